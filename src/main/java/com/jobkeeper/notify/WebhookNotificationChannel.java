package com.jobkeeper.notify;

import com.jobkeeper.core.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts notifications as a JSON object {@code {title, content, format}}.
 */
public class WebhookNotificationChannel implements NotificationChannel {
    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationChannel.class);

    private final URI url;
    private final Duration timeout;
    private final HttpClient client;

    public WebhookNotificationChannel(String url) {
        this(URI.create(url), Duration.ofSeconds(10));
    }

    public WebhookNotificationChannel(URI url, Duration timeout) {
        this.url = url;
        this.timeout = timeout;
        this.client = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    @Override
    public boolean send(String title, String content, String format) throws IOException, InterruptedException {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("title", title);
        payload.put("content", content);
        payload.put("format", format);
        HttpRequest request = HttpRequest.newBuilder(url)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Json.write(payload)))
                .build();
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new IOException("Webhook " + url + " answered HTTP " + status);
        }
        log.debug("Delivered '{}' to {}", title, url);
        return true;
    }
}
