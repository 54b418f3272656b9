package com.jobkeeper.notify;

import com.jobkeeper.core.Json;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class WebhookNotificationChannelTest {
    private HttpServer server;
    private final AtomicReference<String> received = new AtomicReference<>();

    @BeforeEach
    public void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/hook", exchange -> {
            received.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        });
        server.createContext("/down", exchange -> {
            exchange.sendResponseHeaders(503, -1);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    public void tearDown() {
        server.stop(0);
    }

    private String base() {
        return "http://localhost:" + server.getAddress().getPort();
    }

    @Test
    public void testPostsJsonPayload() throws Exception {
        WebhookNotificationChannel channel = new WebhookNotificationChannel(base() + "/hook");
        assertTrue(channel.send("Job failed: g.a", "Error: \"quoted\"", "txt"));

        Map<String, String> payload = Json.readFlatMap(received.get());
        assertEquals("Job failed: g.a", payload.get("title"));
        assertEquals("Error: \"quoted\"", payload.get("content"));
        assertEquals("txt", payload.get("format"));
    }

    @Test
    public void testErrorStatusThrows() {
        WebhookNotificationChannel channel = new WebhookNotificationChannel(base() + "/down");
        IOException e = assertThrows(IOException.class, () -> channel.send("t", "c", "txt"));
        assertTrue(e.getMessage().contains("503"));
    }
}
