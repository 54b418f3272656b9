package com.jobkeeper.core;

import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * Serves {@link Metrics} in Prometheus text format on {@code /metrics}.
 */
public final class MetricsServer {
    private static final Logger log = LoggerFactory.getLogger(MetricsServer.class);
    private static HttpServer server;

    private MetricsServer() {}

    /** Starts the server when {@code METRICS_PORT} is configured. */
    public static void init() {
        String portStr = JobKeeperConfig.get(JobKeeperConfig.METRICS_PORT, null);
        if (portStr == null || portStr.isBlank()) {
            return;
        }
        try {
            start(Integer.parseInt(portStr.trim()));
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid {}: {}", JobKeeperConfig.METRICS_PORT, portStr);
        }
    }

    public static synchronized void start(int port) {
        if (server != null) {
            return;
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/metrics", exchange -> {
                byte[] body = render(Metrics.getInstance()).getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().add("Content-Type", "text/plain; version=0.0.4");
                exchange.sendResponseHeaders(200, body.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(body);
                }
            });
            server.start();
            log.info("Metrics server listening on port {}", getPort());
        } catch (IOException e) {
            server = null;
            log.error("Failed to start metrics server on port {}", port, e);
        }
    }

    public static synchronized void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
    }

    /** Bound port, or -1 if not running. */
    public static synchronized int getPort() {
        return server == null ? -1 : server.getAddress().getPort();
    }

    static String render(Metrics m) {
        StringBuilder sb = new StringBuilder();
        metric(sb, "jobkeeper_job_success_total", "counter", "Number of successful job executions", m.getSuccessCount());
        metric(sb, "jobkeeper_job_failure_total", "counter", "Number of failed job executions", m.getFailureCount());
        metric(sb, "jobkeeper_job_vetoed_total", "counter", "Scheduled firings suppressed while paused", m.getVetoedCount());
        metric(sb, "jobkeeper_job_duration_millis_total", "counter", "Total time spent running jobs in milliseconds",
                m.getTotalDurationMillis());
        metric(sb, "jobkeeper_job_duration_millis_avg", "gauge", "Average job execution time in milliseconds",
                m.getAverageDurationMillis());
        return sb.toString();
    }

    private static void metric(StringBuilder sb, String name, String type, String help, Number value) {
        sb.append("# HELP ").append(name).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(name).append(' ').append(type).append('\n');
        sb.append(name).append(' ').append(value).append('\n');
    }
}
