package io.optracker.admin;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.optracker.budget.MemoryBudget;
import io.optracker.core.OperationDriver;
import io.optracker.tracker.OperationTracker;
import io.optracker.tracker.TrackedEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Minimal admin server exposing the tracker's pending operations, budget and counters as JSON.
 */
public class AdminServer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AdminServer.class);

    private final HttpServer server;
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final String partitionId;
    private final OperationTracker tracker;
    private final MetricRegistry registry;

    public AdminServer(int port, String partitionId, OperationTracker tracker, MetricRegistry registry) throws IOException {
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.partitionId = partitionId;
        this.tracker = tracker;
        this.registry = registry;
        server.createContext("/", new StaticHandler("/public/index.html"));
        server.createContext("/status", new StatusHandler());
        server.createContext("/operations", new OperationsHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.setExecutor(executor);
    }

    public void start() {
        server.start();
        logger.info("Admin server listening on port {}", port());
    }

    public int port() { return server.getAddress().getPort(); }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    private static void sendJson(HttpExchange exchange, String json) throws IOException {
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) { os.write(bytes); }
    }

    static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) sb.append(String.format("\\u%04x", (int) c));
                    else sb.append(c);
                }
            }
        }
        return sb.append('"').toString();
    }

    private static class StaticHandler implements HttpHandler {
        private final String resourcePath;
        StaticHandler(String resourcePath) { this.resourcePath = resourcePath; }
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            Headers h = exchange.getResponseHeaders();
            h.add("Content-Type", "text/html; charset=utf-8");
            try (InputStream in = AdminServer.class.getResourceAsStream(resourcePath)) {
                if (in == null) {
                    byte[] notFound = "No admin page".getBytes(StandardCharsets.UTF_8);
                    exchange.sendResponseHeaders(404, notFound.length);
                    try (OutputStream os = exchange.getResponseBody()) { os.write(notFound); }
                    return;
                }
                byte[] bytes = in.readAllBytes();
                exchange.sendResponseHeaders(200, bytes.length);
                try (OutputStream os = exchange.getResponseBody()) { os.write(bytes); }
            }
        }
    }

    private class StatusHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            Optional<MemoryBudget> budget = tracker.memoryBudget();
            String json = "{" +
                    "\"partition\":" + quote(partitionId) + "," +
                    "\"pending\":" + tracker.getNumPending() + "," +
                    "\"memoryTracking\":" + budget.isPresent() + "," +
                    "\"consumption\":" + budget.map(MemoryBudget::consumption).orElse(0L) + "," +
                    "\"limit\":" + budget.map(MemoryBudget::limit).orElse(-1L) +
                    "}";
            sendJson(exchange, json);
        }
    }

    private class OperationsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            List<TrackedEntry> operations = tracker.getTrackedEntries();
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < operations.size(); i++) {
                TrackedEntry e = operations.get(i);
                OperationDriver d = e.driver();
                sb.append('{')
                        .append("\"id\":").append(d.id()).append(',')
                        .append("\"type\":").append(quote(d.operationType().displayName())).append(',')
                        .append("\"footprint\":").append(e.memoryFootprint()).append(',')
                        .append("\"description\":").append(quote(d.describe()))
                        .append('}');
                if (i < operations.size() - 1) sb.append(',');
            }
            sb.append(']');
            sendJson(exchange, sb.toString());
        }
    }

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            StringBuilder sb = new StringBuilder("{");
            boolean first = true;
            for (Map.Entry<String, Counter> e : registry.getCounters().entrySet()) {
                if (!first) sb.append(',');
                first = false;
                sb.append(quote(e.getKey())).append(':').append(e.getValue().getCount());
            }
            sb.append('}');
            sendJson(exchange, sb.toString());
        }
    }
}
