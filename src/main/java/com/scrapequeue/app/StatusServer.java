package com.scrapequeue.app;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import com.scrapequeue.core.JobNotFoundException;
import com.scrapequeue.core.JobStatus;
import com.scrapequeue.engine.TaskScheduler;
import com.scrapequeue.registry.JobSnapshot;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

/**
 * HTTP server exposing scheduler status and job management as JSON.
 *
 * <ul>
 *   <li>{@code GET /status}: live {@link com.scrapequeue.engine.SchedulerStatus} plus uptime</li>
 *   <li>{@code GET /jobs[?status=running]}: job list, optionally filtered</li>
 *   <li>{@code GET /jobs/{id}}: one job with its results and summary; 404 if unknown</li>
 *   <li>{@code POST /jobs/{id}/cancel}: cancel a job; 404 if unknown</li>
 * </ul>
 * Any other method on these paths answers 405.
 */
public class StatusServer {
    private static final Logger logger = Logger.getLogger(StatusServer.class.getName());

    private final TaskScheduler scheduler;
    private final int port;
    private final long startTime;
    private final Gson gson;
    private HttpServer server;
    private ExecutorService executor;
    private boolean stopped;

    /**
     * @param scheduler the scheduler to report on
     * @param port port to listen on, 0 for any free port
     */
    public StatusServer(TaskScheduler scheduler, int port) {
        this.scheduler = scheduler;
        this.port = port;
        this.startTime = System.currentTimeMillis();
        this.gson = new GsonBuilder()
                .registerTypeAdapter(Instant.class,
                        (JsonSerializer<Instant>) (src, type, context) -> new JsonPrimitive(src.toString()))
                .registerTypeAdapter(JobStatus.class,
                        (JsonSerializer<JobStatus>) (src, type, context) -> new JsonPrimitive(src.getDisplayName()))
                .serializeNulls()
                .create();
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/status", new StatusHandler());
        server.createContext("/jobs", new JobsHandler());

        executor = Executors.newFixedThreadPool(4);
        server.setExecutor(executor);
        server.start();

        logger.info("Status server started on port " + getPort());
    }

    public synchronized void stop() {
        if (server != null && !stopped) {
            stopped = true;
            server.stop(1);
            executor.shutdown();
            logger.info("Status server stopped");
        }
    }

    /**
     * @return the bound port, which differs from the requested one when that was 0
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private class StatusHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            try {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("status", scheduler.getStatus());
                body.put("throttle", scheduler.getThrottleState());
                body.put("uptimeSeconds", (System.currentTimeMillis() - startTime) / 1000);
                sendJson(exchange, 200, gson.toJson(body));
            } catch (Exception e) {
                logger.log(Level.SEVERE, "Unexpected error serving /status", e);
                sendError(exchange, 500, "Internal Server Error");
            }
        }
    }

    // /jobs, /jobs/{id}, /jobs/{id}/cancel
    private class JobsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getRequestURI().getPath();
            String[] parts = path.replaceAll("^/+|/+$", "").split("/");

            try {
                if (parts.length == 1) {
                    if (!"GET".equalsIgnoreCase(method)) {
                        sendError(exchange, 405, "Method Not Allowed");
                        return;
                    }
                    listJobs(exchange);
                } else if (parts.length == 2) {
                    if (!"GET".equalsIgnoreCase(method)) {
                        sendError(exchange, 405, "Method Not Allowed");
                        return;
                    }
                    sendJson(exchange, 200, gson.toJson(scheduler.getJob(parts[1])));
                } else if (parts.length == 3 && "cancel".equals(parts[2])) {
                    if (!"POST".equalsIgnoreCase(method)) {
                        sendError(exchange, 405, "Method Not Allowed");
                        return;
                    }
                    boolean cancelled = scheduler.cancelJob(parts[1]);
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("jobId", parts[1]);
                    body.put("cancelled", cancelled);
                    body.put("status", scheduler.getJob(parts[1]).getStatus());
                    sendJson(exchange, 200, gson.toJson(body));
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (JobNotFoundException e) {
                sendError(exchange, 404, "Job not found: " + e.getJobId());
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, e.getMessage());
            } catch (Exception e) {
                logger.log(Level.SEVERE, "Unexpected error serving " + path, e);
                sendError(exchange, 500, "Internal Server Error");
            }
        }

        private void listJobs(HttpExchange exchange) throws IOException {
            String filter = queryParameter(exchange.getRequestURI().getRawQuery(), "status");
            JobStatus status = filter == null ? null : JobStatus.fromString(filter);
            List<JobSnapshot> jobs = scheduler.listJobs(status);

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("count", jobs.size());
            body.put("jobs", jobs);
            sendJson(exchange, 200, gson.toJson(body));
        }
    }

    static String queryParameter(String rawQuery, String name) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return null;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            if (name.equals(URLDecoder.decode(key, StandardCharsets.UTF_8))) {
                return eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    private void sendJson(HttpExchange exchange, int statusCode, String json) throws IOException {
        byte[] response = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(statusCode, response.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(response);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        sendJson(exchange, statusCode, gson.toJson(body));
    }
}
