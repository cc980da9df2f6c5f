package com.bosdb.debugger.runtime;

import com.bosdb.debugger.DebugEngine;
import com.bosdb.debugger.ExecutionCancelledException;
import com.bosdb.debugger.QuotaExceededException;
import com.bosdb.debugger.SessionNotFoundException;
import com.bosdb.debugger.breakpoint.Breakpoint;
import com.bosdb.debugger.execution.ExecutionPoint;
import com.bosdb.debugger.execution.QueryResult;
import com.bosdb.debugger.protocol.BreakpointRequest;
import com.bosdb.debugger.protocol.BreakpointView;
import com.bosdb.debugger.protocol.ExecutionPointView;
import com.bosdb.debugger.protocol.MessageCodec;
import com.bosdb.debugger.protocol.SessionConfigRequest;
import com.bosdb.debugger.session.DebugSession;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * REST API over a {@link DebugEngine}.
 * <p>
 * The caller is identified by the {@code X-User-Id} header, which an upstream
 * gateway is trusted to set. Sessions of other users answer 403.
 */
public class DebugHttpServer {

    private static final Logger log = LoggerFactory.getLogger(DebugHttpServer.class);

    static final String USER_HEADER = "X-User-Id";

    private final DebugEngine engine;
    private final int port;
    private final int threads;
    private final ObjectMapper mapper;
    private HttpServer server;
    private ExecutorService executor;

    public DebugHttpServer(DebugEngine engine, int port) {
        this(engine, port, 16);
    }

    /**
     * @param threads request threads; {@code execute} requests run on the engine's query
     *                threads, so a paused query does not hold one
     */
    public DebugHttpServer(DebugEngine engine, int port, int threads) {
        this.engine = engine;
        this.port = port;
        this.threads = threads;
        this.mapper = MessageCodec.createMapper();
    }

    /**
     * Start the server. Port 0 binds an ephemeral port.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/sessions", new SessionsHandler());

        executor = Executors.newFixedThreadPool(threads);
        server.setExecutor(executor);
        server.start();

        log.info("[HTTP] Server started on http://localhost:{}", getPort());
    }

    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            executor.shutdownNow();
            server = null;
            log.info("[HTTP] Server stopped");
        }
    }

    /**
     * Thrown by route handlers to answer with an error status.
     */
    static class HttpError extends RuntimeException {
        final int status;

        HttpError(int status, String message) {
            super(message);
            this.status = status;
        }
    }

    /**
     * Routes everything under /sessions.
     */
    class SessionsHandler implements HttpHandler {

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                String userId = exchange.getRequestHeaders().getFirst(USER_HEADER);
                if (userId == null || userId.isBlank()) {
                    throw new HttpError(401, "Unauthorized");
                }
                Object body = route(exchange, userId.trim());
                if (body instanceof CompletableFuture<?> pending) {
                    // Answered from the engine's query thread; a paused query holds no request thread
                    pending.whenComplete((result, error) -> {
                        try {
                            if (error != null) {
                                sendError(exchange, error instanceof CompletionException && error.getCause() != null
                                    ? error.getCause() : error);
                            } else {
                                sendJson(exchange, 200, result);
                            }
                        } catch (IOException e) {
                            log.warn("[HTTP] {} {} response failed: {}", exchange.getRequestMethod(),
                                exchange.getRequestURI(), e.getMessage());
                        }
                    });
                    return;
                }
                sendJson(exchange, 200, body);
            } catch (Exception e) {
                sendError(exchange, e);
            }
        }

        private void sendError(HttpExchange exchange, Throwable e) throws IOException {
            if (e instanceof HttpError he) {
                sendJson(exchange, he.status, Map.of("error", he.getMessage()));
            } else if (e instanceof QuotaExceededException) {
                sendJson(exchange, 429, Map.of("error", e.getMessage()));
            } else if (e instanceof SessionNotFoundException) {
                sendJson(exchange, 404, Map.of("error", "Session not found"));
            } else if (e instanceof JsonProcessingException jpe) {
                sendJson(exchange, 400, Map.of("error", "Invalid JSON: " + jpe.getOriginalMessage()));
            } else if (e instanceof IllegalArgumentException) {
                sendJson(exchange, 400, Map.of("error", String.valueOf(e.getMessage())));
            } else {
                if (!(e instanceof ExecutionCancelledException)) {
                    log.error("[HTTP] {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
                }
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                sendJson(exchange, 500, Map.of("error", message));
            }
        }

        private Object route(HttpExchange exchange, String userId) throws IOException {
            String method = exchange.getRequestMethod();
            List<String> parts = pathSegments(exchange.getRequestURI().getPath());
            if (parts.isEmpty() || !parts.get(0).equals("sessions")) {
                throw new HttpError(404, "Not found: " + exchange.getRequestURI().getPath());
            }

            if (parts.size() == 1) {
                if (method.equals("POST")) {
                    return createSession(exchange, userId);
                }
                if (method.equals("GET")) {
                    List<SessionView> sessions = engine.getUserSessions(userId).stream()
                        .map(SessionView::from)
                        .toList();
                    return Map.of("sessions", sessions);
                }
                throw methodNotAllowed(method);
            }

            String sessionId = parts.get(1);
            DebugSession session = ownedSession(sessionId, userId);

            if (parts.size() == 2) {
                if (method.equals("GET")) {
                    return Map.of("session", SessionView.from(session));
                }
                if (method.equals("DELETE")) {
                    engine.deleteSession(sessionId);
                    return Map.of("success", true);
                }
                throw methodNotAllowed(method);
            }

            String resource = parts.get(2);
            if (resource.equals("breakpoints") && parts.size() == 3) {
                if (method.equals("GET")) {
                    List<BreakpointView> breakpoints = engine.getBreakpoints(sessionId).stream()
                        .map(BreakpointView::from)
                        .toList();
                    return Map.of("breakpoints", breakpoints);
                }
                if (method.equals("POST")) {
                    return setBreakpoint(exchange, sessionId);
                }
                throw methodNotAllowed(method);
            }

            if (!method.equals("POST")) {
                throw methodNotAllowed(method);
            }
            if (resource.equals("execute") && parts.size() == 3) {
                return execute(exchange, sessionId);
            }
            if (resource.equals("control") && parts.size() == 4) {
                return control(sessionId, parts.get(3));
            }
            if (resource.equals("step") && parts.size() == 3) {
                return control(sessionId, "step");
            }
            if (resource.equals("continue") && parts.size() == 3) {
                return control(sessionId, "resume");
            }
            throw new HttpError(404, "Not found: " + exchange.getRequestURI().getPath());
        }

        private Object createSession(HttpExchange exchange, String userId) throws IOException {
            JsonNode body = readBody(exchange);
            String connectionId = body.path("connectionId").asText(null);
            if (connectionId == null || connectionId.isBlank()) {
                throw new HttpError(400, "connectionId is required");
            }
            SessionConfigRequest config = body.hasNonNull("config")
                ? mapper.treeToValue(body.get("config"), SessionConfigRequest.class)
                : null;

            DebugSession session = engine.createSession(userId, connectionId,
                config != null ? config.toOverrides() : null);

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("sessionId", session.getId());
            response.put("createdAt", session.getCreatedAt());
            response.put("config", session.getConfig());
            return response;
        }

        private Object setBreakpoint(HttpExchange exchange, String sessionId) throws IOException {
            JsonNode body = readBody(exchange);
            String type = body.path("type").asText(null);
            if (type == null || type.isBlank()) {
                throw new HttpError(400, "Breakpoint type is required");
            }
            // Target fields may come nested under "config" or at the top level
            ObjectNode merged = mapper.createObjectNode();
            body.fields().forEachRemaining(e -> {
                if (!e.getKey().equals("config")) {
                    merged.set(e.getKey(), e.getValue());
                }
            });
            if (body.path("config").isObject()) {
                merged.setAll((ObjectNode) body.get("config"));
            }
            merged.put("type", type);

            BreakpointRequest request = mapper.treeToValue(merged, BreakpointRequest.class);
            Breakpoint bp = engine.setBreakpoint(sessionId, request.toSpec());
            return Map.of("breakpoint", BreakpointView.from(bp));
        }

        private CompletableFuture<QueryResult> execute(HttpExchange exchange, String sessionId) throws IOException {
            JsonNode body = readBody(exchange);
            String query = body.path("query").asText(null);
            if (query == null || query.isBlank()) {
                throw new HttpError(400, "query is required");
            }
            List<Object> parameters = new ArrayList<>();
            if (body.path("parameters").isArray()) {
                for (JsonNode p : body.get("parameters")) {
                    parameters.add(mapper.treeToValue(p, Object.class));
                }
            }
            return engine.executeQueryAsync(sessionId, query, parameters);
        }

        private Object control(String sessionId, String action) {
            Map<String, Object> response = new LinkedHashMap<>();
            switch (action) {
                case "resume" -> engine.resume(sessionId);
                case "pause" -> response.put("paused", engine.pause(sessionId));
                case "step" -> engine.stepOver(sessionId);
                case "stepInto" -> engine.stepInto(sessionId);
                case "stepOut" -> engine.stepOut(sessionId);
                case "rewind" -> {
                    ExecutionPoint removed = engine.rewind(sessionId);
                    if (removed != null) {
                        response.put("rewound", ExecutionPointView.from(removed));
                    }
                }
                default -> throw new HttpError(400, "Unknown action: " + action);
            }
            response.put("success", true);
            response.put("status", engine.getSession(sessionId).getState().status().wireName());
            return response;
        }

        private DebugSession ownedSession(String sessionId, String userId) {
            DebugSession session = engine.getSession(sessionId);
            if (session == null) {
                throw new SessionNotFoundException(sessionId);
            }
            if (!session.getUserId().equals(userId)) {
                throw new HttpError(403, "Forbidden");
            }
            return session;
        }

        private JsonNode readBody(HttpExchange exchange) throws IOException {
            try (InputStream is = exchange.getRequestBody()) {
                byte[] data = is.readAllBytes();
                if (data.length == 0) {
                    return mapper.createObjectNode();
                }
                JsonNode node = mapper.readTree(data);
                if (node == null || !node.isObject()) {
                    throw new HttpError(400, "Request body must be a JSON object");
                }
                return node;
            }
        }

        private HttpError methodNotAllowed(String method) {
            return new HttpError(405, "Method not allowed: " + method);
        }

        private void sendJson(HttpExchange exchange, int status, Object body) throws IOException {
            byte[] bytes = mapper.writeValueAsString(body).getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
            exchange.sendResponseHeaders(status, bytes.length);
            exchange.getResponseBody().write(bytes);
            exchange.close();
        }
    }

    static List<String> pathSegments(String path) {
        return Arrays.stream(path.split("/"))
            .filter(s -> !s.isEmpty())
            .toList();
    }
}
