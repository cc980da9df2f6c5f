package com.bosdb.debugger.protocol;

import com.bosdb.debugger.DebugEngine;
import com.bosdb.debugger.QuotaExceededException;
import com.bosdb.debugger.SessionNotFoundException;
import com.bosdb.debugger.breakpoint.Breakpoint;
import com.bosdb.debugger.eval.ExpressionEvaluator;
import com.bosdb.debugger.event.DebugEvent;
import com.bosdb.debugger.event.DebugEventListener;
import com.bosdb.debugger.execution.QueryExecution;
import com.bosdb.debugger.inspect.StateInspector;
import com.bosdb.debugger.session.DebugSession;
import com.bosdb.debugger.session.SessionConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes client messages to a {@link DebugEngine} and engine events back to clients.
 * <p>
 * Each session is attached to at most one client. Engine events for a session go only
 * to that client; events of unattached sessions are dropped. The transport calls
 * {@link #connect}, {@link #onMessage} and {@link #disconnect}.
 */
public class ProtocolServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProtocolServer.class);

    public enum ErrorCode {
        PARSE_ERROR,
        UNKNOWN_MESSAGE,
        SESSION_NOT_FOUND,
        QUOTA_EXCEEDED,
        HANDLER_ERROR
    }

    private final DebugEngine engine;
    private final MessageCodec codec;
    private final DebugEventListener engineListener = this::onEngineEvent;

    private final Map<String, ClientConnection> clients = new ConcurrentHashMap<>();
    private final Map<String, String> sessionToClient = new ConcurrentHashMap<>();

    public ProtocolServer(DebugEngine engine) {
        this(engine, new MessageCodec());
    }

    public ProtocolServer(DebugEngine engine, MessageCodec codec) {
        this.engine = engine;
        this.codec = codec;
        engine.addListener(engineListener);
    }

    // ==================== Connections ====================

    /**
     * Register a newly connected client.
     * @return the id the transport passes to {@link #onMessage} and {@link #disconnect}
     */
    public String connect(ClientConnection connection) {
        String clientId = "client_" + UUID.randomUUID();
        clients.put(clientId, connection);
        log.info("[Protocol] Client connected: {}", clientId);
        return clientId;
    }

    /**
     * Forget a client and every session attached to it.
     */
    public void disconnect(String clientId) {
        if (clients.remove(clientId) == null) {
            return;
        }
        sessionToClient.values().removeIf(clientId::equals);
        log.info("[Protocol] Client disconnected: {}", clientId);
    }

    public int getClientCount() {
        return clients.size();
    }

    /**
     * @return the client attached to a session, or null
     */
    public String getAttachedClient(String sessionId) {
        return sessionToClient.get(sessionId);
    }

    // ==================== Client messages ====================

    /**
     * Handle one text frame from a client. Never throws; failures are reported to
     * the client as {@code error} messages.
     */
    public void onMessage(String clientId, String text) {
        ClientConnection connection = clients.get(clientId);
        if (connection == null) {
            log.warn("[Protocol] Message from unknown client {}", clientId);
            return;
        }

        ClientMessage message;
        try {
            message = codec.decode(text);
        } catch (InvalidTypeIdException e) {
            if (e.getTypeId() != null) {
                sendError(connection, ErrorCode.UNKNOWN_MESSAGE, "Unknown message type: " + e.getTypeId(), null);
            } else {
                sendError(connection, ErrorCode.PARSE_ERROR, "Invalid message format", e.getOriginalMessage());
            }
            return;
        } catch (JsonProcessingException e) {
            sendError(connection, ErrorCode.PARSE_ERROR, "Invalid message format", e.getOriginalMessage());
            return;
        }

        try {
            handle(clientId, connection, message);
        } catch (RuntimeException e) {
            log.debug("[Protocol] {} failed for client {}: {}", message.getClass().getSimpleName(), clientId,
                e.getMessage());
            sendError(connection, errorCodeFor(e), e.getMessage(), null);
        }
    }

    private void handle(String clientId, ClientConnection connection, ClientMessage message) {
        if (message instanceof ClientMessage.CreateSession m) {
            SessionConfig.Overrides overrides = m.config() != null ? m.config().toOverrides() : null;
            DebugSession session = engine.createSession(m.userId(), m.connectionId(), overrides);
            sessionToClient.put(session.getId(), clientId);
            send(connection, new ServerMessage.SessionCreated(session.getId()));

        } else if (message instanceof ClientMessage.Attach m) {
            requireSession(m.sessionId());
            sessionToClient.put(m.sessionId(), clientId);

        } else if (message instanceof ClientMessage.Detach m) {
            sessionToClient.remove(m.sessionId(), clientId);

        } else if (message instanceof ClientMessage.Continue m) {
            engine.resume(m.sessionId());
            if (!clientId.equals(sessionToClient.get(m.sessionId()))) {
                send(connection, new ServerMessage.Continued(m.sessionId()));
            }

        } else if (message instanceof ClientMessage.Pause m) {
            if (!engine.pause(m.sessionId())) {
                send(connection, ServerMessage.Output.log(m.sessionId(), "Nothing is executing"));
            }

        } else if (message instanceof ClientMessage.StepOver m) {
            engine.stepOver(m.sessionId());

        } else if (message instanceof ClientMessage.StepInto m) {
            engine.stepInto(m.sessionId());

        } else if (message instanceof ClientMessage.StepOut m) {
            engine.stepOut(m.sessionId());

        } else if (message instanceof ClientMessage.SetBreakpoint m) {
            if (m.breakpoint() == null) {
                throw new IllegalArgumentException("breakpoint is required");
            }
            Breakpoint bp = engine.setBreakpoint(m.sessionId(), m.breakpoint().toSpec());
            send(connection, ServerMessage.Output.log(m.sessionId(), "Breakpoint set: " + bp.id()));

        } else if (message instanceof ClientMessage.RemoveBreakpoint m) {
            String output = engine.removeBreakpoint(m.breakpointId())
                ? "Breakpoint removed: " + m.breakpointId()
                : "Breakpoint not found: " + m.breakpointId();
            send(connection, ServerMessage.Output.log(null, output));

        } else if (message instanceof ClientMessage.Evaluate m) {
            ExpressionEvaluator.EvalResult result = engine.evaluate(m.sessionId(), m.expression());
            if (result instanceof ExpressionEvaluator.EvalResult.Success s) {
                send(connection, ServerMessage.Output.log(m.sessionId(), s.value().toStr()));
            } else if (result instanceof ExpressionEvaluator.EvalResult.Error err) {
                send(connection, ServerMessage.Output.stderr(m.sessionId(), err.message()));
            }

        } else if (message instanceof ClientMessage.GetVariables m) {
            requireSession(m.sessionId());
            String scope = m.scope() != null ? m.scope() : StateInspector.SESSION_SCOPE;
            List<VariableView> variables = engine.getVariables(m.sessionId(), scope).stream()
                .map(VariableView::from)
                .toList();
            send(connection, new ServerMessage.Variables(m.sessionId(), scope, variables));

        } else if (message instanceof ClientMessage.GetStackTrace m) {
            DebugSession session = requireSession(m.sessionId());
            List<StackFrameView> frames = session.getState().callStack().stream()
                .map(StackFrameView::from)
                .toList();
            send(connection, new ServerMessage.StackTrace(m.sessionId(), frames));

        } else if (message instanceof ClientMessage.ExecuteQuery m) {
            requireSession(m.sessionId());
            List<Object> parameters = m.parameters() != null ? m.parameters() : List.of();
            // Results arrive through QueryCompleted; only failures are answered here
            engine.executeQueryAsync(m.sessionId(), m.query(), parameters).whenComplete((result, error) -> {
                if (error != null) {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                    sendError(connection, errorCodeFor(cause), cause.getMessage(), null);
                }
            });
        }
    }

    private DebugSession requireSession(String sessionId) {
        DebugSession session = engine.getSession(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    static ErrorCode errorCodeFor(Throwable error) {
        if (error instanceof SessionNotFoundException) {
            return ErrorCode.SESSION_NOT_FOUND;
        }
        if (error instanceof QuotaExceededException) {
            return ErrorCode.QUOTA_EXCEEDED;
        }
        return ErrorCode.HANDLER_ERROR;
    }

    // ==================== Engine events ====================

    private void onEngineEvent(DebugEvent event) {
        ServerMessage message = toServerMessage(event);
        if (message != null) {
            broadcastToSession(event.sessionId(), message);
        }
        if (event instanceof DebugEvent.QueryCompleted e) {
            QueryExecution execution = e.execution();
            broadcastToSession(execution.sessionId(),
                new ServerMessage.QueryResultMessage(execution.sessionId(), execution.queryId(), execution.result()));
        }
    }

    static ServerMessage toServerMessage(DebugEvent event) {
        if (event instanceof DebugEvent.Paused e) {
            return new ServerMessage.Stopped(e.sessionId(), e.reason().wireName(),
                ExecutionPointView.from(e.point()), BreakpointView.from(e.breakpoint()));
        }
        if (event instanceof DebugEvent.BreakpointHit e) {
            return new ServerMessage.BreakpointHit(e.sessionId(), BreakpointView.from(e.breakpoint()),
                ExecutionPointView.from(e.context().executionPoint()));
        }
        if (event instanceof DebugEvent.Resumed e) {
            return new ServerMessage.Continued(e.sessionId());
        }
        if (event instanceof DebugEvent.Stepped e) {
            return new ServerMessage.Continued(e.sessionId());
        }
        if (event instanceof DebugEvent.SessionStateChanged e) {
            return new ServerMessage.StateChanged(e.sessionId(), SessionStateView.from(e.state()));
        }
        if (event instanceof DebugEvent.LogPointHit e) {
            return ServerMessage.Output.log(e.sessionId(), e.message());
        }
        if (event instanceof DebugEvent.QueryStarted e) {
            return ServerMessage.Output.log(e.sessionId(), "Query started: " + e.execution().sql());
        }
        if (event instanceof DebugEvent.QueryCompleted e) {
            return ServerMessage.Output.log(e.sessionId(), "Query completed in " + e.execution().duration() + "ms");
        }
        if (event instanceof DebugEvent.QueryFailed e) {
            return ServerMessage.Output.stderr(e.sessionId(), "Query failed: " + e.error().getMessage());
        }
        return null;
    }

    private void broadcastToSession(String sessionId, ServerMessage message) {
        String clientId = sessionToClient.get(sessionId);
        if (clientId == null) {
            return;
        }
        ClientConnection connection = clients.get(clientId);
        if (connection != null) {
            send(connection, message);
        }
    }

    // ==================== Sending ====================

    private void send(ClientConnection connection, ServerMessage message) {
        if (!connection.isOpen()) {
            return;
        }
        try {
            connection.send(codec.encode(message));
        } catch (JsonProcessingException e) {
            log.error("[Protocol] Failed to encode {}", message.getClass().getSimpleName(), e);
        }
    }

    private void sendError(ClientConnection connection, ErrorCode code, String message, String details) {
        send(connection, new ServerMessage.ErrorMessage(code.name(), message, details));
    }

    @Override
    public void close() {
        engine.removeListener(engineListener);
        clients.clear();
        sessionToClient.clear();
    }
}
