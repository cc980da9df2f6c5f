package com.bosdb.debugger.protocol;

import com.bosdb.debugger.execution.QueryResult;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Messages pushed to a debugger client. Tagged on the wire by {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ServerMessage.SessionCreated.class, name = "sessionCreated"),
    @JsonSubTypes.Type(value = ServerMessage.Stopped.class, name = "stopped"),
    @JsonSubTypes.Type(value = ServerMessage.Continued.class, name = "continued"),
    @JsonSubTypes.Type(value = ServerMessage.BreakpointHit.class, name = "breakpointHit"),
    @JsonSubTypes.Type(value = ServerMessage.StateChanged.class, name = "stateChanged"),
    @JsonSubTypes.Type(value = ServerMessage.Output.class, name = "output"),
    @JsonSubTypes.Type(value = ServerMessage.ErrorMessage.class, name = "error"),
    @JsonSubTypes.Type(value = ServerMessage.QueryResultMessage.class, name = "queryResult"),
    @JsonSubTypes.Type(value = ServerMessage.Variables.class, name = "variables"),
    @JsonSubTypes.Type(value = ServerMessage.StackTrace.class, name = "stackTrace")
})
public sealed interface ServerMessage {

    record SessionCreated(String sessionId) implements ServerMessage {}

    /**
     * @param reason breakpoint, step, pause, exception or error
     */
    record Stopped(String sessionId, String reason, ExecutionPointView executionPoint,
                   BreakpointView breakpoint) implements ServerMessage {}

    record Continued(String sessionId) implements ServerMessage {}

    record BreakpointHit(String sessionId, BreakpointView breakpoint,
                         ExecutionPointView executionPoint) implements ServerMessage {}

    record StateChanged(String sessionId, SessionStateView state) implements ServerMessage {}

    /**
     * @param category stdout, stderr or log
     */
    record Output(String sessionId, String category, String output) implements ServerMessage {
        public static Output log(String sessionId, String output) {
            return new Output(sessionId, "log", output);
        }

        public static Output stderr(String sessionId, String output) {
            return new Output(sessionId, "stderr", output);
        }
    }

    record ErrorMessage(String code, String message, String details) implements ServerMessage {}

    record QueryResultMessage(String sessionId, String queryId, QueryResult result) implements ServerMessage {}

    record Variables(String sessionId, String scope, List<VariableView> variables) implements ServerMessage {}

    record StackTrace(String sessionId, List<StackFrameView> frames) implements ServerMessage {}
}
