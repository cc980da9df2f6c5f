package com.bosdb.debugger.protocol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Messages sent by a debugger client. Tagged on the wire by {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ClientMessage.CreateSession.class, name = "createSession"),
    @JsonSubTypes.Type(value = ClientMessage.Attach.class, name = "attach"),
    @JsonSubTypes.Type(value = ClientMessage.Detach.class, name = "detach"),
    @JsonSubTypes.Type(value = ClientMessage.Continue.class, name = "continue"),
    @JsonSubTypes.Type(value = ClientMessage.Pause.class, name = "pause"),
    @JsonSubTypes.Type(value = ClientMessage.StepOver.class, name = "stepOver"),
    @JsonSubTypes.Type(value = ClientMessage.StepInto.class, name = "stepInto"),
    @JsonSubTypes.Type(value = ClientMessage.StepOut.class, name = "stepOut"),
    @JsonSubTypes.Type(value = ClientMessage.SetBreakpoint.class, name = "setBreakpoint"),
    @JsonSubTypes.Type(value = ClientMessage.RemoveBreakpoint.class, name = "removeBreakpoint"),
    @JsonSubTypes.Type(value = ClientMessage.Evaluate.class, name = "evaluate"),
    @JsonSubTypes.Type(value = ClientMessage.GetVariables.class, name = "getVariables"),
    @JsonSubTypes.Type(value = ClientMessage.GetStackTrace.class, name = "getStackTrace"),
    @JsonSubTypes.Type(value = ClientMessage.ExecuteQuery.class, name = "executeQuery")
})
public sealed interface ClientMessage {

    record CreateSession(String userId, String connectionId, SessionConfigRequest config) implements ClientMessage {}

    record Attach(String sessionId) implements ClientMessage {}

    record Detach(String sessionId) implements ClientMessage {}

    record Continue(String sessionId) implements ClientMessage {}

    record Pause(String sessionId) implements ClientMessage {}

    record StepOver(String sessionId) implements ClientMessage {}

    record StepInto(String sessionId) implements ClientMessage {}

    record StepOut(String sessionId) implements ClientMessage {}

    record SetBreakpoint(String sessionId, BreakpointRequest breakpoint) implements ClientMessage {}

    record RemoveBreakpoint(String breakpointId) implements ClientMessage {}

    record Evaluate(String sessionId, String expression, String frameId) implements ClientMessage {}

    record GetVariables(String sessionId, String scope) implements ClientMessage {}

    record GetStackTrace(String sessionId) implements ClientMessage {}

    record ExecuteQuery(String sessionId, String query, List<Object> parameters) implements ClientMessage {}
}
