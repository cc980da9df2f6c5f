package com.bosdb.debugger.protocol;

import com.bosdb.debugger.breakpoint.Breakpoint;
import com.bosdb.debugger.breakpoint.BreakpointTarget;
import com.bosdb.debugger.execution.ExecutionPoint;
import com.bosdb.debugger.execution.QueryStage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class MessageCodecTest {

    private MessageCodec codec;

    @BeforeEach
    void setUp() {
        codec = new MessageCodec();
    }

    @Test
    void decode_createSessionWithConfig() throws Exception {
        ClientMessage message = codec.decode("{\"type\":\"createSession\",\"userId\":\"alice\","
            + "\"connectionId\":\"c1\",\"config\":{\"maxHistorySize\":10,\"enableTimeTravel\":false}}");

        ClientMessage.CreateSession create = assertInstanceOf(ClientMessage.CreateSession.class, message);
        assertEquals("alice", create.userId());
        assertEquals(10, create.config().maxHistorySize());
        assertEquals(Boolean.FALSE, create.config().enableTimeTravel());
        assertNull(create.config().debugLevel());
    }

    @Test
    void decode_executeQueryParameters() throws Exception {
        ClientMessage message = codec.decode("{\"type\":\"executeQuery\",\"sessionId\":\"s1\","
            + "\"query\":\"SELECT $1\",\"parameters\":[42,\"x\",null],\"extra\":true}");

        ClientMessage.ExecuteQuery query = assertInstanceOf(ClientMessage.ExecuteQuery.class, message);
        assertEquals(3, query.parameters().size());
        assertEquals(42, query.parameters().get(0));
        assertNull(query.parameters().get(2));
    }

    @Test
    void decode_missingTypeFails() {
        assertThrows(JsonProcessingException.class, () -> codec.decode("{\"sessionId\":\"s1\"}"));
    }

    @Test
    void encode_writesTypeAndOmitsNulls() throws Exception {
        ExecutionPoint point = new ExecutionPoint("p1", Instant.parse("2024-03-01T10:15:30Z"), "q1",
            QueryStage.EXECUTE, 2, null, null);
        String json = codec.encode(new ServerMessage.Stopped("s1", "step", ExecutionPointView.from(point), null));

        JsonNode node = codec.mapper().readTree(json);
        assertEquals("stopped", node.get("type").asText());
        assertEquals("step", node.get("reason").asText());
        assertFalse(node.has("breakpoint"));
        assertEquals("execute", node.get("executionPoint").get("stage").asText());
        assertEquals("2024-03-01T10:15:30Z", node.get("executionPoint").get("timestamp").asText());
        assertFalse(node.get("executionPoint").has("procedureId"));
    }

    @Test
    void encode_breakpointPatternAsText() throws Exception {
        Breakpoint bp = new Breakpoint("b1", "s1", BreakpointTarget.query(QueryStage.PLAN, "^UPDATE\\s"),
            false, 3, null, "x > 1", null);
        String json = codec.encode(new ServerMessage.BreakpointHit("s1", BreakpointView.from(bp), null));

        JsonNode view = codec.mapper().readTree(json).get("breakpoint");
        assertEquals("query", view.get("type").asText());
        assertFalse(view.get("enabled").asBoolean());
        assertEquals(3, view.get("hitCount").asInt());
        assertEquals("x > 1", view.get("condition").asText());
        assertEquals("plan", view.get("target").get("stage").asText());
        assertEquals("^UPDATE\\s", view.get("target").get("queryPattern").asText());
    }

    @Test
    void encode_errorMessage() throws Exception {
        String json = codec.encode(new ServerMessage.ErrorMessage("PARSE_ERROR", "Invalid message format", null));

        JsonNode node = codec.mapper().readTree(json);
        assertEquals("error", node.get("type").asText());
        assertEquals("PARSE_ERROR", node.get("code").asText());
        assertFalse(node.has("details"));
    }
}
