package com.bosdb.debugger.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON encoding of protocol messages.
 */
public final class MessageCodec {

    private final ObjectMapper mapper;

    public MessageCodec() {
        this(createMapper());
    }

    public MessageCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Mapper with the settings every debugger JSON surface uses: ISO-8601 timestamps,
     * null fields omitted, unknown properties ignored.
     */
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public ClientMessage decode(String json) throws JsonProcessingException {
        return mapper.readValue(json, ClientMessage.class);
    }

    public String encode(ServerMessage message) throws JsonProcessingException {
        return mapper.writerFor(ServerMessage.class).writeValueAsString(message);
    }
}
