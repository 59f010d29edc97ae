package com.hivemind.core.state;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * Jackson codec for the state document. Also used to take the working copy a
 * mutation runs against.
 */
public class StateMapper {

    private final ObjectMapper objectMapper;

    public StateMapper() {
        this.objectMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .build();
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public byte[] write(HierarchyState state) {
        try {
            return objectMapper.writeValueAsBytes(state);
        } catch (IOException e) {
            throw new StatePersistenceException("Failed to serialize hierarchy state", e);
        }
    }

    public HierarchyState read(byte[] json) {
        try {
            return objectMapper.readValue(json, HierarchyState.class);
        } catch (IOException e) {
            throw new StatePersistenceException("Failed to parse hierarchy state", e);
        }
    }

    public HierarchyState copy(HierarchyState state) {
        HierarchyState copy = read(write(state));
        copy.setVersion(state.getVersion());
        return copy;
    }
}
