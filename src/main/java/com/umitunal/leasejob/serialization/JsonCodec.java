package com.umitunal.leasejob.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;

/**
 * JSON payload codec using Jackson.
 * Stored payloads stay human readable, so external tooling can inspect
 * the job collection directly.
 *
 * @param <T> the payload type
 */
public class JsonCodec<T> implements PayloadCodec<T> {
    private static final ObjectMapper DEFAULT_MAPPER = createDefaultMapper();

    private final ObjectMapper mapper;
    private final Class<T> type;

    public JsonCodec(Class<T> type) {
        this(type, DEFAULT_MAPPER);
    }

    public JsonCodec(Class<T> type, ObjectMapper mapper) {
        this.type = type;
        this.mapper = mapper;
    }

    @Override
    public byte[] encode(T payload) {
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (IOException e) {
            throw new PayloadCodecException("Failed to write " + type.getSimpleName() + " as JSON", e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        try {
            return mapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new PayloadCodecException("Failed to read " + type.getSimpleName() + " from JSON", e);
        }
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        // payloads written by an older handler version must still decode
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
