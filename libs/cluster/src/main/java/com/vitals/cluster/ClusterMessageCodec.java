package com.vitals.cluster;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * JSON encoding and decoding of {@link ClusterMessage}s.
 * <p>
 * Unknown properties are ignored so that peers may add fields without breaking older ones.
 */
public final class ClusterMessageCodec {

    private final ObjectMapper mapper;

    public ClusterMessageCodec() {
        this(new ObjectMapper());
    }

    public ClusterMessageCodec(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper must not be null");
        }
        this.mapper = mapper.copy().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Serializes a message to its JSON wire form.
     *
     * @throws ClusterCodecException if serialization fails
     */
    public String encode(ClusterMessage message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new ClusterCodecException("Failed to encode cluster message for request " + message.requestId(), e);
        }
    }

    /**
     * Parses a message from its JSON wire form.
     *
     * @throws ClusterCodecException if the JSON is malformed or carries an unknown type
     */
    public ClusterMessage decode(String json) {
        try {
            return mapper.readValue(json, ClusterMessage.class);
        } catch (JsonProcessingException e) {
            throw new ClusterCodecException("Failed to decode cluster message", e);
        }
    }

    /**
     * Safely decodes, returning empty for anything that is not a known cluster message.
     */
    public Optional<ClusterMessage> tryDecode(String json) {
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(decode(json));
        } catch (ClusterCodecException e) {
            return Optional.empty();
        }
    }

    /**
     * Exception thrown when a cluster message cannot be encoded or decoded.
     */
    public static class ClusterCodecException extends RuntimeException {
        public ClusterCodecException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
