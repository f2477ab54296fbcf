package com.warden.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.warden.context.Operation;

import java.io.IOException;

/**
 * JSON rendering of {@link AuditEvent}s.
 * <p>
 * Timestamps are written as ISO-8601 strings, enums by their lower-case value and null fields
 * are left out.
 */
public final class AuditEventSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private AuditEventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        SimpleModule enums = new SimpleModule("warden-audit")
                .addSerializer(Operation.class, new OperationSerializer());
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(enums)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Serializes an event to a single-line JSON string.
     *
     * @throws AuditSerializationException if serialization fails
     */
    public static String toJson(AuditEvent event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException(
                    "Failed to serialize audit event for table " + event.table(), e);
        }
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    private static final class OperationSerializer extends StdSerializer<Operation> {

        private OperationSerializer() {
            super(Operation.class);
        }

        @Override
        public void serialize(Operation value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(value.value());
        }
    }

    /**
     * Thrown when an audit event cannot be rendered as JSON.
     */
    public static class AuditSerializationException extends RuntimeException {

        public AuditSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
