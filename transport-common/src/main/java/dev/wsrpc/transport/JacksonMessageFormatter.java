package dev.wsrpc.transport;

import java.lang.reflect.Type;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * JSON formatter backed by a Jackson {@link ObjectMapper}. Property names are matched
 * case-insensitively so that {@code Method}/{@code IsReturn}/{@code Arguments} resolve as well.
 */
public class JacksonMessageFormatter implements MessageFormatter {

    private final ObjectMapper mapper;

    public JacksonMessageFormatter() {
        this(JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build());
    }

    /**
     * Uses the supplied mapper as-is; callers wanting case-insensitive envelopes must enable
     * {@link MapperFeature#ACCEPT_CASE_INSENSITIVE_PROPERTIES} themselves.
     */
    public JacksonMessageFormatter(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public String formatMessage(InvocationEnvelope envelope) throws MessageFormatException {
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new MessageFormatException("Failed to format message " + envelope.method(), null, e);
        }
    }

    @Override
    public InvocationEnvelope resolveMessage(String content) throws MessageFormatException {
        if (content == null || content.isBlank()) {
            throw new MessageFormatException("Empty message", content, null);
        }
        try {
            InvocationEnvelope envelope = mapper.readValue(content, InvocationEnvelope.class);
            if (envelope == null) {
                throw new MessageFormatException("Message resolved to null", content, null);
            }
            return envelope;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MessageFormatException("Failed to resolve message", content, e);
        }
    }

    @Override
    public ArgumentConversion convertArgument(Object value, Type targetType) {
        JavaType javaType = mapper.getTypeFactory().constructType(targetType);
        if (value == null) {
            if (javaType.isPrimitive()) {
                return ArgumentConversion.failure(targetType,
                    new IllegalArgumentException("null cannot be assigned to " + javaType.getRawClass().getName()));
            }
            return ArgumentConversion.success(null, targetType);
        }
        if (javaType.getRawClass().isInstance(value) && !javaType.isContainerType()) {
            return ArgumentConversion.success(value, targetType);
        }
        try {
            return ArgumentConversion.success(mapper.convertValue(value, javaType), targetType);
        } catch (IllegalArgumentException e) {
            return ArgumentConversion.failure(targetType, e);
        }
    }

    public ObjectMapper getMapper() {
        return mapper;
    }
}
