package dev.wsrpc.transport;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Unit exchanged between peers. A request ({@code isReturn = 0}) carries the positional call
 * arguments; a response ({@code isReturn = 1}) carries a single-element list holding the return
 * value of the method named by {@code method}.
 */
public record InvocationEnvelope(
    @JsonProperty("method") String method,
    @JsonProperty("isReturn") int isReturn,
    @JsonProperty("arguments") List<Object> arguments
) {

    public static final int REQUEST = 0;
    public static final int RESPONSE = 1;

    @JsonCreator
    public InvocationEnvelope {
        Objects.requireNonNull(method, "method");
        if (isReturn != REQUEST && isReturn != RESPONSE) {
            throw new IllegalArgumentException("isReturn must be 0 or 1 but was " + isReturn);
        }
        // null elements are legal arguments, so List.copyOf is not an option here
        arguments = arguments == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public static InvocationEnvelope request(String method, Object... arguments) {
        return new InvocationEnvelope(method, REQUEST, arguments == null ? null : Arrays.asList(arguments));
    }

    public static InvocationEnvelope response(String method, Object result) {
        return new InvocationEnvelope(method, RESPONSE, Collections.singletonList(result));
    }

    @JsonIgnore
    public boolean isResponse() {
        return isReturn == RESPONSE;
    }

    /**
     * Single value carried by a response envelope.
     */
    @JsonIgnore
    public Object result() {
        if (!isResponse()) {
            throw new IllegalStateException("Envelope for " + method + " is a request");
        }
        return arguments.isEmpty() ? null : arguments.get(0);
    }
}
