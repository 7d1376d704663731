package dev.wsrpc.transport;

import java.util.Optional;

/**
 * What the dispatcher produced for one request: an optional reply to write back and an optional
 * failure to report. Both may be present when a failed value-returning call is answered with the
 * return type's default value.
 */
public record DispatchOutcome(InvocationEnvelope reply, InvocationException failure) {

    private static final DispatchOutcome NONE = new DispatchOutcome(null, null);

    public static DispatchOutcome none() {
        return NONE;
    }

    public static DispatchOutcome replied(InvocationEnvelope reply) {
        return new DispatchOutcome(reply, null);
    }

    public static DispatchOutcome failed(InvocationException failure, InvocationEnvelope fallbackReply) {
        return new DispatchOutcome(fallbackReply, failure);
    }

    public Optional<InvocationEnvelope> replyEnvelope() {
        return Optional.ofNullable(reply);
    }

    public Optional<InvocationException> failureCause() {
        return Optional.ofNullable(failure);
    }

    public boolean isFailure() {
        return failure != null;
    }
}
