package dev.wsrpc.transport;

import java.lang.reflect.Type;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

/**
 * Resolves inbound request envelopes against a {@link MethodTable}, converts the arguments, calls
 * the handler and builds the reply. Never throws; every failure is returned in the
 * {@link DispatchOutcome}.
 */
public final class MethodDispatcher<H> {

    private static final Logger LOGGER = LoggerFactory.getLogger(MethodDispatcher.class);

    private final MethodTable<H> methods;
    private final MessageFormatter formatter;
    private final Duration invocationTimeout;

    public MethodDispatcher(MethodTable<H> methods, MessageFormatter formatter, Duration invocationTimeout) {
        this.methods = Objects.requireNonNull(methods, "methods");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.invocationTimeout = Objects.requireNonNull(invocationTimeout, "invocationTimeout");
    }

    public DispatchOutcome dispatch(H handler, String connectionId, InvocationEnvelope request) {
        if (request.isResponse()) {
            LOGGER.debug("Ignoring response envelope for {} on connection {}", request.method(), connectionId);
            return DispatchOutcome.none();
        }

        Optional<MethodBinding<H>> resolved = methods.find(request.method());
        if (resolved.isEmpty()) {
            return DispatchOutcome.failed(new InvocationException(connectionId,
                "Failed to resolve method " + request.method(), new MethodNotFoundException(request.method())), null);
        }

        MethodBinding<H> binding = resolved.get();
        try {
            Object[] arguments = bindArguments(binding, request);
            Object result = await(binding.invoker().invoke(handler, arguments));
            if (!binding.returnsValue()) {
                return DispatchOutcome.none();
            }
            return DispatchOutcome.replied(InvocationEnvelope.response(request.method(), result));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(binding, connectionId, request, e);
        } catch (Exception e) {
            return failed(binding, connectionId, request, e);
        }
    }

    private Object[] bindArguments(MethodBinding<H> binding, InvocationEnvelope request)
            throws ArgumentMismatchException {
        List<Object> supplied = request.arguments();
        if (supplied.size() != binding.arity()) {
            throw new ArgumentMismatchException(request.method(), "Method " + binding.name() + " expects "
                + binding.arity() + " argument(s) but received " + supplied.size());
        }

        Object[] arguments = new Object[supplied.size()];
        for (int i = 0; i < arguments.length; i++) {
            Type parameterType = binding.parameterTypes().get(i);
            ArgumentConversion conversion = formatter.convertArgument(supplied.get(i), parameterType);
            if (!conversion.isSuccess()) {
                throw new ArgumentMismatchException(request.method(), "Argument " + i + " of " + binding.name()
                    + " cannot be converted to " + parameterType.getTypeName(), conversion.failure());
            }
            arguments[i] = conversion.value();
        }
        return arguments;
    }

    private Object await(Object result) throws Exception {
        if (result instanceof CompletionStage<?> stage) {
            try {
                return stage.toCompletableFuture().get(invocationTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException | CompletionException e) {
                throw unwrap(e.getCause(), e);
            } catch (TimeoutException e) {
                throw new TimeoutException("Invocation did not complete within " + invocationTimeout);
            }
        }
        if (result instanceof Publisher<?> publisher) {
            try {
                return Mono.from(publisher).block(invocationTimeout);
            } catch (IllegalStateException e) {
                // Mono.block signals an elapsed timeout this way
                if (e.getMessage() != null && e.getMessage().startsWith("Timeout on blocking read")) {
                    throw new TimeoutException("Invocation did not complete within " + invocationTimeout);
                }
                throw unwrap(Exceptions.unwrap(e), e);
            } catch (RuntimeException e) {
                throw unwrap(Exceptions.unwrap(e), e);
            }
        }
        return result;
    }

    private static Exception unwrap(Throwable cause, Exception wrapper) {
        if (cause instanceof Exception exception) {
            return exception;
        }
        return wrapper;
    }

    private DispatchOutcome failed(MethodBinding<H> binding, String connectionId, InvocationEnvelope request,
            Exception cause) {
        InvocationException failure = new InvocationException(connectionId,
            "Failed to invoke method " + binding.name(), cause);
        InvocationEnvelope fallback = binding.returnsValue()
            ? InvocationEnvelope.response(request.method(), binding.defaultReturnValue())
            : null;
        return DispatchOutcome.failed(failure, fallback);
    }
}
