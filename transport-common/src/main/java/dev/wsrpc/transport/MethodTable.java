package dev.wsrpc.transport;

import java.lang.reflect.Type;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registration table of the methods a handler type exposes to its clients, keyed by lower-cased
 * name. Built once at startup and shared by all connections of that handler type.
 *
 * <pre>
 * MethodTable&lt;ChatHub&gt; table = MethodTable.builder(ChatHub.class)
 *     .returning("Echo", String.class, (hub, args) -&gt; hub.echo((String) args[0]), String.class)
 *     .action("Notify", (hub, args) -&gt; hub.notify((String) args[0]), String.class)
 *     .build();
 * </pre>
 */
public final class MethodTable<H> {

    private final Class<H> handlerType;
    private final Map<String, MethodBinding<H>> bindings;

    private MethodTable(Class<H> handlerType, Map<String, MethodBinding<H>> bindings) {
        this.handlerType = handlerType;
        this.bindings = Map.copyOf(bindings);
    }

    public static <H> Builder<H> builder(Class<H> handlerType) {
        return new Builder<>(handlerType);
    }

    public Optional<MethodBinding<H>> find(String method) {
        if (method == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(bindings.get(key(method)));
    }

    public Collection<MethodBinding<H>> bindings() {
        return bindings.values();
    }

    public int size() {
        return bindings.size();
    }

    public Class<H> handlerType() {
        return handlerType;
    }

    private static String key(String method) {
        return method.toLowerCase(Locale.ROOT);
    }

    public static final class Builder<H> {

        private final Class<H> handlerType;
        private final Map<String, MethodBinding<H>> bindings = new LinkedHashMap<>();

        private Builder(Class<H> handlerType) {
            this.handlerType = Objects.requireNonNull(handlerType, "handlerType");
        }

        /**
         * Registers a method that replies with a value of {@code returnType}. The invoker may
         * return a {@link java.util.concurrent.CompletionStage} or a {@code Mono} completing with
         * that value.
         */
        public Builder<H> returning(String name, Class<?> returnType, MethodInvoker<H> invoker, Type... parameterTypes) {
            if (returnType == void.class || returnType == Void.class) {
                throw new IllegalArgumentException("Use action() to register void method " + name);
            }
            return register(new MethodBinding<>(name, returnType, invoker, parameterTypes));
        }

        /**
         * Registers a void method; callers never get a reply.
         */
        public Builder<H> action(String name, MethodAction<H> action, Type... parameterTypes) {
            Objects.requireNonNull(action, "action");
            MethodInvoker<H> invoker = (handler, arguments) -> {
                action.invoke(handler, arguments);
                return null;
            };
            return register(new MethodBinding<>(name, void.class, invoker, parameterTypes));
        }

        /**
         * Registers a void method whose work completes asynchronously. The dispatcher awaits
         * completion so that failures are reported, but still sends no reply.
         */
        public Builder<H> asyncAction(String name, MethodInvoker<H> invoker, Type... parameterTypes) {
            return register(new MethodBinding<>(name, void.class, invoker, parameterTypes));
        }

        private Builder<H> register(MethodBinding<H> binding) {
            if (binding.name().isBlank()) {
                throw new IllegalArgumentException("Method name must not be blank");
            }
            MethodBinding<H> previous = bindings.putIfAbsent(key(binding.name()), binding);
            if (previous != null) {
                throw new IllegalStateException("Method " + binding.name() + " is already registered on "
                    + handlerType.getName() + " as " + previous.name());
            }
            return this;
        }

        public MethodTable<H> build() {
            return new MethodTable<>(handlerType, bindings);
        }
    }
}
