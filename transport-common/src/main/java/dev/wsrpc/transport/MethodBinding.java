package dev.wsrpc.transport;

import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One entry of a {@link MethodTable}: the public name of a method, the declared parameter types
 * the arguments are converted to, and the declared return type ({@code void.class} when the
 * method never replies).
 */
public final class MethodBinding<H> {

    private final String name;
    private final List<Type> parameterTypes;
    private final Class<?> returnType;
    private final MethodInvoker<H> invoker;

    MethodBinding(String name, Class<?> returnType, MethodInvoker<H> invoker, Type... parameterTypes) {
        this.name = Objects.requireNonNull(name, "name");
        this.returnType = Objects.requireNonNull(returnType, "returnType");
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.parameterTypes = List.copyOf(Arrays.asList(Objects.requireNonNull(parameterTypes, "parameterTypes")));
    }

    public String name() {
        return name;
    }

    public List<Type> parameterTypes() {
        return parameterTypes;
    }

    public int arity() {
        return parameterTypes.size();
    }

    public Class<?> returnType() {
        return returnType;
    }

    public boolean returnsValue() {
        return returnType != void.class && returnType != Void.class;
    }

    public MethodInvoker<H> invoker() {
        return invoker;
    }

    /**
     * Zero value of the return type, sent back when the invocation fails.
     */
    public Object defaultReturnValue() {
        if (!returnType.isPrimitive()) {
            return null;
        }
        if (returnType == boolean.class) {
            return Boolean.FALSE;
        }
        if (returnType == char.class) {
            return '\0';
        }
        if (returnType == byte.class) {
            return (byte) 0;
        }
        if (returnType == short.class) {
            return (short) 0;
        }
        if (returnType == int.class) {
            return 0;
        }
        if (returnType == long.class) {
            return 0L;
        }
        if (returnType == float.class) {
            return 0F;
        }
        if (returnType == double.class) {
            return 0D;
        }
        return null;
    }

    @Override
    public String toString() {
        return name + parameterTypes.stream().map(Type::getTypeName).toList() + " -> " + returnType.getSimpleName();
    }
}
