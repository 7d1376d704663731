package dev.wsrpc.transport;

import java.lang.reflect.Type;
import java.util.Objects;

/**
 * Outcome of converting one loosely typed argument to a declared parameter type.
 */
public final class ArgumentConversion {

    private final Object value;
    private final Type targetType;
    private final Throwable failure;

    private ArgumentConversion(Object value, Type targetType, Throwable failure) {
        this.value = value;
        this.targetType = targetType;
        this.failure = failure;
    }

    public static ArgumentConversion success(Object value, Type targetType) {
        return new ArgumentConversion(value, targetType, null);
    }

    public static ArgumentConversion failure(Type targetType, Throwable failure) {
        return new ArgumentConversion(null, targetType, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public Object value() {
        if (failure != null) {
            throw new IllegalStateException("Conversion to " + targetType.getTypeName() + " failed", failure);
        }
        return value;
    }

    public Type targetType() {
        return targetType;
    }

    public Throwable failure() {
        return failure;
    }
}
