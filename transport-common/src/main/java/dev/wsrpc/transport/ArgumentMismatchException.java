package dev.wsrpc.transport;

/**
 * The supplied arguments do not fit the parameters of the resolved method, either in number or
 * because one of them could not be converted.
 */
public class ArgumentMismatchException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String method;

    public ArgumentMismatchException(String method, String message) {
        this(method, message, null);
    }

    public ArgumentMismatchException(String method, String message, Throwable cause) {
        super(message, cause);
        this.method = method;
    }

    public String getMethod() {
        return method;
    }
}
