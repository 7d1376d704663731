package dev.wsrpc.transport;

public class MethodNotFoundException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String method;

    public MethodNotFoundException(String method) {
        super("No method " + method + " is registered");
        this.method = method;
    }

    public String getMethod() {
        return method;
    }
}
