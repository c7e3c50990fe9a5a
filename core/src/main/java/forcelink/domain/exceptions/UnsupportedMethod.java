package forcelink.domain.exceptions;

/**
 * Represents a request with an HTTP method the connector does not send.
 */
public class UnsupportedMethod extends RuntimeException implements InternalException {
    private final String method;

    public UnsupportedMethod(final String method) {
        super("Method " + method + " isn't supported");
        this.method = method;
    }

    public String getMethod() {
        return method;
    }
}
