package forcelink.domain.exceptions;

/**
 * Represents an HTTP request that returned a non-success status, or that could not be completed at all.
 * Transport failures such as timeouts have a code of -1.
 */
public class RequestFailed extends RuntimeException implements ExternalException {
    private final String body;
    private final int code;

    public RequestFailed(final String message, final String body, final int code) {
        super(message);
        this.body = body;
        this.code = code;
    }

    public RequestFailed(final String message, final Throwable cause) {
        super(message, cause);
        this.body = "";
        this.code = -1;
    }

    public String getBody() {
        return body;
    }

    public int getCode() {
        return code;
    }
}
