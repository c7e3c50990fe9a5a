package forcelink.domain.exceptions;

/**
 * Represents a failed OAuth exchange, either because the credentials were rejected or because
 * the response did not contain an instance URL and access token.
 */
public class AuthenticationFailed extends RuntimeException implements InternalException {
    public AuthenticationFailed(final String message) {
        super(message);
    }

    public AuthenticationFailed(final String message, final Throwable cause) {
        super(message, cause);
    }
}
