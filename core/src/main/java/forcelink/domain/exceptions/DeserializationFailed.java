package forcelink.domain.exceptions;

/**
 * Represents JSON that could not be mapped to the expected type.
 */
public class DeserializationFailed extends RuntimeException implements InternalException {
    public DeserializationFailed(final String message) {
        super(message);
    }

    public DeserializationFailed(final Throwable cause) {
        super(cause);
    }
}
