package forcelink.domain.exceptions;

/**
 * Represents queue message attributes or batch entries that do not have the required structure.
 */
public class InvalidMessageAttributes extends RuntimeException implements InternalException {
    public InvalidMessageAttributes(final String message) {
        super(message);
    }
}
