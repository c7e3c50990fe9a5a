package forcelink.domain.exceptions;

/**
 * Represents a POST or PATCH request sent without a payload.
 */
public class MissingPayload extends RuntimeException implements InternalException {
    public MissingPayload(final String method, final String path) {
        super("Payload must be defined for a " + method + " request to " + path);
    }
}
