package forcelink.domain.exceptions;

public class SerializationFailed extends RuntimeException implements InternalException {
    public SerializationFailed(final Throwable cause) {
        super(cause);
    }
}
