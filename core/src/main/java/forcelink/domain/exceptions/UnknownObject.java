package forcelink.domain.exceptions;

/**
 * Represents a request path that resolved to an object name that is not part of the org's schema.
 */
public class UnknownObject extends RuntimeException implements InternalException {
    private final String objectName;

    public UnknownObject(final String objectName) {
        super(objectName + " isn't a valid object");
        this.objectName = objectName;
    }

    public String getObjectName() {
        return objectName;
    }
}
