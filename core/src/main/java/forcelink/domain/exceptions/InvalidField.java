package forcelink.domain.exceptions;

/**
 * Represents a payload that references a field the target object does not have.
 * Only the first offending field is reported.
 */
public class InvalidField extends RuntimeException implements InternalException {
    private final String field;

    public InvalidField(final String field) {
        super(field + " isn't a valid field");
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
