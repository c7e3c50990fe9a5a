package forcelink.infrastructure.salesforce;

import forcelink.domain.exceptions.InvalidField;

import java.util.Map;
import java.util.Set;

/**
 * Checks that every key of an outgoing payload is a field of the target object.
 */
public class SalesforcePayloadValidator {
    /**
     * @throws InvalidField naming the first key, in iteration order, that is not an allowed field
     */
    public void validate(final Map<String, String> payload, final Set<String> allowedFields) {
        if (payload == null || payload.isEmpty()) {
            return;
        }

        for (final String field : payload.keySet()) {
            if (!allowedFields.contains(field)) {
                throw new InvalidField(field);
            }
        }
    }
}
