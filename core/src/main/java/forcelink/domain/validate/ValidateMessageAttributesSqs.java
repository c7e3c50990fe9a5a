package forcelink.domain.validate;

import forcelink.domain.exceptions.InvalidMessageAttributes;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies the SQS limits: up to 10 attributes per message, up to 10 messages per batch,
 * and String, Number or Binary attribute types.
 */
@ApplicationScoped
public class ValidateMessageAttributesSqs implements ValidateMessageAttributes {
    private static final int MAX_ATTRIBUTES = 10;
    private static final int MAX_BATCH_ENTRIES = 10;
    private static final String DATA_TYPE = "DataType";
    private static final String STRING_VALUE = "StringValue";
    private static final String BINARY_VALUE = "BinaryValue";

    @Override
    public Map<String, Map<String, String>> throwIfMalformed(final Map<String, Map<String, String>> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return attributes;
        }

        checkAttributes(attributes);
        return attributes;
    }

    @Override
    public List<Map<String, Object>> throwIfInvalidBatch(final List<Map<String, Object>> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new InvalidMessageAttributes("The list of entries cannot be empty.");
        }

        if (entries.size() > MAX_BATCH_ENTRIES) {
            throw new InvalidMessageAttributes("The maximum number of messages allowed in a batch is " + MAX_BATCH_ENTRIES + ".");
        }

        final Set<Object> ids = new HashSet<>();
        for (final Map<String, Object> entry : entries) {
            if (!entry.containsKey("Id")) {
                throw new InvalidMessageAttributes("'Id' attribute is required for each message.");
            }

            if (!entry.containsKey("MessageBody")) {
                throw new InvalidMessageAttributes("'MessageBody' attribute is required for each message.");
            }

            if (!ids.add(entry.get("Id"))) {
                throw new InvalidMessageAttributes("'Id' attribute must be unique along all the messages.");
            }

            final Object attributes = entry.get("MessageAttributes");
            if (attributes != null) {
                if (!(attributes instanceof Map)) {
                    throw new InvalidMessageAttributes("'MessageAttributes' must map attribute names to their definitions.");
                }
                checkAttributes((Map<?, ?>) attributes);
            }
        }

        return entries;
    }

    private void checkAttributes(final Map<?, ?> attributes) {
        if (attributes.size() > MAX_ATTRIBUTES) {
            throw new InvalidMessageAttributes("Messages can have up to " + MAX_ATTRIBUTES + " attributes.");
        }

        for (final Object attribute : attributes.values()) {
            checkAttribute(attribute);
        }
    }

    private void checkAttribute(final Object attribute) {
        if (!(attribute instanceof Map)) {
            throw new InvalidMessageAttributes("Each message attribute must contain 'DataType' and 'StringValue' arguments.");
        }

        final Map<?, ?> content = (Map<?, ?>) attribute;

        if (!content.containsKey(DATA_TYPE)) {
            throw new InvalidMessageAttributes("'DataType' argument is missing in message attribute.");
        }

        final Object dataType = content.get(DATA_TYPE);
        if ("String".equals(dataType) || "Number".equals(dataType)) {
            if (!content.containsKey(STRING_VALUE)) {
                throw new InvalidMessageAttributes("'StringValue' argument is required for message attributes of type " + dataType + ".");
            }
        } else if ("Binary".equals(dataType)) {
            if (!content.containsKey(BINARY_VALUE)) {
                throw new InvalidMessageAttributes("'BinaryValue' argument is required for message attributes of type Binary.");
            }
        } else {
            throw new InvalidMessageAttributes("The supported types for 'DataType' argument are: Binary, Number and String.");
        }
    }
}
