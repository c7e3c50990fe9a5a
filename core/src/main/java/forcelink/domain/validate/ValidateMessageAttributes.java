package forcelink.domain.validate;

import java.util.List;
import java.util.Map;

/**
 * Checks the structure of queue message attributes and batch entries before they are handed to a queue client.
 */
public interface ValidateMessageAttributes {
    /**
     * @param attributes attribute name mapped to its "DataType" and value entries
     * @return the attributes, unchanged
     * @throws forcelink.domain.exceptions.InvalidMessageAttributes describing the first problem found
     */
    Map<String, Map<String, String>> throwIfMalformed(Map<String, Map<String, String>> attributes);

    /**
     * @param entries batch entries, each with an "Id", a "MessageBody" and optionally "MessageAttributes"
     * @return the entries, unchanged
     * @throws forcelink.domain.exceptions.InvalidMessageAttributes describing the first problem found
     */
    List<Map<String, Object>> throwIfInvalidBatch(List<Map<String, Object>> entries);
}
