package forcelink.infrastructure.salesforce;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Works out which Salesforce object a REST path refers to. An empty result means the path
 * does not target a specific object and no object validation applies.
 * <p>
 * Recognised shapes, checked in this order:
 * <ul>
 *     <li>{@code sobjects/Account/describe} gives {@code Account}</li>
 *     <li>{@code query?q=SELECT+Name+FROM+Account+WHERE+...} gives {@code Account}</li>
 *     <li>{@code sobjects} gives an empty string</li>
 *     <li>{@code sobjects/Account} and {@code sobjects/Account/001...} give {@code Account}</li>
 * </ul>
 */
public final class SalesforcePathInterpreter {
    private static final String SOBJECTS = "sobjects";
    private static final String DESCRIBE = "describe";
    private static final String SOQL_MARKER = "query?q=SELECT";
    private static final String FROM_TOKEN = "FROM+";
    private static final String WHERE_TOKEN = "+WHERE";

    private SalesforcePathInterpreter() {
    }

    public static String objectNameFromPath(final String path) {
        if (StringUtils.isBlank(path)) {
            return "";
        }

        final String[] segments = path.split("/");

        if (ArrayUtils.contains(segments, DESCRIBE)) {
            return segmentAfterSobjects(segments);
        }

        if (path.contains(SOQL_MARKER)) {
            return objectNameFromQuery(path);
        }

        if (SOBJECTS.equals(path)) {
            return "";
        }

        return segmentAfterSobjects(segments);
    }

    /**
     * The object name sits between FROM+ and +WHERE. Queries that don't follow that shape,
     * such as a lower case "from", yield an empty string and skip validation.
     */
    private static String objectNameFromQuery(final String path) {
        final int from = path.indexOf(FROM_TOKEN);
        if (from < 0) {
            return "";
        }

        final String afterFrom = path.substring(from + FROM_TOKEN.length());

        if (!path.contains("WHERE")) {
            return afterFrom;
        }

        final int where = afterFrom.lastIndexOf(WHERE_TOKEN);
        return where < 0 ? "" : afterFrom.substring(0, where);
    }

    private static String segmentAfterSobjects(final String[] segments) {
        final int index = ArrayUtils.indexOf(segments, SOBJECTS);
        if (index < 0 || index + 1 >= segments.length) {
            return "";
        }

        return segments[index + 1];
    }
}
