package forcelink.infrastructure.salesforce;

import forcelink.domain.httpclient.HttpMethod;
import org.jspecify.annotations.Nullable;

import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A single call to the REST API. The path is relative to {@code /services/data/vXX.X/}, and the
 * id, when present, is appended to it as a final segment.
 */
public record SalesforceRequest(HttpMethod method, String path, @Nullable String id, @Nullable Map<String, String> payload) {
    public SalesforceRequest {
        checkNotNull(method, "method must not be null");
        checkNotNull(path, "path must not be null");
    }

    public static SalesforceRequest get(final String path) {
        return new SalesforceRequest(HttpMethod.GET, path, null, null);
    }

    public static SalesforceRequest post(final String path, final Map<String, String> payload) {
        return new SalesforceRequest(HttpMethod.POST, path, null, payload);
    }

    public static SalesforceRequest patch(final String path, final String id, final Map<String, String> payload) {
        return new SalesforceRequest(HttpMethod.PATCH, path, id, payload);
    }

    public static SalesforceRequest delete(final String path, final String id) {
        return new SalesforceRequest(HttpMethod.DELETE, path, id, null);
    }

    public String fullPath() {
        return id == null || id.isBlank() ? path : path + "/" + id;
    }
}
