package forcelink.domain.httpclient;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Sends a request and returns the status and body. Non-success statuses are returned, not thrown;
 * only failures to complete the exchange (connection errors, timeouts) are thrown as
 * {@link forcelink.domain.exceptions.RequestFailed}.
 */
public interface HttpTransport {
    HttpResult call(HttpMethod method, String url, Map<String, String> headers, @Nullable String jsonBody);

    HttpResult postForm(String url, Map<String, String> headers, Map<String, String> form);
}
