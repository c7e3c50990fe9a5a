package forcelink.domain.httpclient;

/**
 * The status and body of a completed HTTP call.
 */
public record HttpResult(int status, String body) {
    public HttpResult {
        body = body == null ? "" : body;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
