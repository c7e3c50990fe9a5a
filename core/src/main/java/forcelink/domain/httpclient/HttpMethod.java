package forcelink.domain.httpclient;

import forcelink.domain.exceptions.UnsupportedMethod;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

/**
 * The HTTP methods the connector sends.
 */
public enum HttpMethod {
    GET(false),
    POST(true),
    PATCH(true),
    DELETE(false);

    private final boolean hasBody;

    HttpMethod(final boolean hasBody) {
        this.hasBody = hasBody;
    }

    /**
     * @return true if requests with this method carry a JSON body
     */
    public boolean hasBody() {
        return hasBody;
    }

    public static HttpMethod fromName(final String name) {
        if (StringUtils.isBlank(name)) {
            throw new UnsupportedMethod(String.valueOf(name));
        }

        for (final HttpMethod method : values()) {
            if (method.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
                return method;
            }
        }

        throw new UnsupportedMethod(name);
    }
}
