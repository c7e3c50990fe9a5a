package forcelink.infrastructure.salesforce;

import static com.google.common.base.Preconditions.checkState;

/**
 * The instance URL and access token obtained by a {@link SalesforceAuthenticator}.
 * A session starts empty and is populated once; there is no refresh.
 */
public class SalesforceSession {
    private String baseUrl = "";
    private String accessToken = "";
    private boolean authenticated;

    void authenticate(final String baseUrl, final String accessToken) {
        this.baseUrl = baseUrl;
        this.accessToken = accessToken;
        this.authenticated = true;
    }

    public boolean isAuthenticated() {
        return authenticated;
    }

    public String getBaseUrl() {
        checkState(authenticated, "The session has not been authenticated");
        return baseUrl;
    }

    public String getAccessToken() {
        checkState(authenticated, "The session has not been authenticated");
        return accessToken;
    }
}
