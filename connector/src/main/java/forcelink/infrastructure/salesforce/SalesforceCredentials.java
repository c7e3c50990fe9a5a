package forcelink.infrastructure.salesforce;

import static com.google.common.base.Preconditions.checkArgument;
import static org.apache.commons.lang3.StringUtils.isNotBlank;

/**
 * The values posted to the OAuth token endpoint.
 */
public record SalesforceCredentials(String authUrl,
                                    String username,
                                    String password,
                                    String clientId,
                                    String clientSecret,
                                    String grantType) {
    public static final String DEFAULT_GRANT_TYPE = "password";

    public SalesforceCredentials {
        checkArgument(isNotBlank(authUrl), "authUrl must not be blank");
        grantType = isNotBlank(grantType) ? grantType : DEFAULT_GRANT_TYPE;
    }

    public SalesforceCredentials(final String authUrl,
                                 final String username,
                                 final String password,
                                 final String clientId,
                                 final String clientSecret) {
        this(authUrl, username, password, clientId, clientSecret, DEFAULT_GRANT_TYPE);
    }

    @Override
    public String toString() {
        return "SalesforceCredentials[authUrl=" + authUrl
                + ", username=" + username
                + ", clientId=" + clientId
                + ", grantType=" + grantType + "]";
    }
}
