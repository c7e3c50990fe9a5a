package forcelink.infrastructure.salesforce;

import forcelink.domain.exceptions.AuthenticationFailed;
import forcelink.domain.exceptions.DeserializationFailed;
import forcelink.domain.httpclient.HttpResult;
import forcelink.domain.httpclient.HttpTransport;
import forcelink.domain.json.JsonDeserializer;
import forcelink.infrastructure.salesforce.api.SalesforceOauthTokenResponse;
import io.vavr.control.Try;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Exchanges a username and password for an access token using the OAuth 2.0 username-password flow.
 */
public class PasswordGrantAuthenticator implements SalesforceAuthenticator {
    private final SalesforceCredentials credentials;
    private final HttpTransport transport;
    private final JsonDeserializer jsonDeserializer;
    private final Logger logger;
    private final SalesforceSession session = new SalesforceSession();

    public PasswordGrantAuthenticator(
            final SalesforceCredentials credentials,
            final HttpTransport transport,
            final JsonDeserializer jsonDeserializer,
            final Logger logger) {
        this.credentials = checkNotNull(credentials);
        this.transport = checkNotNull(transport);
        this.jsonDeserializer = checkNotNull(jsonDeserializer);
        this.logger = checkNotNull(logger);
    }

    @Override
    public SalesforceSession getSession() {
        return session;
    }

    @Override
    public void ensureAuthenticated() {
        if (session.isAuthenticated()) {
            return;
        }

        logger.fine("Authenticating with Salesforce as " + credentials.username() + " against " + credentials.authUrl());

        final HttpResult result = Try.of(() -> transport.postForm(
                        credentials.authUrl(),
                        Map.of("Accept", "application/json"),
                        buildForm()))
                .getOrElseThrow(ex -> new AuthenticationFailed("Failed to call the Salesforce token endpoint " + credentials.authUrl(), ex));

        if (!result.isSuccess()) {
            logger.warning("Salesforce authentication returned status " + result.status());
            throw new AuthenticationFailed("Expected a success status from the Salesforce token endpoint, but got "
                    + result.status() + ". " + result.body());
        }

        final SalesforceOauthTokenResponse token = Try.of(() -> jsonDeserializer.deserialize(result.body(), SalesforceOauthTokenResponse.class))
                .getOrElseThrow(ex -> new AuthenticationFailed("The Salesforce token response was not valid JSON", ex));

        if (token == null || !token.isComplete()) {
            throw new AuthenticationFailed("The Salesforce token response did not contain instance_url and access_token",
                    new DeserializationFailed("Missing instance_url or access_token"));
        }

        session.authenticate(token.getBaseUrl(), token.accessToken());

        logger.fine("Authenticated with Salesforce instance " + session.getBaseUrl());
    }

    private Map<String, String> buildForm() {
        final Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", credentials.grantType());
        form.put("username", Objects.toString(credentials.username(), ""));
        form.put("password", Objects.toString(credentials.password(), ""));
        form.put("client_id", Objects.toString(credentials.clientId(), ""));
        form.put("client_secret", Objects.toString(credentials.clientSecret(), ""));
        return form;
    }
}
