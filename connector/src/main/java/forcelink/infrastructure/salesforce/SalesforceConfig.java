package forcelink.infrastructure.salesforce;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkState;

/**
 * Connection settings read from MicroProfile Config. The credentials are usually supplied as
 * environment variables, e.g. FL_SALESFORCE_USERNAME.
 */
@ApplicationScoped
public class SalesforceConfig {
    private static final String DEFAULT_AUTH_URL = "https://login.salesforce.com/services/oauth2/token";

    @Inject
    @ConfigProperty(name = "fl.salesforce.authurl", defaultValue = DEFAULT_AUTH_URL)
    private String authUrl;

    @Inject
    @ConfigProperty(name = "fl.salesforce.username")
    private Optional<String> username;

    @Inject
    @ConfigProperty(name = "fl.salesforce.password")
    private Optional<String> password;

    @Inject
    @ConfigProperty(name = "fl.salesforce.clientid")
    private Optional<String> clientId;

    @Inject
    @ConfigProperty(name = "fl.salesforce.clientsecret")
    private Optional<String> clientSecret;

    @Inject
    @ConfigProperty(name = "fl.salesforce.granttype", defaultValue = SalesforceCredentials.DEFAULT_GRANT_TYPE)
    private String grantType;

    @Inject
    @ConfigProperty(name = "fl.salesforce.apiversion", defaultValue = SalesforceConnection.DEFAULT_API_VERSION + "")
    private String apiVersion;

    public SalesforceCredentials getCredentials() {
        checkState(username.isPresent(), "Salesforce username is not configured");
        checkState(password.isPresent(), "Salesforce password is not configured");
        checkState(clientId.isPresent(), "Salesforce client id is not configured");
        checkState(clientSecret.isPresent(), "Salesforce client secret is not configured");

        return new SalesforceCredentials(
                authUrl,
                username.get(),
                password.get(),
                clientId.get(),
                clientSecret.get(),
                grantType);
    }

    public double getApiVersion() {
        return Try.of(() -> Double.parseDouble(apiVersion))
                .filter(version -> version > 0)
                .getOrElse(SalesforceConnection.DEFAULT_API_VERSION);
    }
}
