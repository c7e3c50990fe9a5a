package forcelink.infrastructure.salesforce;

import forcelink.domain.httpclient.HttpTransport;
import forcelink.domain.json.JsonDeserializer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.logging.Logger;

/**
 * Creates connections from the configured credentials. Every connection has its own session and
 * schema cache, so give each job or thread its own.
 */
@ApplicationScoped
public class SalesforceConnectionFactory {
    @Inject
    private SalesforceConfig config;

    @Inject
    private HttpTransport transport;

    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    private Logger logger;

    public SalesforceConnection create() {
        return create(config.getCredentials());
    }

    public SalesforceConnection create(final SalesforceCredentials credentials) {
        return new SalesforceConnection(
                credentials,
                config.getApiVersion(),
                transport,
                jsonDeserializer,
                logger);
    }
}
