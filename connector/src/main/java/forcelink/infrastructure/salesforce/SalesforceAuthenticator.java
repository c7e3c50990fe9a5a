package forcelink.infrastructure.salesforce;

/**
 * Populates a {@link SalesforceSession} on first use.
 */
public interface SalesforceAuthenticator {
    /**
     * Authenticates if the session is not yet authenticated. Calling this again is a no-op.
     *
     * @throws forcelink.domain.exceptions.AuthenticationFailed if the exchange is rejected or the response is malformed
     */
    void ensureAuthenticated();

    SalesforceSession getSession();
}
