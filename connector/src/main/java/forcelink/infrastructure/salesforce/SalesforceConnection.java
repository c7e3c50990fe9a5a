package forcelink.infrastructure.salesforce;

import forcelink.domain.exceptions.MissingPayload;
import forcelink.domain.exceptions.RequestFailed;
import forcelink.domain.exceptions.UnknownObject;
import forcelink.domain.httpclient.HttpMethod;
import forcelink.domain.httpclient.HttpResult;
import forcelink.domain.httpclient.HttpTransport;
import forcelink.domain.json.JsonDeserializer;
import forcelink.infrastructure.salesforce.api.SalesforceQueryResult;
import org.jspecify.annotations.Nullable;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A stateful client for the Salesforce REST API.
 * <p>
 * The first request authenticates. Before a request is sent, the object it targets is checked against
 * the org's object names, and POST and PATCH payloads are checked against the object's fields. The
 * schema metadata needed for these checks is fetched through this same connection on first use and
 * cached for the life of the connection.
 * <p>
 * A connection supports one request at a time. Dispatch is synchronized so concurrent callers are
 * serialized; callers wanting parallelism should use one connection each.
 */
public class SalesforceConnection {
    public static final double DEFAULT_API_VERSION = 47.0;

    private final SalesforceAuthenticator authenticator;
    private final HttpTransport transport;
    private final JsonDeserializer jsonDeserializer;
    private final Logger logger;
    private final double apiVersion;
    private final SalesforceSchemaCache schemaCache;
    private final SalesforcePayloadValidator payloadValidator = new SalesforcePayloadValidator();

    /**
     * False while the schema cache is fetching metadata, so those requests are not themselves validated.
     */
    private boolean validating = true;

    public SalesforceConnection(
            final SalesforceCredentials credentials,
            final double apiVersion,
            final HttpTransport transport,
            final JsonDeserializer jsonDeserializer,
            final Logger logger) {
        this(new PasswordGrantAuthenticator(credentials, transport, jsonDeserializer, logger),
                apiVersion,
                transport,
                jsonDeserializer,
                logger);
    }

    public SalesforceConnection(
            final SalesforceAuthenticator authenticator,
            final double apiVersion,
            final HttpTransport transport,
            final JsonDeserializer jsonDeserializer,
            final Logger logger) {
        this.authenticator = checkNotNull(authenticator);
        this.transport = checkNotNull(transport);
        this.jsonDeserializer = checkNotNull(jsonDeserializer);
        this.logger = checkNotNull(logger);
        this.apiVersion = apiVersion;
        this.schemaCache = new SalesforceSchemaCache(this::fetchWithoutValidation, jsonDeserializer, logger);
    }

    /**
     * Sends a request, naming the method as a string.
     *
     * @throws forcelink.domain.exceptions.UnsupportedMethod if the method is not GET, POST, PATCH or DELETE
     */
    public synchronized String dispatch(final String method, final String path, @Nullable final Map<String, String> payload) {
        return dispatch(method, path, null, payload);
    }

    public synchronized String dispatch(final String method, final String path, @Nullable final String id, @Nullable final Map<String, String> payload) {
        authenticator.ensureAuthenticated();
        return dispatch(new SalesforceRequest(HttpMethod.fromName(method), path, id, payload));
    }

    /**
     * Validates and sends a request.
     *
     * @return the response body, unparsed
     * @throws forcelink.domain.exceptions.AuthenticationFailed if authentication fails
     * @throws UnknownObject if the path targets an object the org does not have
     * @throws MissingPayload if a POST or PATCH has no payload
     * @throws forcelink.domain.exceptions.InvalidField if the payload names a field the object does not have
     * @throws RequestFailed if Salesforce returns a non-success status or the call can't be completed
     */
    public synchronized String dispatch(final SalesforceRequest request) {
        checkNotNull(request);

        authenticator.ensureAuthenticated();

        final String objectName = validating
                ? SalesforcePathInterpreter.objectNameFromPath(request.fullPath())
                : "";

        if (validating && !objectName.isEmpty() && !schemaCache.objectNames().contains(objectName)) {
            throw new UnknownObject(objectName);
        }

        if (request.method().hasBody()) {
            if (request.payload() == null || request.payload().isEmpty()) {
                throw new MissingPayload(request.method().name(), request.fullPath());
            }

            if (validating && !objectName.isEmpty()) {
                payloadValidator.validate(request.payload(), schemaCache.objectFields(objectName));
            }
        }

        final String body = send(request);

        validating = true;

        return body;
    }

    /**
     * Runs a SOQL query and returns the records of the first page of results.
     */
    public List<Map<String, Object>> queryWithSoql(final String query) {
        return jsonDeserializer.deserialize(queryWithSoqlRaw(query), SalesforceQueryResult.class).getRecords();
    }

    /**
     * Runs a SOQL query and returns the response body, which includes totalSize and done as well as the records.
     */
    public String queryWithSoqlRaw(final String query) {
        checkNotNull(query);
        return dispatch(SalesforceRequest.get("query?q=" + URLEncoder.encode(query, StandardCharsets.UTF_8)));
    }

    /**
     * @return the object names of the org, fetched on first use
     */
    public synchronized Set<String> objectNames() {
        return schemaCache.objectNames();
    }

    /**
     * @return the field names of the object, fetched on first use
     */
    public synchronized Set<String> objectFields(final String objectName) {
        return schemaCache.objectFields(objectName);
    }

    public SalesforceSession getSession() {
        return authenticator.getSession();
    }

    private String send(final SalesforceRequest request) {
        final SalesforceSession session = authenticator.getSession();
        final String url = buildUrl(session.getBaseUrl(), request.fullPath());

        logger.fine("Sending " + request.method() + " " + url);

        final HttpResult result = transport.call(
                request.method(),
                url,
                Map.of("Authorization", "Bearer " + session.getAccessToken(),
                        "Accept", "application/json"),
                request.method().hasBody() ? jsonDeserializer.serialize(request.payload()) : null);

        if (!result.isSuccess()) {
            logger.warning(request.method() + " " + url + " returned status " + result.status());
            throw new RequestFailed("Expected a success status code, but got "
                    + result.status()
                    + " from " + request.method() + " " + url + ". " + result.body(),
                    result.body(),
                    result.status());
        }

        return result.body();
    }

    private String buildUrl(final String baseUrl, final String path) {
        return String.format(Locale.ROOT, "%s/services/data/v%.1f/%s", baseUrl, apiVersion, path);
    }

    private synchronized String fetchWithoutValidation(final String path) {
        final boolean previous = validating;
        validating = false;
        try {
            return dispatch(SalesforceRequest.get(path));
        } finally {
            validating = previous;
        }
    }
}
