package forcelink.domain.httpclient;

import forcelink.domain.exceptions.RequestFailed;
import forcelink.domain.tryext.TryExtensions;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.client.Client;
import jakarta.ws.rs.client.ClientBuilder;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.client.Invocation;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.MultivaluedHashMap;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An {@link HttpTransport} built on the Jakarta REST client.
 */
@ApplicationScoped
public class JaxRsHttpTransport implements HttpTransport {
    private static final long API_CONNECTION_TIMEOUT_SECONDS_DEFAULT = 10;
    private static final long API_CALL_TIMEOUT_SECONDS_DEFAULT = 60;

    @Inject
    @ConfigProperty(name = "fl.http.connecttimeoutseconds", defaultValue = API_CONNECTION_TIMEOUT_SECONDS_DEFAULT + "")
    private String connectTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "fl.http.timeoutseconds", defaultValue = API_CALL_TIMEOUT_SECONDS_DEFAULT + "")
    private String timeoutSeconds;

    @Inject
    private Logger logger;

    @Override
    public HttpResult call(final HttpMethod method, final String url, final Map<String, String> headers, @Nullable final String jsonBody) {
        checkNotNull(method);
        checkNotNull(url);

        // Clients are not guaranteed to be thread safe, so we build a new client for each call.
        return TryExtensions.withResources(
                        this::getClient,
                        client -> send(buildRequest(client, url, headers), method, jsonBody),
                        this::toResult)
                .onFailure(e -> logger.warning("Failed to call " + method + " " + url + ": " + e.getMessage()))
                .getOrElseThrow(e -> new RequestFailed("Failed to call " + method + " " + url, e));
    }

    @Override
    public HttpResult postForm(final String url, final Map<String, String> headers, final Map<String, String> form) {
        checkNotNull(url);
        checkNotNull(form);

        return TryExtensions.withResources(
                        this::getClient,
                        client -> buildRequest(client, url, headers)
                                .post(Entity.form(new MultivaluedHashMap<>(form))),
                        this::toResult)
                .onFailure(e -> logger.warning("Failed to post form to " + url + ": " + e.getMessage()))
                .getOrElseThrow(e -> new RequestFailed("Failed to post form to " + url, e));
    }

    private Response send(final Invocation.Builder builder, final HttpMethod method, @Nullable final String jsonBody) {
        if (method.hasBody() && jsonBody != null) {
            return builder.method(method.name(), Entity.entity(jsonBody, MediaType.APPLICATION_JSON_TYPE));
        }

        return builder.method(method.name());
    }

    private Invocation.Builder buildRequest(final Client client, final String url, final Map<String, String> headers) {
        final Invocation.Builder builder = client.target(url).request(MediaType.APPLICATION_JSON_TYPE);
        if (headers != null) {
            headers.forEach(builder::header);
        }
        return builder;
    }

    private HttpResult toResult(final Response response) {
        if (response.getStatus() == Response.Status.NO_CONTENT.getStatusCode()) {
            return new HttpResult(response.getStatus(), "");
        }

        // hasEntity() is false for a body sent without a Content-Type, so read it regardless.
        return new HttpResult(response.getStatus(), Objects.toString(response.readEntity(String.class), ""));
    }

    private Client getClient() {
        final ClientBuilder clientBuilder = ClientBuilder.newBuilder();
        clientBuilder.connectTimeout(getConnectTimeoutSeconds(), TimeUnit.SECONDS);
        clientBuilder.readTimeout(getTimeoutSeconds(), TimeUnit.SECONDS);
        return clientBuilder.build();
    }

    private long getConnectTimeoutSeconds() {
        return Try.of(() -> Long.parseLong(connectTimeoutSeconds))
                .filter(timeout -> timeout > 0)
                .getOrElse(API_CONNECTION_TIMEOUT_SECONDS_DEFAULT);
    }

    private long getTimeoutSeconds() {
        return Try.of(() -> Long.parseLong(timeoutSeconds))
                .filter(timeout -> timeout > 0)
                .getOrElse(API_CALL_TIMEOUT_SECONDS_DEFAULT);
    }
}
