package forcelink.domain.httpclient;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import forcelink.domain.exceptions.RequestFailed;
import forcelink.domain.logger.Loggers;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(JaxRsHttpTransport.class)
@AddBeanClasses(Loggers.class)
public class JaxRsHttpTransportTest {

    @Inject
    HttpTransport transport;

    private HttpServer server;
    private ExecutorService executor;

    @BeforeEach
    void updateConfig() {
        final var configSource = new PropertiesConfigSource(
                Map.of("fl.http.connecttimeoutseconds", "2",
                        "fl.http.timeoutseconds", "1"),
                "TestConfig",
                Integer.MAX_VALUE
        );
        final Config newConfig = new SmallRyeConfigBuilder()
                .withSources(configSource)
                .build();

        final var configProviderResolver = ConfigProviderResolver.instance();
        final var oldConfig = configProviderResolver.getConfig();

        configProviderResolver.releaseConfig(oldConfig);
        configProviderResolver.registerConfig(
                newConfig,
                Thread.currentThread().getContextClassLoader()
        );
    }

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/echo", exchange -> respond(exchange, 200,
                exchange.getRequestMethod() + " " + readBody(exchange)));
        server.createContext("/headers", exchange -> respond(exchange, 200,
                exchange.getRequestHeaders().getFirst("Authorization")));
        server.createContext("/missing", exchange -> respond(exchange, 404,
                "[{\"errorCode\": \"NOT_FOUND\"}]"));
        server.createContext("/gateway", exchange -> {
            final byte[] bytes = "Bad gateway".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(502, bytes.length);
            try (OutputStream output = exchange.getResponseBody()) {
                output.write(bytes);
            }
        });
        server.createContext("/empty", exchange -> {
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        });
        server.createContext("/form", exchange -> respond(exchange, 200,
                exchange.getRequestHeaders().getFirst("Content-Type") + "|" + readBody(exchange)));
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(3000);
            } catch (final InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "late");
        });
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
        executor.shutdownNow();
    }

    private String url(final String path) {
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }

    private static String readBody(final HttpExchange exchange) throws IOException {
        try (InputStream body = exchange.getRequestBody()) {
            return new String(body.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static void respond(final HttpExchange exchange, final int status, final String body) throws IOException {
        final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream output = exchange.getResponseBody()) {
            output.write(bytes);
        }
    }

    @Test
    public void testGet() {
        final HttpResult result = transport.call(HttpMethod.GET, url("/echo"), Map.of(), null);

        assertEquals(200, result.status());
        assertEquals("GET ", result.body());
    }

    @Test
    public void testHeadersAreSent() {
        final HttpResult result = transport.call(HttpMethod.GET, url("/headers"), Map.of("Authorization", "Bearer token"), null);

        assertEquals("Bearer token", result.body());
    }

    @Test
    public void testJsonBody() {
        assertEquals("POST {\"Name\":\"Acme\"}",
                transport.call(HttpMethod.POST, url("/echo"), Map.of(), "{\"Name\":\"Acme\"}").body());
        assertEquals("PATCH {\"Phone\":\"555-0100\"}",
                transport.call(HttpMethod.PATCH, url("/echo"), Map.of(), "{\"Phone\":\"555-0100\"}").body());
    }

    @Test
    public void testDelete() {
        assertEquals("DELETE ", transport.call(HttpMethod.DELETE, url("/echo"), Map.of(), null).body());
    }

    @Test
    public void testErrorStatusIsReturned() {
        final HttpResult result = transport.call(HttpMethod.GET, url("/missing"), Map.of(), null);

        assertEquals(404, result.status());
        assertEquals("[{\"errorCode\": \"NOT_FOUND\"}]", result.body());
    }

    @Test
    public void testBodyWithoutContentTypeIsKept() {
        final HttpResult result = transport.call(HttpMethod.GET, url("/gateway"), Map.of(), null);

        assertEquals(502, result.status());
        assertEquals("Bad gateway", result.body());
    }

    @Test
    public void testNoContent() {
        final HttpResult result = transport.call(HttpMethod.DELETE, url("/empty"), Map.of(), null);

        assertEquals(204, result.status());
        assertEquals("", result.body());
    }

    @Test
    public void testPostForm() {
        final HttpResult result = transport.postForm(
                url("/form"),
                Map.of("Accept", "application/json"),
                Map.of("grant_type", "password"));

        assertTrue(result.body().startsWith("application/x-www-form-urlencoded"));
        assertTrue(result.body().endsWith("|grant_type=password"));
    }

    @Test
    public void testTimeout() {
        final RequestFailed ex = assertThrows(RequestFailed.class,
                () -> transport.call(HttpMethod.GET, url("/slow"), Map.of(), null));

        assertEquals(-1, ex.getCode());
        assertNotNull(ex.getCause());
    }
}
