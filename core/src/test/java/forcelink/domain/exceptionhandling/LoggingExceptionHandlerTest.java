package forcelink.domain.exceptionhandling;

import forcelink.domain.exceptions.InvalidField;
import forcelink.domain.exceptions.RequestFailed;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(LoggingExceptionHandler.class)
public class LoggingExceptionHandlerTest {

    @Inject
    ExceptionHandler exceptionHandler;

    @BeforeEach
    void updateConfig() {
        final var configSource = new PropertiesConfigSource(
                Map.of("fl.exceptions.printstacktrace", "false"),
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

    @Test
    public void testInternalExceptionShowsMessage() {
        assertEquals("Bogus isn't a valid field", exceptionHandler.getExceptionMessage(new InvalidField("Bogus")));
    }

    @Test
    public void testExceptionWithoutMessage() {
        assertEquals("java.lang.IllegalStateException", exceptionHandler.getExceptionMessage(new IllegalStateException()));
    }

    @Test
    public void testExternalExceptionShowsStackTraceAndBody() {
        final String message = exceptionHandler.getExceptionMessage(
                new RequestFailed("Salesforce returned 401", "[{\"errorCode\": \"INVALID_SESSION_ID\"}]", 401));

        assertTrue(message.contains(RequestFailed.class.getName()));
        assertTrue(message.contains("Response body: [{\"errorCode\": \"INVALID_SESSION_ID\"}]"));
    }

    @Test
    public void testNull() {
        assertEquals("Exception was null", exceptionHandler.getExceptionMessage(null));
    }
}
