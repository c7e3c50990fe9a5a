package forcelink.application.cli;

import forcelink.Marker;
import forcelink.domain.exceptionhandling.ExceptionHandler;
import forcelink.domain.json.JsonDeserializer;
import forcelink.infrastructure.salesforce.SalesforceConnection;
import forcelink.infrastructure.salesforce.SalesforceConnectionFactory;
import io.vavr.control.Try;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.jboss.weld.environment.se.Weld;
import org.jboss.weld.environment.se.WeldContainer;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Usage:
 * <pre>
 * Main GET sobjects/Contact
 * Main POST sobjects/Contact '{"FirstName": "June", "LastName": "Ross"}'
 * Main PATCH sobjects/Contact '{"Email": "june@example.com"}' 0035g00000AbCdE
 * Main DELETE sobjects/Contact "" 0035g00000AbCdE
 * Main query "SELECT Id, Name FROM Contact"
 * </pre>
 */
public class Main {
    @Inject
    private SalesforceConnectionFactory connectionFactory;

    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    private ExceptionHandler exceptionHandler;

    public static void main(final String[] args) {
        final Weld weld = new Weld();
        // Each module is its own classpath entry, so point Weld at a class from each of them.
        try (WeldContainer weldContainer = weld.addBeanClass(Main.class)
                .addPackages(true, Marker.class, SalesforceConnectionFactory.class)
                .initialize()) {
            weldContainer.select(Main.class).get().entry(args);
        }
    }

    public void entry(final String[] args) {
        Try.of(() -> run(args))
                .onSuccess(System.out::println)
                .onFailure(e -> System.err.println("Failed to call Salesforce: " + exceptionHandler.getExceptionMessage(e)));
    }

    private String run(final String[] args) {
        if (args.length < 2 || StringUtils.isAnyBlank(args[0], args[1])) {
            throw new IllegalArgumentException("Expected a method and a path, or \"query\" and a SOQL statement");
        }

        final SalesforceConnection connection = connectionFactory.create();

        if ("query".equalsIgnoreCase(args[0])) {
            return jsonDeserializer.serialize(connection.queryWithSoql(args[1]));
        }

        return connection.dispatch(
                args[0],
                args[1],
                args.length > 3 && StringUtils.isNotBlank(args[3]) ? args[3] : null,
                getPayload(args));
    }

    @Nullable
    private Map<String, String> getPayload(final String[] args) {
        if (args.length < 3 || StringUtils.isBlank(args[2])) {
            return null;
        }

        return jsonDeserializer.deserializeMap(args[2], String.class, String.class);
    }
}
