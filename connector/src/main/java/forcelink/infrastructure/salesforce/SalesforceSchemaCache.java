package forcelink.infrastructure.salesforce;

import forcelink.domain.json.JsonDeserializer;
import forcelink.infrastructure.salesforce.api.SalesforceDescribe;
import forcelink.infrastructure.salesforce.api.SalesforceField;
import forcelink.infrastructure.salesforce.api.SalesforceObjectList;
import forcelink.infrastructure.salesforce.api.SalesforceObjectSummary;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Holds the object names of the org and the field names of each object that has been looked up.
 * Entries are fetched on first use and never evicted; a failed fetch caches nothing.
 * <p>
 * Not thread safe. {@link SalesforceConnection} only calls it while holding its own lock.
 */
public class SalesforceSchemaCache {
    private final SchemaFetcher fetcher;
    private final JsonDeserializer jsonDeserializer;
    private final Logger logger;
    private final Map<String, Set<String>> objectFields = new HashMap<>();

    @Nullable
    private Set<String> objectNames;

    public SalesforceSchemaCache(final SchemaFetcher fetcher, final JsonDeserializer jsonDeserializer, final Logger logger) {
        this.fetcher = checkNotNull(fetcher);
        this.jsonDeserializer = checkNotNull(jsonDeserializer);
        this.logger = checkNotNull(logger);
    }

    public Set<String> objectNames() {
        if (objectNames == null) {
            logger.fine("Fetching Salesforce object names");

            final SalesforceObjectList list = jsonDeserializer.deserialize(
                    fetcher.fetchWithoutValidation("sobjects"),
                    SalesforceObjectList.class);

            final Set<String> names = list.getSobjects()
                    .stream()
                    .map(SalesforceObjectSummary::name)
                    .filter(Objects::nonNull)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            objectNames = Collections.unmodifiableSet(names);

            logger.fine("Cached " + objectNames.size() + " Salesforce object names");
        }

        return objectNames;
    }

    public Set<String> objectFields(final String objectName) {
        checkNotNull(objectName);

        final Set<String> cached = objectFields.get(objectName);
        if (cached != null) {
            return cached;
        }

        logger.fine("Fetching fields of Salesforce object " + objectName);

        final SalesforceDescribe describe = jsonDeserializer.deserialize(
                fetcher.fetchWithoutValidation("sobjects/" + objectName + "/describe"),
                SalesforceDescribe.class);

        final Set<String> fields = describe.getFields()
                .stream()
                .map(SalesforceField::name)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        final Set<String> cachedFields = Collections.unmodifiableSet(fields);
        objectFields.put(objectName, cachedFields);
        return cachedFields;
    }

    /**
     * Issues a GET for schema metadata with object validation suspended for that request.
     */
    @FunctionalInterface
    public interface SchemaFetcher {
        String fetchWithoutValidation(String path);
    }
}
