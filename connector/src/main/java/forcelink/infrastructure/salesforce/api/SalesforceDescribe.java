package forcelink.infrastructure.salesforce.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * The response to GET sobjects/{name}/describe.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SalesforceDescribe(String name, List<SalesforceField> fields) {
    public List<SalesforceField> getFields() {
        return fields == null ? List.of() : fields;
    }
}
