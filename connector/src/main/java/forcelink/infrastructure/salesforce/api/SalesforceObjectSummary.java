package forcelink.infrastructure.salesforce.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SalesforceObjectSummary(String name, String label, Boolean createable, Boolean queryable) {
}
