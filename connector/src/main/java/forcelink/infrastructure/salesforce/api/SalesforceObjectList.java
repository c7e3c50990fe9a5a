package forcelink.infrastructure.salesforce.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * The response to GET sobjects.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SalesforceObjectList(List<SalesforceObjectSummary> sobjects) {
    public List<SalesforceObjectSummary> getSobjects() {
        return sobjects == null ? List.of() : sobjects;
    }
}
