package forcelink.infrastructure.salesforce.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SalesforceQueryResult(Integer totalSize, Boolean done, List<Map<String, Object>> records) {
    public List<Map<String, Object>> getRecords() {
        return records == null ? List.of() : records;
    }
}
