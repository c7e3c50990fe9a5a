package forcelink.infrastructure.salesforce.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.StringUtils;

/**
 * The parts of the token endpoint response the connection needs. The identity URL, signature and
 * issue time are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SalesforceOauthTokenResponse(@JsonProperty("access_token") String accessToken,
                                           @JsonProperty("instance_url") String instanceUrl,
                                           @JsonProperty("token_type") String tokenType) {

    public boolean isComplete() {
        return StringUtils.isNotBlank(accessToken) && StringUtils.isNotBlank(instanceUrl);
    }

    /**
     * @return the instance URL without a trailing slash, ready to have API paths appended
     */
    public String getBaseUrl() {
        return StringUtils.removeEnd(instanceUrl, "/");
    }
}
