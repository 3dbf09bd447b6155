package safecode.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reference implementation a brand keeps for one test type.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CodeTemplate(
        @JsonProperty("test_type")     TestType testType,
        @JsonProperty("template_code") String templateCode,
        @JsonProperty("description")   String description) {

    @JsonCreator
    public CodeTemplate {
        templateCode = templateCode != null ? templateCode : "";
    }

    public static CodeTemplate of(TestType testType, String templateCode) {
        return new CodeTemplate(testType, templateCode, null);
    }
}
