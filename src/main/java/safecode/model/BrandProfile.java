package safecode.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Brand details the code-generation prompt needs.
 *
 * @param globalTemplate company-wide code skeleton with {@code {test_id}}-style
 *                       placeholders, or {@code null} when the brand has none
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BrandProfile(
        @JsonProperty("brand_id")        long brandId,
        @JsonProperty("name")            String name,
        @JsonProperty("domain")          String domain,
        @JsonProperty("global_template") String globalTemplate) {

    @JsonCreator
    public BrandProfile {
        name   = name != null ? name : "Unknown";
        domain = domain != null ? domain : "";
    }

    public static BrandProfile unnamed(long brandId) {
        return new BrandProfile(brandId, null, null, null);
    }

    public boolean hasGlobalTemplate() {
        return globalTemplate != null && !globalTemplate.isBlank();
    }
}
