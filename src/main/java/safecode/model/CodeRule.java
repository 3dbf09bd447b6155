package safecode.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A brand-level constraint on generated code.
 *
 * @param ruleType    rule kind; rules with an unknown kind deserialize with {@code null} and are ignored
 * @param ruleContent the pattern text, or the length limit for MAX/MIN_LENGTH rules
 * @param priority    ordering hint supplied by the rule author
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CodeRule(
        @JsonProperty("rule_type")    RuleType ruleType,
        @JsonProperty("rule_content") String ruleContent,
        @JsonProperty("priority")     int priority) {

    @JsonCreator
    public CodeRule {
        ruleContent = ruleContent != null ? ruleContent : "";
    }

    public static CodeRule forbidden(String pattern) {
        return new CodeRule(RuleType.FORBIDDEN_PATTERN, pattern, 1);
    }

    public static CodeRule required(String pattern) {
        return new CodeRule(RuleType.REQUIRED_PATTERN, pattern, 1);
    }
}
