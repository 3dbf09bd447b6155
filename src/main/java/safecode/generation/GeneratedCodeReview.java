package safecode.generation;

import com.fasterxml.jackson.annotation.JsonProperty;
import safecode.validation.ConfidenceBreakdown;

/**
 * Generated code together with everything a human reviewer needs to judge it.
 */
public record GeneratedCodeReview(
        @JsonProperty("generated_code")       String code,
        @JsonProperty("implementation_notes") String implementationNotes,
        @JsonProperty("testing_checklist")    String testingChecklist,
        @JsonProperty("confidence_breakdown") ConfidenceBreakdown confidence,
        @JsonProperty("is_truncated")         boolean truncated,
        @JsonProperty("stop_reason")          String stopReason,
        @JsonProperty("prompt_tokens")        int promptTokens,
        @JsonProperty("completion_tokens")    int completionTokens,
        @JsonProperty("cost_usd")             double costUsd) {

    @JsonProperty("total_tokens")
    public int totalTokens() {
        return promptTokens + completionTokens;
    }

    @JsonProperty("confidence_score")
    public double confidenceScore() {
        return confidence.overallScore();
    }
}
