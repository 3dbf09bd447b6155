package safecode.generation;

/**
 * Raw reply of a {@link CodeGenerator}.
 *
 * @param text             response text as returned, possibly fenced or JSON-wrapped
 * @param promptTokens     input tokens billed
 * @param completionTokens output tokens billed
 * @param stopReason       provider stop reason, e.g. {@code end_turn} or {@code max_tokens}; may be {@code null}
 */
public record GenerationResponse(String text, int promptTokens, int completionTokens, String stopReason) {

    public static final String STOP_MAX_TOKENS = "max_tokens";

    public GenerationResponse {
        text = text != null ? text : "";
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }

    /** True when the provider stopped because it ran out of completion tokens. */
    public boolean hitTokenLimit() {
        return STOP_MAX_TOKENS.equals(stopReason);
    }
}
