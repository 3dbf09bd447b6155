package safecode.selector;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of {@link SelectorResolver#resolve}.
 *
 * <p>{@code offeredOptions} is set only for {@link ResolutionStatus#MULTIPLE_MATCHES}:
 * the candidate selectors in the order the message lists them, for the caller
 * to store on the assistant turn it sends.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResolutionResult(
        @JsonProperty("status")            ResolutionStatus status,
        @JsonProperty("is_valid")          boolean isValid,
        @JsonProperty("resolved_selector") String resolvedSelector,
        @JsonProperty("source")            ResolutionSource source,
        @JsonProperty("requires_review")   boolean requiresReview,
        @JsonProperty("matches")           List<SelectorMatch> matches,
        @JsonProperty("message")           String message,
        @JsonProperty("offered_options")   List<String> offeredOptions) {

    public ResolutionResult {
        matches        = matches != null ? List.copyOf(matches) : List.of();
        offeredOptions = offeredOptions != null ? List.copyOf(offeredOptions) : List.of();
    }

    // ── Factories ─────────────────────────────────────────────────────────

    /** No element was named, so no selector is needed. */
    public static ResolutionResult noElement() {
        return new ResolutionResult(ResolutionStatus.NOT_FOUND, true, null, ResolutionSource.NONE,
                false, null, null, null);
    }

    public static ResolutionResult foundInDb(String selector, List<SelectorMatch> matches) {
        return new ResolutionResult(ResolutionStatus.FOUND_IN_DB, true, selector, ResolutionSource.DATABASE,
                false, matches, null, null);
    }

    public static ResolutionResult userProvided(String selector, String message) {
        return new ResolutionResult(ResolutionStatus.VALID_BUT_NOT_IN_DB, true, selector,
                ResolutionSource.USER_PROVIDED, true, null, message, null);
    }

    public static ResolutionResult multipleMatches(List<SelectorMatch> matches, String message) {
        List<String> options = new ArrayList<>();
        for (SelectorMatch m : matches) {
            options.add(m.selector());
        }
        return new ResolutionResult(ResolutionStatus.MULTIPLE_MATCHES, false, null, ResolutionSource.NONE,
                false, matches, message, options);
    }

    public static ResolutionResult notFound(String message) {
        return new ResolutionResult(ResolutionStatus.NOT_FOUND, false, null, ResolutionSource.NONE,
                false, null, message, null);
    }

    public static ResolutionResult invalidChoice(List<SelectorMatch> matches, String message) {
        return new ResolutionResult(ResolutionStatus.INVALID_CHOICE, false, null, ResolutionSource.NONE,
                false, matches, message, null);
    }

    @JsonIgnore
    public boolean isResolved() {
        return resolvedSelector != null;
    }
}
