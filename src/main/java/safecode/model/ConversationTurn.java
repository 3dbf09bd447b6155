package safecode.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One prior message in a selector conversation.
 *
 * <p>Assistant turns that asked the user to pick between candidates carry the
 * offered selectors in display order, so a later "use 2" can be answered
 * without re-parsing the message text. Legacy history that only has raw
 * strings is wrapped with {@link #text(String)}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConversationTurn(
        @JsonProperty("role")            Role role,
        @JsonProperty("content")         String content,
        @JsonProperty("offered_options") List<String> offeredOptions) {

    public enum Role {
        @JsonProperty("user")        USER,
        @JsonProperty("assistant")   ASSISTANT,
        @JsonProperty("unspecified") UNSPECIFIED
    }

    @JsonCreator
    public ConversationTurn {
        role           = role != null ? role : Role.UNSPECIFIED;
        content        = content != null ? content : "";
        offeredOptions = offeredOptions != null ? List.copyOf(offeredOptions) : List.of();
    }

    /** Wraps a raw history string whose author is not known. */
    public static ConversationTurn text(String content) {
        return new ConversationTurn(Role.UNSPECIFIED, content, null);
    }

    public static ConversationTurn user(String content) {
        return new ConversationTurn(Role.USER, content, null);
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn(Role.ASSISTANT, content, null);
    }

    /** An assistant disambiguation prompt with the numbered options it offered. */
    public static ConversationTurn assistant(String content, List<String> offeredOptions) {
        return new ConversationTurn(Role.ASSISTANT, content, offeredOptions);
    }

    public boolean hasOfferedOptions() {
        return !offeredOptions.isEmpty();
    }
}
