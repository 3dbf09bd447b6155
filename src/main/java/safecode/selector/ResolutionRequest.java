package safecode.selector;

import safecode.model.ConversationTurn;
import safecode.model.PageType;

import java.util.ArrayList;
import java.util.List;

/**
 * Input to {@link SelectorResolver}.
 *
 * @param elementDescription  what the user wants to change, e.g. "add to cart button"
 * @param pageType            page the element lives on
 * @param brandId             owning brand
 * @param userMessage         raw text of the current message; may be {@code null}
 * @param conversationContext prior turns, most recent last; {@code null} and null turns are dropped
 */
public record ResolutionRequest(
        String elementDescription,
        PageType pageType,
        long brandId,
        String userMessage,
        List<ConversationTurn> conversationContext) {

    public ResolutionRequest {
        conversationContext = withoutNulls(conversationContext);
    }

    private static List<ConversationTurn> withoutNulls(List<ConversationTurn> turns) {
        if (turns == null) return List.of();
        List<ConversationTurn> kept = new ArrayList<>(turns.size());
        for (ConversationTurn t : turns) {
            if (t != null) kept.add(t);
        }
        return List.copyOf(kept);
    }

    /** A request with no chat message and no history. */
    public static ResolutionRequest of(String elementDescription, PageType pageType, long brandId) {
        return new ResolutionRequest(elementDescription, pageType, brandId, null, null);
    }

    public ResolutionRequest withMessage(String message) {
        return new ResolutionRequest(elementDescription, pageType, brandId, message, conversationContext);
    }

    public ResolutionRequest withContext(List<ConversationTurn> context) {
        return new ResolutionRequest(elementDescription, pageType, brandId, userMessage, context);
    }

    /** Wraps legacy raw-string history as {@link ConversationTurn#text(String)} turns. */
    public ResolutionRequest withTextContext(List<String> messages) {
        List<ConversationTurn> turns = new ArrayList<>();
        if (messages != null) {
            for (String m : messages) {
                turns.add(ConversationTurn.text(m));
            }
        }
        return withContext(turns);
    }
}
