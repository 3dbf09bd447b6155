package safecode.selector;

import safecode.model.PageType;
import safecode.model.SelectorCatalogEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * User-facing text attached to {@link ResolutionResult#message()}.
 *
 * <p>The multiple-matches wording is also what {@link SelectorResolver}
 * recognises in legacy text history, so the two phrases in
 * {@link #DISAMBIGUATION_MARKERS} must stay in {@link #multipleMatches}.
 */
public final class ResolutionMessages {

    /** Lower-case phrases that mark an earlier message as a disambiguation prompt. */
    public static final List<String> DISAMBIGUATION_MARKERS =
            List.of("found multiple selectors", "which selector should i use");

    static final int MAX_LISTED = 5;

    private static final String DIRECT_SELECTOR_HINT =
            "Alternatively, if you know the CSS selector, you can provide it directly "
                    + "(e.g., \".product-title\" or \"#product-name\").";

    private ResolutionMessages() {}

    /** Numbered candidate list in the {@code "i. description (selector: X)"} format. */
    public static String multipleMatches(String elementDescription, List<SelectorMatch> matches) {
        StringBuilder sb = new StringBuilder();
        sb.append("I found multiple selectors that might match \"").append(elementDescription).append("\":\n\n");
        int n = Math.min(matches.size(), MAX_LISTED);
        for (int i = 0; i < n; i++) {
            SelectorCatalogEntry e = matches.get(i).entry();
            String label = e.hasDescription() ? e.getDescription() : e.getSelector();
            sb.append(i + 1).append(". ").append(label)
              .append(" (selector: ").append(e.getSelector()).append(")\n");
        }
        sb.append("\nWhich selector should I use? You can either:\n")
          .append("- Specify the number (e.g., \"use selector 1\")\n")
          .append("- Provide the exact selector value (e.g., \"")
          .append(matches.isEmpty() ? "#element-id" : matches.get(0).selector()).append("\")\n")
          .append("- Or provide a more specific description of the element");
        return sb.toString();
    }

    /** The catalog holds nothing for this page: walk the user through inspecting the element. */
    public static String noSelectorsConfigured(String elementDescription, PageType pageType) {
        String page = pageLabel(pageType);
        return "No selectors are configured for the " + page + " page yet.\n\n"
                + "To help me generate accurate code, please:\n"
                + "1. Open the " + page + " page in your browser\n"
                + "2. Right-click on the " + elementDescription + "\n"
                + "3. Select \"Inspect\" or \"Inspect Element\"\n"
                + "4. Copy the CSS selector or the relevant HTML\n\n"
                + "Then paste it here, and I'll generate the code with the correct selector.\n\n"
                + DIRECT_SELECTOR_HINT;
    }

    /**
     * Nothing matched but the page has selectors: list up to five of them as
     * {@code "i. selector - description"}, described ones first.
     */
    public static String notFoundWithOptions(String elementDescription, PageType pageType,
                                             List<SelectorCatalogEntry> available) {
        String page = pageLabel(pageType);
        List<SelectorCatalogEntry> shown = pickHints(available);

        StringBuilder sb = new StringBuilder();
        sb.append("I couldn't find an exact match for \"").append(elementDescription)
          .append("\" on the ").append(page).append(" page.");
        if (shown.isEmpty()) {
            sb.append("\n\nNo selectors are configured for the ").append(page).append(" page yet.")
              .append("\n\nTo help me generate accurate code, please paste the relevant HTML or provide a CSS selector.");
        } else {
            sb.append("\n\nHere are some selectors available on the ").append(page).append(" page:\n\n");
            for (int i = 0; i < shown.size(); i++) {
                SelectorCatalogEntry e = shown.get(i);
                sb.append(i + 1).append(". ").append(e.getSelector()).append(" - ")
                  .append(e.hasDescription() ? e.getDescription() : "No description").append('\n');
            }
            sb.append("\nWould any of these work for your request?")
              .append("\n\nOr you can paste HTML from the page to discover new selectors.");
        }
        sb.append("\n\n").append(DIRECT_SELECTOR_HINT);
        return sb.toString();
    }

    public static String invalidChoice(int optionCount) {
        return "I only found " + optionCount + " selectors. Please choose a number between 1 and "
                + optionCount + ".";
    }

    public static String userProvided(String selector) {
        return "Using selector '" + selector + "' (not in database, will be flagged for admin review)";
    }

    /** True when {@code message} reads like a {@link #multipleMatches} prompt. */
    public static boolean isDisambiguationPrompt(String message) {
        if (message == null) return false;
        String lower = message.toLowerCase(Locale.ROOT);
        for (String marker : DISAMBIGUATION_MARKERS) {
            if (lower.contains(marker)) return true;
        }
        return false;
    }

    static List<SelectorCatalogEntry> pickHints(List<SelectorCatalogEntry> available) {
        List<SelectorCatalogEntry> shown = new ArrayList<>();
        for (SelectorCatalogEntry e : available) {
            if (shown.size() >= MAX_LISTED) break;
            if (e.hasDescription()) shown.add(e);
        }
        for (SelectorCatalogEntry e : available) {
            if (shown.size() >= MAX_LISTED) break;
            if (!shown.contains(e)) shown.add(e);
        }
        return shown;
    }

    private static String pageLabel(PageType pageType) {
        return pageType == null ? "UNKNOWN" : pageType.value().toUpperCase(Locale.ROOT);
    }
}
