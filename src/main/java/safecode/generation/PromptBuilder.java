package safecode.generation;

import safecode.model.BrandProfile;
import safecode.model.CodeRule;
import safecode.model.CodeTemplate;
import safecode.model.RuleType;
import safecode.model.SelectorCatalogEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles the code-generation prompt from brand context: approved
 * selectors, code rules, the reference template and the test description.
 *
 * <p>Brands with a global template get the stricter variant that asks the
 * generator to keep the template's structure and placeholders.
 */
public class PromptBuilder {

    private static final String OUTPUT_FORMAT = """
            CRITICAL OUTPUT FORMAT:
            Return ONLY the raw JavaScript code.
            Do NOT wrap it in JSON with fields like "generated_code" or "implementation_notes".
            Do NOT include markdown code blocks.
            Do NOT include explanatory text or metadata.

            The response must be executable JavaScript that starts with comments and ends with the closing brace, e.g.
            'use strict';
            (function() {
              // code
            })();
            """;

    private static final String GLOBAL_TEMPLATE_RULES = """
            INSTRUCTIONS FOR GLOBAL TEMPLATE:
            1. Follow the exact structure of the global template above
            2. Keep all section dividers, configuration variables and logging utilities
            3. Keep the utils.waitForElement() wrapper and all try/catch blocks
            4. Keep the placeholders {test_id}, {summary}, {version}, {date}, {features} as written
            5. Place page-specific code ONLY in the 'PAGE-SPECIFIC CODE GOES HERE' section
            6. Use the log() utility with LOG_PREFIX instead of console.log
            """;

    /**
     * @param brand     brand name, domain and optional global template
     * @param selectors approved selectors for the page
     * @param rules     brand code rules
     * @param templates page templates; only the first is used
     * @param testDescription what the test should do
     */
    public String build(BrandProfile brand, List<SelectorCatalogEntry> selectors, List<CodeRule> rules,
                        List<CodeTemplate> templates, String testDescription) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are a JavaScript code generator for A/B testing. Generate safe, production-ready ")
          .append("JavaScript code for the ").append(brand.name()).append(" brand (").append(brand.domain())
          .append(").\n\n");

        appendSelectors(sb, selectors);
        sb.append('\n');
        appendRules(sb, rules);
        sb.append('\n');
        CodeTemplate template = templates == null || templates.isEmpty() ? null : templates.get(0);
        if (brand.hasGlobalTemplate()) {
            appendGlobalTemplate(sb, brand.globalTemplate(), template);
        } else {
            appendPageTemplate(sb, template);
        }

        sb.append("\nTest Description:\n").append(testDescription).append("\n\n");

        sb.append("Requirements:\n");
        List<String> requirements = new ArrayList<>();
        if (brand.hasGlobalTemplate()) {
            requirements.add("Follow the exact structure of the global template");
        }
        requirements.add("Do NOT use eval(), innerHTML, document.write() or any forbidden pattern");
        requirements.add("Use only the available DOM selectors listed above");
        requirements.add(brand.hasGlobalTemplate()
                ? "Place page-specific logic only in the designated section"
                : "Follow the template structure and patterns shown");
        requirements.add("Keep the code production-ready and comment key logic");
        for (int i = 0; i < requirements.size(); i++) {
            sb.append(i + 1).append(". ").append(requirements.get(i)).append('\n');
        }

        sb.append('\n').append(OUTPUT_FORMAT);
        return sb.toString();
    }

    private static void appendSelectors(StringBuilder sb, List<SelectorCatalogEntry> selectors) {
        sb.append("Available DOM Selectors:\n");
        if (selectors == null || selectors.isEmpty()) {
            sb.append("- No selectors available for this page type\n");
            return;
        }
        for (SelectorCatalogEntry e : selectors) {
            sb.append("- ").append(e.getSelector());
            if (e.hasDescription()) sb.append(" (").append(e.getDescription()).append(')');
            sb.append('\n');
        }
    }

    private static void appendRules(StringBuilder sb, List<CodeRule> rules) {
        List<String> forbidden = new ArrayList<>();
        List<String> required  = new ArrayList<>();
        if (rules != null) {
            for (CodeRule r : rules) {
                if (r.ruleType() == RuleType.FORBIDDEN_PATTERN) forbidden.add(r.ruleContent());
                if (r.ruleType() == RuleType.REQUIRED_PATTERN)  required.add(r.ruleContent());
            }
        }
        sb.append("Code Rules:\n");
        if (!forbidden.isEmpty()) {
            sb.append("FORBIDDEN Patterns (DO NOT USE):\n");
            forbidden.forEach(p -> sb.append("- ").append(p).append('\n'));
        }
        if (!required.isEmpty()) {
            sb.append("REQUIRED Patterns:\n");
            required.forEach(p -> sb.append("- ").append(p).append('\n'));
        }
        if (forbidden.isEmpty() && required.isEmpty()) {
            sb.append("- No specific rules defined\n");
        }
    }

    private static void appendGlobalTemplate(StringBuilder sb, String globalTemplate, CodeTemplate page) {
        sb.append("GLOBAL TEMPLATE (company-wide structure, MUST FOLLOW EXACTLY):\n```javascript\n")
          .append(globalTemplate).append("\n```\n\n")
          .append(GLOBAL_TEMPLATE_RULES);
        if (page != null) {
            sb.append("\nPAGE TEMPLATE (reference for page-specific logic):\n")
              .append("Test Type: ").append(testType(page)).append('\n')
              .append("```javascript\n").append(page.templateCode()).append("\n```\n");
        }
    }

    private static void appendPageTemplate(StringBuilder sb, CodeTemplate page) {
        sb.append("Template Example:\n");
        if (page == null) {
            sb.append("No template available - generate safe JavaScript following best practices\n");
            return;
        }
        sb.append("Test Type: ").append(testType(page)).append('\n')
          .append("Template Code:\n```javascript\n").append(page.templateCode()).append("\n```\n");
    }

    private static String testType(CodeTemplate t) {
        return t.testType() != null ? t.testType().value() : "unknown";
    }
}
