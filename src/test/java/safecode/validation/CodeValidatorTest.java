package safecode.validation;

import org.testng.annotations.Test;
import safecode.catalog.SelectorCatalog;
import safecode.model.CodeRule;
import safecode.model.PageType;
import safecode.model.RuleType;
import safecode.model.SelectorCatalogEntry;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class CodeValidatorTest {

    private final CodeValidator validator = new CodeValidator();

    // ── Rules ─────────────────────────────────────────────────────────────

    @Test
    public void validate_forbiddenPattern_isReported() {
        String code = "eval('x');\ndocument.querySelector('.product-title');";

        ValidationResult result = validator.validate(code, List.of(CodeRule.forbidden("eval(")), List.of(".product-title"));

        assertThat(result.ruleViolations()).containsExactly("Found forbidden pattern: eval(");
        assertThat(result.invalidSelectors()).isEmpty();
        assertThat(result.isValid()).isFalse();
    }

    @Test
    public void validate_forbiddenPattern_ignoresCase() {
        ValidationResult result = validator.validate("Document.Write('hi');",
                List.of(CodeRule.forbidden("document.write")), List.of());

        assertThat(result.ruleViolations()).containsExactly("Found forbidden pattern: document.write");
    }

    @Test(description = "Required patterns and length limits are not checked unless enabled")
    public void validate_extendedRules_offByDefault() {
        List<CodeRule> rules = List.of(
                CodeRule.required("use strict"),
                new CodeRule(RuleType.MAX_LENGTH, "5", 1));

        assertThat(validator.validate("var a = 1;", rules, List.of()).isValid()).isTrue();
    }

    @Test
    public void validate_extendedRules_whenEnabled() {
        CodeValidator strict = new CodeValidator(true);
        String code = "var a = 1;";
        List<CodeRule> rules = List.of(
                CodeRule.required("use strict"),
                new CodeRule(RuleType.MAX_LENGTH, "5", 1),
                new CodeRule(RuleType.MIN_LENGTH, "1000", 1),
                new CodeRule(RuleType.MAX_LENGTH, "not-a-number", 1));

        ValidationResult result = strict.validate(code, rules, List.of());

        assertThat(result.ruleViolations()).containsExactly(
                "Missing required pattern: use strict",
                "Code length 10 exceeds maximum 5",
                "Code length 10 is below minimum 1000");
    }

    @Test
    public void validate_rulesWithUnknownType_areSkipped() {
        ValidationResult result = validator.validate("eval(1)", List.of(new CodeRule(null, "eval(", 1)), List.of());

        assertThat(result.isValid()).isTrue();
    }

    // ── Selectors ─────────────────────────────────────────────────────────

    @Test
    public void extractUsedSelectors_allCallForms_inFirstSeenOrder() {
        String code = """
                document.querySelector('#a');
                document.querySelectorAll(".b");
                document.getElementById('c');
                el.classList['d'];
                var cls = '.e';
                """;

        assertThat(validator.extractUsedSelectors(code)).containsExactly("#a", ".b", "#c", "d", ".e");
    }

    @Test
    public void validate_catalogSelectors_areAccepted() {
        SelectorCatalog catalog = SelectorCatalog.of(1, PageType.PDP, List.of(
                SelectorCatalogEntry.active(1, PageType.PDP, ".product-title", "Product title"),
                SelectorCatalogEntry.active(1, PageType.PDP, "#product-image", "Product image")));
        String code = "document.querySelector('.product-title'); document.getElementById('product-image');";

        ValidationResult result = validator.validate(code, List.of(), catalog);

        assertThat(result.isValid()).isTrue();
        assertThat(ValidationStatus.of(result)).isEqualTo(ValidationStatus.PASSED);
    }

    @Test(description = "A selector that is a fragment of a catalogued one is tolerated")
    public void validate_substringOfApprovedSelector_isTolerated() {
        List<String> approved = List.of(".checkout-button");

        assertThat(validator.validate("document.querySelector('.button')", null, approved).isValid()).isTrue();
        assertThat(validator.validate("document.querySelector('.checkout-button span')", null, approved).isValid())
                .isTrue();
        assertThat(validator.validate("document.querySelector('#promo')", null, approved).invalidSelectors())
                .containsExactly("#promo");
    }

    @Test(description = "Attribute selectors with inner quotes are extracted and checked")
    public void validate_attributeSelectorWithInnerQuotes_isChecked() {
        List<String> approved = List.of("button[data-test-id='add-to-cart']");

        ValidationResult bogus = validator.validate(
                "document.querySelector(\"button[data-test-id='bogus-widget']\").click();", null, approved);
        ValidationResult known = validator.validate(
                "document.querySelectorAll( \"button[data-test-id='add-to-cart']\" );", null, approved);

        assertThat(bogus.invalidSelectors()).containsExactly("button[data-test-id='bogus-widget']");
        assertThat(bogus.isValid()).isFalse();
        assertThat(known.isValid()).isTrue();
        assertThat(validator.extractUsedSelectors("el.querySelector('a[href=\"/cart\"]')"))
                .containsExactly("a[href=\"/cart\"]");
    }

    @Test(description = "getElementById ids are compared with their # prefix")
    public void validate_elementById_isComparedAsIdSelector() {
        assertThat(validator.validate("document.getElementById('x');", null, List.of(".x-thing")).invalidSelectors())
                .containsExactly("#x");
        assertThat(validator.validate("document.getElementById('x');", null, List.of("#x-thing")).isValid())
                .isTrue();
    }

    @Test
    public void validate_emptyCatalog_everyUsedSelectorIsInvalid() {
        ValidationResult result = validator.validate("document.querySelector('.x');", List.of(), List.of());

        assertThat(result.invalidSelectors()).containsExactly(".x");
        assertThat(result.hasRuleViolations()).isFalse();
        assertThat(ValidationStatus.of(result)).isEqualTo(ValidationStatus.WARNING);
    }

    @Test
    public void validate_blankApprovedSelectors_doNotApproveEverything() {
        ValidationResult result = validator.validate("document.querySelector('.x');", null, List.of("", "  "));

        assertThat(result.invalidSelectors()).containsExactly(".x");
    }

    @Test
    public void validate_nullInputs_areClean() {
        assertThat(validator.validate(null, null, (List<String>) null)).isEqualTo(ValidationResult.clean());
    }
}
