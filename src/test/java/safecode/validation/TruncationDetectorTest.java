package safecode.validation;

import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class TruncationDetectorTest {

    private final TruncationDetector detector = new TruncationDetector();

    @Test
    public void unfinishedCall_isTruncated() {
        String code = "const observer = new IntersectionObserver(cb);\nobserver.observe(";

        assertThat(detector.isTruncated(code)).isTrue();
        assertThat(detector.diagnose(code)).isEqualTo("ends mid-statement");
    }

    @Test
    public void completeIife_isNotTruncated() {
        String code = "(function() {\n  document.querySelector('.x');\n})();\n";

        assertThat(detector.isTruncated(code)).isFalse();
        assertThat(detector.diagnose(code)).isNull();
    }

    @Test
    public void unbalancedBraces() {
        String code = "function a() {\n  if (x) {\n    y();\n}";

        assertThat(detector.diagnose(code)).isEqualTo("unbalanced braces");
    }

    @Test
    public void unbalancedParentheses() {
        assertThat(detector.diagnose("foo(bar(1);")).isEqualTo("unbalanced parentheses");
    }

    @Test(description = "A dangling assignment near the end is caught even when the last line is fine")
    public void unfinishedDeclarationInTail() {
        String code = "const total = price * qty\nfoo();";

        assertThat(detector.diagnose(code)).isEqualTo("unfinished line: const total = price * qty");
    }

    @Test
    public void blankCode_isNotTruncated() {
        assertThat(detector.isTruncated("")).isFalse();
        assertThat(detector.isTruncated("   \n")).isFalse();
        assertThat(detector.isTruncated(null)).isFalse();
    }
}
