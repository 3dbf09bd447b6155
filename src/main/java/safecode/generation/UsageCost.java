package safecode.generation;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Token pricing in USD per million tokens.
 */
public record UsageCost(double inputPerMillion, double outputPerMillion) {

    private static final double MILLION = 1_000_000.0;

    public static UsageCost defaults() {
        return new UsageCost(3.0, 15.0);
    }

    /** Cost of one call, rounded half-up to four decimals. */
    public double cost(int promptTokens, int completionTokens) {
        double raw = promptTokens / MILLION * inputPerMillion + completionTokens / MILLION * outputPerMillion;
        return BigDecimal.valueOf(raw).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }
}
