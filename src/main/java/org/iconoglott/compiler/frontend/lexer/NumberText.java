package org.iconoglott.compiler.frontend.lexer;

import java.math.BigDecimal;

/**
 * Formats numbers the way they appear in source and in rendered output: integral
 * values without a fraction, everything else in plain notation without trailing zeros.
 */
public final class NumberText {

    private NumberText() {
        // Utility class
    }

    /**
     * Formats a number.
     * @param value The number.
     * @return The shortest plain decimal text, e.g. {@code 10}, {@code 2.5} or {@code -0.25}.
     */
    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return "0";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            long asLong = (long) value;
            return Long.toString(asLong);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
