package com.borderwatch.core.detection;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Number rendering for anomaly reasons.
 *
 * <p>
 * Values use their shortest round-trip digits in plain notation for decimal
 * exponents from -4 to 15 and scientific notation ({@code 1.5e+16},
 * {@code 5e-05}) outside that range.
 * </p>
 */
final class ReasonFormat {

    private static final int MIN_PLAIN_EXPONENT = -4;
    private static final int MAX_PLAIN_EXPONENT = 15;

    private ReasonFormat() {
        // utility class - not instantiable
    }

    /**
     * Render a value with its shortest round-trip digits. Whole numbers keep
     * one decimal ({@code 100.0}, {@code 12000000.0}).
     */
    static String number(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == 0.0) {
            return 1.0 / value < 0 ? "-0.0" : "0.0";
        }

        BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        int exponent = decimal.precision() - decimal.scale() - 1;
        if (exponent < MIN_PLAIN_EXPONENT || exponent > MAX_PLAIN_EXPONENT) {
            return scientific(decimal, exponent);
        }
        String plain = decimal.toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    /**
     * @return {@code value} rounded half-even to two decimals from its exact
     *         binary value, e.g. {@code 1.005 -> 1.00}
     */
    static String twoDecimals(double value) {
        String rounded = new BigDecimal(value).setScale(2, RoundingMode.HALF_EVEN).toPlainString();
        // -0.001 rounds to a negative zero
        if (value < 0 && !rounded.startsWith("-")) {
            return "-" + rounded;
        }
        return rounded;
    }

    private static String scientific(BigDecimal decimal, int exponent) {
        String digits = decimal.unscaledValue().abs().toString();
        StringBuilder out = new StringBuilder();
        if (decimal.signum() < 0) {
            out.append('-');
        }
        out.append(digits.charAt(0));
        if (digits.length() > 1) {
            out.append('.').append(digits, 1, digits.length());
        }
        out.append('e').append(exponent < 0 ? '-' : '+');
        int magnitude = Math.abs(exponent);
        if (magnitude < 10) {
            out.append('0');
        }
        return out.append(magnitude).toString();
    }
}
