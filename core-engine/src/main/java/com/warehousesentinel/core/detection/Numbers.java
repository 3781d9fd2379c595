package com.warehousesentinel.core.detection;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Number formatting for anomaly messages and context values.
 */
final class Numbers {

    private Numbers() {
        // utility class, not instantiable
    }

    /**
     * @return shortest plain rendering: {@code 5} rather than {@code 5.0},
     *         {@code 0.01} rather than {@code 1.0E-2}
     */
    static String plain(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        return decimal.scale() < 0 ? decimal.setScale(0).toPlainString() : decimal.toPlainString();
    }

    /**
     * @return {@code value} with exactly two decimals, e.g. {@code 49.00}
     */
    static String fixed2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    /**
     * @return {@code value} rounded to two decimals
     */
    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
