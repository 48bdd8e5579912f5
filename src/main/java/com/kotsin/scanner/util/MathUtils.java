package com.kotsin.scanner.util;

/**
 * MathUtils - Safe arithmetic for price ratios and scores.
 *
 * USAGE:
 * Instead of: double ratio = cd / ab;
 * Use: double ratio = MathUtils.safeDivide(cd, ab, 0.0);
 */
public final class MathUtils {

    private MathUtils() {} // Prevent instantiation

    private static final double EPSILON = 1e-10;

    // ======================== SAFE DIVISION ========================

    /**
     * Safe division that returns defaultValue if denominator is 0, NaN, or Infinity
     */
    public static double safeDivide(double numerator, double denominator, double defaultValue) {
        if (!isValidDenominator(denominator)) {
            return defaultValue;
        }
        double result = numerator / denominator;
        if (!isValidNumber(result)) {
            return defaultValue;
        }
        return result;
    }

    public static boolean isValidDenominator(double value) {
        return isValidNumber(value) && Math.abs(value) > EPSILON;
    }

    public static boolean isValidNumber(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value);
    }

    public static boolean isValidNumber(Double value) {
        return value != null && isValidNumber(value.doubleValue());
    }

    // ======================== COMPARISON ========================

    public static boolean isZero(double value) {
        return Math.abs(value) <= EPSILON;
    }

    /**
     * |a - b| <= tolerance x reference, the proximity test used for Fibonacci levels.
     */
    public static boolean withinTolerance(double a, double b, double tolerance, double reference) {
        return Math.abs(a - b) <= tolerance * Math.abs(reference) + EPSILON;
    }

    // ======================== CLAMPING ========================

    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    public static double clampPercentage(double value) {
        return clamp(value, 0.0, 100.0);
    }

    public static double clampConfidence(double value) {
        return clamp(value, 0.0, 1.0);
    }

    // ======================== STATISTICS ========================

    /**
     * Population standard deviation; 0 for fewer than two values.
     */
    public static double safeStdDev(double[] values) {
        if (values == null || values.length < 2) {
            return 0.0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        double mean = sum / values.length;
        double sq = 0;
        for (double v : values) {
            sq += (v - mean) * (v - mean);
        }
        double result = Math.sqrt(sq / values.length);
        return isValidNumber(result) ? result : 0.0;
    }
}
