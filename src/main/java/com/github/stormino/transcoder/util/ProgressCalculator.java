package com.github.stormino.transcoder.util;

import lombok.experimental.UtilityClass;

/**
 * Utility class for conversion progress calculations.
 */
@UtilityClass
public class ProgressCalculator {

    /**
     * Calculate the fraction of the media processed.
     *
     * @param secondsProcessed Media seconds processed so far
     * @param totalSeconds Total media duration
     * @return Fraction (1.0 when complete), or null if calculation not possible
     *         or the inputs are not finite
     */
    public static Double calculateFraction(double secondsProcessed, double totalSeconds) {
        if (totalSeconds <= 0 || secondsProcessed < 0) {
            return null;
        }
        double fraction = secondsProcessed / totalSeconds;
        return Double.isFinite(fraction) ? fraction : null;
    }

    /**
     * Estimate the remaining wall-clock time by linear extrapolation:
     * {@code elapsed * (total / processed) - elapsed}. Unstable at low progress.
     *
     * @param elapsedSeconds Wall-clock seconds since the conversion started
     * @param totalSeconds Total media duration
     * @param secondsProcessed Media seconds processed so far
     * @return Remaining seconds, or null until some media has been processed
     */
    public static Double estimateRemainingSeconds(double elapsedSeconds, double totalSeconds, double secondsProcessed) {
        if (secondsProcessed <= 0 || totalSeconds <= 0) {
            return null;
        }
        return elapsedSeconds * (totalSeconds / secondsProcessed) - elapsedSeconds;
    }

    /**
     * Convert a fraction to a percentage rounded to two decimals.
     *
     * @param fraction Fraction, may be null
     * @return Percentage, or null for a null, negative or non-finite fraction
     */
    public static Double toPercentage(Double fraction) {
        if (fraction == null || fraction < 0 || !Double.isFinite(fraction)) {
            return null;
        }
        return round2(fraction * 100.0);
    }

    /**
     * Round a non-negative value to two decimals.
     *
     * @param value Value, may be null
     * @return Rounded value, or null for a null, negative or non-finite value
     */
    public static Double roundNonNegative(Double value) {
        if (value == null || value < 0 || !Double.isFinite(value)) {
            return null;
        }
        return round2(value);
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
