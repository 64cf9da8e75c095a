package org.broadinstitute.refloci.utils.param;

/**
 * Numeric argument checks. Each method returns its input so it can be used inline in assignments.
 */
public final class ParamUtils {
    private ParamUtils () {}

    /**
     * Checks that the input is within range and returns the same value or throws an {@link IllegalArgumentException}
     * @param val value to check
     * @param min minimum value for val (inclusive)
     * @param max maximum value for val (inclusive)
     * @param message the text message that would be pass to the exception thrown when val lt min or val gt max.
     * @return the same value
     * @throws IllegalArgumentException
     */
    public static int inRange(final int val, final int min, final int max, final String message) {
        if ((val >= min) && (val <= max)) {
            return val;
        } else {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Checks that the input is positive or zero and returns the same value or throws an {@link IllegalArgumentException}
     */
    public static int isPositiveOrZero(final int val, final String message) {
        if (val < 0) {
            throw new IllegalArgumentException(message);
        }
        return val;
    }

    public static long isPositiveOrZero(final long val, final String message) {
        if (val < 0) {
            throw new IllegalArgumentException(message);
        }
        return val;
    }

    public static int isPositive(final int val, final String message) {
        if (val <= 0) {
            throw new IllegalArgumentException(message);
        }
        return val;
    }
}
