// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.common.utils;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import java.util.Objects;

/** A utility class used to assert various preconditions. */
public final class Preconditions {
    private static final String DEFAULT_NOT_BLANK_MESSAGE = "The input String is required to be non-blank.";
    private static final String DEFAULT_REQUIRE_POSITIVE_MESSAGE = "The input number [%d] is required to be positive.";
    private static final String DEFAULT_REQUIRE_WHOLE_MESSAGE =
            "The input number [%d] is required to be a whole number.";
    private static final String DEFAULT_REQUIRE_IN_RANGE_MESSAGE =
            "The input number [%d] is required to be in the range [%d, %d] boundaries included.";
    private static final String DEFAULT_REQUIRE_POSITIVE_DURATION_MESSAGE =
            "The input duration [%s] is required to be positive.";

    /**
     * This method asserts a given {@link String} is not blank.
     * A blank {@link String} is one that is either {@code null} or contains
     * only whitespaces as defined by {@link String#isBlank()}. If the given
     * {@link String} is not blank, then we return it, else we throw
     * {@link IllegalArgumentException}.
     *
     * @param toCheck a {@link String} to be checked if is blank as defined above
     * @return the {@link String} to be checked if it is not blank as defined above
     * @throws IllegalArgumentException if the input {@link String} to be
     * checked is blank
     */
    public static String requireNotBlank(final String toCheck) {
        return requireNotBlank(toCheck, DEFAULT_NOT_BLANK_MESSAGE);
    }

    /**
     * This method asserts a given {@link String} is not blank.
     *
     * @param toCheck a {@link String} to be checked if is blank
     * @param errorMessage the error message to be used in the exception if the
     * input {@link String} to be checked is blank, if null, a default message
     * will be used
     * @return the {@link String} to be checked if it is not blank
     * @throws IllegalArgumentException if the input {@link String} to be
     * checked is blank
     */
    public static String requireNotBlank(final String toCheck, final String errorMessage) {
        if (StringUtilities.isBlank(toCheck)) {
            final String message = Objects.requireNonNullElse(errorMessage, DEFAULT_NOT_BLANK_MESSAGE);
            throw new IllegalArgumentException(message);
        } else {
            return toCheck;
        }
    }

    /**
     * This method asserts a given integer is a positive.
     *
     * @param toCheck the number to check if it is a positive power of two
     * @return the number to check if it is positive
     * @throws IllegalArgumentException if the input number to check is not
     * positive
     */
    public static int requirePositive(final int toCheck) {
        return requirePositive(toCheck, null);
    }

    /**
     * This method asserts a given integer is a positive.
     *
     * @param toCheck the number to check if it is a positive power of two
     * @param errorMessage the error message to be used in the exception if the
     * input integer to check is not positive, if null, a default message will
     * be used
     * @return the number to check if it is positive
     * @throws IllegalArgumentException if the input number to check is not
     * positive
     */
    public static int requirePositive(final int toCheck, final String errorMessage) {
        if (0 >= toCheck) {
            final String message = Objects.requireNonNullElse(
                    errorMessage, DEFAULT_REQUIRE_POSITIVE_MESSAGE.formatted(toCheck));
            throw new IllegalArgumentException(message);
        } else {
            return toCheck;
        }
    }

    /**
     * This method asserts a given long is a whole number. A long is whole
     * if it is greater or equal to zero.
     *
     * @param toCheck the long to check if it is a whole number
     * @return the number to check if it is whole number
     * @throws IllegalArgumentException if the input number to check is not
     * positive
     */
    public static long requireWhole(final long toCheck) {
        return requireWhole(toCheck, null);
    }

    /**
     * This method asserts a given long is a whole number. A long is whole
     * if it is greater or equal to zero.
     *
     * @param toCheck the long to check if it is a whole number
     * @param errorMessage the error message to be used in the exception if the
     * input long to check is not a whole number, if null, a default message will
     * be used
     * @return the number to check if it is whole number
     * @throws IllegalArgumentException if the input number to check is not
     * positive
     */
    public static long requireWhole(final long toCheck, final String errorMessage) {
        if (toCheck >= 0) {
            return toCheck;
        }
        final String message =
                Objects.requireNonNullElse(errorMessage, DEFAULT_REQUIRE_WHOLE_MESSAGE.formatted(toCheck));
        throw new IllegalArgumentException(message);
    }

    /**
     * This method asserts a given int is within a range (boundaries included).
     *
     * @param toCheck the number to check if it is within the range
     * @param lowerBoundary the lower boundary
     * @param upperBoundary the upper boundary
     * @return the number to check if it is within the range
     * @throws IllegalArgumentException if the input number to check is not
     * within the range
     */
    public static int requireInRange(final int toCheck, final int lowerBoundary, final int upperBoundary) {
        return requireInRange(toCheck, lowerBoundary, upperBoundary, null);
    }

    /**
     * This method asserts a given int is within a range (boundaries included).
     *
     * @param toCheck the number to check if it is within the range
     * @param lowerBoundary the lower boundary
     * @param upperBoundary the upper boundary
     * @param errorMessage the error message to be used if the check fails,
     * if null, a default message will be used
     * @return the number to check if it is within the range
     * @throws IllegalArgumentException if the input number to check is not
     * within the range
     */
    public static int requireInRange(
            final int toCheck, final int lowerBoundary, final int upperBoundary, final String errorMessage) {
        if (toCheck >= lowerBoundary && toCheck <= upperBoundary) {
            return toCheck;
        } else {
            final String message = Objects.requireNonNullElse(
                    errorMessage, DEFAULT_REQUIRE_IN_RANGE_MESSAGE.formatted(toCheck, lowerBoundary, upperBoundary));
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * This method asserts a given {@link Duration} is strictly positive.
     *
     * @param toCheck the duration to check
     * @return the duration to check if it is positive
     * @throws NullPointerException if the input duration is null
     * @throws IllegalArgumentException if the input duration is zero or negative
     */
    public static Duration requirePositive(@NonNull final Duration toCheck) {
        Objects.requireNonNull(toCheck);
        if (toCheck.isZero() || toCheck.isNegative()) {
            throw new IllegalArgumentException(DEFAULT_REQUIRE_POSITIVE_DURATION_MESSAGE.formatted(toCheck));
        }
        return toCheck;
    }

    private Preconditions() {}
}
