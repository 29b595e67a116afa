package com.fluentchecks.predicates;

import com.fluentchecks.core.Check;
import com.fluentchecks.core.CustomCheck;

import java.util.Collection;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Comparison checks over plain values.
 * <p>
 * The value overloads compare values captured when the check is built, so the outcome never
 * changes. The {@link Supplier} overloads read the actual value on every evaluation, which is
 * what polling needs:
 * <pre>{@code
 * ComparisonChecks.isEqual(counter::get, 10).eventually(Duration.ofSeconds(1));
 * }</pre>
 */
public final class ComparisonChecks {

    private ComparisonChecks() {
        // utility class
    }

    public static Check isEqual(Object actual, Object expected) {
        return isEqual(() -> actual, expected);
    }

    /**
     * {@code true} when the supplied value equals {@code expected} ({@link Objects#equals}).
     */
    public static Check isEqual(Supplier<?> actual, Object expected) {
        requireSupplier(actual);
        return new CustomCheck("value equals " + expected, () -> Objects.equals(actual.get(), expected));
    }

    public static Check isNotEqual(Object actual, Object expected) {
        return isNotEqual(() -> actual, expected);
    }

    /**
     * {@code true} when the supplied value does not equal {@code expected}.
     */
    public static Check isNotEqual(Supplier<?> actual, Object expected) {
        requireSupplier(actual);
        return new CustomCheck("value not equal to " + expected, () -> !Objects.equals(actual.get(), expected));
    }

    /**
     * {@code true} when {@code actual} compares strictly greater than {@code bound}.
     */
    public static <T extends Comparable<? super T>> Check isGreaterThan(T actual, T bound) {
        requireComparable(actual, bound);
        return new CustomCheck(actual + " greater than " + bound, () -> actual.compareTo(bound) > 0);
    }

    /**
     * {@code true} when {@code actual} compares strictly less than {@code bound}.
     */
    public static <T extends Comparable<? super T>> Check isLessThan(T actual, T bound) {
        requireComparable(actual, bound);
        return new CustomCheck(actual + " less than " + bound, () -> actual.compareTo(bound) < 0);
    }

    /**
     * {@code true} when {@code collection} contains {@code needle}.
     */
    public static Check isIn(Object needle, Collection<?> collection) {
        if (collection == null) {
            throw new IllegalArgumentException("collection must not be null");
        }
        return new CustomCheck(needle + " is in collection", () -> collection.contains(needle));
    }

    /**
     * {@code true} when {@code text} contains {@code needle} as a substring.
     */
    public static Check isIn(CharSequence needle, CharSequence text) {
        if (needle == null || text == null) {
            throw new IllegalArgumentException("needle and text must not be null");
        }
        return new CustomCheck("'" + needle + "' is in text", () -> text.toString().contains(needle));
    }

    /**
     * {@code true} when {@code value} is an instance of {@code type} (exact type or subtype).
     */
    public static Check isInstanceOf(Object value, Class<?> type) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        return new CustomCheck("value is a " + type.getSimpleName(), () -> type.isInstance(value));
    }

    private static void requireSupplier(Supplier<?> actual) {
        if (actual == null) {
            throw new IllegalArgumentException("actual must not be null");
        }
    }

    private static void requireComparable(Object actual, Object bound) {
        if (actual == null) {
            throw new IllegalArgumentException("actual must not be null");
        }
        if (bound == null) {
            throw new IllegalArgumentException("bound must not be null");
        }
    }
}
