package com.meteor.astrometry.util;

/**
 * Shape checks applied where arrays enter the public services.
 */
public final class ArrayChecks {

    private ArrayChecks() {}

    public static void requireSameLength(String firstName, int firstLength, String secondName, int secondLength) {
        if (firstLength != secondLength) {
            throw new IllegalArgumentException(String.format(
                    "%s and %s must have the same length (%d != %d)", firstName, secondName, firstLength, secondLength));
        }
    }

    public static void requireSameLength(String aName, double[] a, String bName, double[] b) {
        requireNonNull(aName, a);
        requireNonNull(bName, b);
        requireSameLength(aName, a.length, bName, b.length);
    }

    public static void requireNonEmpty(String name, double[] a) {
        requireNonNull(name, a);
        if (a.length == 0) {
            throw new IllegalArgumentException(name + " must contain at least one point");
        }
    }

    public static void requireNonNull(String name, Object a) {
        if (a == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
    }
}
