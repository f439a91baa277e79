package com.meteor.astrometry.util;

import java.util.Arrays;

/**
 * Angle bookkeeping and low precision sidereal time. All angles in degrees unless stated.
 */
public final class AstroMath {

    public static final double J2000 = 2451545.0;
    public static final double JD_UNIX_EPOCH = 2440587.5;
    public static final double DAYS_PER_CENTURY = 36525.0;
    public static final double MILLIS_PER_DAY = 86400000.0;

    private AstroMath() {}

    /**
     * Greenwich mean sidereal time, IAU 1982 polynomial.
     */
    public static double greenwichSiderealTime(double jd) {
        double dJd = jd - J2000;
        double t = dJd / DAYS_PER_CENTURY;
        double gst = 280.46061837 + 360.98564736629 * dJd + 0.000387933 * t * t - t * t * t / 38710000.0;
        return normalize360(gst);
    }

    /** [0, 360) */
    public static double normalize360(double angle) {
        double r = angle % 360.0;
        if (r < 0) r += 360.0;
        // -1e-15 % 360 + 360 rounds to 360
        if (r >= 360.0) r -= 360.0;
        return r;
    }

    /** (-180, 180] */
    public static double wrap180(double angle) {
        double r = normalize360(angle);
        return (r > 180.0) ? r - 360.0 : r;
    }

    /**
     * Absolute difference of two angles after both are reduced to [0, 360).
     */
    public static double moduloDistance(double a, double b) {
        return Math.abs(normalize360(a) - normalize360(b));
    }

    /**
     * Shortest distance between two directions, [0, 180]. Zero only when both angles agree mod 360
     * and free of the jump at 0/360.
     */
    public static double wrappedResidual(double target, double value) {
        return 180.0 - Math.abs(moduloDistance(target, value) - 180.0);
    }

    public static double clampUnit(double v) {
        if (v > 1.0) return 1.0;
        if (v < -1.0) return -1.0;
        return v;
    }

    /**
     * Great circle distance between two equatorial (or horizontal) positions.
     */
    public static double angularSeparation(double ra1, double dec1, double ra2, double dec2) {
        double d1 = Math.toRadians(dec1);
        double d2 = Math.toRadians(dec2);
        double dRa = Math.toRadians(ra2 - ra1);

        double sd1 = Math.sin(d1), cd1 = Math.cos(d1);
        double sd2 = Math.sin(d2), cd2 = Math.cos(d2);

        double a = cd2 * Math.sin(dRa);
        double b = cd1 * sd2 - sd1 * cd2 * Math.cos(dRa);
        double c = sd1 * sd2 + cd1 * cd2 * Math.cos(dRa);

        return Math.toDegrees(Math.atan2(Math.sqrt(a * a + b * b), c));
    }

    public static double median(double[] values) {
        if (values.length == 0) return Double.NaN;
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 0) return (sorted[mid - 1] + sorted[mid]) / 2.0;
        return sorted[mid];
    }

    /** Population standard deviation. */
    public static double stddev(double[] values) {
        if (values.length == 0) return Double.NaN;
        double mean = 0;
        for (double v : values) mean += v;
        mean /= values.length;
        double ss = 0;
        for (double v : values) ss += (v - mean) * (v - mean);
        return Math.sqrt(ss / values.length);
    }
}
