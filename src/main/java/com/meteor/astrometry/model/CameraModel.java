package com.meteor.astrometry.model;

import com.meteor.astrometry.util.AstroMath;
import java.util.Arrays;

/**
 * Fitted astrometric and photometric parameters of one camera (the "platepar").
 *
 * <p>Instances are immutable. Distortion arrays are copied on the way in and on the way out.
 * Forward polynomials map pixels to the sky, reverse polynomials map the sky to pixels; each
 * holds 12 terms in the order 1, X, Y, X², XY, Y², X³, X²Y, XY², Y³ followed by two radial
 * terms (X·r, Y·r for the X axis, Y·r, X·r for the Y axis).
 */
public class CameraModel {

    public static final int POLY_TERMS = 12;
    public static final double DEFAULT_MAGNITUDE_SLOPE = -2.5;

    // Station
    public final double latitude;
    public final double longitude;
    public final double elevation;

    // Reference pointing
    public final double raCenter;
    public final double decCenter;
    public final double referenceJd;
    public final double referenceHourAngle;
    public final double positionAngle;
    private final boolean hourAngleGiven;

    // Image geometry
    public final int xResolution;
    public final int yResolution;
    public final double scale;

    private final double[] xPolyForward;
    private final double[] yPolyForward;
    private final double[] xPolyReverse;
    private final double[] yPolyReverse;

    // Photometry
    public final double magnitudeSlope;
    public final double photometricOffset;
    public final double photometricOffsetStddev;
    public final double gamma;

    public final double utCorrection;

    private CameraModel(Builder b) {
        this.latitude = b.latitude;
        this.longitude = b.longitude;
        this.elevation = b.elevation;
        this.raCenter = AstroMath.normalize360(b.raCenter);
        this.decCenter = b.decCenter;
        this.referenceJd = b.referenceJd;
        this.hourAngleGiven = !Double.isNaN(b.referenceHourAngle);
        this.referenceHourAngle = hourAngleGiven
                ? b.referenceHourAngle
                : AstroMath.greenwichSiderealTime(b.referenceJd);
        this.positionAngle = b.positionAngle;
        this.xResolution = b.xResolution;
        this.yResolution = b.yResolution;
        this.scale = b.scale;
        this.xPolyForward = b.xPolyForward.clone();
        this.yPolyForward = b.yPolyForward.clone();
        this.xPolyReverse = b.xPolyReverse.clone();
        this.yPolyReverse = b.yPolyReverse.clone();
        this.magnitudeSlope = b.magnitudeSlope;
        this.photometricOffset = b.photometricOffset;
        this.photometricOffsetStddev = b.photometricOffsetStddev;
        this.gamma = b.gamma;
        this.utCorrection = b.utCorrection;
    }

    public double[] getXPolyForward() { return xPolyForward.clone(); }
    public double[] getYPolyForward() { return yPolyForward.clone(); }
    public double[] getXPolyReverse() { return xPolyReverse.clone(); }
    public double[] getYPolyReverse() { return yPolyReverse.clone(); }

    public double centerX() { return xResolution / 2.0; }
    public double centerY() { return yResolution / 2.0; }

    public CameraModel withPositionAngle(double positionAngle) {
        return toBuilder().positionAngle(positionAngle).build();
    }

    public CameraModel withScale(double scale) {
        return toBuilder().scale(scale).build();
    }

    public CameraModel withPhotometry(double offset, double stddev) {
        return toBuilder().photometricOffset(offset).photometricOffsetStddev(stddev).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .station(latitude, longitude, elevation)
                .pointing(raCenter, decCenter)
                .referenceJd(referenceJd)
                // A derived hour angle follows the reference JD when that is changed
                .referenceHourAngle(hourAngleGiven ? referenceHourAngle : Double.NaN)
                .positionAngle(positionAngle)
                .resolution(xResolution, yResolution)
                .scale(scale)
                .forwardPolynomials(xPolyForward, yPolyForward)
                .reversePolynomials(xPolyReverse, yPolyReverse)
                .magnitudeSlope(magnitudeSlope)
                .photometricOffset(photometricOffset)
                .photometricOffsetStddev(photometricOffsetStddev)
                .gamma(gamma)
                .utCorrection(utCorrection);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("CameraModel[lat=%.4f, lon=%.4f, RA=%.4f, Dec=%.4f, PA=%.3f, %dx%d, F=%.3f px/deg]",
                latitude, longitude, raCenter, decCenter, positionAngle, xResolution, yResolution, scale);
    }

    public static class Builder {
        private double latitude;
        private double longitude;
        private double elevation;
        private double raCenter;
        private double decCenter;
        private double referenceJd = AstroMath.J2000;
        private double referenceHourAngle = Double.NaN;
        private double positionAngle;
        private int xResolution;
        private int yResolution;
        private double scale;
        private double[] xPolyForward = new double[POLY_TERMS];
        private double[] yPolyForward = new double[POLY_TERMS];
        private double[] xPolyReverse = new double[POLY_TERMS];
        private double[] yPolyReverse = new double[POLY_TERMS];
        private double magnitudeSlope = DEFAULT_MAGNITUDE_SLOPE;
        private double photometricOffset;
        private double photometricOffsetStddev;
        private double gamma = 1.0;
        private double utCorrection;

        public Builder station(double latitude, double longitude, double elevation) {
            this.latitude = latitude;
            this.longitude = longitude;
            this.elevation = elevation;
            return this;
        }

        public Builder pointing(double raCenter, double decCenter) {
            this.raCenter = raCenter;
            this.decCenter = decCenter;
            return this;
        }

        public Builder referenceJd(double jd) { this.referenceJd = jd; return this; }

        /** Sidereal angle at the reference time. Left unset, it is derived from the reference JD. */
        public Builder referenceHourAngle(double hourAngle) { this.referenceHourAngle = hourAngle; return this; }

        public Builder positionAngle(double positionAngle) { this.positionAngle = positionAngle; return this; }

        public Builder resolution(int x, int y) {
            this.xResolution = x;
            this.yResolution = y;
            return this;
        }

        public Builder scale(double scale) { this.scale = scale; return this; }

        public Builder forwardPolynomials(double[] x, double[] y) {
            this.xPolyForward = x;
            this.yPolyForward = y;
            return this;
        }

        public Builder reversePolynomials(double[] x, double[] y) {
            this.xPolyReverse = x;
            this.yPolyReverse = y;
            return this;
        }

        public Builder magnitudeSlope(double v) { this.magnitudeSlope = v; return this; }
        public Builder photometricOffset(double v) { this.photometricOffset = v; return this; }
        public Builder photometricOffsetStddev(double v) { this.photometricOffsetStddev = v; return this; }
        public Builder gamma(double v) { this.gamma = v; return this; }
        public Builder utCorrection(double hours) { this.utCorrection = hours; return this; }

        public CameraModel build() {
            if (xResolution <= 0 || yResolution <= 0) {
                throw new IllegalArgumentException("Resolution must be positive, got " + xResolution + "x" + yResolution);
            }
            if (!(scale > 0) || Double.isInfinite(scale)) {
                throw new IllegalArgumentException("Image scale must be a positive number, got " + scale);
            }
            if (!(decCenter >= -90 && decCenter <= 90)) {
                throw new IllegalArgumentException("Declination of the field centre out of range: " + decCenter);
            }
            checkPoly("xPolyForward", xPolyForward);
            checkPoly("yPolyForward", yPolyForward);
            checkPoly("xPolyReverse", xPolyReverse);
            checkPoly("yPolyReverse", yPolyReverse);
            return new CameraModel(this);
        }

        private static void checkPoly(String name, double[] poly) {
            if (poly == null || poly.length != POLY_TERMS) {
                throw new IllegalArgumentException(name + " must hold " + POLY_TERMS + " coefficients, got "
                        + (poly == null ? "null" : Arrays.toString(poly)));
            }
        }
    }
}
