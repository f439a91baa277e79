package com.meteor.astrometry.model;

/**
 * Output of the pixel to sky conversion, one entry per input point.
 */
public class SkyCoordinates {
    public final double[] jd;
    public final double[] ra;
    public final double[] dec;
    public final double[] magnitude;

    public SkyCoordinates(double[] jd, double[] ra, double[] dec, double[] magnitude) {
        this.jd = jd;
        this.ra = ra;
        this.dec = dec;
        this.magnitude = magnitude;
    }

    public int size() { return ra.length; }

    public CelestialPoint point(int i) { return new CelestialPoint(ra[i], dec[i]); }
}
