package com.meteor.astrometry.model;

/**
 * Equatorial position, degrees (J2000).
 */
public class CelestialPoint {
    public final double ra;
    public final double dec;

    public CelestialPoint(double ra, double dec) {
        this.ra = ra;
        this.dec = dec;
    }

    @Override
    public String toString() {
        return String.format("RA %.5f, Dec %+.5f", ra, dec);
    }
}
