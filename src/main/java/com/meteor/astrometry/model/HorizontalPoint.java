package com.meteor.astrometry.model;

/**
 * Local horizontal position. Azimuth from North through East, degrees.
 */
public class HorizontalPoint {
    public final double azimuth;
    public final double altitude;

    public HorizontalPoint(double azimuth, double altitude) {
        this.azimuth = azimuth;
        this.altitude = altitude;
    }

    @Override
    public String toString() {
        return String.format("Az %.5f, Alt %+.5f", azimuth, altitude);
    }
}
