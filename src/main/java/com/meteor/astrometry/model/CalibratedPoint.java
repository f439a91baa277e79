package com.meteor.astrometry.model;

public class CalibratedPoint {
    public final double frame;
    public final double x;
    public final double y;
    public final double jd;
    public final double ra;
    public final double dec;
    public final double azimuth;
    public final double altitude;
    public final double level;
    public final double magnitude;

    public CalibratedPoint(double frame, double x, double y, double jd, double ra, double dec,
                           double azimuth, double altitude, double level, double magnitude) {
        this.frame = frame;
        this.x = x;
        this.y = y;
        this.jd = jd;
        this.ra = ra;
        this.dec = dec;
        this.azimuth = azimuth;
        this.altitude = altitude;
        this.level = level;
        this.magnitude = magnitude;
    }

    @Override
    public String toString() {
        return String.format("%7.2f %8.2f %8.2f %10.5f %+9.5f %10.5f %+9.5f %8d %+6.2f",
                frame, x, y, ra, dec, azimuth, altitude, (long) level, magnitude);
    }
}
