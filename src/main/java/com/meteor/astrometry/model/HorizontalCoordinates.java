package com.meteor.astrometry.model;

public class HorizontalCoordinates {
    public final double[] azimuth;
    public final double[] altitude;

    public HorizontalCoordinates(double[] azimuth, double[] altitude) {
        this.azimuth = azimuth;
        this.altitude = altitude;
    }

    public int size() { return azimuth.length; }
}
