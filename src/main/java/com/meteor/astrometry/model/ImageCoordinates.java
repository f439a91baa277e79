package com.meteor.astrometry.model;

public class ImageCoordinates {
    public final double[] x;
    public final double[] y;

    public ImageCoordinates(double[] x, double[] y) {
        this.x = x;
        this.y = y;
    }

    public int size() { return x.length; }
}
