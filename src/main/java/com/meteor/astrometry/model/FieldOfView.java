package com.meteor.astrometry.model;

public class FieldOfView {
    public final double horizontal; // deg
    public final double vertical;   // deg

    public FieldOfView(double horizontal, double vertical) {
        this.horizontal = horizontal;
        this.vertical = vertical;
    }

    /** Diagonal extent, usable as a catalog search radius around the field centre. */
    public double diagonal() { return Math.hypot(horizontal, vertical); }

    @Override
    public String toString() {
        return String.format("%.2f x %.2f deg", horizontal, vertical);
    }
}
