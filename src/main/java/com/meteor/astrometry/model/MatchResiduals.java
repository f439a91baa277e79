package com.meteor.astrometry.model;

/**
 * Differences between predicted catalog star positions and the measured image stars.
 */
public class MatchResiduals {
    public final double[] dx;
    public final double[] dy;
    public final double[] distance; // px
    public final double[] angle;    // deg, direction of the error vector
    public final double medianDistance;

    public MatchResiduals(double[] dx, double[] dy, double[] distance, double[] angle, double medianDistance) {
        this.dx = dx;
        this.dy = dy;
        this.distance = distance;
        this.angle = angle;
        this.medianDistance = medianDistance;
    }

    public int size() { return distance.length; }
}
