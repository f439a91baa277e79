package com.meteor.astrometry.model;

public class PositionAngleSolution {
    public final double positionAngle;  // deg, [0, 360)
    public final double residual;       // deg, wrapped distance to the requested rotation
    public final boolean converged;
    public final int iterations;
    public final String status;

    public PositionAngleSolution(double positionAngle, double residual, boolean converged, int iterations, String status) {
        this.positionAngle = positionAngle;
        this.residual = residual;
        this.converged = converged;
        this.iterations = iterations;
        this.status = status;
    }
}
