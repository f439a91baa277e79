package com.meteor.astrometry.model;

public class PhotometryResult {
    public final double offset;
    public final double stddev;
    public final double[] residuals; // catalog magnitude minus fitted magnitude

    public PhotometryResult(double offset, double stddev, double[] residuals) {
        this.offset = offset;
        this.stddev = stddev;
        this.residuals = residuals;
    }

    @Override
    public String toString() {
        return String.format("Fit: -2.50LSP %+.2f +/- %.2f", offset, stddev);
    }
}
