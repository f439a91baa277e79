package com.meteor.astrometry.service;

import com.meteor.astrometry.model.CameraModel;
import com.meteor.astrometry.model.ImageCoordinates;
import com.meteor.astrometry.util.ArrayChecks;

// Forward and reverse coefficients are fitted separately and only approximately invert each other
public class DistortionService {

    public double[] rectify(CameraModel model, double x, double y) {
        return rectify(model.getXPolyForward(), model.getYPolyForward(), model, x, y);
    }

    public ImageCoordinates rectify(CameraModel model, double[] x, double[] y) {
        ArrayChecks.requireSameLength("x", x, "y", y);
        double[] px = model.getXPolyForward();
        double[] py = model.getYPolyForward();

        double[] outX = new double[x.length];
        double[] outY = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            double[] r = rectify(px, py, model, x[i], y[i]);
            outX[i] = r[0];
            outY[i] = r[1];
        }
        return new ImageCoordinates(outX, outY);
    }

    public double[] distort(CameraModel model, double x, double y) {
        return distort(model.getXPolyReverse(), model.getYPolyReverse(), model, x, y);
    }

    public ImageCoordinates distort(CameraModel model, double[] x, double[] y) {
        ArrayChecks.requireSameLength("x", x, "y", y);
        double[] px = model.getXPolyReverse();
        double[] py = model.getYPolyReverse();

        double[] outX = new double[x.length];
        double[] outY = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            double[] r = distort(px, py, model, x[i], y[i]);
            outX[i] = r[0];
            outY[i] = r[1];
        }
        return new ImageCoordinates(outX, outY);
    }

    private double[] rectify(double[] px, double[] py, CameraModel model, double x, double y) {
        double dx = x - model.centerX();
        double dy = y - model.centerY();

        double xc = dx + correctionX(px, dx, dy);
        double yc = dy + correctionY(py, dx, dy);

        return new double[] { xc / model.scale, yc / model.scale };
    }

    private double[] distort(double[] px, double[] py, CameraModel model, double x, double y) {
        double xp = x - correctionX(px, x, y) + model.centerX();
        double yp = y - correctionY(py, x, y) + model.centerY();
        return new double[] { xp, yp };
    }

    static double correctionX(double[] c, double x, double y) {
        double r = Math.sqrt(x * x + y * y);
        return c[0]
                + c[1] * x
                + c[2] * y
                + c[3] * x * x
                + c[4] * x * y
                + c[5] * y * y
                + c[6] * x * x * x
                + c[7] * x * x * y
                + c[8] * x * y * y
                + c[9] * y * y * y
                + c[10] * x * r
                + c[11] * y * r;
    }

    // Same as X but the radial terms lead with the axis' own coordinate
    static double correctionY(double[] c, double x, double y) {
        double r = Math.sqrt(x * x + y * y);
        return c[0]
                + c[1] * x
                + c[2] * y
                + c[3] * x * x
                + c[4] * x * y
                + c[5] * y * y
                + c[6] * x * x * x
                + c[7] * x * x * y
                + c[8] * x * y * y
                + c[9] * y * y * y
                + c[10] * y * r
                + c[11] * x * r;
    }
}
