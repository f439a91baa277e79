package com.meteor.astrometry.service;

import com.meteor.astrometry.model.CalibrationConfig;
import com.meteor.astrometry.model.CameraModel;
import com.meteor.astrometry.model.PhotometryResult;
import com.meteor.astrometry.util.ArrayChecks;
import com.meteor.astrometry.util.AstroMath;
import ij.measure.Minimizer;
import ij.measure.UserFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PhotometryService {

    private static final Logger log = LoggerFactory.getLogger(PhotometryService.class);

    // Fixed by the definition of magnitude; only the offset is fitted
    public static final double MAGNITUDE_SLOPE = -2.5;

    private final int maxIterations;

    public PhotometryService() {
        this(CalibrationConfig.getPhotometryMaxIterations());
    }

    public PhotometryService(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public double photometricLine(double logSumPixel, double offset) {
        return MAGNITUDE_SLOPE * logSumPixel + offset;
    }

    /**
     * Fits {@code mag = -2.5 * lsp + offset} with a soft L1 loss, so a few blended or saturated
     * stars do not drag the offset.
     *
     * @param logSumPixel log10 of the summed pixel intensity of each star
     * @param catalogMags catalog magnitude of each star
     */
    public PhotometryResult fit(double[] logSumPixel, double[] catalogMags) {
        ArrayChecks.requireNonEmpty("logSumPixel", logSumPixel);
        ArrayChecks.requireSameLength("logSumPixel", logSumPixel, "catalogMags", catalogMags);

        // Each star on its own gives an offset; start from the median of those
        double[] intercepts = new double[logSumPixel.length];
        for (int i = 0; i < intercepts.length; i++) {
            intercepts[i] = catalogMags[i] - MAGNITUDE_SLOPE * logSumPixel[i];
        }
        double seed = AstroMath.median(intercepts);
        double spread = AstroMath.stddev(intercepts);

        UserFunction softL1 = (params, unused) -> {
            double cost = 0;
            for (int i = 0; i < logSumPixel.length; i++) {
                double r = catalogMags[i] - photometricLine(logSumPixel[i], params[0]);
                cost += 2.0 * (Math.sqrt(1.0 + r * r) - 1.0);
            }
            return cost;
        };

        Minimizer minimizer = new Minimizer();
        minimizer.setFunction(softL1, 1);
        minimizer.setMaxIterations(maxIterations);
        minimizer.setMaxError(1e-12, 1e-15);
        minimizer.setRandomSeed(1);
        int status = minimizer.minimize(new double[] { seed }, new double[] { 0.1 + spread });

        if (status != Minimizer.SUCCESS) {
            log.warn("Photometric fit on {} stars ended with status '{}'", logSumPixel.length,
                    Minimizer.STATUS_STRING[status]);
        }

        double offset = minimizer.getParams()[0];
        double[] residuals = new double[logSumPixel.length];
        for (int i = 0; i < residuals.length; i++) {
            residuals[i] = catalogMags[i] - photometricLine(logSumPixel[i], offset);
        }
        double stddev = AstroMath.stddev(residuals);

        log.debug("Photometric offset {} +/- {} from {} stars", offset, stddev, residuals.length);
        return new PhotometryResult(offset, stddev, residuals);
    }

    /**
     * {@code slope * log10(level) + offset} per element. Levels must be positive; anything else
     * comes back as NaN or Infinity.
     */
    public double[] levelsToMagnitude(double[] levels, double slope, double offset) {
        double[] mags = new double[levels.length];
        for (int i = 0; i < levels.length; i++) {
            mags[i] = slope * Math.log10(levels[i]) + offset;
        }
        return mags;
    }

    public double[] magnitudes(CameraModel model, double[] levels) {
        return levelsToMagnitude(levels, model.magnitudeSlope, model.photometricOffset);
    }
}
