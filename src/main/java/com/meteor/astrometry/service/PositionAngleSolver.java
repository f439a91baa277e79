package com.meteor.astrometry.service;

import com.meteor.astrometry.model.CalibrationConfig;
import com.meteor.astrometry.model.CameraModel;
import com.meteor.astrometry.model.PositionAngleSolution;
import com.meteor.astrometry.model.RotationFrame;
import com.meteor.astrometry.util.AstroMath;
import ij.measure.Minimizer;
import ij.measure.UserFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PositionAngleSolver {

    private static final Logger log = LoggerFactory.getLogger(PositionAngleSolver.class);

    private final FieldGeometryService geometry;
    private final int maxIterations;
    private final double tolerance;
    private final double initialStep;

    public PositionAngleSolver() {
        this(new FieldGeometryService(), CalibrationConfig.getSolverMaxIterations(),
                CalibrationConfig.getSolverTolerance(), CalibrationConfig.getSolverInitialStep());
    }

    /**
     * @param maxIterations simplex iteration cap per minimisation
     * @param tolerance     residual (deg) under which the result is reported as converged
     * @param initialStep   size (deg) of the starting simplex around the seed
     */
    public PositionAngleSolver(FieldGeometryService geometry, int maxIterations, double tolerance, double initialStep) {
        this.geometry = geometry;
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
        this.initialStep = initialStep;
    }

    public double solvePositionAngle(CameraModel model, double targetRotation, RotationFrame frame) {
        return solve(model, targetRotation, frame).positionAngle;
    }

    public PositionAngleSolution solve(CameraModel model, double targetRotation, RotationFrame frame) {
        double target = AstroMath.normalize360(targetRotation);

        UserFunction residual = (params, unused) ->
                AstroMath.wrappedResidual(target, geometry.rotation(model, params[0], frame));

        Minimizer minimizer = new Minimizer();
        minimizer.setFunction(residual, 1);
        minimizer.setMaxIterations(maxIterations);
        minimizer.setMaxError(1e-10, 1e-10);
        minimizer.setRandomSeed(1);
        // Local search around the current position angle
        int status = minimizer.minimize(new double[] { model.positionAngle }, new double[] { initialStep });

        double positionAngle = AstroMath.normalize360(minimizer.getParams()[0]);
        double finalResidual = AstroMath.wrappedResidual(target, geometry.rotation(model, positionAngle, frame));
        boolean converged = finalResidual <= tolerance;

        if (!converged) {
            log.warn("Position angle search for {} rotation {} stopped {} deg away (status '{}', seed {})",
                    frame, target, finalResidual, Minimizer.STATUS_STRING[status], model.positionAngle);
        } else {
            log.debug("Position angle {} gives {} rotation {} (residual {}, {} iterations)",
                    positionAngle, frame, target, finalResidual, minimizer.getIterations());
        }

        return new PositionAngleSolution(positionAngle, finalResidual, converged, minimizer.getIterations(),
                Minimizer.STATUS_STRING[status]);
    }
}
