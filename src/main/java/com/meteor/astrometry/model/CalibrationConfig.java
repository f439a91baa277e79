package com.meteor.astrometry.model;

import java.util.prefs.Preferences;

public class CalibrationConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(CalibrationConfig.class);

    // Position angle solver
    private static final String KEY_SOLVER_MAX_ITER = "solver_max_iterations";
    private static final String KEY_SOLVER_TOLERANCE = "solver_tolerance";
    private static final String KEY_SOLVER_STEP = "solver_initial_step";

    // Photometry
    private static final String KEY_PHOTOM_MAX_ITER = "photometry_max_iterations";

    public static final int DEFAULT_SOLVER_MAX_ITERATIONS = 1000;
    public static final double DEFAULT_SOLVER_TOLERANCE = 1e-3;
    public static final double DEFAULT_SOLVER_INITIAL_STEP = 5.0;
    public static final int DEFAULT_PHOTOMETRY_MAX_ITERATIONS = 2000;

    private CalibrationConfig() {}

    // --- SOLVER ---
    public static int getSolverMaxIterations() { return prefs.getInt(KEY_SOLVER_MAX_ITER, DEFAULT_SOLVER_MAX_ITERATIONS); }
    public static void setSolverMaxIterations(int v) { prefs.putInt(KEY_SOLVER_MAX_ITER, v); }

    /** Largest residual (deg) at which a solved position angle still counts as converged. */
    public static double getSolverTolerance() { return prefs.getDouble(KEY_SOLVER_TOLERANCE, DEFAULT_SOLVER_TOLERANCE); }
    public static void setSolverTolerance(double v) { prefs.putDouble(KEY_SOLVER_TOLERANCE, v); }

    public static double getSolverInitialStep() { return prefs.getDouble(KEY_SOLVER_STEP, DEFAULT_SOLVER_INITIAL_STEP); }
    public static void setSolverInitialStep(double v) { prefs.putDouble(KEY_SOLVER_STEP, v); }

    // --- PHOTOMETRY ---
    public static int getPhotometryMaxIterations() { return prefs.getInt(KEY_PHOTOM_MAX_ITER, DEFAULT_PHOTOMETRY_MAX_ITERATIONS); }
    public static void setPhotometryMaxIterations(int v) { prefs.putInt(KEY_PHOTOM_MAX_ITER, v); }
}
