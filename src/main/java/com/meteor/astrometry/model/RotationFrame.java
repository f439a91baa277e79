package com.meteor.astrometry.model;

public enum RotationFrame {
    /** Rotation of the image X axis with respect to the local horizon. */
    HORIZON,
    /** Rotation with respect to the celestial meridian through the field centre. */
    STANDARD
}
