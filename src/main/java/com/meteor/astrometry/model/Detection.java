package com.meteor.astrometry.model;

import java.time.LocalDateTime;

/**
 * A single timestamped centroid on the sensor. The level is the summed pixel intensity.
 */
public class Detection {
    public final LocalDateTime time;
    public final double x;
    public final double y;
    public final double level;

    public Detection(LocalDateTime time, double x, double y, double level) {
        this.time = time;
        this.x = x;
        this.y = y;
        this.level = level;
    }
}
