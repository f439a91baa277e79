package com.meteor.astrometry.model;

import java.time.LocalDateTime;

/**
 * Centroids of one meteor as measured on a video clip. Point times are derived from the clip
 * start time, the frame number and the frame rate.
 */
public class MeteorTrack {
    public final String name;
    public final LocalDateTime start;
    public final double fps;
    public final double[] frames;
    public final double[] x;
    public final double[] y;
    public final double[] levels;

    public MeteorTrack(String name, LocalDateTime start, double fps, double[] frames, double[] x, double[] y, double[] levels) {
        this.name = name;
        this.start = start;
        this.fps = fps;
        this.frames = frames;
        this.x = x;
        this.y = y;
        this.levels = levels;
    }

    public int size() { return frames.length; }
}
