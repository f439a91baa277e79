package com.meteor.astrometry.service;

import com.meteor.astrometry.model.CalibratedPoint;
import com.meteor.astrometry.model.CameraModel;
import com.meteor.astrometry.model.HorizontalCoordinates;
import com.meteor.astrometry.model.MeteorTrack;
import com.meteor.astrometry.model.SkyCoordinates;
import com.meteor.astrometry.util.ArrayChecks;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MeteorCalibrationService {

    private static final Logger log = LoggerFactory.getLogger(MeteorCalibrationService.class);

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final ProjectionService projection;
    private final SkyFrameService skyFrame;

    public MeteorCalibrationService() {
        this(new ProjectionService(), new SkyFrameService());
    }

    public MeteorCalibrationService(ProjectionService projection, SkyFrameService skyFrame) {
        this.projection = projection;
        this.skyFrame = skyFrame;
    }

    public List<CalibratedPoint> calibrate(CameraModel model, MeteorTrack track) {
        ArrayChecks.requireSameLength("frames", track.frames, "x", track.x);
        ArrayChecks.requireSameLength("x", track.x, "y", track.y);
        ArrayChecks.requireSameLength("x", track.x, "levels", track.levels);
        if (!(track.fps > 0)) {
            throw new IllegalArgumentException("Frame rate must be positive, got " + track.fps + " for " + track.name);
        }

        // The magnitude of a point without signal is undefined
        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < track.size(); i++) {
            if (track.levels[i] > 0) kept.add(i);
        }
        if (kept.size() < track.size()) {
            log.info("{}: dropped {} of {} points with non-positive level", track.name,
                    track.size() - kept.size(), track.size());
        }
        if (kept.isEmpty()) return new ArrayList<>();

        int n = kept.size();
        double[] frames = new double[n];
        double[] x = new double[n];
        double[] y = new double[n];
        double[] levels = new double[n];
        LocalDateTime[] times = new LocalDateTime[n];
        for (int k = 0; k < n; k++) {
            int i = kept.get(k);
            frames[k] = track.frames[i];
            x[k] = track.x[i];
            y[k] = track.y[i];
            levels[k] = track.levels[i];
            times[k] = pointTime(track.start, track.frames[i], track.fps);
        }

        SkyCoordinates sky = projection.pixelToSky(model, times, x, y, levels);

        // Horizontal coordinates stay referred to J2000, as the RA/Dec they come from
        HorizontalCoordinates hor = skyFrame.equatorialToHorizontal(sky.jd, model.longitude, model.latitude,
                sky.ra, sky.dec);

        List<CalibratedPoint> points = new ArrayList<>(n);
        for (int k = 0; k < n; k++) {
            points.add(new CalibratedPoint(frames[k], x[k], y[k], sky.jd[k], sky.ra[k], sky.dec[k],
                    hor.azimuth[k], hor.altitude[k], levels[k], sky.magnitude[k]));
        }

        log.debug("{}: calibrated {} points", track.name, n);
        return points;
    }

    public List<List<CalibratedPoint>> calibrate(CameraModel model, List<MeteorTrack> tracks) {
        List<List<CalibratedPoint>> result = new ArrayList<>(tracks.size());
        for (MeteorTrack track : tracks) {
            result.add(calibrate(model, track));
        }
        log.info("Calibrated {} meteors with {}", tracks.size(), model);
        return result;
    }

    LocalDateTime pointTime(LocalDateTime start, double frame, double fps) {
        long nanos = Math.round(frame / fps * NANOS_PER_SECOND);
        return start.plusNanos(nanos);
    }
}
