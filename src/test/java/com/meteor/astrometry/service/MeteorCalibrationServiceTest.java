package com.meteor.astrometry.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.meteor.astrometry.ModelFixtures;
import com.meteor.astrometry.model.CalibratedPoint;
import com.meteor.astrometry.model.CameraModel;
import com.meteor.astrometry.model.HorizontalCoordinates;
import com.meteor.astrometry.model.MeteorTrack;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class MeteorCalibrationServiceTest {

    private final SkyFrameService skyFrame = new SkyFrameService();
    private final ProjectionService projection = new ProjectionService();
    private final MeteorCalibrationService calibration = new MeteorCalibrationService(projection, skyFrame);

    private final LocalDateTime start = LocalDateTime.of(2018, 9, 21, 6, 10, 0);

    private MeteorTrack track() {
        return new MeteorTrack("FF_HR0001_20180921_061000_000_0000512.fits", start, 25.0,
                new double[] { 0, 25, 50, 75 },
                new double[] { 500, 520, 540, 560 },
                new double[] { 300, 310, 320, 330 },
                new double[] { 100, 0, -5, 1000 });
    }

    @Test
    void dropsPointsWithoutSignal() {
        List<CalibratedPoint> points = calibration.calibrate(ModelFixtures.distorted(), track());

        assertEquals(2, points.size());
        assertEquals(0, points.get(0).frame, 0);
        assertEquals(75, points.get(1).frame, 0);
        assertEquals(560, points.get(1).x, 0);
    }

    @Test
    void pointTimesFollowFrameRate() {
        List<CalibratedPoint> points = calibration.calibrate(ModelFixtures.distorted(), track());

        assertEquals(skyFrame.julianDate(start), points.get(0).jd, 1e-9);
        assertEquals(skyFrame.julianDate(start.plusSeconds(3)), points.get(1).jd, 1e-9);
    }

    @Test
    void magnitudesUseModelPhotometry() {
        List<CalibratedPoint> points = calibration.calibrate(ModelFixtures.distorted(), track());

        assertEquals(5.0, points.get(0).magnitude, 1e-12);
        assertEquals(2.5, points.get(1).magnitude, 1e-12);
    }

    @Test
    void horizontalCoordinatesMatchTheCameraFrame() {
        CameraModel model = ModelFixtures.distorted();
        List<CalibratedPoint> points = calibration.calibrate(model, track());

        HorizontalCoordinates direct = projection.pixelToHorizontal(model,
                new double[] { 500, 560 }, new double[] { 300, 330 });
        for (int i = 0; i < points.size(); i++) {
            assertEquals(direct.azimuth[i], points.get(i).azimuth, 1e-6);
            assertEquals(direct.altitude[i], points.get(i).altitude, 1e-6);
        }
    }

    @Test
    void trackWithoutSignalGivesNothing() {
        MeteorTrack dark = new MeteorTrack("dark", start, 25.0, new double[] { 0, 1 },
                new double[] { 1, 2 }, new double[] { 1, 2 }, new double[] { 0, 0 });
        assertTrue(calibration.calibrate(ModelFixtures.undistorted(), dark).isEmpty());
    }

    @Test
    void calibratesEveryTrack() {
        List<List<CalibratedPoint>> all = calibration.calibrate(ModelFixtures.undistorted(), List.of(track(), track()));
        assertEquals(2, all.size());
        assertEquals(2, all.get(1).size());
    }

    @Test
    void rejectsMalformedTracks() {
        MeteorTrack noRate = new MeteorTrack("bad", start, 0, new double[1], new double[1], new double[1], new double[] { 1 });
        MeteorTrack ragged = new MeteorTrack("bad", start, 25, new double[2], new double[1], new double[1], new double[] { 1 });

        assertThrows(IllegalArgumentException.class, () -> calibration.calibrate(ModelFixtures.undistorted(), noRate));
        assertThrows(IllegalArgumentException.class, () -> calibration.calibrate(ModelFixtures.undistorted(), ragged));
    }
}
