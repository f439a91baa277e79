package com.meteor.astrometry.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.meteor.astrometry.ModelFixtures;
import com.meteor.astrometry.model.CameraModel;
import com.meteor.astrometry.model.MatchResiduals;
import com.meteor.astrometry.model.SkyCoordinates;
import org.junit.jupiter.api.Test;

class StarResidualServiceTest {

    private final ProjectionService projection = new ProjectionService();
    private final StarResidualService residuals = new StarResidualService(projection);

    @Test
    void measuresOffsetOfImageStars() {
        CameraModel model = ModelFixtures.undistorted();
        double jd = model.referenceJd + 0.1;
        double[] x = { 100, 640, 1000 };
        double[] y = { 100, 360, 600 };

        SkyCoordinates catalog = projection.pixelToSky(model, new double[] { jd, jd, jd }, x, y, new double[] { 1, 1, 1 });

        // Measured stars sit 2 px above where the model puts them
        double[] imageY = { 98, 358, 598 };
        MatchResiduals res = residuals.residuals(model, catalog.ra, catalog.dec, x, imageY, jd);

        for (int i = 0; i < x.length; i++) {
            assertEquals(0.0, res.dx[i], 1e-6);
            assertEquals(2.0, res.dy[i], 1e-6);
            assertEquals(2.0, res.distance[i], 1e-6);
            assertEquals(90.0, res.angle[i], 1e-4);
        }
        assertEquals(2.0, res.medianDistance, 1e-6);
    }

    @Test
    void emptyMatchHasNoMedian() {
        MatchResiduals res = residuals.residuals(ModelFixtures.undistorted(), new double[0], new double[0],
                new double[0], new double[0], ModelFixtures.REF_JD);
        assertEquals(0, res.size());
        assertTrue(Double.isNaN(res.medianDistance));
    }

    @Test
    void catalogAndImageMustPair() {
        assertThrows(IllegalArgumentException.class, () -> residuals.residuals(ModelFixtures.undistorted(),
                new double[2], new double[2], new double[3], new double[3], ModelFixtures.REF_JD));
    }
}
