package com.meteor.astrometry.model;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.meteor.astrometry.ModelFixtures;
import com.meteor.astrometry.util.AstroMath;
import org.junit.jupiter.api.Test;

class CameraModelTest {

    @Test
    void hourAngleDefaultsToSiderealTimeAtReference() {
        CameraModel model = ModelFixtures.undistorted();
        assertEquals(AstroMath.greenwichSiderealTime(ModelFixtures.REF_JD), model.referenceHourAngle, 1e-12);
    }

    @Test
    void explicitHourAngleIsKept() {
        CameraModel model = ModelFixtures.baseBuilder().referenceHourAngle(12.5).build();
        assertEquals(12.5, model.referenceHourAngle, 0);
    }

    @Test
    void rightAscensionIsNormalised() {
        CameraModel model = ModelFixtures.baseBuilder().pointing(370.0, 10.0).build();
        assertEquals(10.0, model.raCenter, 1e-12);
    }

    @Test
    void rejectsInvalidGeometry() {
        assertThrows(IllegalArgumentException.class, () -> ModelFixtures.baseBuilder().resolution(0, 720).build());
        assertThrows(IllegalArgumentException.class, () -> ModelFixtures.baseBuilder().scale(0).build());
        assertThrows(IllegalArgumentException.class, () -> ModelFixtures.baseBuilder().scale(Double.NaN).build());
        assertThrows(IllegalArgumentException.class, () -> ModelFixtures.baseBuilder().pointing(10, 91).build());
    }

    @Test
    void rejectsWrongPolynomialLength() {
        assertThrows(IllegalArgumentException.class,
                () -> ModelFixtures.baseBuilder().forwardPolynomials(new double[11], new double[12]).build());
        assertThrows(IllegalArgumentException.class,
                () -> ModelFixtures.baseBuilder().reversePolynomials(new double[12], null).build());
    }

    @Test
    void polynomialsAreCopied() {
        double[] x = new double[12];
        x[3] = 1e-6;
        CameraModel model = ModelFixtures.baseBuilder().forwardPolynomials(x, new double[12]).build();

        x[3] = 99;
        model.getXPolyForward()[3] = 42;

        assertEquals(1e-6, model.getXPolyForward()[3], 0);
        assertNotSame(model.getXPolyForward(), model.getXPolyForward());
    }

    @Test
    void withPositionAngleLeavesOriginalUntouched() {
        CameraModel model = ModelFixtures.distorted();
        CameraModel rotated = model.withPositionAngle(123.0);

        assertEquals(ModelFixtures.POSITION_ANGLE, model.positionAngle, 0);
        assertEquals(123.0, rotated.positionAngle, 0);
        assertEquals(model.raCenter, rotated.raCenter, 0);
        assertEquals(model.referenceHourAngle, rotated.referenceHourAngle, 0);
        assertArrayEquals(model.getYPolyReverse(), rotated.getYPolyReverse(), 0);
    }

    @Test
    void derivedHourAngleFollowsNewReferenceJd() {
        CameraModel model = ModelFixtures.undistorted();
        double newJd = ModelFixtures.REF_JD + 0.3;

        CameraModel moved = model.toBuilder().referenceJd(newJd).build();

        assertEquals(AstroMath.greenwichSiderealTime(newJd), moved.referenceHourAngle, 1e-12);
    }

    @Test
    void explicitHourAngleSurvivesNewReferenceJd() {
        CameraModel model = ModelFixtures.baseBuilder().referenceHourAngle(12.5).build();

        CameraModel moved = model.toBuilder().referenceJd(ModelFixtures.REF_JD + 0.3).build();

        assertEquals(12.5, moved.referenceHourAngle, 0);
    }
}
