package com.meteor.astrometry.service;

import com.meteor.astrometry.model.CameraModel;
import com.meteor.astrometry.model.FieldOfView;
import com.meteor.astrometry.model.HorizontalCoordinates;
import com.meteor.astrometry.model.RotationFrame;
import com.meteor.astrometry.model.SkyCoordinates;
import com.meteor.astrometry.util.AstroMath;
import java.util.Arrays;

public class FieldGeometryService {

    // Offset (px) of the probe point to the right of the image centre
    static final double PROBE_OFFSET = 10.0;

    private final ProjectionService projection;

    public FieldGeometryService() {
        this(new ProjectionService());
    }

    public FieldGeometryService(ProjectionService projection) {
        this.projection = projection;
    }

    /**
     * Angular distance between the midpoints of the left/right and top/bottom image edges.
     */
    public FieldOfView fieldOfView(CameraModel model) {
        double w = model.xResolution;
        double h = model.yResolution;

        double[] x = { 0, w, w / 2, w / 2 };
        double[] y = { h / 2, h / 2, 0, h };
        double[] jd = new double[4];
        Arrays.fill(jd, model.referenceJd);

        SkyCoordinates sky = projection.pixelToSky(model, jd, x, y, new double[] { 1, 1, 1, 1 });

        double fovH = AstroMath.angularSeparation(sky.ra[0], sky.dec[0], sky.ra[1], sky.dec[1]);
        double fovV = AstroMath.angularSeparation(sky.ra[2], sky.dec[2], sky.ra[3], sky.dec[3]);

        return new FieldOfView(fovH, fovV);
    }

    public double rotationWrtHorizon(CameraModel model) {
        return rotationWrtHorizon(model, model.positionAngle);
    }

    /**
     * Angle of the image X axis above the horizon, (-180, 180].
     */
    public double rotationWrtHorizon(CameraModel model, double positionAngle) {
        double cx = model.centerX();
        double cy = model.centerY();

        HorizontalCoordinates hor = projection.pixelToHorizontal(model, positionAngle,
                new double[] { cx, cx + PROBE_OFFSET }, new double[] { cy, cy });

        double dAlt = Math.toRadians(hor.altitude[1] - hor.altitude[0]);
        double dAz = Math.toRadians(AstroMath.wrap180(hor.azimuth[1] - hor.azimuth[0]));

        return AstroMath.wrap180(Math.toDegrees(Math.atan2(dAlt, dAz)));
    }

    public double rotationWrtStandard(CameraModel model) {
        return rotationWrtStandard(model, model.positionAngle);
    }

    /**
     * Rotation of the image X axis from the celestial meridian through the field centre, [0, 360).
     */
    public double rotationWrtStandard(CameraModel model, double positionAngle) {
        double cx = model.centerX();
        double cy = model.centerY();

        SkyCoordinates sky = projection.pixelToSky(model, positionAngle,
                new double[] { model.referenceJd, model.referenceJd },
                new double[] { cx, cx + PROBE_OFFSET }, new double[] { cy, cy }, new double[] { 1, 1 });

        double dDec = Math.toRadians(sky.dec[0] - sky.dec[1]);
        double dRa = Math.toRadians(AstroMath.wrap180(sky.ra[0] - sky.ra[1]));

        return AstroMath.normalize360(Math.toDegrees(Math.atan2(dDec, dRa)));
    }

    public double rotation(CameraModel model, double positionAngle, RotationFrame frame) {
        switch (frame) {
            case HORIZON:
                return rotationWrtHorizon(model, positionAngle);
            case STANDARD:
                return rotationWrtStandard(model, positionAngle);
            default:
                throw new IllegalArgumentException("Unknown rotation frame: " + frame);
        }
    }
}
