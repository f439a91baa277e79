package com.meteor.astrometry.service;

import com.meteor.astrometry.model.CameraModel;
import com.meteor.astrometry.model.ImageCoordinates;
import com.meteor.astrometry.model.MatchResiduals;
import com.meteor.astrometry.util.ArrayChecks;
import com.meteor.astrometry.util.AstroMath;

public class StarResidualService {

    private final ProjectionService projection;

    public StarResidualService() {
        this(new ProjectionService());
    }

    public StarResidualService(ProjectionService projection) {
        this.projection = projection;
    }

    /**
     * @param catalogRa  RA of the matched catalog stars (deg)
     * @param catalogDec Dec of the matched catalog stars (deg)
     * @param imageX     measured X of the same stars (px)
     * @param imageY     measured Y of the same stars (px)
     * @param jd         time of the image
     */
    public MatchResiduals residuals(CameraModel model, double[] catalogRa, double[] catalogDec,
                                    double[] imageX, double[] imageY, double jd) {
        ArrayChecks.requireSameLength("catalogRa", catalogRa, "catalogDec", catalogDec);
        ArrayChecks.requireSameLength("imageX", imageX, "imageY", imageY);
        ArrayChecks.requireSameLength("catalogRa", catalogRa, "imageX", imageX);

        ImageCoordinates predicted = projection.skyToPixel(model, catalogRa, catalogDec, jd);

        int n = imageX.length;
        double[] dx = new double[n];
        double[] dy = new double[n];
        double[] distance = new double[n];
        double[] angle = new double[n];
        for (int i = 0; i < n; i++) {
            dx[i] = predicted.x[i] - imageX[i];
            dy[i] = predicted.y[i] - imageY[i];
            distance[i] = Math.hypot(dx[i], dy[i]);
            angle[i] = Math.toDegrees(Math.atan2(dy[i], dx[i]));
        }

        return new MatchResiduals(dx, dy, distance, angle, AstroMath.median(distance));
    }
}
