package com.meteor.astrometry.service;

import com.meteor.astrometry.model.CameraModel;
import com.meteor.astrometry.model.CelestialPoint;
import com.meteor.astrometry.model.Detection;
import com.meteor.astrometry.model.HorizontalCoordinates;
import com.meteor.astrometry.model.ImageCoordinates;
import com.meteor.astrometry.model.SkyCoordinates;
import com.meteor.astrometry.util.ArrayChecks;
import com.meteor.astrometry.util.AstroMath;
import java.time.LocalDateTime;
import java.util.List;

public class ProjectionService {

    private final DistortionService distortion;
    private final SkyFrameService skyFrame;
    private final PhotometryService photometry;

    public ProjectionService() {
        this(new DistortionService(), new SkyFrameService(), new PhotometryService());
    }

    public ProjectionService(DistortionService distortion, SkyFrameService skyFrame, PhotometryService photometry) {
        this.distortion = distortion;
        this.skyFrame = skyFrame;
        this.photometry = photometry;
    }

    // --- PIXEL -> HORIZONTAL ---

    public HorizontalCoordinates pixelToHorizontal(CameraModel model, double[] x, double[] y) {
        return pixelToHorizontal(model, model.positionAngle, x, y);
    }

    /**
     * Azimuth/altitude of image points with the position angle given explicitly instead of taken
     * from the model. The horizontal frame is fixed to the camera, so no time is involved.
     */
    public HorizontalCoordinates pixelToHorizontal(CameraModel model, double positionAngle, double[] x, double[] y) {
        ImageCoordinates plane = distortion.rectify(model, x, y);

        double decRef = Math.toRadians(model.decCenter);
        double sdRef = Math.sin(decRef), cdRef = Math.cos(decRef);
        double sl = Math.sin(Math.toRadians(model.latitude));
        double cl = Math.cos(Math.toRadians(model.latitude));

        double[] az = new double[plane.size()];
        double[] alt = new double[plane.size()];

        for (int i = 0; i < plane.size(); i++) {
            double px = plane.x[i];
            double py = plane.y[i];

            double radius = Math.toRadians(Math.hypot(px, py));
            double theta = Math.toRadians(AstroMath.normalize360(90.0 - positionAngle + Math.toDegrees(Math.atan2(py, px))));
            double sr = Math.sin(radius), cr = Math.cos(radius);

            double sinDec = sdRef * cr + cdRef * sr * Math.cos(theta);
            double dec = Math.atan2(sinDec, Math.sqrt(Math.max(0.0, 1.0 - sinDec * sinDec)));

            double dRa = Math.toDegrees(Math.atan2(Math.sin(theta) * sr, cdRef * cr - sdRef * sr * Math.cos(theta)));
            double ra = AstroMath.normalize360(model.raCenter - dRa);

            double h = Math.toRadians(AstroMath.wrap180(model.referenceHourAngle + model.longitude - ra));
            double sh = Math.sin(h), ch = Math.cos(h);
            double sd = Math.sin(dec), cd = Math.cos(dec);

            double hx = -ch * cd * sl + sd * cl;
            double hy = -sh * cd;
            double hz = ch * cd * cl + sd * sl;

            az[i] = AstroMath.normalize360(Math.toDegrees(Math.atan2(hy, hx)));
            alt[i] = Math.toDegrees(Math.atan2(hz, Math.hypot(hx, hy)));
        }

        return new HorizontalCoordinates(az, alt);
    }

    // --- PIXEL -> SKY ---

    public SkyCoordinates pixelToSky(CameraModel model, LocalDateTime[] times, double[] x, double[] y, double[] levels) {
        ArrayChecks.requireNonNull("times", times);
        double[] jd = new double[times.length];
        for (int i = 0; i < times.length; i++) {
            jd[i] = skyFrame.julianDate(times[i]);
        }
        return pixelToSky(model, jd, x, y, levels);
    }

    public SkyCoordinates pixelToSky(CameraModel model, List<Detection> detections) {
        int n = detections.size();
        LocalDateTime[] times = new LocalDateTime[n];
        double[] x = new double[n];
        double[] y = new double[n];
        double[] levels = new double[n];
        for (int i = 0; i < n; i++) {
            Detection d = detections.get(i);
            times[i] = d.time;
            x[i] = d.x;
            y[i] = d.y;
            levels[i] = d.level;
        }
        return pixelToSky(model, times, x, y, levels);
    }

    public SkyCoordinates pixelToSky(CameraModel model, double[] jd, double[] x, double[] y, double[] levels) {
        return pixelToSky(model, model.positionAngle, jd, x, y, levels);
    }

    public SkyCoordinates pixelToSky(CameraModel model, double positionAngle, double[] jd, double[] x, double[] y, double[] levels) {
        ArrayChecks.requireSameLength("jd", jd, "x", x);
        ArrayChecks.requireSameLength("x", x, "y", y);
        ArrayChecks.requireSameLength("x", x, "levels", levels);

        HorizontalCoordinates hor = pixelToHorizontal(model, positionAngle, x, y);

        double[] ra = new double[x.length];
        double[] dec = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            CelestialPoint p = skyFrame.horizontalToEquatorial(jd[i], model.longitude, model.latitude,
                    hor.azimuth[i], hor.altitude[i]);
            ra[i] = p.ra;
            dec[i] = p.dec;
        }

        double[] magnitude = photometry.levelsToMagnitude(levels, model.magnitudeSlope, model.photometricOffset);

        return new SkyCoordinates(jd.clone(), ra, dec, magnitude);
    }

    /**
     * Sky position of the image centre at the given time.
     */
    public CelestialPoint fieldCentre(CameraModel model, double jd) {
        SkyCoordinates c = pixelToSky(model, new double[] { jd },
                new double[] { model.centerX() }, new double[] { model.centerY() }, new double[] { 1 });
        return c.point(0);
    }

    // --- SKY -> PIXEL ---

    public ImageCoordinates skyToPixel(CameraModel model, double[] ra, double[] dec, double jd) {
        return skyToPixel(model, ra, dec, jd, model.utCorrection);
    }

    public ImageCoordinates skyToPixel(CameraModel model, double[] ra, double[] dec, double jd, double utCorrectionHours) {
        ArrayChecks.requireSameLength("ra", ra, "dec", dec);

        // The camera does not move, so the optical axis keeps its hour angle and declination
        jd -= utCorrectionHours / 24.0;
        double centreRa = AstroMath.normalize360(model.raCenter
                + AstroMath.greenwichSiderealTime(jd) - AstroMath.greenwichSiderealTime(model.referenceJd));
        CelestialPoint centre = new CelestialPoint(centreRa, model.decCenter);

        double dc = Math.toRadians(centre.dec);
        double sdc = Math.sin(dc), cdc = Math.cos(dc);

        double[] planeX = new double[ra.length];
        double[] planeY = new double[ra.length];

        for (int i = 0; i < ra.length; i++) {
            double ds = Math.toRadians(dec[i]);
            double dRa = Math.toRadians(AstroMath.wrap180(ra[i] - centre.ra));
            double sds = Math.sin(ds), cds = Math.cos(ds);

            double a = cds * Math.sin(dRa);
            double b = cdc * sds - sdc * cds * Math.cos(dRa);
            double c = sdc * sds + cdc * cds * Math.cos(dRa);

            double radius = Math.toDegrees(Math.atan2(Math.hypot(a, b), c));

            // Bearing from the centre, rotated into the image frame
            double theta = Math.toRadians(-Math.toDegrees(Math.atan2(a, b)) + model.positionAngle - 90.0);

            planeX[i] = radius * Math.cos(theta) * model.scale;
            planeY[i] = radius * Math.sin(theta) * model.scale;
        }

        return distortion.distort(model, planeX, planeY);
    }
}
