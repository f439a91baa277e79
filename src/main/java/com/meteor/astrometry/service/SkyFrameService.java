package com.meteor.astrometry.service;

import com.meteor.astrometry.model.CelestialPoint;
import com.meteor.astrometry.model.HorizontalCoordinates;
import com.meteor.astrometry.model.HorizontalPoint;
import com.meteor.astrometry.util.ArrayChecks;
import com.meteor.astrometry.util.AstroMath;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

public class SkyFrameService {

    // Altitude used instead of the zenith, where the hour angle is undefined
    static final double ZENITH_NUDGE = 89.9999;

    /**
     * Julian date of a calendar instant. The UT correction (hours) is subtracted, so a clock running
     * ahead of UT by N hours is brought back with a correction of N.
     */
    public double julianDate(LocalDateTime time, double utCorrectionHours) {
        long millis = time.toInstant(ZoneOffset.UTC).toEpochMilli();
        return AstroMath.JD_UNIX_EPOCH + millis / AstroMath.MILLIS_PER_DAY - utCorrectionHours / 24.0;
    }

    public double julianDate(LocalDateTime time) {
        return julianDate(time, 0);
    }

    public LocalDateTime julianDateToDateTime(double jd) {
        long millis = Math.round((jd - AstroMath.JD_UNIX_EPOCH) * AstroMath.MILLIS_PER_DAY);
        return LocalDateTime.ofInstant(Instant.ofEpochMilli(millis), ZoneOffset.UTC);
    }

    public double localSiderealTime(double jd, double longitude) {
        return AstroMath.normalize360(AstroMath.greenwichSiderealTime(jd) + longitude);
    }

    public HorizontalPoint equatorialToHorizontal(double jd, double lon, double lat, double ra, double dec) {
        double ha = Math.toRadians(AstroMath.wrap180(localSiderealTime(jd, lon) - ra));
        double phi = Math.toRadians(lat);
        double d = Math.toRadians(dec);

        double sl = Math.sin(phi), cl = Math.cos(phi);
        double sd = Math.sin(d), cd = Math.cos(d);
        double sh = Math.sin(ha), ch = Math.cos(ha);

        double x = -ch * cd * sl + sd * cl;
        double y = -sh * cd;
        double azimuth = AstroMath.normalize360(Math.toDegrees(Math.atan2(y, x)));

        // Rounding can push the sine a hair past 1 near the zenith
        double sinAlt = AstroMath.clampUnit(sl * sd + cl * cd * ch);
        double altitude = Math.toDegrees(Math.asin(sinAlt));

        return new HorizontalPoint(azimuth, altitude);
    }

    public HorizontalCoordinates equatorialToHorizontal(double jd, double lon, double lat, double[] ra, double[] dec) {
        ArrayChecks.requireSameLength("ra", ra, "dec", dec);
        double[] az = new double[ra.length];
        double[] alt = new double[ra.length];
        for (int i = 0; i < ra.length; i++) {
            HorizontalPoint p = equatorialToHorizontal(jd, lon, lat, ra[i], dec[i]);
            az[i] = p.azimuth;
            alt[i] = p.altitude;
        }
        return new HorizontalCoordinates(az, alt);
    }

    public HorizontalCoordinates equatorialToHorizontal(double[] jd, double lon, double lat, double[] ra, double[] dec) {
        ArrayChecks.requireSameLength("jd", jd, "ra", ra);
        ArrayChecks.requireSameLength("ra", ra, "dec", dec);
        double[] az = new double[ra.length];
        double[] alt = new double[ra.length];
        for (int i = 0; i < ra.length; i++) {
            HorizontalPoint p = equatorialToHorizontal(jd[i], lon, lat, ra[i], dec[i]);
            az[i] = p.azimuth;
            alt[i] = p.altitude;
        }
        return new HorizontalCoordinates(az, alt);
    }

    public CelestialPoint horizontalToEquatorial(double jd, double lon, double lat, double azimuth, double altitude) {
        if (altitude == 90.0) altitude = ZENITH_NUDGE;

        double az = Math.toRadians(azimuth);
        double alt = Math.toRadians(altitude);
        double phi = Math.toRadians(lat);

        double saz = Math.sin(az), caz = Math.cos(az);
        double salt = Math.sin(alt), calt = Math.cos(alt);
        double sl = Math.sin(phi), cl = Math.cos(phi);

        double x = -saz * calt;
        double y = -caz * sl * calt + salt * cl;
        double ha = Math.toDegrees(Math.atan2(x, y));

        double ra = AstroMath.normalize360(AstroMath.greenwichSiderealTime(jd) + lon - ha);
        double dec = Math.toDegrees(Math.asin(AstroMath.clampUnit(sl * salt + cl * calt * caz)));

        return new CelestialPoint(ra, dec);
    }

    public double angularSeparation(CelestialPoint a, CelestialPoint b) {
        return AstroMath.angularSeparation(a.ra, a.dec, b.ra, b.dec);
    }
}
