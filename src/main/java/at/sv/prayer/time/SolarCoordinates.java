package at.sv.prayer.time;

import lombok.Getter;
import lombok.ToString;

/**
 * The apparent position of the sun at a given Julian day. All values in degrees.
 */
@Getter
@ToString
public final class SolarCoordinates {

    /**
     * The angle between the rays of the sun and the plane of the earth's equator.
     */
    private final double declination;
    /**
     * The angular distance on the celestial equator from the vernal equinox to the hour circle, in [0, 360).
     */
    private final double rightAscension;
    /**
     * The hour angle of the vernal equinox at Greenwich, corrected for nutation.
     */
    private final double apparentSiderealTime;

    public SolarCoordinates(double julianDay) {
        double T = Astronomical.julianCentury(julianDay);
        double L0 = Astronomical.meanSolarLongitude(T);
        double Lp = Astronomical.meanLunarLongitude(T);
        double omega = Astronomical.ascendingLunarNodeLongitude(T);
        double lambda = Math.toRadians(Astronomical.apparentSolarLongitude(T, L0));
        double theta0 = Astronomical.meanSiderealTime(T);
        double dPsi = Astronomical.nutationInLongitude(L0, Lp, omega);
        double dEpsilon = Astronomical.nutationInObliquity(L0, Lp, omega);
        double epsilon0 = Astronomical.meanObliquityOfTheEcliptic(T);
        double epsilonApparent = Math.toRadians(Astronomical.apparentObliquityOfTheEcliptic(T, epsilon0));

        declination = Math.toDegrees(Math.asin(Math.sin(epsilonApparent) * Math.sin(lambda)));
        rightAscension = Astronomical.unwindAngle(Math.toDegrees(
                Math.atan2(Math.cos(epsilonApparent) * Math.sin(lambda), Math.cos(lambda))));
        apparentSiderealTime = theta0 + (dPsi * Math.cos(Math.toRadians(epsilon0 + dEpsilon)));
    }
}
