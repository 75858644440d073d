package at.sv.prayer.time;

/**
 * Low precision solar formulas and the transit / hour angle solver, following Jean Meeus,
 * <i>Astronomical Algorithms</i>, 2nd edition. All angles are in degrees, times are fractions of a day unless
 * noted otherwise.
 */
public final class Astronomical {

    private static final double J2000 = 2451545.0;
    private static final double DAYS_PER_CENTURY = 36525.0;
    private static final double SIDEREAL_DEGREES_PER_DAY = 360.985647;

    private Astronomical() {
    }

    /**
     * @return the geometric mean longitude of the sun, L0
     */
    static double meanSolarLongitude(double T) {
        double term1 = 280.4664567;
        double term2 = 36000.76983 * T;
        double term3 = 0.0003032 * Math.pow(T, 2);
        return unwindAngle(term1 + term2 + term3);
    }

    /**
     * @return the geometric mean longitude of the moon, L'
     */
    static double meanLunarLongitude(double T) {
        double term1 = 218.3165;
        double term2 = 481267.8813 * T;
        return unwindAngle(term1 + term2);
    }

    /**
     * @return the longitude of the ascending node of the moon's mean orbit, Ω
     */
    static double ascendingLunarNodeLongitude(double T) {
        double term1 = 125.04452;
        double term2 = 1934.136261 * T;
        double term3 = 0.0020708 * Math.pow(T, 2);
        double term4 = Math.pow(T, 3) / 450000;
        return unwindAngle(term1 - term2 + term3 + term4);
    }

    /**
     * @return the mean anomaly of the sun, M
     */
    static double meanSolarAnomaly(double T) {
        double term1 = 357.52911;
        double term2 = 35999.05029 * T;
        double term3 = 0.0001537 * Math.pow(T, 2);
        return unwindAngle(term1 + term2 - term3);
    }

    /**
     * @return the sun's equation of the center, C
     */
    static double solarEquationOfTheCenter(double T, double M) {
        double mRad = Math.toRadians(M);
        double term1 = (1.914602 - (0.004817 * T) - (0.000014 * Math.pow(T, 2))) * Math.sin(mRad);
        double term2 = (0.019993 - (0.000101 * T)) * Math.sin(2 * mRad);
        double term3 = 0.000289 * Math.sin(3 * mRad);
        return term1 + term2 + term3;
    }

    /**
     * @return the apparent longitude of the sun, referred to the true equinox of the date, λ
     */
    static double apparentSolarLongitude(double T, double L0) {
        double longitude = L0 + solarEquationOfTheCenter(T, meanSolarAnomaly(T));
        double omega = 125.04 - (1934.136 * T);
        double lambda = longitude - 0.00569 - (0.00478 * Math.sin(Math.toRadians(omega)));
        return unwindAngle(lambda);
    }

    /**
     * @return the mean obliquity of the ecliptic as adopted by the IAU, ε0
     */
    static double meanObliquityOfTheEcliptic(double T) {
        double term1 = 23.439291;
        double term2 = 0.013004167 * T;
        double term3 = 0.0000001639 * Math.pow(T, 2);
        double term4 = 0.0000005036 * Math.pow(T, 3);
        return term1 - term2 - term3 + term4;
    }

    /**
     * @return the obliquity of the ecliptic corrected for the apparent position of the sun
     */
    static double apparentObliquityOfTheEcliptic(double T, double epsilon0) {
        double omega = 125.04 - (1934.136 * T);
        return epsilon0 + (0.00256 * Math.cos(Math.toRadians(omega)));
    }

    /**
     * @return the mean sidereal time at Greenwich, the hour angle of the vernal equinox, θ0
     */
    static double meanSiderealTime(double T) {
        double jd = (T * DAYS_PER_CENTURY) + J2000;
        double term1 = 280.46061837;
        double term2 = 360.98564736629 * (jd - J2000);
        double term3 = 0.000387933 * Math.pow(T, 2);
        double term4 = Math.pow(T, 3) / 38710000;
        return unwindAngle(term1 + term2 + term3 - term4);
    }

    static double nutationInLongitude(double L0, double Lp, double omega) {
        double term1 = (-17.2 / 3600) * Math.sin(Math.toRadians(omega));
        double term2 = (1.32 / 3600) * Math.sin(2 * Math.toRadians(L0));
        double term3 = (0.23 / 3600) * Math.sin(2 * Math.toRadians(Lp));
        double term4 = (0.21 / 3600) * Math.sin(2 * Math.toRadians(omega));
        return term1 - term2 - term3 + term4;
    }

    static double nutationInObliquity(double L0, double Lp, double omega) {
        double term1 = (9.2 / 3600) * Math.cos(Math.toRadians(omega));
        double term2 = (0.57 / 3600) * Math.cos(2 * Math.toRadians(L0));
        double term3 = (0.10 / 3600) * Math.cos(2 * Math.toRadians(Lp));
        double term4 = (0.09 / 3600) * Math.cos(2 * Math.toRadians(omega));
        return term1 + term2 + term3 - term4;
    }

    /**
     * @return the altitude of a celestial body with declination {@code delta} at local hour angle {@code H}
     */
    static double altitudeOfCelestialBody(double phi, double delta, double H) {
        double term1 = Math.sin(Math.toRadians(phi)) * Math.sin(Math.toRadians(delta));
        double term2 = Math.cos(Math.toRadians(phi)) * Math.cos(Math.toRadians(delta)) * Math.cos(Math.toRadians(H));
        return Math.toDegrees(Math.asin(term1 + term2));
    }

    /**
     * @param longitude     the observer longitude, positive east
     * @param siderealTime  the apparent sidereal time at Greenwich at 0h UT
     * @param rightAscension the right ascension of the sun at 0h UT
     * @return the approximate time of transit as a fraction of the day, in [0, 1)
     */
    static double approximateTransit(double longitude, double siderealTime, double rightAscension) {
        double lw = longitude * -1;
        return normalizeWithBound((rightAscension + lw - siderealTime) / 360, 1);
    }

    /**
     * @return the time of transit in hours, in [0, 24)
     */
    static double correctedTransit(double m0, double longitude, double siderealTime, SolarCoordinatesWindow window) {
        double lw = longitude * -1;
        double theta = unwindAngle(siderealTime + (SIDEREAL_DEGREES_PER_DAY * m0));
        double alpha = unwindAngle(window.interpolateRightAscension(m0));
        double H = closestAngle(theta - lw - alpha);
        double dm = H / -360;
        return normalizeWithBound((m0 + dm) * 24, 24);
    }

    /**
     * Solves for the time at which the sun reaches the altitude {@code h0}, refined once against the
     * interpolated solar position at that time.
     *
     * @return hours since 0h UT of the day; values below 0 or from 24 on belong to the adjacent days.
     * {@link Double#NaN} if the altitude is never reached on that day.
     */
    static double correctedHourAngle(double m0, double h0, double latitude, double longitude, boolean afterTransit,
                                     double siderealTime, SolarCoordinatesWindow window) {
        double lw = longitude * -1;
        double delta2 = window.current().getDeclination();
        double term1 = Math.sin(Math.toRadians(h0)) - (Math.sin(Math.toRadians(latitude)) * Math.sin(Math.toRadians(delta2)));
        double term2 = Math.cos(Math.toRadians(latitude)) * Math.cos(Math.toRadians(delta2));
        double H0 = Math.toDegrees(Math.acos(term1 / term2));
        double m = afterTransit ? m0 + (H0 / 360) : m0 - (H0 / 360);
        double theta = unwindAngle(siderealTime + (SIDEREAL_DEGREES_PER_DAY * m));
        double alpha = unwindAngle(window.interpolateRightAscension(m));
        double delta = window.interpolateDeclination(m);
        double H = (theta - lw - alpha);
        double h = altitudeOfCelestialBody(latitude, delta, H);
        double term3 = h - h0;
        double term4 = 360 * Math.cos(Math.toRadians(delta)) * Math.cos(Math.toRadians(latitude)) * Math.sin(Math.toRadians(H));
        double dm = term3 / term4;
        return (m + dm) * 24;
    }

    /**
     * Interpolates a value from three sequential values, Meeus formula 3.3.
     *
     * @param y2 the value of the middle day
     * @param y1 the value of the previous day
     * @param y3 the value of the next day
     * @param n  the interpolation factor, measured from the middle value
     */
    static double interpolate(double y2, double y1, double y3, double n) {
        double a = y2 - y1;
        double b = y3 - y2;
        double c = b - a;
        return y2 + ((n / 2) * (a + b + (n * c)));
    }

    /**
     * Like {@link #interpolate} but for angles, unwinding the differences across the 0/360 boundary.
     */
    static double interpolateAngles(double y2, double y1, double y3, double n) {
        double a = unwindAngle(y2 - y1);
        double b = unwindAngle(y3 - y2);
        double c = b - a;
        return y2 + ((n / 2) * (a + b + (n * c)));
    }

    /**
     * @return the Julian day of the given proleptic Gregorian date, {@code hours} into the day (UT)
     */
    static double julianDay(int year, int month, int day, double hours) {
        int Y = month > 2 ? year : year - 1;
        int M = month > 2 ? month : month + 12;
        double D = day + (hours / 24);

        int A = Y / 100;
        int B = 2 - A + (A / 4);

        int i0 = (int) (365.25 * (Y + 4716));
        int i1 = (int) (30.6001 * (M + 1));
        return i0 + i1 + D + B - 1524.5;
    }

    static double julianCentury(double julianDay) {
        return (julianDay - J2000) / DAYS_PER_CENTURY;
    }

    static double normalizeWithBound(double value, double max) {
        return value - (max * (Math.floor(value / max)));
    }

    public static double unwindAngle(double value) {
        return normalizeWithBound(value, 360);
    }

    /**
     * @return the angle shifted into [-180, 180]
     */
    static double closestAngle(double angle) {
        if (angle >= -180 && angle <= 180) {
            return angle;
        }
        return angle - (360 * Math.round(angle / 360));
    }
}
