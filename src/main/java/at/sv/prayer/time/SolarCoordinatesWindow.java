package at.sv.prayer.time;

/**
 * The solar positions of three consecutive days at 0h UT, used to interpolate the position of the sun at any time
 * of the middle day.
 */
public record SolarCoordinatesWindow(SolarCoordinates previous, SolarCoordinates current, SolarCoordinates next) {

    /**
     * @param julianDay the Julian day of the middle day at 0h UT
     */
    public static SolarCoordinatesWindow around(double julianDay) {
        return new SolarCoordinatesWindow(
                new SolarCoordinates(julianDay - 1),
                new SolarCoordinates(julianDay),
                new SolarCoordinates(julianDay + 1));
    }

    /**
     * @param n fraction of the middle day, may lie slightly outside [0, 1]
     */
    public double interpolateRightAscension(double n) {
        return Astronomical.interpolateAngles(current.getRightAscension(), previous.getRightAscension(),
                next.getRightAscension(), n);
    }

    public double interpolateDeclination(double n) {
        return Astronomical.interpolate(current.getDeclination(), previous.getDeclination(),
                next.getDeclination(), n);
    }
}
