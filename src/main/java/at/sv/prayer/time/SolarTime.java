package at.sv.prayer.time;

import at.sv.prayer.Coordinates;
import at.sv.prayer.UnsolvableGeometryException;
import lombok.Getter;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Solar events of a single UTC day at a single location.
 */
public final class SolarTime {

    /**
     * Altitude of the sun's center at sunrise and sunset: refraction plus the apparent solar radius.
     */
    private static final double SUNRISE_ALTITUDE = -50.0 / 60.0;

    @Getter
    private final LocalDate day;
    @Getter
    private final Coordinates coordinates;
    @Getter
    private final Instant transit;
    @Getter
    private final Instant sunrise;
    @Getter
    private final Instant sunset;

    private final SolarCoordinatesWindow window;
    private final double approximateTransit;

    /**
     * @throws UnsolvableGeometryException if the sun does not rise or set on that day
     */
    public SolarTime(LocalDate day, Coordinates coordinates) {
        this.day = day;
        this.coordinates = coordinates;
        double julianDay = Astronomical.julianDay(day.getYear(), day.getMonthValue(), day.getDayOfMonth(), 0);
        window = SolarCoordinatesWindow.around(julianDay);
        SolarCoordinates solar = window.current();

        approximateTransit = Astronomical.approximateTransit(coordinates.longitude(), solar.getApparentSiderealTime(),
                solar.getRightAscension());
        transit = toInstant(Astronomical.correctedTransit(approximateTransit, coordinates.longitude(),
                solar.getApparentSiderealTime(), window), "transit");
        sunrise = toInstant(hourAngle(SUNRISE_ALTITUDE, false), "sunrise");
        sunset = toInstant(hourAngle(SUNRISE_ALTITUDE, true), "sunset");
    }

    /**
     * @param angle        the altitude of the sun in degrees, negative below the horizon
     * @param afterTransit true for the afternoon / evening crossing, false for the morning one
     * @throws UnsolvableGeometryException if the sun does not reach that altitude on this day
     */
    public Instant timeForSolarAngle(double angle, boolean afterTransit) {
        return toInstant(hourAngle(angle, afterTransit), "solar angle " + angle);
    }

    /**
     * @param shadowLength the shadow length of an object in multiples of its height, on top of its noon shadow
     * @return the time in the afternoon when that shadow length is reached
     */
    public Instant afternoon(double shadowLength) {
        double tangent = Math.abs(coordinates.latitude() - window.current().getDeclination());
        double inverse = shadowLength + Math.tan(Math.toRadians(tangent));
        double angle = Math.toDegrees(Math.atan(1.0 / inverse));
        return timeForSolarAngle(angle, true);
    }

    private double hourAngle(double angle, boolean afterTransit) {
        return Astronomical.correctedHourAngle(approximateTransit, angle, coordinates.latitude(),
                coordinates.longitude(), afterTransit, window.current().getApparentSiderealTime(), window);
    }

    /**
     * Resolves hours since the start of the day, truncated to whole seconds. Values outside [0, 24) roll over
     * into the adjacent days.
     */
    private Instant toInstant(double hours, String event) {
        if (!Double.isFinite(hours)) {
            throw new UnsolvableGeometryException("No " + event + " at " + coordinates + " on " + day);
        }
        double calculatedHours = Math.floor(hours);
        double calculatedMinutes = Math.floor((hours - calculatedHours) * 60);
        double calculatedSeconds = Math.floor((hours - (calculatedHours + calculatedMinutes / 60)) * 60 * 60);
        long seconds = (long) calculatedHours * 3600 + (long) calculatedMinutes * 60 + (long) calculatedSeconds;
        return day.atStartOfDay(ZoneOffset.UTC).toInstant().plusSeconds(seconds);
    }
}
