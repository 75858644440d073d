package at.sv.prayer;

import at.sv.prayer.method.CalculationParameters;
import at.sv.prayer.method.IshaRule;
import at.sv.prayer.method.NightPortions;
import at.sv.prayer.time.SeasonalAdjustment;
import at.sv.prayer.time.SolarTime;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Calculates the prayer times of a single day.
 * <p>
 * Fajr and isha are first derived from their twilight angles. These candidates are then bounded by a safe value,
 * which is either a portion of the night given by the high latitude rule, or the seasonal twilight duration for
 * the Moonsighting Committee. Fajr is never earlier and isha never later than its safe value.
 */
@Slf4j
public final class PrayerTimesCalculator {

    /**
     * Latitude from which the Moonsighting Committee uses a seventh of the night for fajr and isha.
     */
    private static final double MOONSIGHTING_SEVENTH_LATITUDE = 55;

    private PrayerTimesCalculator() {
    }

    /**
     * @throws InvalidCoordinatesException  if latitude or longitude are out of range
     * @throws InvalidDateException         if the day is incomplete or invalid
     * @throws UnsolvableGeometryException  if the sun does not rise or set on the day or the day after
     * @throws IncompleteScheduleException  if asr cannot be determined, or the final times are not strictly
     *                                      increasing
     */
    public static PrayerSchedule calculate(Coordinates coordinates, CalendarDay calendarDay,
                                           CalculationParameters parameters) {
        if (!coordinates.isValid()) {
            throw new InvalidCoordinatesException("Invalid coordinates " + coordinates +
                                                  ". Latitude must be in [-90, 90], longitude in [-180, 180]");
        }
        LocalDate day = calendarDay.toLocalDate();
        SolarTime solarTime = new SolarTime(day, coordinates);
        SolarTime tomorrowSolarTime = new SolarTime(day.plusDays(1), coordinates);

        Instant sunrise = solarTime.getSunrise();
        Instant sunset = solarTime.getSunset();
        Instant dhuhr = solarTime.getTransit();
        Instant asr = calculateAsr(solarTime, parameters);
        Duration night = Duration.between(sunset, tomorrowSolarTime.getSunrise());

        Instant fajr = calculateFajr(solarTime, coordinates, parameters, night);
        Instant isha = calculateIsha(solarTime, coordinates, parameters, night);
        Instant maghrib = calculateMaghrib(solarTime, parameters, isha);

        List<Prayer> prayers = new ArrayList<>();
        prayers.add(finalPrayer(PrayerName.FAJR, fajr, parameters));
        prayers.add(finalPrayer(PrayerName.SUNRISE, sunrise, parameters));
        prayers.add(finalPrayer(PrayerName.DHUHR, dhuhr, parameters));
        prayers.add(finalPrayer(PrayerName.ASR, asr, parameters));
        prayers.add(finalPrayer(PrayerName.MAGHRIB, maghrib, parameters));
        prayers.add(finalPrayer(PrayerName.ISHA, isha, parameters));
        assertChronologicalOrder(prayers, coordinates, day);
        return new PrayerSchedule(coordinates, day, parameters, prayers);
    }

    /**
     * Same as {@link #calculate}, but returns empty instead of throwing if no schedule can be calculated.
     */
    public static Optional<PrayerSchedule> tryCalculate(Coordinates coordinates, CalendarDay calendarDay,
                                                        CalculationParameters parameters) {
        try {
            return Optional.of(calculate(coordinates, calendarDay, parameters));
        } catch (PrayerTimesException e) {
            log.debug("No prayer times for {} on {}: {}", coordinates, calendarDay, e.getMessage());
            return Optional.empty();
        }
    }

    private static Instant calculateAsr(SolarTime solarTime, CalculationParameters parameters) {
        try {
            return solarTime.afternoon(parameters.getMadhab().getShadowLength());
        } catch (UnsolvableGeometryException e) {
            throw new IncompleteScheduleException("Could not determine asr for " + parameters.getMadhab() +
                                                  " at " + solarTime.getCoordinates() + " on " + solarTime.getDay(), e);
        }
    }

    private static Instant calculateFajr(SolarTime solarTime, Coordinates coordinates,
                                         CalculationParameters parameters, Duration night) {
        Instant sunrise = solarTime.getSunrise();
        Instant candidate = timeForSolarAngle(solarTime, -parameters.getFajrAngle(), false);
        if (usesSeventhOfTheNight(coordinates, parameters)) {
            candidate = sunrise.minus(night.dividedBy(7));
        }

        Instant safeFajr;
        if (parameters.isMoonsightingCommittee()) {
            safeFajr = SeasonalAdjustment.morningTwilight(coordinates.latitude(), solarTime.getDay(), sunrise);
        } else {
            NightPortions portions = parameters.nightPortions(coordinates);
            safeFajr = sunrise.minus(fractionOf(night, portions.fajr()));
        }

        if (candidate == null || candidate.isBefore(safeFajr)) {
            log.trace("Use safe fajr {} instead of {}", safeFajr, candidate);
            return safeFajr;
        }
        return candidate;
    }

    private static Instant calculateIsha(SolarTime solarTime, Coordinates coordinates,
                                         CalculationParameters parameters, Duration night) {
        Instant sunset = solarTime.getSunset();
        if (parameters.getIshaRule() instanceof IshaRule.Interval interval) {
            return sunset.plus(Duration.ofMinutes(interval.minutes()));
        }
        IshaRule.Angle angle = (IshaRule.Angle) parameters.getIshaRule();
        Instant candidate = timeForSolarAngle(solarTime, -angle.degrees(), true);
        if (usesSeventhOfTheNight(coordinates, parameters)) {
            candidate = sunset.plus(night.dividedBy(7));
        }

        Instant safeIsha;
        if (parameters.isMoonsightingCommittee()) {
            safeIsha = SeasonalAdjustment.eveningTwilight(coordinates.latitude(), solarTime.getDay(), sunset,
                    parameters.getShafaq());
        } else {
            NightPortions portions = parameters.nightPortions(coordinates);
            safeIsha = sunset.plus(fractionOf(night, portions.isha()));
        }

        if (candidate == null || candidate.isAfter(safeIsha)) {
            log.trace("Use safe isha {} instead of {}", safeIsha, candidate);
            return safeIsha;
        }
        return candidate;
    }

    /**
     * Maghrib by angle is only used if it falls between sunset and isha, otherwise it is sunset.
     */
    private static Instant calculateMaghrib(SolarTime solarTime, CalculationParameters parameters, Instant isha) {
        Instant sunset = solarTime.getSunset();
        Double maghribAngle = parameters.getMaghribAngle();
        if (maghribAngle == null) {
            return sunset;
        }
        Instant candidate = timeForSolarAngle(solarTime, -maghribAngle, true);
        if (candidate != null && candidate.isAfter(sunset) && candidate.isBefore(isha)) {
            return candidate;
        }
        log.trace("Ignore maghrib angle time {}, use sunset {}", candidate, sunset);
        return sunset;
    }

    private static boolean usesSeventhOfTheNight(Coordinates coordinates, CalculationParameters parameters) {
        return parameters.isMoonsightingCommittee() &&
               Math.abs(coordinates.latitude()) >= MOONSIGHTING_SEVENTH_LATITUDE;
    }

    @Nullable
    private static Instant timeForSolarAngle(SolarTime solarTime, double angle, boolean afterTransit) {
        try {
            return solarTime.timeForSolarAngle(angle, afterTransit);
        } catch (UnsolvableGeometryException e) {
            log.trace("Fall back to safe value: {}", e.getMessage());
            return null;
        }
    }

    private static Duration fractionOf(Duration duration, double fraction) {
        return Duration.ofNanos(Math.round(duration.toNanos() * fraction));
    }

    /**
     * Close to polar day or night the asr altitude approaches the sun's maximum altitude, and its hour angle is no
     * longer reliable.
     */
    private static void assertChronologicalOrder(List<Prayer> prayers, Coordinates coordinates, LocalDate day) {
        for (int i = 1; i < prayers.size(); i++) {
            Prayer previous = prayers.get(i - 1);
            Prayer current = prayers.get(i);
            if (!previous.time().isBefore(current.time())) {
                throw new IncompleteScheduleException("Prayer times out of order at " + coordinates + " on " + day +
                                                      ": " + previous + " is not before " + current);
            }
        }
    }

    private static Prayer finalPrayer(PrayerName name, Instant time, CalculationParameters parameters) {
        Instant adjusted = time.plus(Duration.ofMinutes(parameters.getAdjustments().get(name)))
                               .plus(Duration.ofMinutes(parameters.getMethodAdjustments().get(name)));
        return Prayer.of(name, parameters.getRounding().apply(adjusted));
    }
}
