package at.sv.prayer;

import at.sv.prayer.method.CalculationParameters;
import lombok.Getter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * The six prayer times of one day, together with the inputs they were calculated from.
 */
public final class PrayerSchedule {

    @Getter
    private final Coordinates coordinates;
    @Getter
    private final LocalDate day;
    @Getter
    private final CalculationParameters parameters;
    @Getter
    private final List<Prayer> prayers;

    PrayerSchedule(Coordinates coordinates, LocalDate day, CalculationParameters parameters, List<Prayer> prayers) {
        if (prayers.size() != PrayerName.values().length) {
            throw new IllegalArgumentException("Expected all prayers, got " + prayers);
        }
        this.coordinates = coordinates;
        this.day = day;
        this.parameters = parameters;
        this.prayers = List.copyOf(prayers);
    }

    public Instant time(PrayerName name) {
        return prayer(name).time();
    }

    public Prayer prayer(PrayerName name) {
        return prayers.get(name.ordinal());
    }

    public Instant getFajr() {
        return time(PrayerName.FAJR);
    }

    public Instant getSunrise() {
        return time(PrayerName.SUNRISE);
    }

    public Instant getDhuhr() {
        return time(PrayerName.DHUHR);
    }

    public Instant getAsr() {
        return time(PrayerName.ASR);
    }

    public Instant getMaghrib() {
        return time(PrayerName.MAGHRIB);
    }

    public Instant getIsha() {
        return time(PrayerName.ISHA);
    }

    /**
     * @return the last prayer that started at or before the given time, or empty if the time lies before fajr
     */
    public Optional<Prayer> currentPrayer(Instant time) {
        Prayer current = null;
        for (Prayer prayer : prayers) {
            if (prayer.time().isAfter(time)) {
                break;
            }
            current = prayer;
        }
        return Optional.ofNullable(current);
    }

    /**
     * @return the first prayer starting after the given time. After isha, this is the fajr of the following day.
     * @throws PrayerTimesException if the schedule of the following day is needed but cannot be calculated
     */
    public Prayer nextPrayer(Instant time) {
        for (Prayer prayer : prayers) {
            if (prayer.time().isAfter(time)) {
                return prayer;
            }
        }
        return nextDay().prayer(PrayerName.FAJR);
    }

    public PrayerSchedule nextDay() {
        return PrayerTimesCalculator.calculate(coordinates, CalendarDay.of(day.plusDays(1)), parameters);
    }

    public PrayerSchedule previousDay() {
        return PrayerTimesCalculator.calculate(coordinates, CalendarDay.of(day.minusDays(1)), parameters);
    }

    @Override
    public String toString() {
        return "PrayerSchedule{" +
               "day=" + day +
               ", coordinates=" + coordinates +
               ", prayers=" + prayers +
               '}';
    }
}
