package at.sv.prayer.time;

import at.sv.prayer.CalendarDay;
import at.sv.prayer.Coordinates;
import at.sv.prayer.PrayerName;
import at.sv.prayer.PrayerSchedule;
import at.sv.prayer.PrayerTimesCalculator;
import at.sv.prayer.method.CalculationParameters;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Resolves prayer times for a fixed location and parameters in a display zone. Nothing is cached, every call
 * recalculates the schedule.
 */
public final class PrayerTimesProviderImpl implements PrayerTimesProvider {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Coordinates coordinates;
    private final CalculationParameters parameters;
    private final ZoneId zone;

    public PrayerTimesProviderImpl(Coordinates coordinates, CalculationParameters parameters, ZoneId zone) {
        this.coordinates = coordinates;
        this.parameters = parameters;
        this.zone = zone;
    }

    @Override
    public PrayerSchedule getSchedule(LocalDate date) {
        return PrayerTimesCalculator.calculate(coordinates, CalendarDay.of(date), parameters);
    }

    @Override
    public ZonedDateTime getPrayerTime(PrayerName name, LocalDate date) {
        return getSchedule(date).time(name).atZone(zone);
    }

    @Override
    public String toDebugString(LocalDate date) {
        PrayerSchedule schedule = getSchedule(date);
        StringBuilder sb = new StringBuilder();
        for (PrayerName name : PrayerName.values()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(name.getDisplayName()).append(": ").append(format(schedule.time(name).atZone(zone)));
        }
        return sb.toString();
    }

    private String format(ZonedDateTime time) {
        return TIME_FORMATTER.format(time);
    }
}
