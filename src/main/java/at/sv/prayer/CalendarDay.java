package at.sv.prayer;

import org.jetbrains.annotations.Nullable;

import java.time.DateTimeException;
import java.time.LocalDate;

/**
 * A proleptic Gregorian calendar day in UTC, without a time of day. Components may be unset; such a day can be
 * represented but not resolved.
 */
public record CalendarDay(@Nullable Integer year, @Nullable Integer month, @Nullable Integer day) {

    private static final int MIN_YEAR = 1;
    private static final int MAX_YEAR = 9999;

    public static CalendarDay of(int year, int month, int day) {
        return new CalendarDay(year, month, day);
    }

    public static CalendarDay of(LocalDate date) {
        return new CalendarDay(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    public static CalendarDay unset() {
        return new CalendarDay(null, null, null);
    }

    /**
     * @throws InvalidDateException if a component is unset, or the components do not form a valid date
     */
    public LocalDate toLocalDate() {
        if (year == null || month == null || day == null) {
            throw new InvalidDateException("Incomplete calendar day " + this + ": year, month and day are required");
        }
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new InvalidDateException("Unsupported year in " + this + ". Supported range: [" + MIN_YEAR + ".." + MAX_YEAR + "]");
        }
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            throw new InvalidDateException("Invalid calendar day " + this + ": " + e.getMessage(), e);
        }
    }

    public CalendarDay plusDays(long days) {
        return of(toLocalDate().plusDays(days));
    }

    @Override
    public String toString() {
        return year + "-" + month + "-" + day;
    }
}
