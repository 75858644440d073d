package at.sv.prayer;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public final class FormatUtil {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm");

    private FormatUtil() {
    }

    /**
     * Formats the given angle with at most one decimal, omitting a trailing ".0".
     */
    public static String formatDegrees(double degrees) {
        double roundedOneDecimal = Math.round(degrees * 10.0) / 10.0;
        if (Math.abs(roundedOneDecimal - Math.rint(roundedOneDecimal)) < 0.0001) {
            return (int) Math.rint(roundedOneDecimal) + "°";
        }
        return String.format(Locale.ROOT, "%.1f°", roundedOneDecimal);
    }

    public static String formatTime(ZonedDateTime time) {
        return TIME_FORMATTER.format(time);
    }
}
