package at.sv.prayer;

import java.util.Locale;

/**
 * The six daily events of a prayer schedule, in chronological order.
 */
public enum PrayerName {
    FAJR,
    SUNRISE,
    DHUHR,
    ASR,
    MAGHRIB,
    ISHA;

    public String getDisplayName() {
        return name().toLowerCase(Locale.ENGLISH);
    }
}
