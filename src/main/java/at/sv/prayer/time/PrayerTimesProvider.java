package at.sv.prayer.time;

import at.sv.prayer.PrayerName;
import at.sv.prayer.PrayerSchedule;

import java.time.LocalDate;
import java.time.ZonedDateTime;

public interface PrayerTimesProvider {

    /**
     * @param date the calendar day, as seen in the display zone
     * @throws at.sv.prayer.PrayerTimesException if no schedule can be calculated for that day
     */
    PrayerSchedule getSchedule(LocalDate date);

    /**
     * @return the time of the given prayer on the given day, in the display zone
     */
    ZonedDateTime getPrayerTime(PrayerName name, LocalDate date);

    default ZonedDateTime getFajr(LocalDate date) {
        return getPrayerTime(PrayerName.FAJR, date);
    }

    default ZonedDateTime getSunrise(LocalDate date) {
        return getPrayerTime(PrayerName.SUNRISE, date);
    }

    default ZonedDateTime getDhuhr(LocalDate date) {
        return getPrayerTime(PrayerName.DHUHR, date);
    }

    default ZonedDateTime getAsr(LocalDate date) {
        return getPrayerTime(PrayerName.ASR, date);
    }

    default ZonedDateTime getMaghrib(LocalDate date) {
        return getPrayerTime(PrayerName.MAGHRIB, date);
    }

    default ZonedDateTime getIsha(LocalDate date) {
        return getPrayerTime(PrayerName.ISHA, date);
    }

    default String toDebugString(LocalDate date) {
        return null;
    }
}
