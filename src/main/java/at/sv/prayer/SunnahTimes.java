package at.sv.prayer;

import at.sv.prayer.method.Rounding;

import java.time.Duration;
import java.time.Instant;

/**
 * Recommended times of the night, derived from the night between maghrib and the fajr of the following day.
 *
 * @param middleOfTheNight    the midpoint between maghrib and fajr
 * @param lastThirdOfTheNight the start of the last third of the period between maghrib and fajr
 */
public record SunnahTimes(Instant middleOfTheNight, Instant lastThirdOfTheNight) {

    /**
     * @throws PrayerTimesException if the schedule of the following day cannot be calculated
     */
    public static SunnahTimes from(PrayerSchedule schedule) {
        PrayerSchedule tomorrow = schedule.nextDay();
        Instant maghrib = schedule.getMaghrib();
        Duration night = Duration.between(maghrib, tomorrow.getFajr());
        return new SunnahTimes(
                Rounding.NEAREST.apply(maghrib.plus(night.dividedBy(2))),
                Rounding.NEAREST.apply(maghrib.plus(night.multipliedBy(2).dividedBy(3))));
    }
}
