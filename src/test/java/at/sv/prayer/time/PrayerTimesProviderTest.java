package at.sv.prayer.time;

import at.sv.prayer.Coordinates;
import at.sv.prayer.PrayerName;
import at.sv.prayer.UnsolvableGeometryException;
import at.sv.prayer.method.CalculationMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PrayerTimesProviderTest {

    private static final ZoneId ZONE = ZoneId.of("Africa/Cairo");

    private LocalDate date;
    private PrayerTimesProviderImpl provider;

    private void assertTime(ZonedDateTime time, int hour, int minute) {
        assertThat("Time differs", time.toLocalTime(), is(LocalTime.of(hour, minute)));
        assertThat("Zone differs", time.getZone(), is(ZONE));
    }

    @BeforeEach
    void setUp() {
        date = LocalDate.of(2020, 1, 1);
        provider = new PrayerTimesProviderImpl(Coordinates.of(30.028703, 31.249528),
                CalculationMethod.EGYPTIAN.getParameters(), ZONE);
    }

    @Test
    void returnsPrayerTimesInDisplayZone() {
        assertTime(provider.getFajr(date), 5, 18);
        assertTime(provider.getSunrise(date), 6, 51);
        assertTime(provider.getDhuhr(date), 11, 59);
        assertTime(provider.getAsr(date), 14, 47);
        assertTime(provider.getMaghrib(date), 17, 6);
        assertTime(provider.getIsha(date), 18, 29);
    }

    @Test
    void getPrayerTime_sameAsSchedule() {
        assertThat(provider.getPrayerTime(PrayerName.ASR, date).toInstant(),
                is(provider.getSchedule(date).time(PrayerName.ASR)));
    }

    @Test
    void toDebugString_listsAllPrayers() {
        assertThat(provider.toDebugString(date), is("""
                fajr: 05:18:00
                sunrise: 06:51:00
                dhuhr: 11:59:00
                asr: 14:47:00
                maghrib: 17:06:00
                isha: 18:29:00"""));
    }

    @Test
    void getSchedule_polarNight_throws() {
        provider = new PrayerTimesProviderImpl(Coordinates.of(71.275009, -156.761368),
                CalculationMethod.MUSLIM_WORLD_LEAGUE.getParameters(), ZoneId.of("America/Anchorage"));

        assertThrows(UnsolvableGeometryException.class, () -> provider.getSchedule(LocalDate.of(2018, 1, 1)));
    }
}
