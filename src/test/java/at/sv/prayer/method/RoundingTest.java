package at.sv.prayer.method;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

class RoundingTest {

    private static Instant instant(String text) {
        return Instant.parse(text);
    }

    @Test
    void nearest_roundsHalfMinuteUp() {
        assertThat(Rounding.NEAREST.apply(instant("2020-01-01T10:15:29.999Z")), is(instant("2020-01-01T10:15:00Z")));
        assertThat(Rounding.NEAREST.apply(instant("2020-01-01T10:15:30Z")), is(instant("2020-01-01T10:16:00Z")));
        assertThat(Rounding.NEAREST.apply(instant("2020-01-01T23:59:45Z")), is(instant("2020-01-02T00:00:00Z")));
    }

    @Test
    void up_roundsAnySecondUp() {
        assertThat(Rounding.UP.apply(instant("2020-01-01T10:15:00Z")), is(instant("2020-01-01T10:15:00Z")));
        assertThat(Rounding.UP.apply(instant("2020-01-01T10:15:01Z")), is(instant("2020-01-01T10:16:00Z")));
    }

    @Test
    void none_dropsFractionsOfSeconds() {
        assertThat(Rounding.NONE.apply(instant("2020-01-01T10:15:42.7Z")), is(instant("2020-01-01T10:15:42Z")));
    }

    @Test
    void beforeEpoch_roundsTowardsCorrectMinute() {
        assertThat(Rounding.NEAREST.apply(instant("1969-12-31T23:59:20Z")), is(instant("1969-12-31T23:59:00Z")));
        assertThat(Rounding.UP.apply(instant("1969-12-31T23:59:20Z")), is(instant("1970-01-01T00:00:00Z")));
    }

    @Test
    void apply_twice_isSameAsOnce() {
        Instant instant = instant("2020-01-01T10:15:42.123Z");
        for (Rounding rounding : Rounding.values()) {
            Instant once = rounding.apply(instant);
            assertThat(rounding.name(), rounding.apply(once), is(once));
        }
    }
}
