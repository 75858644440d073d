package at.sv.prayer;

import java.time.Instant;

public record Prayer(PrayerName name, Instant time) {

    public static Prayer of(PrayerName name, Instant time) {
        return new Prayer(name, time);
    }

    @Override
    public String toString() {
        return name.getDisplayName() + "=" + time;
    }
}
