package at.sv.prayer.method;

import java.time.Instant;

public enum Rounding {
    /**
     * Round to the nearest minute, half a minute rounds up.
     */
    NEAREST,
    /**
     * Round up to the next full minute, unless already on one.
     */
    UP,
    /**
     * Keep the minute and second, only drop fractions of seconds.
     */
    NONE;

    public Instant apply(Instant instant) {
        long epochSecond = instant.getEpochSecond();
        long second = Math.floorMod(epochSecond, 60);
        long minuteStart = epochSecond - second;
        return switch (this) {
            case NEAREST -> Instant.ofEpochSecond(second >= 30 ? minuteStart + 60 : minuteStart);
            case UP -> Instant.ofEpochSecond(second > 0 ? minuteStart + 60 : minuteStart);
            case NONE -> Instant.ofEpochSecond(epochSecond);
        };
    }
}
