package at.sv.prayer.method;

import at.sv.prayer.Coordinates;

/**
 * Rules to bound fajr and isha at locations where the twilight angles are not reached during parts of the year.
 */
public enum HighLatitudeRule {
    /**
     * Fajr will never be earlier than the middle of the night and isha will never be later than the middle of the
     * night.
     */
    MIDDLE_OF_THE_NIGHT,
    /**
     * Fajr will never be earlier than the beginning of the last seventh of the night and isha will never be later
     * than the end of the first seventh of the night.
     */
    SEVENTH_OF_THE_NIGHT,
    /**
     * Similar to {@link #SEVENTH_OF_THE_NIGHT}, but instead of 1/7 the fraction of the night used is
     * angle / 60.
     */
    TWILIGHT_ANGLE;

    private static final double SEVENTH_OF_THE_NIGHT_LATITUDE = 48;

    public static HighLatitudeRule recommended(Coordinates coordinates) {
        if (coordinates.latitude() > SEVENTH_OF_THE_NIGHT_LATITUDE) {
            return SEVENTH_OF_THE_NIGHT;
        }
        return MIDDLE_OF_THE_NIGHT;
    }
}
