package at.sv.prayer;

/**
 * Exception to signal that the sun never reaches a requested altitude at the given latitude and day, e.g. during
 * polar night or when a twilight angle is out of reach around the solstices.
 */
public class UnsolvableGeometryException extends PrayerTimesException {
    public UnsolvableGeometryException(String message) {
        super(message);
    }
}
