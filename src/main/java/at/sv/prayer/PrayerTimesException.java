package at.sv.prayer;

/**
 * Signals that no prayer schedule could be computed for a location and day. Computations are deterministic, so
 * repeating the call with the same input fails the same way.
 */
public abstract class PrayerTimesException extends RuntimeException {
    protected PrayerTimesException(String message) {
        super(message);
    }

    protected PrayerTimesException(String message, Throwable cause) {
        super(message, cause);
    }
}
