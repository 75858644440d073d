package at.sv.prayer;

/**
 * Exception to signal that one of the six prayers could not be determined, even after applying all fallbacks,
 * or that the determined times are not in chronological order.
 */
public class IncompleteScheduleException extends PrayerTimesException {
    public IncompleteScheduleException(String message) {
        super(message);
    }

    public IncompleteScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
