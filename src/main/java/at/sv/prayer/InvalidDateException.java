package at.sv.prayer;

public class InvalidDateException extends PrayerTimesException {
    public InvalidDateException(String message) {
        super(message);
    }

    public InvalidDateException(String message, Throwable cause) {
        super(message, cause);
    }
}
