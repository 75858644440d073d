package at.sv.prayer;

public class InvalidCoordinatesException extends PrayerTimesException {
    public InvalidCoordinatesException(String message) {
        super(message);
    }
}
