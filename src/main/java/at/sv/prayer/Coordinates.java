package at.sv.prayer;

/**
 * A geographic location in degrees. Latitude is positive north, longitude positive east.
 */
public record Coordinates(double latitude, double longitude) {

    public static Coordinates of(double latitude, double longitude) {
        return new Coordinates(latitude, longitude);
    }

    public boolean isValid() {
        return latitude >= -90 && latitude <= 90 && longitude >= -180 && longitude <= 180;
    }

    @Override
    public String toString() {
        return "(" + latitude + "," + longitude + ")";
    }
}
