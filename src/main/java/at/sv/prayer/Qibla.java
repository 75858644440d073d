package at.sv.prayer;

import at.sv.prayer.time.Astronomical;

/**
 * The direction to the Kaaba in Makkah, in degrees clockwise from true north.
 */
public record Qibla(double direction) {

    static final Coordinates MAKKAH = Coordinates.of(21.4225241, 39.8261818);

    /**
     * Uses the great circle bearing from "Spherical Trigonometry For the use of colleges and schools", page 50.
     *
     * @throws InvalidCoordinatesException if the coordinates are out of range
     */
    public static Qibla of(Coordinates coordinates) {
        if (!coordinates.isValid()) {
            throw new InvalidCoordinatesException("Invalid coordinates " + coordinates);
        }
        double latitude = Math.toRadians(coordinates.latitude());
        double makkahLatitude = Math.toRadians(MAKKAH.latitude());
        double longitudeDelta = Math.toRadians(MAKKAH.longitude() - coordinates.longitude());

        double term1 = Math.sin(longitudeDelta);
        double term2 = Math.cos(latitude) * Math.tan(makkahLatitude);
        double term3 = Math.sin(latitude) * Math.cos(longitudeDelta);
        double direction = Math.toDegrees(Math.atan2(term1, term2 - term3));
        return new Qibla(Astronomical.unwindAngle(direction));
    }
}
