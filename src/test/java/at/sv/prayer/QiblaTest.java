package at.sv.prayer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QiblaTest {

    private static double direction(double latitude, double longitude) {
        return Qibla.of(Coordinates.of(latitude, longitude)).direction();
    }

    @Test
    void northAmerica() {
        assertThat(direction(40.7128, -74.0059)).isCloseTo(58.482, within(0.001));  // New York
        assertThat(direction(37.7749, -122.4194)).isCloseTo(18.844, within(0.001)); // San Francisco
        assertThat(direction(38.9072, -77.0369)).isCloseTo(56.560, within(0.001));  // Washington DC
        assertThat(direction(61.2181, -149.9003)).isCloseTo(350.883, within(0.001)); // Anchorage
    }

    @Test
    void pacific() {
        assertThat(direction(-33.8688, 151.2093)).isCloseTo(277.500, within(0.001)); // Sydney
        assertThat(direction(-36.8485, 174.7633)).isCloseTo(261.197, within(0.001)); // Auckland
    }

    @Test
    void europe() {
        assertThat(direction(51.5074, -0.1278)).isCloseTo(118.987, within(0.001)); // London
        assertThat(direction(48.8566, 2.3522)).isCloseTo(119.163, within(0.001));  // Paris
        assertThat(direction(59.9139, 10.7522)).isCloseTo(139.028, within(0.001)); // Oslo
    }

    @Test
    void asia() {
        assertThat(direction(33.7294, 73.0931)).isCloseTo(255.882, within(0.001));  // Islamabad
        assertThat(direction(35.6895, 139.6917)).isCloseTo(293.021, within(0.001)); // Tokyo
        assertThat(direction(-6.182796, 106.8307)).isCloseTo(295.147, within(0.001)); // Jakarta
    }

    @Test
    void direction_isWithinFullCircle() {
        for (int lat = -80; lat <= 80; lat += 20) {
            for (int lng = -180; lng <= 180; lng += 30) {
                assertThat(direction(lat, lng)).isGreaterThanOrEqualTo(0).isLessThan(360);
            }
        }
    }

    @Test
    void invalidCoordinates_throws() {
        assertThrows(InvalidCoordinatesException.class, () -> Qibla.of(Coordinates.of(91, 0)));
    }
}
