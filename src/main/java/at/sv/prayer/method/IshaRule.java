package at.sv.prayer.method;

/**
 * How the time of isha is determined: either by a depression angle of the sun, or by a fixed interval after
 * maghrib.
 */
public sealed interface IshaRule permits IshaRule.Angle, IshaRule.Interval {

    static IshaRule angle(double degrees) {
        return new Angle(degrees);
    }

    static IshaRule interval(int minutes) {
        return new Interval(minutes);
    }

    /**
     * @param degrees the depression angle below the horizon, positive
     */
    record Angle(double degrees) implements IshaRule {
        @Override
        public String toString() {
            return degrees + "°";
        }
    }

    /**
     * @param minutes the minutes after maghrib
     */
    record Interval(int minutes) implements IshaRule {
        @Override
        public String toString() {
            return minutes + " min";
        }
    }
}
