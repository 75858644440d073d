package at.sv.prayer.time;

import at.sv.prayer.method.Shafaq;

import java.time.Instant;
import java.time.LocalDate;
import java.time.Year;

/**
 * Seasonal twilight durations of the Moonsighting Committee Worldwide method.
 * <p>
 * The duration is given by four seasonal values a, b, c, d, each linear in the absolute latitude, and interpolated
 * piecewise linearly over the days since the winter solstice of the hemisphere.
 */
public final class SeasonalAdjustment {

    private static final double REFERENCE_LATITUDE = 55.0;
    private static final int NORTHERN_OFFSET = 10;

    private SeasonalAdjustment() {
    }

    /**
     * @return the start of the morning twilight, i.e. the seasonally adjusted fajr
     */
    public static Instant morningTwilight(double latitude, LocalDate day, Instant sunrise) {
        double l = Math.abs(latitude) / REFERENCE_LATITUDE;
        double a = 75 + 28.65 * l;
        double b = 75 + 19.44 * l;
        double c = 75 + 32.74 * l;
        double d = 75 + 48.10 * l;
        double minutes = interpolate(a, b, c, d, daysSinceSolstice(day.getDayOfYear(), day.getYear(), latitude));
        return sunrise.minusSeconds(Math.round(minutes * 60.0));
    }

    /**
     * @return the end of the evening twilight for the given shafaq, i.e. the seasonally adjusted isha
     */
    public static Instant eveningTwilight(double latitude, LocalDate day, Instant sunset, Shafaq shafaq) {
        double l = Math.abs(latitude) / REFERENCE_LATITUDE;
        double[] abcd = switch (shafaq) {
            case AHMER -> new double[]{62 + 17.40 * l, 62 - 7.16 * l, 62 + 5.12 * l, 62 + 19.44 * l};
            case ABYAD -> new double[]{75 + 25.60 * l, 75 + 7.16 * l, 75 + 36.84 * l, 75 + 81.84 * l};
            case GENERAL -> new double[]{75 + 25.60 * l, 75 + 2.050 * l, 75 - 9.210 * l, 75 + 6.140 * l};
        };
        double minutes = interpolate(abcd[0], abcd[1], abcd[2], abcd[3],
                daysSinceSolstice(day.getDayOfYear(), day.getYear(), latitude));
        return sunset.plusSeconds(Math.round(minutes * 60.0));
    }

    private static double interpolate(double a, double b, double c, double d, int dyy) {
        if (dyy < 91) {
            return a + (b - a) / 91.0 * dyy;
        } else if (dyy < 137) {
            return b + (c - b) / 46.0 * (dyy - 91);
        } else if (dyy < 183) {
            return c + (d - c) / 46.0 * (dyy - 137);
        } else if (dyy < 229) {
            return d + (c - d) / 46.0 * (dyy - 183);
        } else if (dyy < 275) {
            return c + (b - c) / 46.0 * (dyy - 229);
        }
        return b + (a - b) / 91.0 * (dyy - 275);
    }

    /**
     * @return the days since the winter solstice of the hemisphere of the given latitude, in [0, days of year)
     */
    static int daysSinceSolstice(int dayOfYear, int year, double latitude) {
        boolean leapYear = Year.isLeap(year);
        int southernOffset = leapYear ? 173 : 172;
        int daysInYear = leapYear ? 366 : 365;

        int daysSinceSolstice;
        if (latitude >= 0) {
            daysSinceSolstice = dayOfYear + NORTHERN_OFFSET;
            if (daysSinceSolstice >= daysInYear) {
                daysSinceSolstice -= daysInYear;
            }
        } else {
            daysSinceSolstice = dayOfYear - southernOffset;
            if (daysSinceSolstice < 0) {
                daysSinceSolstice += daysInYear;
            }
        }
        return daysSinceSolstice;
    }
}
