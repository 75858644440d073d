package at.sv.prayer.method;

/**
 * The fractions of the night which bound fajr (before sunrise) and isha (after sunset).
 */
public record NightPortions(double fajr, double isha) {
}
