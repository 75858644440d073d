package at.sv.prayer.method;

import at.sv.prayer.PrayerName;

/**
 * Minutes added to each of the prayer times.
 */
public record PrayerAdjustments(int fajr, int sunrise, int dhuhr, int asr, int maghrib, int isha) {

    private static final PrayerAdjustments NONE = new PrayerAdjustments(0, 0, 0, 0, 0, 0);

    public static PrayerAdjustments none() {
        return NONE;
    }

    public int get(PrayerName name) {
        return switch (name) {
            case FAJR -> fajr;
            case SUNRISE -> sunrise;
            case DHUHR -> dhuhr;
            case ASR -> asr;
            case MAGHRIB -> maghrib;
            case ISHA -> isha;
        };
    }

    public PrayerAdjustments with(PrayerName name, int minutes) {
        return new PrayerAdjustments(
                name == PrayerName.FAJR ? minutes : fajr,
                name == PrayerName.SUNRISE ? minutes : sunrise,
                name == PrayerName.DHUHR ? minutes : dhuhr,
                name == PrayerName.ASR ? minutes : asr,
                name == PrayerName.MAGHRIB ? minutes : maghrib,
                name == PrayerName.ISHA ? minutes : isha);
    }

    public boolean isNone() {
        return equals(NONE);
    }
}
