package at.sv.prayer.method;

import at.sv.prayer.Coordinates;
import lombok.Builder;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

/**
 * The full set of parameters a prayer schedule is calculated with. Usually created from a
 * {@link CalculationMethod} and then customized with {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class CalculationParameters {

    /**
     * The method these parameters originate from, only used for display.
     */
    @Nullable
    CalculationMethod method;
    /**
     * The depression angle of the sun for fajr, positive.
     */
    double fajrAngle;
    /**
     * The depression angle of the sun for maghrib, if maghrib is not simply sunset.
     */
    @Nullable
    Double maghribAngle;
    IshaRule ishaRule;
    @Builder.Default
    Madhab madhab = Madhab.SHAFI;
    /**
     * If not set, the rule recommended for the latitude is used.
     */
    @Nullable
    HighLatitudeRule highLatitudeRule;
    @Builder.Default
    PrayerAdjustments adjustments = PrayerAdjustments.none();
    @Builder.Default
    PrayerAdjustments methodAdjustments = PrayerAdjustments.none();
    @Builder.Default
    Rounding rounding = Rounding.NEAREST;
    @Builder.Default
    Shafaq shafaq = Shafaq.GENERAL;
    /**
     * Whether fajr and isha use the seasonal twilight durations of the Moonsighting Committee.
     */
    boolean moonsightingCommittee;

    public HighLatitudeRule effectiveHighLatitudeRule(Coordinates coordinates) {
        if (highLatitudeRule != null) {
            return highLatitudeRule;
        }
        return HighLatitudeRule.recommended(coordinates);
    }

    public NightPortions nightPortions(Coordinates coordinates) {
        return switch (effectiveHighLatitudeRule(coordinates)) {
            case MIDDLE_OF_THE_NIGHT -> new NightPortions(1.0 / 2.0, 1.0 / 2.0);
            case SEVENTH_OF_THE_NIGHT -> new NightPortions(1.0 / 7.0, 1.0 / 7.0);
            case TWILIGHT_ANGLE -> new NightPortions(fajrAngle / 60.0, ishaAngleOrZero() / 60.0);
        };
    }

    private double ishaAngleOrZero() {
        if (ishaRule instanceof IshaRule.Angle angle) {
            return angle.degrees();
        }
        return 0;
    }

    public String toDebugString() {
        return "method=" + method +
               ", fajr=" + fajrAngle + "°" +
               ", isha=" + ishaRule +
               (maghribAngle != null ? ", maghrib=" + maghribAngle + "°" : "") +
               ", madhab=" + madhab +
               ", highLatitudeRule=" + (highLatitudeRule != null ? highLatitudeRule : "recommended") +
               ", rounding=" + rounding +
               (moonsightingCommittee ? ", shafaq=" + shafaq : "") +
               (adjustments.isNone() ? "" : ", adjustments=" + adjustments);
    }
}
