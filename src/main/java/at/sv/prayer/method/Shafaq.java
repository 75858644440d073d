package at.sv.prayer.method;

/**
 * The twilight appearance used by the Moonsighting Committee method to determine the end of the evening twilight.
 */
public enum Shafaq {
    /**
     * A combination of ahmer and abyad.
     */
    GENERAL,
    /**
     * The red glow in the sky, used by the Shafi, Maliki and Hanbali schools.
     */
    AHMER,
    /**
     * The white glow after the red glow has disappeared, used by the Hanafi school.
     */
    ABYAD
}
