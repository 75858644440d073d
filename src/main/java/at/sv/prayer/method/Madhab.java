package at.sv.prayer.method;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The school of jurisprudence, which only determines the time of asr.
 */
@Getter
@RequiredArgsConstructor
public enum Madhab {
    /**
     * Shafi, Maliki, Hanbali and Jafari: asr starts when an object's shadow equals its length.
     */
    SHAFI(1),
    /**
     * Hanafi: asr starts when an object's shadow is twice its length.
     */
    HANAFI(2);

    private final int shadowLength;
}
