package org.smtbridge.config;

/**
 * IEEE-754 舍入方式，以及它们在 SMT-LIB 中的名字。
 */
public enum RoundingMode {

    ROUND_NEAREST_TIES_TO_EVEN("roundNearestTiesToEven"),
    ROUND_NEAREST_TIES_TO_AWAY("roundNearestTiesToAway"),
    ROUND_TOWARD_POSITIVE("roundTowardPositive"),
    ROUND_TOWARD_NEGATIVE("roundTowardNegative"),
    ROUND_TOWARD_ZERO("roundTowardZero");

    private final String smtName;

    RoundingMode(String smtName) {
        this.smtName = smtName;
    }

    public String getSmtName() {
        return smtName;
    }
}
