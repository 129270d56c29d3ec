package org.smtbridge.capability;

/**
 * 问题可能需要的求解器特性，按检查顺序排列。
 */
public enum Feature {

    UNBOUNDED_INTEGERS("unbounded integers"),
    ALGEBRAIC_REALS("algebraic reals"),
    FLOATING_POINT("floating-point numbers"),
    QUANTIFIERS("quantifiers"),
    UNINTERPRETED_SORTS("uninterpreted sorts"),
    OPTIMIZATION("optimization routines");

    private final String label;

    Feature(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
