package org.smtbridge.core;

/**
 * Kind 的标签。位宽、符号、排序名等参数放在 {@link Kind} 中，
 * 因此定宽整数只有一个 BOUNDED 标签，而不是每种位宽一个。
 */
public enum KindType {

    BOOL,
    BOUNDED,        // 定宽整数 (bit-vector)
    UNBOUNDED,      // 数学整数
    REAL,           // 代数实数
    FLOAT,
    DOUBLE,
    STRING,
    CHAR,
    UNINTERPRETED;  // 用户声明的未解释排序

    /**
     * 可以出现在优化目标 (ExtCW) 中的数值类型。
     */
    public boolean isNumeric() {
        return switch (this) {
            case BOUNDED, UNBOUNDED, REAL, FLOAT, DOUBLE -> true;
            default -> false;
        };
    }
}
