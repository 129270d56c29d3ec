package org.smtbridge.core;

import lombok.Getter;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 符号系统中值的语义类型。
 * 定宽整数统一由 (signed, width) 参数化；未解释排序带有名字以及可选的有序字面量列表。
 * 此类是不可变的。
 */
@Getter
public final class Kind implements Comparable<Kind>, ToSmtLib {

    private static final Comparator<Kind> ORDER = Comparator
            .comparing(Kind::getType)
            .thenComparing(Kind::isSigned)
            .thenComparingInt(Kind::getWidth)
            .thenComparing(k -> k.sortName == null ? "" : k.sortName);

    public static final Kind BOOL = new Kind(KindType.BOOL, false, 0, null, null);
    public static final Kind UNBOUNDED = new Kind(KindType.UNBOUNDED, true, 0, null, null);
    public static final Kind REAL = new Kind(KindType.REAL, true, 0, null, null);
    public static final Kind FLOAT = new Kind(KindType.FLOAT, true, 0, null, null);
    public static final Kind DOUBLE = new Kind(KindType.DOUBLE, true, 0, null, null);
    public static final Kind STRING = new Kind(KindType.STRING, false, 0, null, null);
    public static final Kind CHAR = new Kind(KindType.CHAR, false, 0, null, null);

    private final KindType type;
    private final boolean signed;
    // 仅对 BOUNDED 有意义
    private final int width;
    // 仅对 UNINTERPRETED 有意义
    private final String sortName;
    // 为 null 表示该排序没有枚举字面量
    @Getter(lombok.AccessLevel.NONE)
    private final List<String> literals;

    @Getter(lombok.AccessLevel.NONE)
    private final int hashCode;

    private Kind(KindType type, boolean signed, int width, String sortName, List<String> literals) {
        this.type = type;
        this.signed = signed;
        this.width = width;
        this.sortName = sortName;
        this.literals = literals == null ? null : List.copyOf(literals);
        this.hashCode = Objects.hash(type, signed, width, sortName, this.literals);
    }

    /**
     * 定宽整数。
     * @param signed 是否有符号 (二进制补码)。
     * @param width 位宽，必须为正。
     */
    public static Kind bounded(boolean signed, int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("Bit-vector width must be positive: " + width);
        }
        return new Kind(KindType.BOUNDED, signed, width, null, null);
    }

    /**
     * 没有枚举字面量的未解释排序。
     */
    public static Kind uninterpreted(String name) {
        return new Kind(KindType.UNINTERPRETED, false, 0, Objects.requireNonNull(name, "Sort name cannot be null"), null);
    }

    /**
     * 带有有序字面量的未解释排序 (枚举)，求解器返回的字面量可以解析为下标。
     */
    public static Kind uninterpreted(String name, List<String> literals) {
        Objects.requireNonNull(name, "Sort name cannot be null");
        Objects.requireNonNull(literals, "Literal list cannot be null");
        return new Kind(KindType.UNINTERPRETED, false, 0, name, literals);
    }

    public Optional<List<String>> getLiterals() {
        return Optional.ofNullable(literals);
    }

    /**
     * 字面量在枚举中的下标；排序没有枚举或不含该字面量时为空。
     */
    public Optional<Integer> literalIndex(String literal) {
        if (literals == null) {
            return Optional.empty();
        }
        int idx = literals.indexOf(literal);
        return idx < 0 ? Optional.empty() : Optional.of(idx);
    }

    public boolean isBoolean() {
        return type == KindType.BOOL;
    }

    public boolean isBounded() {
        return type == KindType.BOUNDED;
    }

    public boolean isUnbounded() {
        return type == KindType.UNBOUNDED;
    }

    public boolean isReal() {
        return type == KindType.REAL;
    }

    public boolean isFloat() {
        return type == KindType.FLOAT;
    }

    public boolean isDouble() {
        return type == KindType.DOUBLE;
    }

    public boolean isString() {
        return type == KindType.STRING;
    }

    public boolean isChar() {
        return type == KindType.CHAR;
    }

    public boolean isUninterpreted() {
        return type == KindType.UNINTERPRETED;
    }

    /**
     * 定宽整数的最小值。
     */
    public BigInteger minValue() {
        requireBounded();
        return signed ? BigInteger.ONE.shiftLeft(width - 1).negate() : BigInteger.ZERO;
    }

    /**
     * 定宽整数的最大值。
     */
    public BigInteger maxValue() {
        requireBounded();
        return signed
                ? BigInteger.ONE.shiftLeft(width - 1).subtract(BigInteger.ONE)
                : BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
    }

    private void requireBounded() {
        if (!isBounded()) {
            throw new IllegalStateException("Not a bounded kind: " + this);
        }
    }

    /**
     * SMT-LIB 2 中的排序名。
     */
    @Override
    public String toSmtLib() {
        return switch (type) {
            case BOOL -> "Bool";
            case BOUNDED -> "(_ BitVec " + width + ")";
            case UNBOUNDED -> "Int";
            case REAL -> "Real";
            case FLOAT -> "(_ FloatingPoint 8 24)";
            case DOUBLE -> "(_ FloatingPoint 11 53)";
            case STRING, CHAR -> "String";
            case UNINTERPRETED -> sortName;
        };
    }

    @Override
    public int compareTo(Kind other) {
        int c = ORDER.compare(this, other);
        if (c != 0) {
            return c;
        }
        // 同名排序的字面量列表不同，只能按文本区分
        return String.valueOf(this.literals).compareTo(String.valueOf(other.literals));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Kind that)) {
            return false;
        }
        return type == that.type
                && signed == that.signed
                && width == that.width
                && Objects.equals(sortName, that.sortName)
                && Objects.equals(literals, that.literals);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return switch (type) {
            case BOOL -> "SBool";
            case BOUNDED -> (signed ? "SInt" : "SWord") + width;
            case UNBOUNDED -> "SInteger";
            case REAL -> "SReal";
            case FLOAT -> "SFloat";
            case DOUBLE -> "SDouble";
            case STRING -> "SString";
            case CHAR -> "SChar";
            case UNINTERPRETED -> sortName;
        };
    }
}
