package org.smtbridge.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtbridge.utils.Rational;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 具体值 (concrete word)：一个 {@link Kind} 和与之匹配的取值。
 * <p>
 * 取值的 Java 类型由 Kind 决定：
 * <ul>
 *     <li>BOOL -> {@link Boolean}</li>
 *     <li>BOUNDED, UNBOUNDED -> {@link BigInteger} (定宽整数已规约到其取值范围)</li>
 *     <li>REAL -> {@link Rational}</li>
 *     <li>FLOAT -> {@link Float}, DOUBLE -> {@link Double}</li>
 *     <li>STRING -> {@link String}, CHAR -> 只含一个码点的 {@link String}</li>
 *     <li>UNINTERPRETED -> {@link UninterpretedValue}</li>
 * </ul>
 * 两者不匹配属于编程错误，构造时直接抛出 {@link IllegalArgumentException}。
 */
@Getter
public final class CW {

    private static final Logger logger = LoggerFactory.getLogger(CW.class);

    private final Kind kind;
    private final Object value;

    private CW(Kind kind, Object value) {
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.value = Objects.requireNonNull(value, "Value cannot be null");
        if (!matches(kind, value)) {
            logger.error("Kind/Value 不一致: {} 与 {} ({})", kind, value, value.getClass().getSimpleName());
            throw new IllegalArgumentException("Kind/Value disagreement on: " + kind + ", " + value);
        }
    }

    private static boolean matches(Kind kind, Object value) {
        return switch (kind.getType()) {
            case BOOL -> value instanceof Boolean;
            case BOUNDED, UNBOUNDED -> value instanceof BigInteger;
            case REAL -> value instanceof Rational;
            case FLOAT -> value instanceof Float;
            case DOUBLE -> value instanceof Double;
            case STRING -> value instanceof String;
            case CHAR -> value instanceof String s && s.codePointCount(0, s.length()) == 1;
            case UNINTERPRETED -> value instanceof UninterpretedValue;
        };
    }

    // ========== 工厂方法 ==========

    public static CW ofBool(boolean b) {
        return new CW(Kind.BOOL, b);
    }

    /**
     * 整数值；对定宽整数按位宽取模，有符号时按二进制补码解释。
     */
    public static CW ofInteger(Kind kind, BigInteger v) {
        if (kind.isBounded()) {
            return new CW(kind, normalize(kind, v));
        }
        return new CW(kind, v);
    }

    public static CW ofInteger(Kind kind, long v) {
        return ofInteger(kind, BigInteger.valueOf(v));
    }

    public static CW ofReal(Rational r) {
        return new CW(Kind.REAL, r);
    }

    public static CW ofFloat(float f) {
        return new CW(Kind.FLOAT, f);
    }

    public static CW ofDouble(double d) {
        return new CW(Kind.DOUBLE, d);
    }

    public static CW ofString(String s) {
        return new CW(Kind.STRING, s);
    }

    public static CW ofChar(int codePoint) {
        return new CW(Kind.CHAR, new String(Character.toChars(codePoint)));
    }

    public static CW ofUninterpreted(Kind kind, String label) {
        Integer index = kind.literalIndex(label).orElse(null);
        return new CW(kind, new UninterpretedValue(index, label));
    }

    /**
     * 由整数构造任意数值或布尔类型的常量。
     * 布尔类型中非零即真；字符串和未解释排序没有整数常量，属于编程错误。
     */
    public static CW fromInteger(Kind kind, BigInteger v) {
        return switch (kind.getType()) {
            case BOOL -> ofBool(v.signum() != 0);
            case BOUNDED, UNBOUNDED -> ofInteger(kind, v);
            case REAL -> ofReal(Rational.valueOf(v));
            case FLOAT -> ofFloat(Rational.valueOf(v).floatValue());
            case DOUBLE -> ofDouble(Rational.valueOf(v).doubleValue());
            case STRING, CHAR, UNINTERPRETED -> {
                logger.error("无法由整数 {} 构造 {} 类型的常量", v, kind);
                throw new IllegalArgumentException("Cannot build a " + kind + " constant from integer " + v);
            }
        };
    }

    private static BigInteger normalize(Kind kind, BigInteger v) {
        BigInteger modulus = BigInteger.ONE.shiftLeft(kind.getWidth());
        BigInteger r = v.mod(modulus);
        if (kind.isSigned() && r.testBit(kind.getWidth() - 1)) {
            r = r.subtract(modulus);
        }
        return r;
    }

    // ========== 取值 ==========

    public boolean asBoolean() {
        return cast(Boolean.class);
    }

    public BigInteger asInteger() {
        return cast(BigInteger.class);
    }

    public Rational asRational() {
        return cast(Rational.class);
    }

    public float asFloat() {
        return cast(Float.class);
    }

    public double asDouble() {
        return cast(Double.class);
    }

    public String asString() {
        return cast(String.class);
    }

    public UninterpretedValue asUninterpreted() {
        return cast(UninterpretedValue.class);
    }

    private <T> T cast(Class<T> clazz) {
        if (!clazz.isInstance(value)) {
            throw new IllegalStateException("CW of kind " + kind + " does not hold a " + clazz.getSimpleName() + ": " + value);
        }
        return clazz.cast(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CW that)) {
            return false;
        }
        // Float/Double 的 equals 按位比较：NaN 等于 NaN，+0 不等于 -0
        return kind.equals(that.kind) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        if (kind.isString() || kind.isChar()) {
            return "\"" + value + "\" :: " + kind;
        }
        return value + " :: " + kind;
    }
}
