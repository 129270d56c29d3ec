package org.smtbridge.emit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtbridge.config.RoundingMode;
import org.smtbridge.core.CW;
import org.smtbridge.core.Kind;
import org.smtbridge.utils.Rational;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * 具体值在 SMT-LIB 2 中的字面量形式。
 */
public final class SmtLiterals {

    private static final Logger logger = LoggerFactory.getLogger(SmtLiterals.class);

    // SMT-LIB 2.6 字符串的码点转义最多到 0x2FFFF
    static final int MAX_STRING_CODE_POINT = 0x2FFFF;

    private SmtLiterals() {
    }

    /**
     * 把具体值写成对应 Kind 的 SMT-LIB 字面量。
     * @param rm 非精确的浮点转换使用的舍入方式 (有限浮点值总是可精确表示，它只决定输出文本)。
     */
    public static String cwToSmtLib(RoundingMode rm, CW cw) {
        Objects.requireNonNull(cw, "Value cannot be null");
        Kind k = cw.getKind();
        return switch (k.getType()) {
            case BOOL -> cw.asBoolean() ? "true" : "false";
            case BOUNDED -> bitVector(k, cw.asInteger());
            case UNBOUNDED -> integer(cw.asInteger());
            case REAL -> cw.asRational().toSmtLib();
            case FLOAT -> floatingPoint(rm, 8, 24, cw.asFloat());
            case DOUBLE -> floatingPoint(rm, 11, 53, cw.asDouble());
            case STRING, CHAR -> stringLiteral(cw.asString());
            case UNINTERPRETED -> cw.asUninterpreted().getLabel();
        };
    }

    public static String smtRoundingMode(RoundingMode rm) {
        return rm.getSmtName();
    }

    /**
     * 某个 Kind 的 "零" 值，用作无约束的 skolem 常量的占位值。
     * @throws IllegalArgumentException 如果未解释排序没有列出任何字面量。
     */
    public static String skolemZero(RoundingMode rm, Kind kind) {
        return switch (kind.getType()) {
            case STRING -> "\"\"";
            case CHAR -> stringLiteral("a");
            case UNINTERPRETED -> {
                List<String> literals = kind.getLiterals().orElse(List.of());
                if (literals.isEmpty()) {
                    logger.error("未解释排序 {} 没有字面量，无法构造零值", kind);
                    throw new IllegalArgumentException("Cannot make a zero value for uninterpreted sort " + kind);
                }
                yield literals.get(0);
            }
            default -> cwToSmtLib(rm, CW.fromInteger(kind, BigInteger.ZERO));
        };
    }

    private static String integer(BigInteger v) {
        return v.signum() < 0 ? "(- " + v.negate() + ")" : v.toString();
    }

    private static String bitVector(Kind k, BigInteger v) {
        if (v.signum() >= 0) {
            return unsignedBits(k.getWidth(), v);
        }
        if (v.equals(k.minValue())) {
            // 最小值的绝对值超出范围，直接写出位模式
            return "#b1" + "0".repeat(k.getWidth() - 1);
        }
        return "(bvneg " + unsignedBits(k.getWidth(), v.negate()) + ")";
    }

    private static String unsignedBits(int width, BigInteger v) {
        if (width % 4 == 0) {
            return "#x" + pad(v.toString(16), width / 4);
        }
        return "#b" + pad(v.toString(2), width);
    }

    private static String pad(String digits, int length) {
        return digits.length() >= length ? digits : "0".repeat(length - digits.length()) + digits;
    }

    private static String floatingPoint(RoundingMode rm, int eb, int sb, double v) {
        String precision = " " + eb + " " + sb + ")";
        if (Double.isNaN(v)) {
            return "(_ NaN" + precision;
        }
        if (Double.isInfinite(v)) {
            return (v > 0 ? "(_ +oo" : "(_ -oo") + precision;
        }
        if (v == 0) {
            return (1 / v > 0 ? "(_ +zero" : "(_ -zero") + precision;
        }
        return "((_ to_fp " + eb + " " + sb + ") " + smtRoundingMode(rm) + " " + Rational.valueOf(v).toSmtLib() + ")";
    }

    /**
     * SMT-LIB 2.6 字符串字面量：双引号写两次，可打印 ASCII 之外的字符 (以及反斜杠) 写成码点转义。
     * @throws IllegalArgumentException 如果含有 SMT-LIB 字符串无法表示的码点 (大于 0x2FFFF)。
     */
    public static String stringLiteral(String s) {
        StringBuilder sb = new StringBuilder("\"");
        s.codePoints().forEach(cp -> {
            if (cp > MAX_STRING_CODE_POINT) {
                logger.error("码点 {} 超出 SMT-LIB 字符串的范围", Integer.toHexString(cp));
                throw new IllegalArgumentException("Code point out of SMT-LIB string range: 0x" + Integer.toHexString(cp));
            }
            if (cp == '"') {
                sb.append("\"\"");
            } else if (cp >= 0x20 && cp < 0x7f && cp != '\\') {
                sb.appendCodePoint(cp);
            } else {
                sb.append("\\u{").append(Integer.toHexString(cp)).append('}');
            }
        });
        return sb.append('"').toString();
    }
}
