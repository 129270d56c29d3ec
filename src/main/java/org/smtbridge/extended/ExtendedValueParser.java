package org.smtbridge.extended;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtbridge.config.SmtLibVersion;
import org.smtbridge.core.CW;
import org.smtbridge.core.Kind;
import org.smtbridge.exceptions.SmtParseException;
import org.smtbridge.sexpr.OutputNormalizer;
import org.smtbridge.sexpr.SExpr;
import org.smtbridge.sexpr.SExprParser;
import org.smtbridge.utils.Rational;

import java.util.Objects;

/**
 * 把优化目标值的语法树递归下降地转换为 {@link ExtCW}。文法：
 * <pre>
 *   ext ::= oo | epsilon | (interval ext ext) | (+ ext ext) | (* ext ext) | 数值字面量
 * </pre>
 * {@code (to_real n)} 之类的求解器包装由方言的 {@link OutputNormalizer} 预先去掉。
 * 文法之外的任何形状都是致命错误；文本形式的负号前缀 (例如 "-oo") 由调用方处理。
 */
public final class ExtendedValueParser {

    private static final Logger logger = LoggerFactory.getLogger(ExtendedValueParser.class);

    private final Kind kind;
    private final String rawLine;
    private final SExpr item;

    private ExtendedValueParser(Kind kind, String rawLine, SExpr item) {
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.rawLine = rawLine;
        this.item = item;
    }

    /**
     * 转换一棵已规整的树。
     * @param kind 目标变量的 Kind，整棵树使用它。
     * @param expr 值的语法树。
     * @param rawLine 原始输出行，用于诊断。
     * @param item 所在的目标项，用于诊断。
     * @throws SmtParseException 如果 Kind 不是数值类型，或遇到文法之外的形状。
     */
    public static ExtCW convert(Kind kind, SExpr expr, String rawLine, SExpr item) {
        ExtendedValueParser parser = new ExtendedValueParser(kind, rawLine, item);
        if (!kind.getType().isNumeric()) {
            throw parser.die(expr);
        }
        ExtCW result = parser.cvt(expr);
        logger.debug("目标值 {} 转换为 {}", expr, result);
        return result;
    }

    /**
     * 解析文本形式的目标值，先做 SMT-LIB 2 方言的规整。
     */
    public static ExtCW parse(Kind kind, String text) {
        return parse(kind, text, SmtLibVersion.SMTLIB2.normalizer());
    }

    public static ExtCW parse(Kind kind, String text, OutputNormalizer normalizer) {
        SExpr expr = normalizer.normalize(SExprParser.parse(text));
        return convert(kind, expr, text, expr);
    }

    private ExtCW cvt(SExpr e) {
        if (e.isCon("oo")) {
            return ExtCW.posInfinity(kind);
        }
        if (e.isCon("epsilon")) {
            return ExtCW.epsilon(kind);
        }
        if (e instanceof SExpr.App app && app.size() == 3) {
            if (app.get(0).isCon("interval")) {
                return ExtCW.interval(cvt(app.get(1)), cvt(app.get(2)));
            }
            if (app.get(0).isCon("+")) {
                return ExtCW.sum(cvt(app.get(1)), cvt(app.get(2)));
            }
            if (app.get(0).isCon("*")) {
                return ExtCW.product(cvt(app.get(1)), cvt(app.get(2)));
            }
        }
        if (e instanceof SExpr.Num n) {
            return ExtCW.bounded(CW.fromInteger(kind, n.getValue()));
        }
        if (e instanceof SExpr.Dec d) {
            return ExtCW.bounded(realValue(d.getValue(), e));
        }
        if (e instanceof SExpr.Flt f && kind.isFloat()) {
            return ExtCW.bounded(CW.ofFloat(f.getValue()));
        }
        if (e instanceof SExpr.Dbl d && kind.isDouble()) {
            return ExtCW.bounded(CW.ofDouble(d.getValue()));
        }
        throw die(e);
    }

    private CW realValue(Rational r, SExpr e) {
        return switch (kind.getType()) {
            case REAL -> CW.ofReal(r);
            case FLOAT -> CW.ofFloat(r.floatValue());
            case DOUBLE -> CW.ofDouble(r.doubleValue());
            default -> {
                // 整数类型的目标只接受整值的实数字面量，否则会悄悄丢掉小数部分
                if (r.isInteger()) {
                    yield CW.fromInteger(kind, r.toBigInteger());
                }
                throw die(e);
            }
        };
    }

    private SmtParseException die(SExpr e) {
        logger.error("无法转换目标值 {} (Kind {})", e, kind);
        return new SmtParseException(rawLine, "Cannot convert objective value from solver output!", item, e);
    }
}
