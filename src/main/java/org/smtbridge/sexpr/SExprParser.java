package org.smtbridge.sexpr;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtbridge.exceptions.SmtParseException;
import org.smtbridge.utils.Rational;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 把求解器输出的一行文本读成 {@link SExpr}。
 * <p>
 * 读入时同时对 SMT-LIB 的字面量形式做归类与折叠：
 * {@code (- 5)}、{@code (/ 1.0 3.0)}、{@code (bvneg #x05)}、{@code (fp #b0 #x7f #b0...)}、
 * {@code (_ +zero 8 24)}、{@code ((_ to_fp 11 53) roundNearestTiesToEven 0.5)} 等都变成对应的原子。
 */
public final class SExprParser {

    private static final Logger logger = LoggerFactory.getLogger(SExprParser.class);

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d*");
    private static final Pattern HEX = Pattern.compile("#x[0-9a-fA-F]+");
    private static final Pattern BIN = Pattern.compile("#b[01]+");

    private final String input;
    private int pos = 0;

    private SExprParser(String input) {
        this.input = input;
    }

    /**
     * 解析恰好一个 S 表达式。
     * @throws SmtParseException 如果文本不是一个完整的 S 表达式。
     */
    public static SExpr parse(String line) {
        List<SExpr> all = parseAll(line);
        if (all.size() != 1) {
            throw new SmtParseException(line, "Expected exactly one s-expression, found " + all.size());
        }
        return all.get(0);
    }

    /**
     * 解析文本中的全部顶层 S 表达式。
     */
    public static List<SExpr> parseAll(String text) {
        SExprParser parser = new SExprParser(text);
        List<SExpr> result = new ArrayList<>();
        parser.skipWhitespaceAndComments();
        while (parser.pos < parser.input.length()) {
            result.add(parser.parseExpr());
            parser.skipWhitespaceAndComments();
        }
        logger.debug("解析了 {} 个 S 表达式: {}", result.size(), result);
        return result;
    }

    private SExpr parseExpr() {
        skipWhitespaceAndComments();
        if (pos >= input.length()) {
            throw error("Unexpected end of input");
        }
        char c = input.charAt(pos);
        return switch (c) {
            case '(' -> parseList();
            case ')' -> throw error("Unexpected ')'");
            case '"' -> parseString();
            case '|' -> parseQuotedSymbol();
            default -> parseAtom();
        };
    }

    private SExpr parseList() {
        pos++; // '('
        List<SExpr> items = new ArrayList<>();
        skipWhitespaceAndComments();
        while (pos < input.length() && input.charAt(pos) != ')') {
            items.add(parseExpr());
            skipWhitespaceAndComments();
        }
        if (pos >= input.length()) {
            throw error("Unexpected end of input inside list");
        }
        pos++; // ')'
        return fold(items);
    }

    private SExpr parseString() {
        pos++; // '"'
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= input.length()) {
                throw error("Unexpected end of input inside string literal");
            }
            char c = input.charAt(pos++);
            if (c == '"') {
                // SMT-LIB 2.6: 字符串中的 "" 表示一个双引号
                if (pos < input.length() && input.charAt(pos) == '"') {
                    sb.append('"');
                    pos++;
                    continue;
                }
                break;
            }
            sb.append(c);
        }
        return SExpr.str(unescape(sb.toString()));
    }

    private SExpr parseQuotedSymbol() {
        int end = input.indexOf('|', pos + 1);
        if (end < 0) {
            throw error("Unterminated quoted symbol");
        }
        String name = input.substring(pos + 1, end);
        pos = end + 1;
        return SExpr.con(name);
    }

    private SExpr parseAtom() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c) || c == '(' || c == ')' || c == '"' || c == ';') {
                break;
            }
            pos++;
        }
        return classify(input.substring(start, pos));
    }

    private void skipWhitespaceAndComments() {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == ';') {
                while (pos < input.length() && input.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                return;
            }
        }
    }

    private SmtParseException error(String reason) {
        return new SmtParseException(input, reason + " at position " + pos);
    }

    // ========== 字面量归类 ==========

    static SExpr classify(String token) {
        if (INTEGER.matcher(token).matches()) {
            return SExpr.num(new BigInteger(token));
        }
        if (DECIMAL.matcher(token).matches()) {
            return SExpr.dec(Rational.valueOf(token.endsWith(".") ? token + "0" : token));
        }
        if (HEX.matcher(token).matches()) {
            String digits = token.substring(2);
            return SExpr.num(new BigInteger(digits, 16), digits.length() * 4);
        }
        if (BIN.matcher(token).matches()) {
            String digits = token.substring(2);
            return SExpr.num(new BigInteger(digits, 2), digits.length());
        }
        return SExpr.con(token);
    }

    private static String unescape(String s) {
        if (s.indexOf('\\') < 0) {
            return s;
        }
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\\' && i + 2 < s.length() && s.charAt(i + 1) == 'u') {
                // 花括号形式或四位十六进制形式的码点转义
                if (s.charAt(i + 2) == '{') {
                    int close = s.indexOf('}', i + 3);
                    if (close > 0 && close - (i + 3) <= 5 && isHex(s, i + 3, close)) {
                        sb.appendCodePoint(Integer.parseInt(s.substring(i + 3, close), 16));
                        i = close + 1;
                        continue;
                    }
                } else if (i + 6 <= s.length() && isHex(s, i + 2, i + 6)) {
                    sb.appendCodePoint(Integer.parseInt(s.substring(i + 2, i + 6), 16));
                    i += 6;
                    continue;
                }
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    private static boolean isHex(String s, int from, int to) {
        if (from >= to) {
            return false;
        }
        for (int i = from; i < to; i++) {
            if (Character.digit(s.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    // ========== 复合字面量折叠 ==========

    private static SExpr fold(List<SExpr> items) {
        if (items.size() == 2 && items.get(0).isCon("-")) {
            SExpr arg = items.get(1);
            if (arg instanceof SExpr.Num n) {
                return SExpr.num(n.getValue().negate(), n.getWidth().orElse(null));
            }
            if (arg instanceof SExpr.Dec d) {
                return SExpr.dec(d.getValue().negate());
            }
        }
        if (items.size() == 2 && items.get(0).isCon("bvneg") && items.get(1) instanceof SExpr.Num n && n.getWidth().isPresent()) {
            return SExpr.num(n.getValue().negate(), n.getWidth().get());
        }
        if (items.size() == 3 && items.get(0).isCon("/")) {
            Rational a = asRational(items.get(1));
            Rational b = asRational(items.get(2));
            if (a != null && b != null && !b.isZero()) {
                return SExpr.dec(a.divide(b));
            }
        }
        if (items.size() == 4 && items.get(0).isCon("fp")) {
            SExpr fp = foldFpBits(items.get(1), items.get(2), items.get(3));
            if (fp != null) {
                return fp;
            }
        }
        if (items.size() == 4 && items.get(0).isCon("_") && items.get(1) instanceof SExpr.Con special) {
            SExpr fp = foldSpecialFloat(special.getName(), items.get(2), items.get(3));
            if (fp != null) {
                return fp;
            }
        }
        if (items.size() == 3 && items.get(0) instanceof SExpr.App conv && isToFp(conv)) {
            SExpr fp = foldToFp(conv, items.get(1), items.get(2));
            if (fp != null) {
                return fp;
            }
        }
        return SExpr.app(items);
    }

    private static Rational asRational(SExpr e) {
        if (e instanceof SExpr.Num n) {
            return Rational.valueOf(n.getValue());
        }
        if (e instanceof SExpr.Dec d) {
            return d.getValue();
        }
        return null;
    }

    private static SExpr foldFpBits(SExpr sign, SExpr exponent, SExpr significand) {
        if (!(sign instanceof SExpr.Num s) || !(exponent instanceof SExpr.Num e) || !(significand instanceof SExpr.Num m)) {
            return null;
        }
        if (s.getWidth().isEmpty() || e.getWidth().isEmpty() || m.getWidth().isEmpty()) {
            return null;
        }
        int eb = e.getWidth().get();
        int mb = m.getWidth().get();
        BigInteger bits = s.getValue().shiftLeft(eb + mb).or(e.getValue().shiftLeft(mb)).or(m.getValue());
        if (eb == 8 && mb == 23) {
            return SExpr.flt(Float.intBitsToFloat(bits.intValue()));
        }
        if (eb == 11 && mb == 52) {
            return SExpr.dbl(Double.longBitsToDouble(bits.longValue()));
        }
        return null;
    }

    private static SExpr foldSpecialFloat(String name, SExpr ebExpr, SExpr sbExpr) {
        if (!(ebExpr instanceof SExpr.Num eb) || !(sbExpr instanceof SExpr.Num sb)) {
            return null;
        }
        double v;
        switch (name) {
            case "+zero" -> v = 0.0;
            case "-zero" -> v = -0.0;
            case "+oo" -> v = Double.POSITIVE_INFINITY;
            case "-oo" -> v = Double.NEGATIVE_INFINITY;
            case "NaN" -> v = Double.NaN;
            default -> {
                return null;
            }
        }
        return fpOfPrecision(eb.getValue().intValue(), sb.getValue().intValue(), v);
    }

    private static boolean isToFp(SExpr.App conv) {
        return conv.size() == 4 && conv.get(0).isCon("_") && conv.get(1).isCon("to_fp");
    }

    private static SExpr foldToFp(SExpr.App conv, SExpr roundingMode, SExpr value) {
        Rational r = asRational(value);
        if (!(conv.get(2) instanceof SExpr.Num eb) || !(conv.get(3) instanceof SExpr.Num sb) || r == null) {
            return null;
        }
        int e = eb.getValue().intValue();
        int s = sb.getValue().intValue();
        SExpr folded = fpOfPrecision(e, s, e == 8 ? r.floatValue() : r.doubleValue());
        if (folded == null) {
            return null;
        }
        double converted = folded instanceof SExpr.Flt f ? f.getValue() : ((SExpr.Dbl) folded).getValue();
        // 只有在值可精确表示或舍入方式为就近偶数时，BigDecimal 的舍入结果才与求解器一致
        boolean exact = !Double.isInfinite(converted) && Rational.valueOf(converted).equals(r);
        boolean nearestEven = roundingMode.isCon("roundNearestTiesToEven") || roundingMode.isCon("RNE");
        if (!exact && !nearestEven) {
            logger.debug("to_fp 的舍入方式 {} 无法精确复现，保留原始形式", roundingMode);
            return null;
        }
        return folded;
    }

    private static SExpr fpOfPrecision(int eb, int sb, double v) {
        if (eb == 8 && sb == 24) {
            return SExpr.flt((float) v);
        }
        if (eb == 11 && sb == 53) {
            return SExpr.dbl(v);
        }
        return null;
    }
}
