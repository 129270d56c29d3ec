package org.smtbridge.sexpr;

import lombok.Getter;
import org.smtbridge.utils.Rational;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 求解器输出的通用语法树：已分类的字面量原子，或有序的子节点序列 (application)。
 * 由 {@link SExprParser} 产生，之后只读。
 */
public abstract class SExpr {

    private SExpr() {
    }

    public static Con con(String name) {
        return new Con(name);
    }

    public static Num num(long value) {
        return new Num(BigInteger.valueOf(value), null);
    }

    public static Num num(BigInteger value) {
        return new Num(value, null);
    }

    public static Num num(BigInteger value, Integer width) {
        return new Num(value, width);
    }

    public static Dec dec(Rational value) {
        return new Dec(value);
    }

    public static Flt flt(float value) {
        return new Flt(value);
    }

    public static Dbl dbl(double value) {
        return new Dbl(value);
    }

    public static Str str(String value) {
        return new Str(value);
    }

    public static App app(SExpr... items) {
        return new App(Arrays.asList(items));
    }

    public static App app(List<SExpr> items) {
        return new App(items);
    }

    /**
     * 是否为给定名字的符号原子。
     */
    public boolean isCon(String name) {
        return false;
    }

    /**
     * 是否为以给定符号开头的 application。
     */
    public boolean isAppHeadedBy(String head) {
        return false;
    }

    /**
     * 符号原子：关键字、变量名、未解释排序的字面量等。
     */
    @Getter
    public static final class Con extends SExpr {
        private final String name;

        private Con(String name) {
            this.name = Objects.requireNonNull(name);
        }

        @Override
        public boolean isCon(String n) {
            return name.equals(n);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Con that && name.equals(that.name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * 整数字面量。来自 #x / #b 形式时记录位宽。
     */
    @Getter
    public static final class Num extends SExpr {
        private final BigInteger value;
        @Getter(lombok.AccessLevel.NONE)
        private final Integer width;

        private Num(BigInteger value, Integer width) {
            this.value = Objects.requireNonNull(value);
            this.width = width;
        }

        public Optional<Integer> getWidth() {
            return Optional.ofNullable(width);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Num that && value.equals(that.value) && Objects.equals(width, that.width);
        }

        @Override
        public int hashCode() {
            return Objects.hash(value, width);
        }

        @Override
        public String toString() {
            return width == null ? value.toString() : value + "#" + width;
        }
    }

    /**
     * 实数字面量 (小数或有理分式)。
     */
    @Getter
    public static final class Dec extends SExpr {
        private final Rational value;

        private Dec(Rational value) {
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Dec that && value.equals(that.value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    /**
     * IEEE-754 单精度字面量。
     */
    @Getter
    public static final class Flt extends SExpr {
        private final float value;

        private Flt(float value) {
            this.value = value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Flt that && Float.compare(value, that.value) == 0;
        }

        @Override
        public int hashCode() {
            return Float.hashCode(value);
        }

        @Override
        public String toString() {
            return value + "f";
        }
    }

    /**
     * IEEE-754 双精度字面量。
     */
    @Getter
    public static final class Dbl extends SExpr {
        private final double value;

        private Dbl(double value) {
            this.value = value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Dbl that && Double.compare(value, that.value) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(value);
        }

        @Override
        public String toString() {
            return value + "d";
        }
    }

    /**
     * 字符串字面量，已经去掉转义。
     */
    @Getter
    public static final class Str extends SExpr {
        private final String value;

        private Str(String value) {
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Str that && value.equals(that.value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
    }

    /**
     * 有序的子节点序列。
     */
    @Getter
    public static final class App extends SExpr {
        private final List<SExpr> items;

        private App(List<SExpr> items) {
            this.items = List.copyOf(items);
        }

        public int size() {
            return items.size();
        }

        public SExpr get(int i) {
            return items.get(i);
        }

        @Override
        public boolean isAppHeadedBy(String head) {
            return !items.isEmpty() && items.get(0).isCon(head);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof App that && items.equals(that.items);
        }

        @Override
        public int hashCode() {
            return items.hashCode();
        }

        @Override
        public String toString() {
            return items.stream().map(SExpr::toString).collect(Collectors.joining(" ", "(", ")"));
        }
    }
}
