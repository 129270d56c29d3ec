package org.smtbridge.extended;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtbridge.core.CW;
import org.smtbridge.core.Kind;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 扩展数值：优化目标的取值可能落在比普通数值更丰富的域中 (无穷、无穷小、区间以及它们的和与积)。
 * <p>
 * 只用于数值 Kind，且同一棵树中的 Kind 必须一致，构造时检查。
 * 此类及其子类都是不可变的。
 */
@Getter
public abstract class ExtCW {

    private static final Logger logger = LoggerFactory.getLogger(ExtCW.class);

    private final Kind kind;

    private ExtCW(Kind kind) {
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        if (!kind.getType().isNumeric()) {
            logger.error("扩展数值只支持数值类型，得到 {}", kind);
            throw new IllegalArgumentException("Extended values need a numeric kind, got: " + kind);
        }
    }

    // ========== 工厂方法 ==========

    public static ExtCW bounded(CW cw) {
        return new Bounded(cw);
    }

    public static ExtCW posInfinity(Kind kind) {
        return new Infinite(kind, true);
    }

    public static ExtCW negInfinity(Kind kind) {
        return new Infinite(kind, false);
    }

    public static ExtCW epsilon(Kind kind) {
        return new Epsilon(kind);
    }

    public static ExtCW interval(ExtCW lo, ExtCW hi) {
        return new Interval(lo, hi);
    }

    public static ExtCW sum(ExtCW a, ExtCW b) {
        return new Sum(a, b);
    }

    public static ExtCW product(ExtCW a, ExtCW b) {
        return new Product(a, b);
    }

    private static Kind uniformKind(ExtCW a, ExtCW b) {
        Objects.requireNonNull(a, "Operand cannot be null");
        Objects.requireNonNull(b, "Operand cannot be null");
        if (!a.kind.equals(b.kind)) {
            logger.error("扩展数值的 Kind 不一致: {} 与 {}", a.kind, b.kind);
            throw new IllegalArgumentException("Mixed kinds in extended value: " + a.kind + " and " + b.kind);
        }
        return a.kind;
    }

    /**
     * 是否就是一个普通的具体值。
     */
    public boolean isRegular() {
        return false;
    }

    /**
     * 取相反数。无穷互换；区间上下界交换。
     */
    public abstract ExtCW negate();

    /**
     * 化简：折叠具体值之间的加法和乘法，吸收无穷，去掉加零、乘一。
     * 浮点类型的具体值不做折叠，舍入语义由求解器决定。
     */
    public abstract ExtCW simplify();

    // ========== 具体值的算术 ==========

    private static boolean foldable(Kind k) {
        return k.isBounded() || k.isUnbounded() || k.isReal();
    }

    private static CW addCW(CW a, CW b) {
        if (a.getKind().isReal()) {
            return CW.ofReal(a.asRational().add(b.asRational()));
        }
        return CW.ofInteger(a.getKind(), a.asInteger().add(b.asInteger()));
    }

    private static CW mulCW(CW a, CW b) {
        if (a.getKind().isReal()) {
            return CW.ofReal(a.asRational().multiply(b.asRational()));
        }
        return CW.ofInteger(a.getKind(), a.asInteger().multiply(b.asInteger()));
    }

    private static int signum(CW c) {
        return switch (c.getKind().getType()) {
            case REAL -> c.asRational().signum();
            case FLOAT -> (int) Math.signum(c.asFloat());
            case DOUBLE -> (int) Math.signum(c.asDouble());
            default -> c.asInteger().signum();
        };
    }

    /**
     * 无符号位向量的系数已按模回绕，看不出它在求解器输出中的符号。
     */
    private static boolean hasSign(CW c) {
        return !(c.getKind().isBounded() && !c.getKind().isSigned());
    }

    private static boolean isOne(CW c) {
        return foldable(c.getKind()) && c.equals(CW.fromInteger(c.getKind(), BigInteger.ONE));
    }

    private static CW negateCW(CW c) {
        return switch (c.getKind().getType()) {
            case REAL -> CW.ofReal(c.asRational().negate());
            case FLOAT -> CW.ofFloat(-c.asFloat());
            case DOUBLE -> CW.ofDouble(-c.asDouble());
            default -> CW.ofInteger(c.getKind(), c.asInteger().negate());
        };
    }

    // ========== 变体 ==========

    /**
     * 普通的有界值。
     */
    @Getter
    public static final class Bounded extends ExtCW {
        private final CW value;

        private Bounded(CW value) {
            super(Objects.requireNonNull(value, "Value cannot be null").getKind());
            this.value = value;
        }

        @Override
        public boolean isRegular() {
            return true;
        }

        @Override
        public ExtCW negate() {
            return new Bounded(negateCW(value));
        }

        @Override
        public ExtCW simplify() {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bounded that && value.equals(that.value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return value.getValue().toString();
        }
    }

    /**
     * 正无穷或负无穷。
     */
    @Getter
    public static final class Infinite extends ExtCW {
        private final boolean positive;

        private Infinite(Kind kind, boolean positive) {
            super(kind);
            this.positive = positive;
        }

        @Override
        public ExtCW negate() {
            return new Infinite(getKind(), !positive);
        }

        @Override
        public ExtCW simplify() {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Infinite that && positive == that.positive && getKind().equals(that.getKind());
        }

        @Override
        public int hashCode() {
            return Objects.hash(getKind(), positive);
        }

        @Override
        public String toString() {
            return positive ? "oo" : "-oo";
        }
    }

    /**
     * 正无穷小。
     */
    public static final class Epsilon extends ExtCW {

        private Epsilon(Kind kind) {
            super(kind);
        }

        @Override
        public ExtCW negate() {
            return new Product(new Bounded(CW.fromInteger(getKind(), BigInteger.ONE.negate())), this);
        }

        @Override
        public ExtCW simplify() {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Epsilon that && getKind().equals(that.getKind());
        }

        @Override
        public int hashCode() {
            return Objects.hash(getKind(), "epsilon");
        }

        @Override
        public String toString() {
            return "epsilon";
        }
    }

    /**
     * 区间 [lo, hi]。
     */
    @Getter
    public static final class Interval extends ExtCW {
        private final ExtCW lo;
        private final ExtCW hi;

        private Interval(ExtCW lo, ExtCW hi) {
            super(uniformKind(lo, hi));
            this.lo = lo;
            this.hi = hi;
        }

        @Override
        public ExtCW negate() {
            return new Interval(hi.negate(), lo.negate());
        }

        @Override
        public ExtCW simplify() {
            return new Interval(lo.simplify(), hi.simplify());
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Interval that && lo.equals(that.lo) && hi.equals(that.hi);
        }

        @Override
        public int hashCode() {
            return Objects.hash("interval", lo, hi);
        }

        @Override
        public String toString() {
            return "[" + lo + " .. " + hi + "]";
        }
    }

    /**
     * 和 a + b。
     */
    @Getter
    public static final class Sum extends ExtCW {
        private final ExtCW left;
        private final ExtCW right;

        private Sum(ExtCW left, ExtCW right) {
            super(uniformKind(left, right));
            this.left = left;
            this.right = right;
        }

        @Override
        public ExtCW negate() {
            return new Sum(left.negate(), right.negate());
        }

        @Override
        public ExtCW simplify() {
            ExtCW a = left.simplify();
            ExtCW b = right.simplify();
            if (a instanceof Bounded ba && b instanceof Bounded bb && foldable(getKind())) {
                return new Bounded(addCW(ba.value, bb.value));
            }
            if (a instanceof Bounded ba && foldable(getKind()) && signum(ba.value) == 0) {
                return b;
            }
            if (b instanceof Bounded bb && foldable(getKind()) && signum(bb.value) == 0) {
                return a;
            }
            // 无穷吸收有界值
            if (a instanceof Infinite && b instanceof Bounded) {
                return a;
            }
            if (b instanceof Infinite && a instanceof Bounded) {
                return b;
            }
            if (a instanceof Infinite ia && b instanceof Infinite ib && ia.positive == ib.positive) {
                return a;
            }
            return new Sum(a, b);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Sum that && left.equals(that.left) && right.equals(that.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash("+", left, right);
        }

        @Override
        public String toString() {
            return left + " + " + right;
        }
    }

    /**
     * 积 a * b。
     */
    @Getter
    public static final class Product extends ExtCW {
        private final ExtCW left;
        private final ExtCW right;

        private Product(ExtCW left, ExtCW right) {
            super(uniformKind(left, right));
            this.left = left;
            this.right = right;
        }

        @Override
        public ExtCW negate() {
            return new Product(left.negate(), right);
        }

        @Override
        public ExtCW simplify() {
            ExtCW a = left.simplify();
            ExtCW b = right.simplify();
            if (a instanceof Bounded ba && b instanceof Bounded bb && foldable(getKind())) {
                return new Bounded(mulCW(ba.value, bb.value));
            }
            if (a instanceof Bounded ba && isOne(ba.value)) {
                return b;
            }
            if (b instanceof Bounded bb && isOne(bb.value)) {
                return a;
            }
            // k * oo：符号由 k 决定；0 * oo 不定，无符号的 k 也保留原式
            if (a instanceof Bounded ba && b instanceof Infinite ib && hasSign(ba.value) && signum(ba.value) != 0) {
                return signum(ba.value) > 0 ? ib : ib.negate();
            }
            if (b instanceof Bounded bb && a instanceof Infinite ia && hasSign(bb.value) && signum(bb.value) != 0) {
                return signum(bb.value) > 0 ? ia : ia.negate();
            }
            return new Product(a, b);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Product that && left.equals(that.left) && right.equals(that.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash("*", left, right);
        }

        @Override
        public String toString() {
            return left + " * " + right;
        }
    }
}
