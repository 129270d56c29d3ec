package org.smtbridge.utils;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 精确有理数，作为 SMT-LIB 中 Real 类型 (algebraic real) 的取值。
 * 始终保持规范形式：分母为正，分子分母互素。
 * 此类是不可变的。
 */
public final class Rational implements Comparable<Rational> {
    private static final Logger logger = LoggerFactory.getLogger(Rational.class);
    private static final ConcurrentHashMap<List<BigInteger>, Rational> CACHE = new ConcurrentHashMap<>(256);

    private static final BigInteger BIG_INT_ONE = BigInteger.ONE;
    private static final BigInteger BIG_INT_TEN = BigInteger.TEN;

    @Getter
    private final BigInteger numerator;
    @Getter
    private final BigInteger denominator;

    private volatile int hash;

    // 常用常量
    public static final Rational ZERO = new Rational(BigInteger.ZERO, BIG_INT_ONE); // 0/1
    public static final Rational ONE = new Rational(BIG_INT_ONE, BIG_INT_ONE);      // 1/1
    public static final Rational MINUS_ONE = new Rational(BigInteger.valueOf(-1), BIG_INT_ONE);

    static {
        CACHE.put(ZERO.getCacheKey(), ZERO);
        CACHE.put(ONE.getCacheKey(), ONE);
        CACHE.put(MINUS_ONE.getCacheKey(), MINUS_ONE);
        for (int i = -16; i <= 16; i++) {
            if (i != 0 && i != 1 && i != -1) {
                Rational r = new Rational(BigInteger.valueOf(i), BIG_INT_ONE);
                CACHE.put(r.getCacheKey(), r);
            }
        }
    }

    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    // ========== 工厂方法 ==========

    public static Rational valueOf(BigInteger numerator) {
        return valueOf(numerator, BIG_INT_ONE);
    }

    public static Rational valueOf(long numerator) {
        return valueOf(BigInteger.valueOf(numerator), BIG_INT_ONE);
    }

    public static Rational valueOf(long numerator, long denominator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Rational valueOf(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "Numerator cannot be null");
        Objects.requireNonNull(denominator, "Denominator cannot be null");

        // 1. 分母为0：代数实数中没有无穷，直接拒绝
        if (denominator.signum() == 0) {
            logger.error("尝试创建分母为0的Rational: {} / {}", numerator, denominator);
            throw new ArithmeticException("Rational with zero denominator: " + numerator + "/0");
        }

        // 2. 分子为0的情况
        if (numerator.signum() == 0) {
            return ZERO;
        }

        // 3. 分母总是正数
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }

        // 4. 约分
        BigInteger commonDivisor = numerator.gcd(denominator);
        if (!commonDivisor.equals(BIG_INT_ONE)) {
            numerator = numerator.divide(commonDivisor);
            denominator = denominator.divide(commonDivisor);
        }

        // 5. 统一处理缓存
        List<BigInteger> key = List.of(numerator, denominator);
        Rational cached = CACHE.get(key);
        if (cached != null) {
            return cached;
        }
        return new Rational(numerator, denominator);
    }

    /**
     * 精确转换一个有限的 double，不经过十进制字符串，因此 float/double 的二进制值可以无损还原。
     * @throws ArithmeticException 如果是 NaN 或无穷
     */
    public static Rational valueOf(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            logger.error("尝试将非有限数转换为Rational: {}", value);
            throw new ArithmeticException("Rational of non-finite value: " + value);
        }
        if (value == 0.0) {
            return ZERO;
        }
        return valueOf(new BigDecimal(value));
    }

    public static Rational valueOf(BigDecimal bd) {
        int scale = bd.scale();
        if (scale <= 0) {
            return valueOf(bd.unscaledValue().multiply(BIG_INT_TEN.pow(-scale)), BIG_INT_ONE);
        }
        return valueOf(bd.unscaledValue(), BIG_INT_TEN.pow(scale));
    }

    /**
     * 解析 "3"、"-2.5"、"7/3" 形式的文本。
     */
    public static Rational valueOf(String s) {
        if (s == null || s.trim().isEmpty()) {
            throw new NumberFormatException("输入非法");
        }
        s = s.trim();

        // 处理分数形式
        if (s.contains("/")) {
            String[] parts = s.split("/", 2);
            if (parts[0].isEmpty() || parts[1].isEmpty()) {
                throw new NumberFormatException("无效分数格式: " + s);
            }
            try {
                return valueOf(new BigInteger(parts[0].trim()), new BigInteger(parts[1].trim()));
            } catch (NumberFormatException e) {
                throw new NumberFormatException("分数" + s + "的数字无效: " + e.getMessage());
            }
        }

        try {
            return valueOf(new BigDecimal(s));
        } catch (NumberFormatException e) {
            throw new NumberFormatException("无效数字格式: " + s);
        }
    }

    // ========== 基础运算 ==========

    public Rational add(Rational other) {
        if (this.isZero()) {
            return other;
        }
        if (other.isZero()) {
            return this;
        }
        BigInteger num = this.numerator.multiply(other.denominator).add(other.numerator.multiply(this.denominator));
        return valueOf(num, this.denominator.multiply(other.denominator));
    }

    public Rational subtract(Rational other) {
        return add(other.negate());
    }

    public Rational multiply(Rational other) {
        if (this.isZero() || other.isZero()) {
            return ZERO;
        }
        return valueOf(this.numerator.multiply(other.numerator), this.denominator.multiply(other.denominator));
    }

    public Rational divide(Rational other) {
        if (other.isZero()) {
            logger.error("除数为0: {} / {}", this, other);
            throw new ArithmeticException("Division by zero: " + this + " / 0");
        }
        return valueOf(this.numerator.multiply(other.denominator), this.denominator.multiply(other.numerator));
    }

    public Rational negate() {
        return valueOf(this.numerator.negate(), this.denominator);
    }

    public Rational abs() {
        return signum() < 0 ? negate() : this;
    }

    public int signum() {
        return numerator.signum();
    }

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    /**
     *  判断该rational是否是整数
     */
    public boolean isInteger() {
        return this.denominator.equals(BIG_INT_ONE);
    }

    /**
     * 整数部分，仅在 {@link #isInteger()} 为真时有意义。
     */
    public BigInteger toBigInteger() {
        if (!isInteger()) {
            throw new ArithmeticException("Rational is not an integer: " + this);
        }
        return numerator;
    }

    /**
     * 转换为 BigDecimal：分母只含因子2和5时是精确的 (float/double 的取值总是如此)，否则按 DECIMAL128 舍入。
     */
    public BigDecimal toBigDecimal() {
        BigDecimal num = new BigDecimal(numerator);
        BigDecimal den = new BigDecimal(denominator);
        try {
            return num.divide(den);
        } catch (ArithmeticException e) {
            logger.debug("{} 不是有限小数，按 DECIMAL128 舍入", this);
            return num.divide(den, MathContext.DECIMAL128);
        }
    }

    public double doubleValue() {
        return toBigDecimal().doubleValue();
    }

    public float floatValue() {
        return toBigDecimal().floatValue();
    }

    /**
     * SMT-LIB 2 中的 Real 字面量，例如 {@code 5.0}、{@code (/ 1.0 3.0)}、{@code (- (/ 1.0 3.0))}。
     */
    public String toSmtLib() {
        BigInteger absNum = numerator.abs();
        String body = isInteger()
                ? absNum + ".0"
                : "(/ " + absNum + ".0 " + denominator + ".0)";
        return signum() < 0 ? "(- " + body + ")" : body;
    }

    // ========== 对象基础方法 ==========

    @Override
    public int compareTo(Rational other) {
        BigInteger ad = this.numerator.multiply(other.denominator);
        BigInteger cb = other.numerator.multiply(this.denominator);
        return ad.compareTo(cb);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rational that)) {
            return false;
        }
        return this.numerator.equals(that.numerator) && this.denominator.equals(that.denominator);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Objects.hash(numerator, denominator);
            if (h == 0) {
                h = 1;
            }
            hash = h;
        }
        return h;
    }

    private List<BigInteger> getCacheKey() {
        return List.of(this.numerator, this.denominator);
    }

    @Override
    public String toString() {
        if (isInteger()) {
            return this.numerator.toString();
        }
        // 分数
        return this.numerator + "/" + this.denominator;
    }
}
