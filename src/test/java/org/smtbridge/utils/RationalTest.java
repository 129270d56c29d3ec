package org.smtbridge.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class RationalTest {

    @Nested
    @DisplayName("构造与规范化 (Construction)")
    class ConstructionTests {

        @Test
        @DisplayName("分数应约分，且分母为正")
        void testNormalization() {
            Rational r = Rational.valueOf(4, -6);
            assertAll("2/-3 => -2/3",
                    () -> assertEquals(Rational.valueOf(-2, 3), r),
                    () -> assertEquals("-2/3", r.toString()),
                    () -> assertEquals(-1, r.signum())
            );
        }

        @Test
        @DisplayName("分母为零应抛出 ArithmeticException")
        void testZeroDenominator() {
            assertThrows(ArithmeticException.class, () -> Rational.valueOf(1, 0));
        }

        @Test
        @DisplayName("文本形式：整数、小数和分数")
        void testParseText() {
            assertAll(
                    () -> assertEquals(Rational.valueOf(3), Rational.valueOf("3")),
                    () -> assertEquals(Rational.valueOf(-5, 2), Rational.valueOf("-2.5")),
                    () -> assertEquals(Rational.valueOf(7, 3), Rational.valueOf("7/3")),
                    () -> assertThrows(NumberFormatException.class, () -> Rational.valueOf("abc"))
            );
        }

        @Test
        @DisplayName("double 的转换是精确的二进制值")
        void testExactDouble() {
            assertAll(
                    () -> assertEquals(Rational.valueOf(1, 2), Rational.valueOf(0.5)),
                    () -> assertEquals(0.1, Rational.valueOf(0.1).doubleValue()),
                    () -> assertNotEquals(Rational.valueOf(1, 10), Rational.valueOf(0.1)),
                    () -> assertThrows(ArithmeticException.class, () -> Rational.valueOf(Double.NaN)),
                    () -> assertThrows(ArithmeticException.class, () -> Rational.valueOf(Double.POSITIVE_INFINITY))
            );
        }
    }

    @Nested
    @DisplayName("算术 (Arithmetic)")
    class ArithmeticTests {

        @Test
        @DisplayName("加减乘除")
        void testBasicOps() {
            Rational a = Rational.valueOf(1, 3);
            Rational b = Rational.valueOf(1, 6);
            assertAll(
                    () -> assertEquals(Rational.valueOf(1, 2), a.add(b)),
                    () -> assertEquals(Rational.valueOf(1, 6), a.subtract(b)),
                    () -> assertEquals(Rational.valueOf(1, 18), a.multiply(b)),
                    () -> assertEquals(Rational.valueOf(2), a.divide(b)),
                    () -> assertThrows(ArithmeticException.class, () -> a.divide(Rational.ZERO))
            );
        }

        @Test
        @DisplayName("整数判断与比较")
        void testIntegerAndCompare() {
            assertAll(
                    () -> assertTrue(Rational.valueOf(6, 3).isInteger()),
                    () -> assertEquals(BigInteger.TWO, Rational.valueOf(6, 3).toBigInteger()),
                    () -> assertFalse(Rational.valueOf(1, 3).isInteger()),
                    () -> assertTrue(Rational.valueOf(1, 3).compareTo(Rational.valueOf(1, 2)) < 0),
                    () -> assertEquals(Rational.valueOf(3, 4), Rational.valueOf(-3, 4).abs())
            );
        }
    }

    @Nested
    @DisplayName("SMT-LIB 形式 (toSmtLib)")
    class SmtLibTests {

        @Test
        @DisplayName("整数、分数与负数")
        void testSmtLibText() {
            assertAll(
                    () -> assertEquals("5.0", Rational.valueOf(5).toSmtLib()),
                    () -> assertEquals("(/ 1.0 3.0)", Rational.valueOf(1, 3).toSmtLib()),
                    () -> assertEquals("(- (/ 1.0 3.0))", Rational.valueOf(-1, 3).toSmtLib()),
                    () -> assertEquals("(- 2.0)", Rational.valueOf(-2).toSmtLib())
            );
        }
    }
}
