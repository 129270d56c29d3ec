package org.smtbridge.response;

import org.apache.commons.lang3.tuple.Pair;
import org.smtbridge.core.CW;
import org.smtbridge.core.Kind;
import org.smtbridge.core.NamedSymVar;
import org.smtbridge.core.SymbolTable;
import org.smtbridge.exceptions.AmbiguityException;
import org.smtbridge.exceptions.SmtParseException;
import org.smtbridge.sexpr.SExprParser;
import org.smtbridge.sexpr.SmtLib2Normalizer;
import org.smtbridge.utils.Rational;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ModelExtractorTest {

    private static final Kind W8 = Kind.bounded(false, 8);
    private static final Kind I8 = Kind.bounded(true, 8);
    private static final Kind COLOR = Kind.uninterpreted("Color", List.of("Red", "Green", "Blue"));

    private SymbolTable table;
    private ModelExtractor strict;
    private ModelExtractor lenient;

    @BeforeEach
    void setUp() {
        table = SymbolTable.of(
                NamedSymVar.of(0, "w", W8),
                NamedSymVar.of(1, "i", I8),
                NamedSymVar.of(2, "n", Kind.UNBOUNDED),
                NamedSymVar.of(3, "r", Kind.REAL),
                NamedSymVar.of(4, "b", Kind.BOOL),
                NamedSymVar.of(5, "str", Kind.STRING),
                NamedSymVar.of(6, "ch", Kind.CHAR),
                NamedSymVar.of(7, "c", COLOR),
                NamedSymVar.of(8, "d", Kind.DOUBLE));
        strict = ModelExtractor.strict(table, SmtLib2Normalizer.INSTANCE);
        lenient = ModelExtractor.lenient(table, SmtLib2Normalizer.INSTANCE);
    }

    private List<Pair<NamedSymVar, CW>> extract(ModelExtractor extractor, String line) {
        return extractor.extract(SExprParser.parse(line), line);
    }

    private CW single(String line) {
        List<Pair<NamedSymVar, CW>> result = extract(strict, line);
        assertEquals(1, result.size(), line);
        return result.get(0).getValue();
    }

    @Nested
    @DisplayName("get-value 形式的绑定")
    class ValueTests {

        @Test
        @DisplayName("各种 Kind 的值")
        void testKinds() {
            assertAll(
                    () -> assertEquals(CW.ofInteger(W8, 255), single("((s0 #xff))")),
                    () -> assertEquals(CW.ofInteger(I8, -1), single("((s1 #xff))")),
                    () -> assertEquals(CW.ofInteger(I8, -3), single("((s1 (bvneg #x03)))")),
                    () -> assertEquals(CW.ofInteger(Kind.UNBOUNDED, -12), single("((s2 (- 12)))")),
                    () -> assertEquals(CW.ofReal(Rational.valueOf(1, 3)), single("((s3 (/ 1.0 3.0)))")),
                    () -> assertEquals(CW.ofBool(true), single("((s4 true))")),
                    () -> assertEquals(CW.ofString("a\"b"), single("((s5 \"a\"\"b\"))")),
                    () -> assertEquals(CW.ofChar('x'), single("((s6 \"x\"))")),
                    () -> assertEquals(CW.ofDouble(0.5), single("((s8 ((_ to_fp 11 53) roundNearestTiesToEven 0.5)))"))
            );
        }

        @Test
        @DisplayName("未解释排序的值按字面量名字匹配下标")
        void testUninterpreted() {
            CW green = single("((s7 Green))");
            CW unlisted = single("((s7 Color!val!4))");
            assertAll(
                    () -> assertEquals("Green", green.asUninterpreted().getLabel()),
                    () -> assertEquals(Optional.of(1), green.asUninterpreted().getIndex()),
                    () -> assertEquals("Color!val!4", unlisted.asUninterpreted().getLabel()),
                    () -> assertTrue(unlisted.asUninterpreted().getIndex().isEmpty())
            );
        }

        @Test
        @DisplayName("整数变量得到实数形式的值时保留为实数")
        void testRealValueForInteger() {
            CW v = single("((s2 4.0))");
            assertAll(
                    () -> assertTrue(v.getKind().isReal()),
                    () -> assertEquals(Rational.valueOf(4), v.asRational())
            );
        }

        @Test
        @DisplayName("LAMBDA 包装的值取其函数体")
        void testLambda() {
            assertEquals(CW.ofInteger(Kind.UNBOUNDED, 7), single("((s2 (LAMBDA ((x Int)) 7)))"));
        }

        @Test
        @DisplayName("函数应用形式的头部也能识别")
        void testApplicationHead() {
            assertEquals(CW.ofInteger(W8, 1), single("(((s0 #x00) #x01))"));
        }
    }

    @Nested
    @DisplayName("严格与宽松模式")
    class ModeTests {

        @Test
        @DisplayName("同一行在严格模式下出错，在宽松模式下被丢弃")
        void testUnrecognizedValue() {
            String line = "((s0 (foo bar)))";
            SmtParseException e = assertThrows(SmtParseException.class, () -> extract(strict, line));
            assertAll(
                    () -> assertTrue(strict.isStrict()),
                    () -> assertFalse(lenient.isStrict()),
                    () -> assertEquals(line, e.getRawLine()),
                    () -> assertNotNull(e.getOffendingItem()),
                    () -> assertTrue(extract(lenient, line).isEmpty())
            );
        }

        @Test
        @DisplayName("Kind 不匹配的值同样无法识别")
        void testKindMismatch() {
            assertThrows(SmtParseException.class, () -> extract(strict, "((s4 \"no\"))"));
            assertTrue(extract(lenient, "((s5 12))").isEmpty());
        }

        @Test
        @DisplayName("不指向已知变量的形状总是被忽略")
        void testIgnored() {
            assertAll(
                    () -> assertTrue(extract(strict, "((s99 1))").isEmpty()),
                    () -> assertTrue(extract(strict, "((x 1))").isEmpty()),
                    () -> assertTrue(extract(strict, "((s0 1) (s1 2))").isEmpty()),
                    () -> assertTrue(extract(strict, "success").isEmpty()),
                    () -> assertTrue(extract(strict, "(objectives (s0 1))").isEmpty())
            );
        }

        @Test
        @DisplayName("同一 ID 的多个变量导致歧义错误")
        void testAmbiguity() {
            ModelExtractor ambiguous = ModelExtractor.strict(new SymbolTable(List.of(
                    NamedSymVar.of(3, "p", Kind.UNBOUNDED),
                    NamedSymVar.of(3, "q", Kind.UNBOUNDED))), SmtLib2Normalizer.INSTANCE);
            assertThrows(AmbiguityException.class, () -> extract(ambiguous, "((s3 1))"));
        }
    }

    @Nested
    @DisplayName("get-model 形式")
    class ModelTests {

        @Test
        @DisplayName("model 块中的 define-fun")
        void testModelBlock() {
            List<Pair<NamedSymVar, CW>> result = extract(strict,
                    "(model (define-fun s0 () (_ BitVec 8) #x2a) (define-fun s4 () Bool false))");
            assertAll(
                    () -> assertEquals(2, result.size()),
                    () -> assertEquals("w", result.get(0).getKey().getName()),
                    () -> assertEquals(CW.ofInteger(W8, 42), result.get(0).getValue()),
                    () -> assertEquals(CW.ofBool(false), result.get(1).getValue())
            );
        }

        @Test
        @DisplayName("省略 model 关键字的定义列表")
        void testBareDefinitionList() {
            List<Pair<NamedSymVar, CW>> result = extract(strict,
                    "((declare-fun Color!val!0 () Color) (define-fun s2 () Int 5) (forall ((x Color)) (= x Color!val!0)))");
            assertEquals(List.of(Pair.of(table.resolve("s2").orElseThrow(), CW.ofInteger(Kind.UNBOUNDED, 5))), result);
        }

        @Test
        @DisplayName("带参数的函数定义被跳过")
        void testFunctionDefinitionSkipped() {
            List<Pair<NamedSymVar, CW>> result = extract(strict,
                    "(model (define-fun s2 () Int 5) (define-fun table0 ((x!0 Int)) Int (ite (= x!0 0) 1 2)))");
            assertEquals(1, result.size());
        }

        @Test
        @DisplayName("畸形的 define-fun 在两种模式下都是错误")
        void testMalformedDefinition() {
            String line = "(model (define-fun s2 Int))";
            assertAll(
                    () -> assertThrows(SmtParseException.class, () -> extract(strict, line)),
                    () -> assertThrows(SmtParseException.class, () -> extract(lenient, line)),
                    () -> assertThrows(SmtParseException.class, () -> extract(lenient, "(model 12)"))
            );
        }
    }

    @Test
    @DisplayName("按 Kind 转换单个值")
    void testConvert() {
        assertAll(
                () -> assertTrue(ModelExtractor.convert(Kind.STRING, SExprParser.parse("3")).isEmpty()),
                () -> assertTrue(ModelExtractor.convert(Kind.CHAR, SExprParser.parse("\"ab\"")).isEmpty()),
                () -> assertTrue(ModelExtractor.convert(Kind.FLOAT, SExprParser.parse("((_ to_fp 11 53) RNE 0.5)")).isEmpty()),
                () -> assertEquals(Optional.of(CW.ofFloat(0.5f)),
                        ModelExtractor.convert(Kind.FLOAT, SExprParser.parse("((_ to_fp 8 24) RNE 0.5)")))
        );
    }
}
