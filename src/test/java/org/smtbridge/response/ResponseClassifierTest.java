package org.smtbridge.response;

import org.smtbridge.config.SmtLibVersion;
import org.smtbridge.core.CW;
import org.smtbridge.core.Kind;
import org.smtbridge.core.NamedSymVar;
import org.smtbridge.core.SymbolTable;
import org.smtbridge.exceptions.SmtParseException;
import org.smtbridge.extended.ExtCW;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResponseClassifierTest {

    private NamedSymVar x;
    private NamedSymVar b;
    private ResponseClassifier classifier;

    @BeforeEach
    void setUp() {
        x = NamedSymVar.of(0, "x", Kind.UNBOUNDED);
        b = NamedSymVar.of(1, "b", Kind.BOOL);
        classifier = ResponseClassifier.forVersion(SymbolTable.of(x, b), SmtLibVersion.SMTLIB2);
    }

    @Test
    @DisplayName("unsat 与 timeout 不带模型")
    void testNoModel() {
        SmtResult unsat = classifier.classify(List.of("unsat"));
        SmtResult timeout = classifier.classify(List.of("timeout"));
        assertAll(
                () -> assertEquals(ResultType.UNSATISFIABLE, unsat.getType()),
                () -> assertTrue(unsat.getModel().isEmpty()),
                () -> assertEquals(ResultType.TIMEOUT, timeout.getType()),
                () -> assertFalse(timeout.getType().hasModel())
        );
    }

    @Test
    @DisplayName("sat 后面的 get-model 回答")
    void testSatWithModel() {
        SmtResult r = classifier.classify(List.of("sat", "(model (define-fun s0 () Int 0))"));
        assertEquals(ResultType.SATISFIABLE, r.getType());
        assertEquals(CW.ofInteger(Kind.UNBOUNDED, 0), r.getModel().orElseThrow().valueOf("x").orElseThrow());
    }

    @Test
    @DisplayName("跨行打印的模型与逐个打印的 get-value 回答")
    void testMultiLineAndValues() {
        SmtResult multi = classifier.classify(List.of(
                "sat",
                "(model",
                "  (define-fun s1 () Bool",
                "    true)",
                "  (define-fun s0 () Int",
                "    (- 7))",
                ")"));
        SmtResult values = classifier.classify(List.of("sat", "((s0 (- 7)))", "((s1 true))"));
        assertAll(
                () -> assertEquals(ResultType.SATISFIABLE, multi.getType()),
                () -> assertEquals(CW.ofInteger(Kind.UNBOUNDED, -7), multi.getModel().orElseThrow().get(0).orElseThrow()),
                () -> assertEquals(CW.ofBool(true), multi.getModel().orElseThrow().get(1).orElseThrow()),
                () -> assertEquals(multi, values)
        );
    }

    @Test
    @DisplayName("结果行前后的空白被忽略")
    void testWhitespace() {
        assertEquals(ResultType.SATISFIABLE, classifier.classify(List.of("  sat  ", "", "((s0 1))")).getType());
    }

    @Test
    @DisplayName("unknown 以宽松模式读出模型")
    void testUnknown() {
        SmtResult bare = classifier.classify(List.of("unknown"));
        SmtResult partial = classifier.classify(List.of("unknown", "((s0 (foo)))", "((s1 false))"));
        assertAll(
                () -> assertEquals(ResultType.UNKNOWN, bare.getType()),
                () -> assertEquals(SmtModel.EMPTY, bare.getModel().orElseThrow()),
                () -> assertEquals(ResultType.UNKNOWN, partial.getType()),
                () -> assertTrue(partial.getModel().orElseThrow().get(0).isEmpty()),
                () -> assertEquals(CW.ofBool(false), partial.getModel().orElseThrow().get(1).orElseThrow())
        );
    }

    @Test
    @DisplayName("sat 的模型无法解释时抛出解析错误")
    void testSatStrict() {
        SmtParseException e = assertThrows(SmtParseException.class,
                () -> classifier.classify(List.of("sat", "((s0 (foo)))")));
        assertEquals("((s0 (foo)))", e.getRawLine());
    }

    @Test
    @DisplayName("无法识别的回答保留原始输出")
    void testProofError() {
        List<String> lines = List.of("(error \"line 3 column 10: unknown constant s9\")", "sat");
        SmtResult r = classifier.classify(lines);
        SmtResult empty = classifier.classify(List.of());
        assertAll(
                () -> assertEquals(ResultType.PROOF_ERROR, r.getType()),
                () -> assertEquals(lines, r.getRawLines()),
                () -> assertEquals(ResultType.PROOF_ERROR, empty.getType()),
                () -> assertTrue(empty.getRawLines().isEmpty())
        );
    }

    @Test
    @DisplayName("目标值中出现无穷时为扩展域可满足")
    void testExtendedField() {
        SmtResult ext = classifier.classify(List.of("sat", "(objectives (s0 oo))", "((s0 3))"));
        SmtResult regular = classifier.classify(List.of("sat", "(objectives (s0 3))", "((s0 3))"));
        assertAll(
                () -> assertEquals(ResultType.SAT_EXT_FIELD, ext.getType()),
                () -> assertEquals(ExtCW.posInfinity(Kind.UNBOUNDED), ext.getModel().orElseThrow().objectiveValue("x").orElseThrow()),
                () -> assertEquals(ResultType.SATISFIABLE, regular.getType()),
                () -> assertTrue(regular.getModel().orElseThrow().objectiveValue("x").orElseThrow().isRegular())
        );
    }

    @Test
    @DisplayName("可能带模型的结果行")
    void testHelpers() {
        assertAll(
                () -> assertTrue(ResponseClassifier.startsWithModel(List.of("sat"))),
                () -> assertTrue(ResponseClassifier.startsWithModel(List.of("unknown", "x"))),
                () -> assertFalse(ResponseClassifier.startsWithModel(List.of("unsat"))),
                () -> assertFalse(ResponseClassifier.startsWithModel(List.of())),
                () -> assertTrue(ResponseClassifier.isResultLine(" timeout")),
                () -> assertFalse(ResponseClassifier.isResultLine("((s0 1))"))
        );
    }
}
