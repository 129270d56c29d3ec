package org.smtbridge.emit;

import org.apache.commons.lang3.tuple.Pair;
import org.smtbridge.config.OptimizeStyle;
import org.smtbridge.config.SmtConfig;
import org.smtbridge.config.Solvers;
import org.smtbridge.core.CW;
import org.smtbridge.core.Kind;
import org.smtbridge.core.NamedSymVar;
import org.smtbridge.core.Quantifier;
import org.smtbridge.core.SymWord;
import org.smtbridge.program.ArrayDecl;
import org.smtbridge.program.Assignment;
import org.smtbridge.program.Axiom;
import org.smtbridge.program.Objective;
import org.smtbridge.program.SymExpr;
import org.smtbridge.program.SymbolicProgram;
import org.smtbridge.program.Table;
import org.smtbridge.program.UninterpretedFunction;
import org.smtbridge.response.MultiModelSplitter;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SmtLib2WriterTest {

    private static final Kind W8 = Kind.bounded(false, 8);
    private static final SmtConfig Z3 = SmtConfig.forSolver(Solvers.Z3);

    private static NamedSymVar x, y;
    private static SymWord ten, sum, isTen, less;

    @BeforeAll
    static void setUp() {
        x = NamedSymVar.of(0, "x", W8);
        y = NamedSymVar.of(1, "y", W8);
        ten = SymWord.of(2, W8);
        sum = SymWord.of(3, W8);
        isTen = SymWord.of(4, Kind.BOOL);
        less = SymWord.of(5, Kind.BOOL);
    }

    /**
     * x + y == 10 且 x < y
     */
    static SymbolicProgram.SymbolicProgramBuilder sumIsTen() {
        return SymbolicProgram.builder()
                .input(Pair.of(Quantifier.EX, x))
                .input(Pair.of(Quantifier.EX, y))
                .constant(Pair.of(ten, CW.ofInteger(W8, 10)))
                .assignment(new Assignment(sum, SymExpr.of("bvadd", x.getSymWord(), y.getSymWord())))
                .assignment(new Assignment(isTen, SymExpr.of("=", sum, ten)))
                .assignment(new Assignment(less, SymExpr.of("bvult", x.getSymWord(), y.getSymWord())))
                .constraint(less)
                .output(isTen);
    }

    @Nested
    @DisplayName("一次性程序 (One-shot programs)")
    class ProgramTests {

        @Test
        @DisplayName("无量词的位向量程序")
        void testQuantifierFreeProgram() {
            String text = SmtLibEmitter.toSmtLib(Z3, sumIsTen().build()).getText();
            String expected = String.join("\n",
                    "; Automatically generated by smtlib-bridge. Do not edit.",
                    "(set-option :produce-models true)",
                    "(set-logic QF_BV)",
                    "; --- uninterpreted sorts ---",
                    "; --- top level inputs ---",
                    "(declare-fun s0 () (_ BitVec 8)) ; tracks user variable \"x\"",
                    "(declare-fun s1 () (_ BitVec 8)) ; tracks user variable \"y\"",
                    "; --- constants ---",
                    "(define-fun s2 () (_ BitVec 8) #x0a)",
                    "; --- uninterpreted functions ---",
                    "; --- tables ---",
                    "; --- arrays ---",
                    "; --- axioms ---",
                    "; --- skolemized inputs ---",
                    "; --- formula ---",
                    "(define-fun s3 () (_ BitVec 8) (bvadd s0 s1))",
                    "(define-fun s4 () Bool (= s3 s2))",
                    "(define-fun s5 () Bool (bvult s0 s1))",
                    "(assert s5)",
                    "(assert s4)") + "\n";
            assertEquals(expected, text);
        }

        @Test
        @DisplayName("同样的输入得到逐字节相同的文本")
        void testDeterminism() {
            String a = SmtLibEmitter.toSmtLib(Z3, sumIsTen().build()).getText();
            String b = SmtLibEmitter.toSmtLib(Z3, sumIsTen().build()).getText();
            assertEquals(a, b);
        }

        @Test
        @DisplayName("求证明时断言输出的否定")
        void testProveNegatesOutput() {
            String text = SmtLibEmitter.toSmtLib(Z3, sumIsTen().sat(false).build()).getText();
            assertAll(
                    () -> assertTrue(text.contains("(assert (not s4))")),
                    () -> assertTrue(text.contains("(assert s5)"))
            );
        }

        @Test
        @DisplayName("配置的逻辑优先；含整数时自动选择 ALL")
        void testLogicSelection() {
            SymbolicProgram withInt = SymbolicProgram.builder()
                    .input(Pair.of(Quantifier.EX, NamedSymVar.of(0, Kind.UNBOUNDED)))
                    .output(SymWord.TRUE)
                    .build();
            assertAll(
                    () -> assertTrue(SmtLibEmitter.toSmtLib(Z3, withInt).getText().contains("(set-logic ALL)")),
                    () -> assertTrue(SmtLibEmitter.toSmtLib(Z3.toBuilder().logic("QF_LIA").build(), withInt)
                            .getText().contains("(set-logic QF_LIA)")),
                    () -> assertTrue(SmtLibEmitter.toSmtLib(Z3, withInt).getText().contains("(assert true)"))
            );
        }

        @Test
        @DisplayName("各段按固定顺序输出")
        void testSectionOrder() {
            Kind color = Kind.uninterpreted("Color", List.of("Red", "Green"));
            SymbolicProgram p = sumIsTen()
                    .input(Pair.of(Quantifier.EX, NamedSymVar.of(6, color)))
                    .uninterpretedFunction(new UninterpretedFunction("f", List.of(W8), W8))
                    .table(new Table(0, W8, W8, List.of(ten, x.getSymWord())))
                    .array(ArrayDecl.constant(1, W8, W8, ten))
                    .axiom(new Axiom("f-idempotent", List.of("(assert (forall ((a (_ BitVec 8))) (= (f (f a)) (f a))))")))
                    .objective(Objective.minimize("m", sum, List.of(x.getSymWord())))
                    .comment("section order")
                    .build();
            String text = SmtLibEmitter.toSmtLib(Z3, p).getText();
            List<String> markers = List.of(
                    "; section order",
                    "(set-logic ALL)",
                    "(declare-datatypes ((Color 0)) (((Red) (Green))))",
                    "(declare-fun s6 () Color)",
                    "(define-fun s2 ",
                    "(declare-fun f ((_ BitVec 8)) (_ BitVec 8))",
                    "(declare-fun table0 ((_ BitVec 8)) (_ BitVec 8))",
                    "(assert (= (table0 #x00) s2))",
                    "(assert (= (table0 #x01) s0))",
                    "(declare-fun array_1 () (Array (_ BitVec 8) (_ BitVec 8)))",
                    "(assert (= array_1 ((as const (Array (_ BitVec 8) (_ BitVec 8))) s2)))",
                    "; -- axiom: f-idempotent",
                    "; --- formula ---",
                    "(assert s4)",
                    "(set-option :opt.priority lex)",
                    "(minimize s3)");
            int last = -1;
            for (String marker : markers) {
                int at = text.indexOf(marker);
                assertTrue(at > last, "Out of order or missing: " + marker + "\n" + text);
                last = at;
            }
        }

        @Test
        @DisplayName("依赖非顶层值的表约束放入公式")
        void testDelayedTableEqualities() {
            SymbolicProgram p = sumIsTen()
                    .table(new Table(0, W8, W8, List.of(sum)))
                    .build();
            String text = SmtLibEmitter.toSmtLib(Z3, p).getText();
            assertTrue(text.indexOf("(assert (= (table0 #x00) s3))") > text.indexOf("(define-fun s3 "), text);
        }

        @Test
        @DisplayName("优化指令：优先级、最小化、最大化与软约束")
        void testOptimizationDirectives() {
            SymbolicProgram p = sumIsTen()
                    .objective(Objective.maximize("hi", x.getSymWord(), List.of(x.getSymWord())))
                    .objective(Objective.soft("s", less, List.of(), new BigDecimal("2.5"), "g"))
                    .objective(Objective.soft("t", isTen, List.of(), BigDecimal.ONE, null))
                    .build();
            String text = SmtLibEmitter.toSmtLib(Z3.toBuilder().optimizeStyle(OptimizeStyle.INDEPENDENT).build(), p).getText();
            assertTrue(text.endsWith(String.join("\n",
                    "; --- optimization directives ---",
                    "(set-option :opt.priority box)",
                    "(maximize s0)",
                    "(assert-soft s5 :weight 2.5 :id g)",
                    "(assert-soft s4 :weight 1)") + "\n"), text);
        }
    }

    @Nested
    @DisplayName("量词 (Quantifiers)")
    class QuantifierTests {

        @Test
        @DisplayName("内层全称变量由 forall 绑定，之后的存在变量 skolem 化")
        void testSkolemization() {
            NamedSymVar a = NamedSymVar.of(0, W8);
            NamedSymVar b = NamedSymVar.of(1, W8);
            NamedSymVar c = NamedSymVar.of(2, W8);
            SymWord eq = SymWord.of(3, Kind.BOOL);
            SymbolicProgram p = SymbolicProgram.builder()
                    .input(Pair.of(Quantifier.EX, a))
                    .input(Pair.of(Quantifier.ALL, b))
                    .input(Pair.of(Quantifier.EX, c))
                    .assignment(new Assignment(eq, SymExpr.of("=", c.getSymWord(), b.getSymWord())))
                    .output(eq)
                    .build();
            String text = SmtLibEmitter.toSmtLib(Z3, p).getText();
            assertAll(
                    () -> assertTrue(text.contains("(set-logic BV)")),
                    () -> assertTrue(text.contains("(declare-fun s0 () (_ BitVec 8))")),
                    () -> assertFalse(text.contains("(declare-fun s1 ")),
                    () -> assertTrue(text.contains("(declare-fun s2_sk ((_ BitVec 8)) (_ BitVec 8))")),
                    () -> assertTrue(text.endsWith(String.join("\n",
                            "; --- formula ---",
                            "(assert (forall ((s1 (_ BitVec 8)))",
                            "  (let ((s2 (s2_sk s1)))",
                            "  (let ((s3 (= s2 s1)))",
                            "  s3))))") + "\n"), text)
            );
        }

        @Test
        @DisplayName("求证明时存在变量是内层量词")
        void testProveWithExistential() {
            NamedSymVar a = NamedSymVar.of(0, W8);
            NamedSymVar b = NamedSymVar.of(1, W8);
            SymWord eq = SymWord.of(2, Kind.BOOL);
            SymbolicProgram p = SymbolicProgram.builder()
                    .sat(false)
                    .input(Pair.of(Quantifier.ALL, a))
                    .input(Pair.of(Quantifier.EX, b))
                    .assignment(new Assignment(eq, SymExpr.of("=", a.getSymWord(), b.getSymWord())))
                    .output(eq)
                    .build();
            String text = SmtLibEmitter.toSmtLib(Z3, p).getText();
            assertTrue(text.endsWith(String.join("\n",
                    "(assert (forall ((s1 (_ BitVec 8)))",
                    "  (let ((s2 (= s0 s1)))",
                    "  (not s2))))") + "\n"), text);
        }
    }

    @Nested
    @DisplayName("查询命令 (Query commands)")
    class CommandTests {

        @Test
        @DisplayName("push/pop/check-sat/get-value/get-objectives/echo")
        void testCommands() {
            assertAll(
                    () -> assertEquals("(push 1)", SmtLib2Writer.push(1)),
                    () -> assertEquals("(pop 2)", SmtLib2Writer.pop(2)),
                    () -> assertEquals("(check-sat)", SmtLib2Writer.checkSat()),
                    () -> assertEquals("(get-model)", SmtLib2Writer.getModel()),
                    () -> assertEquals("(get-objectives)", SmtLib2Writer.getObjectives()),
                    () -> assertEquals("(get-value (s0 s1))", SmtLib2Writer.getValue(List.of(x, y))),
                    () -> assertEquals("(echo " + MultiModelSplitter.SENTINEL_LINE + ")", SmtLib2Writer.echoSentinel()),
                    () -> assertThrows(IllegalArgumentException.class, () -> SmtLib2Writer.push(0)),
                    () -> assertThrows(IllegalArgumentException.class, () -> SmtLib2Writer.getValue(List.of()))
            );
        }
    }
}
