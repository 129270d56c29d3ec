package org.smtbridge.program;

import org.apache.commons.lang3.tuple.Pair;
import org.smtbridge.core.CW;
import org.smtbridge.core.Kind;
import org.smtbridge.core.NamedSymVar;
import org.smtbridge.core.Quantifier;
import org.smtbridge.core.SymWord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolicProgramTest {

    private static final Kind W8 = Kind.bounded(false, 8);

    @Nested
    @DisplayName("程序的组成部分")
    class PartTests {

        @Test
        @DisplayName("表达式按前缀形式输出")
        void testSymExpr() {
            SymWord a = SymWord.of(0, W8);
            SymWord b = SymWord.of(1, W8);
            assertAll(
                    () -> assertEquals("(bvadd s0 s1)", SymExpr.of("bvadd", a, b).toSmtLib()),
                    () -> assertEquals("(not true)", SymExpr.of("not", SymWord.TRUE).toSmtLib()),
                    () -> assertEquals("#x00", SymExpr.of("#x00").toSmtLib()),
                    () -> assertThrows(IllegalArgumentException.class, () -> SymExpr.of(" "))
            );
        }

        @Test
        @DisplayName("不能给布尔常量赋值")
        void testAssignment() {
            assertThrows(IllegalArgumentException.class,
                    () -> new Assignment(SymWord.TRUE, SymExpr.of("=", SymWord.of(0, W8), SymWord.of(1, W8))));
        }

        @Test
        @DisplayName("表的下标必须是整数类型")
        void testTable() {
            Table t = new Table(3, W8, Kind.BOOL, List.of(SymWord.TRUE));
            assertAll(
                    () -> assertEquals("table3", t.getName()),
                    () -> assertThrows(IllegalArgumentException.class, () -> new Table(0, Kind.REAL, W8, List.of()))
            );
        }

        @Test
        @DisplayName("数组与未解释函数的声明")
        void testArrayAndFunction() {
            ArrayDecl a = ArrayDecl.fresh(2, Kind.UNBOUNDED, W8);
            assertAll(
                    () -> assertEquals("array_2", a.getName()),
                    () -> assertEquals("(Array Int (_ BitVec 8))", a.getSort()),
                    () -> assertTrue(a.getInitialValue().isEmpty()),
                    () -> assertEquals("(declare-fun f ((_ BitVec 8) Bool) Int)",
                            new UninterpretedFunction("f", List.of(W8, Kind.BOOL), Kind.UNBOUNDED).toDeclaration())
            );
        }

        @Test
        @DisplayName("软约束的权重必须为正")
        void testObjective() {
            SymWord goal = SymWord.of(4, Kind.BOOL);
            Objective soft = Objective.soft("s", goal, List.of(), new BigDecimal("0.5"), "g1");
            assertAll(
                    () -> assertEquals(Objective.Type.SOFT, soft.getType()),
                    () -> assertEquals("g1", soft.getGroup().orElseThrow()),
                    () -> assertTrue(Objective.minimize("m", SymWord.of(0, W8), List.of()).getGroup().isEmpty()),
                    () -> assertThrows(IllegalArgumentException.class,
                            () -> Objective.soft("s", goal, List.of(), BigDecimal.ZERO, null))
            );
        }
    }

    @Test
    @DisplayName("程序中出现的全部 Kind")
    void testKinds() {
        Kind color = Kind.uninterpreted("Color");
        SymbolicProgram p = SymbolicProgram.builder()
                .input(Pair.of(Quantifier.EX, NamedSymVar.of(0, color)))
                .constant(Pair.of(SymWord.of(1, W8), CW.ofInteger(W8, 1)))
                .array(ArrayDecl.fresh(0, Kind.UNBOUNDED, Kind.REAL))
                .output(SymWord.TRUE)
                .build();
        assertAll(
                () -> assertEquals(5, p.getKinds().size()),
                () -> assertTrue(p.getKinds().contains(color)),
                () -> assertTrue(p.isSat()),
                () -> assertEquals(Quantifier.EX, p.getTopLevelQuantifier()),
                () -> assertEquals(Quantifier.ALL,
                        SymbolicProgram.builder().sat(false).output(SymWord.TRUE).build().getTopLevelQuantifier())
        );
    }

    @Test
    @DisplayName("空的增量更新")
    void testIncrementalUpdate() {
        IncrementalUpdate empty = IncrementalUpdate.builder().build();
        IncrementalUpdate one = IncrementalUpdate.builder().newInput(NamedSymVar.of(9, Kind.STRING)).build();
        assertAll(
                () -> assertTrue(empty.isEmpty()),
                () -> assertTrue(empty.getKinds().isEmpty()),
                () -> assertFalse(one.isEmpty()),
                () -> assertEquals(Kind.STRING, one.getKinds().first())
        );
    }
}
