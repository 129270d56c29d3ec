package org.smtbridge.core;

import org.smtbridge.exceptions.AmbiguityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolTableTest {

    @Test
    @DisplayName("s<ID> 解析到唯一的变量")
    void testResolveUnique() {
        NamedSymVar x = NamedSymVar.of(0, "x", Kind.UNBOUNDED);
        NamedSymVar y = NamedSymVar.of(1, "y", Kind.BOOL);
        SymbolTable table = SymbolTable.of(x, y);

        assertAll(
                () -> assertEquals(x, table.resolve("s0").orElseThrow()),
                () -> assertEquals(y, table.resolve("s1").orElseThrow()),
                () -> assertEquals("s1", y.getSmtName())
        );
    }

    @Test
    @DisplayName("不符合命名约定或没有匹配的符号被忽略")
    void testResolveNone() {
        SymbolTable table = SymbolTable.of(NamedSymVar.of(0, Kind.UNBOUNDED));
        assertAll(
                () -> assertTrue(table.resolve("s7").isEmpty()),
                () -> assertTrue(table.resolve("x").isEmpty()),
                () -> assertTrue(table.resolve("s0_sk").isEmpty()),
                () -> assertTrue(table.resolve("s99999999999999").isEmpty())
        );
    }

    @Test
    @DisplayName("同一 ID 的多个变量导致歧义错误")
    void testAmbiguity() {
        SymbolTable table = new SymbolTable(List.of(
                NamedSymVar.of(3, "a", Kind.UNBOUNDED),
                NamedSymVar.of(3, "b", Kind.UNBOUNDED)));

        AmbiguityException e = assertThrows(AmbiguityException.class, () -> table.resolve("s3"));
        assertEquals(2, e.getMatches().size());
    }
}
