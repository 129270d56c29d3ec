package org.smtbridge.program;

import lombok.Getter;
import org.smtbridge.core.Kind;
import org.smtbridge.core.SymWord;

import java.util.List;
import java.util.Objects;

/**
 * 查找表：下标类型到结果类型的一个函数，第 i 个元素是下标 i 处的值。
 * 输出为一个未解释函数和逐元素的等式约束。
 */
@Getter
public final class Table {

    private final int id;
    private final Kind indexKind;
    private final Kind resultKind;
    private final List<SymWord> elements;

    public Table(int id, Kind indexKind, Kind resultKind, List<SymWord> elements) {
        this.id = id;
        this.indexKind = Objects.requireNonNull(indexKind, "Index kind cannot be null");
        this.resultKind = Objects.requireNonNull(resultKind, "Result kind cannot be null");
        this.elements = List.copyOf(elements);
        if (!indexKind.isBounded() && !indexKind.isUnbounded()) {
            throw new IllegalArgumentException("Table index must be an integral kind, got: " + indexKind);
        }
    }

    public String getName() {
        return "table" + id;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Table that && id == that.id && indexKind.equals(that.indexKind)
                && resultKind.equals(that.resultKind) && elements.equals(that.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, indexKind, resultKind, elements);
    }

    @Override
    public String toString() {
        return getName() + " :: " + indexKind + " -> " + resultKind + " " + elements;
    }
}
