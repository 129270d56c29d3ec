package org.smtbridge.program;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.apache.commons.lang3.tuple.Pair;
import org.smtbridge.core.CW;
import org.smtbridge.core.Kind;
import org.smtbridge.core.NamedSymVar;
import org.smtbridge.core.SymWord;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 交互式会话中一次增量更新的内容：在已发送的程序之上新增的声明与约束。
 * 增量片段中没有量词，新输入都按自由变量声明。
 */
@Getter
@Builder
public final class IncrementalUpdate {

    // 新出现的未解释排序
    @Singular
    private final List<Kind> newSorts;

    @Singular
    private final List<NamedSymVar> newInputs;

    @Singular
    private final List<Pair<SymWord, CW>> constants;

    @Singular
    private final List<Table> tables;

    @Singular
    private final List<ArrayDecl> arrays;

    @Singular
    private final List<UninterpretedFunction> uninterpretedFunctions;

    @Singular
    private final List<Assignment> assignments;

    @Singular
    private final List<SymWord> constraints;

    public SortedSet<Kind> getKinds() {
        SortedSet<Kind> kinds = new TreeSet<>(newSorts);
        newInputs.forEach(i -> kinds.add(i.getKind()));
        constants.forEach(c -> kinds.add(c.getValue().getKind()));
        for (Table t : tables) {
            kinds.add(t.getIndexKind());
            kinds.add(t.getResultKind());
        }
        for (ArrayDecl a : arrays) {
            kinds.add(a.getIndexKind());
            kinds.add(a.getElementKind());
        }
        for (UninterpretedFunction f : uninterpretedFunctions) {
            kinds.addAll(f.getArgKinds());
            kinds.add(f.getResultKind());
        }
        assignments.forEach(a -> kinds.add(a.getTarget().getKind()));
        return Collections.unmodifiableSortedSet(kinds);
    }

    public boolean isEmpty() {
        return newSorts.isEmpty() && newInputs.isEmpty() && constants.isEmpty() && tables.isEmpty()
                && arrays.isEmpty() && uninterpretedFunctions.isEmpty() && assignments.isEmpty() && constraints.isEmpty();
    }
}
