package org.smtbridge.program;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import org.apache.commons.lang3.tuple.Pair;
import org.smtbridge.core.CW;
import org.smtbridge.core.Kind;
import org.smtbridge.core.NamedSymVar;
import org.smtbridge.core.Quantifier;
import org.smtbridge.core.SymWord;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 发射之前的符号程序：带量词的输入、常量、表、数组、未解释函数、公理、
 * 按拓扑序排列的赋值、约束、输出节点以及优化目标。
 * <p>
 * {@code sat} 为真时求可满足性 (断言输出)，否则求证明 (断言输出的否定)。
 * 构造后不可变。
 */
@Getter
@Builder
public final class SymbolicProgram {

    @Builder.Default
    private final boolean sat = true;

    @Singular
    private final List<String> comments;

    // 输入的顺序决定量词的嵌套顺序
    @Singular
    private final List<Pair<Quantifier, NamedSymVar>> inputs;

    @Singular
    private final List<Pair<SymWord, CW>> constants;

    @Singular
    private final List<Table> tables;

    @Singular
    private final List<ArrayDecl> arrays;

    @Singular
    private final List<UninterpretedFunction> uninterpretedFunctions;

    @Singular
    private final List<Axiom> axioms;

    @Singular
    private final List<Assignment> assignments;

    @Singular
    private final List<SymWord> constraints;

    @NonNull
    private final SymWord output;

    @Singular
    private final List<Objective> objectives;

    /**
     * 程序中出现的全部 Kind，按 Kind 的全序排列。
     */
    public SortedSet<Kind> getKinds() {
        SortedSet<Kind> kinds = new TreeSet<>();
        kinds.add(output.getKind());
        inputs.forEach(i -> kinds.add(i.getValue().getKind()));
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
        objectives.forEach(o -> kinds.add(o.getMetric().getKind()));
        return Collections.unmodifiableSortedSet(kinds);
    }

    /**
     * 顶层量词：求可满足性时为存在，求证明时为全称。
     */
    public Quantifier getTopLevelQuantifier() {
        return sat ? Quantifier.EX : Quantifier.ALL;
    }
}
