package org.smtbridge.response;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.smtbridge.core.CW;
import org.smtbridge.core.NamedSymVar;
import org.smtbridge.extended.ExtCW;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 求解器给出的模型：变量 ID 到 (名字, 值) 的映射，以及按变量 ID 排序的 (目标名, 扩展值) 列表。
 * 此类是不可变的。
 */
@Getter
public final class SmtModel {

    public static final SmtModel EMPTY = new SmtModel(Collections.emptySortedMap(), List.of());

    private final SortedMap<Integer, Pair<String, CW>> bindings;
    private final List<Pair<String, ExtCW>> objectives;

    private SmtModel(SortedMap<Integer, Pair<String, CW>> bindings, List<Pair<String, ExtCW>> objectives) {
        this.bindings = Collections.unmodifiableSortedMap(bindings);
        this.objectives = List.copyOf(objectives);
    }

    /**
     * 由提取出的绑定构造模型。同一变量出现多次时以最后一次为准。
     */
    public static SmtModel of(List<Pair<NamedSymVar, CW>> bindings, List<Pair<NamedSymVar, ExtCW>> objectives) {
        SortedMap<Integer, Pair<String, CW>> sorted = new TreeMap<>();
        for (Pair<NamedSymVar, CW> b : bindings) {
            sorted.put(b.getKey().getId(), Pair.of(b.getKey().getName(), b.getValue()));
        }
        List<Pair<NamedSymVar, ExtCW>> objs = new ArrayList<>(objectives);
        // 稳定排序，保持同一变量多次出现时的相对顺序
        objs.sort(Comparator.comparing((Pair<NamedSymVar, ExtCW> o) -> o.getKey()));
        List<Pair<String, ExtCW>> named = new ArrayList<>(objs.size());
        for (Pair<NamedSymVar, ExtCW> o : objs) {
            named.add(Pair.of(o.getKey().getName(), o.getValue()));
        }
        return new SmtModel(sorted, named);
    }

    public Optional<CW> get(int id) {
        Pair<String, CW> b = bindings.get(id);
        return b == null ? Optional.empty() : Optional.of(b.getValue());
    }

    /**
     * 按显示名查找变量的值。
     */
    public Optional<CW> valueOf(String name) {
        return bindings.values().stream()
                .filter(b -> b.getKey().equals(name))
                .map(Pair::getValue)
                .findFirst();
    }

    public Optional<ExtCW> objectiveValue(String name) {
        return objectives.stream()
                .filter(o -> o.getKey().equals(name))
                .map(Pair::getValue)
                .findFirst();
    }

    /**
     * 所有目标值都是普通值 (或没有目标)。
     */
    public boolean hasOnlyRegularObjectives() {
        return objectives.stream().allMatch(o -> o.getValue().isRegular());
    }

    public boolean isEmpty() {
        return bindings.isEmpty() && objectives.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SmtModel that)) {
            return false;
        }
        return bindings.equals(that.bindings) && objectives.equals(that.objectives);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bindings, objectives);
    }

    @Override
    public String toString() {
        return "{bindings=" + bindings.values() + ", objectives=" + objectives + "}";
    }
}
