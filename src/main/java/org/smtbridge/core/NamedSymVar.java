package org.smtbridge.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 一个带显示名的输入变量：(内部 ID, 显示名, Kind)。
 * 求解器输出中以 "s" + ID 引用它。
 */
@Getter
public final class NamedSymVar implements Comparable<NamedSymVar> {

    private final SymWord symWord;
    private final String name;

    private NamedSymVar(SymWord symWord, String name) {
        this.symWord = Objects.requireNonNull(symWord, "SymWord cannot be null");
        this.name = Objects.requireNonNull(name, "Name cannot be null");
    }

    public static NamedSymVar of(int id, String name, Kind kind) {
        return new NamedSymVar(SymWord.of(id, kind), name);
    }

    /**
     * 没有显示名时使用默认命名规则 "s" + ID。
     */
    public static NamedSymVar of(int id, Kind kind) {
        return new NamedSymVar(SymWord.of(id, kind), "s" + id);
    }

    public int getId() {
        return symWord.getId();
    }

    public Kind getKind() {
        return symWord.getKind();
    }

    /**
     * SMT-LIB 中的符号名。
     */
    public String getSmtName() {
        return symWord.toSmtLib();
    }

    @Override
    public int compareTo(NamedSymVar other) {
        return symWord.compareTo(other.symWord);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NamedSymVar that)) {
            return false;
        }
        return symWord.equals(that.symWord) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symWord, name);
    }

    @Override
    public String toString() {
        return name + " (" + symWord + " :: " + symWord.getKind() + ")";
    }
}
