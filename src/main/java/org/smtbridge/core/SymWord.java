package org.smtbridge.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 符号程序中的一个节点 (symbolic word)，在 SMT-LIB 中命名为 "s" + ID。
 * TRUE 和 FALSE 是两个保留节点，直接输出为布尔字面量。
 */
@Getter
public final class SymWord implements Comparable<SymWord>, ToSmtLib {

    public static final SymWord FALSE = new SymWord(-2, Kind.BOOL);
    public static final SymWord TRUE = new SymWord(-1, Kind.BOOL);

    private final int id;
    private final Kind kind;

    private SymWord(int id, Kind kind) {
        this.id = id;
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
    }

    public static SymWord of(int id, Kind kind) {
        if (id < 0) {
            throw new IllegalArgumentException("Negative ids are reserved for the boolean constants: " + id);
        }
        return new SymWord(id, kind);
    }

    public boolean isConstantTrueOrFalse() {
        return id < 0;
    }

    @Override
    public String toSmtLib() {
        if (this == TRUE) {
            return "true";
        }
        if (this == FALSE) {
            return "false";
        }
        return "s" + id;
    }

    @Override
    public int compareTo(SymWord other) {
        return Integer.compare(this.id, other.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SymWord that)) {
            return false;
        }
        return id == that.id && kind.equals(that.kind);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind);
    }

    @Override
    public String toString() {
        return toSmtLib();
    }
}
