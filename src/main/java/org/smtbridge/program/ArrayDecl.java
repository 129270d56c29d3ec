package org.smtbridge.program;

import lombok.Getter;
import org.smtbridge.core.Kind;
import org.smtbridge.core.SymWord;

import java.util.Objects;
import java.util.Optional;

/**
 * SMT-LIB 数组声明。可选的初始值表示所有位置都取该值的常量数组。
 */
@Getter
public final class ArrayDecl {

    private final int id;
    private final Kind indexKind;
    private final Kind elementKind;
    @Getter(lombok.AccessLevel.NONE)
    private final SymWord initialValue;

    private ArrayDecl(int id, Kind indexKind, Kind elementKind, SymWord initialValue) {
        this.id = id;
        this.indexKind = Objects.requireNonNull(indexKind, "Index kind cannot be null");
        this.elementKind = Objects.requireNonNull(elementKind, "Element kind cannot be null");
        this.initialValue = initialValue;
    }

    public static ArrayDecl fresh(int id, Kind indexKind, Kind elementKind) {
        return new ArrayDecl(id, indexKind, elementKind, null);
    }

    public static ArrayDecl constant(int id, Kind indexKind, Kind elementKind, SymWord initialValue) {
        return new ArrayDecl(id, indexKind, elementKind, Objects.requireNonNull(initialValue, "Initial value cannot be null"));
    }

    public Optional<SymWord> getInitialValue() {
        return Optional.ofNullable(initialValue);
    }

    public String getName() {
        return "array_" + id;
    }

    public String getSort() {
        return "(Array " + indexKind.toSmtLib() + " " + elementKind.toSmtLib() + ")";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ArrayDecl that && id == that.id && indexKind.equals(that.indexKind)
                && elementKind.equals(that.elementKind) && Objects.equals(initialValue, that.initialValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, indexKind, elementKind, initialValue);
    }

    @Override
    public String toString() {
        return getName() + " :: " + getSort();
    }
}
