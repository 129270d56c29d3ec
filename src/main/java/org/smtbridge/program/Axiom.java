package org.smtbridge.program;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * 用户给出的公理，原样写入程序。
 */
@Getter
public final class Axiom {

    private final String name;
    private final List<String> lines;

    public Axiom(String name, List<String> lines) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.lines = List.copyOf(lines);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Axiom that && name.equals(that.name) && lines.equals(that.lines);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, lines);
    }

    @Override
    public String toString() {
        return "axiom " + name;
    }
}
