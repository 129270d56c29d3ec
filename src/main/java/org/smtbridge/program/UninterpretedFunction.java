package org.smtbridge.program;

import lombok.Getter;
import org.smtbridge.core.Kind;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 用户声明的未解释常量或函数。参数列表为空时是常量。
 */
@Getter
public final class UninterpretedFunction {

    private final String name;
    private final List<Kind> argKinds;
    private final Kind resultKind;

    public UninterpretedFunction(String name, List<Kind> argKinds, Kind resultKind) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.argKinds = List.copyOf(argKinds);
        this.resultKind = Objects.requireNonNull(resultKind, "Result kind cannot be null");
    }

    public String toDeclaration() {
        String args = argKinds.stream().map(Kind::toSmtLib).collect(Collectors.joining(" "));
        return "(declare-fun " + name + " (" + args + ") " + resultKind.toSmtLib() + ")";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UninterpretedFunction that && name.equals(that.name)
                && argKinds.equals(that.argKinds) && resultKind.equals(that.resultKind);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, argKinds, resultKind);
    }

    @Override
    public String toString() {
        return name + " :: " + argKinds + " -> " + resultKind;
    }
}
