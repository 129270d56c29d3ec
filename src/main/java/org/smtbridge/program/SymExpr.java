package org.smtbridge.program;

import lombok.Getter;
import org.smtbridge.core.SymWord;
import org.smtbridge.core.ToSmtLib;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 赋值右侧的一次运算：SMT-LIB 运算符 (可以是带索引的形式，如 {@code (_ extract 7 0)}) 作用于若干节点。
 * 没有参数时输出运算符本身。
 */
@Getter
public final class SymExpr implements ToSmtLib {

    private final String op;
    private final List<SymWord> args;

    private SymExpr(String op, List<SymWord> args) {
        if (op == null || op.isBlank()) {
            throw new IllegalArgumentException("Operator cannot be blank");
        }
        this.op = op;
        this.args = List.copyOf(args);
    }

    public static SymExpr of(String op, SymWord... args) {
        return new SymExpr(op, Arrays.asList(args));
    }

    public static SymExpr of(String op, List<SymWord> args) {
        return new SymExpr(op, Objects.requireNonNull(args, "Arguments cannot be null"));
    }

    @Override
    public String toSmtLib() {
        if (args.isEmpty()) {
            return op;
        }
        return args.stream().map(SymWord::toSmtLib).collect(Collectors.joining(" ", "(" + op + " ", ")"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SymExpr that)) {
            return false;
        }
        return op.equals(that.op) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, args);
    }

    @Override
    public String toString() {
        return toSmtLib();
    }
}
