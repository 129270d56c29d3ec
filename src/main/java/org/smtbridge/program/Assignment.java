package org.smtbridge.program;

import lombok.Getter;
import org.smtbridge.core.SymWord;

import java.util.Objects;

/**
 * 一条赋值：目标节点 := 运算。程序中的赋值按拓扑序排列。
 */
@Getter
public final class Assignment {

    private final SymWord target;
    private final SymExpr expr;

    public Assignment(SymWord target, SymExpr expr) {
        this.target = Objects.requireNonNull(target, "Target cannot be null");
        this.expr = Objects.requireNonNull(expr, "Expression cannot be null");
        if (target.isConstantTrueOrFalse()) {
            throw new IllegalArgumentException("Cannot assign to a boolean constant");
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Assignment that && target.equals(that.target) && expr.equals(that.expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, expr);
    }

    @Override
    public String toString() {
        return target + " := " + expr;
    }
}
