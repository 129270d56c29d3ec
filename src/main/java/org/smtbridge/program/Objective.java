package org.smtbridge.program;

import lombok.Getter;
import org.smtbridge.core.SymWord;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 优化目标：最小化或最大化一个度量节点，或者一条带权重的软约束。
 * {@code inputs} 是度量所依赖的输入变量，用于检查全称量化的度量。
 */
@Getter
public final class Objective {

    public enum Type {
        MINIMIZE,
        MAXIMIZE,
        SOFT
    }

    private final Type type;
    private final String name;
    private final SymWord metric;
    private final List<SymWord> inputs;
    private final BigDecimal weight;
    @Getter(lombok.AccessLevel.NONE)
    private final String group;

    private Objective(Type type, String name, SymWord metric, List<SymWord> inputs, BigDecimal weight, String group) {
        this.type = type;
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.metric = Objects.requireNonNull(metric, "Metric cannot be null");
        this.inputs = List.copyOf(inputs);
        this.weight = weight;
        this.group = group;
    }

    public static Objective minimize(String name, SymWord metric, List<SymWord> inputs) {
        return new Objective(Type.MINIMIZE, name, metric, inputs, BigDecimal.ONE, null);
    }

    public static Objective maximize(String name, SymWord metric, List<SymWord> inputs) {
        return new Objective(Type.MAXIMIZE, name, metric, inputs, BigDecimal.ONE, null);
    }

    /**
     * 软约束。
     * @param weight 正的权重。
     * @param group 分组名，可以为 null。
     */
    public static Objective soft(String name, SymWord assertion, List<SymWord> inputs, BigDecimal weight, String group) {
        Objects.requireNonNull(weight, "Weight cannot be null");
        if (weight.signum() <= 0) {
            throw new IllegalArgumentException("Soft constraint weight must be positive: " + weight);
        }
        return new Objective(Type.SOFT, name, assertion, inputs, weight, group);
    }

    public Optional<String> getGroup() {
        return Optional.ofNullable(group);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Objective that && type == that.type && name.equals(that.name)
                && metric.equals(that.metric) && inputs.equals(that.inputs)
                && Objects.equals(weight, that.weight) && Objects.equals(group, that.group);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, metric, inputs, weight, group);
    }

    @Override
    public String toString() {
        return type + " " + name + " (" + metric + ")";
    }
}
