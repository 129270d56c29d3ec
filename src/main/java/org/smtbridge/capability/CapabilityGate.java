package org.smtbridge.capability;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtbridge.config.SmtConfig;
import org.smtbridge.config.SolverCapabilities;
import org.smtbridge.core.Kind;
import org.smtbridge.core.NamedSymVar;
import org.smtbridge.core.Quantifier;
import org.smtbridge.core.SymWord;
import org.smtbridge.exceptions.CapabilityException;
import org.smtbridge.program.Objective;
import org.smtbridge.program.SymbolicProgram;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 在发射任何文本之前，检查问题所需的特性是否都在求解器的能力范围之内。
 * 按 {@link Feature} 的顺序报告第一个不满足的特性；通过时没有任何输出。
 */
public final class CapabilityGate {

    private static final Logger logger = LoggerFactory.getLogger(CapabilityGate.class);

    private CapabilityGate() {
    }

    public static void check(SymbolicProgram program, SmtConfig config) {
        check(program.getKinds(), program.isSat(), program.getInputs(), program.getObjectives(), config.getSolver());
    }

    /**
     * @param kinds 问题中出现的全部 Kind。
     * @param isSat 求可满足性 (true) 还是求证明 (false)。
     * @param inputs 带量词的输入变量。
     * @param objectives 优化目标。
     * @param caps 求解器能力。
     * @throws CapabilityException 如果问题需要求解器不支持的特性。
     */
    public static void check(Collection<Kind> kinds, boolean isSat, List<Pair<Quantifier, NamedSymVar>> inputs,
                             List<Objective> objectives, SolverCapabilities caps) {
        Objects.requireNonNull(kinds, "Kinds cannot be null");
        Objects.requireNonNull(inputs, "Inputs cannot be null");
        Objects.requireNonNull(objectives, "Objectives cannot be null");
        Objects.requireNonNull(caps, "Solver capabilities cannot be null");

        Optional<Feature> missing = firstMissing(kinds, isSat, inputs, objectives, caps);
        if (missing.isPresent()) {
            logger.error("求解器 {} 不支持问题所需的 {}", caps.getName(), missing.get().getLabel());
            throw new CapabilityException(missing.get().getLabel(), caps.getName());
        }

        List<String> universalMetrics = universallyQuantifiedMetrics(inputs, objectives);
        if (!universalMetrics.isEmpty()) {
            String feature = "optimization of universally quantified metric" + (universalMetrics.size() > 1 ? "s" : "")
                    + ": " + String.join(" ", universalMetrics);
            logger.error("求解器 {} 不支持 {}", caps.getName(), feature);
            throw new CapabilityException(feature, caps.getName());
        }
        logger.debug("能力检查通过: {}", caps.getName());
    }

    private static Optional<Feature> firstMissing(Collection<Kind> kinds, boolean isSat,
                                                  List<Pair<Quantifier, NamedSymVar>> inputs,
                                                  List<Objective> objectives, SolverCapabilities caps) {
        if (!caps.supportsUnboundedInts() && kinds.stream().anyMatch(Kind::isUnbounded)) {
            return Optional.of(Feature.UNBOUNDED_INTEGERS);
        }
        if (!caps.supportsReals() && kinds.stream().anyMatch(Kind::isReal)) {
            return Optional.of(Feature.ALGEBRAIC_REALS);
        }
        if (!caps.supportsIEEE754() && kinds.stream().anyMatch(k -> k.isFloat() || k.isDouble())) {
            return Optional.of(Feature.FLOATING_POINT);
        }
        if (!caps.supportsQuantifiers() && needsQuantifiers(isSat, inputs)) {
            return Optional.of(Feature.QUANTIFIERS);
        }
        if (!caps.supportsUninterpretedSorts() && kinds.stream().anyMatch(Kind::isUninterpreted)) {
            return Optional.of(Feature.UNINTERPRETED_SORTS);
        }
        if (!caps.supportsOptimization() && !objectives.isEmpty()) {
            return Optional.of(Feature.OPTIMIZATION);
        }
        return Optional.empty();
    }

    /**
     * 求可满足性时出现全称输入，或求证明时出现存在输入，就需要量词。
     */
    public static boolean needsQuantifiers(boolean isSat, List<Pair<Quantifier, NamedSymVar>> inputs) {
        Quantifier inner = isSat ? Quantifier.ALL : Quantifier.EX;
        return inputs.stream().anyMatch(i -> i.getKey() == inner);
    }

    private static List<String> universallyQuantifiedMetrics(List<Pair<Quantifier, NamedSymVar>> inputs,
                                                             List<Objective> objectives) {
        Set<SymWord> universals = inputs.stream()
                .filter(i -> i.getKey() == Quantifier.ALL)
                .map(i -> i.getValue().getSymWord())
                .collect(Collectors.toSet());
        if (universals.isEmpty()) {
            return List.of();
        }
        return objectives.stream()
                .filter(o -> o.getInputs().stream().anyMatch(universals::contains))
                .map(Objective::getName)
                .collect(Collectors.toList());
    }
}
