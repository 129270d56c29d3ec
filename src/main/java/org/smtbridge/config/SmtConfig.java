package org.smtbridge.config;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.util.Optional;

/**
 * 一次翻译所用的配置：目标求解器、方言、浮点舍入方式、逻辑以及多目标优化方式。
 * 此类是不可变的。
 */
@Getter
@Builder(toBuilder = true)
public final class SmtConfig {

    @NonNull
    private final SolverCapabilities solver;

    @NonNull
    @Builder.Default
    private final SmtLibVersion smtLibVersion = SmtLibVersion.SMTLIB2;

    @NonNull
    @Builder.Default
    private final RoundingMode roundingMode = RoundingMode.ROUND_NEAREST_TIES_TO_EVEN;

    @NonNull
    @Builder.Default
    private final OptimizeStyle optimizeStyle = OptimizeStyle.LEXICOGRAPHIC;

    // 为 null 时由发射器根据问题自动选择
    @Getter(lombok.AccessLevel.NONE)
    private final String logic;

    public Optional<String> getLogic() {
        return Optional.ofNullable(logic);
    }

    /**
     * 使用给定求解器和默认设置的配置。
     */
    public static SmtConfig forSolver(SolverCapabilities solver) {
        return SmtConfig.builder().solver(solver).build();
    }
}
