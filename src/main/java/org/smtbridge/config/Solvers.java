package org.smtbridge.config;

import java.util.List;
import java.util.Optional;

/**
 * 常见求解器的能力预置。
 */
public final class Solvers {

    public static final SolverCapabilities Z3 = SolverCapabilities.builder()
            .name("z3")
            .unboundedInts(true).reals(true).ieee754(true)
            .quantifiers(true).uninterpretedSorts(true).optimization(true)
            .build();

    public static final SolverCapabilities CVC4 = SolverCapabilities.builder()
            .name("cvc4")
            .unboundedInts(true).reals(true).ieee754(false)
            .quantifiers(true).uninterpretedSorts(true).optimization(false)
            .build();

    public static final SolverCapabilities YICES = SolverCapabilities.builder()
            .name("yices")
            .unboundedInts(true).reals(true).ieee754(false)
            .quantifiers(false).uninterpretedSorts(true).optimization(false)
            .build();

    public static final SolverCapabilities BOOLECTOR = SolverCapabilities.builder()
            .name("boolector")
            .unboundedInts(false).reals(false).ieee754(false)
            .quantifiers(false).uninterpretedSorts(false).optimization(false)
            .build();

    public static final SolverCapabilities MATHSAT = SolverCapabilities.builder()
            .name("mathsat")
            .unboundedInts(true).reals(true).ieee754(true)
            .quantifiers(false).uninterpretedSorts(false).optimization(false)
            .build();

    public static final SolverCapabilities ABC = SolverCapabilities.builder()
            .name("abc")
            .unboundedInts(false).reals(false).ieee754(false)
            .quantifiers(true).uninterpretedSorts(false).optimization(false)
            .build();

    private static final List<SolverCapabilities> ALL = List.of(Z3, CVC4, YICES, BOOLECTOR, MATHSAT, ABC);

    private Solvers() {
    }

    /**
     * 按名字 (不区分大小写) 查找预置。
     */
    public static Optional<SolverCapabilities> byName(String name) {
        return ALL.stream().filter(s -> s.getName().equalsIgnoreCase(name)).findFirst();
    }

    public static List<SolverCapabilities> all() {
        return ALL;
    }
}
