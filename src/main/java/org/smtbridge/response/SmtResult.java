package org.smtbridge.response;

import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 一次查询的结果。只在查询期间存在，调用方取用后即丢弃。
 */
@Getter
public final class SmtResult {

    private static final SmtResult UNSAT = new SmtResult(ResultType.UNSATISFIABLE, null, List.of());
    private static final SmtResult TIME_OUT = new SmtResult(ResultType.TIMEOUT, null, List.of());

    private final ResultType type;
    @Getter(lombok.AccessLevel.NONE)
    private final SmtModel model;
    // 仅 PROOF_ERROR 携带
    private final List<String> rawLines;

    private SmtResult(ResultType type, SmtModel model, List<String> rawLines) {
        this.type = type;
        this.model = model;
        this.rawLines = List.copyOf(rawLines);
    }

    public static SmtResult unsatisfiable() {
        return UNSAT;
    }

    public static SmtResult timeOut() {
        return TIME_OUT;
    }

    public static SmtResult unknown(SmtModel model) {
        return new SmtResult(ResultType.UNKNOWN, Objects.requireNonNull(model, "Model cannot be null"), List.of());
    }

    public static SmtResult satisfiable(SmtModel model) {
        return new SmtResult(ResultType.SATISFIABLE, Objects.requireNonNull(model, "Model cannot be null"), List.of());
    }

    public static SmtResult satExtField(SmtModel model) {
        return new SmtResult(ResultType.SAT_EXT_FIELD, Objects.requireNonNull(model, "Model cannot be null"), List.of());
    }

    public static SmtResult proofError(List<String> rawLines) {
        return new SmtResult(ResultType.PROOF_ERROR, null, Objects.requireNonNull(rawLines, "Lines cannot be null"));
    }

    public Optional<SmtModel> getModel() {
        return Optional.ofNullable(model);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SmtResult that)) {
            return false;
        }
        return type == that.type && Objects.equals(model, that.model) && rawLines.equals(that.rawLines);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, model, rawLines);
    }

    @Override
    public String toString() {
        return switch (type) {
            case UNSATISFIABLE -> "Unsatisfiable";
            case TIMEOUT -> "TimeOut";
            case PROOF_ERROR -> "ProofError" + rawLines;
            default -> type + " " + model;
        };
    }
}
