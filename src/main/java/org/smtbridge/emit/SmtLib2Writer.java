package org.smtbridge.emit;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtbridge.config.RoundingMode;
import org.smtbridge.config.SmtConfig;
import org.smtbridge.core.CW;
import org.smtbridge.core.Kind;
import org.smtbridge.core.NamedSymVar;
import org.smtbridge.core.Quantifier;
import org.smtbridge.core.SymWord;
import org.smtbridge.program.ArrayDecl;
import org.smtbridge.program.Assignment;
import org.smtbridge.program.Axiom;
import org.smtbridge.program.IncrementalUpdate;
import org.smtbridge.program.Objective;
import org.smtbridge.program.SymbolicProgram;
import org.smtbridge.program.Table;
import org.smtbridge.program.UninterpretedFunction;
import org.smtbridge.response.MultiModelSplitter;
import org.smtbridge.response.SmtModel;
import org.smtbridge.utils.Rational;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * SMT-LIB 2 方言的程序写出器。
 * <p>
 * 完整程序的各段按固定顺序输出 (每段都带一行注释标题，即使为空)：
 * 头部与选项、未解释排序、顶层输入、常量、未解释函数、表、数组、公理、skolem 函数、公式、优化指令。
 * 同样的输入总是得到逐字节相同的文本。
 */
public final class SmtLib2Writer {

    private static final Logger logger = LoggerFactory.getLogger(SmtLib2Writer.class);

    static final String HEADER = "; Automatically generated by smtlib-bridge. Do not edit.";

    private final SmtConfig config;

    public SmtLib2Writer(SmtConfig config) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
    }

    // ========== 完整程序 ==========

    /**
     * 写出一个完整的一次性查询程序 (不含 check-sat)。
     */
    public String program(SymbolicProgram p) {
        Quantifier top = p.getTopLevelQuantifier();
        List<NamedSymVar> topLevel = new ArrayList<>();
        List<Pair<NamedSymVar, List<NamedSymVar>>> skolems = new ArrayList<>();
        List<NamedSymVar> bound = new ArrayList<>();
        for (Pair<Quantifier, NamedSymVar> input : p.getInputs()) {
            NamedSymVar v = input.getValue();
            if (input.getKey() != top) {
                bound.add(v);
            } else if (bound.isEmpty()) {
                topLevel.add(v);
            } else {
                // 出现在某个内层量词之后：依赖于之前的全部内层变量
                skolems.add(Pair.of(v, List.copyOf(bound)));
            }
        }

        // 顶层可见的节点：常量和顶层输入
        Set<SymWord> visible = new HashSet<>();
        p.getConstants().forEach(c -> visible.add(c.getKey()));
        topLevel.forEach(v -> visible.add(v.getSymWord()));
        Predicate<SymWord> atTopLevel = w -> w.isConstantTrueOrFalse() || visible.contains(w);

        List<String> out = new ArrayList<>();
        out.add(HEADER);
        p.getComments().forEach(c -> out.add("; " + c));
        out.add("(set-option :produce-models true)");
        out.add("(set-logic " + logic(p, !bound.isEmpty()) + ")");

        out.add("; --- uninterpreted sorts ---");
        p.getKinds().stream().filter(Kind::isUninterpreted).forEach(k -> out.add(declareSort(k)));

        out.add("; --- top level inputs ---");
        topLevel.forEach(v -> out.add(declareInput(v)));

        out.add("; --- constants ---");
        p.getConstants().forEach(c -> out.add(defineConstant(c.getKey(), c.getValue())));

        out.add("; --- uninterpreted functions ---");
        p.getUninterpretedFunctions().forEach(f -> out.add(f.toDeclaration()));

        List<String> delayed = new ArrayList<>();
        out.add("; --- tables ---");
        for (Table t : p.getTables()) {
            out.add(declareTable(t));
            List<String> eqs = tableEqualities(t);
            if (t.getElements().stream().allMatch(atTopLevel)) {
                eqs.forEach(eq -> out.add("(assert " + eq + ")"));
            } else {
                delayed.addAll(eqs);
            }
        }

        out.add("; --- arrays ---");
        for (ArrayDecl a : p.getArrays()) {
            out.add(declareArray(a));
            Optional<String> init = arrayInitializer(a);
            if (init.isPresent()) {
                if (atTopLevel.test(a.getInitialValue().get())) {
                    out.add("(assert " + init.get() + ")");
                } else {
                    delayed.add(init.get());
                }
            }
        }

        out.add("; --- axioms ---");
        for (Axiom ax : p.getAxioms()) {
            out.add("; -- axiom: " + ax.getName());
            out.addAll(ax.getLines());
        }

        out.add("; --- skolemized inputs ---");
        for (Pair<NamedSymVar, List<NamedSymVar>> sk : skolems) {
            String args = sk.getValue().stream().map(v -> v.getKind().toSmtLib()).collect(Collectors.joining(" "));
            out.add("(declare-fun " + skolemName(sk.getKey()) + " (" + args + ") " + sk.getKey().getKind().toSmtLib() + ")");
        }

        out.add("; --- formula ---");
        List<String> conjuncts = new ArrayList<>();
        p.getConstraints().forEach(c -> conjuncts.add(c.toSmtLib()));
        conjuncts.addAll(delayed);
        String goal = p.getOutput().toSmtLib();
        conjuncts.add(p.isSat() ? goal : "(not " + goal + ")");
        if (bound.isEmpty()) {
            p.getAssignments().forEach(a -> out.add(defineAssignment(a)));
            conjuncts.forEach(c -> out.add("(assert " + c + ")"));
        } else {
            out.addAll(quantifiedAssertion(bound, skolems, p.getAssignments(), conjuncts));
        }

        if (!p.getObjectives().isEmpty()) {
            out.add("; --- optimization directives ---");
            out.add("(set-option :opt.priority " + config.getOptimizeStyle().getPriority() + ")");
            p.getObjectives().forEach(o -> out.add(objective(o)));
        }

        logger.debug("写出 SMT-LIB 2 程序，共 {} 行", out.size());
        return String.join("\n", out) + "\n";
    }

    private String logic(SymbolicProgram p, boolean quantified) {
        Optional<String> configured = config.getLogic();
        if (configured.isPresent()) {
            return configured.get();
        }
        SortedSet<Kind> kinds = p.getKinds();
        boolean extras = !p.getObjectives().isEmpty() || !p.getTables().isEmpty() || !p.getArrays().isEmpty()
                || !p.getUninterpretedFunctions().isEmpty() || !p.getAxioms().isEmpty();
        if (!extras && kinds.stream().allMatch(k -> k.isBoolean() || k.isBounded())) {
            return quantified ? "BV" : "QF_BV";
        }
        return "ALL";
    }

    private static List<String> quantifiedAssertion(List<NamedSymVar> bound,
                                                    List<Pair<NamedSymVar, List<NamedSymVar>>> skolems,
                                                    List<Assignment> assignments, List<String> conjuncts) {
        List<String> lines = new ArrayList<>();
        String binders = bound.stream()
                .map(v -> "(" + v.getSmtName() + " " + v.getKind().toSmtLib() + ")")
                .collect(Collectors.joining(" "));
        lines.add("(assert (forall (" + binders + ")");
        int lets = 0;
        for (Pair<NamedSymVar, List<NamedSymVar>> sk : skolems) {
            String args = sk.getValue().stream().map(NamedSymVar::getSmtName).collect(Collectors.joining(" "));
            lines.add("  (let ((" + sk.getKey().getSmtName() + " (" + skolemName(sk.getKey()) + " " + args + ")))");
            lets++;
        }
        for (Assignment a : assignments) {
            lines.add("  (let ((" + a.getTarget().toSmtLib() + " " + a.getExpr().toSmtLib() + "))");
            lets++;
        }
        lines.add("  " + conjunction(conjuncts) + ")".repeat(lets) + "))");
        return lines;
    }

    private static String conjunction(List<String> terms) {
        if (terms.size() == 1) {
            return terms.get(0);
        }
        return "(and " + String.join(" ", terms) + ")";
    }

    private static String skolemName(NamedSymVar v) {
        return v.getSmtName() + "_sk";
    }

    private static String objective(Objective o) {
        String m = o.getMetric().toSmtLib();
        return switch (o.getType()) {
            case MINIMIZE -> "(minimize " + m + ")";
            case MAXIMIZE -> "(maximize " + m + ")";
            case SOFT -> "(assert-soft " + m + " :weight " + o.getWeight().toPlainString()
                    + o.getGroup().map(g -> " :id " + g).orElse("") + ")";
        };
    }

    // ========== 增量片段 ==========

    /**
     * 写出增量片段：只包含非空的段，没有头部和量词。
     */
    public String incremental(IncrementalUpdate u) {
        List<String> out = new ArrayList<>();
        section(out, "; --- new uninterpreted sorts ---", u.getNewSorts().stream().map(SmtLib2Writer::declareSort).collect(Collectors.toList()));
        section(out, "; --- new inputs ---", u.getNewInputs().stream().map(SmtLib2Writer::declareInput).collect(Collectors.toList()));
        section(out, "; --- new constants ---", u.getConstants().stream().map(c -> defineConstant(c.getKey(), c.getValue())).collect(Collectors.toList()));
        section(out, "; --- new uninterpreted functions ---", u.getUninterpretedFunctions().stream().map(UninterpretedFunction::toDeclaration).collect(Collectors.toList()));
        section(out, "; --- new tables ---", u.getTables().stream().map(SmtLib2Writer::declareTable).collect(Collectors.toList()));
        section(out, "; --- new arrays ---", u.getArrays().stream().map(SmtLib2Writer::declareArray).collect(Collectors.toList()));
        section(out, "; --- new assignments ---", u.getAssignments().stream().map(SmtLib2Writer::defineAssignment).collect(Collectors.toList()));

        List<String> delayed = new ArrayList<>();
        for (Table t : u.getTables()) {
            tableEqualities(t).forEach(eq -> delayed.add("(assert " + eq + ")"));
        }
        for (ArrayDecl a : u.getArrays()) {
            arrayInitializer(a).ifPresent(init -> delayed.add("(assert " + init + ")"));
        }
        section(out, "; --- table and array contents ---", delayed);
        section(out, "; --- new constraints ---", u.getConstraints().stream().map(c -> "(assert " + c.toSmtLib() + ")").collect(Collectors.toList()));

        logger.debug("写出增量片段，共 {} 行", out.size());
        return out.isEmpty() ? "" : String.join("\n", out) + "\n";
    }

    private static void section(List<String> out, String title, List<String> lines) {
        if (!lines.isEmpty()) {
            out.add(title);
            out.addAll(lines);
        }
    }

    // ========== 声明 ==========

    private static String declareSort(Kind k) {
        List<String> literals = k.getLiterals().orElse(List.of());
        if (literals.isEmpty()) {
            return "(declare-sort " + k.getSortName() + " 0)";
        }
        String ctors = literals.stream().map(l -> "(" + l + ")").collect(Collectors.joining(" "));
        return "(declare-datatypes ((" + k.getSortName() + " 0)) ((" + ctors + ")))";
    }

    private static String declareInput(NamedSymVar v) {
        String decl = "(declare-fun " + v.getSmtName() + " () " + v.getKind().toSmtLib() + ")";
        return v.getName().equals(v.getSmtName()) ? decl : decl + " ; tracks user variable \"" + v.getName() + "\"";
    }

    private String defineConstant(SymWord w, CW value) {
        return "(define-fun " + w.toSmtLib() + " () " + w.getKind().toSmtLib() + " "
                + SmtLiterals.cwToSmtLib(config.getRoundingMode(), value) + ")";
    }

    private static String defineAssignment(Assignment a) {
        return "(define-fun " + a.getTarget().toSmtLib() + " () " + a.getTarget().getKind().toSmtLib() + " "
                + a.getExpr().toSmtLib() + ")";
    }

    private static String declareTable(Table t) {
        return "(declare-fun " + t.getName() + " (" + t.getIndexKind().toSmtLib() + ") " + t.getResultKind().toSmtLib() + ")";
    }

    private List<String> tableEqualities(Table t) {
        List<String> eqs = new ArrayList<>();
        List<SymWord> elements = t.getElements();
        for (int i = 0; i < elements.size(); i++) {
            String index = SmtLiterals.cwToSmtLib(config.getRoundingMode(), CW.fromInteger(t.getIndexKind(), BigInteger.valueOf(i)));
            eqs.add("(= (" + t.getName() + " " + index + ") " + elements.get(i).toSmtLib() + ")");
        }
        return eqs;
    }

    private static String declareArray(ArrayDecl a) {
        return "(declare-fun " + a.getName() + " () " + a.getSort() + ")";
    }

    private static Optional<String> arrayInitializer(ArrayDecl a) {
        return a.getInitialValue().map(v -> "(= " + a.getName() + " ((as const " + a.getSort() + ") " + v.toSmtLib() + "))");
    }

    // ========== 查询命令 ==========

    public static String push(int levels) {
        if (levels < 1) {
            throw new IllegalArgumentException("Push level must be positive: " + levels);
        }
        return "(push " + levels + ")";
    }

    public static String pop(int levels) {
        if (levels < 1) {
            throw new IllegalArgumentException("Pop level must be positive: " + levels);
        }
        return "(pop " + levels + ")";
    }

    public static String checkSat() {
        return "(check-sat)";
    }

    public static String getModel() {
        return "(get-model)";
    }

    public static String getObjectives() {
        return "(get-objectives)";
    }

    public static String getValue(Collection<NamedSymVar> vars) {
        if (vars.isEmpty()) {
            throw new IllegalArgumentException("get-value needs at least one variable");
        }
        return vars.stream().map(NamedSymVar::getSmtName).collect(Collectors.joining(" ", "(get-value (", "))"));
    }

    /**
     * 让求解器打印多模型输出的分隔标记。
     */
    public static String echoSentinel() {
        return "(echo \"" + MultiModelSplitter.SENTINEL + "\")";
    }

    // ========== 排除已知模型 ==========

    /**
     * 为每个已知模型生成一条断言，要求下一个模型至少在一个输入上与之不同。
     * 有全称输入时无法这样排除，返回空。
     */
    static Optional<List<String>> nonEqConstraints(RoundingMode rm, List<Pair<Quantifier, NamedSymVar>> inputs,
                                                   List<SmtModel> models) {
        if (inputs.stream().anyMatch(i -> i.getKey() == Quantifier.ALL)) {
            logger.debug("存在全称输入，无法生成排除模型的约束");
            return Optional.empty();
        }
        if (models.isEmpty()) {
            return Optional.empty();
        }
        List<String> asserts = new ArrayList<>(models.size());
        for (SmtModel model : models) {
            List<String> terms = new ArrayList<>();
            for (Pair<Quantifier, NamedSymVar> input : inputs) {
                NamedSymVar v = input.getValue();
                Optional<CW> value = model.get(v.getId()).flatMap(cw -> coerce(v.getKind(), cw));
                value.ifPresent(cw -> terms.add("(distinct " + v.getSmtName() + " " + SmtLiterals.cwToSmtLib(rm, cw) + ")"));
            }
            if (terms.isEmpty()) {
                asserts.add("(assert false)");
            } else if (terms.size() == 1) {
                asserts.add("(assert " + terms.get(0) + ")");
            } else {
                asserts.add("(assert (or " + String.join(" ", terms) + "))");
            }
        }
        return Optional.of(asserts);
    }

    /**
     * 模型中的值可能是求解器给出的实数形式，需要先还原成变量的 Kind。
     */
    private static Optional<CW> coerce(Kind kind, CW cw) {
        if (cw.getKind().equals(kind)) {
            return Optional.of(cw);
        }
        if (cw.getKind().isReal() && (kind.isBounded() || kind.isUnbounded())) {
            Rational r = cw.asRational();
            if (r.isInteger()) {
                return Optional.of(CW.fromInteger(kind, r.toBigInteger()));
            }
        }
        logger.warn("模型值 {} 与变量的 Kind {} 不符，不参与排除", cw, kind);
        return Optional.empty();
    }
}
