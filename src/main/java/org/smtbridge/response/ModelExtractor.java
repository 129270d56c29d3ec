package org.smtbridge.response;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtbridge.core.CW;
import org.smtbridge.core.Kind;
import org.smtbridge.core.NamedSymVar;
import org.smtbridge.core.SymbolTable;
import org.smtbridge.exceptions.SmtParseException;
import org.smtbridge.sexpr.OutputNormalizer;
import org.smtbridge.sexpr.SExpr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 从一行 (已解析的) 求解器输出中提取变量绑定。识别两种形状：
 * <pre>
 *   ((s0 v))                                  get-value 的回答
 *   (model (define-fun s0 () Int v) ...)      get-model 的回答
 *   ((define-fun s0 () Int v) ...)            同上，省略 model 关键字
 * </pre>
 * 严格模式下，已知变量的值无法识别是致命错误；宽松模式下跳过。
 * 不指向已知变量的形状总是被忽略。
 */
public final class ModelExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ModelExtractor.class);

    // model 块中不携带变量值的声明，z3 用它们描述未解释排序的论域
    private static final Set<String> NON_BINDING_FORMS = Set.of("declare-fun", "declare-sort", "declare-datatypes", "forall");

    private final SymbolTable table;
    private final OutputNormalizer normalizer;
    private final boolean strict;

    private ModelExtractor(SymbolTable table, OutputNormalizer normalizer, boolean strict) {
        this.table = Objects.requireNonNull(table, "Symbol table cannot be null");
        this.normalizer = Objects.requireNonNull(normalizer, "Normalizer cannot be null");
        this.strict = strict;
    }

    public static ModelExtractor strict(SymbolTable table, OutputNormalizer normalizer) {
        return new ModelExtractor(table, normalizer, true);
    }

    public static ModelExtractor lenient(SymbolTable table, OutputNormalizer normalizer) {
        return new ModelExtractor(table, normalizer, false);
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * 提取一行输出中的全部绑定。
     * @param tree 该行解析出的语法树 (尚未规整)。
     * @param rawLine 原始文本，用于诊断。
     * @throws SmtParseException 严格模式下遇到无法识别的值，或者 model 块中出现畸形的 define-fun。
     */
    public List<Pair<NamedSymVar, CW>> extract(SExpr tree, String rawLine) {
        SExpr e = normalizer.normalize(tree);
        int first = definitionsStart(e);
        if (first >= 0) {
            SExpr.App model = (SExpr.App) e;
            List<Pair<NamedSymVar, CW>> result = new ArrayList<>();
            for (int i = first; i < model.size(); i++) {
                SExpr reduced = reduceDefinition(model.get(i), rawLine, tree);
                if (reduced != null) {
                    result.addAll(extractBinding(normalizer.normalize(reduced), rawLine, tree));
                }
            }
            return result;
        }
        return extractBinding(e, rawLine, tree);
    }

    /**
     * model 块中第一个定义的位置；不是 model 块时为 -1。
     * 较新的 z3 省略开头的 model 关键字，只打印定义的列表。
     */
    private static int definitionsStart(SExpr e) {
        if (!(e instanceof SExpr.App app) || app.size() == 0) {
            return -1;
        }
        if (app.isAppHeadedBy("model")) {
            return 1;
        }
        boolean allDefinitions = app.getItems().stream().allMatch(item -> item instanceof SExpr.App d
                && d.size() > 0 && (d.isAppHeadedBy("define-fun") || d.get(0) instanceof SExpr.Con c && NON_BINDING_FORMS.contains(c.getName())));
        boolean anyDefineFun = app.getItems().stream().anyMatch(item -> item.isAppHeadedBy("define-fun"));
        return allDefinitions && anyDefineFun ? 0 : -1;
    }

    /**
     * 把 {@code (define-fun s0 () K v)} 改写为 {@code ((s0 v))}。带参数的函数定义与论域声明返回 null。
     */
    private SExpr reduceDefinition(SExpr def, String rawLine, SExpr tree) {
        if (!(def instanceof SExpr.App app) || app.size() == 0) {
            throw die(rawLine, "Cannot extract value from model level define-fun", tree, def);
        }
        if (app.get(0) instanceof SExpr.Con head && NON_BINDING_FORMS.contains(head.getName())) {
            return null;
        }
        if (!app.isAppHeadedBy("define-fun") || app.size() < 5 || !(app.get(2) instanceof SExpr.App params)) {
            throw die(rawLine, "Cannot extract value from model level define-fun", tree, def);
        }
        if (params.size() > 0) {
            logger.debug("跳过带参数的函数定义 {}", app.get(1));
            return null;
        }
        List<SExpr> binding = new ArrayList<>();
        binding.add(app.get(1));
        binding.addAll(app.getItems().subList(4, app.size()));
        return SExpr.app(SExpr.app(binding));
    }

    private List<Pair<NamedSymVar, CW>> extractBinding(SExpr e, String rawLine, SExpr tree) {
        if (!(e instanceof SExpr.App outer) || outer.size() != 1 || !(outer.get(0) instanceof SExpr.App binding) || binding.size() == 0) {
            return List.of();
        }
        Optional<NamedSymVar> input = identify(binding.get(0));
        if (input.isEmpty()) {
            return List.of();
        }
        NamedSymVar var = input.get();
        Optional<CW> value = binding.size() == 2 ? convert(var.getKind(), binding.get(1)) : Optional.empty();
        if (value.isPresent()) {
            logger.debug("提取绑定 {} = {}", var.getName(), value.get());
            return List.of(Pair.of(var, value.get()));
        }
        if (strict) {
            throw die(rawLine, "Cannot extract value for " + var.getName() + " :: " + var.getKind(), tree, e);
        }
        logger.debug("宽松模式下跳过无法识别的绑定 {}", e);
        return List.of();
    }

    /**
     * 识别绑定头部引用的输入变量：{@code s3} 或 {@code (s3 ...)}。
     */
    Optional<NamedSymVar> identify(SExpr head) {
        if (head instanceof SExpr.Con con) {
            return table.resolve(con.getName());
        }
        if (head instanceof SExpr.App app && app.size() > 0 && app.get(0) instanceof SExpr.Con con) {
            return table.resolve(con.getName());
        }
        return Optional.empty();
    }

    /**
     * 按变量的 Kind 转换一个值；无法识别时为空。
     */
    static Optional<CW> convert(Kind kind, SExpr value) {
        if (value instanceof SExpr.Num n) {
            if (kind.isString() || kind.isChar() || kind.isUninterpreted()) {
                return Optional.empty();
            }
            return Optional.of(CW.fromInteger(kind, n.getValue()));
        }
        if (value instanceof SExpr.Dec d) {
            // 求解器可能对非实数变量给出实数形式的值，此时得到的是实数 CW
            return Optional.of(CW.ofReal(d.getValue()));
        }
        if (value instanceof SExpr.Flt f && kind.isFloat()) {
            return Optional.of(CW.ofFloat(f.getValue()));
        }
        if (value instanceof SExpr.Dbl d && kind.isDouble()) {
            return Optional.of(CW.ofDouble(d.getValue()));
        }
        if (value instanceof SExpr.Str s) {
            if (kind.isString()) {
                return Optional.of(CW.ofString(s.getValue()));
            }
            if (kind.isChar() && s.getValue().codePointCount(0, s.getValue().length()) == 1) {
                return Optional.of(CW.ofChar(s.getValue().codePointAt(0)));
            }
            return Optional.empty();
        }
        if (value instanceof SExpr.Con c) {
            if (kind.isBoolean() && (c.isCon("true") || c.isCon("false"))) {
                return Optional.of(CW.ofBool(c.isCon("true")));
            }
            if (kind.isUninterpreted()) {
                return Optional.of(CW.ofUninterpreted(kind, c.getName()));
            }
        }
        return Optional.empty();
    }

    private static SmtParseException die(String rawLine, String reason, SExpr tree, SExpr item) {
        logger.error("{}: {}", reason, rawLine);
        return new SmtParseException(rawLine, reason, tree, item);
    }
}
