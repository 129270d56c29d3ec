package org.smtbridge.response;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtbridge.core.CW;
import org.smtbridge.core.NamedSymVar;
import org.smtbridge.core.SymbolTable;
import org.smtbridge.extended.ExtCW;
import org.smtbridge.extended.ExtendedValueParser;
import org.smtbridge.sexpr.OutputNormalizer;
import org.smtbridge.sexpr.SExpr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 从 {@code (objectives (s0 v) (s1 oo) ...)} 中提取优化目标值。
 * 每一项先按宽松模式当作普通绑定提取；失败时再按扩展值文法转换。
 * 任一项无法转换时整批失败。
 */
public final class ObjectiveExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ObjectiveExtractor.class);

    private final OutputNormalizer normalizer;
    private final ModelExtractor regular;

    public ObjectiveExtractor(SymbolTable table, OutputNormalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "Normalizer cannot be null");
        this.regular = ModelExtractor.lenient(table, normalizer);
    }

    /**
     * @param tree 一行输出解析出的语法树。根不是 objectives 时返回空列表。
     * @param rawLine 原始文本，用于诊断。
     * @throws org.smtbridge.exceptions.SmtParseException 如果某一项的值不在扩展值文法之内。
     */
    public List<Pair<NamedSymVar, ExtCW>> extract(SExpr tree, String rawLine) {
        SExpr e = normalizer.normalize(tree);
        if (!(e instanceof SExpr.App root) || !root.isAppHeadedBy("objectives")) {
            return List.of();
        }
        List<Pair<NamedSymVar, ExtCW>> result = new ArrayList<>();
        for (int i = 1; i < root.size(); i++) {
            SExpr item = root.get(i);
            List<Pair<NamedSymVar, CW>> plain = regular.extract(SExpr.app(item), rawLine);
            if (!plain.isEmpty()) {
                for (Pair<NamedSymVar, CW> p : plain) {
                    result.add(Pair.of(p.getKey(), ExtCW.bounded(p.getValue())));
                }
                continue;
            }
            extended(item, rawLine).ifPresent(result::add);
        }
        logger.debug("提取了 {} 个目标值", result.size());
        return result;
    }

    private Optional<Pair<NamedSymVar, ExtCW>> extended(SExpr item, String rawLine) {
        if (!(item instanceof SExpr.App app) || app.size() != 2) {
            return Optional.empty();
        }
        Optional<NamedSymVar> input = regular.identify(app.get(0));
        if (input.isEmpty()) {
            return Optional.empty();
        }
        NamedSymVar var = input.get();
        ExtCW value = ExtendedValueParser.convert(var.getKind(), app.get(1), rawLine, item).simplify();
        logger.debug("目标 {} 的扩展值为 {}", var.getName(), value);
        return Optional.of(Pair.of(var, value));
    }
}
