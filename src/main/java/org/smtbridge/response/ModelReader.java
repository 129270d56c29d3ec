package org.smtbridge.response;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtbridge.config.SmtLibVersion;
import org.smtbridge.core.CW;
import org.smtbridge.core.NamedSymVar;
import org.smtbridge.core.SymbolTable;
import org.smtbridge.extended.ExtCW;
import org.smtbridge.sexpr.OutputNormalizer;
import org.smtbridge.sexpr.SExpr;
import org.smtbridge.sexpr.SExprLines;
import org.smtbridge.sexpr.SExprParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 把结果行之后的输出读成 {@link SmtModel}：先把跨行的 S 表达式合并，
 * 再对每一行同时做绑定提取和目标提取。
 */
public final class ModelReader {

    private static final Logger logger = LoggerFactory.getLogger(ModelReader.class);

    private final ModelExtractor strictExtractor;
    private final ModelExtractor lenientExtractor;
    private final ObjectiveExtractor objectiveExtractor;

    public ModelReader(SymbolTable table, OutputNormalizer normalizer) {
        Objects.requireNonNull(table, "Symbol table cannot be null");
        Objects.requireNonNull(normalizer, "Normalizer cannot be null");
        this.strictExtractor = ModelExtractor.strict(table, normalizer);
        this.lenientExtractor = ModelExtractor.lenient(table, normalizer);
        this.objectiveExtractor = new ObjectiveExtractor(table, normalizer);
    }

    public static ModelReader forVersion(SymbolTable table, SmtLibVersion version) {
        return new ModelReader(table, version.normalizer());
    }

    /**
     * @param lines 结果行之后的输出行。
     * @param strict 绑定提取是否使用严格模式。
     * @throws org.smtbridge.exceptions.SmtParseException 如果某行无法解析，或提取失败。
     */
    public SmtModel read(List<String> lines, boolean strict) {
        ModelExtractor extractor = strict ? strictExtractor : lenientExtractor;
        List<Pair<NamedSymVar, CW>> bindings = new ArrayList<>();
        List<Pair<NamedSymVar, ExtCW>> objectives = new ArrayList<>();
        for (String line : SExprLines.merge(lines)) {
            if (StringUtils.isBlank(line)) {
                continue;
            }
            SExpr tree = SExprParser.parse(line);
            bindings.addAll(extractor.extract(tree, line));
            objectives.addAll(objectiveExtractor.extract(tree, line));
        }
        SmtModel model = SmtModel.of(bindings, objectives);
        logger.debug("读出模型 {}", model);
        return model;
    }
}
