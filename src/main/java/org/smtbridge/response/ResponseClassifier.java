package org.smtbridge.response;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtbridge.config.SmtLibVersion;
import org.smtbridge.core.SymbolTable;

import java.util.List;
import java.util.Objects;

/**
 * 根据求解器回答的第一行对结果分类，并在需要时读出模型。
 * <ul>
 *     <li>{@code unsat}：不可满足；</li>
 *     <li>{@code unknown}：未知，以宽松模式读出其余行的模型；</li>
 *     <li>{@code sat}：以严格模式读出模型；目标值全为普通值时为可满足，否则为扩展域可满足；</li>
 *     <li>{@code timeout}：超时；</li>
 *     <li>其他 (包括空输出)：证明错误，保留全部原始行。</li>
 * </ul>
 */
public final class ResponseClassifier {

    private static final Logger logger = LoggerFactory.getLogger(ResponseClassifier.class);

    private final ModelReader reader;

    public ResponseClassifier(ModelReader reader) {
        this.reader = Objects.requireNonNull(reader, "Model reader cannot be null");
    }

    public static ResponseClassifier forVersion(SymbolTable table, SmtLibVersion version) {
        return new ResponseClassifier(ModelReader.forVersion(table, version));
    }

    /**
     * @param lines 求解器对一次查询的全部输出行。
     * @throws org.smtbridge.exceptions.SmtParseException 严格模式下模型无法解释。
     */
    public SmtResult classify(List<String> lines) {
        Objects.requireNonNull(lines, "Lines cannot be null");
        if (lines.isEmpty()) {
            logger.warn("求解器没有任何输出");
            return SmtResult.proofError(lines);
        }
        List<String> rest = lines.subList(1, lines.size());
        SmtResult result = switch (lines.get(0).trim()) {
            case "unsat" -> SmtResult.unsatisfiable();
            case "unknown" -> SmtResult.unknown(reader.read(rest, false));
            case "sat" -> {
                SmtModel model = reader.read(rest, true);
                yield model.hasOnlyRegularObjectives() ? SmtResult.satisfiable(model) : SmtResult.satExtField(model);
            }
            case "timeout" -> SmtResult.timeOut();
            default -> SmtResult.proofError(lines);
        };
        logger.debug("求解器回答分类为 {}", result.getType());
        return result;
    }

    /**
     * 结果行是否为 sat 或 unknown，即后面可能跟着模型。
     */
    static boolean startsWithModel(List<String> lines) {
        if (lines.isEmpty()) {
            return false;
        }
        String first = lines.get(0).trim();
        return "sat".equals(first) || "unknown".equals(first);
    }

    static boolean isResultLine(String line) {
        return switch (line.trim()) {
            case "sat", "unsat", "unknown", "timeout" -> true;
            default -> false;
        };
    }
}
