package org.smtbridge.response;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtbridge.exceptions.CountMismatchException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 把一次批量优化查询 (每个目标各自给出一个模型) 的输出按分隔标记切开，逐段分类。
 * <p>
 * 输出的形状为 "前言 (标记 段)*"。若各段都以自己的结果行开头，则前言本身是第一个回答，
 * 各段依次是其余的回答；否则前言是只打印一次的头部 (结果行、目标值)，拼到每一段前面再分类。
 */
public final class MultiModelSplitter {

    private static final Logger logger = LoggerFactory.getLogger(MultiModelSplitter.class);

    /**
     * 分隔标记，由 {@code (echo "...")} 打印。
     */
    public static final String SENTINEL = "smtbridge_objective_model_marker_3f1c9a7e-5b2d-4e8a-9c61-d0b7a4e2f815";

    /**
     * echo 打印出的分隔行 (带引号)。
     */
    public static final String SENTINEL_LINE = "\"" + SENTINEL + "\"";

    private final ResponseClassifier classifier;

    public MultiModelSplitter(ResponseClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "Classifier cannot be null");
    }

    /**
     * 有的求解器打印 echo 的参数时不带引号，两种形式都逐字节匹配。
     */
    public static boolean isSentinel(String line) {
        return SENTINEL_LINE.equals(line) || SENTINEL.equals(line);
    }

    /**
     * @param expected 期望的结果数。
     * @param lines 求解器的全部输出行。
     * @return 恰好 expected 个结果，顺序与输出中的段一致。
     * @throws CountMismatchException 如果段数与期望不符。
     */
    public List<SmtResult> split(int expected, List<String> lines) {
        Objects.requireNonNull(lines, "Lines cannot be null");
        int firstMarker = indexOfSentinel(lines, 0);
        List<String> preamble = firstMarker < 0 ? lines : lines.subList(0, firstMarker);

        if (!ResponseClassifier.startsWithModel(lines)) {
            // 没有模型可分：同一个结果复制 expected 份
            SmtResult single = classifier.classify(preamble);
            logger.debug("输出不含模型，结果 {} 复制 {} 份", single.getType(), expected);
            return Collections.nCopies(expected, single);
        }

        List<List<String>> segments = segments(firstMarker < 0 ? List.of() : lines.subList(firstMarker + 1, lines.size()));
        List<List<String>> answers = new ArrayList<>();
        if (!segments.isEmpty() && segments.stream().allMatch(s -> !s.isEmpty() && ResponseClassifier.isResultLine(s.get(0)))) {
            answers.add(preamble);
            answers.addAll(segments);
        } else {
            for (List<String> segment : segments) {
                List<String> answer = new ArrayList<>(preamble);
                answer.addAll(segment);
                answers.add(answer);
            }
        }

        if (answers.size() != expected) {
            logger.error("期望 {} 个模型，实际得到 {} 个", expected, answers.size());
            throw new CountMismatchException(expected, answers.size(), lines);
        }
        List<SmtResult> results = new ArrayList<>(answers.size());
        for (List<String> answer : answers) {
            results.add(classifier.classify(answer));
        }
        return results;
    }

    private static List<List<String>> segments(List<String> lines) {
        List<List<String>> result = new ArrayList<>();
        int start = 0;
        while (start < lines.size()) {
            int marker = indexOfSentinel(lines, start);
            int end = marker < 0 ? lines.size() : marker;
            result.add(lines.subList(start, end));
            start = end + 1;
        }
        return result;
    }

    private static int indexOfSentinel(List<String> lines, int from) {
        for (int i = from; i < lines.size(); i++) {
            if (isSentinel(lines.get(i))) {
                return i;
            }
        }
        return -1;
    }
}
