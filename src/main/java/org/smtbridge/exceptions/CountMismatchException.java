package org.smtbridge.exceptions;

import lombok.Getter;

import java.util.List;

/**
 * 多目标优化输出中切分出的模型数与期望不符。
 */
@Getter
public class CountMismatchException extends SmtBridgeException {

    private final int expected;
    private final int actual;
    private final List<String> rawOutput;

    public CountMismatchException(int expected, int actual, List<String> rawOutput) {
        super("Expected " + expected + " models, received: " + actual + ":\n" + String.join("\n", rawOutput));
        this.expected = expected;
        this.actual = actual;
        this.rawOutput = List.copyOf(rawOutput);
    }
}
