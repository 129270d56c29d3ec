package org.smtbridge.exceptions;

import lombok.Getter;

import java.util.List;

/**
 * 求解器输出中的符号对应到了多个变量。
 */
@Getter
public class AmbiguityException extends SmtBridgeException {

    private final String symbol;
    private final List<String> matches;

    public AmbiguityException(String symbol, List<String> matches) {
        super("Cannot uniquely identify value for " + symbol + " in " + matches);
        this.symbol = symbol;
        this.matches = List.copyOf(matches);
    }
}
