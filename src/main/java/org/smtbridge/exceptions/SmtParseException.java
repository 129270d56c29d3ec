package org.smtbridge.exceptions;

import lombok.Getter;

/**
 * 无法把求解器输出解析为预期的结构。
 * 消息中带有原始行、解析出的树以及出问题的子项，便于定位求解器的输出格式差异。
 */
@Getter
public class SmtParseException extends SmtBridgeException {

    private final String rawLine;
    private final String reason;
    private final String parsedTree;
    private final String offendingItem;

    public SmtParseException(String rawLine, String reason) {
        this(rawLine, reason, null, null);
    }

    public SmtParseException(String rawLine, String reason, Object parsedTree) {
        this(rawLine, reason, parsedTree, null);
    }

    public SmtParseException(String rawLine, String reason, Object parsedTree, Object offendingItem) {
        super(format(rawLine, reason, parsedTree, offendingItem));
        this.rawLine = rawLine;
        this.reason = reason;
        this.parsedTree = parsedTree == null ? null : parsedTree.toString();
        this.offendingItem = offendingItem == null ? null : offendingItem.toString();
    }

    private static String format(String rawLine, String reason, Object parsedTree, Object offendingItem) {
        StringBuilder sb = new StringBuilder(reason);
        sb.append("\n\tInput     : ").append(rawLine);
        if (parsedTree != null) {
            sb.append("\n\tParse     : ").append(parsedTree);
        }
        if (offendingItem != null) {
            sb.append("\n\tItem Parse: ").append(offendingItem);
        }
        return sb.toString();
    }
}
