package org.smtbridge.exceptions;

/**
 * 所有翻译与结果解析错误的公共父类。
 * 这些错误对当前查询都是致命的，本层不做任何重试。
 */
public class SmtBridgeException extends RuntimeException {

    public SmtBridgeException(String message) {
        super(message);
    }

    public SmtBridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
