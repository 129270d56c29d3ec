package org.smtbridge.core;

/**
 * 定义将 Java 对象转换为 SMT-LIB 文本的接口。
 */
public interface ToSmtLib {

    /**
     * 将此对象转换为 SMT-LIB 2 文本。相同的对象必须总是产生相同的文本。
     * @return 对应的 SMT-LIB 片段。
     */
    String toSmtLib();
}
