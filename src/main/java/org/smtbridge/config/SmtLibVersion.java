package org.smtbridge.config;

import org.smtbridge.sexpr.OutputNormalizer;
import org.smtbridge.sexpr.SmtLib2Normalizer;

/**
 * 目标查询语言的方言。目前只有 SMT-LIB 2 一种；新增方言时在这里以及发射器的分派处各加一个分支。
 */
public enum SmtLibVersion {

    SMTLIB2;

    /**
     * 该方言的求解器输出规整。
     */
    public OutputNormalizer normalizer() {
        return switch (this) {
            case SMTLIB2 -> SmtLib2Normalizer.INSTANCE;
        };
    }
}
