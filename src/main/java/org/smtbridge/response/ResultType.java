package org.smtbridge.response;

/**
 * 求解器回答的顶层分类。
 */
public enum ResultType {

    UNSATISFIABLE,
    UNKNOWN,        // 带一个 (可能为空的) 模型
    SATISFIABLE,    // 模型中的优化目标值都是普通值
    SAT_EXT_FIELD,  // 至少一个优化目标值落在扩展域中 (无穷、无穷小、区间...)
    TIMEOUT,
    PROOF_ERROR;    // 无法分类的回答，原样保留输出行

    public boolean hasModel() {
        return switch (this) {
            case UNKNOWN, SATISFIABLE, SAT_EXT_FIELD -> true;
            default -> false;
        };
    }
}
