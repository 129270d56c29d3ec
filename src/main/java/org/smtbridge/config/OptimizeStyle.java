package org.smtbridge.config;

/**
 * 多个优化目标之间的关系。
 */
public enum OptimizeStyle {

    LEXICOGRAPHIC("lex"),   // 按声明顺序依次优化
    INDEPENDENT("box"),     // 各目标独立优化，每个目标一个模型
    PARETO("pareto");       // 逐个枚举 Pareto 前沿上的点

    private final String priority;

    OptimizeStyle(String priority) {
        this.priority = priority;
    }

    /**
     * {@code :opt.priority} 选项的取值。
     */
    public String getPriority() {
        return priority;
    }
}
