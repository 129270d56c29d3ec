package org.smtbridge.sexpr;

/**
 * 某个方言特有的输出规整：在通用文法之前去掉求解器的怪癖，使文法本身与求解器无关。
 * 新的求解器输出怪癖只需在这里增加一个实现，不必改动核心解析器。
 */
public interface OutputNormalizer {

    /**
     * 规整一棵完整的输出树。实现必须是纯函数。
     * @param expr 解析出的树。
     * @return 规整后的树；无需改动时可以返回原对象。
     */
    SExpr normalize(SExpr expr);
}
