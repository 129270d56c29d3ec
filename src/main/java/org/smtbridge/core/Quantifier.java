package org.smtbridge.core;

/**
 * 输入变量的量词。
 */
public enum Quantifier {

    ALL("forall"),
    EX("exists");

    private final String symbol;

    Quantifier(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 返回对偶量词：求证 (prove) 时问题被取反，量词随之对调。
     */
    public Quantifier dual() {
        return switch (this) {
            case ALL -> EX;
            case EX -> ALL;
        };
    }
}
