package io.github.flameyossnowy.querycraft.api.expression;

/**
 * Arithmetic and bitwise operators joining the two sides of a {@link CombinedExpression}.
 */
public enum Connector {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    BITAND("&"),
    BITOR("|");

    private final String symbol;

    Connector(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
