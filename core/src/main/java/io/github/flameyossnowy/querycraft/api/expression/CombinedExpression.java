package io.github.flameyossnowy.querycraft.api.expression;

import java.util.List;
import java.util.Objects;

public record CombinedExpression(Expression lhs, Connector connector, Expression rhs) implements Expression {
    public CombinedExpression {
        Objects.requireNonNull(lhs, "lhs");
        Objects.requireNonNull(connector, "connector");
        Objects.requireNonNull(rhs, "rhs");
    }

    @Override
    public List<Expression> children() {
        return List.of(lhs, rhs);
    }

    @Override
    public String toString() {
        return "(" + lhs + " " + connector.symbol() + " " + rhs + ")";
    }
}
