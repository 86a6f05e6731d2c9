package io.github.flameyossnowy.querycraft.api.expression;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * A scalar expression built before compilation and resolved against a query later.
 *
 * <p>Nodes are immutable, so one expression can be reused across queries.</p>
 *
 * <pre>{@code
 * // (price * quantity) - discount
 * Expression total = F.of("price").times(F.of("quantity")).minus(F.of("discount"));
 *
 * // created + 1 day
 * Expression due = F.of("created").plus(Duration.ofDays(1));
 * }</pre>
 */
public sealed interface Expression permits F, Value, CombinedExpression {

    /**
     * Child nodes in rendering order, empty for leaves.
     */
    List<Expression> children();

    /**
     * Wraps anything that is not already an expression into a {@link Value}.
     */
    @Contract(pure = true)
    static @NotNull Expression of(Object operand) {
        if (operand instanceof Expression expression) {
            return expression;
        }
        return new Value(operand);
    }

    default CombinedExpression plus(Object other) {
        return new CombinedExpression(this, Connector.ADD, of(other));
    }

    default CombinedExpression minus(Object other) {
        return new CombinedExpression(this, Connector.SUB, of(other));
    }

    default CombinedExpression times(Object other) {
        return new CombinedExpression(this, Connector.MUL, of(other));
    }

    default CombinedExpression dividedBy(Object other) {
        return new CombinedExpression(this, Connector.DIV, of(other));
    }

    default CombinedExpression mod(Object other) {
        return new CombinedExpression(this, Connector.MOD, of(other));
    }

    default CombinedExpression bitAnd(Object other) {
        return new CombinedExpression(this, Connector.BITAND, of(other));
    }

    default CombinedExpression bitOr(Object other) {
        return new CombinedExpression(this, Connector.BITOR, of(other));
    }
}
