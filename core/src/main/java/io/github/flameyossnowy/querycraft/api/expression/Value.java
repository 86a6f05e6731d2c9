package io.github.flameyossnowy.querycraft.api.expression;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.List;

/**
 * Literal operand, always rendered as a bind parameter.
 */
public record Value(@Nullable Object value) implements Expression {
    @Override
    public List<Expression> children() {
        return List.of();
    }

    public boolean isDuration() {
        return value instanceof Duration;
    }
}
