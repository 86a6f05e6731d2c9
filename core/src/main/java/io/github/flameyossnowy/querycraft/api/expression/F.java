package io.github.flameyossnowy.querycraft.api.expression;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Reference to a field by path, e.g. {@code F.of("customer__name")}.
 * The name may also be the alias of an aggregate already added to the query.
 */
public record F(String name) implements Expression {
    public F {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Field reference must not be empty");
        }
    }

    @Contract(value = "_ -> new", pure = true)
    public static @NotNull F of(String name) {
        return new F(name);
    }

    @Override
    public List<Expression> children() {
        return List.of();
    }

    @Override
    public String toString() {
        return "F(" + name + ")";
    }
}
