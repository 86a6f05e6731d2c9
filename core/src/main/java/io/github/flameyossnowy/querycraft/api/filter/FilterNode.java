package io.github.flameyossnowy.querycraft.api.filter;

/**
 * Either a {@link Q} subtree or a single {@link Lookup}.
 */
public sealed interface FilterNode permits Q, Lookup {
}
