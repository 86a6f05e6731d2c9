package io.github.flameyossnowy.querycraft.sql.internals.query;

import java.util.Map;

public sealed interface WhereChild extends Compilable permits WhereNode, Constraint {
    @Override
    WhereChild relabeledClone(Map<String, String> changeMap);

    boolean isEmpty();
}
