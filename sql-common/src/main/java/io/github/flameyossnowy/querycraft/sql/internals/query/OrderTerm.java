package io.github.flameyossnowy.querycraft.sql.internals.query;

import java.util.Map;

public record OrderTerm(Compilable expression, boolean descending) {
    OrderTerm relabeled(Map<String, String> changeMap) {
        return new OrderTerm(expression.relabeledClone(changeMap), descending);
    }
}
