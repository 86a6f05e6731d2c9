package io.github.flameyossnowy.querycraft.sql.internals.query;

import java.util.List;
import java.util.Map;

/**
 * Anything that renders to a SQL fragment with bind parameters.
 */
public interface Compilable {
    ParameterizedSql asSql(CompileContext context);

    /**
     * Copy of this node with table aliases renamed per {@code changeMap}; unmapped aliases are kept.
     */
    Compilable relabeledClone(Map<String, String> changeMap);

    /**
     * Table columns this node reads.
     */
    List<Col> getCols();
}
