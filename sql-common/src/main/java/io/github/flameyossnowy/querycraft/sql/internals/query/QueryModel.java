package io.github.flameyossnowy.querycraft.sql.internals.query;

import io.github.flameyossnowy.querycraft.api.aggregate.Aggregate;
import io.github.flameyossnowy.querycraft.api.exceptions.AggregateOverAggregateException;
import io.github.flameyossnowy.querycraft.api.exceptions.ConditionOnAggregatedFieldException;
import io.github.flameyossnowy.querycraft.api.exceptions.ConditionReferencesAnnotationException;
import io.github.flameyossnowy.querycraft.api.exceptions.FieldResolutionException;
import io.github.flameyossnowy.querycraft.api.filter.LookupPath;
import io.github.flameyossnowy.querycraft.api.filter.LookupType;
import io.github.flameyossnowy.querycraft.api.filter.Q;
import io.github.flameyossnowy.querycraft.api.meta.FieldModel;
import io.github.flameyossnowy.querycraft.api.meta.RelationshipModel;
import io.github.flameyossnowy.querycraft.api.meta.TableModel;
import io.github.flameyossnowy.querycraft.api.utils.Logging;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable description of one SELECT statement over a base table: its joins,
 * filters, aggregates and select list.
 *
 * <p>Every table in the FROM clause has an alias. The base table is aliased by
 * its own name, as is the first join to any other table; further joins to an
 * already aliased table get {@code <prefix><n>} ({@code T2}, {@code T3}, ...).
 * Each alias carries a reference count, and joins with no references left are
 * not rendered.</p>
 *
 * <p>Instances are not thread-safe. A query is built by one caller through a
 * sequence of calls and must not be mutated or compiled concurrently; callers
 * sharing a base query should {@link #copy()} it first.</p>
 */
public final class QueryModel {
    public static final String DEFAULT_ALIAS_PREFIX = "T";

    private final TableModel model;

    private final Map<String, JoinInfo> aliasMap;
    private final Map<String, Integer> aliasRefcount;
    private final Map<String, List<String>> tableMap;
    private final Map<JoinKey, List<String>> joinMap;
    private final List<String> tables;
    private String aliasPrefix;

    private WhereNode where;
    private WhereNode having;

    private final Map<String, SqlAggregate> aggregates;
    private final Set<String> aggregationJoins;

    private final List<Col> select;
    private boolean defaultCols;
    private final Map<String, ParameterizedSql> extraSelect;
    private final List<Col> relatedSelectCols;
    private @Nullable List<Col> groupBy;
    private final List<OrderTerm> orderBy;
    private boolean distinct;
    private int lowMark;
    private @Nullable Integer highMark;

    public QueryModel(TableModel model) {
        this.model = Objects.requireNonNull(model, "model");
        this.aliasMap = new LinkedHashMap<>();
        this.aliasRefcount = new HashMap<>();
        this.tableMap = new HashMap<>();
        this.joinMap = new HashMap<>();
        this.tables = new ArrayList<>();
        this.aliasPrefix = DEFAULT_ALIAS_PREFIX;
        this.where = new WhereNode();
        this.having = new WhereNode();
        this.aggregates = new LinkedHashMap<>();
        this.aggregationJoins = new LinkedHashSet<>();
        this.select = new ArrayList<>();
        this.defaultCols = true;
        this.extraSelect = new LinkedHashMap<>();
        this.relatedSelectCols = new ArrayList<>();
        this.orderBy = new ArrayList<>();

        String alias = tableAlias(model.tableName(), false);
        aliasMap.put(alias, JoinInfo.base(model.tableName(), alias));
        aliasRefcount.put(alias, 0);
    }

    private QueryModel(QueryModel other) {
        this.model = other.model;
        this.aliasMap = new LinkedHashMap<>(other.aliasMap);
        this.aliasRefcount = new HashMap<>(other.aliasRefcount);
        this.tableMap = deepCopy(other.tableMap);
        this.joinMap = deepCopy(other.joinMap);
        this.tables = new ArrayList<>(other.tables);
        this.aliasPrefix = other.aliasPrefix;
        this.where = other.where.copy();
        this.having = other.having.copy();
        this.aggregates = new LinkedHashMap<>(other.aggregates);
        this.aggregationJoins = new LinkedHashSet<>(other.aggregationJoins);
        this.select = new ArrayList<>(other.select);
        this.defaultCols = other.defaultCols;
        this.extraSelect = new LinkedHashMap<>(other.extraSelect);
        this.relatedSelectCols = new ArrayList<>(other.relatedSelectCols);
        this.groupBy = other.groupBy == null ? null : new ArrayList<>(other.groupBy);
        this.orderBy = new ArrayList<>(other.orderBy);
        this.distinct = other.distinct;
        this.lowMark = other.lowMark;
        this.highMark = other.highMark;
    }

    private static <K> Map<K, List<String>> deepCopy(Map<K, List<String>> source) {
        Map<K, List<String>> copy = new HashMap<>();
        for (Map.Entry<K, List<String>> entry : source.entrySet()) {
            copy.put(entry.getKey(), new ArrayList<>(entry.getValue()));
        }
        return copy;
    }

    /**
     * Independent clone; changes to either query never show up in the other.
     */
    public QueryModel copy() {
        return new QueryModel(this);
    }

    public TableModel model() {
        return model;
    }

    // ---------------------------------------------------------------- aliases and joins

    /**
     * Returns an alias for {@code tableName}. Unless {@code create} is set an existing
     * alias of that table is reused and referenced once more.
     */
    private String tableAlias(String tableName, boolean create) {
        List<String> current = tableMap.get(tableName);
        if (!create && current != null) {
            String alias = current.get(0);
            ref(alias);
            return alias;
        }

        String alias = current == null ? tableName : aliasPrefix + (aliasMap.size() + 1);
        tableMap.computeIfAbsent(tableName, ignored -> new ArrayList<>()).add(alias);
        aliasRefcount.put(alias, 1);
        tables.add(alias);
        return alias;
    }

    public String baseAlias() {
        return tables.get(0);
    }

    /**
     * The base table's alias, referenced once more.
     */
    public String getInitialAlias() {
        String alias = baseAlias();
        ref(alias);
        return alias;
    }

    void ref(String alias) {
        aliasRefcount.merge(alias, 1, Integer::sum);
    }

    void unref(String alias) {
        aliasRefcount.merge(alias, -1, Integer::sum);
    }

    public int refCount(String alias) {
        return aliasRefcount.getOrDefault(alias, 0);
    }

    public Map<String, JoinInfo> aliasMap() {
        return Collections.unmodifiableMap(aliasMap);
    }

    public List<String> tables() {
        return Collections.unmodifiableList(tables);
    }

    /**
     * Whether any join is still referenced, in which case columns must be qualified.
     */
    public boolean hasJoins() {
        for (String alias : tables) {
            JoinInfo info = aliasMap.get(alias);
            if (!info.isBase() && refCount(alias) > 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the alias for {@code connection}, reusing an existing join when
     * {@code reuse} is set. New joins are outer when {@code promote} is set or
     * when they hang off an outer join, inner otherwise.
     */
    public String join(JoinKey connection, boolean reuse, boolean promote, boolean nullable) {
        if (reuse) {
            List<String> existing = joinMap.get(connection);
            if (existing != null && !existing.isEmpty()) {
                String alias = existing.get(0);
                ref(alias);
                if (promote) {
                    promoteAlias(alias, true);
                }
                return alias;
            }
        }

        String alias = tableAlias(connection.tableName(), true);
        JoinInfo lhs = aliasMap.get(connection.lhsAlias());
        JoinType joinType = promote || (lhs != null && lhs.isOuter()) ? JoinType.LOUTER : JoinType.INNER;
        aliasMap.put(alias, new JoinInfo(
            connection.tableName(),
            alias,
            joinType,
            connection.lhsAlias(),
            connection.lhsColumn(),
            connection.column(),
            nullable
        ));
        joinMap.computeIfAbsent(connection, ignored -> new ArrayList<>()).add(alias);
        Logging.deepInfo(() -> "Created " + joinType + " join " + alias + " for " + connection);
        return alias;
    }

    /**
     * Walks {@code names} from {@code alias} over {@code opts}, joining every relationship
     * on the way. A path ending in a relationship resolves to the target's primary key.
     *
     * @throws FieldResolutionException if a name is not a field of the table reached so far
     */
    public JoinSetup setupJoins(List<String> names, TableModel opts, String alias) {
        List<String> joins = new ArrayList<>();
        joins.add(alias);
        FieldModel field = null;
        boolean multiValued = false;

        for (int pos = 0; pos < names.size(); pos++) {
            String name = names.get(pos);
            field = "pk".equals(name) ? opts.getPrimaryKey() : opts.fieldByName(name);
            if (field == null) {
                throw new FieldResolutionException(name, opts.fieldNames());
            }

            RelationshipModel relationship = field.relationshipModel();
            if (relationship == null) {
                if (pos != names.size() - 1) {
                    throw new FieldResolutionException(name, "Cannot resolve '" + names.get(pos + 1)
                        + "': '" + name + "' on '" + opts.tableName() + "' is not a relationship");
                }
                break;
            }

            TableModel target = relationship.target();
            JoinKey connection = new JoinKey(alias, target.tableName(), relationship.localColumn(), relationship.targetColumn());
            alias = join(connection, true, false, relationship.nullable());
            joins.add(alias);
            multiValued |= relationship.isMultiValued();
            opts = target;

            if (pos == names.size() - 1) {
                field = target.getPrimaryKey();
            }
        }

        if (field == null) {
            throw new IllegalArgumentException("Field path must not be empty");
        }
        return new JoinSetup(field, opts, joins, multiValued);
    }

    /**
     * Drops trailing joins whose wanted column is the join column itself, reading the
     * value from the left-hand side of the join instead. Dropped joins are unreferenced.
     */
    public TrimmedJoin trimJoins(JoinSetup setup) {
        List<String> joins = new ArrayList<>(setup.joins());
        String column = setup.field().columnName();
        String alias = joins.get(joins.size() - 1);

        while (joins.size() > 1) {
            JoinInfo join = aliasMap.get(alias);
            if (!column.equals(join.column())) {
                break;
            }
            unref(alias);
            column = join.lhsColumn();
            alias = join.lhsAlias();
            joins.remove(joins.size() - 1);
        }
        return new TrimmedJoin(alias, column, joins);
    }

    /**
     * Makes {@code alias} an outer join if {@code unconditional} is set or the join is nullable.
     *
     * @return whether the join type changed
     */
    public boolean promoteAlias(String alias, boolean unconditional) {
        JoinInfo info = aliasMap.get(alias);
        if (info == null || info.isBase() || info.isOuter()) {
            return false;
        }
        if (!unconditional && !info.nullable()) {
            return false;
        }
        aliasMap.put(alias, info.withJoinType(JoinType.LOUTER));
        Logging.deepInfo(() -> "Promoted join " + alias + " (" + info.tableName() + ") to LEFT OUTER JOIN");
        return true;
    }

    /**
     * Promotes the aliases of a join chain in order. Once one link is promoted every
     * later link must be too, otherwise an inner join would drop the rows just kept.
     */
    public void promoteAliasChain(Collection<String> chain, boolean mustPromote) {
        for (String alias : chain) {
            if (promoteAlias(alias, mustPromote)) {
                mustPromote = true;
            }
        }
    }

    /**
     * Promotes each alias that is nullable, hangs off an outer join, or (with
     * {@code unconditional}) any alias. Joins hanging off a promoted alias are
     * revisited, so promotion spreads down the join tree.
     */
    public void promoteJoins(Collection<String> aliases, boolean unconditional) {
        LinkedList<String> pending = new LinkedList<>(aliases);
        while (!pending.isEmpty()) {
            String alias = pending.removeFirst();
            JoinInfo info = aliasMap.get(alias);
            if (info == null || info.isBase() || info.isOuter()) {
                continue;
            }
            JoinInfo parent = aliasMap.get(info.lhsAlias());
            boolean parentOuter = parent != null && parent.isOuter();
            if (!promoteAlias(alias, unconditional || parentOuter)) {
                continue;
            }
            for (JoinInfo candidate : aliasMap.values()) {
                if (alias.equals(candidate.lhsAlias()) && !pending.contains(candidate.alias())) {
                    pending.add(candidate.alias());
                }
            }
        }
    }

    /**
     * Turns outer joins back into inner joins where that cannot lose rows. Every aggregate
     * and filter is scanned first; joins an aggregate reads through, joins read by an
     * {@code isnull=true} lookup or inside an OR, joins hanging off an outer join and
     * joins with outer children stay outer.
     *
     * @return the aliases that were demoted
     */
    public Set<String> demoteJoins(Collection<String> aliases) {
        Set<String> needed = new LinkedHashSet<>(aggregationJoins);
        for (SqlAggregate aggregate : aggregates.values()) {
            addAliases(aggregate.getCols(), needed);
        }
        collectOuterFilterJoins(where, false, needed);
        collectOuterFilterJoins(having, false, needed);

        Set<String> demoted = new LinkedHashSet<>();
        for (String alias : aliases) {
            JoinInfo info = aliasMap.get(alias);
            if (info == null || !info.isOuter() || needed.contains(alias)) {
                continue;
            }
            JoinInfo parent = aliasMap.get(info.lhsAlias());
            if (parent != null && parent.isOuter()) {
                continue;
            }
            if (hasOuterChild(alias)) {
                continue;
            }
            aliasMap.put(alias, info.withJoinType(JoinType.INNER));
            demoted.add(alias);
        }
        if (!demoted.isEmpty()) {
            Logging.deepInfo(() -> "Demoted joins " + demoted + " to INNER JOIN");
        }
        return demoted;
    }

    private static void collectOuterFilterJoins(WhereChild child, boolean inOr, Set<String> needed) {
        if (child instanceof Constraint constraint) {
            boolean matchesMissing = constraint.lookupType() == LookupType.ISNULL && Boolean.TRUE.equals(constraint.value());
            if (inOr || matchesMissing) {
                addAliases(constraint.getCols(), needed);
            }
            return;
        }
        WhereNode node = (WhereNode) child;
        boolean branching = inOr || (node.connector() == Q.Connector.OR && node.children().size() > 1);
        for (WhereChild nested : node.children()) {
            collectOuterFilterJoins(nested, branching, needed);
        }
    }

    private static void addAliases(List<Col> cols, Set<String> aliases) {
        for (Col col : cols) {
            if (col.alias() != null) {
                aliases.add(col.alias());
            }
        }
    }

    private boolean hasOuterChild(String alias) {
        for (JoinInfo candidate : aliasMap.values()) {
            if (alias.equals(candidate.lhsAlias()) && candidate.isOuter() && refCount(candidate.alias()) > 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Joins that aggregates read through; these are always outer joins.
     */
    public Set<String> aggregationJoins() {
        return Collections.unmodifiableSet(aggregationJoins);
    }

    /**
     * Renames aliases everywhere they are used: the FROM clause, filters, select list,
     * grouping, ordering and aggregates (targets and conditions).
     */
    public void changeAliases(Map<String, String> changeMap) {
        for (String old : changeMap.keySet()) {
            if (!aliasMap.containsKey(old)) {
                throw new IllegalArgumentException("Unknown alias '" + old + "'");
            }
        }

        where = where.relabeledClone(changeMap);
        having = having.relabeledClone(changeMap);
        relabelCols(select, changeMap);
        relabelCols(relatedSelectCols, changeMap);
        if (groupBy != null) {
            relabelCols(groupBy, changeMap);
        }
        orderBy.replaceAll(term -> term.relabeled(changeMap));
        aggregates.replaceAll((alias, aggregate) -> aggregate.relabeledClone(changeMap));

        Map<String, JoinInfo> relabeledJoins = new LinkedHashMap<>();
        for (JoinInfo info : aliasMap.values()) {
            JoinInfo relabeled = info.relabeled(changeMap);
            relabeledJoins.put(relabeled.alias(), relabeled);
        }
        aliasMap.clear();
        aliasMap.putAll(relabeledJoins);

        Map<String, Integer> refcounts = new HashMap<>();
        for (Map.Entry<String, Integer> entry : aliasRefcount.entrySet()) {
            refcounts.put(changeMap.getOrDefault(entry.getKey(), entry.getKey()), entry.getValue());
        }
        aliasRefcount.clear();
        aliasRefcount.putAll(refcounts);

        for (List<String> aliases : tableMap.values()) {
            aliases.replaceAll(alias -> changeMap.getOrDefault(alias, alias));
        }
        tables.replaceAll(alias -> changeMap.getOrDefault(alias, alias));

        joinMap.clear();
        for (JoinInfo info : aliasMap.values()) {
            JoinKey key = info.key();
            if (key != null) {
                joinMap.computeIfAbsent(key, ignored -> new ArrayList<>()).add(info.alias());
            }
        }

        Set<String> relabeledAggregationJoins = new LinkedHashSet<>();
        for (String alias : aggregationJoins) {
            relabeledAggregationJoins.add(changeMap.getOrDefault(alias, alias));
        }
        aggregationJoins.clear();
        aggregationJoins.addAll(relabeledAggregationJoins);
    }

    private static void relabelCols(List<Col> cols, Map<String, String> changeMap) {
        cols.replaceAll(col -> col.relabeledClone(changeMap));
    }

    /**
     * Renames every alias to {@code <prefix><position>} and uses {@code prefix} for new
     * aliases, so this query can be nested inside another without alias clashes.
     */
    public void bumpPrefix(String prefix) {
        Map<String, String> changeMap = new LinkedHashMap<>();
        for (int pos = 0; pos < tables.size(); pos++) {
            changeMap.put(tables.get(pos), prefix + pos);
        }
        aliasPrefix = prefix;
        changeAliases(changeMap);
    }

    public String aliasPrefix() {
        return aliasPrefix;
    }

    // ---------------------------------------------------------------- filters

    public WhereNode where() {
        return where;
    }

    public WhereNode having() {
        return having;
    }

    public void addQ(Q filter) {
        new SqlConditionBuilder(this).addQ(filter);
    }

    public void addFilter(String lookup, @Nullable Object value) {
        addQ(Q.where(lookup, value));
    }

    // ---------------------------------------------------------------- aggregates

    public Map<String, SqlAggregate> aggregates() {
        return Collections.unmodifiableMap(aggregates);
    }

    void putAggregate(String alias, SqlAggregate aggregate) {
        aggregates.put(alias, aggregate);
    }

    void removeAggregate(String alias) {
        aggregates.remove(alias);
    }

    /**
     * Resolves {@code aggregate} against this query and adds it under {@code alias}.
     *
     * <p>The target's joins are promoted to outer joins so rows without a related row
     * still count. A condition is compiled on a sandbox copy of this query; the filters
     * of this query are never touched, and only the joins the condition introduces are
     * taken over. On failure the join state of this query is left as it was.</p>
     *
     * @param alias output alias, or null for {@link Aggregate#defaultAlias()}
     * @param isSummary whether the aggregate summarises the whole result instead of each group
     */
    public SqlAggregate addAggregate(Aggregate aggregate, @Nullable String alias, boolean isSummary) {
        Objects.requireNonNull(aggregate, "aggregate");
        String outputAlias = alias != null ? alias : aggregate.defaultAlias();
        if (aggregates.containsKey(outputAlias)) {
            throw new IllegalArgumentException("Aggregate alias '" + outputAlias + "' is already in use");
        }
        if (model.fieldByName(outputAlias) != null) {
            throw new IllegalArgumentException("Aggregate alias '" + outputAlias + "' conflicts with a field of '" + model.tableName() + "'");
        }

        QueryModel saved = copy();
        try {
            SqlAggregate resolved = resolveAggregate(aggregate, outputAlias, isSummary);
            Logging.deepInfo(() -> "Added aggregate " + outputAlias + " = " + resolved);
            return resolved;
        } catch (RuntimeException e) {
            restoreJoinState(saved);
            throw e;
        }
    }

    private SqlAggregate resolveAggregate(Aggregate aggregate, String outputAlias, boolean isSummary) {
        String functionName = aggregate.function().name();
        Compilable target = null;
        FieldModel source = null;

        if (aggregate.isExpression()) {
            SQLEvaluator evaluator = new SQLEvaluator(aggregate.expression(), this, true, true);
            if (evaluator.containsAggregate()) {
                if (aggregate.isConditional()) {
                    throw new ConditionOnAggregatedFieldException(outputAlias);
                }
                if (!isSummary) {
                    throw new AggregateOverAggregateException(functionName, aggregate.expression().toString());
                }
                for (SqlAggregate referenced : evaluator.referencedAggregates()) {
                    // a summary aggregate has no per-row value to aggregate over
                    if (referenced.isSummary()) {
                        throw new AggregateOverAggregateException(functionName, aggregate.expression().toString());
                    }
                }
            }
            aggregationJoins.addAll(evaluator.joinsUsed());
            target = evaluator;
            source = evaluator.source();
        } else if (!aggregate.isAll()) {
            List<String> path = LookupPath.split(aggregate.lookup());
            SqlAggregate annotation = path.size() == 1 ? aggregates.get(path.get(0)) : null;
            if (annotation != null) {
                if (aggregate.isConditional()) {
                    throw new ConditionOnAggregatedFieldException(path.get(0));
                }
                if (!isSummary || annotation.isSummary()) {
                    throw new AggregateOverAggregateException(functionName, path.get(0));
                }
                target = new AnnotationRef(path.get(0));
            } else {
                JoinSetup setup = setupJoins(path, model, getInitialAlias());
                TrimmedJoin trimmed = trimJoins(setup);
                List<String> chain = trimmed.joins().subList(1, trimmed.joins().size());
                promoteAliasChain(chain, true);
                aggregationJoins.addAll(chain);
                target = trimmed.toCol();
                source = setup.field();
            }
        }

        WhereNode condition = aggregate.isConditional() ? resolveCondition(aggregate.condition(), outputAlias) : null;
        SqlAggregate resolved = SqlAggregate.addToQuery(this, aggregate, outputAlias, target, source, isSummary, condition);

        if (!isSummary && groupBy == null) {
            groupBy = select.isEmpty() ? baseColumns() : new ArrayList<>(select);
        }
        return resolved;
    }

    /**
     * Compiles an aggregate's condition in isolation. The condition sees the current
     * aliases, so it reuses existing joins; joins it adds are taken over as outer joins.
     */
    private WhereNode resolveCondition(Q condition, String outputAlias) {
        QueryModel sandbox = copy();
        sandbox.where = new WhereNode();
        sandbox.having = new WhereNode();
        sandbox.addQ(condition);
        if (!sandbox.having.isEmpty()) {
            throw new ConditionReferencesAnnotationException();
        }

        Set<String> introduced = new LinkedHashSet<>();
        for (String alias : sandbox.tables) {
            if (!aliasMap.containsKey(alias)) {
                introduced.add(alias);
            }
        }
        restoreJoinState(sandbox);

        if (!introduced.isEmpty()) {
            promoteAliasChain(introduced, true);
            aggregationJoins.addAll(introduced);
            List<String> used = new ArrayList<>();
            for (String alias : introduced) {
                if (refCount(alias) > 0) {
                    used.add(aliasMap.get(alias).tableName() + " " + alias);
                }
            }
            if (!used.isEmpty()) {
                Logging.warn("Condition of aggregate '" + outputAlias + "' joined " + used
                    + " as outer joins; a to-many join here repeats rows for the other aggregates of the query");
            }
        }
        return sandbox.where;
    }

    private void restoreJoinState(QueryModel source) {
        aliasMap.clear();
        aliasMap.putAll(source.aliasMap);
        aliasRefcount.clear();
        aliasRefcount.putAll(source.aliasRefcount);
        tableMap.clear();
        tableMap.putAll(deepCopy(source.tableMap));
        joinMap.clear();
        joinMap.putAll(deepCopy(source.joinMap));
        tables.clear();
        tables.addAll(source.tables);
        aggregationJoins.clear();
        aggregationJoins.addAll(source.aggregationJoins);
    }

    private List<Col> baseColumns() {
        String base = baseAlias();
        List<Col> cols = new ArrayList<>();
        for (FieldModel field : model.fields()) {
            cols.add(new Col(base, field.columnName()));
        }
        return cols;
    }

    // ---------------------------------------------------------------- select list

    /**
     * Replaces the default select list with the given field paths. When the query
     * is grouped the same columns become the GROUP BY.
     */
    public void addSelect(String... paths) {
        select.clear();
        defaultCols = false;
        for (String path : paths) {
            JoinSetup setup = setupJoins(LookupPath.split(path), model, getInitialAlias());
            TrimmedJoin trimmed = trimJoins(setup);
            promoteAliasChain(trimmed.joins(), false);
            select.add(trimmed.toCol());
        }
        if (groupBy != null) {
            groupBy = new ArrayList<>(select);
        }
    }

    /**
     * Adds a raw SQL fragment to the select list under {@code alias}.
     */
    public void addExtraSelect(String alias, String sql, Object... params) {
        Objects.requireNonNull(alias, "alias");
        extraSelect.put(alias, ParameterizedSql.of(sql, params));
    }

    /**
     * Selects every column of the table reached through the relationship path {@code path}.
     */
    public void addRelatedSelect(String path) {
        List<String> names = LookupPath.split(path);
        JoinSetup setup = setupJoins(names, model, getInitialAlias());
        if (setup.joins().size() != names.size() + 1) {
            throw new IllegalArgumentException("'" + path + "' does not end in a relationship");
        }
        promoteAliasChain(setup.joins(), false);
        for (FieldModel field : setup.table().fields()) {
            relatedSelectCols.add(new Col(setup.lastAlias(), field.columnName()));
        }
    }

    public List<Col> select() {
        return Collections.unmodifiableList(select);
    }

    public boolean defaultCols() {
        return defaultCols;
    }

    /**
     * The columns selected when no explicit select list was given.
     */
    public List<Col> defaultColumns() {
        return baseColumns();
    }

    public Map<String, ParameterizedSql> extraSelect() {
        return Collections.unmodifiableMap(extraSelect);
    }

    public List<Col> relatedSelectCols() {
        return Collections.unmodifiableList(relatedSelectCols);
    }

    public @Nullable List<Col> groupBy() {
        return groupBy == null ? null : Collections.unmodifiableList(groupBy);
    }

    void clearSelectClause() {
        select.clear();
        defaultCols = false;
        extraSelect.clear();
        relatedSelectCols.clear();
    }

    // ---------------------------------------------------------------- ordering, distinct, limits

    /**
     * Orders by field paths or aggregate aliases; a leading {@code -} sorts descending.
     */
    public void addOrdering(String... ordering) {
        for (String term : ordering) {
            boolean descending = term.startsWith("-");
            String name = descending ? term.substring(1) : term;
            if (aggregates.containsKey(name) || extraSelect.containsKey(name)) {
                orderBy.add(new OrderTerm(new AnnotationRef(name), descending));
                continue;
            }
            JoinSetup setup = setupJoins(LookupPath.split(name), model, getInitialAlias());
            TrimmedJoin trimmed = trimJoins(setup);
            promoteAliasChain(trimmed.joins(), false);
            orderBy.add(new OrderTerm(trimmed.toCol(), descending));
        }
    }

    public void clearOrdering() {
        orderBy.clear();
    }

    public List<OrderTerm> orderBy() {
        return Collections.unmodifiableList(orderBy);
    }

    public void setDistinct(boolean distinct) {
        this.distinct = distinct;
    }

    public boolean isDistinct() {
        return distinct;
    }

    /**
     * Narrows the result to rows {@code [low, high)} of the current window; either bound may be null.
     */
    public void setLimits(@Nullable Integer low, @Nullable Integer high) {
        if (high != null) {
            highMark = highMark != null ? Math.min(highMark, lowMark + high) : lowMark + high;
        }
        if (low != null) {
            lowMark = highMark != null ? Math.min(highMark, lowMark + low) : lowMark + low;
        }
    }

    public void clearLimits() {
        lowMark = 0;
        highMark = null;
    }

    public boolean hasLimits() {
        return lowMark != 0 || highMark != null;
    }

    public int lowMark() {
        return lowMark;
    }

    public @Nullable Integer highMark() {
        return highMark;
    }

    @Override
    public String toString() {
        return "QueryModel[" + model.tableName() + ", aliases=" + tables + ", aggregates=" + aggregates.keySet() + "]";
    }
}
