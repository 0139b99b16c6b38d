package com.enterprise.querybuilder.builder;

import com.enterprise.querybuilder.core.ParameterLimitException;
import com.enterprise.querybuilder.core.SqlBindException;
import com.enterprise.querybuilder.core.SqlDialect;
import com.enterprise.querybuilder.param.ArgumentBuffer;

import java.util.ArrayList;
import java.util.IllegalFormatException;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Builds SQL at runtime from literal fragments and bind arguments.
 *
 * <p>{@link #push} appends text verbatim, {@link #pushBind} appends a
 * placeholder and records the value out of band, so placeholder numbering
 * never has to be tracked by hand. The dialect decides placeholder syntax
 * ({@code ?}, {@code $N}, ...) and how values are encoded.
 *
 * <p>Example:
 * <pre>{@code
 * QueryBuilder qb = QueryBuilder.query(Dialects.POSTGRES,
 *         "SELECT * FROM orders WHERE status = ");
 * qb.pushBind(status);
 * if (minAmount != null) {
 *     qb.push(" AND amount >= ").pushBind(minAmount);
 * }
 * qb.push(" AND id IN (");
 * Separated ids = qb.separated(", ");
 * for (long id : orderIds) {
 *     ids.pushBind(id);
 * }
 * ids.pushUnseparated(")");
 * SqlResult result = qb.build();
 * }</pre>
 *
 * <p>{@link #build()} and {@link #intoSql()} are terminal: afterwards only
 * {@link #reset()}, {@link #sql()} and {@link #state()} may be called.
 *
 * <h2>Warning: untrusted input</h2>
 * {@link #push} performs no escaping. Never pass user input to it; bind it
 * with {@link #pushBind} instead.
 *
 * <p>Not thread-safe.
 */
public class QueryBuilder {

    /** Lifecycle of a builder. */
    public enum State {
        /** Nothing pushed since construction. */
        FRESH,
        /** Accepting pushes. */
        BUILDING,
        /** Arguments handed out; only {@link #reset()} revives the builder. */
        FINALIZED
    }

    private final SqlDialect dialect;
    private final StringBuilder sql;
    private final int initLength;
    private final List<Placeholder> placeholders = new ArrayList<>();
    private ArgumentBuffer arguments;
    private State state = State.FRESH;
    private int modCount;

    private QueryBuilder(String init, ArgumentBuffer arguments) {
        Objects.requireNonNull(init, "init");
        this.arguments = Objects.requireNonNull(arguments, "arguments");
        this.dialect = arguments.dialect();
        this.sql = new StringBuilder(Math.max(64, init.length() * 2)).append(init);
        this.initLength = init.length();
    }

    // ==================== Factory ====================

    /** Empty query with a fresh argument buffer. */
    public static QueryBuilder query(SqlDialect dialect) {
        return query(dialect, "");
    }

    /**
     * Starts a query with a constant prefix such as {@code "SELECT ... FROM t WHERE "}.
     * The prefix is what {@link #reset()} restores.
     */
    public static QueryBuilder query(SqlDialect dialect, String init) {
        return new QueryBuilder(init, new ArgumentBuffer(dialect));
    }

    /**
     * Starts a query with existing SQL and arguments. The arguments are
     * <b>not</b> checked against placeholders already present in {@code init}.
     *
     * <p>The builder keeps its own copy of {@code arguments}; later changes
     * to the caller's buffer do not reach it.
     */
    public static QueryBuilder withArguments(String init, ArgumentBuffer arguments) {
        Objects.requireNonNull(arguments, "arguments");
        ArgumentBuffer owned = new ArgumentBuffer(arguments.dialect());
        owned.reserve(arguments.length());
        return new QueryBuilder(init, owned.addAll(arguments));
    }

    // ==================== Text ====================

    /**
     * Appends {@code String.valueOf(fragment)} verbatim.
     *
     * <p>No sanitization happens here. Use {@link #pushBind} for any value
     * that did not come from your own code.
     *
     * @throws IllegalArgumentException if {@code fragment} is a QueryBuilder
     *         (use {@link #pushFragment})
     */
    public QueryBuilder push(Object fragment) {
        sanityCheck();
        sql.append(requireText(fragment));
        touch();
        return this;
    }

    static Object requireText(Object fragment) {
        Objects.requireNonNull(fragment, "fragment");
        if (fragment instanceof QueryBuilder) {
            throw new IllegalArgumentException(
                    "Pushing a QueryBuilder as text drops its arguments; use pushFragment()");
        }
        return fragment;
    }

    /**
     * Appends {@code String.format(Locale.ROOT, pattern, args)} verbatim.
     * Same injection caveats as {@link #push}.
     */
    public QueryBuilder pushFormatted(String pattern, Object... args) {
        sanityCheck();
        Objects.requireNonNull(pattern, "pattern");
        String formatted;
        try {
            formatted = String.format(Locale.ROOT, pattern, args);
        } catch (IllegalFormatException e) {
            throw new IllegalStateException("error formatting sql: " + pattern, e);
        }
        return push(formatted);
    }

    // ==================== Bind arguments ====================

    /**
     * Binds a value and appends its placeholder.
     *
     * <p>Engines cap the number of bind parameters per statement (Postgres and
     * MySQL 65535, SQLite 32766, SQL Server 2100); the dialect enforces its cap.
     *
     * @throws com.enterprise.querybuilder.core.ValueEncodeException if the
     *         dialect cannot encode the value
     * @throws com.enterprise.querybuilder.core.ParameterLimitException if the
     *         placeholder would exceed the dialect's limit
     */
    public QueryBuilder pushBind(Object value) {
        sanityCheck();
        int argumentMark = arguments.length();
        arguments.add(value);

        int start = sql.length();
        try {
            arguments.formatPlaceholder(sql);
        } catch (SqlBindException e) {
            arguments.truncate(argumentMark);
            sql.setLength(start);
            throw e;
        }
        placeholders.add(new Placeholder(start, sql.length(), arguments.length()));
        touch();
        return this;
    }

    // ==================== Fragments ====================

    /**
     * Appends a separately built builder: its text, then its arguments in
     * order. Placeholders the fragment emitted are renumbered to follow this
     * builder's arguments, so a Postgres fragment {@code "x = $1"} lands as
     * {@code "x = $3"} when two values are already bound here.
     *
     * <p>The fragment's arguments are taken; it is FINALIZED afterwards.
     *
     * @throws IllegalStateException if the fragment was already built or merged
     * @throws IllegalArgumentException for a self-merge or a dialect mismatch
     * @throws ParameterLimitException if the merged arguments would exceed the
     *         dialect's limit
     */
    public QueryBuilder pushFragment(QueryBuilder fragment) {
        sanityCheck();
        Objects.requireNonNull(fragment, "fragment");
        if (fragment == this) {
            throw new IllegalArgumentException("Cannot push a QueryBuilder into itself");
        }
        if (fragment.arguments == null) {
            throw new IllegalStateException("Fragment arguments were already taken");
        }
        if (!fragment.dialect.equals(dialect)) {
            throw new IllegalArgumentException("Fragment dialect " + fragment.dialect.id()
                    + " does not match " + dialect.id());
        }

        int textOffset = sql.length();
        int ordinalOffset = arguments.length();
        // values supplied through withArguments carry no tracked placeholder
        if (ordinalOffset + fragment.arguments.length() > dialect.maxParameters()) {
            throw new ParameterLimitException(dialect.id(), dialect.maxParameters());
        }
        StringBuilder rendered = new StringBuilder(fragment.sql.length() + 8);
        List<Placeholder> moved = new ArrayList<>(fragment.placeholders.size());
        int cursor = 0;
        for (Placeholder p : fragment.placeholders) {
            rendered.append(fragment.sql, cursor, p.start());
            int start = rendered.length();
            dialect.appendPlaceholder(rendered, p.ordinal() + ordinalOffset);
            moved.add(new Placeholder(start + textOffset,
                    rendered.length() + textOffset, p.ordinal() + ordinalOffset));
            cursor = p.end();
        }
        rendered.append(fragment.sql, cursor, fragment.sql.length());

        ArgumentBuffer fragmentArguments = fragment.takeArguments();
        sql.append(rendered);
        placeholders.addAll(moved);
        arguments.reserve(fragmentArguments.length());
        arguments.addAll(fragmentArguments);
        touch();
        return this;
    }

    // ==================== Lists ====================

    /**
     * Starts a list whose elements are joined by {@code separator}.
     *
     * <p>While the returned view is in use, mutate this builder only through
     * it; a direct mutation makes the view's next call fail with
     * {@link java.util.ConcurrentModificationException}.
     *
     * <pre>{@code
     * QueryBuilder qb = QueryBuilder.query(Dialects.MYSQL, "SELECT * FROM food WHERE name IN (");
     * Separated names = qb.separated(", ");
     * for (String food : foods) {
     *     names.pushBind(food);
     * }
     * names.pushUnseparated(")");
     * }</pre>
     *
     * An empty list still produces {@code IN ()}, which most engines reject.
     */
    public Separated separated(Object separator) {
        sanityCheck();
        return new Separated(this, String.valueOf(Objects.requireNonNull(separator, "separator")));
    }

    /** Scoped form of {@link #separated(Object)}: the view is closed when {@code body} returns. */
    public QueryBuilder separated(Object separator, Consumer<Separated> body) {
        Objects.requireNonNull(body, "body");
        Separated view = separated(separator);
        try {
            body.accept(view);
        } finally {
            view.close();
        }
        return this;
    }

    /**
     * Pushes {@code VALUES (..), (..)} with one parenthesized row per element.
     * Each row's columns are pushed by {@code pushTuple} through a view
     * separated by {@code ", "}.
     *
     * <pre>{@code
     * QueryBuilder qb = QueryBuilder.query(Dialects.POSTGRES, "INSERT INTO users(id, name) ");
     * qb.pushValues(users, (row, user) -> row.pushBind(user.id()).pushBind(user.name()));
     * // INSERT INTO users(id, name) VALUES ($1, $2), ($3, $4)
     * }</pre>
     *
     * If a bind fails part way, everything this call pushed is rolled back.
     *
     * @throws IllegalArgumentException if {@code tuples} is empty
     */
    public <T> QueryBuilder pushValues(Iterable<T> tuples, BiConsumer<Separated, ? super T> pushTuple) {
        sanityCheck();
        Iterator<T> it = requireRows(tuples, pushTuple, "VALUES");
        Checkpoint mark = checkpoint();
        try {
            push("VALUES ");
            pushRows(it, pushTuple);
        } catch (SqlBindException e) {
            rollback(mark);
            throw e;
        }
        return this;
    }

    /**
     * Pushes a parenthesized list of tuples, e.g. for
     * {@code (a, b) IN ((1, 2), (3, 4))}. Rolled back like {@link #pushValues}.
     *
     * @throws IllegalArgumentException if {@code tuples} is empty
     */
    public <T> QueryBuilder pushTuples(Iterable<T> tuples, BiConsumer<Separated, ? super T> pushTuple) {
        sanityCheck();
        Iterator<T> it = requireRows(tuples, pushTuple, "tuple");
        Checkpoint mark = checkpoint();
        try {
            push(" (");
            pushRows(it, pushTuple);
            push(")");
        } catch (SqlBindException e) {
            rollback(mark);
            throw e;
        }
        return this;
    }

    // ==================== Lifecycle ====================

    /**
     * Truncates the SQL to the initial prefix and starts a fresh argument
     * buffer. Valid in every state, including after {@link #build()}.
     */
    public QueryBuilder reset() {
        sql.setLength(initLength);
        placeholders.clear();
        arguments = new ArgumentBuffer(dialect);
        state = State.BUILDING;
        modCount++;
        return this;
    }

    /** Current SQL text, possibly incomplete. Valid in every state. */
    public String sql() {
        return sql.toString();
    }

    public State state() {
        return state;
    }

    public SqlDialect dialect() {
        return dialect;
    }

    /** Values bound so far; 0 once finalized. */
    public int argumentCount() {
        return arguments == null ? 0 : arguments.length();
    }

    /**
     * Hands out the SQL and its arguments. The builder is FINALIZED until
     * {@link #reset()}; its text stays readable through {@link #sql()}.
     */
    public SqlResult build() {
        sanityCheck();
        ArgumentBuffer taken = takeArguments();
        return new SqlResult(sql.toString(), taken.values(), placeholders, dialect);
    }

    /** Hands out the SQL alone, discarding the arguments. The builder is FINALIZED. */
    public String intoSql() {
        if (arguments != null) {
            takeArguments();
        }
        return sql.toString();
    }

    @Override
    public String toString() {
        return "QueryBuilder[" + dialect.id() + ", " + state + ", sql=" + sql + "]";
    }

    // ==================== Internals ====================

    private void sanityCheck() {
        if (arguments == null) {
            throw new IllegalStateException("QueryBuilder must be reset before reuse after build()");
        }
    }

    private void touch() {
        state = State.BUILDING;
        modCount++;
    }

    private ArgumentBuffer takeArguments() {
        ArgumentBuffer taken = arguments;
        arguments = null;
        state = State.FINALIZED;
        modCount++;
        return taken;
    }

    private static <T> Iterator<T> requireRows(Iterable<T> tuples, BiConsumer<Separated, ? super T> pushTuple,
                                               String what) {
        Objects.requireNonNull(tuples, "tuples");
        Objects.requireNonNull(pushTuple, "pushTuple");
        Iterator<T> it = tuples.iterator();
        if (!it.hasNext()) {
            throw new IllegalArgumentException(what + " list must not be empty");
        }
        return it;
    }

    private <T> void pushRows(Iterator<T> it, BiConsumer<Separated, ? super T> pushTuple) {
        boolean first = true;
        while (it.hasNext()) {
            T tuple = it.next();
            push(first ? "(" : ", (");
            separated(", ", row -> pushTuple.accept(row, tuple));
            push(")");
            first = false;
        }
    }

    int modCount() {
        return modCount;
    }

    Checkpoint checkpoint() {
        return new Checkpoint(sql.length(), arguments.length(), placeholders.size(), state);
    }

    void rollback(Checkpoint mark) {
        sql.setLength(mark.sqlLength());
        arguments.truncate(mark.argumentCount());
        placeholders.subList(mark.placeholderCount(), placeholders.size()).clear();
        state = mark.state();
        modCount++;
    }

    record Checkpoint(int sqlLength, int argumentCount, int placeholderCount, State state) {}
}
