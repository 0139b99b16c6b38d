package com.enterprise.querybuilder.builder;

import com.enterprise.querybuilder.core.SqlBindException;

import java.util.ConcurrentModificationException;

/**
 * View over a {@link QueryBuilder} for separator-joined lists such as
 * {@code IN (...)} or {@code VALUES (...), (...)}.
 *
 * <p>The "first element" flag belongs to the view, so one logical element
 * may span several {@code push}/{@code pushBind} calls and still get exactly
 * one separator in front of it, as long as only the first call is separated.
 *
 * <p>The view is valid until its builder is mutated through another handle;
 * after that every call fails fast with {@link ConcurrentModificationException}.
 * Obtain one via {@link QueryBuilder#separated(Object)}.
 */
public final class Separated {

    private final QueryBuilder builder;
    private final String separator;
    private boolean pushSeparator;
    private boolean closed;
    private int expectedModCount;

    Separated(QueryBuilder builder, String separator) {
        this.builder = builder;
        this.separator = separator;
        this.expectedModCount = builder.modCount();
    }

    /** Pushes the separator unless this is the first element, then {@code fragment}. */
    public Separated push(Object fragment) {
        checkUsable();
        String text = String.valueOf(QueryBuilder.requireText(fragment));
        if (pushSeparator) {
            builder.push(separator + text);
        } else {
            builder.push(text);
            pushSeparator = true;
        }
        sync();
        return this;
    }

    /** Pushes {@code fragment} with no separator, e.g. a closing {@code ")"}. */
    public Separated pushUnseparated(Object fragment) {
        checkUsable();
        builder.push(fragment);
        sync();
        return this;
    }

    /**
     * Pushes the separator unless this is the first element, then binds
     * {@code value}. A failed bind also takes the separator back out.
     */
    public Separated pushBind(Object value) {
        checkUsable();
        QueryBuilder.Checkpoint mark = builder.checkpoint();
        try {
            if (pushSeparator) {
                builder.push(separator);
            }
            builder.pushBind(value);
        } catch (SqlBindException e) {
            builder.rollback(mark);
            sync();
            throw e;
        }
        pushSeparator = true;
        sync();
        return this;
    }

    /** Binds {@code value} with no separator. */
    public Separated pushBindUnseparated(Object value) {
        checkUsable();
        builder.pushBind(value);
        sync();
        return this;
    }

    /** True once an element has been pushed through {@link #push} or {@link #pushBind}. */
    public boolean hasElements() {
        return pushSeparator;
    }

    public String separator() {
        return separator;
    }

    void close() {
        closed = true;
    }

    private void checkUsable() {
        if (closed) {
            throw new IllegalStateException("Separated list is closed");
        }
        if (builder.modCount() != expectedModCount) {
            throw new ConcurrentModificationException(
                    "QueryBuilder was modified outside of this separated list");
        }
    }

    private void sync() {
        expectedModCount = builder.modCount();
    }
}
