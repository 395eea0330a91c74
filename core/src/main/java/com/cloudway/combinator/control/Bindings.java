/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.combinator.control;

import com.cloudway.combinator.data.Seq;
import com.cloudway.combinator.data.Tuple;
import static java.util.Objects.requireNonNull;

/**
 * An immutable set of named values bound by a {@link Syntax.Do} block.
 * Binding a name again shadows the previous binding. Values may be
 * {@code null}.
 */
public final class Bindings {
    private static final Bindings EMPTY = new Bindings(Seq.nil());

    private final Seq<Tuple<String, Object>> entries;

    private Bindings(Seq<Tuple<String, Object>> entries) {
        this.entries = entries;
    }

    /**
     * Returns the bindings with no names.
     */
    public static Bindings empty() {
        return EMPTY;
    }

    /**
     * Returns new bindings with the name bound to the value. Binding the
     * reserved {@link Syntax#IGNORE} name records nothing.
     */
    public Bindings bind(String name, Object value) {
        if (Syntax.IGNORE.equals(requireNonNull(name))) {
            return this;
        }
        return new Bindings(Seq.cons(Tuple.of(name, value), entries));
    }

    /**
     * Returns {@code true} if the name is bound.
     */
    public boolean contains(String name) {
        for (Tuple<String, Object> e : entries) {
            if (e.first().equals(name))
                return true;
        }
        return false;
    }

    /**
     * Returns the value most recently bound to the name.
     *
     * @throws IllegalArgumentException if the name is not bound
     */
    @SuppressWarnings("unchecked")
    public <V> V get(String name) {
        for (Tuple<String, Object> e : entries) {
            if (e.first().equals(name))
                return (V)e.second();
        }
        throw new IllegalArgumentException("unbound name: " + name);
    }

    @Override
    public String toString() {
        return entries.reverse().show(Integer.MAX_VALUE, ", ", "{", "}");
    }
}
