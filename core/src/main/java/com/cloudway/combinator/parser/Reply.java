/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.combinator.parser;

import java.util.Objects;

import com.cloudway.combinator.input.Input;
import static java.util.Objects.requireNonNull;

/**
 * One way a parser consumed a prefix of its input: the semantic value and
 * the input left unconsumed.
 *
 * @param <T> the input element type
 * @param <A> the value type, the value itself may be {@code null}
 */
public final class Reply<T, A> {
    private final A value;
    private final Input<T> rest;

    private Reply(A value, Input<T> rest) {
        this.value = value;
        this.rest = requireNonNull(rest);
    }

    public static <T, A> Reply<T, A> of(A value, Input<T> rest) {
        return new Reply<>(value, rest);
    }

    public A value() {
        return value;
    }

    public Input<T> rest() {
        return rest;
    }

    /**
     * Returns {@code true} if this reply consumed all of the input.
     */
    public boolean isComplete() {
        return rest.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Reply))
            return false;

        Reply<?,?> other = (Reply<?,?>)obj;
        return Objects.equals(value, other.value) && rest.equals(other.rest);
    }

    @Override
    public int hashCode() {
        return 31 * (31 + Objects.hashCode(value)) + rest.hashCode();
    }

    @Override
    public String toString() {
        return "(" + value + "," + rest + ")";
    }
}
