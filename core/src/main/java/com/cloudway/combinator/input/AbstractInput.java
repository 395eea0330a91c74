/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.combinator.input;

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * Skeletal implementation of {@link Input} that compares inputs by their
 * remaining elements.
 *
 * @param <T> the element type
 */
public abstract class AbstractInput<T> implements Input<T> {
    private static final int PREVIEW_LENGTH = 16;

    /**
     * The number of elements consumed from the underlying source.
     */
    protected final int offset;

    protected AbstractInput(int offset) {
        this.offset = offset;
    }

    /**
     * Helper method to report a contract violation on an empty input.
     */
    protected static EmptyInputException emptyInput(String operation) {
        return new EmptyInputException(operation + " called on empty input");
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof AbstractInput))
            return false;

        Input<?> xs = this, ys = (Input<?>)obj;
        while (!xs.isEmpty() && !ys.isEmpty()) {
            if (!Objects.equals(xs.first(), ys.first()))
                return false;
            xs = xs.rest();
            ys = ys.rest();
        }
        return xs.isEmpty() && ys.isEmpty();
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (Input<T> xs = this; !xs.isEmpty(); xs = xs.rest()) {
            hash = 31 * hash + Objects.hashCode(xs.first());
        }
        return hash;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("offset", offset)
            .add("remaining", toSeq().show(PREVIEW_LENGTH, "", "\"", "\""))
            .toString();
    }
}
