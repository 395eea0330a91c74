/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.combinator.parser;

/**
 * Thrown when a unique interpretation was required but several complete
 * parses exist.
 */
public class AmbiguousParseException extends ParseException {
    private static final long serialVersionUID = 2871596127338065095L;

    private final int count;

    public AmbiguousParseException(int count) {
        super("ambiguous input: " + count + " complete parses");
        this.count = count;
    }

    /**
     * Returns the number of complete parses found.
     */
    public int getCount() {
        return count;
    }
}
