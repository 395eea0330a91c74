/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.combinator.parser;

/**
 * Base type of the exceptions raised when a caller asks for a parse outcome
 * that the result sequence cannot provide. Parsers themselves never throw
 * it; a failed parse is an empty result sequence.
 */
public class ParseException extends RuntimeException {
    private static final long serialVersionUID = 5380981347620137459L;

    public ParseException(String message) {
        super(message);
    }
}
