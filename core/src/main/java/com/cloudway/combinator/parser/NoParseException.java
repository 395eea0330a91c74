/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.combinator.parser;

/**
 * Thrown when no interpretation consumes the whole input.
 */
public class NoParseException extends ParseException {
    private static final long serialVersionUID = -4469287402170593012L;

    public NoParseException(String message) {
        super(message);
    }
}
