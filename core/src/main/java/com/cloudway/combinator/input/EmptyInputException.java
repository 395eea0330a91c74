/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.combinator.input;

import java.util.NoSuchElementException;

/**
 * Thrown when the first element or the remainder of an empty input is
 * requested. This is a contract violation by the caller, not a parse
 * failure: callers must test {@link Input#isEmpty()} first.
 */
public class EmptyInputException extends NoSuchElementException {
    private static final long serialVersionUID = -2364113370911460517L;

    public EmptyInputException(String message) {
        super(message);
    }
}
