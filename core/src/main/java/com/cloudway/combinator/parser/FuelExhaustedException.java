/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.combinator.parser;

/**
 * Thrown by a fuel limited repetition when the repeated parser matches
 * more often than the fuel allows. This usually means the parser succeeds
 * without consuming input.
 */
public class FuelExhaustedException extends RuntimeException {
    private static final long serialVersionUID = -1726392860431578420L;

    private final int fuel;

    public FuelExhaustedException(int fuel) {
        super("repetition exceeded the fuel limit of " + fuel);
        this.fuel = fuel;
    }

    /**
     * Returns the fuel the repetition was given.
     */
    public int getFuel() {
        return fuel;
    }
}
