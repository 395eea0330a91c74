/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.combinator;

import java.util.Optional;
import java.util.logging.Logger;

import com.google.common.primitives.Ints;

/**
 * Library settings. A setting is looked up from the JVM system properties
 * first, then from the environment, and falls back to a default.
 */
public final class Settings
{
    private static final Logger logger = Logger.getLogger(Settings.class.getName());

    private Settings() {}

    public static final String FUEL_KEY = "combinator.fuel";
    public static final String FUEL_ENV = "COMBINATOR_FUEL";
    public static final int DEFAULT_FUEL = 100_000;

    /**
     * Look up a setting by its system property name and environment variable
     * name.
     */
    public static Optional<String> get(String key, String env) {
        String value = System.getProperty(key);
        if (value == null && env != null) {
            value = System.getenv(env);
        }
        return Optional.ofNullable(value).map(String::trim).filter(s -> !s.isEmpty());
    }

    /**
     * Look up a non-negative integer setting. Malformed or negative values
     * are logged and replaced by the default.
     */
    public static int getInt(String key, String env, int deflt) {
        Optional<String> value = get(key, env);
        if (!value.isPresent()) {
            return deflt;
        }

        Integer result = Ints.tryParse(value.get());
        if (result == null || result < 0) {
            logger.warning("Ignoring invalid value '" + value.get() + "' for " + key +
                           ", using " + deflt);
            return deflt;
        }
        return result;
    }

    /**
     * Returns the fuel used by the bounded repetition combinators.
     */
    public static int getDefaultFuel() {
        return getInt(FUEL_KEY, FUEL_ENV, DEFAULT_FUEL);
    }
}
