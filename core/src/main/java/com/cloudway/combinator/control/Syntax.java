/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.combinator.control;

import java.util.function.Function;
import java.util.function.Supplier;

import com.cloudway.combinator.data.Seq;
import com.cloudway.combinator.parser.Parser;
import com.cloudway.combinator.parser.Parsers;
import static java.util.Objects.requireNonNull;

// @formatter:off

/**
 * This class contains keywords for writing sequential parsers. Nothing here
 * adds behavior: every form expands to nested {@link Parsers#bind} calls.
 *
 * <p>The {@code do_} helpers are chained by nesting:</p>
 *
 * <pre>{@code
 * do_(open,             __ ->
 * do_(zeroOrMore(expr), xs ->
 * do_(close,            () ->
 *     result(xs))))
 * }</pre>
 *
 * <p>The {@link Do} builder names each value instead:</p>
 *
 * <pre>{@code
 * Syntax.<Character>begin()
 *     .let(IGNORE, open)
 *     .let("xs", zeroOrMore(expr))
 *     .let(IGNORE, close)
 *     .returning(env -> env.get("xs"))
 * }</pre>
 */
public final class Syntax {
    private Syntax() {}

    /**
     * The reserved name that runs a parser without recording its value.
     */
    public static final String IGNORE = "_";

    // Do notation helper methods. These methods simply call 'bind' on parsers.

    /**
     * Helper method to chain parsers together.
     */
    public static <T, A, B> Parser<T, B>
    do_(Parser<T, A> a, Function<? super A, ? extends Parser<T, B>> f) {
        return Parsers.bind(a, f);
    }

    /**
     * Helper method to chain parsers together, discard intermediate result.
     */
    public static <T, A, B> Parser<T, B>
    do_(Parser<T, A> a, Supplier<? extends Parser<T, B>> b) {
        requireNonNull(b);
        return Parsers.bind(a, __ -> b.get());
    }

    /**
     * Helper method to end a chain of parsers.
     */
    public static <T, A> Parser<T, A> do_(Parser<T, A> a) {
        return requireNonNull(a);
    }

    /**
     * Deterministic choice among alternatives.
     *
     * @see Parsers#alt(Parser[])
     */
    @SafeVarargs
    public static <T, A> Parser<T, A> choice(Parser<T, A>... alternatives) {
        return Parsers.alt(alternatives);
    }

    /**
     * Start a block of named bindings over inputs of the given element type.
     */
    public static <T> Do<T> begin() {
        return new Do<>(Seq.nil());
    }

    /**
     * A block of named parser bindings. Each binding's parser runs after the
     * previous one, on the input it left, and its value becomes visible under
     * the binding name to later bindings and to the body. The block is
     * immutable, adding a binding returns a new block.
     *
     * @param <T> the input element type
     */
    public static final class Do<T> {
        private static final class Step<T> {
            final String name;
            final Function<Bindings, ? extends Parser<T, ?>> expr;

            Step(String name, Function<Bindings, ? extends Parser<T, ?>> expr) {
                this.name = requireNonNull(name);
                this.expr = requireNonNull(expr);
            }
        }

        // the most recent binding comes first
        private final Seq<Step<T>> steps;

        private Do(Seq<Step<T>> steps) {
            this.steps = steps;
        }

        /**
         * Bind the value of the parser to the name.
         */
        public Do<T> let(String name, Parser<T, ?> parser) {
            requireNonNull(parser);
            return letWith(name, env -> parser);
        }

        /**
         * Bind the value of a parser computed from the earlier bindings to
         * the name.
         */
        public Do<T> letWith(String name, Function<Bindings, ? extends Parser<T, ?>> expr) {
            return new Do<>(Seq.cons(new Step<>(name, expr), steps));
        }

        /**
         * Run the parser and discard its value.
         */
        public Do<T> ignore(Parser<T, ?> parser) {
            return let(IGNORE, parser);
        }

        /**
         * Finish the block with a body computed from all bindings. Without
         * any binding the body parser is returned as is.
         */
        public <R> Parser<T, R> in(Function<Bindings, ? extends Parser<T, R>> body) {
            requireNonNull(body);
            return expand(steps.reverse(), Bindings.empty(), body);
        }

        /**
         * Finish the block with a value computed from all bindings.
         */
        public <R> Parser<T, R> returning(Function<Bindings, ? extends R> f) {
            requireNonNull(f);
            return in(env -> Parsers.result(f.apply(env)));
        }

        private static <T, R> Parser<T, R>
        expand(Seq<Step<T>> steps, Bindings env, Function<Bindings, ? extends Parser<T, R>> body) {
            if (steps.isEmpty()) {
                return requireNonNull(body.apply(env));
            }
            Step<T> step = steps.head();
            Parser<T, ?> p = requireNonNull(step.expr.apply(env));
            return bindStep(p, step.name, steps.tail(), env, body);
        }

        private static <T, A, R> Parser<T, R>
        bindStep(Parser<T, A> p, String name, Seq<Step<T>> rest, Bindings env,
                 Function<Bindings, ? extends Parser<T, R>> body) {
            return Parsers.bind(p, v -> expand(rest, env.bind(name, v), body));
        }
    }
}
