/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.combinator.parser;

import java.util.function.Function;

import com.cloudway.combinator.data.Seq;
import com.cloudway.combinator.input.Input;

/**
 * A parser is a pure function from an input to the ordered sequence of all
 * the ways it can consume a prefix of that input. An empty sequence means
 * the parser failed, more than one reply means the input is ambiguous at
 * this point.
 *
 * <p>Parsers hold no mutable state and never modify their input, so a
 * parser can be reused on any number of inputs. Any lambda with the right
 * shape is a parser and can be passed to every combinator in
 * {@link Parsers}.</p>
 *
 * @param <T> the input element type
 * @param <A> the value type
 */
@FunctionalInterface
public interface Parser<T, A> {
    /**
     * Run the parser on the given input.
     */
    Seq<Reply<T, A>> parse(Input<T> input);

    /**
     * Sequentially compose two parsers, passing the value produced by this
     * parser to the continuation.
     *
     * <pre>{@code (>>=) :: Parser a -> (a -> Parser b) -> Parser b}</pre>
     *
     * @see Parsers#bind(Parser, Function)
     */
    default <B> Parser<T, B> bind(Function<? super A, ? extends Parser<T, B>> k) {
        return Parsers.bind(this, k);
    }

    /**
     * Transform the values produced by this parser.
     *
     * <pre>{@code fmap :: (a -> b) -> Parser a -> Parser b}</pre>
     */
    default <B> Parser<T, B> map(Function<? super A, ? extends B> f) {
        return Parsers.map(this, f);
    }

    /**
     * Run this parser then the next one, keeping the value of the next.
     *
     * <pre>{@code (>>) :: Parser a -> Parser b -> Parser b}</pre>
     */
    default <B> Parser<T, B> then(Parser<T, B> next) {
        return Parsers.then(this, next);
    }

    /**
     * Run this parser then the next one, keeping the value of this parser.
     *
     * <pre>{@code (<*) :: Parser a -> Parser b -> Parser a}</pre>
     */
    default Parser<T, A> skip(Parser<T, ?> next) {
        return Parsers.skip(this, next);
    }

    /**
     * Keep the replies of both parsers.
     *
     * @see Parsers#plus(Parser, Parser)
     */
    default Parser<T, A> plus(Parser<T, A> other) {
        return Parsers.plus(this, other);
    }

    /**
     * Try the other parser only if this one fails.
     *
     * @see Parsers#alt(Parser[])
     */
    default Parser<T, A> or(Parser<T, A> other) {
        return Parsers.alt(this, other);
    }
}
