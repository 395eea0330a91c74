/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.combinator.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;

import com.cloudway.combinator.Settings;
import com.cloudway.combinator.data.Seq;
import com.cloudway.combinator.data.Tuple;
import com.cloudway.combinator.input.Input;
import static java.util.Objects.requireNonNull;

// @formatter:off

/**
 * The parser combinators.
 *
 * <p>{@link #result}, {@link #fail} and {@link #item} are the primitive
 * parsers. {@link #bind} sequences parsers, {@link #plus} keeps every
 * alternative, {@link #alt} commits to the first alternative that succeeds
 * and {@link #notP} succeeds only where its argument fails. Everything else
 * is derived from these.</p>
 *
 * <p>The result sequences are lazy. A reply is computed when it is first
 * looked at, so {@code plus} runs its right operand only after the replies
 * of the left operand have been consumed.</p>
 */
public final class Parsers {
    private static final Logger logger = Logger.getLogger(Parsers.class.getName());

    private Parsers() {}

    private static final Parser<Object, Object> FAIL = input -> Seq.nil();

    // Primitives

    /**
     * Succeeds with the given value without consuming input.
     *
     * <pre>{@code return :: a -> Parser a}</pre>
     */
    public static <T, A> Parser<T, A> result(A value) {
        return input -> Seq.of(Reply.of(value, input));
    }

    /**
     * The parser that always fails. This is the zero of {@link #bind} and
     * the identity of {@link #plus}.
     *
     * <pre>{@code mzero :: Parser a}</pre>
     */
    @SuppressWarnings("unchecked")
    public static <T, A> Parser<T, A> fail() {
        return (Parser<T, A>)(Parser<?, ?>)FAIL;
    }

    /**
     * Consumes one element and returns it, fails on empty input.
     */
    public static <T> Parser<T, T> item() {
        return input -> input.isEmpty()
            ? Seq.nil()
            : Seq.of(Reply.of(input.first(), input.rest()));
    }

    // Sequencing

    /**
     * Sequentially compose two parsers. For every reply of the parser, in
     * order, the continuation is applied to the reply value and the resulting
     * parser is run on the remaining input. The replies are flattened in
     * order.
     *
     * <p>{@code bind} and {@link #result} satisfy the monad laws:</p>
     *
     * <pre>{@code
     * bind(result(x), f)     == f(x)
     * bind(p, Parsers::result) == p
     * bind(bind(p, f), g)    == bind(p, x -> bind(f(x), g))
     * }</pre>
     */
    public static <T, A, B> Parser<T, B>
    bind(Parser<T, A> p, Function<? super A, ? extends Parser<T, B>> k) {
        requireNonNull(p);
        requireNonNull(k);
        return input -> p.parse(input).flatMap(r -> k.apply(r.value()).parse(r.rest()));
    }

    /**
     * Transform the value of every reply.
     */
    public static <T, A, B> Parser<T, B>
    map(Parser<T, A> p, Function<? super A, ? extends B> f) {
        requireNonNull(p);
        requireNonNull(f);
        return input -> p.parse(input).map(r -> Reply.of(f.apply(r.value()), r.rest()));
    }

    /**
     * Sequentially compose two parsers, discarding the value of the first.
     */
    public static <T, A, B> Parser<T, B> then(Parser<T, A> p, Parser<T, B> q) {
        requireNonNull(q);
        return bind(p, __ -> q);
    }

    /**
     * Sequentially compose two parsers, discarding the value of the second.
     */
    public static <T, A> Parser<T, A> skip(Parser<T, A> p, Parser<T, ?> q) {
        requireNonNull(q);
        return bind(p, x -> map(q, __ -> x));
    }

    // Choice

    /**
     * Non-deterministic choice. Returns the replies of {@code p1} followed by
     * the replies of {@code p2}, both run on the same input.
     *
     * <pre>{@code mplus :: Parser a -> Parser a -> Parser a}</pre>
     */
    public static <T, A> Parser<T, A> plus(Parser<T, A> p1, Parser<T, A> p2) {
        requireNonNull(p1);
        requireNonNull(p2);
        return input -> p1.parse(input).append(() -> p2.parse(input));
    }

    /**
     * Non-deterministic choice over any number of parsers, folded from the
     * left. With no parsers this is {@link #fail()}.
     */
    @SafeVarargs
    public static <T, A> Parser<T, A> plus(Parser<T, A>... ps) {
        if (ps.length == 0) {
            return fail();
        }
        Parser<T, A> res = ps[0];
        for (int i = 1; i < ps.length; i++) {
            res = plus(res, ps[i]);
        }
        return requireNonNull(res);
    }

    /**
     * Deterministic choice. Runs the alternatives from left to right and
     * returns the replies of the first one that succeeds, unchanged. The
     * remaining alternatives are not run. Fails if every alternative fails.
     */
    @SafeVarargs
    public static <T, A> Parser<T, A> alt(Parser<T, A>... alternatives) {
        List<Parser<T, A>> ps = ImmutableList.copyOf(alternatives);
        return input -> {
            for (Parser<T, A> p : ps) {
                Seq<Reply<T, A>> replies = p.parse(input);
                if (!replies.isEmpty()) {
                    return replies;
                }
            }
            return Seq.nil();
        };
    }

    /**
     * Negative lookahead. Succeeds with {@code TRUE} if the parser fails,
     * fails if it succeeds. Never consumes input.
     */
    public static <T> Parser<T, Boolean> notP(Parser<T, ?> p) {
        requireNonNull(p);
        return input -> p.parse(input).isEmpty()
            ? Seq.of(Reply.of(Boolean.TRUE, input))
            : Seq.nil();
    }

    // Repetition

    /**
     * Applies the parser as many times as it succeeds, greedily, and collects
     * the values. Always succeeds.
     *
     * <p>The parser must consume input whenever it succeeds. A parser that
     * can succeed without consuming makes this repetition loop forever;
     * use {@link #zeroOrMore(Parser, int)} to guard against that. The
     * number of matches is not limited by the call stack.</p>
     *
     * <pre>{@code zeroOrMore p = alt(oneOrMore p, return [])}</pre>
     */
    public static <T, A> Parser<T, Seq<A>> zeroOrMore(Parser<T, A> p) {
        return repetition(p, true, NO_FUEL_LIMIT);
    }

    /**
     * Applies the parser one or more times and collects the values. Fails
     * exactly when the first application fails.
     *
     * <pre>{@code oneOrMore p = do { x <- p; xs <- zeroOrMore p; return (x:xs) }}</pre>
     */
    public static <T, A> Parser<T, Seq<A>> oneOrMore(Parser<T, A> p) {
        return repetition(p, false, NO_FUEL_LIMIT);
    }

    /**
     * The fuel limited version of {@link #zeroOrMore(Parser)}. Behaves the
     * same as long as the parser matches at most {@code fuel} times in a row,
     * and throws {@link FuelExhaustedException} if it would match again.
     *
     * @throws IllegalArgumentException if fuel is negative
     */
    public static <T, A> Parser<T, Seq<A>> zeroOrMore(Parser<T, A> p, int fuel) {
        checkFuel(fuel);
        return repetition(p, true, fuel);
    }

    /**
     * The fuel limited version of {@link #oneOrMore(Parser)}.
     *
     * @throws IllegalArgumentException if fuel is negative
     * @see #zeroOrMore(Parser, int)
     */
    public static <T, A> Parser<T, Seq<A>> oneOrMore(Parser<T, A> p, int fuel) {
        checkFuel(fuel);
        return repetition(p, false, fuel);
    }

    /**
     * Fuel limited {@code zeroOrMore} using the configured default fuel.
     *
     * @see Settings#getDefaultFuel()
     */
    public static <T, A> Parser<T, Seq<A>> boundedZeroOrMore(Parser<T, A> p) {
        return zeroOrMore(p, Settings.getDefaultFuel());
    }

    /**
     * Fuel limited {@code oneOrMore} using the configured default fuel.
     *
     * @see Settings#getDefaultFuel()
     */
    public static <T, A> Parser<T, Seq<A>> boundedOneOrMore(Parser<T, A> p) {
        return oneOrMore(p, Settings.getDefaultFuel());
    }

    private static void checkFuel(int fuel) {
        if (fuel < 0) {
            throw new IllegalArgumentException("negative fuel: " + fuel);
        }
    }

    private static final int NO_FUEL_LIMIT = -1;

    private static <T, A> Parser<T, Seq<A>> repetition(Parser<T, A> p, boolean allowEmpty, int fuel) {
        requireNonNull(p);
        return input -> Seq.wrap(new Repetition<>(p, input, allowEmpty, fuel));
    }

    /**
     * Enumerates the replies of a repetition without recursion. The matches
     * form a tree: each node is a position in the input, its children are
     * the replies of the parser at that position, and a node where the
     * parser fails ends one reply. Walking the tree depth first, children
     * in order, yields the replies in the order of
     * {@code alt(oneOrMore p, return [])}.
     */
    private static final class Repetition<T, A> implements Iterator<Reply<T, Seq<A>>> {
        private static final class Frame<T, A> {
            Seq<Reply<T, A>> replies;
            final Seq<A> path;      // values matched so far, most recent first
            final int depth;
            boolean started;

            Frame(Seq<Reply<T, A>> replies, Seq<A> path, int depth) {
                this.replies = replies;
                this.path = path;
                this.depth = depth;
            }

            // the unexplored replies, the tail is forced only when the
            // subtree of the previous reply is done
            Seq<Reply<T, A>> pending() {
                if (started)
                    replies = replies.tail();
                started = true;
                return replies;
            }
        }

        private final Parser<T, A> p;
        private final boolean allowEmpty;
        private final int fuel;
        private final Deque<Frame<T, A>> stack = new ArrayDeque<>();

        private Input<T> start;
        private Reply<T, Seq<A>> next;
        private boolean ready;

        Repetition(Parser<T, A> p, Input<T> input, boolean allowEmpty, int fuel) {
            this.p = p;
            this.start = input;
            this.allowEmpty = allowEmpty;
            this.fuel = fuel;
        }

        @Override
        public boolean hasNext() {
            if (!ready) {
                next = advance();
                ready = true;
            }
            return next != null;
        }

        @Override
        public Reply<T, Seq<A>> next() {
            if (!hasNext())
                throw new NoSuchElementException();
            ready = false;
            return next;
        }

        private Reply<T, Seq<A>> advance() {
            if (start != null) {
                Input<T> input = start;
                start = null;
                Seq<Reply<T, A>> replies = step(input, 0);
                if (replies.isEmpty()) {
                    return allowEmpty ? Reply.of(Seq.nil(), input) : null;
                }
                stack.push(new Frame<>(replies, Seq.nil(), 0));
            }

            while (!stack.isEmpty()) {
                Frame<T, A> top = stack.peek();
                Seq<Reply<T, A>> pending = top.pending();
                if (pending.isEmpty()) {
                    stack.pop();
                    continue;
                }

                Reply<T, A> r = pending.head();
                Seq<A> path = Seq.cons(r.value(), top.path);
                Seq<Reply<T, A>> replies = step(r.rest(), top.depth + 1);
                if (replies.isEmpty()) {
                    return Reply.of(path.reverse(), r.rest());
                }
                stack.push(new Frame<>(replies, path, top.depth + 1));
            }
            return null;
        }

        private Seq<Reply<T, A>> step(Input<T> input, int depth) {
            Seq<Reply<T, A>> replies = p.parse(input);
            if (depth == fuel && !replies.isEmpty()) {
                logger.warning("Repetition exceeded the fuel limit of " + fuel + " at " + input);
                throw new FuelExhaustedException(fuel);
            }
            return replies;
        }
    }

    // Derived combinators

    /**
     * Runs two parsers in sequence and keeps the value of the second.
     */
    public static <T, A> Parser<T, A> andP(Parser<T, ?> first, Parser<T, A> last) {
        return then(first, last);
    }

    /**
     * Runs the parsers in sequence and keeps the value of the last one.
     * With no parsers, succeeds with {@code TRUE}. The value type is only
     * known as a wildcard here; use {@link #andP(Parser, Parser)} or
     * {@link #then(Parser, Parser)} when the value of the last parser is
     * needed with its type.
     */
    @SafeVarargs
    public static <T> Parser<T, ?> andP(Parser<T, ?>... parsers) {
        if (parsers.length == 0) {
            return Parsers.<T, Boolean>result(Boolean.TRUE);
        }
        Parser<T, ?> res = requireNonNull(parsers[parsers.length - 1]);
        for (int i = parsers.length - 1; --i >= 0; ) {
            res = then(parsers[i], res);
        }
        return res;
    }

    /**
     * Runs the parser, or succeeds with the default value without consuming
     * input if it fails.
     */
    public static <T, A> Parser<T, A> option(A deflt, Parser<T, A> p) {
        return Parsers.<T, A>alt(p, result(deflt));
    }

    /**
     * Runs the parser, or succeeds with {@code null} without consuming input
     * if it fails.
     */
    public static <T, A> Parser<T, A> maybe(Parser<T, A> p) {
        return option(null, p);
    }

    /**
     * If the condition parser succeeds, continue with {@code consequent}
     * after it, otherwise run {@code alternative} on the original input. The
     * value of the condition is discarded.
     */
    public static <T, A> Parser<T, A>
    ifP(Parser<T, ?> cond, Parser<T, A> consequent, Parser<T, A> alternative) {
        return Parsers.<T, A>alt(then(cond, consequent), then(notP(cond), alternative));
    }

    /**
     * Continue with the parser after the condition succeeds, fail otherwise.
     */
    public static <T, A> Parser<T, A> whenP(Parser<T, ?> cond, Parser<T, A> consequent) {
        return ifP(cond, consequent, fail());
    }

    /**
     * Run the parser only when the condition fails.
     */
    public static <T, A> Parser<T, A> unlessP(Parser<T, ?> cond, Parser<T, A> alternative) {
        return ifP(cond, fail(), alternative);
    }

    /**
     * Consumes one element satisfying the predicate.
     */
    public static <T> Parser<T, T> sat(Predicate<? super T> predicate) {
        requireNonNull(predicate);
        return Parsers.<T, T, T>bind(item(), x ->
            predicate.test(x) ? Parsers.<T, T>result(x) : Parsers.<T, T>fail());
    }

    /**
     * Consumes one element equal to the given one.
     */
    public static <T> Parser<T, T> token(T expected) {
        return sat(x -> Objects.equals(expected, x));
    }

    /**
     * Consumes the given elements in order.
     */
    public static <T> Parser<T, Seq<T>> sequence(Seq<T> elements) {
        if (elements.isEmpty()) {
            return result(Seq.nil());
        }
        Parser<T, Seq<T>> rest = sequence(elements.tail());
        return bind(token(elements.head()), x -> map(rest, xs -> Seq.cons(x, xs)));
    }

    /**
     * Consumes the characters of the given string.
     */
    public static Parser<Character, String> string(String s) {
        return map(sequence(Seq.wrap(s)), __ -> s);
    }

    /**
     * Succeeds with {@code TRUE} only at the end of input.
     */
    public static <T> Parser<T, Boolean> eof() {
        return notP(Parsers.<T>item());
    }

    /**
     * Runs two parsers in sequence and pairs their values.
     */
    public static <T, A, B> Parser<T, Tuple<A, B>> pair(Parser<T, A> p, Parser<T, B> q) {
        requireNonNull(q);
        return bind(p, x -> map(q, y -> Tuple.of(x, y)));
    }

    /**
     * Defers building a parser until it is run. Useful for mutually
     * recursive grammars.
     */
    public static <T, A> Parser<T, A> lazy(Supplier<? extends Parser<T, A>> supplier) {
        requireNonNull(supplier);
        return input -> supplier.get().parse(input);
    }

    /**
     * Ties the knot of a recursive grammar. The function receives a parser
     * that stands for the result of the function itself.
     */
    public static <T, A> Parser<T, A> fix(Function<Parser<T, A>, ? extends Parser<T, A>> f) {
        AtomicReference<Parser<T, A>> self = new AtomicReference<>();
        Parser<T, A> p = requireNonNull(f.apply(input -> self.get().parse(input)));
        self.set(p);
        return p;
    }

    // Running parsers

    /**
     * Runs the parser and returns every reply.
     */
    public static <T, A> Seq<Reply<T, A>> run(Parser<T, A> p, Input<T> input) {
        return p.parse(input);
    }

    /**
     * Returns the values of every parse that consumes the whole input, in
     * order.
     */
    public static <T, A> Seq<A> parseAll(Parser<T, A> p, Input<T> input) {
        return p.parse(input).filter(Reply::isComplete).map(Reply::value);
    }

    /**
     * Returns the first reply that consumes the whole input.
     */
    public static <T, A> Optional<Reply<T, A>> parseFirst(Parser<T, A> p, Input<T> input) {
        Seq<Reply<T, A>> complete = p.parse(input).filter(Reply::isComplete);
        return complete.isEmpty() ? Optional.empty() : Optional.of(complete.head());
    }

    /**
     * Returns the value of the only parse that consumes the whole input.
     *
     * @throws NoParseException if no parse consumes the whole input
     * @throws AmbiguousParseException if more than one does
     */
    public static <T, A> A parseUnique(Parser<T, A> p, Input<T> input) {
        Seq<Reply<T, A>> complete = p.parse(input).filter(Reply::isComplete);
        if (complete.isEmpty()) {
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("No complete parse of " + input);
            }
            throw new NoParseException("no complete parse of " + input);
        }
        if (!complete.tail().isEmpty()) {
            int count = complete.size();
            if (logger.isLoggable(Level.FINE)) {
                logger.fine(count + " complete parses of " + input);
            }
            throw new AmbiguousParseException(count);
        }
        return complete.head().value();
    }
}
