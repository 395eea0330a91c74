/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.combinator.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * A sequential, ordered, and potentially lazied list. Lazy tails are
 * evaluated at most once, so a {@code Seq} behaves as an immutable value
 * no matter how often it is traversed.
 *
 * <p>Two sequences are equal if they contain equal elements in the same
 * order. Comparing or hashing a sequence forces all of its elements.</p>
 *
 * @param <T> the element type
 */
public interface Seq<T> extends Iterable<T>
{
    /**
     * Returns {@code true} if this list contains no elements.
     *
     * @return {@code true} if this list contains no elements
     */
    boolean isEmpty();

    /**
     * Returns the first element in the list.
     *
     * @return the first element in the list
     * @throws NoSuchElementException if the list is empty
     */
    T head();

    /**
     * Returns remaining elements in the list.
     *
     * @return remaining elements in the list
     * @throws NoSuchElementException if the list is empty
     */
    Seq<T> tail();

    /**
     * Peek the head element as an optional.
     *
     * @return {@code Optional.empty()} if the sequence is empty, otherwise
     * an optional wrapping the head value.
     * @throws NullPointerException if the sequence is not empty but the head
     * element is {@code null}.
     */
    default Optional<T> peek() {
        return isEmpty() ? Optional.empty() : Optional.of(head());
    }

    // Constructors

    /**
     * Construct an empty list.
     *
     * @return the empty list
     */
    static <T> Seq<T> nil() {
        return SeqImpl.nil();
    }

    /**
     * Construct a list with head and tail.
     *
     * @param head the first element in the list
     * @param tail the remaining elements in the list
     * @return the list that concatenate from head and tail
     */
    static <T> Seq<T> cons(T head, Seq<T> tail) {
        return SeqImpl.cons(head, tail);
    }

    /**
     * Construct a lazy list with head and a tail generator.
     *
     * @param head the first element in the list
     * @param tail a supplier to generate remaining elements in the list
     * @return the list that concatenate from head and tail
     */
    static <T> Seq<T> cons(T head, Supplier<Seq<T>> tail) {
        return SeqImpl.cons(head, tail);
    }

    /**
     * Construct a list with single element.
     */
    static <T> Seq<T> of(T value) {
        return SeqImpl.cons(value, SeqImpl.<T>nil());
    }

    /**
     * Construct a list with given elements
     */
    @SafeVarargs
    static <T> Seq<T> of(T... elements) {
        Seq<T> res = nil();
        for (int i = elements.length; --i >= 0; ) {
            res = cons(elements[i], res);
        }
        return res;
    }

    /**
     * Wrap an iterator into a list. The iterator is advanced only when the
     * list is traversed.
     */
    static <T> Seq<T> wrap(Iterator<T> iterator) {
        return iterator.hasNext()
            ? cons(iterator.next(), () -> wrap(iterator))
            : nil();
    }

    /**
     * Wrap an iterable into a list.
     */
    static <T> Seq<T> wrap(Iterable<T> iterable) {
        return wrap(iterable.iterator());
    }

    /**
     * Wrap a character sequence into a list of characters.
     */
    static Seq<Character> wrap(CharSequence cs) {
        Seq<Character> res = nil();
        for (int i = cs.length(); --i >= 0; ) {
            res = cons(cs.charAt(i), res);
        }
        return res;
    }

    // Operations

    /**
     * Reverse elements in this list.
     */
    default Seq<T> reverse() {
        Seq<T> res = nil();
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail()) {
            res = cons(xs.head(), res);
        }
        return res;
    }

    /**
     * Concatenate this list to other list.
     */
    default Seq<T> append(Seq<T> other) {
        return SeqImpl.concat(this, () -> other);
    }

    /**
     * Lazily concatenate this list to other list. The supplier is not
     * invoked until all elements of this list have been consumed.
     */
    default Seq<T> append(Supplier<? extends Seq<T>> other) {
        return SeqImpl.concat(this, other);
    }

    /**
     * Returns a list consisting of the elements of this list that match
     * the given predicate
     *
     * @param predicate a predicate to apply to each element to determine if it
     * should be included
     * @return the new list
     */
    default Seq<T> filter(Predicate<? super T> predicate) {
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail()) {
            if (predicate.test(xs.head())) {
                final Seq<T> t = xs;
                return cons(t.head(), () -> t.tail().filter(predicate));
            }
        }
        return nil();
    }

    /**
     * Returns a list consisting of the results of applying the given function
     * to the elements of this list.
     *
     * @param <R> the element type of the new list
     * @param mapper a function to apply to each element
     * @return the new list
     */
    default <R> Seq<R> map(Function<? super T, ? extends R> mapper) {
        return isEmpty() ? nil() : cons(mapper.apply(head()), () -> tail().map(mapper));
    }

    /**
     * Returns a list consisting of the results of replacing each element of
     * this list with the contents of a mapped list produced by applying the
     * provided mapping function to each element. The mapping function is
     * applied lazily, in order, as the resulting list is traversed.
     *
     * @param <R> the element type of the new list
     * @param mapper a function to apply to each element which produces a list
     * of new values
     * @return the new list
     */
    default <R> Seq<R> flatMap(Function<? super T, ? extends Seq<R>> mapper) {
        return SeqImpl.flatMap(this, mapper);
    }

    /**
     * Returns an iterator over elements of this list.
     *
     * @return an iterator
     */
    @Override
    default Iterator<T> iterator() {
        return new Iterator<T>() {
            Seq<T> cur = Seq.this;

            @Override
            public boolean hasNext() {
                return !cur.isEmpty();
            }

            @Override
            public T next() {
                if (cur.isEmpty())
                    throw new NoSuchElementException();
                T res = cur.head();
                cur = cur.tail();
                return res;
            }
        };
    }

    /**
     * Reduce the list using the binary operator, from left to right.
     */
    default <R> R foldLeft(R identity, BiFunction<R, ? super T, R> accumulator) {
        R result = identity;
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail()) {
            result = accumulator.apply(result, xs.head());
        }
        return result;
    }

    /**
     * Returns the number of elements in this list.
     */
    default int size() {
        int n = 0;
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail()) {
            n++;
        }
        return n;
    }

    /**
     * Returns a list with given limited elements taken.
     */
    default Seq<T> take(int n) {
        if (n <= 0 || isEmpty()) {
            return nil();
        } else {
            return cons(head(), () -> tail().take(n - 1));
        }
    }

    /**
     * A convenient method that collect sequence elements into an unmodifiable
     * {@code List}. The list may contain {@code null} elements.
     */
    default List<T> toList() {
        List<T> res = new ArrayList<>();
        for (T x : this) {
            res.add(x);
        }
        return Collections.unmodifiableList(res);
    }

    /**
     * Returns the string representation of a sequence.
     */
    default String show() {
        return show(Integer.MAX_VALUE);
    }

    /**
     * Returns the string representation of a sequence.
     *
     * @param n number of elements to be shown
     */
    default String show(int n) {
        return show(n, ", ", "[", "]");
    }

    /**
     * Returns the string representation of a sequence.
     *
     * @param n number of elements to be shown
     * @param delimiter the sequence of characters to be used between each element
     * @param prefix the sequence of characters to be used at the beginning
     * @param suffix the sequence of characters to be used at the end
     */
    default String show(int n, CharSequence delimiter, CharSequence prefix, CharSequence suffix) {
        StringJoiner joiner = new StringJoiner(delimiter, prefix, suffix);
        Seq<T> xs = this; int i = 0;
        for (; !xs.isEmpty() && i < n; xs = xs.tail(), i++) {
            joiner.add(String.valueOf(xs.head()));
        }
        if (!xs.isEmpty()) {
            joiner.add("...");
        }
        return joiner.toString();
    }
}
