/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.combinator.input;

import java.io.Reader;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.function.BiFunction;
import java.util.function.Supplier;

import com.cloudway.combinator.data.Seq;

/**
 * Represents an immutable view over a source of elements. Consuming an
 * element never changes the receiver, it produces a new view positioned
 * after that element.
 *
 * <p>Implementations must be referentially stable: calling {@link #rest()}
 * twice on the same input yields two equal inputs. Implementations should
 * extend {@link AbstractInput} so that inputs compare by the elements they
 * have left, regardless of the source they read from.</p>
 *
 * @param <T> the element type
 */
public interface Input<T> {
    /**
     * Returns {@code true} if there are no more elements.
     */
    boolean isEmpty();

    /**
     * Returns the current element.
     *
     * @throws EmptyInputException if the input is empty
     */
    T first();

    /**
     * Returns the input positioned after the current element.
     *
     * @throws EmptyInputException if the input is empty
     */
    Input<T> rest();

    /**
     * Deconstruct current element and remaining input to the given function,
     * or in case of an empty input, apply the empty function.
     *
     * @param consumer the function to apply with current element and remaining input
     * @param empty the function to apply when the input is empty
     */
    default <R> R uncons(BiFunction<? super T, Input<T>, ? extends R> consumer,
                         Supplier<? extends R> empty) {
        return isEmpty() ? empty.get() : consumer.apply(first(), rest());
    }

    /**
     * Returns the remaining elements as a list.
     */
    default Seq<T> toSeq() {
        return isEmpty() ? Seq.nil() : Seq.cons(first(), () -> rest().toSeq());
    }

    /**
     * Create a character input from a character sequence.
     */
    static Input<Character> of(CharSequence input) {
        return new Inputs.CharInput(input.toString());
    }

    /**
     * Create a token input from a list.
     */
    static <T> Input<T> of(Seq<T> list) {
        return new Inputs.ListInput<>(list, 0);
    }

    /**
     * Create a token input from a {@code java.util.List}. The elements are
     * copied, later changes to the list are not seen by the input.
     */
    static <T> Input<T> of(List<T> list) {
        Seq<T> elements = Seq.nil();
        for (ListIterator<T> it = list.listIterator(list.size()); it.hasPrevious(); ) {
            elements = Seq.cons(it.previous(), elements);
        }
        return new Inputs.ListInput<>(elements, 0);
    }

    /**
     * Create an input from an iterator. Elements are pulled from the iterator
     * on demand and remembered, so the resulting input can be read any number
     * of times. The iterator must not be used by anyone else afterwards.
     */
    static <T> Input<T> of(Iterator<T> iterator) {
        return new Inputs.ListInput<>(Seq.wrap(iterator), 0);
    }

    /**
     * Create a character input from a {@code java.io.Reader}. The reader is
     * read lazily in chunks and is not closed by the input.
     */
    static Input<Character> of(Reader reader) {
        return Inputs.ChunkInput.open(reader);
    }
}
