/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.combinator.data;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.Function;
import java.util.function.Supplier;
import static java.util.Objects.requireNonNull;

final class SeqImpl {
    private SeqImpl() {}

    private interface Delayed {
        boolean computed();
    }

    /**
     * Provides value semantics shared by all list implementations.
     */
    private static abstract class AbstractSeq<T> implements Seq<T> {
        @Override
        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof Seq))
                return false;

            Seq<?> xs = this, ys = (Seq<?>)obj;
            while (!xs.isEmpty() && !ys.isEmpty()) {
                if (!Objects.equals(xs.head(), ys.head()))
                    return false;
                xs = xs.tail();
                ys = ys.tail();
            }
            return xs.isEmpty() && ys.isEmpty();
        }

        @Override
        public int hashCode() {
            int hash = 1;
            for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail()) {
                hash = 31 * hash + Objects.hashCode(xs.head());
            }
            return hash;
        }

        @Override
        public String toString() {
            return SeqImpl.toString(this);
        }
    }

    @SuppressWarnings("rawtypes")
    private static final Seq NIL = new AbstractSeq() {
        @Override
        public boolean isEmpty() {
            return true;
        }

        @Override
        public Object head() {
            throw new NoSuchElementException();
        }

        @Override
        public Seq tail() {
            throw new NoSuchElementException();
        }

        @Override
        public Seq reverse() {
            return this;
        }

        @Override
        public String toString() {
            return "[]";
        }
    };

    private static class Cons<T> extends AbstractSeq<T> {
        private final T head;
        private final Seq<T> tail;

        Cons(T head, Seq<T> tail) {
            this.head = head;
            this.tail = tail;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public T head() {
            return head;
        }

        @Override
        public Seq<T> tail() {
            return tail;
        }
    }

    private static class LazySeq<T> extends AbstractSeq<T> implements Delayed {
        private final T head;
        private volatile Supplier<Seq<T>> generator;
        private volatile Seq<T> tail;

        LazySeq(T head, Supplier<Seq<T>> generator) {
            this.head = head;
            this.generator = generator;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public T head() {
            return head;
        }

        @Override
        public Seq<T> tail() {
            if (tail == null)
                expand();
            return tail;
        }

        private synchronized void expand() {
            if (tail == null) {
                tail = requireNonNull(generator.get());
                generator = null; // no longer used again
            }
        }

        @Override
        public boolean computed() {
            return generator == null;
        }

        @Override
        public String toString() {
            if (generator != null) {
                return "[" + head + ", ?]";
            } else {
                return SeqImpl.toString(this);
            }
        }
    }

    @SuppressWarnings("unchecked")
    static <T> Seq<T> nil() {
        return (Seq<T>)NIL;
    }

    static <T> Seq<T> cons(T head, Seq<T> tail) {
        return new Cons<>(head, requireNonNull(tail));
    }

    static <T> Seq<T> cons(T head, Supplier<Seq<T>> generator) {
        return new LazySeq<>(head, requireNonNull(generator));
    }

    static <T> Seq<T> concat(Seq<T> a, Supplier<? extends Seq<T>> b) {
        if (a.isEmpty())
            return b.get();
        return cons(a.head(), () -> concat(a.tail(), b));
    }

    static <T, R> Seq<R> flatMap(Seq<T> xs, Function<? super T, ? extends Seq<R>> f) {
        // skip over elements mapped to empty lists without growing the stack
        while (!xs.isEmpty()) {
            Seq<R> ys = f.apply(xs.head());
            if (!ys.isEmpty()) {
                final Seq<T> t = xs;
                return concat(ys, () -> flatMap(t.tail(), f));
            }
            xs = xs.tail();
        }
        return nil();
    }

    static <T> String toString(Seq<T> xs) {
        StringJoiner sj = new StringJoiner(", ", "[", "]");
        while (true) {
            if ((xs instanceof Delayed) && !((Delayed)xs).computed()) {
                sj.add(String.valueOf(xs.head()));
                sj.add("?");
                break;
            } else if (xs.isEmpty()) {
                break;
            } else {
                sj.add(String.valueOf(xs.head()));
                xs = xs.tail();
            }
        }
        return sj.toString();
    }
}
