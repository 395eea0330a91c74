/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.combinator.input;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Arrays;

import com.cloudway.combinator.data.Seq;
import static java.util.Objects.requireNonNull;

final class Inputs {
    private Inputs() {}

    /**
     * The string input.
     */
    static final class CharInput extends AbstractInput<Character> {
        private final String input;

        CharInput(String input) {
            this(input, 0);
        }

        private CharInput(String input, int offset) {
            super(offset);
            this.input = input;
        }

        @Override
        public boolean isEmpty() {
            return offset >= input.length();
        }

        @Override
        public Character first() {
            if (isEmpty())
                throw emptyInput("first()");
            return input.charAt(offset);
        }

        @Override
        public Input<Character> rest() {
            if (isEmpty())
                throw emptyInput("rest()");
            return new CharInput(input, offset + 1);
        }

        @Override
        public boolean equals(Object obj) {
            if (obj instanceof CharInput) {
                CharInput other = (CharInput)obj;
                int len = input.length() - offset;
                return len == other.input.length() - other.offset
                    && input.regionMatches(offset, other.input, other.offset, len);
            }
            return super.equals(obj);
        }

        @Override
        public int hashCode() {
            int hash = 1;
            for (int i = offset; i < input.length(); i++) {
                hash = 31 * hash + Character.hashCode(input.charAt(i));
            }
            return hash;
        }
    }

    /**
     * The list input, also used for iterator backed inputs.
     */
    static final class ListInput<T> extends AbstractInput<T> {
        private final Seq<T> list;

        ListInput(Seq<T> list, int offset) {
            super(offset);
            this.list = requireNonNull(list);
        }

        @Override
        public boolean isEmpty() {
            return list.isEmpty();
        }

        @Override
        public T first() {
            if (list.isEmpty())
                throw emptyInput("first()");
            return list.head();
        }

        @Override
        public Input<T> rest() {
            if (list.isEmpty())
                throw emptyInput("rest()");
            return new ListInput<>(list.tail(), offset + 1);
        }

        @Override
        public Seq<T> toSeq() {
            return list;
        }
    }

    /**
     * The chunked reader input. Chunks are read on demand and kept in a lazy
     * list, so every view of the input sees the same characters.
     */
    static final class ChunkInput extends AbstractInput<Character> {
        private static final int CHUNK_SIZE = 8192;

        private final Seq<char[]> chunks;
        private final int index;

        private ChunkInput(Seq<char[]> chunks, int index, int offset) {
            super(offset);
            this.chunks = chunks;
            this.index = index;
        }

        static Input<Character> open(Reader reader) {
            return new ChunkInput(makeChunkList(requireNonNull(reader)), 0, 0);
        }

        private static Seq<char[]> makeChunkList(Reader reader) {
            try {
                char[] payload = new char[CHUNK_SIZE];
                int length = reader.read(payload);
                if (length < 0) {
                    return Seq.nil();
                } else if (length == 0) {
                    return makeChunkList(reader);
                } else {
                    if (length != payload.length) {
                        payload = Arrays.copyOf(payload, length);
                    }
                    return Seq.cons(payload, () -> makeChunkList(reader));
                }
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
        }

        @Override
        public boolean isEmpty() {
            return chunks.isEmpty();
        }

        @Override
        public Character first() {
            if (chunks.isEmpty())
                throw emptyInput("first()");
            return chunks.head()[index];
        }

        @Override
        public Input<Character> rest() {
            if (chunks.isEmpty())
                throw emptyInput("rest()");
            if (index + 1 < chunks.head().length) {
                return new ChunkInput(chunks, index + 1, offset + 1);
            } else {
                return new ChunkInput(chunks.tail(), 0, offset + 1);
            }
        }
    }
}
