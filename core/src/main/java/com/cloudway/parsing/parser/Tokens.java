/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.parsing.parser;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Predicate;

import com.google.common.collect.ImmutableList;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkPositionIndex;
import static java.util.Objects.requireNonNull;

/**
 * An immutable sequence of tokens. A {@code Tokens} value is a window
 * {@code [start, end)} into a shared append-only arena, so slicing never
 * copies and holding an earlier value is as good as rewinding to it.
 *
 * <p>Appending to a window that ends at the arena's high-water mark grows
 * the arena in place; every other window keeps seeing exactly the tokens
 * it saw before. Appending to any other window copies.</p>
 *
 * @param <T> the token type
 */
public final class Tokens<T> implements Iterable<T> {
    private static final int MIN_CAPACITY = 16;

    /**
     * The shared token storage. Slots below {@code size} are never written
     * again once filled.
     */
    private static final class Arena {
        Object[] data;
        int size;

        Arena(Object[] data, int size) {
            this.data = data;
            this.size = size;
        }
    }

    private static final Tokens<?> EMPTY = new Tokens<>(new Arena(new Object[0], 0), 0, 0);

    private final Arena arena;
    private final int start;
    private final int end;

    private Tokens(Arena arena, int start, int end) {
        this.arena = arena;
        this.start = start;
        this.end = end;
    }

    /**
     * Returns the empty token sequence.
     */
    @SuppressWarnings("unchecked")
    public static <T> Tokens<T> empty() {
        return (Tokens<T>)EMPTY;
    }

    /**
     * Creates a token sequence holding the given tokens.
     */
    @SafeVarargs
    public static <T> Tokens<T> of(T... tokens) {
        return wrap(Arrays.copyOf(tokens, tokens.length, Object[].class), tokens.length);
    }

    /**
     * Creates a token sequence holding the elements of the given iterable.
     */
    public static <T> Tokens<T> copyOf(Iterable<? extends T> tokens) {
        Object[] data;
        if (tokens instanceof List) {
            data = ((List<?>)tokens).toArray(new Object[0]);
        } else {
            data = ImmutableList.copyOf(tokens).toArray(new Object[0]);
        }
        return wrap(data, data.length);
    }

    /**
     * Creates a character sequence from the given string.
     */
    public static Tokens<Character> chars(CharSequence s) {
        Object[] data = new Object[s.length()];
        for (int i = 0; i < data.length; i++) {
            data[i] = s.charAt(i);
        }
        return wrap(data, data.length);
    }

    /**
     * Creates a character sequence from a region of the given buffer.
     */
    public static Tokens<Character> chars(char[] buf, int off, int len) {
        checkPositionIndex(off + len, buf.length);
        Object[] data = new Object[len];
        for (int i = 0; i < len; i++) {
            data[i] = buf[off + i];
        }
        return wrap(data, len);
    }

    /**
     * Creates a byte sequence from the given array.
     */
    public static Tokens<Byte> bytes(byte[] buf) {
        return bytes(buf, 0, buf.length);
    }

    /**
     * Creates a byte sequence from a region of the given buffer.
     */
    public static Tokens<Byte> bytes(byte[] buf, int off, int len) {
        checkPositionIndex(off + len, buf.length);
        Object[] data = new Object[len];
        for (int i = 0; i < len; i++) {
            data[i] = buf[off + i];
        }
        return wrap(data, len);
    }

    private static <T> Tokens<T> wrap(Object[] data, int len) {
        if (len == 0) {
            return empty();
        }
        for (int i = 0; i < len; i++) {
            requireNonNull(data[i], "null token");
        }
        return new Tokens<>(new Arena(data, len), 0, len);
    }

    /**
     * Concatenates the given token sequences in order.
     */
    public static <T> Tokens<T> concat(List<Tokens<T>> parts) {
        Tokens<T> single = null;
        int total = 0;
        for (Tokens<T> part : parts) {
            if (!part.isEmpty()) {
                single = total == 0 ? part : null;
                total += part.size();
            }
        }
        if (total == 0) {
            return empty();
        }
        if (single != null) {
            return single;
        }

        Object[] data = new Object[total];
        int pos = 0;
        for (Tokens<T> part : parts) {
            System.arraycopy(part.arena.data, part.start, data, pos, part.size());
            pos += part.size();
        }
        return new Tokens<>(new Arena(data, total), 0, total);
    }

    /**
     * Returns the number of tokens in this sequence.
     */
    public int size() {
        return end - start;
    }

    /**
     * Returns {@code true} if this sequence contains no tokens.
     */
    public boolean isEmpty() {
        return start == end;
    }

    /**
     * Returns the token at the given index.
     */
    @SuppressWarnings("unchecked")
    public T get(int index) {
        checkElementIndex(index, size());
        return (T)arena.data[start + index];
    }

    /**
     * Returns the first token.
     *
     * @throws NoSuchElementException if this sequence is empty
     */
    public T head() {
        if (isEmpty())
            throw new NoSuchElementException();
        return get(0);
    }

    /**
     * Returns all tokens but the first one.
     *
     * @throws NoSuchElementException if this sequence is empty
     */
    public Tokens<T> tail() {
        if (isEmpty())
            throw new NoSuchElementException();
        return drop(1);
    }

    /**
     * Returns the first {@code n} tokens, or all tokens if this sequence is
     * shorter than {@code n}.
     */
    public Tokens<T> take(int n) {
        if (n <= 0)
            return empty();
        if (n >= size())
            return this;
        return new Tokens<>(arena, start, start + n);
    }

    /**
     * Returns all tokens after the first {@code n}.
     */
    public Tokens<T> drop(int n) {
        if (n <= 0)
            return this;
        if (n >= size())
            return empty();
        return new Tokens<>(arena, start + n, end);
    }

    /**
     * Returns the length of the longest prefix whose tokens all satisfy the
     * given predicate.
     */
    @SuppressWarnings("unchecked")
    public int prefixLength(Predicate<? super T> p) {
        Object[] data = arena.data;
        int i = start;
        while (i < end && p.test((T)data[i])) {
            i++;
        }
        return i - start;
    }

    /**
     * Returns a sequence of this sequence followed by the given tokens.
     */
    public Tokens<T> concat(Tokens<T> other) {
        if (other.isEmpty())
            return this;
        if (this.isEmpty())
            return other;

        int n = other.size();
        synchronized (arena) {
            if (end == arena.size && arena.data.length - end >= n) {
                System.arraycopy(other.arena.data, other.start, arena.data, end, n);
                arena.size = end + n;
                return new Tokens<>(arena, start, end + n);
            }
        }

        // only the live window moves to the new arena, consumed tokens are left behind
        int len = size() + n;
        Object[] data = new Object[Math.max(MIN_CAPACITY, len + (len >> 1))];
        System.arraycopy(arena.data, start, data, 0, size());
        System.arraycopy(other.arena.data, other.start, data, size(), n);
        return new Tokens<>(new Arena(data, len), 0, len);
    }

    /**
     * Returns {@code true} if this sequence holds the same tokens as the
     * given list, in the same order.
     */
    public boolean contentEquals(List<?> list) {
        if (list.size() != size())
            return false;
        for (int i = 0; i < list.size(); i++) {
            if (!arena.data[start + i].equals(list.get(i)))
                return false;
        }
        return true;
    }

    /**
     * Copies the tokens into an immutable list.
     */
    @SuppressWarnings("unchecked")
    public ImmutableList<T> toList() {
        return (ImmutableList<T>)(ImmutableList<?>)ImmutableList.copyOf(Arrays.copyOfRange(arena.data, start, end));
    }

    /**
     * Joins a character sequence into a string.
     */
    public static String asString(Tokens<Character> cs) {
        StringBuilder sb = new StringBuilder(cs.size());
        for (int i = cs.start; i < cs.end; i++) {
            sb.append((char)(Character)cs.arena.data[i]);
        }
        return sb.toString();
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<T>() {
            private int next = start;

            @Override
            public boolean hasNext() {
                return next < end;
            }

            @Override
            @SuppressWarnings("unchecked")
            public T next() {
                if (next >= end)
                    throw new NoSuchElementException();
                return (T)arena.data[next++];
            }
        };
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Tokens))
            return false;
        Tokens<?> other = (Tokens<?>)obj;
        if (other.size() != size())
            return false;
        for (int i = 0; i < size(); i++) {
            if (!arena.data[start + i].equals(other.arena.data[other.start + i]))
                return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (int i = start; i < end; i++) {
            h = 31 * h + arena.data[i].hashCode();
        }
        return h;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = start; i < end; i++) {
            if (i > start)
                sb.append(", ");
            sb.append(arena.data[i]);
        }
        return sb.append(']').toString();
    }
}
