/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.parsing.parser;

import com.google.common.collect.ImmutableList;

/**
 * A persistent stack used to accumulate results newest-first. Pushing
 * never disturbs an existing chain, so a continuation that is resumed more
 * than once sees the same accumulator each time.
 */
final class Chain<E> {
    private static final Chain<?> NIL = new Chain<>(null, null, 0);

    private final E head;
    private final Chain<E> next;
    private final int size;

    private Chain(E head, Chain<E> next, int size) {
        this.head = head;
        this.next = next;
        this.size = size;
    }

    @SuppressWarnings("unchecked")
    static <E> Chain<E> nil() {
        return (Chain<E>)NIL;
    }

    Chain<E> push(E e) {
        return new Chain<>(e, this, size + 1);
    }

    /**
     * Returns the elements in the order they were pushed.
     */
    @SuppressWarnings("unchecked")
    ImmutableList<E> toList() {
        Object[] elems = new Object[size];
        int i = size;
        for (Chain<E> c = this; c.size > 0; c = c.next) {
            elems[--i] = c.head;
        }
        return (ImmutableList<E>)(ImmutableList<?>)ImmutableList.copyOf(elems);
    }
}
