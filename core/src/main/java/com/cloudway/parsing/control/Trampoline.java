/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.parsing.control;

import java.util.function.Supplier;

/**
 * A Trampoline is a computation that can be stepped through and executed
 * in constant stack. Each step is either a final value or a deferred thunk
 * that yields the next step.
 *
 * <p>Parsers never call their continuations directly from a caller's stack
 * frame. Instead they return a suspended step and let the {@link #run()}
 * loop drive the computation, so the native stack depth stays bounded no
 * matter how long the input or how deep the continuation chain.</p>
 *
 * @param <A> the type of computation result
 */
public abstract class Trampoline<A> {
    /**
     * A suspended computation that can be resumed.
     */
    private static final class Suspend<A> extends Trampoline<A> {
        private final Supplier<? extends Trampoline<A>> suspension;

        private Suspend(Supplier<? extends Trampoline<A>> s) {
            suspension = s;
        }

        @Override
        public boolean isDone() {
            return false;
        }

        @Override
        public Trampoline<A> resume() {
            return suspension.get();
        }

        @Override
        public A get() {
            throw new IllegalStateException("computation suspended");
        }
    }

    /**
     * A pure value at the leaf of a computation.
     */
    private static final class Pure<A> extends Trampoline<A> {
        private final A value;

        private Pure(A a) {
            value = a;
        }

        @Override
        public boolean isDone() {
            return true;
        }

        @Override
        public Trampoline<A> resume() {
            return this;
        }

        @Override
        public A get() {
            return value;
        }
    }

    Trampoline() {}

    /**
     * Constructs a pure computation that results in the given value.
     *
     * @param a the value of the result
     * @return a trampoline that results in the given value
     */
    public static <A> Trampoline<A> pure(A a) {
        return new Pure<>(a);
    }

    /**
     * Synonym for {@link #pure(Object) pure}.
     */
    public static <A> Trampoline<A> immediate(A a) {
        return pure(a);
    }

    /**
     * Suspends the given computation in a thunk.
     *
     * @param a a trampoline suspended in a thunk
     * @return a trampoline whose next step runs the given thunk
     */
    public static <A> Trampoline<A> suspend(Supplier<? extends Trampoline<A>> a) {
        return new Suspend<>(a);
    }

    /**
     * Returns {@code true} if this computation has produced its final value.
     */
    public abstract boolean isDone();

    /**
     * Returns a single step of this computation. A finished computation
     * resumes to itself.
     *
     * @return the next step of this computation.
     */
    public abstract Trampoline<A> resume();

    /**
     * Returns the final value of a finished computation.
     *
     * @throws IllegalStateException if the computation is still suspended
     */
    public abstract A get();

    /**
     * Runs this computation all the way to the end, in constant stack.
     *
     * @return the end result of this computation
     */
    public A run() {
        Trampoline<A> current = this;
        while (!current.isDone()) {
            current = current.resume();
        }
        return current.get();
    }

    /**
     * Runs the given computation all the way to the end.
     */
    public static <A> A run(Trampoline<A> t) {
        return t.run();
    }
}
