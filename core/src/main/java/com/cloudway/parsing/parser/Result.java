/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.parsing.parser;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.cloudway.parsing.control.Trampoline;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of running a parser: it either finished with a value, failed,
 * or is suspended waiting for more input.
 *
 * @param <T> the token type
 * @param <A> the result type
 */
public abstract class Result<T, A> {
    private static final Logger logger = Logger.getLogger(Result.class.getName());

    Result() {}

    /**
     * The parser succeeded.
     */
    public static final class Done<T, A> extends Result<T, A> {
        private final Input<T> input;
        private final A value;

        Done(Input<T> input, A value) {
            this.input = input;
            this.value = value;
        }

        /**
         * Returns the parsed value.
         */
        public A value() {
            return value;
        }

        /**
         * Returns the input state the parser ended in.
         */
        public Input<T> input() {
            return input;
        }

        @Override
        public Tokens<T> remaining() {
            return input.remaining();
        }

        /**
         * Appends the chunk to the unconsumed remainder.
         */
        @Override
        public Result<T, A> feed(Tokens<T> chunk) {
            return chunk.isEmpty() ? this : new Done<>(input.feed(chunk), value);
        }

        @Override
        public Result<T, A> finish() {
            return this;
        }

        @Override
        public <R> R fold(Function<? super Done<T, A>, ? extends R> done,
                          Function<? super Fail<T, A>, ? extends R> fail,
                          Function<? super Partial<T, A>, ? extends R> partial) {
            return done.apply(this);
        }

        public String toString() {
            return MoreObjects.toStringHelper("Done")
                .add("value", value)
                .add("remaining", input.remaining())
                .toString();
        }
    }

    /**
     * The parser failed.
     */
    public static final class Fail<T, A> extends Result<T, A> {
        private final Input<T> input;
        private final ImmutableList<String> context;
        private final String message;

        Fail(Input<T> input, ImmutableList<String> context, String message) {
            this.input = input;
            this.context = context;
            this.message = message;
        }

        /**
         * Returns the failure-site labels, innermost first.
         */
        public ImmutableList<String> context() {
            return context;
        }

        /**
         * Returns the failure message.
         */
        public String message() {
            return message;
        }

        /**
         * Returns the input state at the point of failure.
         */
        public Input<T> input() {
            return input;
        }

        @Override
        public Tokens<T> remaining() {
            return input.remaining();
        }

        /**
         * Converts this failure to an exception.
         */
        public ParseError toError() {
            return new ParseError(context, message, input.remaining());
        }

        @Override
        public Result<T, A> feed(Tokens<T> chunk) {
            return chunk.isEmpty() ? this : new Fail<>(input.feed(chunk), context, message);
        }

        @Override
        public Result<T, A> finish() {
            return this;
        }

        @Override
        public <R> R fold(Function<? super Done<T, A>, ? extends R> done,
                          Function<? super Fail<T, A>, ? extends R> fail,
                          Function<? super Partial<T, A>, ? extends R> partial) {
            return fail.apply(this);
        }

        public String toString() {
            return MoreObjects.toStringHelper("Fail")
                .add("context", context)
                .add("message", message)
                .add("remaining", input.remaining())
                .toString();
        }
    }

    /**
     * The parser is suspended, waiting for more input. The suspended
     * computation resumes exactly where it stopped.
     */
    public static final class Partial<T, A> extends Result<T, A> {
        private final Supplier<Trampoline<Result<T, A>>> noMoreInput;
        private final Function<Tokens<T>, Trampoline<Result<T, A>>> newChunk;

        Partial(Supplier<Trampoline<Result<T, A>>> noMoreInput,
                Function<Tokens<T>, Trampoline<Result<T, A>>> newChunk) {
            this.noMoreInput = noMoreInput;
            this.newChunk = newChunk;
        }

        /**
         * Always returns an empty sequence: the buffered input of a suspended
         * parser belongs to the suspended computation.
         */
        @Override
        public Tokens<T> remaining() {
            return Tokens.empty();
        }

        /**
         * Resumes the parser with the next chunk of input. Feeding an empty
         * chunk means that no more input will arrive.
         */
        @Override
        public Result<T, A> feed(Tokens<T> chunk) {
            requireNonNull(chunk);
            if (chunk.isEmpty()) {
                return finish();
            }
            if (logger.isLoggable(Level.FINEST)) {
                logger.finest("Resume with " + chunk.size() + " tokens");
            }
            return newChunk.apply(chunk).run();
        }

        /**
         * Resumes the parser, telling it that no more input will arrive.
         * The result is never {@code Partial}.
         */
        @Override
        public Result<T, A> finish() {
            logger.finest("Resume at end of input");
            return noMoreInput.get().run();
        }

        @Override
        public <R> R fold(Function<? super Done<T, A>, ? extends R> done,
                          Function<? super Fail<T, A>, ? extends R> fail,
                          Function<? super Partial<T, A>, ? extends R> partial) {
            return partial.apply(this);
        }

        public String toString() {
            return "Partial";
        }
    }

    /**
     * Returns the unconsumed input of a finished parse.
     */
    public abstract Tokens<T> remaining();

    /**
     * Supplies another chunk of input.
     */
    public abstract Result<T, A> feed(Tokens<T> chunk);

    /**
     * Tells a suspended parser that no more input will arrive. A finished
     * result is returned unchanged.
     */
    public abstract Result<T, A> finish();

    /**
     * Applies the function that matches the kind of this result.
     */
    public abstract <R> R fold(Function<? super Done<T, A>, ? extends R> done,
                               Function<? super Fail<T, A>, ? extends R> fail,
                               Function<? super Partial<T, A>, ? extends R> partial);

    public boolean isDone() {
        return this instanceof Done;
    }

    public boolean isFail() {
        return this instanceof Fail;
    }

    public boolean isPartial() {
        return this instanceof Partial;
    }

    /**
     * Returns the parsed value, or empty if the parser failed or is still
     * suspended.
     */
    public Optional<A> toOptional() {
        return this.<Optional<A>>fold(d -> Optional.ofNullable(d.value()), f -> Optional.empty(), p -> Optional.empty());
    }

    /**
     * Returns the parsed value.
     *
     * @throws ParseError if the parser failed
     * @throws IllegalStateException if the parser is still suspended
     */
    public A getOrThrow() {
        return this.<A>fold(Done::value, f -> { throw f.toError(); }, p -> {
            throw new IllegalStateException("parser is suspended waiting for more input");
        });
    }
}
