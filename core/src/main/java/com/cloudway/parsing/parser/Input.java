/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.parsing.parser;

import com.google.common.base.MoreObjects;

import static java.util.Objects.requireNonNull;

/**
 * A record of parser state: the remaining unconsumed input and whether more
 * input may still arrive.
 *
 * <p>Besides those two, the state carries the prompt of the current run
 * and, inside a speculative branch, the tokens the prompt delivered since
 * the branch began ({@link #added()}). The latter lets a backtracking
 * combinator replay input pulled by a failed branch. Outside any branch
 * nothing is recorded, so a long stream is not retained.</p>
 *
 * <p>An {@code Input} is immutable. Every operation that consumes or
 * delivers input produces a new value, so holding an earlier value is
 * equivalent to rewinding.</p>
 *
 * @param <T> the token type
 */
public final class Input<T> {
    private final Tokens<T> remaining;
    private final Tokens<T> added;
    private final More more;
    private final Prompt<T> prompt;

    Input(Tokens<T> remaining, Tokens<T> added, More more, Prompt<T> prompt) {
        this.remaining = remaining;
        this.added = added;
        this.more = more;
        this.prompt = prompt;
    }

    /**
     * Creates the initial state of a run.
     *
     * @param remaining the initially buffered tokens
     * @param more whether more input may arrive
     * @param prompt the hook that delivers further input
     */
    public static <T> Input<T> of(Tokens<T> remaining, More more, Prompt<T> prompt) {
        return new Input<>(requireNonNull(remaining), null, requireNonNull(more), requireNonNull(prompt));
    }

    /**
     * Returns the remaining unconsumed tokens.
     */
    public Tokens<T> remaining() {
        return remaining;
    }

    /**
     * Returns the tokens delivered since the innermost speculative point,
     * or an empty sequence outside any speculative branch.
     */
    public Tokens<T> added() {
        return added != null ? added : Tokens.empty();
    }

    /**
     * Returns whether more input may still arrive.
     */
    public More more() {
        return more;
    }

    /**
     * Returns {@code true} if no further chunks will ever arrive.
     */
    public boolean isComplete() {
        return more == More.COMPLETE;
    }

    /**
     * Returns the prompt of the current run.
     */
    public Prompt<T> prompt() {
        return prompt;
    }

    /**
     * Replaces the remaining tokens.
     */
    public Input<T> withRemaining(Tokens<T> tokens) {
        return tokens == remaining ? this : new Input<>(requireNonNull(tokens), added, more, prompt);
    }

    /**
     * Appends a newly delivered chunk to the remaining tokens.
     */
    public Input<T> feed(Tokens<T> chunk) {
        Tokens<T> history = added != null ? added.concat(chunk) : null;
        return new Input<>(remaining.concat(chunk), history, more, prompt);
    }

    /**
     * Marks the stream complete.
     */
    public Input<T> complete() {
        return more == More.COMPLETE ? this : new Input<>(remaining, added, More.COMPLETE, prompt);
    }

    /**
     * Returns this state with the delivered-token history cleared, marking
     * the start of a speculative branch.
     */
    Input<T> speculate() {
        return added != null && added.isEmpty() ? this : new Input<>(remaining, Tokens.empty(), more, prompt);
    }

    /**
     * Merges the state before a speculative branch with the state the
     * branch ended in. The result holds the tokens that were remaining
     * before the branch, followed by every token the prompt delivered while
     * the branch ran, so that input pulled from the source is neither lost
     * nor duplicated when the branch is abandoned.
     *
     * @param before the state before the branch, as passed to {@link #speculate()}
     * @param after the state the branch ended in
     */
    static <T> Input<T> merge(Input<T> before, Input<T> after) {
        Tokens<T> pulled = after.added();
        if (pulled.isEmpty() && after.more == before.more)
            return before;
        Tokens<T> history = before.added != null ? before.added.concat(pulled) : null;
        return new Input<>(before.remaining.concat(pulled), history,
                           before.more.plus(after.more), before.prompt);
    }

    /**
     * Continues with the state a successful speculative branch ended in,
     * restoring the delivered-token history of the enclosing branch.
     *
     * @param before the state before the branch, as passed to {@link #speculate()}
     * @param after the state the branch ended in
     */
    static <T> Input<T> commit(Input<T> before, Input<T> after) {
        Tokens<T> history = before.added != null ? before.added.concat(after.added()) : null;
        return history == after.added ? after : new Input<>(after.remaining, history, after.more, after.prompt);
    }

    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("remaining", remaining)
            .add("more", more)
            .toString();
    }
}
