/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.parsing.parser;

import java.util.function.Function;

import com.cloudway.parsing.control.Trampoline;

import static com.cloudway.parsing.control.Trampoline.suspend;
import static java.util.Objects.requireNonNull;

/**
 * The common part of {@link Parser} and {@link TotalParser}: a packed parse
 * function plus the sequencing operations every parser supports.
 *
 * @param <T> the token type
 * @param <A> the result type
 */
public abstract class ParserBase<T, A> {
    private final ParseFunction<T, A, ?> pf;

    ParserBase(ParseFunction<T, A, ?> f) {
        this.pf = requireNonNull(f);
    }

    /**
     * Unpack the parser function.
     */
    @SuppressWarnings("unchecked")
    <R> ParseFunction<T, A, R> function() {
        return (ParseFunction<T, A, R>)pf;
    }

    /**
     * Unpack and execute the parser function. The execution is suspended
     * so that it happens on the driving loop, not on the caller's stack.
     *
     * @param input the input state to start from
     * @param err the failure continuation
     * @param ok the success continuation
     * @return the rest of the computation
     */
    public <R> Trampoline<R> unParser(Input<T> input, FailureContinuation<T, R> err,
                                      SuccessContinuation<T, A, R> ok) {
        return suspend(() -> this.<R>function().apply(input, err, ok));
    }

    /**
     * Transfer a computation by feeding the result to the given function.
     * The resulting parser fails exactly when this parser fails.
     */
    public abstract <B> ParserBase<T, B> map(Function<? super A, ? extends B> f);

    /**
     * Sequentially compose this parser with the parser computed from its
     * result.
     */
    public <B> Parser<T, B> bind(Function<? super A, ? extends ParserBase<T, B>> k) {
        return Parser.of((s, err, ok) ->
            unParser(s, err, (s1, x) -> k.apply(x).unParser(s1, err, ok)));
    }

    /**
     * Sequentially compose two parsers, discarding the result of this parser.
     */
    public <B> Parser<T, B> then(ParserBase<T, B> next) {
        requireNonNull(next);
        return Parser.of((s, err, ok) ->
            unParser(s, err, (s1, x) -> next.unParser(s1, err, ok)));
    }

    /**
     * Sequentially compose two parsers, discarding the result of the second
     * parser.
     */
    public Parser<T, A> before(ParserBase<T, ?> next) {
        requireNonNull(next);
        return Parser.of((s, err, ok) ->
            unParser(s, err, (s1, x) ->
                next.unParser(s1, err, (s2, y) -> suspend(() -> ok.apply(s2, x)))));
    }
}
