/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.parsing.parser;

import java.util.Optional;
import java.util.function.Function;

import com.google.common.collect.ImmutableList;
import com.cloudway.parsing.control.Trampoline;
import com.cloudway.parsing.data.Unit;

import static com.cloudway.parsing.control.Trampoline.suspend;
import static java.util.Objects.requireNonNull;

/**
 * A parser that may fail. Only parsers of this type can be repeated with
 * {@link #many()} or used as the first branch of {@link #or(Parser)}; a
 * {@link TotalParser} never fails and would make those combinators loop
 * forever or never try their alternative.
 *
 * @param <T> the token type
 * @param <A> the result type
 */
public final class Parser<T, A> extends ParserBase<T, A> {
    private Parser(ParseFunction<T, A, ?> f) {
        super(f);
    }

    /**
     * Construct a parser from a parse function.
     */
    public static <T, A> Parser<T, A> of(ParseFunction<T, A, ?> f) {
        return new Parser<>(f);
    }

    @Override
    public <B> Parser<T, B> map(Function<? super A, ? extends B> f) {
        return of((s, err, ok) ->
            unParser(s, err, (s1, x) -> suspend(() -> ok.apply(s1, f.apply(x)))));
    }

    /**
     * Alternatively combine two parsers. If this parser fails the other
     * parser runs from the state this parser started in, extended with any
     * input the prompt delivered while this parser ran.
     */
    public Parser<T, A> or(Parser<T, A> other) {
        requireNonNull(other);
        return of((s, err, ok) ->
            unParser(s.speculate(),
                (s1, ctx, msg) -> other.unParser(Input.merge(s, s1), err, ok),
                (s1, x) -> suspend(() -> ok.apply(Input.commit(s, s1), x))));
    }

    /**
     * Labels this parser. When it fails the label is appended to the
     * failure's context, so the context lists labels innermost first.
     */
    public Parser<T, A> label(String name) {
        requireNonNull(name);
        return of((s, err, ok) ->
            unParser(s,
                (s1, ctx, msg) -> suspend(() -> err.apply(s1, append(ctx, name), msg)),
                ok));
    }

    private static ImmutableList<String> append(ImmutableList<String> context, String name) {
        return ImmutableList.<String>builder().addAll(context).add(name).build();
    }

    /**
     * Tries this parser. If it fails, returns the given value without
     * consuming input.
     */
    public TotalParser<T, A> option(A x) {
        return TotalParser.trusted(or(Parsers.<T, A>pure(x).asParser()));
    }

    /**
     * Tries this parser. If it fails, returns an empty result without
     * consuming input.
     */
    public TotalParser<T, Optional<A>> optional() {
        return this.<Optional<A>>map(Optional::of).option(Optional.empty());
    }

    /**
     * Applies this parser zero or more times. Returns the list of results.
     *
     * @throws IllegalStateException when run, if this parser succeeds
     *         without consuming input
     */
    public TotalParser<T, ImmutableList<A>> many() {
        return TotalParser.trusted(Parser.<T, ImmutableList<A>>of((s, err, ok) ->
            manyLoop(s, Chain.nil(), ok)));
    }

    /**
     * Applies this parser one or more times. Returns the list of results.
     */
    public Parser<T, ImmutableList<A>> many1() {
        return bind(x -> many().map(xs ->
            ImmutableList.<A>builder().add(x).addAll(xs).build()));
    }

    /**
     * Applies this parser zero or more times, skipping its result.
     */
    public TotalParser<T, Unit> skipMany() {
        return many().map(xs -> Unit.U);
    }

    private <R> Trampoline<R> manyLoop(Input<T> s, Chain<A> acc,
                                       SuccessContinuation<T, ImmutableList<A>, R> ok) {
        return unParser(s.speculate(),
            (s1, ctx, msg) -> suspend(() -> ok.apply(Input.merge(s, s1), acc.toList())),
            (s1, x) -> {
                if (s1.remaining() == s.remaining() && s1.more() == s.more()) {
                    throw new IllegalStateException(
                        "combinator 'many' is applied to a parser that accepts an empty input");
                }
                return suspend(() -> manyLoop(Input.commit(s, s1), acc.push(x), ok));
            });
    }
}
