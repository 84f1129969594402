/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.parsing.parser;

import java.util.function.Function;

import static com.cloudway.parsing.control.Trampoline.suspend;

/**
 * A parser that never fails, such as {@link Parsers#takeWhile}.
 *
 * <p>A {@code TotalParser} is deliberately not a {@link Parser}: repetition
 * combinators loop until their argument fails, so handing them a parser
 * that always succeeds would never terminate. Use {@link #asParser()} to
 * pass one where a {@code Parser} is required anyway.</p>
 *
 * @param <T> the token type
 * @param <A> the result type
 */
public final class TotalParser<T, A> extends ParserBase<T, A> {
    private TotalParser(ParseFunction<T, A, ?> f) {
        super(f);
    }

    /**
     * Wraps a parser that is known never to fail.
     */
    static <T, A> TotalParser<T, A> trusted(ParserBase<T, A> p) {
        return new TotalParser<>(p.function());
    }

    /**
     * Construct a total parser from a parse function. The function must
     * never call its failure continuation.
     */
    public static <T, A> TotalParser<T, A> of(ParseFunction<T, A, ?> f) {
        return new TotalParser<>(f);
    }

    @Override
    public <B> TotalParser<T, B> map(Function<? super A, ? extends B> f) {
        return of((s, err, ok) ->
            unParser(s, err, (s1, x) -> suspend(() -> ok.apply(s1, f.apply(x)))));
    }

    /**
     * Widens this parser to a {@link Parser}. The result must not be passed
     * to {@link Parser#many()} or similar repetition combinators.
     */
    public Parser<T, A> asParser() {
        return Parser.of(function());
    }
}
