/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.parsing.parser;

import java.util.List;
import java.util.function.Predicate;
import java.util.function.Supplier;

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.cloudway.parsing.data.Unit;

import static com.cloudway.parsing.control.Trampoline.suspend;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

// @formatter:off

/**
 * The primitive parsers and the scanning combinators built on them.
 *
 * <p>All parsers here work on incremental input: when they need more
 * tokens than are buffered they ask the prompt of the current run for the
 * next chunk, and they behave the same whether a matching run of tokens
 * arrives in one chunk or in many.</p>
 */
public final class Parsers {
    private Parsers() {}

    static final ImmutableList<String> NO_CONTEXT = ImmutableList.of();
    static final ImmutableList<String> DEMAND_INPUT = ImmutableList.of("demand-input");
    static final String NOT_ENOUGH_INPUT = "not enough input";

    // Basic parsers

    /**
     * Construct a pure computation that results in the given value.
     */
    public static <T, A> TotalParser<T, A> pure(A x) {
        return TotalParser.of((s, err, ok) -> suspend(() -> ok.apply(s, x)));
    }

    /**
     * Fail with a message, without consuming input.
     */
    public static <T, A> Parser<T, A> fail(String msg) {
        requireNonNull(msg);
        return Parser.of((s, err, ok) -> suspend(() -> err.apply(s, NO_CONTEXT, msg)));
    }

    /**
     * Delay the construction of the given parser until it runs, which lets a
     * parser refer to itself.
     */
    public static <T, A> Parser<T, A> delay(Supplier<? extends ParserBase<T, A>> p) {
        Supplier<ParserBase<T, A>> t = Suppliers.memoize(p::get);
        return Parser.of((s, err, ok) -> t.get().unParser(s, err, ok));
    }

    /**
     * Tries to apply the parsers in order, until one of them succeeds.
     * Returns the value of the succeeding parser.
     */
    @SafeVarargs
    public static <T, A> Parser<T, A> choice(Parser<T, A> first, Parser<T, A>... rest) {
        return choice(ImmutableList.<Parser<T, A>>builder().add(first).add(rest).build());
    }

    /**
     * Tries to apply the parsers in order, until one of them succeeds.
     * Returns the value of the succeeding parser, or fails if the list is
     * empty.
     */
    public static <T, A> Parser<T, A> choice(List<Parser<T, A>> ps) {
        Parser<T, A> result = fail("empty choice");
        for (int i = ps.size(); --i >= 0; ) {
            result = ps.get(i).or(result);
        }
        return result;
    }

    /**
     * Returns the remaining input without consuming it.
     */
    public static <T> TotalParser<T, Tokens<T>> get() {
        return TotalParser.of((s, err, ok) -> suspend(() -> ok.apply(s, s.remaining())));
    }

    /**
     * Sets a (possibly modified) input into the parser state. Whatever was
     * remaining before is discarded.
     */
    public static <T> TotalParser<T, Unit> put(Tokens<T> input) {
        requireNonNull(input);
        return TotalParser.of((s, err, ok) -> suspend(() -> ok.apply(s.withRemaining(input), Unit.U)));
    }

    /**
     * Requests more input via the prompt. Fails with "not enough input" if
     * the stream is complete or the prompt reports that no more input will
     * arrive; otherwise succeeds with the new chunk appended to the remaining
     * input.
     */
    public static <T> Parser<T, Unit> demandInput() {
        return Parser.of((s, err, ok) -> {
            if (s.isComplete()) {
                return suspend(() -> err.apply(s, DEMAND_INPUT, NOT_ENOUGH_INPUT));
            }
            return s.prompt().request(s,
                () -> suspend(() -> err.apply(s.complete(), DEMAND_INPUT, NOT_ENOUGH_INPUT)),
                chunk -> suspend(() -> ok.apply(s.feed(checkChunk(chunk)), Unit.U)));
        });
    }

    /**
     * Returns {@code true} if any input is available either immediately or
     * on demand, and {@code false} if the end of all input has been reached.
     * Asking twice in a row gives the same answer and consumes nothing.
     *
     * <p>This parser always succeeds.</p>
     */
    public static <T> TotalParser<T, Boolean> wantInput() {
        return TotalParser.of((s, err, ok) -> {
            if (!s.remaining().isEmpty()) {
                return suspend(() -> ok.apply(s, true));
            }
            if (s.isComplete()) {
                return suspend(() -> ok.apply(s, false));
            }
            return s.prompt().request(s,
                () -> suspend(() -> ok.apply(s.complete(), false)),
                chunk -> suspend(() -> ok.apply(s.feed(checkChunk(chunk)), true)));
        });
    }

    private static <T> Tokens<T> checkChunk(Tokens<T> chunk) {
        checkArgument(!chunk.isEmpty(), "the prompt delivered an empty chunk");
        return chunk;
    }

    /**
     * If at least {@code n} items of input are available, return the current
     * input, otherwise demand more input until there are, or fail.
     */
    public static <T> Parser<T, Tokens<T>> ensure(int n) {
        checkArgument(n >= 0, "negative count: %s", n);
        return Parser.of((s, err, ok) -> {
            if (s.remaining().size() >= n) {
                return suspend(() -> ok.apply(s, s.remaining()));
            }
            return Parsers.<T>demandInput().then(ensure(n)).unParser(s, err, ok);
        });
    }

    // Token level parsers

    /**
     * Succeeds for any item for which the predicate returns {@code true}.
     * Returns the item that is actually parsed. Nothing is consumed on
     * failure.
     */
    public static <T> Parser<T, T> satisfy(Predicate<? super T> pred) {
        requireNonNull(pred);
        return Parsers.<T>ensure(1).bind(input -> {
            T item = input.head();
            if (pred.test(item)) {
                return Parsers.put(input.tail()).then(Parsers.<T, T>pure(item));
            } else {
                return Parsers.<T, T>fail("satisfy?");
            }
        });
    }

    /**
     * Succeeds for any item for which the predicate returns {@code true},
     * discarding it.
     */
    public static <T> Parser<T, Unit> skip(Predicate<? super T> pred) {
        requireNonNull(pred);
        return Parsers.<T>ensure(1).bind(input -> {
            if (pred.test(input.head())) {
                return Parsers.put(input.tail());
            } else {
                return Parsers.<T, Unit>fail("skip");
            }
        });
    }

    /**
     * Matches any single item.
     */
    public static <T> Parser<T, T> anyToken() {
        return satisfy(x -> true);
    }

    /**
     * Matches {@code n} items of input, but succeeds only if the predicate
     * returns {@code true} on them. Returns the matched items. Nothing is
     * consumed on failure.
     */
    public static <T> Parser<T, Tokens<T>> takeWith(int n, Predicate<? super Tokens<T>> pred) {
        requireNonNull(pred);
        return Parsers.<T>ensure(n).bind(input -> {
            Tokens<T> h = input.take(n);
            if (pred.test(h)) {
                return Parsers.put(input.drop(n)).then(Parsers.<T, Tokens<T>>pure(h));
            } else {
                return Parsers.<T, Tokens<T>>fail("take-with");
            }
        });
    }

    /**
     * Matches exactly {@code n} items of input.
     */
    public static <T> Parser<T, Tokens<T>> take(int n) {
        return takeWith(n, h -> true);
    }

    /**
     * Matches a sequence of items identical to the given ones. Consumes no
     * input if it fails, even after a partial match.
     */
    public static <T> Parser<T, Tokens<T>> tokens(List<? extends T> expected) {
        ImmutableList<T> xs = ImmutableList.copyOf(expected);
        return takeWith(xs.size(), h -> h.contentEquals(xs));
    }

    /**
     * Matches the characters of the given string and returns the string.
     * Consumes no input if it fails, even after a partial match.
     */
    public static Parser<Character, String> string(String str) {
        return tokens(Tokens.chars(str).toList()).map(cs -> str);
    }

    // Scanning combinators

    /**
     * Skips input for as long as the predicate returns {@code true}.
     *
     * <p>This parser always succeeds.</p>
     */
    public static <T> TotalParser<T, Unit> skipWhile(Predicate<? super T> pred) {
        requireNonNull(pred);
        return TotalParser.trusted(Parsers.<T>get().bind(input -> {
            Tokens<T> rest = input.drop(input.prefixLength(pred));
            return Parsers.put(rest).then(rest.isEmpty()
                ? Parsers.<T>wantInput().bind(more -> more ? Parsers.<T>skipWhile(pred) : Parsers.<T, Unit>pure(Unit.U))
                : Parsers.<T, Unit>pure(Unit.U));
        }));
    }

    /**
     * Matches input as long as the predicate returns {@code true}, and
     * returns the consumed input.
     *
     * <p>This parser does not fail. It returns an empty sequence if the
     * predicate returns {@code false} on the first item of input. Because
     * it does not fail, it cannot be repeated with {@link Parser#many()}.</p>
     */
    public static <T> TotalParser<T, Tokens<T>> takeWhile(Predicate<? super T> pred) {
        requireNonNull(pred);
        return TotalParser.trusted(takeWhileLoop(pred, Chain.<Tokens<T>>nil())
            .map(acc -> Tokens.concat(acc.toList())));
    }

    private static <T> Parser<T, Chain<Tokens<T>>>
    takeWhileLoop(Predicate<? super T> pred, Chain<Tokens<T>> acc) {
        return Parsers.<T>get().bind(input -> {
            int n = input.prefixLength(pred);
            Tokens<T> post = input.drop(n);
            Chain<Tokens<T>> acc1 = acc.push(input.take(n));
            if (post.isEmpty()) {
                return Parsers.put(post).then(Parsers.<T>wantInput().bind(more -> more
                    ? takeWhileLoop(pred, acc1)
                    : Parsers.<T, Chain<Tokens<T>>>pure(acc1)));
            } else {
                return Parsers.put(post).then(Parsers.<T, Chain<Tokens<T>>>pure(acc1));
            }
        });
    }

    /**
     * Matches input as long as the predicate returns {@code false}, that is
     * until it returns {@code true}, and returns the consumed input.
     *
     * <p>This parser does not fail. It returns an empty sequence if the
     * predicate returns {@code true} on the first item of input.</p>
     */
    public static <T> TotalParser<T, Tokens<T>> takeTill(Predicate<? super T> pred) {
        requireNonNull(pred);
        return takeWhile(x -> !pred.test(x));
    }

    /**
     * Matches input as long as the predicate returns {@code true}, and
     * returns the consumed input. Fails if the first item of input, after
     * demanding one if none is buffered, does not satisfy the predicate.
     */
    public static <T> Parser<T, Tokens<T>> takeWhile1(Predicate<? super T> pred) {
        requireNonNull(pred);
        return Parsers.<T>get().bind(input -> input.isEmpty()
                ? Parsers.<T>demandInput()
                : Parsers.<T, Unit>pure(Unit.U))
            .then(Parsers.<T>get())
            .bind(input -> {
                int n = input.prefixLength(pred);
                if (n == 0) {
                    return Parsers.<T, Tokens<T>>fail("take-while1");
                }
                Tokens<T> pre = input.take(n), post = input.drop(n);
                if (post.isEmpty()) {
                    return Parsers.put(post).then(Parsers.<T>takeWhile(pred)).map(rest -> pre.concat(rest));
                } else {
                    return Parsers.put(post).then(Parsers.<T, Tokens<T>>pure(pre));
                }
            });
    }

    /**
     * Returns the rest of the input, across every chunk still to arrive.
     * The result holds one sequence per continuation hop, in delivery
     * order.
     *
     * <p>This parser always succeeds.</p>
     */
    public static <T> TotalParser<T, ImmutableList<Tokens<T>>> takeRest() {
        return TotalParser.trusted(takeRestLoop(Chain.<Tokens<T>>nil()));
    }

    private static <T> Parser<T, ImmutableList<Tokens<T>>> takeRestLoop(Chain<Tokens<T>> acc) {
        return Parsers.<T>wantInput().bind(more -> {
            if (more) {
                return Parsers.<T>get().bind(input ->
                    Parsers.put(Tokens.<T>empty()).then(takeRestLoop(acc.push(input))));
            } else {
                return Parsers.<T, ImmutableList<Tokens<T>>>pure(acc.toList());
            }
        });
    }

    /**
     * Matches only when the end of input has been reached, otherwise fails.
     * Consumes nothing either way.
     *
     * <p>When the buffer is empty but the stream is not yet complete, this
     * parser probes for more input. A chunk that arrives during the probe
     * makes it fail, and the chunk stays in the input for the next parser.</p>
     */
    public static <T> Parser<T, Unit> endOfInput() {
        return Parser.of((s, err, ok) -> {
            if (!s.remaining().isEmpty()) {
                return suspend(() -> err.apply(s, NO_CONTEXT, "end-of-input"));
            }
            if (s.isComplete()) {
                return suspend(() -> ok.apply(s, Unit.U));
            }
            return Parsers.<T>demandInput().unParser(s.speculate(),
                (s1, ctx, msg) -> suspend(() -> ok.apply(Input.merge(s, s1), Unit.U)),
                (s1, u) -> suspend(() -> err.apply(Input.merge(s, s1), NO_CONTEXT, "end-of-input")));
        });
    }

    /**
     * Returns {@code true} when the end of input is reached, {@code false}
     * otherwise.
     *
     * <p>This parser always succeeds.</p>
     */
    public static <T> TotalParser<T, Boolean> atEnd() {
        return Parsers.<T>wantInput().map(more -> !more);
    }
}
