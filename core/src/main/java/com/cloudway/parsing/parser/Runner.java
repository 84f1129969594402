/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.parsing.parser;

import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.cloudway.parsing.control.Trampoline;

import static java.util.Objects.requireNonNull;

/**
 * Entry points that run a parser over some input.
 *
 * <p>Every entry point drives the parser on a trampoline loop, so stack
 * usage does not depend on the length of the input.</p>
 */
public final class Runner {
    private Runner() {}

    private static final Logger logger = Logger.getLogger(Runner.class.getName());

    /**
     * Runs a parser from the given input state, reporting the outcome to one
     * of the given continuations. The value produced by the continuation is
     * returned.
     *
     * @param p the parser to run
     * @param input the initial input state
     * @param err the continuation that receives a failure
     * @param ok the continuation that receives a success
     */
    public static <T, A, R> R run(ParserBase<T, A> p, Input<T> input,
                                  FailureContinuation<T, R> err,
                                  SuccessContinuation<T, A, R> ok) {
        return p.unParser(input, err, ok).run();
    }

    /**
     * Runs a parser over the given initial chunk, asking the prompt whenever
     * more input is needed.
     *
     * @param p the parser to run
     * @param prompt the source of further input
     * @param chunk the initially buffered input
     * @param more whether more input may arrive beyond the initial chunk
     */
    public static <T, A> Result<T, A> parse(ParserBase<T, A> p, Prompt<T> prompt, Tokens<T> chunk, More more) {
        Level level = ParsingConfig.getDefault().isTrace() ? Level.INFO : Level.FINE;
        if (logger.isLoggable(level)) {
            logger.log(level, "Start parsing with " + chunk.size() + " tokens, " + more);
        }

        Result<T, A> result = run(p, Input.of(chunk, more, prompt),
            (s, ctx, msg) -> Trampoline.<Result<T, A>>immediate(new Result.Fail<>(s, ctx, msg)),
            (s, x) -> Trampoline.<Result<T, A>>immediate(new Result.Done<>(s, x)));

        if (logger.isLoggable(level)) {
            logger.log(level, "Parser returned " + result);
        }
        return result;
    }

    /**
     * Runs a parser on a prompt that blocks until the source delivers more
     * input. The result is never {@link Result.Partial}.
     */
    public static <T, A> Result<T, A> parse(ParserBase<T, A> p, Prompt<T> prompt) {
        return parse(p, prompt, Tokens.empty(), More.INCOMPLETE);
    }

    /**
     * Runs a parser over the first chunk of an incremental input. If the
     * parser needs more input the result is a {@link Result.Partial}, which
     * must be fed further chunks with {@link Result#feed}, or told about the
     * end of input with {@link Result#finish}.
     */
    public static <T, A> Result<T, A> parse(ParserBase<T, A> p, Tokens<T> chunk) {
        return parse(p, Prompts.suspending(), chunk, More.INCOMPLETE);
    }

    /**
     * Runs a parser over an incremental input, calling the refill function
     * every time the parser needs more input. The refill function returns an
     * empty sequence at the end of input.
     */
    public static <T, A> Result<T, A> parseWith(ParserBase<T, A> p, Supplier<Tokens<T>> refill, Tokens<T> chunk) {
        requireNonNull(refill);
        Result<T, A> result = parse(p, chunk);
        while (result.isPartial()) {
            result = result.feed(refill.get());
        }
        return result;
    }

    /**
     * Runs a parser over a complete input. The result is never
     * {@link Result.Partial}.
     */
    public static <T, A> Result<T, A> parseOnly(ParserBase<T, A> p, Tokens<T> input) {
        return parse(p, Prompts.noMoreInput(), input, More.COMPLETE);
    }

    /**
     * Runs a character parser over a complete string.
     */
    public static <A> Result<Character, A> parseOnly(ParserBase<Character, A> p, String input) {
        return parseOnly(p, Tokens.chars(input));
    }
}
