/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.parsing.parser;

import com.cloudway.parsing.control.Trampoline;

/**
 * The parser is implemented as a function. It takes the current input
 * state and reports its outcome to exactly one of the two continuations.
 * It never calls onward synchronously in a way that grows the stack: the
 * returned trampoline carries the rest of the computation.
 *
 * @param <T> the token type
 * @param <A> the result type of the parser
 * @param <R> the final answer type of the whole run
 */
@FunctionalInterface
public interface ParseFunction<T, A, R> {
    Trampoline<R> apply(Input<T> input,
                        FailureContinuation<T, R> err,
                        SuccessContinuation<T, A, R> ok);
}
