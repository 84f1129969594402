/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.parsing.parser;

import com.cloudway.parsing.control.Trampoline;

/**
 * Receives the value produced by a successful parsing step.
 *
 * @param <T> the token type
 * @param <A> the result type of the step
 * @param <R> the final answer type of the whole run
 */
@FunctionalInterface
public interface SuccessContinuation<T, A, R> {
    Trampoline<R> apply(Input<T> input, A value);
}
