/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.parsing.parser;

import com.google.common.collect.ImmutableList;

import com.cloudway.parsing.control.Trampoline;

/**
 * Receives the outcome of a parsing step that did not succeed.
 *
 * @param <T> the token type
 * @param <R> the final answer type of the whole run
 */
@FunctionalInterface
public interface FailureContinuation<T, R> {
    /**
     * Continue after a failure.
     *
     * @param input the input state at the point of failure
     * @param context the failure-site labels, innermost first
     * @param message the failure message
     */
    Trampoline<R> apply(Input<T> input, ImmutableList<String> context, String message);
}
