/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.parsing.parser;

import java.util.function.Function;
import java.util.function.Supplier;

import com.cloudway.parsing.control.Trampoline;

/**
 * The hook the engine calls when a parser needs more input than is
 * currently buffered and the stream is not yet complete.
 *
 * <p>An implementation must invoke exactly one of the two continuations,
 * exactly once. {@code noMoreInput} marks the stream complete;
 * {@code newChunk} must be given a non-empty chunk which is appended to
 * the remaining input. The implementation may block, return buffered data,
 * or hand the continuations to an outer driver (see
 * {@link Prompts#suspending()}); the engine imposes no threading
 * requirement.</p>
 *
 * @param <T> the token type
 */
public interface Prompt<T> {
    /**
     * Requests more input.
     *
     * @param input the input state at the point of the request
     * @param noMoreInput the continuation to call if the stream has ended
     * @param newChunk the continuation to call with a newly arrived chunk
     * @return the rest of the computation
     */
    <R> Trampoline<R> request(Input<T> input,
                              Supplier<Trampoline<R>> noMoreInput,
                              Function<Tokens<T>, Trampoline<R>> newChunk);
}
