/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.parsing.parser;

import com.google.common.collect.ImmutableList;

/**
 * The exception type represents a parse failure that reached the top
 * level. It is only raised at the API boundary, by
 * {@link Result#getOrThrow()}; inside the engine failures travel through
 * failure continuations.
 */
@SuppressWarnings("ExceptionClassNameDoesntEndWithException")
public class ParseError extends RuntimeException {
    private static final long serialVersionUID = 2741950203853317214L;

    private final ImmutableList<String> context;
    private final String reason;
    private final transient Tokens<?> remaining;

    public ParseError(ImmutableList<String> context, String reason, Tokens<?> remaining) {
        super(format(context, reason));
        this.context = context;
        this.reason = reason;
        this.remaining = remaining;
    }

    /**
     * Returns the failure-site labels, innermost first.
     */
    public ImmutableList<String> getContext() {
        return context;
    }

    /**
     * Returns the failure message without the context.
     */
    public String getReason() {
        return reason;
    }

    /**
     * Returns the input that was left unconsumed at the point of failure.
     */
    public Tokens<?> getRemaining() {
        return remaining;
    }

    private static String format(ImmutableList<String> context, String reason) {
        if (context.isEmpty()) {
            return reason;
        } else {
            return String.join(" > ", context) + ": " + reason;
        }
    }
}
