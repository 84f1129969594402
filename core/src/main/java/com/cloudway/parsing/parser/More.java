/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.parsing.parser;

/**
 * Tells whether more input may still arrive after the tokens that are
 * currently buffered.
 */
public enum More {
    /**
     * No further chunks will ever arrive.
     */
    COMPLETE,

    /**
     * More chunks may arrive on demand.
     */
    INCOMPLETE;

    /**
     * Combines two observations of the same stream. Once a stream has been
     * seen complete it stays complete.
     */
    public More plus(More other) {
        return this == COMPLETE || other == COMPLETE ? COMPLETE : INCOMPLETE;
    }
}
