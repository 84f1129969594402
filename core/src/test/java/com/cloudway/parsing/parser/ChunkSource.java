/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.parsing.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * A chunk reader over a fixed list of character chunks that counts how
 * many chunks it delivered.
 */
final class ChunkSource implements Prompts.ChunkReader<Character> {
    private final Iterator<String> chunks;
    private int delivered;

    ChunkSource(String... chunks) {
        this(Arrays.asList(chunks));
    }

    ChunkSource(List<String> chunks) {
        this.chunks = new ArrayList<>(chunks).iterator();
    }

    @Override
    public Tokens<Character> read() {
        if (!chunks.hasNext()) {
            return null;
        }
        String chunk = chunks.next();
        if (!chunk.isEmpty()) {
            delivered++;
        }
        return Tokens.chars(chunk);
    }

    Prompt<Character> prompt() {
        return Prompts.from(this);
    }

    int delivered() {
        return delivered;
    }

    /**
     * Returns every way to split the given string into consecutive
     * non-empty chunks.
     */
    static List<List<String>> partitions(String s) {
        List<List<String>> result = new ArrayList<>();
        int cuts = s.length() - 1;
        for (int mask = 0; mask < (1 << Math.max(cuts, 0)); mask++) {
            List<String> parts = new ArrayList<>();
            int from = 0;
            for (int i = 0; i < cuts; i++) {
                if ((mask & (1 << i)) != 0) {
                    parts.add(s.substring(from, i + 1));
                    from = i + 1;
                }
            }
            parts.add(s.substring(from));
            result.add(parts);
        }
        return result;
    }

    /**
     * Runs a parser over the given chunks by feeding them one by one to the
     * suspended parser, then finishing it.
     */
    static <A> Result<Character, A> feedAll(ParserBase<Character, A> p, List<String> chunks) {
        Result<Character, A> r = Runner.parse(p, Tokens.<Character>empty());
        for (String chunk : chunks) {
            r = r.feed(Tokens.chars(chunk));
        }
        return r.finish();
    }
}
