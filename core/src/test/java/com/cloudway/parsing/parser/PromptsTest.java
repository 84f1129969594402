/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.parsing.parser;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.function.Function;
import java.util.function.Supplier;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import static org.junit.Assert.*;

import com.cloudway.parsing.control.Trampoline;

// @formatter:off

public class PromptsTest {
    @Test
    public void readerDeliversChunksOfGivenSize() {
        Result<Character, ImmutableList<Tokens<Character>>> r =
            Runner.parse(Parsers.<Character>takeRest(), Prompts.from(new StringReader("abcdefg"), 3));
        assertEquals(ImmutableList.of(Tokens.chars("abc"), Tokens.chars("def"), Tokens.chars("g")), r.getOrThrow());
    }

    @Test
    public void readerWithDefaultChunkSize() {
        Result<Character, String> r = Runner.parse(Parsers.string("hello"), Prompts.from(new StringReader("hello")));
        assertEquals("hello", r.getOrThrow());
    }

    @Test
    public void iteratorSkipsEmptyChunks() {
        ImmutableList<Tokens<Character>> chunks = ImmutableList.of(
            Tokens.<Character>empty(), Tokens.chars("ab"), Tokens.<Character>empty(), Tokens.chars("c"));
        Result<Character, ImmutableList<Tokens<Character>>> r =
            Runner.parse(Parsers.<Character>takeRest(), Prompts.from(chunks.iterator()));
        assertEquals(ImmutableList.of(Tokens.chars("ab"), Tokens.chars("c")), r.getOrThrow());
    }

    @Test
    public void inputStreamDeliversBytes() {
        byte[] data = {1, 2, 3};
        Result<Byte, ImmutableList<Tokens<Byte>>> r =
            Runner.parse(Parsers.<Byte>takeRest(), Prompts.from(new ByteArrayInputStream(data), 2));
        assertEquals(ImmutableList.of(Tokens.bytes(new byte[] {1, 2}), Tokens.bytes(new byte[] {3})), r.getOrThrow());
    }

    @Test
    public void byteParsing() {
        byte[] data = {0x7f, 'E', 'L', 'F', 2};
        Parser<Byte, Tokens<Byte>> magic = Parsers.tokens(ImmutableList.of((byte)0x7f, (byte)'E', (byte)'L', (byte)'F'));
        Result<Byte, Byte> r = Runner.parse(magic.then(Parsers.<Byte>anyToken()),
                                            Prompts.from(new ByteArrayInputStream(data), 1));
        assertEquals(Byte.valueOf((byte)2), r.getOrThrow());
    }

    @Test(expected = UncheckedIOException.class)
    public void readFailureIsRethrown() {
        Reader broken = new Reader() {
            @Override
            public int read(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("connection reset");
            }

            @Override
            public void close() {}
        };
        Runner.parse(Parsers.<Character>anyToken(), Prompts.from(broken, 4));
    }

    @Test
    public void noMoreInputFailsDemand() {
        Result<Character, Character> r = Runner.parse(Parsers.<Character>anyToken(),
            Prompts.<Character>noMoreInput(), Tokens.<Character>empty(), More.INCOMPLETE);
        assertEquals("not enough input", ((Result.Fail<Character, Character>)r).message());
        assertTrue(((Result.Fail<Character, Character>)r).input().isComplete());
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyChunkFromPromptIsRejected() {
        Prompt<Character> bad = new Prompt<Character>() {
            @Override
            public <R> Trampoline<R> request(Input<Character> input,
                                             Supplier<Trampoline<R>> noMoreInput,
                                             Function<Tokens<Character>, Trampoline<R>> newChunk) {
                return newChunk.apply(Tokens.<Character>empty());
            }
        };
        Runner.parse(Parsers.<Character>anyToken(), bad);
    }

    @Test(expected = IllegalArgumentException.class)
    public void chunkSizeMustBePositive() {
        Prompts.from(new StringReader("x"), 0);
    }
}
