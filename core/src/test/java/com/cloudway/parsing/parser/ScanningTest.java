/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.parsing.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import static org.junit.Assert.*;

import com.cloudway.parsing.data.Unit;

import static com.cloudway.parsing.parser.Parsers.*;

// @formatter:off

public class ScanningTest {
    private static Parser<Character, String> lettersThenDigits() {
        return Parsers.<Character>takeWhile(Character::isLetter).bind(a ->
               Parsers.<Character>takeWhile(Character::isDigit).map(d ->
               Tokens.asString(a) + "|" + Tokens.asString(d)));
    }

    @Test
    public void takeWhileAcrossTwoChunks() {
        ChunkSource src = new ChunkSource("ab", "cd");
        Result<Character, Tokens<Character>> r = Runner.parse(Parsers.<Character>takeWhile(Character::isLetter), src.prompt());
        assertEquals("abcd", Tokens.asString(r.getOrThrow()));
        assertTrue(r.remaining().isEmpty());
        assertEquals(2, src.delivered());
    }

    @Test
    public void takeWhileSuspendsBetweenChunks() {
        Result<Character, Tokens<Character>> r = Runner.parse(Parsers.<Character>takeWhile(Character::isLetter), Tokens.chars("ab"));
        assertTrue(r.isPartial());
        r = r.feed(Tokens.chars("cd"));
        assertTrue(r.isPartial());
        r = r.finish();
        assertEquals("abcd", Tokens.asString(r.getOrThrow()));
    }

    @Test
    public void takeWhileIsIndependentOfChunking() {
        for (List<String> chunks : ChunkSource.partitions("abc12def")) {
            Result<Character, String> r = ChunkSource.feedAll(lettersThenDigits(), chunks);
            assertEquals(chunks.toString(), "abc|12", r.getOrThrow());
            assertEquals(chunks.toString(), "def", Tokens.asString(r.remaining()));
        }
    }

    @Test
    public void takeWhileStopsWithinChunk() {
        Result<Character, Tokens<Character>> r = Runner.parse(Parsers.<Character>takeWhile(Character::isLetter), Tokens.chars("ab1"));
        assertTrue(r.isDone());
        assertEquals("ab", Tokens.asString(r.getOrThrow()));
        assertEquals("1", Tokens.asString(r.remaining()));
    }

    @Test
    public void takeWhileOnEmptyInput() {
        assertTrue(Runner.parseOnly(Parsers.<Character>takeWhile(Character::isLetter), "").getOrThrow().isEmpty());
        assertTrue(Runner.parseOnly(Parsers.<Character>takeWhile(Character::isLetter), "1").getOrThrow().isEmpty());
    }

    @Test
    public void takeTillStopsAtMatch() {
        Result<Character, Tokens<Character>> r = Runner.parseOnly(takeTill((Character c) -> c == ';'), "ab;c");
        assertEquals("ab", Tokens.asString(r.getOrThrow()));
        assertEquals(";c", Tokens.asString(r.remaining()));
    }

    @Test
    public void skipWhileAcrossChunks() {
        for (List<String> chunks : ChunkSource.partitions("   x ")) {
            Result<Character, Unit> r = ChunkSource.feedAll(skipWhile((Character c) -> c == ' '), chunks);
            assertEquals(Unit.U, r.getOrThrow());
            assertEquals(chunks.toString(), "x ", Tokens.asString(r.remaining()));
        }
    }

    @Test
    public void takeWhile1RequiresOneMatch() {
        Result.Fail<Character, Tokens<Character>> f =
            (Result.Fail<Character, Tokens<Character>>)Runner.parseOnly(Parsers.<Character>takeWhile1(Character::isDigit), "abc");
        assertEquals("take-while1", f.message());
        assertEquals("abc", Tokens.asString(f.remaining()));

        f = (Result.Fail<Character, Tokens<Character>>)Runner.parseOnly(Parsers.<Character>takeWhile1(Character::isDigit), "");
        assertEquals("not enough input", f.message());
    }

    @Test
    public void takeWhile1DemandsFirstChunk() {
        ChunkSource src = new ChunkSource("12", "34", "x");
        Result<Character, Tokens<Character>> r = Runner.parse(Parsers.<Character>takeWhile1(Character::isDigit), src.prompt());
        assertEquals("1234", Tokens.asString(r.getOrThrow()));
        assertEquals("x", Tokens.asString(r.remaining()));
    }

    @Test
    public void takeWhile1StopsWithoutFurtherInput() {
        // the run ends inside the buffer, so no more input is requested
        Result<Character, Tokens<Character>> r = Runner.parse(Parsers.<Character>takeWhile1(Character::isDigit), Tokens.chars("12a"));
        assertTrue(r.isDone());
        assertEquals("12", Tokens.asString(r.getOrThrow()));
    }

    @Test
    public void takeRestGroupsByDelivery() {
        Result<Character, ImmutableList<Tokens<Character>>> r =
            Runner.parse(Parsers.<Character>takeRest(), Tokens.chars("ab"));
        r = r.feed(Tokens.chars("cd")).feed(Tokens.chars("e")).finish();
        assertEquals(ImmutableList.of(Tokens.chars("ab"), Tokens.chars("cd"), Tokens.chars("e")), r.getOrThrow());
        assertTrue(r.remaining().isEmpty());
    }

    @Test
    public void takeRestNeverFails() {
        assertEquals(ImmutableList.of(), Runner.parseOnly(Parsers.<Character>takeRest(), "").getOrThrow());
        assertEquals(ImmutableList.of(Tokens.chars("abc")),
                     Runner.parseOnly(Parsers.<Character>takeRest(), "abc").getOrThrow());
    }

    @Test
    public void endOfInput() {
        assertTrue(Runner.parseOnly(Parsers.<Character>endOfInput(), "").isDone());

        Result.Fail<Character, Unit> f =
            (Result.Fail<Character, Unit>)Runner.parseOnly(Parsers.<Character>endOfInput(), "a");
        assertEquals("end-of-input", f.message());
        assertEquals("a", Tokens.asString(f.remaining()));
    }

    @Test
    public void endOfInputProbeIsDeterministic() {
        Result<Character, Unit> r = Runner.parse(Parsers.<Character>endOfInput(), Tokens.<Character>empty());
        assertTrue(r.isPartial());

        // the same suspension may be resumed either way
        Result<Character, Unit> failed = r.feed(Tokens.chars("x"));
        Result<Character, Unit> done = r.finish();
        assertTrue(failed.isFail());
        assertEquals("x", Tokens.asString(failed.remaining()));
        assertTrue(done.isDone());

        assertTrue(r.feed(Tokens.chars("y")).isFail());
        assertTrue(r.finish().isDone());
    }

    @Test
    public void chunkPulledByProbeStaysVisible() {
        ChunkSource src = new ChunkSource("z");
        Parser<Character, String> p = Parsers.<Character>endOfInput().map(u -> "end")
            .or(Parsers.<Character>anyToken().map(String::valueOf));
        assertEquals("z", Runner.parse(p, src.prompt()).getOrThrow());
        assertEquals(1, src.delivered());

        assertEquals("end", Runner.parse(p, new ChunkSource().prompt()).getOrThrow());
    }

    @Test
    public void atEnd() {
        assertTrue(Runner.parseOnly(Parsers.<Character>atEnd(), "").getOrThrow());
        assertFalse(Runner.parseOnly(Parsers.<Character>atEnd(), "a").getOrThrow());

        ChunkSource src = new ChunkSource("a");
        Result<Character, Boolean> r = Runner.parse(Parsers.<Character>atEnd(), src.prompt());
        assertFalse(r.getOrThrow());
        assertEquals("a", Tokens.asString(r.remaining()));
    }

    @Test
    public void longInputRunsInConstantStack() {
        String input = Strings.repeat(" ", 1_000_000) + "x";
        Parser<Character, Character> p = skipWhile((Character c) -> c == ' ')
            .then(Parsers.<Character>anyToken())
            .before(Parsers.<Character>endOfInput());
        assertEquals(Character.valueOf('x'), Runner.parseOnly(p, input).getOrThrow());
    }

    @Test
    public void manySmallChunksRunInConstantStack() {
        int n = 100_000;
        ChunkSource src = new ChunkSource(Collections.nCopies(n, "a"));
        Result<Character, Tokens<Character>> r = Runner.parse(Parsers.<Character>takeWhile(Character::isLetter), src.prompt());
        assertEquals(n, r.getOrThrow().size());
        assertEquals(n, src.delivered());
    }

    @Test
    public void manyRepetitionsRunInConstantStack() {
        int n = 200_000;
        List<String> chunks = new ArrayList<>();
        chunks.add(Strings.repeat("a", n / 2));
        chunks.add(Strings.repeat("a", n / 2));
        ChunkSource src = new ChunkSource(chunks);
        Result<Character, ImmutableList<Character>> r =
            Runner.parse(satisfy((Character c) -> c == 'a').many(), src.prompt());
        assertEquals(n, r.getOrThrow().size());
    }
}
