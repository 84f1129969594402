/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.parsing.text;

import java.math.BigInteger;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Longs;
import com.cloudway.parsing.data.Unit;
import com.cloudway.parsing.parser.Parser;
import com.cloudway.parsing.parser.Parsers;
import com.cloudway.parsing.parser.TotalParser;

import static com.cloudway.parsing.parser.Parsers.satisfy;

// @formatter:off

/**
 * Lexical parsers over character tokens.
 */
public final class CharParsers {
    private CharParsers() {}

    /**
     * Matches any character.
     */
    public static Parser<Character, Character> anyChar() {
        return Parsers.anyToken();
    }

    /**
     * Matches only the given character.
     */
    public static Parser<Character, Character> chr(char c) {
        return satisfy((Character x) -> x == c).label("failed parser char: " + c);
    }

    /**
     * Matches any character in the given set.
     */
    public static Parser<Character, Character> chr(Set<Character> cs) {
        ImmutableSet<Character> set = ImmutableSet.copyOf(cs);
        return satisfy((Character x) -> set.contains(x)).label("failed parser char: " + set);
    }

    /**
     * Matches any character except the given one.
     */
    public static Parser<Character, Character> notChr(char c) {
        return satisfy((Character x) -> x != c).label(String.valueOf(c));
    }

    /**
     * Matches any character not in the given set.
     */
    public static Parser<Character, Character> notChr(Set<Character> cs) {
        ImmutableSet<Character> set = ImmutableSet.copyOf(cs);
        return satisfy((Character x) -> !set.contains(x)).label(set.toString());
    }

    /**
     * Succeeds if the current character is in the supplied list of
     * characters. Returns the parsed character.
     */
    public static Parser<Character, Character> oneOf(String cs) {
        return satisfy((Character c) -> cs.indexOf(c) != -1);
    }

    /**
     * As the dual of {@link #oneOf}, succeeds if the current character is
     * not in the supplied list of characters.
     */
    public static Parser<Character, Character> noneOf(String cs) {
        return satisfy((Character c) -> cs.indexOf(c) == -1);
    }

    /**
     * Matches a letter, as defined by {@link Character#isLetter(char)}.
     */
    public static Parser<Character, Character> letter() {
        return satisfy(Character::isLetter);
    }

    /**
     * Matches a digit, as defined by {@link Character#isDigit(char)}.
     */
    public static Parser<Character, Character> digit() {
        return satisfy(Character::isDigit);
    }

    /**
     * Matches a white space character, as defined by
     * {@link Character#isWhitespace(char)}.
     */
    public static Parser<Character, Character> whitespace() {
        return satisfy(Character::isWhitespace);
    }

    /**
     * Matches a space character.
     */
    public static Parser<Character, Character> space() {
        return chr(' ');
    }

    /**
     * Matches zero or more space characters.
     */
    public static TotalParser<Character, ImmutableList<Character>> spaces() {
        return space().many();
    }

    /**
     * Skips zero or more space characters.
     */
    public static TotalParser<Character, Unit> skipSpaces() {
        return Parsers.skipWhile((Character c) -> c == ' ');
    }

    /**
     * Skips zero or more white space characters.
     */
    public static TotalParser<Character, Unit> skipWhitespaces() {
        return Parsers.skipWhile(Character::isWhitespace);
    }

    /**
     * Matches a word, that is one or more letters.
     */
    public static Parser<Character, String> word() {
        return letter().many1().map(CharParsers::join);
    }

    /**
     * Matches the characters of the given string. Consumes no input if it
     * fails.
     */
    public static Parser<Character, String> string(String s) {
        return Parsers.string(s);
    }

    /**
     * Matches a decimal number: one or more digits, optionally followed by a
     * dot and zero or more digits. Returns a {@code Long}, a
     * {@code BigInteger} if the integral value does not fit in a long, or a
     * {@code Double} if the number has a fractional part.
     */
    public static Parser<Character, Number> number() {
        return doubleOrLong().map(CharParsers::readNumber);
    }

    private static Parser<Character, ImmutableList<Character>> doubleOrLong() {
        return digit().bind(h ->
            digitOrDot().option(ImmutableList.of()).map(t -> cons(h, t)));
    }

    private static Parser<Character, ImmutableList<Character>> digitOrDot() {
        return digit().or(chr('.')).bind(h -> {
            if (h == '.') {
                return digit().many().map(t -> cons(h, t));
            } else {
                return Parsers.delay(CharParsers::digitOrDot)
                    .option(ImmutableList.of())
                    .map(t -> cons(h, t));
            }
        });
    }

    private static ImmutableList<Character> cons(Character h, ImmutableList<Character> t) {
        return ImmutableList.<Character>builder().add(h).addAll(t).build();
    }

    private static Number readNumber(ImmutableList<Character> cs) {
        String s = join(cs);
        if (s.indexOf('.') >= 0) {
            return Double.valueOf(s);
        }
        Long n = Longs.tryParse(s);
        return n != null ? n : new BigInteger(s);
    }

    /**
     * Matches an end of line, either {@code "\n"} or {@code "\r\n"}.
     */
    public static Parser<Character, Unit> eol() {
        return chr('\n').then(Parsers.<Character, Unit>pure(Unit.U))
            .or(string("\r\n").then(Parsers.<Character, Unit>pure(Unit.U)));
    }

    private static String join(ImmutableList<Character> cs) {
        StringBuilder sb = new StringBuilder(cs.size());
        for (Character c : cs) {
            sb.append(c.charValue());
        }
        return sb.toString();
    }
}
