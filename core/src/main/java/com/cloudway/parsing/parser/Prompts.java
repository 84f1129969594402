/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.parsing.parser;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.cloudway.parsing.control.Trampoline;

import static com.cloudway.parsing.control.Trampoline.suspend;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Static factories for the common {@link Prompt} implementations.
 */
public final class Prompts {
    private Prompts() {}

    private static final Logger logger = Logger.getLogger(Prompts.class.getName());

    /**
     * Reads the next chunk from an input source.
     *
     * @param <T> the token type
     */
    @FunctionalInterface
    public interface ChunkReader<T> {
        /**
         * Returns the next chunk, or {@code null} at the end of input. An
         * empty chunk is skipped.
         */
        Tokens<T> read() throws IOException;
    }

    private static final Prompt<?> NO_MORE_INPUT = new Prompt<Object>() {
        @Override
        public <R> Trampoline<R> request(Input<Object> input,
                                         Supplier<Trampoline<R>> noMoreInput,
                                         Function<Tokens<Object>, Trampoline<R>> newChunk) {
            return noMoreInput.get();
        }
    };

    /**
     * Returns a prompt that always reports the end of input.
     */
    @SuppressWarnings("unchecked")
    public static <T> Prompt<T> noMoreInput() {
        return (Prompt<T>)NO_MORE_INPUT;
    }

    private static final Prompt<?> SUSPENDING = new Prompt<Object>() {
        @Override
        @SuppressWarnings("unchecked")
        public <R> Trampoline<R> request(Input<Object> input,
                                         Supplier<Trampoline<R>> noMoreInput,
                                         Function<Tokens<Object>, Trampoline<R>> newChunk) {
            Result<Object, Object> partial = new Result.Partial<>(
                (Supplier<Trampoline<Result<Object, Object>>>)(Supplier<?>)noMoreInput,
                (Function<Tokens<Object>, Trampoline<Result<Object, Object>>>)(Function<?, ?>)newChunk);
            return Trampoline.immediate((R)partial);
        }
    };

    /**
     * Returns a prompt that suspends the whole computation, handing control
     * back to the caller as a {@link Result.Partial}. The caller resumes it
     * with {@link Result#feed} or {@link Result#finish}.
     *
     * <p>This prompt can only be used by runs whose final answer is a
     * {@link Result}, as is the case for every {@link Runner} entry point
     * that returns one.</p>
     */
    @SuppressWarnings("unchecked")
    public static <T> Prompt<T> suspending() {
        return (Prompt<T>)SUSPENDING;
    }

    /**
     * Returns a prompt that pulls chunks from the given source, blocking the
     * parser until the source delivers.
     */
    public static <T> Prompt<T> from(ChunkReader<T> source) {
        requireNonNull(source);
        return new Prompt<T>() {
            @Override
            public <R> Trampoline<R> request(Input<T> input,
                                             Supplier<Trampoline<R>> noMoreInput,
                                             Function<Tokens<T>, Trampoline<R>> newChunk) {
                Tokens<T> chunk;
                do {
                    try {
                        chunk = source.read();
                    } catch (IOException ex) {
                        logger.log(Level.WARNING, "Failed to read input", ex);
                        throw new UncheckedIOException(ex);
                    }
                } while (chunk != null && chunk.isEmpty());

                if (chunk == null) {
                    logger.fine("End of input reached");
                    return suspend(noMoreInput);
                }
                if (logger.isLoggable(Level.FINEST)) {
                    logger.finest("Received chunk of " + chunk.size() + " tokens");
                }
                Tokens<T> next = chunk;
                return suspend(() -> newChunk.apply(next));
            }
        };
    }

    /**
     * Returns a prompt that pulls chunks from the given iterator.
     */
    public static <T> Prompt<T> from(Iterator<Tokens<T>> chunks) {
        requireNonNull(chunks);
        return from(() -> chunks.hasNext() ? chunks.next() : null);
    }

    /**
     * Returns a prompt that reads characters from the given reader, in chunks
     * of the configured size.
     *
     * @see ParsingConfig#getChunkSize()
     */
    public static Prompt<Character> from(Reader reader) {
        return from(reader, ParsingConfig.getDefault().getChunkSize());
    }

    /**
     * Returns a prompt that reads characters from the given reader, in chunks
     * of at most the given size.
     */
    public static Prompt<Character> from(Reader reader, int chunkSize) {
        requireNonNull(reader);
        checkArgument(chunkSize > 0, "chunk size must be positive: %s", chunkSize);
        char[] buf = new char[chunkSize];
        return from(() -> {
            int n = reader.read(buf);
            return n < 0 ? null : Tokens.chars(buf, 0, n);
        });
    }

    /**
     * Returns a prompt that reads bytes from the given stream, in chunks of
     * the configured size.
     *
     * @see ParsingConfig#getChunkSize()
     */
    public static Prompt<Byte> from(InputStream in) {
        return from(in, ParsingConfig.getDefault().getChunkSize());
    }

    /**
     * Returns a prompt that reads bytes from the given stream, in chunks of
     * at most the given size.
     */
    public static Prompt<Byte> from(InputStream in, int chunkSize) {
        requireNonNull(in);
        checkArgument(chunkSize > 0, "chunk size must be positive: %s", chunkSize);
        byte[] buf = new byte[chunkSize];
        return from(() -> {
            int n = in.read(buf);
            return n < 0 ? null : Tokens.bytes(buf, 0, n);
        });
    }
}
