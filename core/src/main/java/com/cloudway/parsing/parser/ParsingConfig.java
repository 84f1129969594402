/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.parsing.parser;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Optional;
import java.util.Properties;

import com.google.common.base.MoreObjects;
import com.google.common.primitives.Ints;

/**
 * The parsing configuration. Properties are read from the
 * {@code cloudway-parsing.properties} resource on the class path and may be
 * overridden by system properties of the same name.
 */
public final class ParsingConfig
{
    public static final String RESOURCE_NAME = "/cloudway-parsing.properties";

    public static final String CHUNK_SIZE_KEY = "cloudway.parsing.chunkSize";
    public static final int DEFAULT_CHUNK_SIZE = 8192;
    public static final String TRACE_KEY = "cloudway.parsing.trace";

    private static final class DefaultHolder {
        static final ParsingConfig INSTANCE = new ParsingConfig(loadResource());
    }

    private final Properties props;

    public ParsingConfig(Properties props) {
        this.props = props;
    }

    public static ParsingConfig getDefault() {
        return DefaultHolder.INSTANCE;
    }

    private static Properties loadResource() {
        Properties props = new Properties();
        try (InputStream in = ParsingConfig.class.getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return props;
    }

    public Optional<String> get(String name) {
        Optional<String> val = Optional.ofNullable(System.getProperty(name));
        return val.isPresent() ? val : Optional.ofNullable(props.getProperty(name));
    }

    public String get(String name, String deflt) {
        return get(name).orElse(deflt);
    }

    public boolean getBoolean(String name, boolean deflt) {
        return get(name).map(s -> Boolean.valueOf(s.trim())).orElse(deflt);
    }

    public int getInt(String name, int deflt) {
        return get(name).map(s -> Ints.tryParse(s.trim())).orElse(deflt);
    }

    /**
     * Returns the chunk size used by reader and stream prompts.
     */
    public int getChunkSize() {
        int size = getInt(CHUNK_SIZE_KEY, DEFAULT_CHUNK_SIZE);
        return size > 0 ? size : DEFAULT_CHUNK_SIZE;
    }

    /**
     * Returns {@code true} if parser suspensions are logged at {@code INFO}
     * rather than {@code FINE}.
     */
    public boolean isTrace() {
        return getBoolean(TRACE_KEY, false);
    }

    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("chunkSize", getChunkSize())
            .add("trace", isTrace())
            .toString();
    }
}
