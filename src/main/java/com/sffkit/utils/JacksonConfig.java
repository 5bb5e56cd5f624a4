/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared ObjectMapper instances. ObjectMapper is thread-safe after configuration,
 * so a single instance can be reused across the application.
 */
public final class JacksonConfig {

    private static final ObjectMapper INSTANCE = new ObjectMapper();

    private static final ObjectMapper PRETTY_INSTANCE = new ObjectMapper();

    static {
        INSTANCE.registerModule(new JavaTimeModule());
        INSTANCE.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        PRETTY_INSTANCE.registerModule(new JavaTimeModule());
        PRETTY_INSTANCE.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        PRETTY_INSTANCE.enable(SerializationFeature.INDENT_OUTPUT);
    }

    private JacksonConfig() {}

    /** Compact ObjectMapper, ISO-8601 dates. */
    public static ObjectMapper mapper() {
        return INSTANCE;
    }

    /** Indented ObjectMapper for archive summaries printed to the console. */
    public static ObjectMapper prettyMapper() {
        return PRETTY_INSTANCE;
    }
}
