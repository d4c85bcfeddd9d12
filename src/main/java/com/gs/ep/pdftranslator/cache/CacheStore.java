package com.gs.ep.pdftranslator.cache;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * Persistent backing store of {@link TranslationCache}. One row per
 * (engine, params, original text) key; writing an existing key replaces it.
 * Implementations must allow concurrent readers and writers.
 */
public interface CacheStore extends Closeable {

    Optional<String> find(String engine, String params, String originalText) throws IOException;

    void upsert(String engine, String params, String originalText, String translation) throws IOException;

    /**
     * Number of rows currently stored.
     */
    long count() throws IOException;

    /**
     * Deletes every row.
     */
    void clear() throws IOException;

    @Override
    void close() throws IOException;
}
