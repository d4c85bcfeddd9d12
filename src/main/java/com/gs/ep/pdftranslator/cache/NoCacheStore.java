package com.gs.ep.pdftranslator.cache;

import java.util.Optional;

/**
 * Store used when caching is switched off: nothing is kept.
 */
public class NoCacheStore implements CacheStore {

    @Override
    public Optional<String> find(String engine, String params, String originalText) {
        return Optional.empty();
    }

    @Override
    public void upsert(String engine, String params, String originalText, String translation) {
    }

    @Override
    public long count() {
        return 0;
    }

    @Override
    public void clear() {
    }

    @Override
    public void close() {
    }
}
