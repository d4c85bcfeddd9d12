package com.gs.ep.pdftranslator.cache;

import com.gs.ep.pdftranslator.config.TranslationConfig;

import java.io.IOException;

/**
 * Opens the store selected by {@code cache.store}: file, redis or none.
 */
public final class CacheStores {

    private CacheStores() {
    }

    public static CacheStore open(TranslationConfig config) throws IOException {
        String kind = config.getCacheStore().trim().toLowerCase();
        switch (kind) {
            case "file":
                return new H2CacheStore(config.getCachePath());
            case "redis":
                return new RedisCacheStore(config);
            case "none":
                return new NoCacheStore();
            default:
                throw new IllegalArgumentException("Unknown cache store: " + kind);
        }
    }
}
