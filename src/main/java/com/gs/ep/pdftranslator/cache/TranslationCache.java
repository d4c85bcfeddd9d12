package com.gs.ep.pdftranslator.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Memo of translations keyed by engine, engine parameters and original text.
 *
 * <p>
 * The parameters are reduced to a canonical JSON fingerprint: maps at any depth,
 * including maps held in lists, are sorted by key before serialization, so two
 * parameter maps with the same content always hit the same rows.
 * </p>
 *
 * <p>
 * Store failures never reach the caller: a failed read is a miss and a failed
 * write is logged and dropped.
 * </p>
 */
public class TranslationCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationCache.class);
    public static final int MAX_ENGINE_LENGTH = 20;

    private final String engine;
    private final CacheStore store;
    private final boolean ignoreReads;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Object paramsLock = new Object();
    private Map<String, Object> params = new TreeMap<>();
    private volatile String fingerprint;

    public TranslationCache(String engine, Map<String, ?> params, CacheStore store) {
        this(engine, params, store, false);
    }

    /**
     * @param ignoreReads when true every lookup misses, but new translations are still stored
     */
    public TranslationCache(String engine, Map<String, ?> params, CacheStore store, boolean ignoreReads) {
        if (engine == null || engine.isEmpty()) {
            throw new IllegalArgumentException("Cache engine name must not be empty");
        }
        if (engine.length() > MAX_ENGINE_LENGTH) {
            throw new IllegalArgumentException(
                    "Cache engine name longer than " + MAX_ENGINE_LENGTH + " characters: " + engine);
        }
        this.engine = engine;
        this.store = store;
        this.ignoreReads = ignoreReads;
        replaceParams(params);
    }

    public String getEngine() {
        return engine;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public Optional<String> get(String originalText) {
        if (ignoreReads) {
            return Optional.empty();
        }
        try {
            return store.find(engine, fingerprint, originalText);
        } catch (IOException | RuntimeException e) {
            LOGGER.debug("Cache lookup failed for engine {}, treating as miss: {}", engine, e.getMessage());
            return Optional.empty();
        }
    }

    public void set(String originalText, String translation) {
        try {
            store.upsert(engine, fingerprint, originalText, translation);
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Dropping cache write for engine {}: {}", engine, e.getMessage());
        }
    }

    public void replaceParams(Map<String, ?> newParams) {
        synchronized (paramsLock) {
            params = new TreeMap<>();
            if (newParams != null) {
                params.putAll(newParams);
            }
            refreshFingerprint();
        }
    }

    public void updateParams(Map<String, ?> moreParams) {
        if (moreParams == null) {
            return;
        }
        synchronized (paramsLock) {
            params.putAll(moreParams);
            refreshFingerprint();
        }
    }

    /**
     * Adds one parameter. Values Jackson cannot serialize are stored as their
     * {@code toString()}.
     */
    public void addParam(String key, Object value) {
        Object stored = value;
        try {
            objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            stored = String.valueOf(value);
        }
        synchronized (paramsLock) {
            params.put(key, stored);
            refreshFingerprint();
        }
    }

    private void refreshFingerprint() {
        try {
            fingerprint = objectMapper.writeValueAsString(canonicalize(params));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cache parameters are not serializable: " + params, e);
        }
    }

    static Object canonicalize(Object value) {
        if (value instanceof Map) {
            Map<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                sorted.put(String.valueOf(entry.getKey()), canonicalize(entry.getValue()));
            }
            return sorted;
        }
        if (value instanceof Collection) {
            List<Object> items = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                items.add(canonicalize(item));
            }
            return items;
        }
        return value;
    }

    /**
     * Read-only view of the current parameters.
     */
    public Map<String, Object> getParams() {
        synchronized (paramsLock) {
            return Collections.unmodifiableMap(new TreeMap<>(params));
        }
    }

    public long size() throws IOException {
        return store.count();
    }

    public void clear() throws IOException {
        store.clear();
    }
}
