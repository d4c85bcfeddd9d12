package com.gs.ep.pdftranslator.translate;

import com.gs.ep.pdftranslator.cache.TranslationCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Translates one run of page text: cache first, then the backend with retries.
 *
 * <p>
 * Retryable failures are retried up to {@code retries} more times with a linear
 * backoff. When the backend still fails the result is empty and the caller keeps
 * the original text, unless strict mode is on, in which case a
 * {@link TranslationException} is thrown.
 * </p>
 */
public class SpanTranslator {
    private static final Logger LOGGER = LoggerFactory.getLogger(SpanTranslator.class);

    private final Translator translator;
    private final TranslationCache cache;
    private final int retries;
    private final long backoffMillis;
    private final boolean strict;

    private final AtomicInteger cacheHits = new AtomicInteger();
    private final AtomicInteger translated = new AtomicInteger();
    private final AtomicInteger failures = new AtomicInteger();

    public SpanTranslator(Translator translator, TranslationCache cache, int retries, long backoffMillis,
            boolean strict) {
        this.translator = translator;
        this.cache = cache;
        this.retries = Math.max(0, retries);
        this.backoffMillis = Math.max(0, backoffMillis);
        this.strict = strict;
    }

    public Optional<String> translate(String text) throws TranslationException {
        Optional<String> cached = cache.get(text);
        if (cached.isPresent()) {
            cacheHits.incrementAndGet();
            return cached;
        }

        TranslationResult result = translator.translate(text);
        int attempt = 0;
        while (result.isRetryable() && attempt < retries) {
            attempt++;
            LOGGER.debug("Retrying {} translation ({}/{}): {}", translator.getName(), attempt, retries,
                    result.getError());
            if (!sleep(backoffMillis * attempt)) {
                break;
            }
            result = translator.translate(text);
        }

        if (result.isSuccess()) {
            translated.incrementAndGet();
            cache.set(text, result.getText());
            return Optional.of(result.getText());
        }

        failures.incrementAndGet();
        if (strict) {
            throw new TranslationException(
                    translator.getName() + " failed to translate text (" + result.getStatus() + "): "
                            + result.getError());
        }
        LOGGER.warn("{} translation failed ({}), keeping original text: {}", translator.getName(),
                result.getStatus(), result.getError());
        return Optional.empty();
    }

    private static boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public Translator getTranslator() {
        return translator;
    }

    public boolean isStrict() {
        return strict;
    }

    public int getCacheHits() {
        return cacheHits.get();
    }

    public int getTranslatedCount() {
        return translated.get();
    }

    public int getFailureCount() {
        return failures.get();
    }
}
