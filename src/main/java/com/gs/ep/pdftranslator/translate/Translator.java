package com.gs.ep.pdftranslator.translate;

import java.util.Map;

/**
 * A translation backend: text in, text out. Implementations must be safe to call
 * from several worker threads.
 */
public interface Translator {

    /**
     * Short engine name, also used as the cache engine key.
     */
    String getName();

    /**
     * Settings that change the output (languages, model, prompt). They form the
     * cache fingerprint, so changing any of them bypasses earlier translations.
     */
    Map<String, Object> getCacheParameters();

    TranslationResult translate(String text);
}
