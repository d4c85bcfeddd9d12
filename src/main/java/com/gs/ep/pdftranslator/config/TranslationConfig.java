package com.gs.ep.pdftranslator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Translation and pipeline settings loaded from config.properties.
 * Every key can be overridden with a system property of the same name.
 */
public class TranslationConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationConfig.class);
    private static final String DEFAULT_CONFIG = "config.properties";
    static final String DEFAULT_FONT_URL =
            "https://github.com/google/fonts/raw/main/ofl/notosanssc/NotoSansSC%5Bwght%5D.ttf";

    private final Properties properties = new Properties();

    public TranslationConfig() {
        this(DEFAULT_CONFIG);
    }

    public TranslationConfig(String configPath) {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(configPath)) {
            if (input == null) {
                LOGGER.warn("Unable to find {} on the classpath. Using defaults.", configPath);
                return;
            }
            properties.load(input);
        } catch (IOException ex) {
            LOGGER.warn("Failed to read {}. Using defaults.", configPath, ex);
        }
    }

    public TranslationConfig(Properties properties) {
        this.properties.putAll(properties);
    }

    /**
     * Returns a copy with one key overridden, leaving this instance untouched.
     */
    public TranslationConfig with(String key, String value) {
        Properties copy = new Properties();
        copy.putAll(properties);
        copy.setProperty(key, value);
        return new TranslationConfig(copy);
    }

    private String get(String key, String defaultValue) {
        String override = System.getProperty(key);
        if (override != null) {
            return override;
        }
        return properties.getProperty(key, defaultValue);
    }

    private int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid integer for {}: '{}'. Using {}.", key, value, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBoolean(String key, boolean defaultValue) {
        String value = get(key, null);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    public String getApiKey() {
        return get("api.key", "");
    }

    public String getModelName() {
        return get("api.model", "vendor/meta-llama/Llama-3.3-70B-Instruct");
    }

    public String getApiUrl() {
        return get("api.url", "https://api.siliconflow.cn/v1/chat/completions");
    }

    public String getServiceName() {
        return get("translation.service", "google");
    }

    public String getSourceLanguage() {
        return get("translation.lang.in", "en");
    }

    public String getTargetLanguage() {
        return get("translation.lang.out", "zh-CN");
    }

    public String getPromptFile() {
        return get("translation.prompt.file", "");
    }

    public int getTranslationRetries() {
        return Math.max(0, getInt("translation.retries", 2));
    }

    public long getRetryBackoffMillis() {
        return Math.max(0, getInt("translation.retry.backoff.ms", 500));
    }

    public boolean isStrict() {
        return getBoolean("translation.strict", false);
    }

    public boolean isIgnoreCache() {
        return getBoolean("translation.ignore.cache", false);
    }

    public int getThreads() {
        return Math.max(1, getInt("pipeline.threads", 4));
    }

    public String getFontPath() {
        return get("font.path", "");
    }

    public boolean isSubsetFonts() {
        return getBoolean("font.subset", true);
    }

    /**
     * Directory holding the default translation font, downloaded there on first use.
     */
    public Path getFontDir() {
        String configured = get("font.dir", "");
        if (!configured.trim().isEmpty()) {
            return Paths.get(configured.trim());
        }
        return Paths.get(System.getProperty("user.home"), ".cache", "pdf-translator", "fonts");
    }

    public String getDefaultFontName() {
        return get("font.default.name", "NotoSansSC-Regular.ttf");
    }

    /**
     * Where the default font is fetched from when it is not in {@link #getFontDir()};
     * empty disables the download.
     */
    public String getFontDownloadUrl() {
        return get("font.download.url", DEFAULT_FONT_URL).trim();
    }

    /**
     * Normalize inputs to PDF/A-2b before translating them.
     */
    public boolean isCompatible() {
        return getBoolean("pdf.compatible", false);
    }

    public String getFormulaFontPattern() {
        return get("formula.font.pattern", "");
    }

    public String getFormulaCharPattern() {
        return get("formula.char.pattern", "");
    }

    public String getCacheStore() {
        return get("cache.store", "file");
    }

    public Path getCachePath() {
        String configured = get("cache.path", "");
        if (!configured.trim().isEmpty()) {
            return Paths.get(configured.trim());
        }
        return Paths.get(System.getProperty("user.home"), ".cache", "pdf-translator", "cache.v1");
    }

    public String getRedisHost() {
        return get("redis.host", "localhost");
    }

    public int getRedisPort() {
        return getInt("redis.port", 6379);
    }

    public String getRedisPassword() {
        return get("redis.password", "");
    }

    public int getRedisDb() {
        return getInt("redis.db", 0);
    }

    public int getRedisCacheTtl() {
        return getInt("redis.cache.ttl", 0);
    }
}
