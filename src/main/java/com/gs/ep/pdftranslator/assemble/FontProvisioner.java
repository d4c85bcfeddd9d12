package com.gs.ep.pdftranslator.assemble;

import com.gs.ep.pdftranslator.config.TranslationConfig;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.TimeUnit;

/**
 * Finds the TrueType file translated text is drawn with: the configured font,
 * else the default font in the font directory, else the default font downloaded
 * into that directory. The answer is looked up once and reused.
 */
public class FontProvisioner {
    private static final Logger LOGGER = LoggerFactory.getLogger(FontProvisioner.class);

    private final String configuredPath;
    private final Path defaultFont;
    private final String downloadUrl;
    private final OkHttpClient httpClient;
    private boolean resolved;
    private Path font;

    /**
     * @param configuredPath explicit font file, may be empty
     * @param defaultFont    where the default font lives once provisioned, null for none
     * @param downloadUrl    source of the default font, empty to never download
     */
    public FontProvisioner(String configuredPath, Path defaultFont, String downloadUrl, OkHttpClient httpClient) {
        this.configuredPath = configuredPath == null ? "" : configuredPath.trim();
        this.defaultFont = defaultFont;
        this.downloadUrl = downloadUrl == null ? "" : downloadUrl.trim();
        this.httpClient = httpClient;
    }

    public static FontProvisioner fromConfig(TranslationConfig config) {
        return new FontProvisioner(config.getFontPath(),
                config.getFontDir().resolve(config.getDefaultFontName()),
                config.getFontDownloadUrl(),
                new OkHttpClient.Builder()
                        .connectTimeout(30, TimeUnit.SECONDS)
                        .readTimeout(120, TimeUnit.SECONDS)
                        .build());
    }

    /**
     * Only the given file; nothing is downloaded.
     */
    public static FontProvisioner fixed(String fontPath) {
        return new FontProvisioner(fontPath, null, "", null);
    }

    /**
     * @return the font file, or null when none is available
     */
    public synchronized Path resolve() {
        if (!resolved) {
            font = locate();
            resolved = true;
            if (font != null) {
                LOGGER.info("Using translation font {}", font);
            }
        }
        return font;
    }

    private Path locate() {
        if (!configuredPath.isEmpty()) {
            Path configured = Paths.get(configuredPath);
            if (Files.isRegularFile(configured)) {
                return configured;
            }
            LOGGER.warn("Translation font {} not found", configuredPath);
        }
        if (defaultFont == null) {
            return null;
        }
        if (Files.isRegularFile(defaultFont)) {
            return defaultFont;
        }
        if (downloadUrl.isEmpty() || httpClient == null) {
            LOGGER.warn("Default translation font {} is missing and no download URL is configured", defaultFont);
            return null;
        }
        try {
            download(downloadUrl, defaultFont);
            return defaultFont;
        } catch (IOException e) {
            LOGGER.warn("Failed to download translation font from {}: {}", downloadUrl, e.getMessage());
            return null;
        }
    }

    /**
     * Fetches {@code url} into {@code target} through a sibling temp file, so a
     * concurrent reader never sees a half-written font.
     */
    void download(String url, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        LOGGER.info("Downloading translation font {} from {}", target.getFileName(), url);
        Request request;
        try {
            request = new Request.Builder().url(url).get().build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid font URL " + url, e);
        }
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IOException("HTTP " + response.code());
            }
            Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".part");
            try (InputStream input = body.byteStream()) {
                long bytes = Files.copy(input, temp, StandardCopyOption.REPLACE_EXISTING);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                LOGGER.info("Saved translation font {} ({} bytes)", target, bytes);
            } finally {
                Files.deleteIfExists(temp);
            }
        }
    }
}
