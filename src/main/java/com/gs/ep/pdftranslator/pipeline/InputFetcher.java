package com.gs.ep.pdftranslator.pipeline;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Turns command line inputs into local files. Local paths pass through; http(s)
 * URLs are downloaded into a temporary directory that is removed on close.
 */
public class InputFetcher implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(InputFetcher.class);
    static final String FALLBACK_NAME = "download.pdf";

    private final OkHttpClient httpClient;
    private Path downloadDir;
    private int downloads;

    public InputFetcher(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public InputFetcher() {
        this(new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(120, TimeUnit.SECONDS)
                .build());
    }

    public static boolean isUrl(String input) {
        String lower = input.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    /**
     * @return one local file per input, in the same order
     * @throws IOException when a download fails
     */
    public List<Path> fetch(List<String> inputs) throws IOException {
        List<Path> files = new ArrayList<>(inputs.size());
        for (String input : inputs) {
            files.add(isUrl(input) ? download(input) : Paths.get(input));
        }
        return files;
    }

    /**
     * Each download gets its own subdirectory, so two URLs ending in the same name
     * still produce distinct files while keeping that name for the outputs.
     */
    Path download(String url) throws IOException {
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw new IOException("Invalid input URL " + url);
        }
        if (downloadDir == null) {
            downloadDir = Files.createTempDirectory("pdf-translator-inputs");
        }
        Path target = Files.createDirectories(downloadDir.resolve(String.valueOf(downloads++)))
                .resolve(fileName(parsed));
        LOGGER.info("Downloading {}", url);
        Request request = new Request.Builder().url(parsed).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IOException("Failed to download " + url + ": HTTP " + response.code());
            }
            try (InputStream input = body.byteStream()) {
                long bytes = Files.copy(input, target);
                LOGGER.info("Downloaded {} ({} bytes) to {}", url, bytes, target);
            }
        }
        return target;
    }

    /**
     * Last non-empty path segment with a .pdf extension, or {@value #FALLBACK_NAME}.
     */
    static String fileName(HttpUrl url) {
        List<String> segments = url.pathSegments();
        for (int i = segments.size() - 1; i >= 0; i--) {
            String segment = segments.get(i).replaceAll("[\\\\/:*?\"<>|]", "_").trim();
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                continue;
            }
            return segment.toLowerCase(Locale.ROOT).endsWith(".pdf") ? segment : segment + ".pdf";
        }
        return FALLBACK_NAME;
    }

    @Override
    public void close() throws IOException {
        if (downloadDir == null) {
            return;
        }
        try (Stream<Path> paths = Files.walk(downloadDir)) {
            List<Path> ordered = new ArrayList<>();
            paths.sorted(Comparator.reverseOrder()).forEach(ordered::add);
            for (Path path : ordered) {
                Files.deleteIfExists(path);
            }
        }
        LOGGER.debug("Removed downloaded inputs in {}", downloadDir);
        downloadDir = null;
    }
}
