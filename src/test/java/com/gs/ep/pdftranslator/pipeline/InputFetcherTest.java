package com.gs.ep.pdftranslator.pipeline;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InputFetcherTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void fetch_shouldDownloadUrlsAndPassLocalPathsThrough() throws Exception {
        server.enqueue(new MockResponse().setBody("%PDF-first"));
        server.enqueue(new MockResponse().setBody("%PDF-second"));
        String first = server.url("/papers/paper.pdf").toString();
        String second = server.url("/mirror/paper.pdf").toString();
        List<Path> files;
        try (InputFetcher fetcher = new InputFetcher(new OkHttpClient())) {
            files = fetcher.fetch(Arrays.asList("local.pdf", first, second));

            assertEquals(Paths.get("local.pdf"), files.get(0));
            assertEquals("paper.pdf", files.get(1).getFileName().toString());
            assertEquals("paper.pdf", files.get(2).getFileName().toString());
            assertNotEquals(files.get(1), files.get(2));
            assertEquals("%PDF-first", new String(Files.readAllBytes(files.get(1)), StandardCharsets.US_ASCII));
            assertEquals("%PDF-second", new String(Files.readAllBytes(files.get(2)), StandardCharsets.US_ASCII));
            assertEquals("/papers/paper.pdf", server.takeRequest().getPath());
        }
        assertFalse(Files.exists(files.get(1)));
        assertFalse(Files.exists(files.get(2)));
    }

    @Test
    void fetch_withFailedDownload_shouldThrow() throws IOException {
        server.enqueue(new MockResponse().setResponseCode(404));

        try (InputFetcher fetcher = new InputFetcher(new OkHttpClient())) {
            IOException e = assertThrows(IOException.class,
                    () -> fetcher.fetch(Arrays.asList(server.url("/missing.pdf").toString())));
            assertTrue(e.getMessage().contains("404"), e.getMessage());
        }
    }

    @Test
    void fetch_withOnlyLocalPaths_shouldNotTouchNetwork() throws IOException {
        try (InputFetcher fetcher = new InputFetcher(new OkHttpClient())) {
            assertEquals(Arrays.asList(Paths.get("a.pdf"), Paths.get("b.pdf")),
                    fetcher.fetch(Arrays.asList("a.pdf", "b.pdf")));
        }
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void isUrl_shouldOnlyAcceptHttpSchemes() {
        assertTrue(InputFetcher.isUrl("https://example.com/a.pdf"));
        assertTrue(InputFetcher.isUrl("HTTP://example.com/a.pdf"));
        assertFalse(InputFetcher.isUrl("ftp://example.com/a.pdf"));
        assertFalse(InputFetcher.isUrl("/tmp/http.pdf"));
    }

    @Test
    void fileName_shouldUseLastSegmentAndFallBack() {
        assertEquals("paper.pdf", InputFetcher.fileName(HttpUrl.parse("https://example.com/a/paper.pdf?x=1")));
        assertEquals("2401.00001.pdf", InputFetcher.fileName(HttpUrl.parse("https://arxiv.org/pdf/2401.00001")));
        assertEquals("report.pdf", InputFetcher.fileName(HttpUrl.parse("https://example.com/report/")));
        assertEquals(InputFetcher.FALLBACK_NAME, InputFetcher.fileName(HttpUrl.parse("https://example.com/")));
    }
}
