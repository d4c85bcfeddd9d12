package com.gs.ep.pdftranslator.app;

import com.gs.ep.pdftranslator.config.TranslationConfig;
import com.gs.ep.pdftranslator.pipeline.CancellationToken;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

public class PdfTranslatorCliTest {

    @TempDir
    Path tempDir;

    private TranslationConfig offlineConfig() {
        Properties properties = new Properties();
        properties.setProperty("cache.store", "none");
        properties.setProperty("font.dir", tempDir.resolve("fonts").toString());
        properties.setProperty("font.download.url", "");
        return new TranslationConfig(properties);
    }

    @Test
    void run_withBadArguments_shouldReturnUsageError() {
        assertEquals(2, PdfTranslatorCli.run(new String[0], offlineConfig(), new CancellationToken()));
        assertEquals(2, PdfTranslatorCli.run(new String[]{"--bogus"}, offlineConfig(), new CancellationToken()));
    }

    @Test
    void run_withMissingInput_shouldReturnUsageError() {
        String missing = tempDir.resolve("missing.pdf").toString();

        assertEquals(2, PdfTranslatorCli.run(new String[]{missing, "-o", tempDir.toString()}, offlineConfig(),
                new CancellationToken()));
    }

    @Test
    void run_withUnknownService_shouldReturnUsageError() throws Exception {
        Path input = tempDir.resolve("paper.pdf");
        Files.write(input, new byte[]{1});

        assertEquals(2, PdfTranslatorCli.run(new String[]{input.toString(), "-s", "babelfish"}, offlineConfig(),
                new CancellationToken()));
    }

    @Test
    void run_withCancelledToken_shouldReportFailureStatus() throws Exception {
        Path input = tempDir.resolve("paper.pdf");
        Files.write(input, new byte[]{1});
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertEquals(1, PdfTranslatorCli.run(new String[]{input.toString(), "-o", tempDir.resolve("out").toString()},
                offlineConfig(), token));
        assertTrue(Files.isDirectory(tempDir.resolve("out")));
    }

    @Test
    void applyOverrides_shouldMapFlagsToConfigKeys() {
        CliArguments arguments = CliArguments.parse(new String[]{
                "-s", "openai", "-t", "3", "-f", "CM", "-c", "=", "--prompt", "p.txt", "--font", "f.ttf",
                "--ignore-cache", "--skip-subset-fonts", "--strict", "-cp", "a.pdf"});

        TranslationConfig config = PdfTranslatorCli.applyOverrides(offlineConfig(), arguments);

        assertEquals("openai", config.getServiceName());
        assertEquals(3, config.getThreads());
        assertEquals("CM", config.getFormulaFontPattern());
        assertEquals("=", config.getFormulaCharPattern());
        assertEquals("p.txt", config.getPromptFile());
        assertEquals("f.ttf", config.getFontPath());
        assertTrue(config.isIgnoreCache());
        assertFalse(config.isSubsetFonts());
        assertTrue(config.isStrict());
        assertTrue(config.isCompatible());
        assertFalse(PdfTranslatorCli.applyOverrides(offlineConfig(), CliArguments.parse(new String[]{"a.pdf"}))
                .isCompatible());
    }

    @Test
    void run_withVersion_shouldPrintVersionAndSucceed() {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setOut(new PrintStream(captured, true));
        try {
            assertEquals(0, PdfTranslatorCli.run(new String[]{"--version"}, offlineConfig(), new CancellationToken()));
        } finally {
            System.setOut(originalOut);
        }
        String printed = new String(captured.toByteArray(), StandardCharsets.UTF_8).trim();
        assertTrue(printed.startsWith("pdf-translator "), printed);
        assertFalse(printed.contains("${"), printed);
    }

    @Test
    void version_shouldNeverBeEmpty() {
        String version = PdfTranslatorCli.version();

        assertFalse(version.isEmpty());
        assertFalse(version.startsWith("${"));
    }

    @Test
    void run_withUnreachableUrlInput_shouldReportFailure() throws IOException {
        MockWebServer server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(500));
        server.start();
        try {
            assertEquals(1, PdfTranslatorCli.run(new String[]{server.url("/paper.pdf").toString(),
                    "-o", tempDir.resolve("out").toString()}, offlineConfig(), new CancellationToken()));
            assertEquals(1, server.getRequestCount());
        } finally {
            server.shutdown();
        }
    }

    @Test
    void shutdownHook_shouldCancelAndWaitForRunToFinish() throws InterruptedException {
        CancellationToken token = new CancellationToken();
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = PdfTranslatorCli.shutdownHook(token, finished, 30);

        hook.start();
        long deadline = System.currentTimeMillis() + 5000;
        while (!token.isCancelled() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(token.isCancelled());
        hook.join(200);
        assertTrue(hook.isAlive());

        finished.countDown();
        hook.join(5000);
        assertFalse(hook.isAlive());
    }

    @Test
    void shutdownHook_shouldGiveUpAfterGracePeriod() throws InterruptedException {
        Thread hook = PdfTranslatorCli.shutdownHook(new CancellationToken(), new CountDownLatch(1), 0);

        hook.start();
        hook.join(5000);

        assertFalse(hook.isAlive());
    }
}
