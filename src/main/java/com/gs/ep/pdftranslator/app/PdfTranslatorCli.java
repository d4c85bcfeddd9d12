package com.gs.ep.pdftranslator.app;

import ch.qos.logback.classic.Level;
import com.gs.ep.pdftranslator.assemble.FontRegistry;
import com.gs.ep.pdftranslator.cache.CacheStore;
import com.gs.ep.pdftranslator.cache.CacheStores;
import com.gs.ep.pdftranslator.cache.TranslationCache;
import com.gs.ep.pdftranslator.config.TranslationConfig;
import com.gs.ep.pdftranslator.interpret.PageInterpreter;
import com.gs.ep.pdftranslator.layout.JsonLayoutDetector;
import com.gs.ep.pdftranslator.layout.LayoutDetector;
import com.gs.ep.pdftranslator.layout.NoLayoutDetector;
import com.gs.ep.pdftranslator.pipeline.CancellationToken;
import com.gs.ep.pdftranslator.pipeline.FileOutcome;
import com.gs.ep.pdftranslator.pipeline.InputFetcher;
import com.gs.ep.pdftranslator.pipeline.PipelineOptions;
import com.gs.ep.pdftranslator.pipeline.PipelineOrchestrator;
import com.gs.ep.pdftranslator.translate.SpanTranslator;
import com.gs.ep.pdftranslator.translate.Translator;
import com.gs.ep.pdftranslator.translate.TranslatorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class PdfTranslatorCli {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfTranslatorCli.class);
    static final long SHUTDOWN_GRACE_SECONDS = 30;

    public static void main(String[] args) {
        int status = run(args, new TranslationConfig(), new CancellationToken());
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return 0 when every file was translated, 1 when any file failed or was cancelled, 2 on bad arguments
     */
    static int run(String[] args, TranslationConfig baseConfig, CancellationToken token) {
        CliArguments arguments;
        try {
            arguments = CliArguments.parse(args);
        } catch (IllegalArgumentException e) {
            LOGGER.error("{}", e.getMessage());
            System.err.println("Error: " + e.getMessage());
            System.err.println(CliArguments.USAGE);
            return 2;
        }
        if (arguments.isVersion()) {
            System.out.println("pdf-translator " + version());
            return 0;
        }
        if (arguments.isDebug()) {
            enableDebugLogging();
            LOGGER.debug("Debug logging enabled");
        }

        TranslationConfig config = applyOverrides(baseConfig, arguments);
        LOGGER.info("PdfTranslator CLI started. {} file(s), output directory {}", arguments.getInputs().size(),
                arguments.getOutputDir().toAbsolutePath());
        LOGGER.info("Translation service: {} ({} -> {})", config.getServiceName(), config.getSourceLanguage(),
                config.getTargetLanguage());
        if (!arguments.getPages().isEmpty()) {
            LOGGER.info("Target pages (0-based): {}", arguments.getPages());
        }

        CountDownLatch finished = new CountDownLatch(1);
        Thread shutdownHook = shutdownHook(token, finished, SHUTDOWN_GRACE_SECONDS);
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try (InputFetcher fetcher = new InputFetcher(); CacheStore store = CacheStores.open(config)) {
            List<Path> inputs = fetcher.fetch(arguments.getInputs());
            Translator translator = TranslatorRegistry.create(config.getServiceName(), config);
            TranslationCache cache = new TranslationCache(translator.getName(), translator.getCacheParameters(),
                    store, config.isIgnoreCache());
            SpanTranslator spanTranslator = new SpanTranslator(translator, cache, config.getTranslationRetries(),
                    config.getRetryBackoffMillis(), config.isStrict());
            LayoutDetector detector = arguments.getLayoutFile() == null
                    ? new NoLayoutDetector()
                    : JsonLayoutDetector.fromFile(arguments.getLayoutFile());
            PipelineOrchestrator orchestrator = new PipelineOrchestrator(
                    detector,
                    new PageInterpreter(config.getFormulaFontPattern(), config.getFormulaCharPattern()),
                    spanTranslator,
                    FontRegistry.fromConfig(config),
                    new PipelineOptions(config.getThreads(), arguments.getPages(), config.isCompatible()));

            long start = System.currentTimeMillis();
            List<FileOutcome> outcomes = orchestrator.translate(inputs, arguments.getOutputDir(),
                    token, event -> LOGGER.info("{}", event));
            LOGGER.info("Finished in {} s", (System.currentTimeMillis() - start) / 1000.0);

            boolean allSucceeded = true;
            for (FileOutcome outcome : outcomes) {
                System.out.println(outcome);
                allSucceeded &= outcome.getStatus() == FileOutcome.Status.SUCCESS;
            }
            return allSucceeded ? 0 : 1;
        } catch (IllegalArgumentException e) {
            LOGGER.error("{}", e.getMessage());
            System.err.println("Error: " + e.getMessage());
            return 2;
        } catch (IOException e) {
            LOGGER.error("Error during PDF translation process: ", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        } finally {
            finished.countDown();
            removeShutdownHook(shutdownHook);
        }
    }

    /**
     * Cancels the run on JVM shutdown, then holds shutdown until the run has
     * written its partial output or {@code graceSeconds} have passed.
     */
    static Thread shutdownHook(CancellationToken token, CountDownLatch finished, long graceSeconds) {
        return new Thread(() -> {
            LOGGER.warn("Shutdown requested, cancelling translation");
            token.cancel();
            try {
                if (!finished.await(graceSeconds, TimeUnit.SECONDS)) {
                    LOGGER.warn("Translation did not stop within {} s, exiting anyway", graceSeconds);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "pdf-translator-shutdown");
    }

    /**
     * Project version stamped into {@code version.properties} at build time.
     */
    static String version() {
        Properties properties = new Properties();
        try (InputStream input = PdfTranslatorCli.class.getClassLoader().getResourceAsStream("version.properties")) {
            if (input != null) {
                properties.load(input);
            }
        } catch (IOException e) {
            LOGGER.debug("Unable to read version.properties: {}", e.getMessage());
        }
        String version = properties.getProperty("version", "").trim();
        return version.isEmpty() || version.startsWith("${") ? "unknown" : version;
    }

    static TranslationConfig applyOverrides(TranslationConfig config, CliArguments arguments) {
        TranslationConfig result = config;
        if (arguments.getService() != null) {
            result = result.with("translation.service", arguments.getService());
        }
        if (arguments.getThreads() != null) {
            result = result.with("pipeline.threads", String.valueOf(arguments.getThreads()));
        }
        if (arguments.getFormulaFontPattern() != null) {
            result = result.with("formula.font.pattern", arguments.getFormulaFontPattern());
        }
        if (arguments.getFormulaCharPattern() != null) {
            result = result.with("formula.char.pattern", arguments.getFormulaCharPattern());
        }
        if (arguments.getPromptFile() != null) {
            result = result.with("translation.prompt.file", arguments.getPromptFile());
        }
        if (arguments.getFontPath() != null) {
            result = result.with("font.path", arguments.getFontPath());
        }
        if (arguments.isIgnoreCache()) {
            result = result.with("translation.ignore.cache", "true");
        }
        if (arguments.isSkipSubsetFonts()) {
            result = result.with("font.subset", "false");
        }
        if (arguments.isStrict()) {
            result = result.with("translation.strict", "true");
        }
        if (arguments.isCompatible()) {
            result = result.with("pdf.compatible", "true");
        }
        return result;
    }

    private static void enableDebugLogging() {
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down; the hook has run or is running
            LOGGER.debug("Shutdown in progress, hook left registered");
        }
    }
}
