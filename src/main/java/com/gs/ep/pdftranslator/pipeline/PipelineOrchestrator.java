package com.gs.ep.pdftranslator.pipeline;

import com.gs.ep.pdftranslator.PdfTranslatorException;
import com.gs.ep.pdftranslator.assemble.AssembledDocument;
import com.gs.ep.pdftranslator.assemble.DocumentAssembler;
import com.gs.ep.pdftranslator.assemble.FontRegistry;
import com.gs.ep.pdftranslator.document.ObjectPatch;
import com.gs.ep.pdftranslator.document.PdfAConverter;
import com.gs.ep.pdftranslator.document.WorkingDocument;
import com.gs.ep.pdftranslator.interpret.PageInterpreter;
import com.gs.ep.pdftranslator.interpret.PageProgram;
import com.gs.ep.pdftranslator.layout.LayoutBox;
import com.gs.ep.pdftranslator.layout.LayoutDetector;
import com.gs.ep.pdftranslator.layout.PageImage;
import com.gs.ep.pdftranslator.layout.RegionMask;
import com.gs.ep.pdftranslator.translate.SpanTranslator;
import com.gs.ep.pdftranslator.translate.TranslationException;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives files and pages through detection, interpretation, translation and
 * assembly.
 *
 * <p>
 * Pages run on a bounded worker pool. Rasterizing, decoding and emitting touch
 * the document graph and run under the {@link WorkingDocument} lock; layout
 * detection and translation run outside it. At most {@code threads} pages are in
 * flight; the next page is dispatched only when one finishes, so cancellation
 * stops dispatch promptly.
 * </p>
 */
public class PipelineOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);
    static final float RENDER_DPI = 72f;

    private final LayoutDetector layoutDetector;
    private final PageInterpreter interpreter;
    private final SpanTranslator spanTranslator;
    private final FontRegistry fontRegistry;
    private final DocumentAssembler assembler;
    private final PipelineOptions options;
    private volatile PipelineState state = PipelineState.IDLE;

    public PipelineOrchestrator(LayoutDetector layoutDetector, PageInterpreter interpreter,
            SpanTranslator spanTranslator, FontRegistry fontRegistry, PipelineOptions options) {
        this.layoutDetector = layoutDetector;
        this.interpreter = interpreter;
        this.spanTranslator = spanTranslator;
        this.fontRegistry = fontRegistry;
        this.assembler = new DocumentAssembler(fontRegistry);
        this.options = options;
    }

    public PipelineState getState() {
        return state;
    }

    // ------------------------------------------------------------------- files

    /**
     * Translates every file into {@code <stem>-mono.pdf} and {@code <stem>-dual.pdf}
     * under {@code outputDir}. A failing file is reported and the batch moves on.
     *
     * @throws IllegalArgumentException when the list is empty or a file is missing
     */
    public List<FileOutcome> translate(List<Path> files, Path outputDir, CancellationToken token,
            ProgressListener listener) throws IOException {
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("No input files given");
        }
        MutableList<Path> missing = Lists.mutable.ofAll(files).reject(Files::isRegularFile);
        if (missing.notEmpty()) {
            throw new IllegalArgumentException("Input files not found: " + missing.makeString(", "));
        }
        Files.createDirectories(outputDir);

        MutableList<FileOutcome> outcomes = Lists.mutable.empty();
        for (Path file : files) {
            if (token.isCancelled()) {
                outcomes.add(FileOutcome.cancelled(file));
                continue;
            }
            outcomes.add(translateFile(file, outputDir, token, listener));
        }
        return outcomes;
    }

    private FileOutcome translateFile(Path file, Path outputDir, CancellationToken token,
            ProgressListener listener) {
        String stem = stem(file);
        LOGGER.info("Translating {}", file);
        try {
            byte[] input = Files.readAllBytes(file);
            if (options.isCompatible()) {
                input = PdfAConverter.convert(input);
                LOGGER.info("Converted {} to PDF/A before translation", file.getFileName());
            }
            DocumentResult result = run(file.getFileName().toString(), input, options.getPages(), token, listener);
            if (result.getMono() == null) {
                LOGGER.info("Translation of {} cancelled before it started", file);
                return FileOutcome.cancelled(file);
            }
            Path mono = outputDir.resolve(stem + "-mono.pdf");
            Path dual = outputDir.resolve(stem + "-dual.pdf");
            Files.write(mono, result.getMono());
            Files.write(dual, result.getDual());
            if (result.getState() == PipelineState.CANCELLED) {
                LOGGER.info("Translation of {} cancelled after {} pages, partial output in {} and {}", file,
                        result.getPatches().size(), mono, dual);
                return FileOutcome.cancelled(file, mono, result.getMono().length, dual, result.getDual().length);
            }
            LOGGER.info("Wrote {} and {}", mono, dual);
            return FileOutcome.success(file, mono, result.getMono().length, dual, result.getDual().length);
        } catch (IOException | RuntimeException e) {
            state = PipelineState.FAILED;
            LOGGER.error("Failed to translate {}", file, e);
            return FileOutcome.failed(file, e.getMessage());
        }
    }

    static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    // ------------------------------------------------------------------ stream

    /**
     * Translates one in-memory document.
     *
     * @param pages 0-based pages to translate; null or empty for all
     * @throws com.gs.ep.pdftranslator.PdfFormatException when the bytes are not a readable PDF
     * @throws PdfTranslatorException when a strict translator fails
     */
    public DocumentResult translateStream(byte[] pdf, List<Integer> pages, CancellationToken token,
            ProgressListener listener) throws IOException {
        try {
            return run("stream", pdf, pages, token, listener);
        } catch (IOException | RuntimeException e) {
            state = PipelineState.FAILED;
            throw e;
        }
    }

    private DocumentResult run(String source, byte[] pdf, List<Integer> pages, CancellationToken token,
            ProgressListener listener) throws IOException {
        state = PipelineState.OPENING;
        if (token.isCancelled()) {
            state = PipelineState.CANCELLED;
            return new DocumentResult(state, Collections.<ObjectPatch>emptyList(), null);
        }
        try (WorkingDocument document = WorkingDocument.load(pdf)) {
            document.withLock(d -> {
                document.setTranslationFont(fontRegistry.load(d));
                return null;
            });
            List<Integer> selected = selectPages(pages, document.getPageCount());

            state = PipelineState.PER_PAGE;
            MutableList<ObjectPatch> patches = processPages(source, document, selected, token, listener);
            boolean cancelled = token.isCancelled();

            // a cancelled run still assembles; pages without a patch keep their original content
            state = PipelineState.ASSEMBLING;
            AssembledDocument assembled = assembler.assemble(document, patches);
            state = cancelled ? PipelineState.CANCELLED : PipelineState.DONE;
            LOGGER.info("{}: {} pages patched{}, cache hits {}, translated {}, failed {}", source, patches.size(),
                    cancelled ? " before cancellation" : "", spanTranslator.getCacheHits(),
                    spanTranslator.getTranslatedCount(), spanTranslator.getFailureCount());
            return new DocumentResult(state, patches, assembled);
        }
    }

    private static List<Integer> selectPages(List<Integer> pages, int pageCount) {
        MutableList<Integer> selected = Lists.mutable.empty();
        if (pages == null || pages.isEmpty()) {
            for (int i = 0; i < pageCount; i++) {
                selected.add(i);
            }
            return selected;
        }
        for (Integer page : pages) {
            if (page >= 0 && page < pageCount) {
                selected.add(page);
            } else {
                LOGGER.warn("Ignoring page {}; the document has {} pages", page + 1, pageCount);
            }
        }
        return selected;
    }

    /**
     * Result of one worker task.
     */
    private static final class PageOutcome {
        final int pageIndex;
        final ObjectPatch patch;

        PageOutcome(int pageIndex, ObjectPatch patch) {
            this.pageIndex = pageIndex;
            this.patch = patch;
        }
    }

    private MutableList<ObjectPatch> processPages(String source, WorkingDocument document, List<Integer> pages,
            CancellationToken token, ProgressListener listener) {
        MutableList<ObjectPatch> patches = Lists.mutable.empty();
        int threads = Math.min(options.getThreads(), Math.max(1, pages.size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
        CompletionService<PageOutcome> completion = new ExecutorCompletionService<>(pool);
        Iterator<Integer> pending = pages.iterator();
        CancellationToken pageToken = token.child();
        int inFlight = 0;
        int completed = 0;
        PdfTranslatorException strictFailure = null;
        try {
            while (inFlight < threads && dispatchNext(completion, document, pending, pageToken)) {
                inFlight++;
            }
            while (inFlight > 0) {
                Future<PageOutcome> future;
                try {
                    future = completion.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    token.cancel();
                    break;
                }
                inFlight--;
                completed++;
                PageOutcome outcome;
                try {
                    outcome = future.get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    token.cancel();
                    break;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof TranslationException) {
                        pageToken.cancel();
                        if (strictFailure == null) {
                            strictFailure = new PdfTranslatorException(cause.getMessage(), cause);
                        }
                    } else {
                        LOGGER.error("Unexpected failure on a page of {}, keeping it untranslated", source, cause);
                    }
                    outcome = null;
                }
                if (outcome != null && outcome.patch != null) {
                    patches.add(outcome.patch);
                }
                if (outcome != null) {
                    listener.onProgress(new ProgressEvent(source, outcome.pageIndex, completed, pages.size(),
                            outcome.patch == null));
                }
                if (dispatchNext(completion, document, pending, pageToken)) {
                    inFlight++;
                }
            }
        } finally {
            pool.shutdownNow();
        }
        if (strictFailure != null) {
            throw strictFailure;
        }
        while (pending.hasNext()) {
            int skipped = pending.next();
            completed++;
            listener.onProgress(new ProgressEvent(source, skipped, completed, pages.size(), true));
        }
        return patches;
    }

    private boolean dispatchNext(CompletionService<PageOutcome> completion, WorkingDocument document,
            Iterator<Integer> pending, CancellationToken token) {
        if (!pending.hasNext() || token.isCancelled()) {
            return false;
        }
        submit(completion, document, pending.next(), token);
        return true;
    }

    private void submit(CompletionService<PageOutcome> completion, WorkingDocument document, int pageIndex,
            CancellationToken token) {
        completion.submit(() -> processPage(document, pageIndex, token));
    }

    private PageOutcome processPage(WorkingDocument document, int pageIndex, CancellationToken token)
            throws IOException, TranslationException {
        if (token.isCancelled()) {
            return new PageOutcome(pageIndex, null);
        }
        PageImage image = document.withLock(d -> new PageImage(pageIndex,
                new PDFRenderer(d).renderImageWithDPI(pageIndex, RENDER_DPI, ImageType.RGB)));

        List<LayoutBox> boxes;
        try {
            boxes = layoutDetector.detect(image, image.getTileSize());
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Layout detection failed on page {}, translating the whole page: {}", pageIndex + 1,
                    e.getMessage());
            boxes = Collections.emptyList();
        }
        RegionMask mask = RegionMask.build(image.getHeight(), image.getWidth(), boxes);

        PageProgram program = document.withLock(d -> interpreter.decode(pageIndex, d.getPage(pageIndex), mask));
        interpreter.translateRuns(program, spanTranslator);
        ObjectPatch patch = document.withLock(d -> interpreter.emit(program, document));
        LOGGER.debug("Page {} done: {} runs, {} translated", pageIndex + 1, program.getRuns().size(),
                patch.getTranslatedRuns());
        return new PageOutcome(pageIndex, patch);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "pdf-translator-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
