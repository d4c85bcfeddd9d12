package com.gs.ep.pdftranslator.assemble;

import com.gs.ep.pdftranslator.document.ObjectPatch;
import com.gs.ep.pdftranslator.document.ObjectRef;
import com.gs.ep.pdftranslator.document.WorkingDocument;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSStream;
import org.apache.pdfbox.multipdf.PDFMergerUtility;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageTree;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns a working document and its page patches into the mono and dual PDFs.
 */
public class DocumentAssembler {
    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentAssembler.class);

    private final FontRegistry fontRegistry;

    public DocumentAssembler(FontRegistry fontRegistry) {
        this.fontRegistry = fontRegistry;
    }

    public AssembledDocument assemble(WorkingDocument workingDocument, List<ObjectPatch> patches) throws IOException {
        List<ObjectPatch> ordered = new ArrayList<>(patches);
        ordered.sort(Comparator.comparingInt(ObjectPatch::getPageIndex));

        List<ObjectRef> targets = new ArrayList<>();
        for (ObjectPatch patch : ordered) {
            targets.add(patch.getTarget());
        }

        byte[] mono = workingDocument.withLock(document -> {
            int restored = workingDocument.restoreUnpatched(targets);
            if (restored > 0) {
                LOGGER.info("{} pages without a patch keep their original content", restored);
            }
            for (ObjectPatch patch : ordered) {
                COSStream stream = workingDocument.claimForPatch(patch.getTarget());
                try (OutputStream out = stream.createOutputStream(COSName.FLATE_DECODE)) {
                    out.write(patch.getPayload());
                }
            }
            PDFont font = workingDocument.getTranslationFont();
            if (font == null) {
                font = fontRegistry.load(document);
                workingDocument.setTranslationFont(font);
            }
            fontRegistry.register(document, font);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        });
        LOGGER.info("Applied {} page patches, mono output {} bytes", ordered.size(), mono.length);

        byte[] dual = buildDual(workingDocument.getOriginalBytes(), mono);
        LOGGER.info("Dual output {} bytes", dual.length);
        return new AssembledDocument(mono, dual, workingDocument.getPageCount(), ordered.size());
    }

    /**
     * Appends every translated page to a fresh copy of the original and moves each
     * one behind its original page.
     */
    static byte[] buildDual(byte[] original, byte[] translated) throws IOException {
        try (PDDocument dual = PDDocument.load(original); PDDocument mono = PDDocument.load(translated)) {
            if (dual.isEncrypted()) {
                dual.setAllSecurityToBeRemoved(true);
            }
            int originalPages = dual.getNumberOfPages();
            new PDFMergerUtility().appendDocument(dual, mono);
            interleave(dual.getPages(), originalPages);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            dual.save(out);
            return out.toByteArray();
        }
    }

    /**
     * Reorders {@code O0..On-1 T0..Tn-1} into {@code O0 T0 O1 T1 ...}.
     */
    static void interleave(PDPageTree pages, int originalPages) {
        for (int k = 0; k < originalPages && originalPages + k < pages.getCount(); k++) {
            PDPage translatedPage = pages.get(originalPages + k);
            pages.remove(originalPages + k);
            pages.insertAfter(translatedPage, pages.get(2 * k));
        }
    }
}
