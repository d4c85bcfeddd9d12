package com.gs.ep.pdftranslator.document;

import com.gs.ep.pdftranslator.PdfFormatException;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class WorkingDocumentTest {

    private static byte[] blankPdf(int pages) throws IOException {
        try (PDDocument document = new PDDocument()) {
            for (int i = 0; i < pages; i++) {
                document.addPage(new PDPage());
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        }
    }

    @Test
    void load_withGarbage_shouldThrowPdfFormatException() {
        assertThrows(PdfFormatException.class,
                () -> WorkingDocument.load("not a pdf".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    void allocateStream_withoutLock_shouldThrow() throws IOException {
        try (WorkingDocument document = WorkingDocument.load(blankPdf(1))) {
            assertThrows(IllegalStateException.class, document::allocateStream);
        }
    }

    @Test
    void repointContents_shouldMakeStreamThePageContent() throws IOException {
        try (WorkingDocument document = WorkingDocument.load(blankPdf(2))) {
            assertEquals(2, document.getPageCount());
            ObjectRef ref = document.withLock(d -> {
                ObjectRef allocated = document.allocateStream();
                document.repointContents(d.getPage(1), allocated);
                return allocated;
            });

            assertSame(document.resolve(ref), document.getDocument().getPage(1).getCOSObject()
                    .getDictionaryObject(COSName.CONTENTS));
            assertNotEquals(ref, document.withLock(d -> document.allocateStream()));
        }
    }

    @Test
    void claimForPatch_twice_shouldThrow() throws IOException {
        try (WorkingDocument document = WorkingDocument.load(blankPdf(1))) {
            ObjectRef ref = document.withLock(d -> document.allocateStream());

            document.withLock(d -> document.claimForPatch(ref));
            assertTrue(document.isPatched(ref));
            assertThrows(IllegalStateException.class, () -> document.withLock(d -> document.claimForPatch(ref)));
        }
    }

    @Test
    void getOriginalBytes_shouldReturnCopyOfInput() throws IOException {
        byte[] input = blankPdf(1);
        try (WorkingDocument document = WorkingDocument.load(input)) {
            byte[] copy = document.getOriginalBytes();
            assertArrayEquals(input, copy);
            copy[0] = 0;
            assertArrayEquals(input, document.getOriginalBytes());
        }
    }

    @Test
    void restoreUnpatched_shouldPutBackOriginalContentsAndSealDocument() throws IOException {
        try (WorkingDocument document = WorkingDocument.load(blankPdf(2))) {
            PDDocument d0 = document.getDocument();
            d0.getPage(0).getCOSObject().setItem(COSName.CONTENTS, d0.getDocument().createCOSStream());
            COSBase originalFirst = d0.getPage(0).getCOSObject().getItem(COSName.CONTENTS);

            ObjectRef kept = document.withLock(d -> {
                ObjectRef abandoned = document.allocateStream();
                document.repointContents(d.getPage(0), abandoned);
                ObjectRef patched = document.allocateStream();
                document.repointContents(d.getPage(1), patched);
                return patched;
            });

            assertEquals(1, (int) document.withLock(d -> document.restoreUnpatched(Collections.singleton(kept))));
            assertSame(originalFirst, d0.getPage(0).getCOSObject().getItem(COSName.CONTENTS));
            assertSame(document.resolve(kept), d0.getPage(1).getCOSObject().getDictionaryObject(COSName.CONTENTS));
            assertThrows(IllegalStateException.class, () -> document.withLock(d -> {
                document.repointContents(d.getPage(0), document.allocateStream());
                return null;
            }));
        }
    }
}
