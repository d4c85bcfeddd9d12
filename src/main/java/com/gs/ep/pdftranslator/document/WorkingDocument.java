package com.gs.ep.pdftranslator.document;

import com.gs.ep.pdftranslator.PdfFormatException;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSStream;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The mutable object graph of one input file.
 *
 * <p>
 * PDFBox documents are not thread-safe, so every read or write of the graph from
 * a worker goes through {@link #withLock}. Stream allocation and patch
 * application additionally check that the caller holds the lock.
 * </p>
 */
public class WorkingDocument implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkingDocument.class);

    private final PDDocument document;
    private final byte[] originalBytes;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<COSStream> slots = new ArrayList<>();
    private final Set<ObjectRef> applied = new HashSet<>();
    private final Map<ObjectRef, Repoint> repointed = new LinkedHashMap<>();
    private boolean sealed;
    private PDFont translationFont;

    private WorkingDocument(PDDocument document, byte[] originalBytes) {
        this.document = document;
        this.originalBytes = originalBytes;
    }

    public static WorkingDocument load(byte[] pdfBytes) {
        PDDocument document;
        try {
            document = PDDocument.load(pdfBytes);
        } catch (IOException e) {
            throw new PdfFormatException("Unable to parse PDF: " + e.getMessage(), e);
        }
        if (document.isEncrypted()) {
            LOGGER.info("Input is encrypted; security will be removed from the translated output");
            document.setAllSecurityToBeRemoved(true);
        }
        return new WorkingDocument(document, pdfBytes.clone());
    }

    /**
     * Action run while holding the document lock.
     */
    public interface LockedAction<T> {
        T run(PDDocument document) throws IOException;
    }

    public <T> T withLock(LockedAction<T> action) throws IOException {
        lock.lock();
        try {
            return action.run(document);
        } finally {
            lock.unlock();
        }
    }

    private void checkLocked() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Document graph mutated without holding the document lock");
        }
    }

    public int getPageCount() throws IOException {
        return withLock(PDDocument::getNumberOfPages);
    }

    /**
     * Allocates an empty content stream and returns its handle. Lock required.
     */
    public ObjectRef allocateStream() {
        checkLocked();
        COSStream stream = document.getDocument().createCOSStream();
        slots.add(stream);
        return new ObjectRef(slots.size() - 1);
    }

    /**
     * Makes {@code ref} the only content stream of {@code page}. Lock required.
     */
    public void repointContents(PDPage page, ObjectRef ref) {
        checkLocked();
        if (sealed) {
            throw new IllegalStateException("Document is being assembled, page contents can no longer change");
        }
        COSBase original = page.getCOSObject().getItem(COSName.CONTENTS);
        page.getCOSObject().setItem(COSName.CONTENTS, resolve(ref));
        repointed.put(ref, new Repoint(page, original));
    }

    /**
     * Points every page whose new stream has no patch in {@code patched} back at
     * its original contents, and refuses any later repointing. Lock required.
     *
     * @return the number of pages restored
     */
    public int restoreUnpatched(Collection<ObjectRef> patched) {
        checkLocked();
        sealed = true;
        int restored = 0;
        for (Map.Entry<ObjectRef, Repoint> entry : repointed.entrySet()) {
            if (patched.contains(entry.getKey())) {
                continue;
            }
            Repoint repoint = entry.getValue();
            if (repoint.originalContents == null) {
                repoint.page.getCOSObject().removeItem(COSName.CONTENTS);
            } else {
                repoint.page.getCOSObject().setItem(COSName.CONTENTS, repoint.originalContents);
            }
            restored++;
        }
        return restored;
    }

    public COSStream resolve(ObjectRef ref) {
        if (ref.getSlot() < 0 || ref.getSlot() >= slots.size()) {
            throw new IllegalArgumentException("Unknown stream " + ref);
        }
        return slots.get(ref.getSlot());
    }

    /**
     * Claims a stream for writing its patch. Lock required; a second claim of the
     * same stream fails.
     */
    public COSStream claimForPatch(ObjectRef ref) {
        checkLocked();
        if (!applied.add(ref)) {
            throw new IllegalStateException("Patch for " + ref + " was already applied");
        }
        return resolve(ref);
    }

    public boolean isPatched(ObjectRef ref) {
        return applied.contains(ref);
    }

    public PDFont getTranslationFont() {
        return translationFont;
    }

    public void setTranslationFont(PDFont translationFont) {
        this.translationFont = translationFont;
    }

    public byte[] getOriginalBytes() {
        return originalBytes.clone();
    }

    /**
     * Direct access for single-threaded phases (assembly, tests).
     */
    public PDDocument getDocument() {
        return document;
    }

    private static final class Repoint {
        final PDPage page;
        final COSBase originalContents;

        Repoint(PDPage page, COSBase originalContents) {
            this.page = page;
            this.originalContents = originalContents;
        }
    }

    @Override
    public void close() throws IOException {
        document.close();
    }
}
