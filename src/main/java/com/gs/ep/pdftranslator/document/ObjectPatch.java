package com.gs.ep.pdftranslator.document;

import java.util.Arrays;

/**
 * Rewritten content of one page: the raw (unencoded) content-stream bytes for the
 * stream the page now points to.
 */
public class ObjectPatch {
    private final int pageIndex;
    private final ObjectRef target;
    private final byte[] payload;
    private final int translatedRuns;

    public ObjectPatch(int pageIndex, ObjectRef target, byte[] payload, int translatedRuns) {
        this.pageIndex = pageIndex;
        this.target = target;
        this.payload = payload.clone();
        this.translatedRuns = translatedRuns;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public ObjectRef getTarget() {
        return target;
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    public int getPayloadLength() {
        return payload.length;
    }

    public int getTranslatedRuns() {
        return translatedRuns;
    }

    @Override
    public String toString() {
        return "ObjectPatch[page=" + pageIndex + ", target=" + target + ", bytes=" + payload.length
                + ", runs=" + translatedRuns + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ObjectPatch)) {
            return false;
        }
        ObjectPatch other = (ObjectPatch) o;
        return pageIndex == other.pageIndex && target.equals(other.target) && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * pageIndex + target.hashCode()) + Arrays.hashCode(payload);
    }
}
