package com.gs.ep.pdftranslator.document;

/**
 * Handle to a content stream allocated in a {@link WorkingDocument}.
 */
public final class ObjectRef {
    private final int slot;

    ObjectRef(int slot) {
        this.slot = slot;
    }

    public int getSlot() {
        return slot;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ObjectRef && ((ObjectRef) o).slot == slot;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(slot);
    }

    @Override
    public String toString() {
        return "ObjectRef[" + slot + "]";
    }
}
