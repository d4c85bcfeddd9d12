package com.gs.ep.pdftranslator.layout;

/**
 * Region labels reported by the layout detector.
 * Protected categories are copied into the output without translation.
 */
public enum LayoutCategory {

    TITLE("title", false),

    TEXT("text", false),

    PLAIN_TEXT("plain_text", false),

    FIGURE("figure", true),

    FIGURE_CAPTION("figure_caption", false),

    TABLE("table", true),

    TABLE_CAPTION("table_caption", false),

    TABLE_FOOTNOTE("table_footnote", false),

    ISOLATED_FORMULA("isolated_formula", true),

    FORMULA_CAPTION("formula_caption", true),

    /**
     * Headers, footers and other content the detector chose to discard.
     */
    ABANDON("abandon", true);

    private final String label;
    private final boolean protectedRegion;

    LayoutCategory(String label, boolean protectedRegion) {
        this.label = label;
        this.protectedRegion = protectedRegion;
    }

    public String getLabel() {
        return label;
    }

    public boolean isProtected() {
        return protectedRegion;
    }

    /**
     * Resolves a detector label. "isolate_formula" is accepted as an alias since
     * some model exports spell it that way.
     */
    public static LayoutCategory fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Layout label must not be null");
        }
        String normalized = label.trim().toLowerCase();
        if ("isolate_formula".equals(normalized)) {
            return ISOLATED_FORMULA;
        }
        for (LayoutCategory category : values()) {
            if (category.label.equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown layout label: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
