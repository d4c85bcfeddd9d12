package com.gs.ep.pdftranslator.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Parses page selections such as {@code "1,3,5-7"}.
 */
public final class PageRanges {

    private PageRanges() {
    }

    /**
     * @param ranges 1-based pages and inclusive ranges separated by commas
     * @return sorted, distinct 0-based page indices; empty (meaning every page) for a blank selection
     * @throws IllegalArgumentException for anything that is not a page number or range
     */
    public static List<Integer> parse(String ranges) {
        if (ranges == null || ranges.trim().isEmpty()) {
            return Collections.emptyList();
        }
        TreeSet<Integer> pages = new TreeSet<>();
        for (String part : ranges.split(",")) {
            String item = part.trim();
            if (item.isEmpty()) {
                throw new IllegalArgumentException("Empty page range in '" + ranges + "'");
            }
            int dash = item.indexOf('-');
            if (dash < 0) {
                pages.add(pageNumber(item, ranges) - 1);
                continue;
            }
            int first = pageNumber(item.substring(0, dash), ranges);
            int last = pageNumber(item.substring(dash + 1), ranges);
            if (last < first) {
                throw new IllegalArgumentException("Descending page range '" + item + "' in '" + ranges + "'");
            }
            for (int page = first; page <= last; page++) {
                pages.add(page - 1);
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(pages));
    }

    private static int pageNumber(String text, String ranges) {
        int page;
        try {
            page = Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid page number '" + text.trim() + "' in '" + ranges + "'", e);
        }
        if (page < 1) {
            throw new IllegalArgumentException("Page numbers start at 1: '" + ranges + "'");
        }
        return page;
    }
}
