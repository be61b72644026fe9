package com.codeabbrev.core.transform;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the comment lines that show the start of an abbreviated body.
 */
public class PreviewExtractor {

    static final String TRUNCATION_MARKER = "...";

    private final int preserveLines;
    private final int preserveChars;

    public PreviewExtractor(int preserveLines, int preserveChars) {
        this.preserveLines = preserveLines;
        this.preserveChars = preserveChars;
    }

    /**
     * Returns up to {@code preserveLines} comment texts ({@code "# ..."}, no
     * indentation, no line break) taken from the non-blank lines of
     * {@code bodyText}, in order, with leading whitespace removed and cut to
     * {@code preserveChars} code points.
     */
    public List<String> extract(String bodyText) {
        List<String> preview = new ArrayList<>();
        if (preserveLines <= 0 || preserveChars <= 0) {
            return preview;
        }
        for (String line : bodyText.split("\r\n|\r|\n")) {
            if (line.isBlank()) continue;
            preview.add("# " + truncate(line.stripLeading()));
            if (preview.size() >= preserveLines) break;
        }
        return preview;
    }

    private String truncate(String content) {
        if (content.codePointCount(0, content.length()) <= preserveChars) {
            return content;
        }
        int end = content.offsetByCodePoints(0, preserveChars);
        return content.substring(0, end) + TRUNCATION_MARKER;
    }
}
