package com.codeabbrev.core;

/**
 * Settings for one abbreviation call.
 *
 * There is deliberately no default for {@code preserveChars}: callers name it.
 */
public class AbbreviationOptions {

    public static final int DEFAULT_MAX_DEPTH = 2;
    public static final int DEFAULT_PRESERVE_LINES = 2;

    /** Deepest nesting level left intact. Negative values make every block-bearing node eligible. */
    public final int maxDepth;

    /** Characters of each preview line kept before truncation. Zero disables the preview. */
    public final int preserveChars;

    /** Non-blank lines of the original body shown as preview. Zero disables the preview. */
    public final int preserveLines;

    /** Collect and print a {@link com.codeabbrev.core.debug.DebugInfo} summary. */
    public final boolean debug;

    public AbbreviationOptions(int maxDepth, int preserveChars, int preserveLines, boolean debug) {
        this.maxDepth = maxDepth;
        this.preserveChars = preserveChars;
        this.preserveLines = preserveLines;
        this.debug = debug;
    }

    public static AbbreviationOptions withPreserveChars(int preserveChars) {
        return new AbbreviationOptions(DEFAULT_MAX_DEPTH, preserveChars, DEFAULT_PRESERVE_LINES, false);
    }

    public AbbreviationOptions withMaxDepth(int newMaxDepth) {
        return new AbbreviationOptions(newMaxDepth, preserveChars, preserveLines, debug);
    }

    public AbbreviationOptions withPreserveLines(int newPreserveLines) {
        return new AbbreviationOptions(maxDepth, preserveChars, newPreserveLines, debug);
    }

    public AbbreviationOptions withDebug(boolean newDebug) {
        return new AbbreviationOptions(maxDepth, preserveChars, preserveLines, newDebug);
    }

    @Override
    public String toString() {
        return "depth=" + maxDepth + ", preserve_chars=" + preserveChars
                + ", preserve_lines=" + preserveLines + ", debug=" + debug;
    }
}
