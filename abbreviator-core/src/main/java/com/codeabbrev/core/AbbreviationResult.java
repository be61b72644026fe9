package com.codeabbrev.core;

import com.codeabbrev.core.debug.DebugInfo;

/**
 * Outcome of one {@link CodeAbbreviator#abbreviate} call.
 *
 * @param text             the abbreviated source, or the input unchanged when {@code failed}
 * @param debugInfo        what the traversal considered; disabled unless debug was requested
 * @param originalChars    code points in the input
 * @param abbreviatedChars code points in {@code text}
 * @param failed           whether the input was returned unchanged because of an error
 */
public record AbbreviationResult(String text, DebugInfo debugInfo, int originalChars,
                                 int abbreviatedChars, boolean failed) {

    public int charsSaved() {
        return originalChars - abbreviatedChars;
    }

    /** Percentage of the original size removed, 0 for empty input. */
    public double percentSaved() {
        return originalChars == 0 ? 0.0 : charsSaved() * 100.0 / originalChars;
    }
}
