package com.codeabbrev.core.transform;

import com.codeabbrev.core.syntax.BlockStatement;

/**
 * A proposed replacement for an eligible statement. {@code charsSaved} is
 * negative when the placeholder is longer than the original.
 */
public record AbbreviationCandidate(BlockStatement original, int depth,
                                    BlockStatement replacement, int charsSaved) {
}
