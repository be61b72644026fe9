package com.codeabbrev.core.transform;

import com.codeabbrev.core.syntax.BlockStatement;
import com.codeabbrev.core.syntax.SyntaxNode;

/**
 * Commits a candidate only when the whole statement gets strictly shorter.
 */
public class DecisionPolicy {

    public static final String NO_CHARACTER_REDUCTION = "no character reduction";

    public AbbreviationCandidate evaluate(BlockStatement original, int depth, BlockStatement replacement) {
        int saved = serializedLength(original) - serializedLength(replacement);
        return new AbbreviationCandidate(original, depth, replacement, saved);
    }

    public boolean shouldCommit(AbbreviationCandidate candidate) {
        return candidate.charsSaved() > 0;
    }

    /** Length in code points of the node's rendering. */
    public static int serializedLength(SyntaxNode node) {
        String code = node.code();
        return code.codePointCount(0, code.length());
    }
}
