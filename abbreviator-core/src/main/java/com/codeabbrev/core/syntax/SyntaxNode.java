package com.codeabbrev.core.syntax;

/**
 * A node of the full-fidelity tree. Rendering an untouched node reproduces
 * the exact source text it was parsed from.
 */
public interface SyntaxNode {

    void render(StringBuilder out);

    default String code() {
        StringBuilder out = new StringBuilder();
        render(out);
        return out.toString();
    }
}
