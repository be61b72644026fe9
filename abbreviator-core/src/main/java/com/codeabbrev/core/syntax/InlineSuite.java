package com.codeabbrev.core.syntax;

/**
 * Simple statements on the header line itself, e.g. {@code if ready: return x}.
 * {@code text} starts right after the colon and ends with the line break.
 */
public record InlineSuite(String text) implements Suite {

    @Override
    public void render(StringBuilder out) {
        out.append(text);
    }
}
