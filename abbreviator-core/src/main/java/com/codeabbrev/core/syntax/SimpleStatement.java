package com.codeabbrev.core.syntax;

/**
 * One logical line that is not a compound statement.
 */
public record SimpleStatement(String leadingLines, String text) implements Statement {

    @Override
    public void render(StringBuilder out) {
        out.append(leadingLines).append(text);
    }
}
