package com.codeabbrev.core.syntax;

import java.util.List;

/**
 * A suite on its own lines.
 *
 * @param headerTrail whitespace, comment and newline after the header colon
 * @param indent      absolute indentation of the block's statements
 * @param body        statements of the block
 * @param footer      indented comment lines after the last statement
 */
public record IndentedBlock(String headerTrail, String indent, List<Statement> body, String footer)
        implements Suite {

    public IndentedBlock {
        body = List.copyOf(body);
    }

    @Override
    public void render(StringBuilder out) {
        out.append(headerTrail);
        for (Statement statement : body) {
            statement.render(out);
        }
        out.append(footer);
    }

    public IndentedBlock withBody(List<Statement> newBody) {
        return new IndentedBlock(headerTrail, indent, newBody, footer);
    }
}
