package com.codeabbrev.core.syntax;

import java.util.List;

/**
 * Root of the tree.
 *
 * @param prefix          byte order mark, if the source had one
 * @param body            top-level statements
 * @param footer          trailing blank and comment lines
 * @param indentUnit      indentation step detected from the first indented block
 * @param newline         line break detected from the first line
 * @param trailingNewline whether the source ended with a line break
 */
public record Module(String prefix, List<Statement> body, String footer,
                     String indentUnit, String newline, boolean trailingNewline) implements SyntaxNode {

    public Module {
        body = List.copyOf(body);
    }

    @Override
    public void render(StringBuilder out) {
        int start = out.length();
        out.append(prefix);
        for (Statement statement : body) {
            statement.render(out);
        }
        out.append(footer);
        // The parser appended one line break to unterminated input; drop it again.
        if (!trailingNewline && out.length() - start >= newline.length()
                && out.substring(out.length() - newline.length()).equals(newline)) {
            out.setLength(out.length() - newline.length());
        }
    }

    public Module withBody(List<Statement> newBody) {
        return new Module(prefix, newBody, footer, indentUnit, newline, trailingNewline);
    }
}
