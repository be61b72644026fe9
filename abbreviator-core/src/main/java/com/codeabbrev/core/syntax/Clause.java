package com.codeabbrev.core.syntax;

/**
 * One clause of a compound statement.
 *
 * @param leadingLines blank and comment lines before the clause
 * @param header       from the first decorator (if any) through the colon
 * @param suite        everything after the colon
 */
public record Clause(String leadingLines, String header, Suite suite) implements SyntaxNode {

    @Override
    public void render(StringBuilder out) {
        out.append(leadingLines).append(header);
        suite.render(out);
    }

    public Clause withSuite(Suite newSuite) {
        return new Clause(leadingLines, header, newSuite);
    }

    /** Indentation of the clause header line. */
    public String indent() {
        int end = 0;
        while (end < header.length() && PythonParser.isIndentChar(header.charAt(end))) end++;
        return header.substring(0, end);
    }
}
