package com.codeabbrev.core.syntax;

import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSPoint;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parses Python source into a full-fidelity statement tree.
 *
 * tree-sitter validates the whole grammar and locates statements and clause
 * colons; the tree itself is cut from the source by line boundaries, so
 * rendering the returned {@link Module} reproduces the input exactly.
 * Expressions stay as raw text inside headers and simple statements.
 */
public class PythonParser {

    static final String DEFAULT_INDENT = "    ";
    static final String DEFAULT_NEWLINE = "\n";

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    /** Hard keywords. tree-sitter lexes a misplaced one as a plain identifier. */
    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
            "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
            "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");

    /** Python 2 statement forms the grammar still accepts. */
    private static final Set<String> LEGACY_STATEMENTS = Set.of("print_statement", "exec_statement");

    private static final Set<String> COMPOUND_STATEMENTS = Set.of(
            "function_definition", "class_definition", "decorated_definition", "if_statement",
            "while_statement", "for_statement", "try_statement", "with_statement", "match_statement",
            "case_clause");

    private static final Set<String> CONTINUATION_CLAUSES = Set.of(
            "elif_clause", "else_clause", "except_clause", "except_group_clause", "finally_clause");

    private static final Set<String> TRIVIA = Set.of("comment", "line_continuation");

    public Module parse(String source) throws ParseException {
        String prefix = "";
        String text = source;
        if (text.startsWith(BYTE_ORDER_MARK)) {
            prefix = BYTE_ORDER_MARK;
            text = text.substring(1);
        }
        String newline = detectNewline(text);
        boolean trailingNewline = text.isEmpty() || text.endsWith("\n") || text.endsWith("\r");
        if (!trailingNewline) {
            text = text + newline;
        }
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        if (!new String(bytes, StandardCharsets.UTF_8).equals(text)) {
            throw new ParseException("source contains an unpaired surrogate", 1);
        }

        TSParser parser = new TSParser();
        parser.setLanguage(new TreeSitterPython());
        TSTree tree = parser.parseString(null, text);
        TSNode root = tree.getRootNode();
        if (root.hasError()) {
            throw syntaxError(root);
        }
        TreeBuilder builder = new TreeBuilder(bytes);
        builder.rejectInvalidTokens(root);
        return builder.buildModule(root, prefix, newline, trailingNewline);
    }

    static String detectNewline(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') return "\n";
            if (c == '\r') {
                return i + 1 < text.length() && text.charAt(i + 1) == '\n' ? "\r\n" : "\r";
            }
        }
        return DEFAULT_NEWLINE;
    }

    /** Reports the first ERROR node, or the first token tree-sitter had to insert. */
    private static ParseException syntaxError(TSNode node) {
        TSNode current = node;
        while (!current.isError()) {
            TSNode next = null;
            for (int i = 0; i < current.getChildCount(); i++) {
                TSNode child = current.getChild(i);
                if (child.hasError()) {
                    next = child;
                    break;
                }
            }
            if (next == null) {
                return new ParseException("expected '" + current.getType() + "'", lineOf(current));
            }
            current = next;
        }
        return new ParseException("invalid syntax", lineOf(current));
    }

    private static int lineOf(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    static boolean isIndentChar(char c) {
        return c == ' ' || c == '\t' || c == '\f';
    }

    /**
     * Cuts the source into statements and clauses. Works on UTF-8 bytes since
     * tree-sitter positions are byte offsets. Blank and comment lines are owned
     * by the statement or clause that follows them, except for indented
     * comments closing a block, which stay in that block's footer.
     */
    private static final class TreeBuilder {

        private final byte[] source;
        private final int[] lineStarts;
        private int row;
        private String indentUnit;

        TreeBuilder(byte[] source) {
            this.source = source;
            List<Integer> starts = new ArrayList<>();
            starts.add(0);
            for (int i = 0; i < source.length; i++) {
                if (source[i] == '\n') starts.add(i + 1);
            }
            if (starts.get(starts.size() - 1) != source.length) {
                starts.add(source.length);
            }
            this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
        }

        void rejectInvalidTokens(TSNode node) throws ParseException {
            String type = node.getType();
            if (LEGACY_STATEMENTS.contains(type)) {
                throw new ParseException("Python 2 " + type.replace('_', ' ') + " is not supported", lineOf(node));
            }
            if (type.equals("identifier") && KEYWORDS.contains(text(node.getStartByte(), node.getEndByte()))) {
                throw new ParseException("invalid syntax", lineOf(node));
            }
            for (int i = 0; i < node.getChildCount(); i++) {
                rejectInvalidTokens(node.getChild(i));
            }
        }

        Module buildModule(TSNode root, String prefix, String newline, boolean trailingNewline)
                throws ParseException {
            List<Statement> body = parseStatements(statementsOf(root), "");
            String footer = text(lineStarts[row], source.length);
            return new Module(prefix, body, footer,
                    indentUnit != null ? indentUnit : DEFAULT_INDENT, newline, trailingNewline);
        }

        private List<Statement> parseStatements(List<TSNode> nodes, String indent) throws ParseException {
            List<Statement> body = new ArrayList<>();
            int i = 0;
            while (i < nodes.size()) {
                TSNode node = nodes.get(i);
                int start = node.getStartPoint().getRow();
                if (start < row) {
                    throw new ParseException("invalid syntax", start + 1);
                }
                checkIndent(start, indent);
                String leading = text(lineStarts[row], lineStarts[start]);
                row = start;
                i++;
                if (COMPOUND_STATEMENTS.contains(node.getType())) {
                    body.add(parseCompound(leading, node));
                    continue;
                }
                // statements joined by ';' share one line
                int end = lastCodeRow(node);
                while (i < nodes.size() && nodes.get(i).getStartPoint().getRow() == end) {
                    if (COMPOUND_STATEMENTS.contains(nodes.get(i).getType())) {
                        throw new ParseException("invalid syntax", end + 1);
                    }
                    end = lastCodeRow(nodes.get(i));
                    i++;
                }
                row = end + 1;
                body.add(new SimpleStatement(leading, text(lineStarts[start], lineStarts[row])));
            }
            return body;
        }

        private void checkIndent(int line, String expected) throws ParseException {
            String actual = indentOf(line);
            if (actual.equals(expected)) return;
            if (actual.length() > expected.length() && actual.startsWith(expected)) {
                throw new ParseException("unexpected indent", line + 1);
            }
            if (actual.length() < expected.length() && expected.startsWith(actual)) {
                throw new ParseException("unindent does not match any outer indentation level", line + 1);
            }
            throw new ParseException("inconsistent use of tabs and spaces in indentation", line + 1);
        }

        private Statement parseCompound(String leading, TSNode node) throws ParseException {
            String indent = indentOf(row);
            switch (node.getType()) {
                case "decorated_definition": {
                    TSNode definition = node.getChildByFieldName("definition");
                    Clause clause = parseClause(leading, definition);
                    return definition.getType().equals("class_definition")
                            ? new ClassDef(clause)
                            : new FunctionDef(clause, isAsync(definition));
                }
                case "function_definition":
                    return new FunctionDef(parseClause(leading, node), isAsync(node));
                case "class_definition":
                    return new ClassDef(parseClause(leading, node));
                case "if_statement":
                    return parseIf(leading, node, indent);
                case "while_statement": {
                    Clause clause = parseClause(leading, node);
                    List<Clause> rest = parseContinuations(node, indent);
                    return new WhileStatement(clause, rest.isEmpty() ? null : rest.get(0));
                }
                case "for_statement": {
                    Clause clause = parseClause(leading, node);
                    List<Clause> rest = parseContinuations(node, indent);
                    return new ForStatement(clause, rest.isEmpty() ? null : rest.get(0), isAsync(node));
                }
                case "try_statement":
                    return parseTry(leading, node, indent);
                case "with_statement":
                    return new WithStatement(parseClause(leading, node), isAsync(node));
                case "match_statement":
                    return new CompoundStatement("match", parseClause(leading, node));
                case "case_clause":
                    return new CompoundStatement("case", parseClause(leading, node));
                default:
                    throw new IllegalStateException("not a compound statement: " + node.getType());
            }
        }

        private IfStatement parseIf(String leading, TSNode node, String indent) throws ParseException {
            Clause clause = parseClause(leading, node);
            List<Clause> elifs = new ArrayList<>();
            Clause orElse = null;
            for (TSNode child : continuationsOf(node)) {
                Clause continuation = parseContinuation(child, indent);
                if (child.getType().equals("elif_clause")) {
                    elifs.add(continuation);
                } else {
                    orElse = continuation;
                }
            }
            // elif chain becomes nested ifs, innermost first
            IfStatement tail = null;
            for (int i = elifs.size() - 1; i >= 0; i--) {
                tail = new IfStatement(elifs.get(i), tail, tail == null ? orElse : null);
            }
            return new IfStatement(clause, tail, tail == null ? orElse : null);
        }

        private TryStatement parseTry(String leading, TSNode node, String indent) throws ParseException {
            Clause clause = parseClause(leading, node);
            List<Clause> handlers = new ArrayList<>();
            Clause orElse = null;
            Clause finallyClause = null;
            for (TSNode child : continuationsOf(node)) {
                Clause continuation = parseContinuation(child, indent);
                switch (child.getType()) {
                    case "else_clause" -> orElse = continuation;
                    case "finally_clause" -> finallyClause = continuation;
                    default -> handlers.add(continuation);
                }
            }
            return new TryStatement(clause, handlers, orElse, finallyClause);
        }

        private List<Clause> parseContinuations(TSNode node, String indent) throws ParseException {
            List<Clause> clauses = new ArrayList<>();
            for (TSNode child : continuationsOf(node)) {
                clauses.add(parseContinuation(child, indent));
            }
            return clauses;
        }

        private Clause parseContinuation(TSNode node, String ownerIndent) throws ParseException {
            int start = node.getStartPoint().getRow();
            if (start < row || !indentOf(start).equals(ownerIndent)) {
                throw new ParseException("invalid syntax", start + 1);
            }
            String leading = text(lineStarts[row], lineStarts[start]);
            row = start;
            return parseClause(leading, node);
        }

        /**
         * Parses the clause owned by {@code node}: its header runs from the
         * current line through the colon in front of the clause's block.
         */
        private Clause parseClause(String leading, TSNode node) throws ParseException {
            int blockIndex = -1;
            TSNode colon = null;
            for (int i = 0; i < node.getChildCount(); i++) {
                TSNode child = node.getChild(i);
                if (child.getType().equals("block")) {
                    blockIndex = i;
                    break;
                }
                if (child.getType().equals(":")) colon = child;
            }
            if (blockIndex < 0 || colon == null) {
                throw new ParseException("expected ':'", lineOf(node));
            }
            TSNode block = node.getChild(blockIndex);
            String headerIndent = indentOf(row);
            String header = text(lineStarts[row], colon.getEndByte());
            int colonRow = colon.getEndPoint().getRow();

            List<TSNode> statements = statementsOf(block);
            if (statements.isEmpty()) {
                throw new ParseException("expected an indented block", colonRow + 2);
            }
            int first = statements.get(0).getStartPoint().getRow();
            if (first == colonRow) {
                int end = lastCodeRow(block);
                row = end + 1;
                return new Clause(leading, header, new InlineSuite(text(colon.getEndByte(), lineStarts[row])));
            }

            String headerTrail = text(colon.getEndByte(), lineStarts[colonRow + 1]);
            row = colonRow + 1;
            String blockIndent = indentOf(first);
            if (blockIndent.length() <= headerIndent.length() || !blockIndent.startsWith(headerIndent)) {
                throw new ParseException("expected an indented block", first + 1);
            }
            if (indentUnit == null) {
                indentUnit = blockIndent.substring(headerIndent.length());
            }
            List<Statement> body = parseStatements(statements, blockIndent);
            int footerEnd = footerEnd(blockIndent);
            String footer = text(lineStarts[row], lineStarts[footerEnd]);
            row = footerEnd;
            return new Clause(leading, header, new IndentedBlock(headerTrail, blockIndent, body, footer));
        }

        /** The block keeps trailing comments indented at least as deep as its statements. */
        private int footerEnd(String blockIndent) {
            int end = row;
            for (int line = row; line < lineCount() && isTrivia(line); line++) {
                if (!isComment(line)) continue;
                if (indentOf(line).length() < blockIndent.length()) break;
                end = line + 1;
            }
            return end;
        }

        private List<TSNode> statementsOf(TSNode container) {
            List<TSNode> statements = new ArrayList<>();
            for (int i = 0; i < container.getNamedChildCount(); i++) {
                TSNode child = container.getNamedChild(i);
                if (!TRIVIA.contains(child.getType())) statements.add(child);
            }
            return statements;
        }

        private static List<TSNode> continuationsOf(TSNode node) {
            List<TSNode> clauses = new ArrayList<>();
            for (int i = 0; i < node.getChildCount(); i++) {
                TSNode child = node.getChild(i);
                if (CONTINUATION_CLAUSES.contains(child.getType())) clauses.add(child);
            }
            return clauses;
        }

        private static boolean isAsync(TSNode node) {
            return node.getChildCount() > 0 && node.getChild(0).getType().equals("async");
        }

        /** Row of the last token that is not a comment; trailing comments are placed by indentation instead. */
        private int lastCodeRow(TSNode node) {
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                TSNode child = node.getChild(i);
                if (TRIVIA.contains(child.getType()) || child.getStartByte() == child.getEndByte()) continue;
                return lastCodeRow(child);
            }
            TSPoint end = node.getEndPoint();
            return end.getColumn() == 0 && end.getRow() > node.getStartPoint().getRow()
                    ? end.getRow() - 1
                    : end.getRow();
        }

        private int lineCount() {
            return lineStarts.length - 1;
        }

        private String indentOf(int line) {
            int start = lineStarts[line];
            int end = start;
            while (end < lineStarts[line + 1] && isIndentChar((char) source[end])) end++;
            return text(start, end);
        }

        private boolean isTrivia(int line) {
            String content = text(lineStarts[line], lineStarts[line + 1]).strip();
            return content.isEmpty() || content.startsWith("#");
        }

        private boolean isComment(int line) {
            return text(lineStarts[line], lineStarts[line + 1]).strip().startsWith("#");
        }

        private String text(int from, int to) {
            return new String(source, from, to - from, StandardCharsets.UTF_8);
        }
    }
}
