package com.codeabbrev.core.transform;

import com.codeabbrev.core.syntax.BlockStatement;
import com.codeabbrev.core.syntax.ClassDef;
import com.codeabbrev.core.syntax.Clause;
import com.codeabbrev.core.syntax.ForStatement;
import com.codeabbrev.core.syntax.FunctionDef;
import com.codeabbrev.core.syntax.IfStatement;
import com.codeabbrev.core.syntax.IndentedBlock;
import com.codeabbrev.core.syntax.SimpleStatement;
import com.codeabbrev.core.syntax.Statement;
import com.codeabbrev.core.syntax.Suite;
import com.codeabbrev.core.syntax.TryStatement;
import com.codeabbrev.core.syntax.WhileStatement;
import com.codeabbrev.core.syntax.WithStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the abbreviated form of a block-bearing statement: every body it owns
 * becomes preview comments, an ellipsis comment and {@code pass}.
 */
public class BlockReplacer {

    static final String ELLIPSIS_COMMENT = "# ...";
    static final String NO_OP_STATEMENT = "pass";

    private final PreviewExtractor previewExtractor;

    public BlockReplacer(PreviewExtractor previewExtractor) {
        this.previewExtractor = previewExtractor;
    }

    /**
     * Returns the candidate for {@code node}. Every suite of the statement is
     * replaced; an {@code elif} continuation collapses into a single
     * {@code else} holding the placeholder of the elif's own body.
     */
    public BlockStatement buildCandidate(BlockStatement node, TraversalContext context) {
        switch (node.kind()) {
            case FUNCTION_DEF: {
                FunctionDef def = (FunctionDef) node;
                return def.withClause(abbreviate(def.clause(), context));
            }
            case CLASS_DEF:
                return new ClassDef(abbreviate(node.clause(), context));
            case IF: {
                IfStatement ifStatement = (IfStatement) node;
                Clause orElse = abbreviate(ifStatement.orElse(), context);
                if (ifStatement.elif() != null) {
                    Clause elif = ifStatement.elif().clause();
                    orElse = new Clause("", elif.indent() + "else:",
                            placeholderFor(elif.suite(), elif.indent(), context));
                }
                return new IfStatement(abbreviate(ifStatement.clause(), context), null, orElse);
            }
            case WHILE: {
                WhileStatement loop = (WhileStatement) node;
                return new WhileStatement(abbreviate(loop.clause(), context), abbreviate(loop.orElse(), context));
            }
            case FOR: {
                ForStatement loop = (ForStatement) node;
                return new ForStatement(abbreviate(loop.clause(), context), abbreviate(loop.orElse(), context),
                        loop.async());
            }
            case TRY: {
                TryStatement tryStatement = (TryStatement) node;
                List<Clause> handlers = new ArrayList<>();
                for (Clause handler : tryStatement.handlers()) {
                    handlers.add(abbreviate(handler, context));
                }
                return new TryStatement(abbreviate(tryStatement.clause(), context), handlers,
                        abbreviate(tryStatement.orElse(), context),
                        abbreviate(tryStatement.finallyClause(), context));
            }
            case WITH: {
                WithStatement with = (WithStatement) node;
                return new WithStatement(abbreviate(with.clause(), context), with.async());
            }
            default:
                throw new IllegalArgumentException("Unsupported block kind: " + node.kind());
        }
    }

    private Clause abbreviate(Clause clause, TraversalContext context) {
        if (clause == null) return null;
        return clause.withSuite(placeholderFor(clause.suite(), clause.indent(), context));
    }

    /**
     * Placeholder block for {@code original}. It keeps the original block's
     * indentation; an inline suite moves onto its own lines one indent unit
     * deeper than the clause header.
     */
    public IndentedBlock placeholderFor(Suite original, String clauseIndent, TraversalContext context) {
        String indent = original instanceof IndentedBlock block
                ? block.indent()
                : clauseIndent + context.indentUnit();
        String newline = context.newline();

        StringBuilder comments = new StringBuilder();
        for (String preview : previewExtractor.extract(original.code())) {
            comments.append(indent).append(preview).append(newline);
        }
        comments.append(indent).append(ELLIPSIS_COMMENT).append(newline);

        Statement noOp = new SimpleStatement(comments.toString(), indent + NO_OP_STATEMENT + newline);
        return new IndentedBlock(newline, indent, List.of(noOp), "");
    }
}
