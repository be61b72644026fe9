package com.codeabbrev.core.transform;

import com.codeabbrev.core.AbbreviationOptions;
import com.codeabbrev.core.debug.DebugInfo;
import com.codeabbrev.core.syntax.BlockStatement;
import com.codeabbrev.core.syntax.ClassDef;
import com.codeabbrev.core.syntax.Clause;
import com.codeabbrev.core.syntax.CompoundStatement;
import com.codeabbrev.core.syntax.ForStatement;
import com.codeabbrev.core.syntax.FunctionDef;
import com.codeabbrev.core.syntax.IfStatement;
import com.codeabbrev.core.syntax.IndentedBlock;
import com.codeabbrev.core.syntax.Module;
import com.codeabbrev.core.syntax.Statement;
import com.codeabbrev.core.syntax.Suite;
import com.codeabbrev.core.syntax.TryStatement;
import com.codeabbrev.core.syntax.WhileStatement;
import com.codeabbrev.core.syntax.WithStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Walks the statement tree tracking nesting depth over block-bearing
 * statements and replaces those nested deeper than
 * {@link AbbreviationOptions#maxDepth} when the replacement is shorter.
 *
 * An eligible statement is the unit of abbreviation: its children are not
 * visited. Statements at or above the threshold are kept and their children
 * are visited.
 */
public class BlockTransformer {

    private final AbbreviationOptions options;
    private final BlockReplacer replacer;
    private final DecisionPolicy policy;

    public BlockTransformer(AbbreviationOptions options) {
        this(options, new DecisionPolicy());
    }

    public BlockTransformer(AbbreviationOptions options, DecisionPolicy policy) {
        this.options = options;
        this.replacer = new BlockReplacer(new PreviewExtractor(options.preserveLines, options.preserveChars));
        this.policy = policy;
    }

    public Module transform(Module module, DebugInfo debugInfo) {
        TraversalContext context = new TraversalContext(module.indentUnit(), module.newline(), debugInfo);
        Module result = module.withBody(visitStatements(module.body(), context));
        if (context.depth() != 0) {
            throw new IllegalStateException("traversal finished at depth " + context.depth());
        }
        return result;
    }

    private List<Statement> visitStatements(List<Statement> statements, TraversalContext context) {
        List<Statement> result = new ArrayList<>(statements.size());
        for (Statement statement : statements) {
            if (statement instanceof BlockStatement block) {
                result.add(visitBlock(block, context));
            } else if (statement instanceof CompoundStatement compound) {
                result.add(compound.withClause(visitClause(compound.clause(), context)));
            } else {
                result.add(statement);
            }
        }
        return result;
    }

    private BlockStatement visitBlock(BlockStatement node, TraversalContext context) {
        int depth = context.enter(node);
        try {
            if (depth > options.maxDepth) {
                return abbreviate(node, depth, context);
            }
            return descend(node, context);
        } catch (TransformException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransformException("Failed to rewrite " + node.kind().displayName()
                    + " at depth " + depth + " (" + path(context) + "): " + e.getMessage(), e);
        } finally {
            context.leave(node);
        }
    }

    private static String path(TraversalContext context) {
        return context.ancestors().stream()
                .map(ancestor -> ancestor.kind().displayName())
                .collect(Collectors.joining(" > "));
    }

    private BlockStatement abbreviate(BlockStatement node, int depth, TraversalContext context) {
        BlockStatement replacement = replacer.buildCandidate(node, context);
        AbbreviationCandidate candidate = policy.evaluate(node, depth, replacement);
        if (policy.shouldCommit(candidate)) {
            context.debugInfo().recordAbbreviated(node.kind(), depth, candidate.charsSaved());
            return candidate.replacement();
        }
        context.debugInfo().recordSkipped(node.kind(), depth, DecisionPolicy.NO_CHARACTER_REDUCTION);
        return node;
    }

    private BlockStatement descend(BlockStatement node, TraversalContext context) {
        switch (node.kind()) {
            case FUNCTION_DEF: {
                FunctionDef def = (FunctionDef) node;
                return def.withClause(visitClause(def.clause(), context));
            }
            case CLASS_DEF:
                return new ClassDef(visitClause(node.clause(), context));
            case IF: {
                IfStatement ifStatement = (IfStatement) node;
                Clause body = visitClause(ifStatement.clause(), context);
                IfStatement elif = ifStatement.elif() == null
                        ? null
                        : (IfStatement) visitBlock(ifStatement.elif(), context);
                return new IfStatement(body, elif, visitClause(ifStatement.orElse(), context));
            }
            case WHILE: {
                WhileStatement loop = (WhileStatement) node;
                return new WhileStatement(visitClause(loop.clause(), context), visitClause(loop.orElse(), context));
            }
            case FOR: {
                ForStatement loop = (ForStatement) node;
                return new ForStatement(visitClause(loop.clause(), context), visitClause(loop.orElse(), context),
                        loop.async());
            }
            case TRY: {
                TryStatement tryStatement = (TryStatement) node;
                Clause body = visitClause(tryStatement.clause(), context);
                List<Clause> handlers = new ArrayList<>();
                for (Clause handler : tryStatement.handlers()) {
                    handlers.add(visitClause(handler, context));
                }
                return new TryStatement(body, handlers, visitClause(tryStatement.orElse(), context),
                        visitClause(tryStatement.finallyClause(), context));
            }
            case WITH: {
                WithStatement with = (WithStatement) node;
                return new WithStatement(visitClause(with.clause(), context), with.async());
            }
            default:
                throw new IllegalArgumentException("Unsupported block kind: " + node.kind());
        }
    }

    private Clause visitClause(Clause clause, TraversalContext context) {
        if (clause == null) return null;
        Suite suite = clause.suite();
        if (suite instanceof IndentedBlock block) {
            return clause.withSuite(block.withBody(visitStatements(block.body(), context)));
        }
        // inline suites hold simple statements only
        return clause;
    }
}
