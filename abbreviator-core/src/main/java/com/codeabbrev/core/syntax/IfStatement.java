package com.codeabbrev.core.syntax;

/**
 * An {@code if} (or {@code elif}) clause. An {@code elif} continuation is held
 * as a nested IfStatement in {@code elif}; a plain {@code else} in
 * {@code orElse}. At most one of the two is non-null.
 */
public record IfStatement(Clause clause, IfStatement elif, Clause orElse) implements BlockStatement {

    public IfStatement {
        if (elif != null && orElse != null) {
            throw new IllegalArgumentException("if statement cannot have both elif and else continuations");
        }
    }

    @Override
    public BlockKind kind() { return BlockKind.IF; }

    @Override
    public void render(StringBuilder out) {
        clause.render(out);
        if (elif != null) elif.render(out);
        if (orElse != null) orElse.render(out);
    }
}
