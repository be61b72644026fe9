package com.codeabbrev.core.syntax;

import java.util.List;

/**
 * {@code try} with its {@code except} (or {@code except*}) handlers and the
 * optional {@code else} and {@code finally} clauses.
 */
public record TryStatement(Clause clause, List<Clause> handlers, Clause orElse, Clause finallyClause)
        implements BlockStatement {

    public TryStatement {
        handlers = List.copyOf(handlers);
    }

    @Override
    public BlockKind kind() { return BlockKind.TRY; }

    @Override
    public void render(StringBuilder out) {
        clause.render(out);
        for (Clause handler : handlers) {
            handler.render(out);
        }
        if (orElse != null) orElse.render(out);
        if (finallyClause != null) finallyClause.render(out);
    }
}
