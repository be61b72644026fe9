package com.codeabbrev.core.syntax;

public record ForStatement(Clause clause, Clause orElse, boolean async) implements BlockStatement {

    @Override
    public BlockKind kind() { return BlockKind.FOR; }

    @Override
    public void render(StringBuilder out) {
        clause.render(out);
        if (orElse != null) orElse.render(out);
    }
}
