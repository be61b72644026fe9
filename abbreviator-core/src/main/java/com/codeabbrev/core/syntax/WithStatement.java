package com.codeabbrev.core.syntax;

public record WithStatement(Clause clause, boolean async) implements BlockStatement {

    @Override
    public BlockKind kind() { return BlockKind.WITH; }

    @Override
    public void render(StringBuilder out) {
        clause.render(out);
    }
}
