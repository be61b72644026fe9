package com.codeabbrev.core.syntax;

public record WhileStatement(Clause clause, Clause orElse) implements BlockStatement {

    @Override
    public BlockKind kind() { return BlockKind.WHILE; }

    @Override
    public void render(StringBuilder out) {
        clause.render(out);
        if (orElse != null) orElse.render(out);
    }
}
