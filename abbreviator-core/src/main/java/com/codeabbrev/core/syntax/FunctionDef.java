package com.codeabbrev.core.syntax;

public record FunctionDef(Clause clause, boolean async) implements BlockStatement {

    @Override
    public BlockKind kind() { return BlockKind.FUNCTION_DEF; }

    @Override
    public void render(StringBuilder out) {
        clause.render(out);
    }

    public FunctionDef withClause(Clause newClause) {
        return new FunctionDef(newClause, async);
    }
}
