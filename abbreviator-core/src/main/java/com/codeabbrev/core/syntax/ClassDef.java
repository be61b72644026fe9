package com.codeabbrev.core.syntax;

public record ClassDef(Clause clause) implements BlockStatement {

    @Override
    public BlockKind kind() { return BlockKind.CLASS_DEF; }

    @Override
    public void render(StringBuilder out) {
        clause.render(out);
    }
}
