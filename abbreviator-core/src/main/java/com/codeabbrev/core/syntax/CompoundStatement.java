package com.codeabbrev.core.syntax;

/**
 * A compound statement that does not count towards nesting depth
 * ({@code match} and its {@code case} clauses). Its suite is still traversed.
 */
public record CompoundStatement(String keyword, Clause clause) implements Statement {

    @Override
    public void render(StringBuilder out) {
        clause.render(out);
    }

    public CompoundStatement withClause(Clause newClause) {
        return new CompoundStatement(keyword, newClause);
    }
}
