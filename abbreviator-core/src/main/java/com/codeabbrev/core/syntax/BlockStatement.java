package com.codeabbrev.core.syntax;

/**
 * A block-bearing statement. {@link #clause()} is the leading clause
 * ({@code def}, {@code if}, {@code try}, ...).
 */
public interface BlockStatement extends Statement {

    BlockKind kind();

    Clause clause();
}
