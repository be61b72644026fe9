package com.codeabbrev.core.syntax;

/**
 * Everything after the colon of a clause header: either an indented block or
 * an inline run of simple statements.
 */
public interface Suite extends SyntaxNode {
}
