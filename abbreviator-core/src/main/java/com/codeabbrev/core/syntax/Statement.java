package com.codeabbrev.core.syntax;

/**
 * A statement inside a module or an indented block, together with the blank
 * and comment lines that precede it.
 */
public interface Statement extends SyntaxNode {
}
