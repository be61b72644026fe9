package com.codeabbrev.core.transform;

import com.codeabbrev.core.debug.DebugInfo;
import com.codeabbrev.core.syntax.BlockStatement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * State of one traversal: the stack of enclosing block-bearing nodes (its
 * size is the current depth), the module's layout conventions and the debug
 * collector. Created per call and never shared.
 */
public final class TraversalContext {

    private final Deque<BlockStatement> stack = new ArrayDeque<>();
    private final String indentUnit;
    private final String newline;
    private final DebugInfo debugInfo;

    public TraversalContext(String indentUnit, String newline, DebugInfo debugInfo) {
        this.indentUnit = indentUnit;
        this.newline = newline;
        this.debugInfo = debugInfo;
    }

    /** Pushes {@code node} and returns its depth. */
    public int enter(BlockStatement node) {
        stack.push(node);
        debugInfo.consider(node.kind(), depth());
        return depth();
    }

    public void leave(BlockStatement node) {
        BlockStatement top = stack.poll();
        if (top != node) {
            throw new IllegalStateException("unbalanced traversal: leaving " + node.kind().displayName()
                    + " but top of stack is " + (top == null ? "empty" : top.kind().displayName()));
        }
    }

    public int depth() { return stack.size(); }

    /** Enclosing nodes, outermost first. */
    public List<BlockStatement> ancestors() {
        List<BlockStatement> path = new ArrayList<>(stack);
        Collections.reverse(path);
        return path;
    }

    public String indentUnit()    { return indentUnit; }
    public String newline()       { return newline; }
    public DebugInfo debugInfo()  { return debugInfo; }
}
