package com.codeabbrev.core.transform;

import com.codeabbrev.core.debug.DebugInfo;
import com.codeabbrev.core.syntax.BlockStatement;
import com.codeabbrev.core.syntax.PythonParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TraversalContextTest {

    @Test
    void depthFollowsTheStack() throws Exception {
        List<?> body = new PythonParser().parse("class A:\n    pass\nclass B:\n    pass\n").body();
        BlockStatement a = (BlockStatement) body.get(0);
        BlockStatement b = (BlockStatement) body.get(1);
        DebugInfo debug = new DebugInfo(true);
        TraversalContext context = new TraversalContext("    ", "\n", debug);

        assertEquals(1, context.enter(a));
        assertEquals(2, context.enter(b));
        assertEquals(List.of(a, b), context.ancestors());
        context.leave(b);
        context.leave(a);

        assertEquals(0, context.depth());
        assertEquals(2, debug.getNodesConsidered());
        assertEquals(2, debug.getMaxDepthReached());
    }

    @Test
    void unbalancedLeaveFails() throws Exception {
        BlockStatement a = (BlockStatement) new PythonParser().parse("class A:\n    pass\n").body().get(0);
        TraversalContext context = new TraversalContext("    ", "\n", DebugInfo.disabled());
        assertThrows(IllegalStateException.class, () -> context.leave(a));
    }
}
