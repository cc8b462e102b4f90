package xyz.vvrf.reactor.flow.plan;

import xyz.vvrf.reactor.flow.graph.WorkflowCompilationException;

/**
 * 作用域展开深度超过上限时抛出。
 */
public class ScopeDepthExceededException extends WorkflowCompilationException {

    private final int maxDepth;

    public ScopeDepthExceededException(String scope, int maxDepth) {
        super(String.format("Scope '%s' exceeds the maximum nesting depth of %d", scope, maxDepth));
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
