package xyz.vvrf.reactor.flow.plan;

import xyz.vvrf.reactor.flow.model.ScopeDefinition;
import xyz.vvrf.reactor.flow.model.ScopeRef;

import java.util.Objects;

/**
 * 一个作用域展开后的可调用单元（不可变）。
 * <p>
 * 入口为所有者的 start 输出与负载输出，出口为 success/failure 输入与结果输入。
 * 所有者每次逻辑迭代调用一次本单元。
 *
 * @author ruifeng.wen
 */
public final class ScopeUnit {
    private final ScopeRef scope;
    private final ScopeDefinition definition;
    private final LayerPlan body;
    private final int depth;

    public ScopeUnit(ScopeRef scope, ScopeDefinition definition, LayerPlan body, int depth) {
        this.scope = Objects.requireNonNull(scope, "作用域不能为空");
        this.definition = Objects.requireNonNull(definition, "作用域定义不能为空");
        this.body = Objects.requireNonNull(body, "作用域主体不能为空");
        this.depth = depth;
    }

    public ScopeRef getScope() {
        return scope;
    }

    public String getOwnerId() {
        return scope.getOwnerId();
    }

    public String getScopeName() {
        return scope.getScopeName();
    }

    public ScopeDefinition getDefinition() {
        return definition;
    }

    public LayerPlan getBody() {
        return body;
    }

    /**
     * 嵌套深度，根层的直接作用域为 1。
     */
    public int getDepth() {
        return depth;
    }

    @Override
    public String toString() {
        return String.format("ScopeUnit[%s, depth=%d, nodes=%d]", scope, depth, body.getNodes().size());
    }
}
