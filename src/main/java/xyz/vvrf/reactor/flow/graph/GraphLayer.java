package xyz.vvrf.reactor.flow.graph;

import xyz.vvrf.reactor.flow.model.ScopeRef;
import xyz.vvrf.reactor.flow.model.Workflow;

import java.util.Objects;
import java.util.Optional;

/**
 * 一个作用域层：根层（工作流本身），或者某个所有者上的一个作用域。
 * 每一层单独构建控制流图并单独排序。
 *
 * @author ruifeng.wen
 */
public final class GraphLayer {
    private static final GraphLayer ROOT = new GraphLayer(null);

    private final ScopeRef scope;

    private GraphLayer(ScopeRef scope) {
        this.scope = scope;
    }

    public static GraphLayer root() {
        return ROOT;
    }

    public static GraphLayer of(ScopeRef scope) {
        return new GraphLayer(Objects.requireNonNull(scope, "作用域不能为空"));
    }

    /**
     * 由 Optional 作用域得到层：empty 对应根层。
     */
    public static GraphLayer of(Optional<ScopeRef> scope) {
        return scope.isPresent() ? of(scope.get()) : root();
    }

    public boolean isRoot() {
        return scope == null;
    }

    public Optional<ScopeRef> getScope() {
        return Optional.ofNullable(scope);
    }

    /**
     * 实例是否属于本层（不含 Start/Exit）。
     */
    public boolean contains(Workflow workflow, String instanceId) {
        if (!workflow.findInstance(instanceId).isPresent()) {
            return false;
        }
        Optional<ScopeRef> owner = workflow.getScopeOf(instanceId);
        return isRoot() ? !owner.isPresent() : owner.isPresent() && owner.get().equals(scope);
    }

    /**
     * 层的显示名称，用于日志与诊断。
     */
    public String describe(Workflow workflow) {
        return isRoot() ? workflow.getName() : workflow.getName() + "/" + scope.getQualifiedName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(scope, ((GraphLayer) o).scope);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(scope);
    }

    @Override
    public String toString() {
        return isRoot() ? "GraphLayer[root]" : "GraphLayer[" + scope + "]";
    }
}
