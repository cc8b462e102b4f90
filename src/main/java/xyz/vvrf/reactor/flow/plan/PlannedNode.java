package xyz.vvrf.reactor.flow.plan;

import xyz.vvrf.reactor.flow.model.NodeInstance;
import xyz.vvrf.reactor.flow.model.NodeType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 执行计划中的一个节点（不可变）：实例、类型、守卫、输入绑定以及它拥有的作用域单元。
 *
 * @author ruifeng.wen
 */
public final class PlannedNode {
    private final NodeInstance instance;
    private final NodeType nodeType;
    private final ReadinessGuard guard;
    private final Map<String, InputBinding> inputs;
    private final List<ScopeUnit> scopeUnits;

    public PlannedNode(NodeInstance instance, NodeType nodeType, ReadinessGuard guard,
                       Map<String, InputBinding> inputs, List<ScopeUnit> scopeUnits) {
        this.instance = Objects.requireNonNull(instance, "实例不能为空");
        this.nodeType = Objects.requireNonNull(nodeType, "节点类型不能为空");
        this.guard = Objects.requireNonNull(guard, "守卫不能为空");
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        this.scopeUnits = Collections.unmodifiableList(new ArrayList<>(scopeUnits));
    }

    public String getInstanceId() {
        return instance.getId();
    }

    public NodeInstance getInstance() {
        return instance;
    }

    public NodeType getNodeType() {
        return nodeType;
    }

    public ReadinessGuard getGuard() {
        return guard;
    }

    /**
     * 输入绑定：端口名 -> 绑定，按端口声明顺序。不含 scoped 输入。
     */
    public Map<String, InputBinding> getInputs() {
        return inputs;
    }

    public boolean isLazy() {
        return nodeType.isLazy();
    }

    public List<ScopeUnit> getScopeUnits() {
        return scopeUnits;
    }

    public Optional<ScopeUnit> findScopeUnit(String scopeName) {
        return scopeUnits.stream().filter(u -> u.getScopeName().equals(scopeName)).findFirst();
    }

    @Override
    public String toString() {
        return String.format("PlannedNode[%s (%s), guard=%s%s]", instance.getId(), nodeType.getName(),
                guard.describe(), isLazy() ? ", lazy" : "");
    }
}
