package xyz.vvrf.reactor.flow.plan;

import xyz.vvrf.reactor.flow.graph.GraphLayer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 一层的编译结果（不可变）：拓扑顺序、按该顺序排列的计划节点，以及出口绑定。
 * 根层的出口是 Exit 的端口；作用域层的出口是所有者的 scoped 输入。
 *
 * @author ruifeng.wen
 */
public final class LayerPlan {
    private final GraphLayer layer;
    private final List<String> order;
    private final List<PlannedNode> nodes;
    private final Map<String, InputBinding> exitBindings;

    public LayerPlan(GraphLayer layer, List<String> order, List<PlannedNode> nodes,
                     Map<String, InputBinding> exitBindings) {
        this.layer = Objects.requireNonNull(layer, "层不能为空");
        this.order = Collections.unmodifiableList(new ArrayList<>(order));
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.exitBindings = Collections.unmodifiableMap(new LinkedHashMap<>(exitBindings));
    }

    public GraphLayer getLayer() {
        return layer;
    }

    /**
     * 拓扑顺序，包含 Start 与 Exit。
     */
    public List<String> getOrder() {
        return order;
    }

    /**
     * 计划节点，按拓扑顺序排列，不含 Start 与 Exit。
     */
    public List<PlannedNode> getNodes() {
        return nodes;
    }

    public Map<String, InputBinding> getExitBindings() {
        return exitBindings;
    }

    public Optional<PlannedNode> findNode(String instanceId) {
        return nodes.stream().filter(n -> n.getInstanceId().equals(instanceId)).findFirst();
    }
}
