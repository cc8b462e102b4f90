package xyz.vvrf.reactor.flow.graph;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.model.Connection;
import xyz.vvrf.reactor.flow.model.NodeInstance;
import xyz.vvrf.reactor.flow.model.ScopeRef;
import xyz.vvrf.reactor.flow.model.Workflow;
import xyz.vvrf.reactor.flow.model.WorkflowConstants;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 把一层中的 CONTROL 与 DATA 连接统一成一张控制流图。
 * <p>
 * 规则：
 * <ul>
 *     <li>层内每条 CONTROL 或 DATA 连接 A -> B 产生边 A -> B（重复边合并，自环保留以便检测环）。</li>
 *     <li>根层中 Start/Exit 即工作流的 Start/Exit；经过所有者 scoped 端口的连接与作用域成员被排除。</li>
 *     <li>作用域层中，所有者的 scoped 输出充当 Start，所有者的 scoped 输入充当 Exit。</li>
 *     <li>没有前驱的节点以 Start 为隐式前驱；没有后继的节点以 Exit 为隐式后继。</li>
 * </ul>
 * 引用未知实例或跨层的连接被忽略，由校验器报告。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class ControlFlowGraphBuilder {

    /**
     * 构建根层的控制流图。
     */
    public ControlFlowGraph build(Workflow workflow) {
        return build(workflow, GraphLayer.root());
    }

    /**
     * 构建指定层的控制流图。
     */
    public ControlFlowGraph build(Workflow workflow, GraphLayer layer) {
        List<String> members = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (NodeInstance instance : workflow.getInstances()) {
            String id = instance.getId();
            if (!WorkflowConstants.isReserved(id) && layer.contains(workflow, id) && seen.add(id)) {
                members.add(id);
            }
        }

        List<String> nodes = new ArrayList<>();
        nodes.add(WorkflowConstants.START);
        nodes.addAll(members);
        nodes.add(WorkflowConstants.EXIT);

        Map<String, Set<String>> successors = new LinkedHashMap<>();
        for (String node : nodes) {
            successors.put(node, new LinkedHashSet<>());
        }

        for (Connection connection : workflow.getConnections()) {
            Optional<String> from = mapSource(workflow, layer, connection, seen);
            Optional<String> to = mapTarget(workflow, layer, connection, seen);
            if (from.isPresent() && to.isPresent()) {
                successors.get(from.get()).add(to.get());
            }
        }

        // Start 为所有无前驱成员的隐式前驱
        Set<String> hasPredecessor = new LinkedHashSet<>();
        successors.values().forEach(hasPredecessor::addAll);
        for (String member : members) {
            if (!hasPredecessor.contains(member)) {
                successors.get(WorkflowConstants.START).add(member);
            }
        }
        // Exit 为所有无后继成员的隐式后继
        for (String member : members) {
            if (successors.get(member).isEmpty()) {
                successors.get(member).add(WorkflowConstants.EXIT);
            }
        }

        String name = layer.describe(workflow);
        ControlFlowGraph graph = new ControlFlowGraph(name, layer, nodes, successors);
        log.debug("Flow '{}': Built control flow graph with {} nodes and {} edges", name, nodes.size(), graph.edgeCount());
        return graph;
    }

    private Optional<String> mapSource(Workflow workflow, GraphLayer layer, Connection connection, Set<String> members) {
        String source = connection.getSourceInstance();
        Optional<ScopeRef> scopedSource = workflow.scopedSourceOf(connection);
        if (scopedSource.isPresent()) {
            // 所有者的 scoped 输出只在对应作用域层中充当 Start
            return layer.getScope().isPresent() && layer.getScope().get().equals(scopedSource.get())
                    ? Optional.of(WorkflowConstants.START) : Optional.<String>empty();
        }
        if (layer.isRoot() && WorkflowConstants.isStart(source)) {
            return Optional.of(WorkflowConstants.START);
        }
        return members.contains(source) ? Optional.of(source) : Optional.<String>empty();
    }

    private Optional<String> mapTarget(Workflow workflow, GraphLayer layer, Connection connection, Set<String> members) {
        String target = connection.getTargetInstance();
        Optional<ScopeRef> scopedTarget = workflow.scopedTargetOf(connection);
        if (scopedTarget.isPresent()) {
            return layer.getScope().isPresent() && layer.getScope().get().equals(scopedTarget.get())
                    ? Optional.of(WorkflowConstants.EXIT) : Optional.<String>empty();
        }
        if (layer.isRoot() && WorkflowConstants.isExit(target)) {
            return Optional.of(WorkflowConstants.EXIT);
        }
        return members.contains(target) ? Optional.of(target) : Optional.<String>empty();
    }
}
