package xyz.vvrf.reactor.flow.plan;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.graph.ControlFlowGraph;
import xyz.vvrf.reactor.flow.model.Connection;
import xyz.vvrf.reactor.flow.model.JoinPolicy;
import xyz.vvrf.reactor.flow.model.NodeType;
import xyz.vvrf.reactor.flow.model.PortDefinition;
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
 * 为一层中每个节点计算就绪守卫。
 * 守卫由节点的入向 CONTROL 连接构成（经过所有者 scoped 输入的连接属于作用域出口，不计入）。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class ReadinessEvaluator {

    /**
     * 计算守卫。
     *
     * @param workflow 工作流
     * @param graph    当前层的控制流图
     * @param order    当前层的拓扑顺序
     * @return 实例 ID -> 守卫，按拓扑顺序排列，不含 Start/Exit
     */
    public Map<String, ReadinessGuard> evaluate(Workflow workflow, ControlFlowGraph graph, List<String> order) {
        Map<String, ReadinessGuard> guards = new LinkedHashMap<>();
        for (String instanceId : order) {
            if (WorkflowConstants.isReserved(instanceId)) {
                continue;
            }
            ReadinessGuard guard = guardFor(workflow, instanceId);
            guards.put(instanceId, guard);
            log.trace("Flow '{}': Guard for '{}': {}", graph.getName(), instanceId, guard.describe());
        }
        return guards;
    }

    /**
     * 计算单个节点的守卫。
     */
    public ReadinessGuard guardFor(Workflow workflow, String instanceId) {
        Optional<NodeType> type = workflow.nodeTypeOf(instanceId);
        JoinPolicy policy = type.map(NodeType::getJoinPolicy).orElse(JoinPolicy.ALL);
        Set<ControlSignalRef> signals = new LinkedHashSet<>();
        for (Connection connection : workflow.incomingTo(instanceId)) {
            Optional<PortDefinition> port = workflow.findInputPort(instanceId, connection.getTargetPort());
            if (port.isPresent() && port.get().isControl() && !port.get().isScoped()) {
                signals.add(new ControlSignalRef(connection.getSourceInstance(), connection.getSourcePort()));
            }
        }
        return new ReadinessGuard(instanceId, policy, new ArrayList<>(signals),
                type.flatMap(NodeType::getReadinessPredicate).orElse(null));
    }
}
