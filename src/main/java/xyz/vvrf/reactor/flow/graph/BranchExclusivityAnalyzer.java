package xyz.vvrf.reactor.flow.graph;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.model.Connection;
import xyz.vvrf.reactor.flow.model.JoinPolicy;
import xyz.vvrf.reactor.flow.model.NodeType;
import xyz.vvrf.reactor.flow.model.PortDefinition;
import xyz.vvrf.reactor.flow.model.PortRef;
import xyz.vvrf.reactor.flow.model.Workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 判断多个写入者是否位于同一分支节点的互斥分支上。
 * <p>
 * 为每个节点计算“必经分支”：分支祖先 B 及其输出，节点能执行就说明 B 一定走了该输出。
 * ALL 汇合取所有入向 CONTROL 连接贡献的并集，ANY 取交集，CUSTOM 以及没有入向 CONTROL 连接的节点为空。
 * 只有存在某个 B，使一个写入者必经其成功输出而另一个必经其失败输出时，二者才互斥。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class BranchExclusivityAnalyzer {

    private enum Branch {SUCCESS, FAILURE}

    /**
     * 判断给定的写入者是否两两互斥。
     *
     * @param workflow 工作流
     * @param sources  写入者（源端口），至少两个才有意义
     * @return 两两互斥时为 true；少于两个写入者时为 true
     */
    public boolean areMutuallyExclusive(Workflow workflow, List<PortRef> sources) {
        if (sources.size() < 2) {
            return true;
        }
        Map<String, List<Connection>> incomingControl = incomingControlEdges(workflow);
        Map<String, Map<String, Set<Branch>>> memo = new HashMap<>();
        List<Map<String, Set<Branch>>> guaranteed = new ArrayList<>();
        for (PortRef source : sources) {
            guaranteed.add(guaranteedBranches(workflow, source.getInstanceId(), incomingControl, memo, new HashSet<>()));
        }
        for (int i = 0; i < sources.size(); i++) {
            for (int j = i + 1; j < sources.size(); j++) {
                if (!exclusive(guaranteed.get(i), guaranteed.get(j))) {
                    log.debug("Flow '{}': Writers {} and {} are not on mutually exclusive branches",
                            workflow.getName(), sources.get(i), sources.get(j));
                    return false;
                }
            }
        }
        return true;
    }

    private boolean exclusive(Map<String, Set<Branch>> first, Map<String, Set<Branch>> second) {
        for (Map.Entry<String, Set<Branch>> entry : first.entrySet()) {
            Set<Branch> other = second.get(entry.getKey());
            if (other == null || entry.getValue().size() != 1 || other.size() != 1) {
                continue;
            }
            if (!entry.getValue().equals(other)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 计算节点的必经分支：分支祖先 ID -> 必经的输出。
     * 集合中同时含成功与失败表示该节点永远无法执行，不参与互斥判定。
     */
    private Map<String, Set<Branch>> guaranteedBranches(Workflow workflow, String node,
                                                        Map<String, List<Connection>> incomingControl,
                                                        Map<String, Map<String, Set<Branch>>> memo,
                                                        Set<String> visiting) {
        Map<String, Set<Branch>> cached = memo.get(node);
        if (cached != null) {
            return cached;
        }
        List<Connection> edges = incomingControl.getOrDefault(node, Collections.<Connection>emptyList());
        Optional<NodeType> type = workflow.nodeTypeOf(node);
        JoinPolicy policy = type.map(NodeType::getJoinPolicy).orElse(JoinPolicy.ALL);
        // 环由验证器报告，这里按无保证处理
        if (edges.isEmpty() || policy == JoinPolicy.CUSTOM || !visiting.add(node)) {
            return Collections.emptyMap();
        }
        Map<String, Set<Branch>> result = null;
        for (Connection edge : edges) {
            Map<String, Set<Branch>> contribution = contributionOf(workflow, edge, incomingControl, memo, visiting);
            if (result == null) {
                result = contribution;
            } else if (policy == JoinPolicy.ANY) {
                result = intersect(result, contribution);
            } else {
                result = union(result, contribution);
            }
        }
        visiting.remove(node);
        memo.put(node, result);
        return result;
    }

    private Map<String, Set<Branch>> contributionOf(Workflow workflow, Connection edge,
                                                    Map<String, List<Connection>> incomingControl,
                                                    Map<String, Map<String, Set<Branch>>> memo,
                                                    Set<String> visiting) {
        String upstream = edge.getSourceInstance();
        Map<String, Set<Branch>> contribution = copy(
                guaranteedBranches(workflow, upstream, incomingControl, memo, visiting));
        Optional<NodeType> upstreamType = workflow.nodeTypeOf(upstream);
        if (upstreamType.isPresent() && upstreamType.get().isBranching()) {
            Optional<PortDefinition> port = workflow.findOutputPort(upstream, edge.getSourcePort());
            Branch branch = port.isPresent() && port.get().isFailure() ? Branch.FAILURE : Branch.SUCCESS;
            contribution.computeIfAbsent(upstream, k -> EnumSet.noneOf(Branch.class)).add(branch);
        }
        return contribution;
    }

    private Map<String, Set<Branch>> union(Map<String, Set<Branch>> first, Map<String, Set<Branch>> second) {
        Map<String, Set<Branch>> merged = copy(first);
        for (Map.Entry<String, Set<Branch>> entry : second.entrySet()) {
            merged.computeIfAbsent(entry.getKey(), k -> EnumSet.noneOf(Branch.class)).addAll(entry.getValue());
        }
        return merged;
    }

    private Map<String, Set<Branch>> intersect(Map<String, Set<Branch>> first, Map<String, Set<Branch>> second) {
        Map<String, Set<Branch>> common = new LinkedHashMap<>();
        for (Map.Entry<String, Set<Branch>> entry : first.entrySet()) {
            Set<Branch> other = second.get(entry.getKey());
            if (other != null && other.equals(entry.getValue())) {
                common.put(entry.getKey(), EnumSet.copyOf(entry.getValue()));
            }
        }
        return common;
    }

    private Map<String, Set<Branch>> copy(Map<String, Set<Branch>> source) {
        Map<String, Set<Branch>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Set<Branch>> entry : source.entrySet()) {
            copy.put(entry.getKey(), EnumSet.copyOf(entry.getValue()));
        }
        return copy;
    }

    private Map<String, List<Connection>> incomingControlEdges(Workflow workflow) {
        Map<String, List<Connection>> incoming = new LinkedHashMap<>();
        for (Connection connection : workflow.getConnections()) {
            Optional<PortDefinition> sourcePort = workflow.findOutputPort(connection.getSourceInstance(), connection.getSourcePort());
            if (sourcePort.isPresent() && sourcePort.get().isControl() && !sourcePort.get().isScoped()) {
                incoming.computeIfAbsent(connection.getTargetInstance(), k -> new ArrayList<>()).add(connection);
            }
        }
        return incoming;
    }
}
