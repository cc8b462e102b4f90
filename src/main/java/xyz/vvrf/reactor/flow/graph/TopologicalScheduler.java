package xyz.vvrf.reactor.flow.graph;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * 使用 Kahn 算法对控制流图做确定性的拓扑排序。
 * 就绪候选按声明序号取出（Start 最先，Exit 最后），因此同一张图总是得到同一个顺序。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class TopologicalScheduler {

    /**
     * 计算拓扑顺序。
     *
     * @param graph 控制流图
     * @return 包含 Start 与 Exit 在内的全部节点的拓扑顺序（不可变）
     * @throws CycleDetectedException 如果图中存在环；不会返回部分顺序
     */
    public List<String> order(ControlFlowGraph graph) {
        log.debug("Flow '{}': Starting topological sort...", graph.getName());
        Map<String, Integer> inDegree = new HashMap<>();
        for (String node : graph.getNodes()) {
            inDegree.put(node, graph.predecessorsOf(node).size());
        }

        PriorityQueue<String> ready = new PriorityQueue<>(Comparator.comparingInt(graph::declarationIndexOf));
        for (String node : graph.getNodes()) {
            if (inDegree.get(node) == 0) {
                ready.offer(node);
            }
        }

        List<String> sortedOrder = new ArrayList<>();
        while (!ready.isEmpty()) {
            String current = ready.poll();
            sortedOrder.add(current);
            for (String next : graph.successorsOf(current)) {
                int remaining = inDegree.get(next) - 1;
                inDegree.put(next, remaining);
                if (remaining == 0) {
                    ready.offer(next);
                }
            }
        }

        if (sortedOrder.size() != graph.getNodes().size()) {
            Set<String> remainder = new LinkedHashSet<>(graph.getNodes());
            remainder.removeAll(sortedOrder);
            List<String> cycleMembers = new ArrayList<>();
            for (List<String> cycle : graph.findCycles()) {
                cycleMembers.addAll(cycle);
            }
            cycleMembers.retainAll(remainder);
            log.warn("Flow '{}': Topological sort failed. Unsorted nodes: {}, nodes in cycle: {}",
                    graph.getName(), remainder, cycleMembers);
            throw new CycleDetectedException(graph.getName(), cycleMembers);
        }

        log.debug("Flow '{}': Topological sort successful: {}", graph.getName(), sortedOrder);
        return Collections.unmodifiableList(sortedOrder);
    }
}
