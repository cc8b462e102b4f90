package xyz.vvrf.reactor.flow.graph;

import xyz.vvrf.reactor.flow.model.WorkflowConstants;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 一层的控制流图（不可变）。节点为实例 ID，加上伪节点 Start 与 Exit。
 * 邻接关系按插入顺序保存；每个节点带有声明序号：Start 为 0，成员按声明顺序从 1 开始，Exit 最大。
 *
 * @author ruifeng.wen
 */
public final class ControlFlowGraph {
    private final String name;
    private final GraphLayer layer;
    private final List<String> nodes;
    private final Map<String, Integer> declarationIndex;
    private final Map<String, Set<String>> successors;
    private final Map<String, Set<String>> predecessors;

    ControlFlowGraph(String name, GraphLayer layer, List<String> nodes, Map<String, Set<String>> successors) {
        this.name = Objects.requireNonNull(name, "图名称不能为空");
        this.layer = Objects.requireNonNull(layer, "层不能为空");
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < this.nodes.size(); i++) {
            index.put(this.nodes.get(i), i);
        }
        this.declarationIndex = Collections.unmodifiableMap(index);

        Map<String, Set<String>> succ = new LinkedHashMap<>();
        Map<String, Set<String>> pred = new LinkedHashMap<>();
        for (String node : this.nodes) {
            succ.put(node, new LinkedHashSet<>());
            pred.put(node, new LinkedHashSet<>());
        }
        successors.forEach((from, targets) -> {
            for (String to : targets) {
                succ.get(from).add(to);
                pred.get(to).add(from);
            }
        });
        succ.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        pred.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        this.successors = Collections.unmodifiableMap(succ);
        this.predecessors = Collections.unmodifiableMap(pred);
    }

    public String getName() {
        return name;
    }

    public GraphLayer getLayer() {
        return layer;
    }

    /**
     * 获取全部节点，Start 在前、Exit 在后，中间为声明顺序。
     */
    public List<String> getNodes() {
        return nodes;
    }

    public boolean contains(String node) {
        return declarationIndex.containsKey(node);
    }

    public int declarationIndexOf(String node) {
        Integer index = declarationIndex.get(node);
        if (index == null) {
            throw new IllegalArgumentException(String.format("Graph '%s' does not contain node '%s'", name, node));
        }
        return index;
    }

    public Set<String> successorsOf(String node) {
        Set<String> result = successors.get(node);
        return result != null ? result : Collections.emptySet();
    }

    public Set<String> predecessorsOf(String node) {
        Set<String> result = predecessors.get(node);
        return result != null ? result : Collections.emptySet();
    }

    public boolean hasEdge(String from, String to) {
        return successorsOf(from).contains(to);
    }

    public int edgeCount() {
        int count = 0;
        for (Set<String> targets : successors.values()) {
            count += targets.size();
        }
        return count;
    }

    /**
     * 用 Tarjan 算法找出所有环（强连通分量）。
     * 只包含大小大于 1 的分量或带自环的单个节点；每个环内的节点按声明顺序排列，
     * 环之间按第一个节点的声明顺序排列。
     *
     * @return 环列表，无环时为空列表
     */
    public List<List<String>> findCycles() {
        TarjanState state = new TarjanState();
        for (String node : nodes) {
            if (!state.index.containsKey(node)) {
                strongConnect(node, state);
            }
        }
        Comparator<String> byDeclaration = Comparator.comparingInt(this::declarationIndexOf);
        List<List<String>> cycles = new ArrayList<>();
        for (List<String> component : state.components) {
            boolean selfLoop = component.size() == 1 && hasEdge(component.get(0), component.get(0));
            if (component.size() > 1 || selfLoop) {
                List<String> sorted = new ArrayList<>(component);
                sorted.sort(byDeclaration);
                cycles.add(Collections.unmodifiableList(sorted));
            }
        }
        cycles.sort(Comparator.comparingInt(c -> declarationIndexOf(c.get(0))));
        return cycles;
    }

    private void strongConnect(String node, TarjanState state) {
        state.index.put(node, state.counter);
        state.lowLink.put(node, state.counter);
        state.counter++;
        state.stack.add(node);
        state.onStack.add(node);

        for (String next : successorsOf(node)) {
            if (!state.index.containsKey(next)) {
                strongConnect(next, state);
                state.lowLink.put(node, Math.min(state.lowLink.get(node), state.lowLink.get(next)));
            } else if (state.onStack.contains(next)) {
                state.lowLink.put(node, Math.min(state.lowLink.get(node), state.index.get(next)));
            }
        }

        if (state.lowLink.get(node).equals(state.index.get(node))) {
            List<String> component = new ArrayList<>();
            String member;
            do {
                member = state.stack.remove(state.stack.size() - 1);
                state.onStack.remove(member);
                component.add(member);
            } while (!member.equals(node));
            state.components.add(component);
        }
    }

    private static final class TarjanState {
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final List<String> stack = new ArrayList<>();
        private final Set<String> onStack = new LinkedHashSet<>();
        private final List<List<String>> components = new ArrayList<>();
        private int counter;
    }

    /**
     * 以 DOT 格式描述本图，便于调试。
     */
    public String toDot() {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph \"").append(name).append("\" {\n");
        for (String node : nodes) {
            String shape = WorkflowConstants.isReserved(node) ? "ellipse" : "box";
            sb.append("  \"").append(node).append("\" [shape=").append(shape).append("];\n");
        }
        for (String node : nodes) {
            for (String next : successorsOf(node)) {
                sb.append("  \"").append(node).append("\" -> \"").append(next).append("\";\n");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("ControlFlowGraph[%s, nodes=%d, edges=%d]", name, nodes.size(), edgeCount());
    }
}
