package xyz.vvrf.reactor.flow.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 工作流图模型（不可变）。
 * <p>
 * 由外部解析器或 {@code WorkflowBuilder} 构建。本类不做结构校验：重复的实例 ID、
 * 未知端口等问题由 {@code WorkflowValidator} 报告，这里只保证集合不可变，并提供按声明顺序的派生视图。
 * 存在重复实例 ID 时，查找以第一次声明为准。
 *
 * @author ruifeng.wen
 */
public final class Workflow {
    private final String name;
    private final List<NodeInstance> instances;
    private final List<Connection> connections;
    private final List<PortDefinition> startPorts;
    private final List<PortDefinition> exitPorts;
    private final Map<String, List<String>> scopes;
    private final Map<String, NodeType> nodeTypes;

    // 派生索引
    private final Map<String, NodeInstance> instanceIndex;
    private final Map<String, Integer> declarationIndex;
    private final Map<String, ScopeRef> memberScopes;

    /**
     * 创建工作流模型。
     *
     * @param name        工作流名称
     * @param instances   按声明顺序排列的节点实例
     * @param connections 按声明顺序排列的连接
     * @param startPorts  Start 的端口签名 (OUTPUT)；缺少 {@code execute} 时自动补充
     * @param exitPorts   Exit 的端口签名 (INPUT)；缺少 {@code onSuccess}/{@code onFailure} 时自动补充为可选端口
     * @param scopes      限定作用域名 ("owner.scope") -> 成员实例 ID
     * @param nodeTypes   工作流引用到的节点类型
     */
    public Workflow(String name,
                    List<NodeInstance> instances,
                    List<Connection> connections,
                    List<PortDefinition> startPorts,
                    List<PortDefinition> exitPorts,
                    Map<String, List<String>> scopes,
                    Collection<NodeType> nodeTypes) {
        this.name = Objects.requireNonNull(name, "工作流名称不能为空");
        this.instances = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(instances, "实例列表不能为空")));
        this.connections = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(connections, "连接列表不能为空")));
        this.startPorts = Collections.unmodifiableList(normalizeStartPorts(startPorts));
        this.exitPorts = Collections.unmodifiableList(normalizeExitPorts(exitPorts));

        Map<String, List<String>> scopeCopy = new LinkedHashMap<>();
        if (scopes != null) {
            scopes.forEach((key, members) ->
                    scopeCopy.put(key, Collections.unmodifiableList(new ArrayList<>(members))));
        }
        this.scopes = Collections.unmodifiableMap(scopeCopy);

        Map<String, NodeType> typeCopy = new LinkedHashMap<>();
        if (nodeTypes != null) {
            for (NodeType type : nodeTypes) {
                typeCopy.putIfAbsent(type.getName(), type);
            }
        }
        this.nodeTypes = Collections.unmodifiableMap(typeCopy);

        Map<String, NodeInstance> index = new HashMap<>();
        Map<String, Integer> order = new HashMap<>();
        for (int i = 0; i < this.instances.size(); i++) {
            NodeInstance instance = this.instances.get(i);
            index.putIfAbsent(instance.getId(), instance);
            order.putIfAbsent(instance.getId(), i);
        }
        this.instanceIndex = index;
        this.declarationIndex = order;

        Map<String, ScopeRef> membership = new HashMap<>();
        for (Map.Entry<String, List<String>> entry : this.scopes.entrySet()) {
            Optional<ScopeRef> ref = tryParseScope(entry.getKey());
            // 格式错误的键不参与成员关系，由验证器报告 SCOPE_UNKNOWN
            if (!ref.isPresent()) {
                continue;
            }
            for (String member : entry.getValue()) {
                membership.putIfAbsent(member, ref.get());
            }
        }
        this.memberScopes = membership;
    }

    private static Optional<ScopeRef> tryParseScope(String key) {
        try {
            return Optional.of(ScopeRef.parse(key));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static List<PortDefinition> normalizeStartPorts(List<PortDefinition> ports) {
        List<PortDefinition> result = new ArrayList<>();
        boolean hasExecute = ports != null && ports.stream().anyMatch(p -> p.getName().equals(WorkflowConstants.EXECUTE));
        if (!hasExecute) {
            result.add(PortDefinition.controlOutput(WorkflowConstants.EXECUTE));
        }
        if (ports != null) {
            result.addAll(ports);
        }
        return result;
    }

    private static List<PortDefinition> normalizeExitPorts(List<PortDefinition> ports) {
        List<PortDefinition> result = new ArrayList<>();
        if (ports != null) {
            result.addAll(ports);
        }
        if (result.stream().noneMatch(p -> p.getName().equals(WorkflowConstants.ON_SUCCESS))) {
            result.add(PortDefinition.builder(WorkflowConstants.ON_SUCCESS, PortDirection.INPUT, PortKind.CONTROL)
                    .optional(true).build());
        }
        if (result.stream().noneMatch(p -> p.getName().equals(WorkflowConstants.ON_FAILURE))) {
            result.add(PortDefinition.builder(WorkflowConstants.ON_FAILURE, PortDirection.INPUT, PortKind.CONTROL)
                    .optional(true).build());
        }
        return result;
    }

    // --- Getters ---

    public String getName() {
        return name;
    }

    public List<NodeInstance> getInstances() {
        return instances;
    }

    public List<Connection> getConnections() {
        return connections;
    }

    public List<PortDefinition> getStartPorts() {
        return startPorts;
    }

    public List<PortDefinition> getExitPorts() {
        return exitPorts;
    }

    /**
     * 获取作用域成员映射：限定名 "owner.scope" -> 成员实例 ID（声明顺序）。
     */
    public Map<String, List<String>> getScopes() {
        return scopes;
    }

    public Map<String, NodeType> getNodeTypes() {
        return nodeTypes;
    }

    // --- 查找 ---

    public Optional<NodeInstance> findInstance(String instanceId) {
        return Optional.ofNullable(instanceIndex.get(instanceId));
    }

    /**
     * 实例是否存在。Start 与 Exit 总是存在。
     */
    public boolean hasInstance(String instanceId) {
        return WorkflowConstants.isReserved(instanceId) || instanceIndex.containsKey(instanceId);
    }

    public Optional<NodeType> findNodeType(String typeName) {
        return Optional.ofNullable(nodeTypes.get(typeName));
    }

    /**
     * 获取实例对应的节点类型。Start/Exit 以及类型未解析的实例返回 empty。
     */
    public Optional<NodeType> nodeTypeOf(String instanceId) {
        NodeInstance instance = instanceIndex.get(instanceId);
        if (instance == null) {
            return Optional.empty();
        }
        return findNodeType(instance.getNodeTypeName());
    }

    /**
     * 获取实例的声明序号。未知实例返回 -1。
     */
    public int declarationIndexOf(String instanceId) {
        Integer index = declarationIndex.get(instanceId);
        return index != null ? index : -1;
    }

    public Optional<PortDefinition> findOutputPort(String instanceId, String portName) {
        if (WorkflowConstants.isStart(instanceId)) {
            return startPorts.stream().filter(p -> p.getName().equals(portName)).findFirst();
        }
        if (WorkflowConstants.isExit(instanceId)) {
            return Optional.empty();
        }
        return nodeTypeOf(instanceId).flatMap(t -> t.findOutput(portName));
    }

    public Optional<PortDefinition> findInputPort(String instanceId, String portName) {
        if (WorkflowConstants.isExit(instanceId)) {
            return exitPorts.stream().filter(p -> p.getName().equals(portName)).findFirst();
        }
        if (WorkflowConstants.isStart(instanceId)) {
            return Optional.empty();
        }
        return nodeTypeOf(instanceId).flatMap(t -> t.findInput(portName));
    }

    // --- 作用域视图 ---

    /**
     * 获取实例所属的作用域。根层实例（以及 Start/Exit）返回 empty。
     */
    public Optional<ScopeRef> getScopeOf(String instanceId) {
        return Optional.ofNullable(memberScopes.get(instanceId));
    }

    public List<String> getScopeMembers(ScopeRef scope) {
        List<String> members = scopes.get(scope.getQualifiedName());
        return members != null ? members : Collections.emptyList();
    }

    /**
     * 获取所有已声明的作用域（声明顺序）。
     */
    public List<ScopeRef> getScopeRefs() {
        return scopes.keySet().stream().map(ScopeRef::parse).collect(Collectors.toList());
    }

    /**
     * 获取某个所有者实例上声明了成员的作用域。
     */
    public List<ScopeRef> getScopeRefsOwnedBy(String ownerId) {
        return getScopeRefs().stream().filter(r -> r.getOwnerId().equals(ownerId)).collect(Collectors.toList());
    }

    /**
     * 如果连接的源端口是所有者的 scoped 输出，返回对应作用域。
     */
    public Optional<ScopeRef> scopedSourceOf(Connection connection) {
        return findOutputPort(connection.getSourceInstance(), connection.getSourcePort())
                .flatMap(PortDefinition::getScope)
                .map(scope -> new ScopeRef(connection.getSourceInstance(), scope));
    }

    /**
     * 如果连接的目标端口是所有者的 scoped 输入，返回对应作用域。
     */
    public Optional<ScopeRef> scopedTargetOf(Connection connection) {
        return findInputPort(connection.getTargetInstance(), connection.getTargetPort())
                .flatMap(PortDefinition::getScope)
                .map(scope -> new ScopeRef(connection.getTargetInstance(), scope));
    }

    /**
     * 连接是否经过所有者的 scoped 端口。
     */
    public boolean isScopedConnection(Connection connection) {
        return scopedSourceOf(connection).isPresent() || scopedTargetOf(connection).isPresent();
    }

    /**
     * 连接源端所在的层：scoped 输出属于其作用域，其余属于源实例所在的层。empty 表示根层。
     */
    public Optional<ScopeRef> sourceLayerOf(Connection connection) {
        Optional<ScopeRef> scoped = scopedSourceOf(connection);
        return scoped.isPresent() ? scoped : getScopeOf(connection.getSourceInstance());
    }

    /**
     * 连接目标端所在的层。empty 表示根层。
     */
    public Optional<ScopeRef> targetLayerOf(Connection connection) {
        Optional<ScopeRef> scoped = scopedTargetOf(connection);
        return scoped.isPresent() ? scoped : getScopeOf(connection.getTargetInstance());
    }

    // --- 连接视图 ---

    /**
     * 获取写入某个输入端口的连接（声明顺序）。
     */
    public List<Connection> incomingTo(String instanceId, String portName) {
        return connections.stream()
                .filter(c -> c.getTargetInstance().equals(instanceId) && c.getTargetPort().equals(portName))
                .collect(Collectors.toList());
    }

    public List<Connection> incomingTo(String instanceId) {
        return connections.stream()
                .filter(c -> c.getTargetInstance().equals(instanceId))
                .collect(Collectors.toList());
    }

    public List<Connection> outgoingFrom(String instanceId) {
        return connections.stream()
                .filter(c -> c.getSourceInstance().equals(instanceId))
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return String.format("Workflow[name=%s, instances=%d, connections=%d, scopes=%d]",
                name, instances.size(), connections.size(), scopes.size());
    }
}
