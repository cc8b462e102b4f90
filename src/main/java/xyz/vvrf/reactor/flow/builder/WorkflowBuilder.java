package xyz.vvrf.reactor.flow.builder;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.model.Connection;
import xyz.vvrf.reactor.flow.model.MergeStrategy;
import xyz.vvrf.reactor.flow.model.NodeInstance;
import xyz.vvrf.reactor.flow.model.NodeType;
import xyz.vvrf.reactor.flow.model.PortDefinition;
import xyz.vvrf.reactor.flow.model.PortDirection;
import xyz.vvrf.reactor.flow.model.PortKind;
import xyz.vvrf.reactor.flow.model.PortRef;
import xyz.vvrf.reactor.flow.model.ScopeRef;
import xyz.vvrf.reactor.flow.model.Workflow;
import xyz.vvrf.reactor.flow.model.WorkflowConstants;
import xyz.vvrf.reactor.flow.registry.NodeTypeRegistry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 用于以编程方式构建不可变的 {@link Workflow}。
 * <p>
 * 需要一个 NodeTypeRegistry 来解析实例引用的节点类型。
 * 构建器只拒绝空参数和重复定义；端口是否存在、类型是否匹配、是否成环等结构问题
 * 留给 {@code WorkflowValidator} 统一报告。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class WorkflowBuilder {

    private final NodeTypeRegistry nodeTypeRegistry;
    private final String workflowName;

    private final Map<String, Map<String, Object>> instances = new LinkedHashMap<>();
    private final Map<String, String> instanceTypes = new LinkedHashMap<>();
    private final List<Connection> connections = new ArrayList<>();
    private final List<PortDefinition> startPorts = new ArrayList<>();
    private final List<PortDefinition> exitPorts = new ArrayList<>();
    private final Map<String, List<String>> scopes = new LinkedHashMap<>();

    public WorkflowBuilder(String workflowName, NodeTypeRegistry nodeTypeRegistry) {
        this.workflowName = Objects.requireNonNull(workflowName, "工作流名称不能为空");
        this.nodeTypeRegistry = Objects.requireNonNull(nodeTypeRegistry, "NodeTypeRegistry 不能为空");
        log.debug("为工作流 '{}' 创建 WorkflowBuilder", workflowName);
    }

    public WorkflowBuilder addNode(String instanceId, String nodeTypeName) {
        Objects.requireNonNull(instanceId, "实例 ID 不能为空");
        Objects.requireNonNull(nodeTypeName, "节点类型名称不能为空");
        if (WorkflowConstants.isReserved(instanceId)) {
            throw new IllegalArgumentException(String.format("实例 ID '%s' 是保留名称，不能在工作流 '%s' 中使用。", instanceId, workflowName));
        }
        if (instanceTypes.containsKey(instanceId)) {
            throw new IllegalArgumentException(String.format("节点实例 '%s' 在工作流 '%s' 中已存在。", instanceId, workflowName));
        }
        instanceTypes.put(instanceId, nodeTypeName);
        instances.put(instanceId, new LinkedHashMap<>());
        log.debug("工作流 '{}': 添加了节点实例 '{}' (类型: {})", workflowName, instanceId, nodeTypeName);
        return this;
    }

    /**
     * 为实例的某个未连接输入提供静态值。
     */
    public WorkflowBuilder withConfiguration(String instanceId, String portName, Object value) {
        Objects.requireNonNull(portName, "实例 " + instanceId + " 的配置键不能为空");
        Map<String, Object> configuration = instances.get(instanceId);
        if (configuration == null) {
            throw new IllegalArgumentException(String.format("工作流 '%s' 中不存在节点实例 '%s'。", workflowName, instanceId));
        }
        configuration.put(portName, value);
        log.debug("工作流 '{}': 为实例 '{}' 添加了配置: {}={}", workflowName, instanceId, portName, value);
        return this;
    }

    /**
     * 声明一个工作流输入（Start 上的 DATA 输出端口）。
     */
    public WorkflowBuilder startPort(String portName, String valueType) {
        startPorts.add(PortDefinition.dataOutput(portName, valueType));
        return this;
    }

    /**
     * 声明一个工作流输出（Exit 上的 DATA 输入端口）。
     */
    public WorkflowBuilder exitPort(String portName, String valueType) {
        exitPorts.add(PortDefinition.builder(portName, PortDirection.INPUT, PortKind.DATA)
                .valueType(valueType).optional(true).build());
        return this;
    }

    /**
     * 声明一个带合并策略的工作流输出。
     */
    public WorkflowBuilder exitPort(String portName, String valueType, MergeStrategy strategy) {
        exitPorts.add(PortDefinition.builder(portName, PortDirection.INPUT, PortKind.DATA)
                .valueType(valueType).optional(true).mergeStrategy(strategy).build());
        return this;
    }

    public WorkflowBuilder connect(String sourceInstance, String sourcePort, String targetInstance, String targetPort) {
        Objects.requireNonNull(sourceInstance, "源实例不能为空");
        Objects.requireNonNull(sourcePort, "源端口不能为空");
        Objects.requireNonNull(targetInstance, "目标实例不能为空");
        Objects.requireNonNull(targetPort, "目标端口不能为空");
        Connection connection = Connection.of(sourceInstance, sourcePort, targetInstance, targetPort);
        if (connections.contains(connection)) {
            throw new IllegalArgumentException(String.format("工作流 '%s' 中已存在连接 %s -> %s。",
                    workflowName, connection.getSource(), connection.getTarget()));
        }
        connections.add(connection);
        log.debug("工作流 '{}': 添加了连接 {} -> {}", workflowName, connection.getSource(), connection.getTarget());
        return this;
    }

    /**
     * 以 "instance.port" 形式添加连接。
     */
    public WorkflowBuilder connect(String source, String target) {
        PortRef from = PortRef.parse(source);
        PortRef to = PortRef.parse(target);
        return connect(from.getInstanceId(), from.getPortName(), to.getInstanceId(), to.getPortName());
    }

    /**
     * 把实例放入所有者的某个作用域。
     */
    public WorkflowBuilder addToScope(String ownerId, String scopeName, String... memberIds) {
        Objects.requireNonNull(memberIds, "成员列表不能为空");
        String key = new ScopeRef(ownerId, scopeName).getQualifiedName();
        List<String> members = scopes.computeIfAbsent(key, k -> new ArrayList<>());
        for (String member : Arrays.asList(memberIds)) {
            Objects.requireNonNull(member, "成员实例 ID 不能为空");
            if (members.contains(member)) {
                throw new IllegalArgumentException(String.format("实例 '%s' 已是作用域 '%s' 的成员。", member, key));
            }
            members.add(member);
        }
        log.debug("工作流 '{}': 作用域 '{}' 成员: {}", workflowName, key, members);
        return this;
    }

    public Workflow build() {
        log.info("开始为 '{}' 构建 Workflow...", workflowName);
        List<NodeInstance> nodeInstances = new ArrayList<>();
        Map<String, NodeType> resolvedTypes = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : instanceTypes.entrySet()) {
            String instanceId = entry.getKey();
            String typeName = entry.getValue();
            nodeInstances.add(new NodeInstance(instanceId, typeName, instances.get(instanceId)));
            if (!resolvedTypes.containsKey(typeName)) {
                Optional<NodeType> resolved = nodeTypeRegistry.findNodeType(typeName);
                if (resolved.isPresent()) {
                    resolvedTypes.put(typeName, resolved.get());
                } else {
                    log.warn("工作流 '{}': 实例 '{}' 引用的节点类型 '{}' 无法解析，将由校验器报告", workflowName, instanceId, typeName);
                }
            }
        }
        Workflow workflow = new Workflow(workflowName, nodeInstances, connections, startPorts, exitPorts, scopes,
                resolvedTypes.values());
        log.info("Workflow '{}' 构建完成: {} 个实例, {} 条连接, {} 个作用域",
                workflowName, nodeInstances.size(), connections.size(), scopes.size());
        return workflow;
    }
}
