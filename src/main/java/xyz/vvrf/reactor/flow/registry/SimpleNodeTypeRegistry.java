package xyz.vvrf.reactor.flow.registry;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.model.NodeType;
import xyz.vvrf.reactor.flow.model.Workflow;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * NodeTypeRegistry 的简单内存实现。
 * 线程安全。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SimpleNodeTypeRegistry implements NodeTypeRegistry {

    private final Map<String, NodeType> nodeTypes = new ConcurrentHashMap<>();
    private final Map<String, Workflow> workflows = new ConcurrentHashMap<>();

    public SimpleNodeTypeRegistry() {
        log.info("SimpleNodeTypeRegistry 已创建");
    }

    /**
     * 注册一个节点类型。
     *
     * @param nodeType 节点类型 (不能为空)
     * @return this，便于链式调用
     * @throws IllegalArgumentException 如果同名类型已被注册
     */
    public SimpleNodeTypeRegistry register(NodeType nodeType) {
        Objects.requireNonNull(nodeType, "节点类型不能为空");
        if (nodeTypes.putIfAbsent(nodeType.getName(), nodeType) != null) {
            throw new IllegalArgumentException(String.format("节点类型 '%s' 已在注册表中存在。", nodeType.getName()));
        }
        log.info("已注册节点类型 '{}' (类别: {}, 端口数: {})",
                nodeType.getName(), nodeType.getKindName(), nodeType.getPorts().size());
        return this;
    }

    /**
     * 注册一个工作流，使其可以被 WorkflowNodeType 按名称引用。
     *
     * @throws IllegalArgumentException 如果同名工作流已被注册
     */
    public SimpleNodeTypeRegistry registerWorkflow(Workflow workflow) {
        Objects.requireNonNull(workflow, "工作流不能为空");
        if (workflows.putIfAbsent(workflow.getName(), workflow) != null) {
            throw new IllegalArgumentException(String.format("工作流 '%s' 已在注册表中存在。", workflow.getName()));
        }
        log.info("已注册工作流 '{}' (实例数: {})", workflow.getName(), workflow.getInstances().size());
        return this;
    }

    @Override
    public Optional<NodeType> findNodeType(String typeName) {
        Objects.requireNonNull(typeName, "节点类型名称不能为空");
        return Optional.ofNullable(nodeTypes.get(typeName));
    }

    @Override
    public Optional<Workflow> findWorkflow(String workflowName) {
        Objects.requireNonNull(workflowName, "工作流名称不能为空");
        return Optional.ofNullable(workflows.get(workflowName));
    }

    public Set<String> getRegisteredTypeNames() {
        return Collections.unmodifiableSet(nodeTypes.keySet());
    }
}
