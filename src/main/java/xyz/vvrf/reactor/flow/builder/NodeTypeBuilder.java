package xyz.vvrf.reactor.flow.builder;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.model.BuiltinNodeType;
import xyz.vvrf.reactor.flow.model.CoercionKind;
import xyz.vvrf.reactor.flow.model.CoercionNodeType;
import xyz.vvrf.reactor.flow.model.CustomReadinessPredicate;
import xyz.vvrf.reactor.flow.model.JoinPolicy;
import xyz.vvrf.reactor.flow.model.LocalNodeType;
import xyz.vvrf.reactor.flow.model.MergeStrategy;
import xyz.vvrf.reactor.flow.model.PortDefinition;
import xyz.vvrf.reactor.flow.model.PortDirection;
import xyz.vvrf.reactor.flow.model.PortKind;
import xyz.vvrf.reactor.flow.model.WorkflowConstants;
import xyz.vvrf.reactor.flow.model.WorkflowNodeType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 以编程方式构建不可变的 {@link xyz.vvrf.reactor.flow.model.NodeType}。
 * <p>
 * 构建器不检查端口名称是否重复，重复端口由校验器以 DUPLICATE_PORT_NAME 报告。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class NodeTypeBuilder {

    private final String name;
    private final List<PortDefinition> ports = new ArrayList<>();
    private final List<String> declaredScopes = new ArrayList<>();
    private JoinPolicy joinPolicy = JoinPolicy.ALL;
    private CustomReadinessPredicate readinessPredicate;
    private boolean pure;
    private boolean lazy;

    private NodeTypeBuilder(String name) {
        this.name = Objects.requireNonNull(name, "节点类型名称不能为空");
    }

    public static NodeTypeBuilder named(String name) {
        return new NodeTypeBuilder(name);
    }

    public NodeTypeBuilder port(PortDefinition port) {
        ports.add(Objects.requireNonNull(port, "端口不能为空"));
        return this;
    }

    public NodeTypeBuilder dataInput(String portName, String valueType) {
        return port(PortDefinition.dataInput(portName, valueType));
    }

    public NodeTypeBuilder optionalInput(String portName, String valueType) {
        return port(PortDefinition.optionalDataInput(portName, valueType));
    }

    public NodeTypeBuilder inputWithDefault(String portName, String valueType, Object defaultValue) {
        return port(PortDefinition.builder(portName, PortDirection.INPUT, PortKind.DATA)
                .valueType(valueType).defaultValue(defaultValue).build());
    }

    /**
     * 添加一个允许多个写入者的 DATA 输入。
     */
    public NodeTypeBuilder mergedInput(String portName, String valueType, MergeStrategy strategy) {
        return port(PortDefinition.builder(portName, PortDirection.INPUT, PortKind.DATA)
                .valueType(valueType).mergeStrategy(Objects.requireNonNull(strategy, "合并策略不能为空")).build());
    }

    public NodeTypeBuilder dataOutput(String portName, String valueType) {
        return port(PortDefinition.dataOutput(portName, valueType));
    }

    public NodeTypeBuilder controlInput(String portName) {
        return port(PortDefinition.controlInput(portName));
    }

    public NodeTypeBuilder optionalControlInput(String portName) {
        return port(PortDefinition.builder(portName, PortDirection.INPUT, PortKind.CONTROL).optional(true).build());
    }

    public NodeTypeBuilder controlOutput(String portName) {
        return port(PortDefinition.controlOutput(portName));
    }

    public NodeTypeBuilder failureOutput(String portName) {
        return port(PortDefinition.failureOutput(portName));
    }

    /**
     * 添加约定的外部控制端口：execute 输入，onSuccess 与 onFailure 输出。
     */
    public NodeTypeBuilder withStandardControlPorts() {
        controlInput(WorkflowConstants.EXECUTE);
        controlOutput(WorkflowConstants.ON_SUCCESS);
        failureOutput(WorkflowConstants.ON_FAILURE);
        return this;
    }

    /**
     * 声明一个作用域，并添加其必需端口：start 输出，success 与 failure 输入（failure 可选）。
     */
    public NodeTypeBuilder scope(String scopeName) {
        declareScope(scopeName);
        port(PortDefinition.builder(WorkflowConstants.SCOPE_START, PortDirection.OUTPUT, PortKind.CONTROL)
                .scope(scopeName).build());
        port(PortDefinition.builder(WorkflowConstants.SCOPE_SUCCESS, PortDirection.INPUT, PortKind.CONTROL)
                .scope(scopeName).build());
        port(PortDefinition.builder(WorkflowConstants.SCOPE_FAILURE, PortDirection.INPUT, PortKind.CONTROL)
                .scope(scopeName).optional(true).build());
        return this;
    }

    /**
     * 只声明作用域名称，不添加任何端口。
     */
    public NodeTypeBuilder declareScope(String scopeName) {
        Objects.requireNonNull(scopeName, "作用域名称不能为空");
        if (!declaredScopes.contains(scopeName)) {
            declaredScopes.add(scopeName);
        }
        return this;
    }

    /**
     * 添加作用域负载输出（所有者写出，子图读取）。
     */
    public NodeTypeBuilder scopeOutput(String scopeName, String portName, String valueType) {
        return port(PortDefinition.builder(portName, PortDirection.OUTPUT, PortKind.DATA)
                .valueType(valueType).scope(scopeName).build());
    }

    /**
     * 添加作用域结果输入（子图写入，所有者读取），为可选端口。
     */
    public NodeTypeBuilder scopeInput(String scopeName, String portName, String valueType) {
        return port(PortDefinition.builder(portName, PortDirection.INPUT, PortKind.DATA)
                .valueType(valueType).scope(scopeName).optional(true).build());
    }

    public NodeTypeBuilder joinPolicy(JoinPolicy policy) {
        this.joinPolicy = Objects.requireNonNull(policy, "汇合策略不能为空");
        return this;
    }

    /**
     * 设置 CUSTOM 就绪谓词，同时把汇合策略切换为 CUSTOM。
     */
    public NodeTypeBuilder customReadiness(CustomReadinessPredicate predicate) {
        this.readinessPredicate = Objects.requireNonNull(predicate, "就绪谓词不能为空");
        this.joinPolicy = JoinPolicy.CUSTOM;
        return this;
    }

    public NodeTypeBuilder pure() {
        this.pure = true;
        return this;
    }

    /**
     * 标记为惰性节点：只在下游首次需要其输出时执行，且每次调用最多执行一次。
     */
    public NodeTypeBuilder lazy() {
        this.lazy = true;
        return this;
    }

    public LocalNodeType local(String implementationId) {
        LocalNodeType type = new LocalNodeType(name, ports, joinPolicy, readinessPredicate, pure, lazy,
                declaredScopes, implementationId);
        log.debug("构建了本地节点类型 '{}' (实现: {})", name, implementationId);
        return type;
    }

    /**
     * 构建以自身名称作为实现 ID 的本地节点类型。
     */
    public LocalNodeType local() {
        return local(name);
    }

    public WorkflowNodeType workflow(String workflowName) {
        WorkflowNodeType type = new WorkflowNodeType(name, ports, joinPolicy, readinessPredicate, pure, lazy,
                declaredScopes, workflowName);
        log.debug("构建了工作流节点类型 '{}' (引用工作流: {})", name, workflowName);
        return type;
    }

    public CoercionNodeType coercion(CoercionKind targetKind) {
        return new CoercionNodeType(name, ports, joinPolicy, lazy, targetKind);
    }

    public BuiltinNodeType builtin(String builtinId) {
        return new BuiltinNodeType(name, ports, joinPolicy, lazy, declaredScopes, builtinId);
    }
}
