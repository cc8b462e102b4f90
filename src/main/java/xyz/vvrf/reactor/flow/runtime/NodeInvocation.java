package xyz.vvrf.reactor.flow.runtime;

import lombok.Getter;
import xyz.vvrf.reactor.flow.model.NodeType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 一次节点调用的输入视图（不可变）。
 *
 * @author ruifeng.wen
 */
@Getter
public final class NodeInvocation {
    private final String requestId;
    private final String flowName;
    private final String instanceId;
    private final NodeType nodeType;
    private final Map<String, Object> inputs;
    private final Map<String, Object> configuration;
    private final Map<String, ScopeInvoker> scopes;
    private final int callDepth;

    public NodeInvocation(String requestId, String flowName, String instanceId, NodeType nodeType,
                          Map<String, Object> inputs, Map<String, Object> configuration,
                          Map<String, ScopeInvoker> scopes, int callDepth) {
        this.requestId = Objects.requireNonNull(requestId, "请求 ID 不能为空");
        this.flowName = Objects.requireNonNull(flowName, "工作流名称不能为空");
        this.instanceId = Objects.requireNonNull(instanceId, "实例 ID 不能为空");
        this.nodeType = Objects.requireNonNull(nodeType, "节点类型不能为空");
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        this.configuration = configuration != null ? configuration : Collections.<String, Object>emptyMap();
        this.scopes = Collections.unmodifiableMap(new LinkedHashMap<>(scopes));
        this.callDepth = callDepth;
    }

    /**
     * 输入端口是否有值（值本身可以是 null）。
     */
    public boolean hasInput(String port) {
        return inputs.containsKey(port);
    }

    public Object getInput(String port) {
        return inputs.get(port);
    }

    /**
     * 获取类型化的输入值。
     *
     * @throws ClassCastException 如果值不是期望的类型
     */
    public <T> Optional<T> getInput(String port, Class<T> type) {
        Object value = inputs.get(port);
        return value == null ? Optional.<T>empty() : Optional.of(type.cast(value));
    }

    /**
     * 获取作用域调用器。
     *
     * @throws IllegalArgumentException 如果节点没有该作用域
     */
    public ScopeInvoker scope(String scopeName) {
        ScopeInvoker invoker = scopes.get(scopeName);
        if (invoker == null) {
            throw new IllegalArgumentException(String.format("Node '%s' has no scope '%s'", instanceId, scopeName));
        }
        return invoker;
    }
}
