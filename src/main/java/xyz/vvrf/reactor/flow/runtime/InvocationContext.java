package xyz.vvrf.reactor.flow.runtime;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.model.PortRef;
import xyz.vvrf.reactor.flow.plan.LayerPlan;
import xyz.vvrf.reactor.flow.plan.PlannedNode;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 封装一层执行的运行时状态：端口值、CONTROL 信号、节点结果以及惰性节点的记忆。
 * <p>
 * 每次工作流调用创建一个根上下文；每次作用域调用创建一个子上下文。
 * 子上下文读取不到的端口值与信号会向父上下文查找。
 *
 * @author ruifeng.wen
 */
@Slf4j
@Getter
public class InvocationContext {

    private final String requestId;
    private final String flowName;
    private final LayerPlan layer;
    private final InvocationContext parent;
    private final int callDepth;
    private final Instant startTime;

    // 值可以为 null，用 containsKey 区分缺失
    private final Map<PortRef, Object> values = Collections.synchronizedMap(new HashMap<PortRef, Object>());
    private final Map<PortRef, Boolean> signals = new ConcurrentHashMap<>();
    private final Map<String, NodeOutcome> outcomes = Collections.synchronizedMap(new LinkedHashMap<String, NodeOutcome>());
    private final Map<String, Mono<NodeOutcome>> nodeMonos = new ConcurrentHashMap<>();

    private InvocationContext(String requestId, String flowName, LayerPlan layer, InvocationContext parent, int callDepth) {
        this.requestId = requestId;
        this.flowName = flowName;
        this.layer = layer;
        this.parent = parent;
        this.callDepth = callDepth;
        this.startTime = Instant.now();
    }

    /**
     * 创建一次工作流调用的根上下文。
     *
     * @param rawRequestId 请求 ID，为空时自动生成
     */
    public static InvocationContext root(String rawRequestId, String flowName, LayerPlan layer, int callDepth) {
        String requestId = (rawRequestId != null && !rawRequestId.trim().isEmpty())
                ? rawRequestId
                : "flow-req-" + UUID.randomUUID().toString().substring(0, 8);
        log.debug("[RequestId: {}][Flow: '{}'] 创建 InvocationContext (Nodes: {}, CallDepth: {})",
                requestId, flowName, layer.getNodes().size(), callDepth);
        return new InvocationContext(requestId, flowName, layer, null, callDepth);
    }

    /**
     * 为一次作用域调用创建子上下文。
     */
    public InvocationContext child(LayerPlan body) {
        return new InvocationContext(requestId, flowName, body, this, callDepth);
    }

    // --- 值与信号 ---

    public void writeValue(PortRef port, Object value) {
        values.put(port, value);
    }

    public boolean hasValue(PortRef port) {
        if (values.containsKey(port)) {
            return true;
        }
        return parent != null && parent.hasValue(port);
    }

    public Object readValue(PortRef port) {
        if (values.containsKey(port)) {
            return values.get(port);
        }
        return parent != null ? parent.readValue(port) : null;
    }

    public void writeSignal(PortRef port, boolean fired) {
        signals.put(port, fired);
    }

    /**
     * @return true/false，尚未写入时返回 null
     */
    public Boolean readSignal(String instanceId, String portName) {
        Boolean value = signals.get(PortRef.of(instanceId, portName));
        if (value != null) {
            return value;
        }
        return parent != null ? parent.readSignal(instanceId, portName) : null;
    }

    // --- 节点 ---

    public void recordOutcome(String instanceId, NodeOutcome outcome) {
        outcomes.put(instanceId, outcome);
        log.debug("[RequestId: {}][Flow: '{}'] Node '{}' completed with status: {}. Progress: {}/{}",
                requestId, flowName, instanceId, outcome.getStatus(), outcomes.size(), layer.getNodes().size());
    }

    public Map<String, NodeOutcome> snapshotOutcomes() {
        synchronized (outcomes) {
            return new LinkedHashMap<>(outcomes);
        }
    }

    /**
     * 查找拥有某个节点的上下文，从本层开始向父层查找。
     */
    public Optional<InvocationContext> ownerOf(String instanceId) {
        if (layer.findNode(instanceId).isPresent()) {
            return Optional.of(this);
        }
        return parent != null ? parent.ownerOf(instanceId) : Optional.<InvocationContext>empty();
    }

    public Optional<PlannedNode> findNode(String instanceId) {
        return layer.findNode(instanceId);
    }

    /**
     * 获取或创建指定节点的执行 Mono。
     * 使用 computeIfAbsent 确保每个节点在本上下文中只创建一个 Mono。
     *
     * @param instanceId   节点实例 ID
     * @param monoSupplier 用于创建 Mono 的 Supplier (仅当 Mono 不存在时调用)
     * @return 缓存的或新创建的 Mono
     */
    public Mono<NodeOutcome> getOrCreateNodeMono(String instanceId, Supplier<Mono<NodeOutcome>> monoSupplier) {
        return nodeMonos.computeIfAbsent(instanceId, key -> {
            log.trace("[RequestId: {}][Flow: '{}'] Creating execution Mono for node '{}'.", requestId, flowName, instanceId);
            return monoSupplier.get();
        });
    }

    /**
     * 清理此上下文持有的 Mono 缓存。
     */
    public void clearExecutionMonoCache() {
        nodeMonos.clear();
    }
}
