package xyz.vvrf.reactor.flow.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.builder.BuiltinNodeTypes;
import xyz.vvrf.reactor.flow.model.BuiltinNodeType;
import xyz.vvrf.reactor.flow.model.CoercionNodeType;
import xyz.vvrf.reactor.flow.model.JoinPolicy;
import xyz.vvrf.reactor.flow.model.LocalNodeType;
import xyz.vvrf.reactor.flow.model.NodeType;
import xyz.vvrf.reactor.flow.model.NodeTypeVisitor;
import xyz.vvrf.reactor.flow.model.PortDefinition;
import xyz.vvrf.reactor.flow.model.PortRef;
import xyz.vvrf.reactor.flow.model.ScopeRef;
import xyz.vvrf.reactor.flow.model.Workflow;
import xyz.vvrf.reactor.flow.model.WorkflowConstants;
import xyz.vvrf.reactor.flow.model.WorkflowNodeType;
import xyz.vvrf.reactor.flow.monitor.FlowMonitorListener;
import xyz.vvrf.reactor.flow.plan.ControlSignalRef;
import xyz.vvrf.reactor.flow.plan.ExecutionPlan;
import xyz.vvrf.reactor.flow.plan.GuardDecision;
import xyz.vvrf.reactor.flow.plan.InputBinding;
import xyz.vvrf.reactor.flow.plan.MergeExpression;
import xyz.vvrf.reactor.flow.plan.MergeResolver;
import xyz.vvrf.reactor.flow.plan.PlannedNode;
import xyz.vvrf.reactor.flow.plan.ScopeUnit;
import xyz.vvrf.reactor.flow.plan.WorkflowCompiler;
import xyz.vvrf.reactor.flow.registry.NodeTypeRegistry;
import xyz.vvrf.reactor.flow.runtime.builtin.CoercionNode;
import xyz.vvrf.reactor.flow.runtime.builtin.ForEachNode;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * 执行计划的标准解释器。
 * <p>
 * 每层按拓扑顺序依次处理非惰性节点（{@code concatMap}），同一层内任意时刻最多只有一个节点在执行。
 * 惰性节点只在下游需要其输出时才执行，并在同一次调用（或同一次作用域调用）内只执行一次。
 * 节点失败不会中断工作流：失败分支的 CONTROL 输出被触发，其余下游节点按守卫跳过。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class StandardFlowEngine implements FlowEngine {

    private final WorkflowCompiler compiler;
    private final NodeTypeRegistry typeRegistry;
    private final NodeImplementationRegistry implementations;
    private final MergeResolver mergeResolver;
    private final CoercionNode coercionNode;
    private final Duration defaultNodeTimeout;
    private final int maxCallDepth;
    private final List<FlowMonitorListener> monitorListeners;
    private final Cache<String, ExecutionPlan> planCache;

    public StandardFlowEngine(WorkflowCompiler compiler,
                              NodeTypeRegistry typeRegistry,
                              NodeImplementationRegistry implementations,
                              MergeResolver mergeResolver,
                              ObjectMapper objectMapper,
                              Duration defaultNodeTimeout,
                              int maxCallDepth,
                              long planCacheCapacity,
                              List<FlowMonitorListener> monitorListeners) {
        this.compiler = Objects.requireNonNull(compiler, "WorkflowCompiler 不能为空");
        this.typeRegistry = Objects.requireNonNull(typeRegistry, "NodeTypeRegistry 不能为空");
        this.implementations = Objects.requireNonNull(implementations, "NodeImplementationRegistry 不能为空");
        this.mergeResolver = Objects.requireNonNull(mergeResolver, "MergeResolver 不能为空");
        this.coercionNode = new CoercionNode(Objects.requireNonNull(objectMapper, "ObjectMapper 不能为空"));
        this.defaultNodeTimeout = Objects.requireNonNull(defaultNodeTimeout, "默认节点超时时间不能为空");
        this.monitorListeners = monitorListeners != null
                ? Collections.unmodifiableList(new ArrayList<>(monitorListeners))
                : Collections.<FlowMonitorListener>emptyList();
        if (maxCallDepth < 1) {
            throw new IllegalArgumentException("最大调用深度必须至少为 1: " + maxCallDepth);
        }
        this.maxCallDepth = maxCallDepth;
        this.planCache = Caffeine.newBuilder().maximumSize(planCacheCapacity).build();

        implementations.registerIfAbsent(BuiltinNodeTypes.FOR_EACH, new ForEachNode());

        log.info("StandardFlowEngine initialized. Default timeout: {}, Max call depth: {}, Plan cache: {}, Listeners: {}",
                defaultNodeTimeout, maxCallDepth, planCacheCapacity, this.monitorListeners.size());
    }

    @Override
    public Mono<ExecutionResult> execute(ExecutionPlan plan, Map<String, Object> inputs, String requestId) {
        Objects.requireNonNull(plan, "执行计划不能为空");
        return executeInternal(plan, inputs, requestId, 0);
    }

    @Override
    public Mono<ExecutionResult> execute(String workflowName, Map<String, Object> inputs, String requestId) {
        Objects.requireNonNull(workflowName, "工作流名称不能为空");
        return Mono.fromCallable(() -> resolvePlan(workflowName))
                .flatMap(plan -> executeInternal(plan, inputs, requestId, 0));
    }

    /**
     * 丢弃所有缓存的执行计划。注册表中的工作流变化后调用。
     */
    public void invalidatePlans() {
        planCache.invalidateAll();
    }

    public long getCachedPlanCount() {
        return planCache.estimatedSize();
    }

    private ExecutionPlan resolvePlan(String workflowName) {
        Workflow workflow = typeRegistry.findWorkflow(workflowName)
                .orElseThrow(() -> new FlowExecutionException(
                        String.format("Workflow '%s' is not registered.", workflowName)));
        return planCache.get(workflowName, key -> compiler.compileOrThrow(workflow));
    }

    private Mono<ExecutionResult> executeInternal(ExecutionPlan plan, Map<String, Object> inputs,
                                                  String requestId, int callDepth) {
        return Mono.defer(() -> {
            Map<String, Object> safeInputs = inputs != null ? inputs : Collections.<String, Object>emptyMap();
            InvocationContext context = InvocationContext.root(requestId, plan.getWorkflowName(), plan.getRoot(), callDepth);
            log.info("[RequestId: {}][Flow: '{}'] Starting execution (Nodes: {}, CallDepth: {})",
                    context.getRequestId(), context.getFlowName(), plan.getNodes().size(), callDepth);
            safeNotifyListeners(l -> l.onFlowStart(context.getRequestId(), context.getFlowName(), plan, safeInputs));
            seedStart(context, plan.getWorkflow(), safeInputs);

            return runLayer(context)
                    .then(resolveExit(context, plan))
                    .doOnNext(result -> {
                        log.info("[RequestId: {}][Flow: '{}'] Execution finished. Succeeded: {}, Failed: {}, Duration: {}ms",
                                result.getRequestId(), result.getFlowName(), result.isSucceeded(), result.isFailed(),
                                result.getDuration().toMillis());
                        safeNotifyListeners(l -> l.onFlowComplete(result.getRequestId(), result.getFlowName(),
                                result.getDuration(), result.isSucceeded(), result.getOutcomes()));
                    })
                    .doFinally(signal -> context.clearExecutionMonoCache());
        });
    }

    private void seedStart(InvocationContext context, Workflow workflow, Map<String, Object> inputs) {
        context.writeSignal(PortRef.of(WorkflowConstants.START, WorkflowConstants.EXECUTE), true);
        for (PortDefinition port : workflow.getStartPorts()) {
            if (port.isControl()) {
                continue;
            }
            PortRef ref = PortRef.of(WorkflowConstants.START, port.getName());
            if (inputs.containsKey(port.getName())) {
                context.writeValue(ref, inputs.get(port.getName()));
            } else if (port.hasDefaultValue()) {
                context.writeValue(ref, port.getDefaultValue());
            }
        }
        for (String name : inputs.keySet()) {
            if (!workflow.findOutputPort(WorkflowConstants.START, name).isPresent()) {
                log.debug("[RequestId: {}][Flow: '{}'] Ignoring undeclared input '{}'",
                        context.getRequestId(), context.getFlowName(), name);
            }
        }
    }

    /**
     * 按拓扑顺序依次处理本层的非惰性节点。
     */
    private Mono<Void> runLayer(InvocationContext context) {
        return Flux.fromIterable(context.getLayer().getNodes())
                .filter(node -> !node.isLazy())
                .concatMap(node -> demand(context, node))
                .then();
    }

    private Mono<NodeOutcome> demand(InvocationContext context, PlannedNode node) {
        return context.getOrCreateNodeMono(node.getInstanceId(),
                () -> Mono.defer(() -> evaluate(context, node)).cache());
    }

    /**
     * 执行写入者中尚未执行的惰性节点。
     */
    private Mono<Void> demandWriters(InvocationContext context, Collection<String> writerIds) {
        return Flux.fromIterable(writerIds)
                .concatMap(writerId -> {
                    if (isEnclosingScopeOwner(context, writerId)) {
                        return Mono.<NodeOutcome>empty();
                    }
                    Optional<InvocationContext> owner = context.ownerOf(writerId);
                    if (!owner.isPresent()) {
                        return Mono.<NodeOutcome>empty();
                    }
                    Optional<PlannedNode> writer = owner.get().findNode(writerId);
                    if (writer.isPresent() && writer.get().isLazy()) {
                        return demand(owner.get(), writer.get());
                    }
                    return Mono.<NodeOutcome>empty();
                })
                .then();
    }

    private boolean isEnclosingScopeOwner(InvocationContext context, String instanceId) {
        for (InvocationContext current = context; current != null; current = current.getParent()) {
            Optional<ScopeRef> scope = current.getLayer().getLayer().getScope();
            if (scope.isPresent() && scope.get().getOwnerId().equals(instanceId)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 判定守卫，然后执行或跳过节点。
     */
    private Mono<NodeOutcome> evaluate(InvocationContext context, PlannedNode node) {
        Set<String> controlWriters = new LinkedHashSet<>();
        for (ControlSignalRef signal : node.getGuard().getSignals()) {
            controlWriters.add(signal.getInstanceId());
        }
        boolean custom = node.getGuard().getPolicy() == JoinPolicy.CUSTOM;
        Mono<Void> pullData = custom ? demandWriters(context, dataWriters(node)) : Mono.<Void>empty();

        return demandWriters(context, controlWriters)
                .then(pullData)
                .then(Mono.defer(() -> {
                    GuardDecision decision;
                    try {
                        Map<String, Object> guardInputs = custom
                                ? resolveValues(context, node.getInputs())
                                : Collections.<String, Object>emptyMap();
                        decision = node.getGuard().decide(context::readSignal, guardInputs);
                    } catch (Exception e) {
                        log.error("[RequestId: {}][Flow: '{}'] Node '{}' readiness guard threw exception. Treating as failed.",
                                context.getRequestId(), context.getFlowName(), node.getInstanceId(), e);
                        safeNotifyListeners(l -> l.onNodeFailure(context.getRequestId(), context.getFlowName(),
                                node.getInstanceId(), Duration.ZERO, e, node.getNodeType()));
                        return Mono.just(record(context, node, NodeOutcome.failure(e)));
                    }

                    if (decision == GuardDecision.RUN) {
                        log.debug("[RequestId: {}][Flow: '{}'] Node '{}' guard [{}] satisfied, proceeding to execute.",
                                context.getRequestId(), context.getFlowName(), node.getInstanceId(), node.getGuard().describe());
                        return demandWriters(context, dataWriters(node)).then(Mono.defer(() -> run(context, node)));
                    }
                    if (decision == GuardDecision.WAIT) {
                        log.debug("[RequestId: {}][Flow: '{}'] Node '{}' guard [{}] has unwritten signals after all upstream nodes completed, skipping.",
                                context.getRequestId(), context.getFlowName(), node.getInstanceId(), node.getGuard().describe());
                    } else {
                        log.debug("[RequestId: {}][Flow: '{}'] Node '{}' guard [{}] not met, skipping execution.",
                                context.getRequestId(), context.getFlowName(), node.getInstanceId(), node.getGuard().describe());
                    }
                    safeNotifyListeners(l -> l.onNodeSkipped(context.getRequestId(), context.getFlowName(),
                            node.getInstanceId(), node.getNodeType()));
                    return Mono.just(record(context, node, NodeOutcome.skipped()));
                }));
    }

    private Set<String> dataWriters(PlannedNode node) {
        Set<String> writers = new LinkedHashSet<>();
        for (InputBinding binding : node.getInputs().values()) {
            if (binding.getSource() != InputBinding.Source.SIGNAL) {
                for (PortRef writer : binding.getWriters()) {
                    writers.add(writer.getInstanceId());
                }
            }
        }
        return writers;
    }

    private Mono<NodeOutcome> run(InvocationContext context, PlannedNode node) {
        String requestId = context.getRequestId();
        String flowName = context.getFlowName();
        String instanceId = node.getInstanceId();
        Instant startTime = Instant.now();
        safeNotifyListeners(l -> l.onNodeStart(requestId, flowName, instanceId, node.getNodeType()));

        return Mono.fromCallable(() -> resolveValues(context, node.getInputs()))
                .flatMap(inputs -> dispatch(context, node, inputs))
                .switchIfEmpty(Mono.defer(() -> Mono.<NodeOutcome>error(new FlowExecutionException(
                        String.format("Node '%s' completed without emitting an outcome.", instanceId)))))
                .onErrorResume(error -> {
                    log.error("[RequestId: {}][Flow: '{}'] Node '{}' execution failed: {}",
                            requestId, flowName, instanceId, error.getMessage(), error);
                    return Mono.just(NodeOutcome.failure(error));
                })
                .map(outcome -> {
                    Duration duration = Duration.between(startTime, Instant.now());
                    if (outcome.isFailure()) {
                        Throwable error = outcome.getError().orElseThrow(IllegalStateException::new);
                        safeNotifyListeners(l -> l.onNodeFailure(requestId, flowName, instanceId, duration, error, node.getNodeType()));
                    } else if (outcome.isSkipped()) {
                        safeNotifyListeners(l -> l.onNodeSkipped(requestId, flowName, instanceId, node.getNodeType()));
                    } else {
                        log.debug("[RequestId: {}][Flow: '{}'] Node '{}' executed successfully. Outcome: {}",
                                requestId, flowName, instanceId, outcome);
                        safeNotifyListeners(l -> l.onNodeSuccess(requestId, flowName, instanceId, duration, outcome, node.getNodeType()));
                    }
                    return record(context, node, outcome);
                });
    }

    private Mono<NodeOutcome> dispatch(InvocationContext context, PlannedNode node, Map<String, Object> inputs) {
        Map<String, ScopeInvoker> scopes = new LinkedHashMap<>();
        for (ScopeUnit unit : node.getScopeUnits()) {
            scopes.put(unit.getScopeName(), payload -> invokeScope(context, unit, payload));
        }
        NodeInvocation invocation = new NodeInvocation(context.getRequestId(), context.getFlowName(),
                node.getInstanceId(), node.getNodeType(), inputs, node.getInstance().getConfiguration(),
                scopes, context.getCallDepth());

        return node.getNodeType().accept(new NodeTypeVisitor<Mono<NodeOutcome>>() {
            @Override
            public Mono<NodeOutcome> visitLocal(LocalNodeType nodeType) {
                return lookup(nodeType.getImplementationId(), node)
                        .flatMap(implementation -> Mono.defer(() -> implementation.execute(invocation))
                                .timeout(defaultNodeTimeout)
                                .doOnError(TimeoutException.class, e -> {
                                    log.warn("[RequestId: {}][Flow: '{}'] Node '{}' execution timed out after {}.",
                                            context.getRequestId(), context.getFlowName(), node.getInstanceId(), defaultNodeTimeout);
                                    safeNotifyListeners(l -> l.onNodeTimeout(context.getRequestId(), context.getFlowName(),
                                            node.getInstanceId(), defaultNodeTimeout, nodeType));
                                }));
            }

            @Override
            public Mono<NodeOutcome> visitBuiltin(BuiltinNodeType nodeType) {
                return lookup(nodeType.getBuiltinId(), node)
                        .flatMap(implementation -> Mono.defer(() -> implementation.execute(invocation)));
            }

            @Override
            public Mono<NodeOutcome> visitCoercion(CoercionNodeType nodeType) {
                return coercionNode.execute(invocation);
            }

            @Override
            public Mono<NodeOutcome> visitWorkflow(WorkflowNodeType nodeType) {
                return invokeWorkflow(context, node, nodeType, inputs);
            }
        });
    }

    private Mono<NodeImplementation> lookup(String implementationId, PlannedNode node) {
        Optional<NodeImplementation> implementation = implementations.find(implementationId);
        if (!implementation.isPresent()) {
            return Mono.error(new FlowExecutionException(String.format(
                    "No implementation registered under '%s' for node '%s' (type '%s').",
                    implementationId, node.getInstanceId(), node.getNodeType().getName())));
        }
        return Mono.just(implementation.get());
    }

    private Mono<NodeOutcome> invokeWorkflow(InvocationContext context, PlannedNode node,
                                             WorkflowNodeType nodeType, Map<String, Object> inputs) {
        int nextDepth = context.getCallDepth() + 1;
        if (nextDepth > maxCallDepth) {
            return Mono.error(new FlowExecutionException(String.format(
                    "Maximum call depth %d exceeded when node '%s' invoked workflow '%s'.",
                    maxCallDepth, node.getInstanceId(), nodeType.getWorkflowName())));
        }
        return Mono.fromCallable(() -> resolvePlan(nodeType.getWorkflowName()))
                .flatMap(plan -> executeInternal(plan, inputs, context.getRequestId(), nextDepth))
                .map(result -> {
                    if (result.isSucceeded() && !result.isFailed()) {
                        return NodeOutcome.success(result.getOutputs());
                    }
                    return NodeOutcome.failure(new FlowExecutionException(String.format(
                            "Workflow '%s' invoked by node '%s' did not succeed.",
                            nodeType.getWorkflowName(), node.getInstanceId())));
                });
    }

    /**
     * 在全新的子上下文中运行一次作用域。
     */
    private Mono<ScopeResult> invokeScope(InvocationContext context, ScopeUnit unit, Map<String, Object> payload) {
        return Mono.defer(() -> {
            InvocationContext child = context.child(unit.getBody());
            String ownerId = unit.getOwnerId();
            String startPort = unit.getDefinition().getStartPort()
                    .map(PortDefinition::getName)
                    .orElse(WorkflowConstants.SCOPE_START);
            child.writeSignal(PortRef.of(ownerId, startPort), true);
            Map<String, Object> safePayload = payload != null ? payload : Collections.<String, Object>emptyMap();
            for (PortDefinition port : unit.getDefinition().getPayloadPorts()) {
                if (safePayload.containsKey(port.getName())) {
                    child.writeValue(PortRef.of(ownerId, port.getName()), safePayload.get(port.getName()));
                }
            }
            log.trace("[RequestId: {}][Flow: '{}'] Invoking scope '{}' with payload {}",
                    context.getRequestId(), context.getFlowName(), unit.getScope(), safePayload.keySet());

            return runLayer(child)
                    .then(resolveBindings(child, unit.getBody().getExitBindings()))
                    .map(values -> {
                        Map<String, Object> results = new LinkedHashMap<>();
                        for (PortDefinition port : unit.getDefinition().getResultPorts()) {
                            if (values.containsKey(port.getName())) {
                                results.put(port.getName(), values.get(port.getName()));
                            }
                        }
                        boolean success = unit.getDefinition().getSuccessPort()
                                .map(p -> Boolean.TRUE.equals(values.get(p.getName()))).orElse(false);
                        boolean failure = unit.getDefinition().getFailurePort()
                                .map(p -> Boolean.TRUE.equals(values.get(p.getName()))).orElse(false);
                        return new ScopeResult(success, failure, results);
                    })
                    .doFinally(signal -> child.clearExecutionMonoCache());
        });
    }

    /**
     * 解析 Exit 端口并生成结果。合并失败不会中止调用：该端口不输出，错误记入结果，调用视为失败。
     */
    private Mono<ExecutionResult> resolveExit(InvocationContext context, ExecutionPlan plan) {
        Map<String, InputBinding> bindings = plan.getExitBindings();
        return demandWriters(context, writerIdsOf(bindings))
                .then(Mono.fromCallable(() -> {
                    Map<String, Object> exitValues = new LinkedHashMap<>();
                    Throwable exitError = null;
                    for (Map.Entry<String, InputBinding> entry : bindings.entrySet()) {
                        try {
                            exitValues.putAll(resolveValues(context,
                                    Collections.singletonMap(entry.getKey(), entry.getValue())));
                        } catch (IllegalArgumentException e) {
                            log.error("[RequestId: {}][Flow: '{}'] Failed to resolve exit port '{}': {}",
                                    context.getRequestId(), context.getFlowName(), entry.getKey(), e.getMessage(), e);
                            if (exitError == null) {
                                exitError = new FlowExecutionException(String.format(
                                        "Exit port '%s' could not be resolved: %s", entry.getKey(), e.getMessage()), e);
                            }
                        }
                    }
                    return buildResult(context, plan, exitValues, exitError);
                }));
    }

    private Set<String> writerIdsOf(Map<String, InputBinding> bindings) {
        Set<String> writers = new LinkedHashSet<>();
        for (InputBinding binding : bindings.values()) {
            for (PortRef writer : binding.getWriters()) {
                writers.add(writer.getInstanceId());
            }
        }
        return writers;
    }

    private Mono<Map<String, Object>> resolveBindings(InvocationContext context, Map<String, InputBinding> bindings) {
        return demandWriters(context, writerIdsOf(bindings))
                .then(Mono.fromCallable(() -> resolveValues(context, bindings)));
    }

    /**
     * 根据绑定读取当前值。缺失的端口不放入结果。
     *
     * @throws IllegalArgumentException 如果合并失败
     */
    private Map<String, Object> resolveValues(InvocationContext context, Map<String, InputBinding> bindings) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (InputBinding binding : bindings.values()) {
            String name = binding.getPortName();
            switch (binding.getSource()) {
                case SIGNAL:
                    Boolean signal = readSignal(context, binding.getWriters());
                    if (signal != null) {
                        values.put(name, signal);
                    }
                    break;
                case CONNECTED:
                    PortRef writer = binding.getWriters().get(0);
                    if (context.hasValue(writer)) {
                        values.put(name, context.readValue(writer));
                    }
                    break;
                case MERGED:
                    List<Object> written = new ArrayList<>();
                    boolean anyWritten = false;
                    for (PortRef source : binding.getWriters()) {
                        if (context.hasValue(source)) {
                            anyWritten = true;
                            written.add(context.readValue(source));
                        } else {
                            written.add(null);
                        }
                    }
                    if (anyWritten) {
                        MergeExpression expression = binding.getMergeExpression()
                                .orElseThrow(() -> new IllegalStateException("Missing merge expression for " + name));
                        values.put(name, mergeResolver.resolve(expression.getStrategy(), written));
                    }
                    break;
                case CONFIGURED:
                case DEFAULTED:
                    values.put(name, binding.getStaticValue());
                    break;
                default:
                    break;
            }
        }
        return values;
    }

    private Boolean readSignal(InvocationContext context, List<PortRef> writers) {
        Boolean result = null;
        for (PortRef writer : writers) {
            Boolean value = context.readSignal(writer.getInstanceId(), writer.getPortName());
            if (value != null) {
                result = (result != null && result) || value;
            }
        }
        return result;
    }

    /**
     * 记录节点结果：写入 CONTROL 信号，成功时写入数据输出。
     */
    private NodeOutcome record(InvocationContext context, PlannedNode node, NodeOutcome outcome) {
        String instanceId = node.getInstanceId();
        for (PortDefinition port : node.getNodeType().getOutputs()) {
            if (port.isScoped()) {
                continue;
            }
            PortRef ref = PortRef.of(instanceId, port.getName());
            if (port.isControl()) {
                boolean fired = outcome.isSuccess() ? !port.isFailure() : outcome.isFailure() && port.isFailure();
                context.writeSignal(ref, fired);
            } else if (outcome.isSuccess() && outcome.hasOutput(port.getName())) {
                context.writeValue(ref, outcome.getOutput(port.getName()));
            }
        }
        context.recordOutcome(instanceId, outcome);
        return outcome;
    }

    private ExecutionResult buildResult(InvocationContext context, ExecutionPlan plan, Map<String, Object> exitValues,
                                        Throwable exitError) {
        Map<String, Object> outputs = new LinkedHashMap<>();
        for (InputBinding binding : plan.getExitBindings().values()) {
            if (binding.getPort().isData() && exitValues.containsKey(binding.getPortName())) {
                outputs.put(binding.getPortName(), exitValues.get(binding.getPortName()));
            }
        }
        Map<String, NodeOutcome> outcomes = context.snapshotOutcomes();
        boolean anyFailure = false;
        for (NodeOutcome outcome : outcomes.values()) {
            if (outcome.isFailure()) {
                anyFailure = true;
                break;
            }
        }
        boolean succeeded = exitError == null && (isWired(plan, WorkflowConstants.ON_SUCCESS)
                ? Boolean.TRUE.equals(exitValues.get(WorkflowConstants.ON_SUCCESS))
                : !anyFailure);
        boolean failed = exitError != null || (isWired(plan, WorkflowConstants.ON_FAILURE)
                ? Boolean.TRUE.equals(exitValues.get(WorkflowConstants.ON_FAILURE))
                : anyFailure);
        Duration duration = Duration.between(context.getStartTime(), Instant.now());
        return new ExecutionResult(context.getRequestId(), context.getFlowName(), outputs, outcomes,
                succeeded, failed, duration, exitError);
    }

    private boolean isWired(ExecutionPlan plan, String exitPort) {
        InputBinding binding = plan.getExitBindings().get(exitPort);
        return binding != null && !binding.getWriters().isEmpty();
    }

    private void safeNotifyListeners(Consumer<FlowMonitorListener> notification) {
        if (monitorListeners.isEmpty()) {
            return;
        }
        for (FlowMonitorListener listener : monitorListeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.error("Flow Monitor Listener {} threw exception: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
