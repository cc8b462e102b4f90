package xyz.vvrf.reactor.flow.plan;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.graph.ControlFlowGraph;
import xyz.vvrf.reactor.flow.graph.ControlFlowGraphBuilder;
import xyz.vvrf.reactor.flow.graph.GraphLayer;
import xyz.vvrf.reactor.flow.graph.TopologicalScheduler;
import xyz.vvrf.reactor.flow.model.Connection;
import xyz.vvrf.reactor.flow.model.NodeInstance;
import xyz.vvrf.reactor.flow.model.NodeType;
import xyz.vvrf.reactor.flow.model.PortDefinition;
import xyz.vvrf.reactor.flow.model.PortRef;
import xyz.vvrf.reactor.flow.model.ScopeDefinition;
import xyz.vvrf.reactor.flow.model.ScopeRef;
import xyz.vvrf.reactor.flow.model.Workflow;
import xyz.vvrf.reactor.flow.model.WorkflowConstants;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 逐层编译：构建控制流图、排序、计算守卫与输入绑定，并把每个所有者的作用域展开为 {@link ScopeUnit}。
 * <p>
 * 每个作用域层独立使用同一套 CFG 构建器、调度器、就绪计算与合并解析；嵌套作用域逐层展开，
 * 深度超过 {@code maxDepth} 时抛出 {@link ScopeDepthExceededException}。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class ScopeExpander {

    public static final int DEFAULT_MAX_DEPTH = 16;

    private final ControlFlowGraphBuilder graphBuilder;
    private final TopologicalScheduler scheduler;
    private final ReadinessEvaluator readinessEvaluator;
    private final MergeResolver mergeResolver;
    private final int maxDepth;

    public ScopeExpander(ControlFlowGraphBuilder graphBuilder, TopologicalScheduler scheduler,
                         ReadinessEvaluator readinessEvaluator, MergeResolver mergeResolver, int maxDepth) {
        this.graphBuilder = Objects.requireNonNull(graphBuilder, "ControlFlowGraphBuilder 不能为空");
        this.scheduler = Objects.requireNonNull(scheduler, "TopologicalScheduler 不能为空");
        this.readinessEvaluator = Objects.requireNonNull(readinessEvaluator, "ReadinessEvaluator 不能为空");
        this.mergeResolver = Objects.requireNonNull(mergeResolver, "MergeResolver 不能为空");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("最大作用域深度必须至少为 1: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * 展开所有者上的一个作用域。
     *
     * @param workflow  工作流
     * @param ownerId   所有者实例 ID
     * @param scopeName 作用域名称
     * @param depth     本作用域的嵌套深度（根层的直接作用域为 1）
     * @return 作用域单元
     * @throws ScopeDepthExceededException 如果深度超过上限
     * @throws IllegalArgumentException    如果所有者不存在或未声明该作用域
     */
    public ScopeUnit expand(Workflow workflow, String ownerId, String scopeName, int depth) {
        ScopeRef ref = new ScopeRef(ownerId, scopeName);
        if (depth > maxDepth) {
            log.warn("Flow '{}': Scope '{}' exceeds max depth {}", workflow.getName(), ref, maxDepth);
            throw new ScopeDepthExceededException(workflow.getName() + "/" + ref, maxDepth);
        }
        NodeType ownerType = workflow.nodeTypeOf(ownerId)
                .orElseThrow(() -> new IllegalArgumentException(String.format(
                        "Flow '%s': Scope owner '%s' does not exist or has no resolved type", workflow.getName(), ownerId)));
        ScopeDefinition definition = ownerType.findScope(scopeName)
                .orElseThrow(() -> new IllegalArgumentException(String.format(
                        "Flow '%s': Node '%s' declares no scope '%s'", workflow.getName(), ownerId, scopeName)));
        LayerPlan body = planLayer(workflow, GraphLayer.of(ref), depth);
        log.debug("Flow '{}': Expanded scope '{}' at depth {} with {} node(s)",
                workflow.getName(), ref, depth, body.getNodes().size());
        return new ScopeUnit(ref, definition, body, depth);
    }

    /**
     * 编译一层。
     *
     * @param depth 该层的嵌套深度，根层为 0
     */
    public LayerPlan planLayer(Workflow workflow, GraphLayer layer, int depth) {
        ControlFlowGraph graph = graphBuilder.build(workflow, layer);
        List<String> order = scheduler.order(graph);
        Map<String, ReadinessGuard> guards = readinessEvaluator.evaluate(workflow, graph, order);

        List<PlannedNode> nodes = new ArrayList<>();
        for (String instanceId : order) {
            if (WorkflowConstants.isReserved(instanceId)) {
                continue;
            }
            NodeInstance instance = workflow.findInstance(instanceId)
                    .orElseThrow(() -> new IllegalStateException("Unknown instance in schedule: " + instanceId));
            NodeType type = workflow.nodeTypeOf(instanceId)
                    .orElseThrow(() -> new IllegalStateException("Unresolved node type for instance: " + instanceId));
            Map<String, InputBinding> inputs = bindInputs(workflow, instance, unscopedInputs(type));
            List<ScopeUnit> units = new ArrayList<>();
            for (ScopeDefinition scope : type.getScopes()) {
                units.add(expand(workflow, instanceId, scope.getName(), depth + 1));
            }
            nodes.add(new PlannedNode(instance, type, guards.get(instanceId), inputs, units));
        }

        Map<String, InputBinding> exitBindings;
        Optional<ScopeRef> scope = layer.getScope();
        if (scope.isPresent()) {
            NodeInstance owner = workflow.findInstance(scope.get().getOwnerId())
                    .orElseThrow(() -> new IllegalStateException("Unknown scope owner: " + scope.get()));
            List<PortDefinition> exitPorts = workflow.nodeTypeOf(owner.getId())
                    .flatMap(t -> t.findScope(scope.get().getScopeName()))
                    .map(ScopeDefinition::getExitPorts)
                    .orElse(new ArrayList<>());
            exitBindings = bindInputs(workflow, owner, exitPorts);
        } else {
            exitBindings = bindInputs(workflow, new NodeInstance(WorkflowConstants.EXIT, WorkflowConstants.EXIT),
                    workflow.getExitPorts());
        }
        return new LayerPlan(layer, order, nodes, exitBindings);
    }

    private List<PortDefinition> unscopedInputs(NodeType type) {
        List<PortDefinition> result = new ArrayList<>();
        for (PortDefinition port : type.getInputs()) {
            if (!port.isScoped()) {
                result.add(port);
            }
        }
        return result;
    }

    private Map<String, InputBinding> bindInputs(Workflow workflow, NodeInstance instance, List<PortDefinition> ports) {
        Map<String, InputBinding> bindings = new LinkedHashMap<>();
        for (PortDefinition port : ports) {
            if (bindings.containsKey(port.getName())) {
                continue;
            }
            Set<PortRef> writers = new LinkedHashSet<>();
            for (Connection connection : workflow.incomingTo(instance.getId(), port.getName())) {
                writers.add(connection.getSource());
            }
            InputBinding binding;
            if (port.isControl()) {
                binding = InputBinding.signal(port, new ArrayList<>(writers));
            } else if (writers.size() > 1) {
                MergeExpression expression = mergeResolver.expressionFor(workflow, PortRef.of(instance.getId(), port.getName()))
                        .orElseThrow(() -> new IllegalStateException("No merge expression for " + instance.getId() + "." + port.getName()));
                binding = InputBinding.merged(port, expression);
            } else if (writers.size() == 1) {
                binding = InputBinding.connected(port, writers.iterator().next());
            } else if (instance.isConfigured(port.getName())) {
                binding = InputBinding.configured(port, instance.getConfiguration().get(port.getName()));
            } else if (port.hasDefaultValue()) {
                binding = InputBinding.defaulted(port);
            } else {
                binding = InputBinding.unbound(port);
            }
            bindings.put(port.getName(), binding);
        }
        return bindings;
    }
}
