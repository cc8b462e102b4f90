package xyz.vvrf.reactor.flow.validation;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.graph.BranchExclusivityAnalyzer;
import xyz.vvrf.reactor.flow.graph.ControlFlowGraph;
import xyz.vvrf.reactor.flow.graph.ControlFlowGraphBuilder;
import xyz.vvrf.reactor.flow.graph.GraphLayer;
import xyz.vvrf.reactor.flow.model.Connection;
import xyz.vvrf.reactor.flow.model.JoinPolicy;
import xyz.vvrf.reactor.flow.model.NodeInstance;
import xyz.vvrf.reactor.flow.model.NodeType;
import xyz.vvrf.reactor.flow.model.PortDefinition;
import xyz.vvrf.reactor.flow.model.PortRef;
import xyz.vvrf.reactor.flow.model.ScopeDefinition;
import xyz.vvrf.reactor.flow.model.ScopeRef;
import xyz.vvrf.reactor.flow.model.Workflow;
import xyz.vvrf.reactor.flow.model.WorkflowConstants;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 工作流结构校验器。
 * <p>
 * 执行一组固定的、互相独立的检查，不会在第一个错误处中止：一次校验发现的所有问题都会被收集。
 * 所有检查只按声明顺序遍历，因此对同一工作流校验两次得到相同的报告。
 * 校验器无状态，可以被多个编译并发共享。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class WorkflowValidator {

    private final ControlFlowGraphBuilder graphBuilder;
    private final BranchExclusivityAnalyzer exclusivityAnalyzer;

    public WorkflowValidator(ControlFlowGraphBuilder graphBuilder, BranchExclusivityAnalyzer exclusivityAnalyzer) {
        this.graphBuilder = Objects.requireNonNull(graphBuilder, "ControlFlowGraphBuilder 不能为空");
        this.exclusivityAnalyzer = Objects.requireNonNull(exclusivityAnalyzer, "BranchExclusivityAnalyzer 不能为空");
    }

    public WorkflowValidator() {
        this(new ControlFlowGraphBuilder(), new BranchExclusivityAnalyzer());
    }

    /**
     * 校验工作流。
     *
     * @param workflow 待校验的工作流 (不能为空)
     * @return 校验报告
     */
    public ValidationReport validate(Workflow workflow) {
        Objects.requireNonNull(workflow, "工作流不能为空");
        log.debug("Flow '{}': Starting structural validation...", workflow.getName());
        List<Diagnostic> diagnostics = new ArrayList<>();

        checkPortNames(workflow, diagnostics);
        checkInstances(workflow, diagnostics);
        checkScopeDeclarations(workflow, diagnostics);
        checkScopeMembership(workflow, diagnostics);
        checkDuplicateConnections(workflow, diagnostics);
        checkConnectionEndpoints(workflow, diagnostics);
        checkTypeShapes(workflow, diagnostics);
        checkMultipleInputConnections(workflow, diagnostics);
        checkExitConnections(workflow, diagnostics);
        checkRequiredInputs(workflow, diagnostics);
        checkJoinPolicies(workflow, diagnostics);
        checkCycles(workflow, diagnostics);
        checkUsage(workflow, diagnostics);

        ValidationReport report = new ValidationReport(workflow.getName(), diagnostics);
        if (report.hasErrors()) {
            log.warn("Flow '{}': Validation found {} error(s) and {} warning(s)",
                    workflow.getName(), report.getErrors().size(), report.getWarnings().size());
        } else {
            log.debug("Flow '{}': Validation passed with {} warning(s)", workflow.getName(), report.getWarnings().size());
        }
        return report;
    }

    // --- 节点类型与实例 ---

    private void checkPortNames(Workflow workflow, List<Diagnostic> diagnostics) {
        for (NodeType type : referencedTypes(workflow)) {
            for (String duplicate : duplicatePortNames(type.getPorts())) {
                diagnostics.add(Diagnostic.of(DiagnosticCode.DUPLICATE_PORT_NAME,
                        String.format("Node type \"%s\" declares port \"%s\" more than once", type.getName(), duplicate)));
            }
        }
        for (String duplicate : duplicatePortNames(workflow.getStartPorts())) {
            diagnostics.add(Diagnostic.forInstance(DiagnosticCode.DUPLICATE_PORT_NAME, WorkflowConstants.START,
                    String.format("Start declares port \"%s\" more than once", duplicate)));
        }
        for (String duplicate : duplicatePortNames(workflow.getExitPorts())) {
            diagnostics.add(Diagnostic.forInstance(DiagnosticCode.DUPLICATE_PORT_NAME, WorkflowConstants.EXIT,
                    String.format("Exit declares port \"%s\" more than once", duplicate)));
        }
    }

    /**
     * 同一方向上的端口名必须唯一；输入与输出可以同名。
     */
    private List<String> duplicatePortNames(List<PortDefinition> ports) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (PortDefinition port : ports) {
            if (!seen.add(port.getDirection() + ":" + port.getName())) {
                duplicates.add(port.getName());
            }
        }
        return new ArrayList<>(duplicates);
    }

    private void checkInstances(Workflow workflow, List<Diagnostic> diagnostics) {
        Set<String> seen = new HashSet<>();
        Set<String> reportedDuplicates = new HashSet<>();
        for (NodeInstance instance : workflow.getInstances()) {
            String id = instance.getId();
            if (WorkflowConstants.isReserved(id)) {
                diagnostics.add(Diagnostic.forInstance(DiagnosticCode.RESERVED_INSTANCE_ID, id,
                        String.format("Instance id \"%s\" is reserved", id)));
            }
            if (!seen.add(id) && reportedDuplicates.add(id)) {
                diagnostics.add(Diagnostic.forInstance(DiagnosticCode.DUPLICATE_INSTANCE_ID, id,
                        String.format("Duplicate instance id \"%s\"", id)));
            }
            if (!workflow.findNodeType(instance.getNodeTypeName()).isPresent()) {
                diagnostics.add(Diagnostic.forInstance(DiagnosticCode.UNKNOWN_NODE_TYPE, id,
                        String.format("Instance \"%s\" references unknown node type \"%s\"", id, instance.getNodeTypeName())));
            }
        }
    }

    // --- 作用域 ---

    private void checkScopeDeclarations(Workflow workflow, List<Diagnostic> diagnostics) {
        for (NodeType type : referencedTypes(workflow)) {
            for (ScopeDefinition scope : type.getScopes()) {
                for (String missing : scope.getMissingMandatoryPorts()) {
                    diagnostics.add(Diagnostic.of(DiagnosticCode.SCOPE_MISSING_MANDATORY_PORT,
                            String.format("Scope \"%s\" on node type \"%s\" is missing mandatory port \"%s\"",
                                    scope.getName(), type.getName(), missing)));
                }
            }
        }
    }

    private void checkScopeMembership(Workflow workflow, List<Diagnostic> diagnostics) {
        Map<String, String> firstScopeOfMember = new HashMap<>();
        for (Map.Entry<String, List<String>> entry : workflow.getScopes().entrySet()) {
            String key = entry.getKey();
            ScopeRef ref;
            try {
                ref = ScopeRef.parse(key);
            } catch (IllegalArgumentException e) {
                diagnostics.add(Diagnostic.of(DiagnosticCode.SCOPE_UNKNOWN,
                        String.format("Scope key \"%s\" is not of the form owner.scope", key)));
                continue;
            }
            Optional<NodeType> ownerType = workflow.nodeTypeOf(ref.getOwnerId());
            if (!workflow.findInstance(ref.getOwnerId()).isPresent()) {
                diagnostics.add(Diagnostic.forInstance(DiagnosticCode.SCOPE_UNKNOWN, ref.getOwnerId(),
                        String.format("Scope \"%s\" refers to unknown owner \"%s\"", key, ref.getOwnerId())));
            } else if (ownerType.isPresent() && !ownerType.get().findScope(ref.getScopeName()).isPresent()) {
                diagnostics.add(Diagnostic.forInstance(DiagnosticCode.SCOPE_UNKNOWN, ref.getOwnerId(),
                        String.format("Node \"%s\" (type \"%s\") declares no scope \"%s\"",
                                ref.getOwnerId(), ownerType.get().getName(), ref.getScopeName())));
            }
            for (String member : entry.getValue()) {
                if (!workflow.findInstance(member).isPresent()) {
                    diagnostics.add(Diagnostic.forInstance(DiagnosticCode.SCOPE_INVALID_MEMBERSHIP, member,
                            String.format("Scope \"%s\" lists unknown member \"%s\"", key, member)));
                    continue;
                }
                String previous = firstScopeOfMember.putIfAbsent(member, key);
                if (previous != null) {
                    diagnostics.add(Diagnostic.forInstance(DiagnosticCode.SCOPE_INVALID_MEMBERSHIP, member,
                            String.format("Node \"%s\" is a member of both scope \"%s\" and scope \"%s\"", member, previous, key)));
                }
            }
        }
        // 所有者不能（直接或间接）位于自己的作用域中
        for (ScopeRef ref : workflow.getScopeRefs()) {
            Set<String> chain = new LinkedHashSet<>();
            String current = ref.getOwnerId();
            while (current != null && chain.add(current)) {
                Optional<ScopeRef> parent = workflow.getScopeOf(current);
                current = parent.isPresent() ? parent.get().getOwnerId() : null;
            }
            if (current != null && current.equals(ref.getOwnerId())) {
                diagnostics.add(Diagnostic.forInstance(DiagnosticCode.SCOPE_INVALID_MEMBERSHIP, ref.getOwnerId(),
                        String.format("Node \"%s\" is nested inside its own scope \"%s\"", ref.getOwnerId(), ref)));
            }
        }
    }

    // --- 连接 ---

    private void checkDuplicateConnections(Workflow workflow, List<Diagnostic> diagnostics) {
        Set<Connection> seen = new HashSet<>();
        Set<Connection> reported = new HashSet<>();
        for (Connection connection : workflow.getConnections()) {
            if (!seen.add(connection) && reported.add(connection)) {
                diagnostics.add(Diagnostic.forConnection(DiagnosticCode.DUPLICATE_CONNECTION, connection,
                        String.format("Duplicate connection %s -> %s", connection.getSource(), connection.getTarget())));
            }
        }
    }

    private void checkConnectionEndpoints(Workflow workflow, List<Diagnostic> diagnostics) {
        for (Connection connection : workflow.getConnections()) {
            String source = connection.getSourceInstance();
            String target = connection.getTargetInstance();
            boolean sourceKnown = workflow.hasInstance(source) && !WorkflowConstants.isExit(source);
            boolean targetKnown = workflow.hasInstance(target) && !WorkflowConstants.isStart(target);
            if (!sourceKnown) {
                diagnostics.add(Diagnostic.forConnection(DiagnosticCode.UNKNOWN_SOURCE_NODE, connection,
                        String.format("Connection source node \"%s\" does not exist", source)));
            }
            if (!targetKnown) {
                diagnostics.add(Diagnostic.forConnection(DiagnosticCode.UNKNOWN_TARGET_NODE, connection,
                        String.format("Connection target node \"%s\" does not exist", target)));
            }
            Optional<PortDefinition> sourcePort = workflow.findOutputPort(source, connection.getSourcePort());
            Optional<PortDefinition> targetPort = workflow.findInputPort(target, connection.getTargetPort());
            // 类型未解析的实例已由 UNKNOWN_NODE_TYPE 报告，不再重复报告端口
            if (sourceKnown && hasResolvableType(workflow, source) && !sourcePort.isPresent()) {
                diagnostics.add(Diagnostic.forConnection(DiagnosticCode.UNKNOWN_SOURCE_PORT, connection,
                        String.format("Node \"%s\" has no output port \"%s\"", source, connection.getSourcePort())));
            }
            if (targetKnown && hasResolvableType(workflow, target) && !targetPort.isPresent()) {
                diagnostics.add(Diagnostic.forConnection(DiagnosticCode.UNKNOWN_TARGET_PORT, connection,
                        String.format("Node \"%s\" has no input port \"%s\"", target, connection.getTargetPort())));
            }
            if (sourcePort.isPresent() && targetPort.isPresent()
                    && sourcePort.get().getKind() != targetPort.get().getKind()) {
                diagnostics.add(Diagnostic.forConnection(DiagnosticCode.CONNECTION_KIND_MISMATCH, connection,
                        String.format("Cannot connect %s output %s to %s input %s",
                                sourcePort.get().getKind(), connection.getSource(),
                                targetPort.get().getKind(), connection.getTarget())));
            }
            if (sourceKnown && targetKnown) {
                checkScopeBoundary(workflow, connection, diagnostics);
            }
        }
    }

    private boolean hasResolvableType(Workflow workflow, String instanceId) {
        return WorkflowConstants.isReserved(instanceId) || workflow.nodeTypeOf(instanceId).isPresent();
    }

    private void checkScopeBoundary(Workflow workflow, Connection connection, List<Diagnostic> diagnostics) {
        Optional<ScopeRef> sourceLayer = workflow.sourceLayerOf(connection);
        Optional<ScopeRef> targetLayer = workflow.targetLayerOf(connection);
        if (!sourceLayer.equals(targetLayer)) {
            diagnostics.add(Diagnostic.forConnection(DiagnosticCode.SCOPE_CONNECTION_OUTSIDE, connection,
                    String.format("Connection %s -> %s crosses a scope boundary (%s -> %s)",
                            connection.getSource(), connection.getTarget(),
                            sourceLayer.map(ScopeRef::getQualifiedName).orElse("root"),
                            targetLayer.map(ScopeRef::getQualifiedName).orElse("root"))));
        }
    }

    private void checkTypeShapes(Workflow workflow, List<Diagnostic> diagnostics) {
        for (Connection connection : workflow.getConnections()) {
            Optional<PortDefinition> sourcePort = workflow.findOutputPort(connection.getSourceInstance(), connection.getSourcePort());
            Optional<PortDefinition> targetPort = workflow.findInputPort(connection.getTargetInstance(), connection.getTargetPort());
            if (!sourcePort.isPresent() || !targetPort.isPresent()
                    || !sourcePort.get().isData() || !targetPort.get().isData()) {
                continue;
            }
            String sourceType = sourcePort.get().getValueType();
            String targetType = targetPort.get().getValueType();
            if (isLoose(sourceType) || isLoose(targetType) || TypeShapeNormalizer.sameShape(sourceType, targetType)) {
                continue;
            }
            boolean structural = TypeShapeNormalizer.isStructural(sourceType) && TypeShapeNormalizer.isStructural(targetType);
            DiagnosticCode code = structural ? DiagnosticCode.OBJECT_TYPE_MISMATCH : DiagnosticCode.TYPE_MISMATCH;
            diagnostics.add(Diagnostic.forConnection(code, connection,
                    String.format("Type mismatch on %s -> %s: \"%s\" is not \"%s\"",
                            connection.getSource(), connection.getTarget(), sourceType, targetType)));
        }
    }

    private boolean isLoose(String typeShape) {
        return TypeShapeNormalizer.isUntyped(typeShape) || TypeShapeNormalizer.normalize(typeShape).startsWith("any");
    }

    private void checkMultipleInputConnections(Workflow workflow, List<Diagnostic> diagnostics) {
        for (Map.Entry<PortRef, List<Connection>> entry : connectionsByTarget(workflow).entrySet()) {
            PortRef target = entry.getKey();
            List<Connection> writers = entry.getValue();
            if (writers.size() < 2 || WorkflowConstants.isExit(target.getInstanceId())) {
                continue;
            }
            Optional<PortDefinition> port = workflow.findInputPort(target.getInstanceId(), target.getPortName());
            if (!port.isPresent() || !port.get().isData() || port.get().getMergeStrategy().isPresent()) {
                continue;
            }
            String sources = writers.stream().map(c -> c.getSource().toString()).collect(Collectors.joining(", "));
            diagnostics.add(Diagnostic.forInstance(DiagnosticCode.MULTIPLE_CONNECTIONS_TO_INPUT, target.getInstanceId(),
                    String.format("Input port \"%s\" on node \"%s\" has %d connections (%s). Only one value can be received.",
                            target.getPortName(), target.getInstanceId(), writers.size(), sources)));
        }
    }

    private void checkExitConnections(Workflow workflow, List<Diagnostic> diagnostics) {
        for (Map.Entry<PortRef, List<Connection>> entry : connectionsByTarget(workflow).entrySet()) {
            PortRef target = entry.getKey();
            List<Connection> writers = entry.getValue();
            if (writers.size() < 2 || !WorkflowConstants.isExit(target.getInstanceId())) {
                continue;
            }
            Optional<PortDefinition> port = workflow.findInputPort(target.getInstanceId(), target.getPortName());
            if (!port.isPresent() || !port.get().isData() || port.get().getMergeStrategy().isPresent()) {
                continue;
            }
            List<PortRef> sources = writers.stream().map(Connection::getSource).collect(Collectors.toList());
            if (!exclusivityAnalyzer.areMutuallyExclusive(workflow, sources)) {
                diagnostics.add(Diagnostic.forInstance(DiagnosticCode.MULTIPLE_EXIT_CONNECTIONS, WorkflowConstants.EXIT,
                        String.format("Exit port \"%s\" has %d connections (%s) that are not on mutually exclusive branches; the last defined value wins",
                                target.getPortName(), writers.size(),
                                sources.stream().map(PortRef::toString).collect(Collectors.joining(", ")))));
            }
        }
    }

    private Map<PortRef, List<Connection>> connectionsByTarget(Workflow workflow) {
        Map<PortRef, List<Connection>> byTarget = new LinkedHashMap<>();
        Set<Connection> seen = new HashSet<>();
        for (Connection connection : workflow.getConnections()) {
            if (seen.add(connection)) {
                byTarget.computeIfAbsent(connection.getTarget(), k -> new ArrayList<>()).add(connection);
            }
        }
        return byTarget;
    }

    // --- 结构 ---

    private void checkRequiredInputs(Workflow workflow, List<Diagnostic> diagnostics) {
        Set<PortRef> connectedTargets = new HashSet<>();
        for (Connection connection : workflow.getConnections()) {
            connectedTargets.add(connection.getTarget());
        }
        for (NodeInstance instance : distinctInstances(workflow)) {
            Optional<NodeType> type = workflow.findNodeType(instance.getNodeTypeName());
            if (!type.isPresent()) {
                continue;
            }
            for (PortDefinition port : type.get().getInputs()) {
                if (!port.isData() || port.isScoped() || port.isOptional() || port.hasDefaultValue()
                        || instance.isConfigured(port.getName())
                        || connectedTargets.contains(PortRef.of(instance.getId(), port.getName()))) {
                    continue;
                }
                diagnostics.add(Diagnostic.forInstance(DiagnosticCode.MISSING_REQUIRED_INPUT, instance.getId(),
                        String.format("Required input \"%s\" on node \"%s\" is not connected and has no default or configured value",
                                port.getName(), instance.getId())));
            }
        }
    }

    private void checkJoinPolicies(Workflow workflow, List<Diagnostic> diagnostics) {
        for (NodeType type : referencedTypes(workflow)) {
            if (type.getJoinPolicy() == JoinPolicy.CUSTOM && !type.getReadinessPredicate().isPresent()) {
                diagnostics.add(Diagnostic.of(DiagnosticCode.MISSING_CUSTOM_PREDICATE,
                        String.format("Node type \"%s\" uses CUSTOM join policy without a readiness predicate", type.getName())));
            }
            if (type.getJoinPolicy() == JoinPolicy.ANY) {
                for (PortDefinition port : type.getInputs()) {
                    if (port.isControl() && !port.isScoped() && !port.isOptional()) {
                        diagnostics.add(Diagnostic.of(DiagnosticCode.ANY_JOIN_REQUIRED_CONTROL_INPUT,
                                String.format("Node type \"%s\" uses ANY join policy but control input \"%s\" is not optional",
                                        type.getName(), port.getName())));
                    }
                }
            }
        }
    }

    private void checkCycles(Workflow workflow, List<Diagnostic> diagnostics) {
        List<GraphLayer> layers = new ArrayList<>();
        layers.add(GraphLayer.root());
        for (ScopeRef ref : validScopeRefs(workflow)) {
            layers.add(GraphLayer.of(ref));
        }
        for (GraphLayer layer : layers) {
            ControlFlowGraph graph = graphBuilder.build(workflow, layer);
            for (List<String> cycle : graph.findCycles()) {
                diagnostics.add(Diagnostic.forInstance(DiagnosticCode.CYCLE_DETECTED, cycle.get(0),
                        String.format("Circular dependency detected in \"%s\". Nodes in cycle: %s",
                                graph.getName(), String.join(", ", cycle))));
            }
        }
    }

    private List<ScopeRef> validScopeRefs(Workflow workflow) {
        List<ScopeRef> refs = new ArrayList<>();
        for (String key : workflow.getScopes().keySet()) {
            try {
                refs.add(ScopeRef.parse(key));
            } catch (IllegalArgumentException e) {
                log.trace("Flow '{}': Skipping malformed scope key '{}' in cycle check", workflow.getName(), key);
            }
        }
        return refs;
    }

    // --- 使用情况 ---

    private void checkUsage(Workflow workflow, List<Diagnostic> diagnostics) {
        Set<String> connectedInstances = new HashSet<>();
        Set<PortRef> usedOutputs = new HashSet<>();
        Set<PortRef> usedInputs = new HashSet<>();
        for (Connection connection : workflow.getConnections()) {
            connectedInstances.add(connection.getSourceInstance());
            connectedInstances.add(connection.getTargetInstance());
            usedOutputs.add(connection.getSource());
            usedInputs.add(connection.getTarget());
        }

        for (NodeInstance instance : distinctInstances(workflow)) {
            if (!connectedInstances.contains(instance.getId())) {
                diagnostics.add(Diagnostic.forInstance(DiagnosticCode.UNUSED_NODE, instance.getId(),
                        String.format("Node \"%s\" has no connections", instance.getId())));
                continue;
            }
            Optional<NodeType> type = workflow.findNodeType(instance.getNodeTypeName());
            if (!type.isPresent()) {
                continue;
            }
            for (PortDefinition port : type.get().getOutputs()) {
                if (port.isData() && !port.isScoped() && !usedOutputs.contains(PortRef.of(instance.getId(), port.getName()))) {
                    diagnostics.add(Diagnostic.forInstance(DiagnosticCode.UNUSED_OUTPUT_PORT, instance.getId(),
                            String.format("Output port \"%s\" on node \"%s\" is never connected", port.getName(), instance.getId())));
                }
            }
        }

        for (PortDefinition port : workflow.getExitPorts()) {
            if (port.isData() && !usedInputs.contains(PortRef.of(WorkflowConstants.EXIT, port.getName()))) {
                diagnostics.add(Diagnostic.forInstance(DiagnosticCode.UNREACHABLE_EXIT_PORT, WorkflowConstants.EXIT,
                        String.format("Exit port \"%s\" has no incoming connection", port.getName())));
            }
        }
        if (!connectedInstances.contains(WorkflowConstants.START) && !workflow.getInstances().isEmpty()) {
            diagnostics.add(Diagnostic.forInstance(DiagnosticCode.NO_START_CONNECTIONS, WorkflowConstants.START,
                    "Start is not connected to any node"));
        }
        if (!connectedInstances.contains(WorkflowConstants.EXIT)) {
            diagnostics.add(Diagnostic.forInstance(DiagnosticCode.NO_EXIT_CONNECTIONS, WorkflowConstants.EXIT,
                    "No connection reaches Exit"));
        }
    }

    // --- 辅助方法 ---

    private List<NodeType> referencedTypes(Workflow workflow) {
        Map<String, NodeType> types = new LinkedHashMap<>();
        for (NodeInstance instance : workflow.getInstances()) {
            workflow.findNodeType(instance.getNodeTypeName()).ifPresent(t -> types.putIfAbsent(t.getName(), t));
        }
        return new ArrayList<>(types.values());
    }

    private List<NodeInstance> distinctInstances(Workflow workflow) {
        Set<String> seen = new HashSet<>();
        List<NodeInstance> result = new ArrayList<>();
        for (NodeInstance instance : workflow.getInstances()) {
            if (seen.add(instance.getId())) {
                result.add(instance);
            }
        }
        return result;
    }
}
