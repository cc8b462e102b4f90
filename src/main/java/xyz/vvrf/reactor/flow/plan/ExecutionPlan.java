package xyz.vvrf.reactor.flow.plan;

import xyz.vvrf.reactor.flow.model.Workflow;
import xyz.vvrf.reactor.flow.validation.ValidationReport;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 校验通过的工作流的执行计划（不可变）。
 *
 * @author ruifeng.wen
 */
public final class ExecutionPlan {
    private final Workflow workflow;
    private final LayerPlan root;
    private final ValidationReport report;

    public ExecutionPlan(Workflow workflow, LayerPlan root, ValidationReport report) {
        this.workflow = Objects.requireNonNull(workflow, "工作流不能为空");
        this.root = Objects.requireNonNull(root, "根层计划不能为空");
        this.report = Objects.requireNonNull(report, "校验报告不能为空");
    }

    public Workflow getWorkflow() {
        return workflow;
    }

    public String getWorkflowName() {
        return workflow.getName();
    }

    public LayerPlan getRoot() {
        return root;
    }

    /**
     * 根层拓扑顺序，包含 Start 与 Exit。
     */
    public List<String> getOrder() {
        return root.getOrder();
    }

    public List<PlannedNode> getNodes() {
        return root.getNodes();
    }

    public Map<String, InputBinding> getExitBindings() {
        return root.getExitBindings();
    }

    public Optional<PlannedNode> findNode(String instanceId) {
        return root.findNode(instanceId);
    }

    /**
     * 获取编译时的校验报告（只包含警告）。
     */
    public ValidationReport getReport() {
        return report;
    }

    @Override
    public String toString() {
        return String.format("ExecutionPlan[%s, order=%s]", workflow.getName(), root.getOrder());
    }
}
