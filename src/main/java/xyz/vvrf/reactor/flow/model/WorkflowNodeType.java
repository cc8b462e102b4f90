package xyz.vvrf.reactor.flow.model;

import java.util.List;
import java.util.Objects;

/**
 * 复用另一个工作流的节点类型。
 * 被引用的工作流只按名称记录，在运行时才解析，因此允许递归引用。
 *
 * @author ruifeng.wen
 */
public final class WorkflowNodeType extends NodeType {
    private final String workflowName;

    public WorkflowNodeType(String name, List<PortDefinition> ports, JoinPolicy joinPolicy,
                            CustomReadinessPredicate readinessPredicate, boolean pure, boolean lazy,
                            List<String> declaredScopes, String workflowName) {
        super(name, ports, joinPolicy, readinessPredicate, pure, lazy, declaredScopes);
        this.workflowName = Objects.requireNonNull(workflowName, "工作流名称不能为空");
    }

    public String getWorkflowName() {
        return workflowName;
    }

    @Override
    public <R> R accept(NodeTypeVisitor<R> visitor) {
        return visitor.visitWorkflow(this);
    }

    @Override
    public String getKindName() {
        return "Workflow";
    }
}
