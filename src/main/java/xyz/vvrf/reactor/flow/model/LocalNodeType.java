package xyz.vvrf.reactor.flow.model;

import java.util.List;
import java.util.Objects;

/**
 * 由宿主函数实现的节点类型。
 * 实现通过 {@code implementationId} 在运行时注册表中查找。
 *
 * @author ruifeng.wen
 */
public final class LocalNodeType extends NodeType {
    private final String implementationId;

    public LocalNodeType(String name, List<PortDefinition> ports, JoinPolicy joinPolicy,
                         CustomReadinessPredicate readinessPredicate, boolean pure, boolean lazy,
                         List<String> declaredScopes, String implementationId) {
        super(name, ports, joinPolicy, readinessPredicate, pure, lazy, declaredScopes);
        this.implementationId = Objects.requireNonNull(implementationId, "实现 ID 不能为空");
    }

    public String getImplementationId() {
        return implementationId;
    }

    @Override
    public <R> R accept(NodeTypeVisitor<R> visitor) {
        return visitor.visitLocal(this);
    }

    @Override
    public String getKindName() {
        return "Local";
    }
}
