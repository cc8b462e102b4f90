package xyz.vvrf.reactor.flow.model;

import java.util.List;
import java.util.Objects;

/**
 * 合成的值转换节点类型。
 */
public final class CoercionNodeType extends NodeType {
    private final CoercionKind targetKind;

    public CoercionNodeType(String name, List<PortDefinition> ports, JoinPolicy joinPolicy,
                            boolean lazy, CoercionKind targetKind) {
        super(name, ports, joinPolicy, null, true, lazy, null);
        this.targetKind = Objects.requireNonNull(targetKind, "目标类型不能为空");
    }

    public CoercionKind getTargetKind() {
        return targetKind;
    }

    @Override
    public <R> R accept(NodeTypeVisitor<R> visitor) {
        return visitor.visitCoercion(this);
    }

    @Override
    public String getKindName() {
        return "Coercion";
    }
}
