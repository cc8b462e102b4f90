package xyz.vvrf.reactor.flow.model;

import java.util.List;
import java.util.Objects;

/**
 * 由引擎自身提供实现的节点类型，例如 forEach。
 *
 * @author ruifeng.wen
 */
public final class BuiltinNodeType extends NodeType {
    private final String builtinId;

    public BuiltinNodeType(String name, List<PortDefinition> ports, JoinPolicy joinPolicy,
                           boolean lazy, List<String> declaredScopes, String builtinId) {
        super(name, ports, joinPolicy, null, false, lazy, declaredScopes);
        this.builtinId = Objects.requireNonNull(builtinId, "内置节点 ID 不能为空");
    }

    public String getBuiltinId() {
        return builtinId;
    }

    @Override
    public <R> R accept(NodeTypeVisitor<R> visitor) {
        return visitor.visitBuiltin(this);
    }

    @Override
    public String getKindName() {
        return "Builtin";
    }
}
