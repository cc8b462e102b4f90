package xyz.vvrf.reactor.flow.model;

/**
 * {@link NodeType} 各类别的访问者。
 *
 * @param <R> 返回类型
 */
public interface NodeTypeVisitor<R> {

    R visitLocal(LocalNodeType nodeType);

    R visitWorkflow(WorkflowNodeType nodeType);

    R visitCoercion(CoercionNodeType nodeType);

    R visitBuiltin(BuiltinNodeType nodeType);
}
