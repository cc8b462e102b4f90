package xyz.vvrf.reactor.flow.registry;

import xyz.vvrf.reactor.flow.model.NodeType;
import xyz.vvrf.reactor.flow.model.Workflow;

import java.util.Optional;

/**
 * 节点类型注册表接口。
 * 负责按名称解析节点类型，以及被 {@code WorkflowNodeType} 引用的工作流。
 * 前端（解析器）填充注册表；构建器、校验器与引擎只读取。
 *
 * @author ruifeng.wen
 */
public interface NodeTypeRegistry {

    /**
     * 根据名称查找节点类型。
     *
     * @param typeName 节点类型名称 (不能为空)
     * @return 节点类型的 Optional，如果未注册则为空
     */
    Optional<NodeType> findNodeType(String typeName);

    /**
     * 根据名称查找工作流，用于解析 {@code WorkflowNodeType} 的引用。
     * 解析发生在运行时首次调用时，因此工作流可以（直接或间接）引用自身。
     *
     * @param workflowName 工作流名称 (不能为空)
     * @return 工作流的 Optional，如果未注册则为空
     */
    Optional<Workflow> findWorkflow(String workflowName);
}
