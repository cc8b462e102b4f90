package xyz.vvrf.reactor.flow.plan;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.graph.GraphLayer;
import xyz.vvrf.reactor.flow.model.Workflow;
import xyz.vvrf.reactor.flow.validation.Diagnostic;
import xyz.vvrf.reactor.flow.validation.ValidationReport;
import xyz.vvrf.reactor.flow.validation.WorkflowValidator;

import java.util.Objects;

/**
 * 工作流编译器：校验 -> 控制流图 -> 拓扑排序 -> 就绪守卫 -> 合并表达式 -> 作用域展开。
 * 无状态，可以被多个线程并发使用。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class WorkflowCompiler {

    private final WorkflowValidator validator;
    private final ScopeExpander scopeExpander;

    public WorkflowCompiler(WorkflowValidator validator, ScopeExpander scopeExpander) {
        this.validator = Objects.requireNonNull(validator, "WorkflowValidator 不能为空");
        this.scopeExpander = Objects.requireNonNull(scopeExpander, "ScopeExpander 不能为空");
    }

    /**
     * 编译工作流。校验存在错误时不生成执行计划。
     *
     * @param workflow 工作流 (不能为空)
     * @return 编译结果
     * @throws ScopeDepthExceededException 如果作用域嵌套超过上限
     */
    public CompilationResult compile(Workflow workflow) {
        Objects.requireNonNull(workflow, "工作流不能为空");
        log.info("开始编译工作流 '{}'...", workflow.getName());
        ValidationReport report = validator.validate(workflow);
        if (report.hasErrors()) {
            log.warn("工作流 '{}' 校验失败，不生成执行计划:\n{}", workflow.getName(), report.summarize());
            return new CompilationResult(report, null);
        }
        for (Diagnostic warning : report.getWarnings()) {
            log.warn("工作流 '{}' 警告: {}", workflow.getName(), warning);
        }
        LayerPlan root = scopeExpander.planLayer(workflow, GraphLayer.root(), 0);
        ExecutionPlan plan = new ExecutionPlan(workflow, root, report);
        log.info("工作流 '{}' 编译完成，执行顺序: {}", workflow.getName(), root.getOrder());
        return new CompilationResult(report, plan);
    }

    /**
     * 编译工作流，校验存在错误时抛出异常。
     *
     * @throws WorkflowValidationException 如果校验存在错误
     */
    public ExecutionPlan compileOrThrow(Workflow workflow) {
        CompilationResult result = compile(workflow);
        if (!result.getPlan().isPresent()) {
            throw new WorkflowValidationException(result.getReport());
        }
        return result.getPlan().get();
    }
}
