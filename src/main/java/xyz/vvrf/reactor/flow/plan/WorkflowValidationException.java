package xyz.vvrf.reactor.flow.plan;

import xyz.vvrf.reactor.flow.graph.WorkflowCompilationException;
import xyz.vvrf.reactor.flow.validation.ValidationReport;

/**
 * 工作流校验存在错误、无法生成执行计划时抛出。
 */
public class WorkflowValidationException extends WorkflowCompilationException {

    private final ValidationReport report;

    public WorkflowValidationException(ValidationReport report) {
        super(report.summarize());
        this.report = report;
    }

    public ValidationReport getReport() {
        return report;
    }
}
