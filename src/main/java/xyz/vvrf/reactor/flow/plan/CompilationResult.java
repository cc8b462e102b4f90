package xyz.vvrf.reactor.flow.plan;

import xyz.vvrf.reactor.flow.validation.ValidationReport;

import java.util.Objects;
import java.util.Optional;

/**
 * 编译结果：校验报告，以及在没有错误时生成的执行计划。
 */
public final class CompilationResult {
    private final ValidationReport report;
    private final ExecutionPlan plan;

    CompilationResult(ValidationReport report, ExecutionPlan plan) {
        this.report = Objects.requireNonNull(report, "校验报告不能为空");
        this.plan = plan;
    }

    public ValidationReport getReport() {
        return report;
    }

    public Optional<ExecutionPlan> getPlan() {
        return Optional.ofNullable(plan);
    }

    public boolean isSuccessful() {
        return plan != null;
    }
}
