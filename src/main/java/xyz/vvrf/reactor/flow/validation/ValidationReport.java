package xyz.vvrf.reactor.flow.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 校验结果：错误与警告，均按发现顺序排列（不可变）。
 *
 * @author ruifeng.wen
 */
public final class ValidationReport {
    private final String workflowName;
    private final List<Diagnostic> errors;
    private final List<Diagnostic> warnings;

    public ValidationReport(String workflowName, List<Diagnostic> diagnostics) {
        this.workflowName = Objects.requireNonNull(workflowName, "工作流名称不能为空");
        List<Diagnostic> errorList = new ArrayList<>();
        List<Diagnostic> warningList = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.isError()) {
                errorList.add(diagnostic);
            } else {
                warningList.add(diagnostic);
            }
        }
        this.errors = Collections.unmodifiableList(errorList);
        this.warnings = Collections.unmodifiableList(warningList);
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public List<Diagnostic> getErrors() {
        return errors;
    }

    public List<Diagnostic> getWarnings() {
        return warnings;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * 获取指定代码的全部诊断（先错误后警告）。
     */
    public List<Diagnostic> find(DiagnosticCode code) {
        List<Diagnostic> all = new ArrayList<>(errors);
        all.addAll(warnings);
        return all.stream().filter(d -> d.getCode() == code).collect(Collectors.toList());
    }

    public boolean contains(DiagnosticCode code) {
        return !find(code).isEmpty();
    }

    /**
     * 将报告格式化为多行文本，用于日志和异常信息。
     */
    public String summarize() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Workflow '%s': %d error(s), %d warning(s)", workflowName, errors.size(), warnings.size()));
        for (Diagnostic error : errors) {
            sb.append("\n  ").append(error);
        }
        for (Diagnostic warning : warnings) {
            sb.append("\n  ").append(warning);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValidationReport that = (ValidationReport) o;
        return workflowName.equals(that.workflowName) && errors.equals(that.errors) && warnings.equals(that.warnings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workflowName, errors, warnings);
    }

    @Override
    public String toString() {
        return String.format("ValidationReport[%s, errors=%d, warnings=%d]", workflowName, errors.size(), warnings.size());
    }
}
