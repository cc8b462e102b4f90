package xyz.vvrf.reactor.flow.validation;

/**
 * 稳定的诊断代码。代码与默认严重程度一一对应。
 *
 * @author ruifeng.wen
 */
public enum DiagnosticCode {

    // --- 节点类型与实例 ---
    DUPLICATE_PORT_NAME(Severity.ERROR),
    UNKNOWN_NODE_TYPE(Severity.ERROR),
    DUPLICATE_INSTANCE_ID(Severity.ERROR),
    RESERVED_INSTANCE_ID(Severity.ERROR),

    // --- 连接 ---
    UNKNOWN_SOURCE_NODE(Severity.ERROR),
    UNKNOWN_TARGET_NODE(Severity.ERROR),
    UNKNOWN_SOURCE_PORT(Severity.ERROR),
    UNKNOWN_TARGET_PORT(Severity.ERROR),
    DUPLICATE_CONNECTION(Severity.ERROR),
    CONNECTION_KIND_MISMATCH(Severity.ERROR),
    MULTIPLE_CONNECTIONS_TO_INPUT(Severity.ERROR),
    MULTIPLE_EXIT_CONNECTIONS(Severity.WARNING),
    OBJECT_TYPE_MISMATCH(Severity.WARNING),
    TYPE_MISMATCH(Severity.WARNING),

    // --- 结构 ---
    CYCLE_DETECTED(Severity.ERROR),
    MISSING_REQUIRED_INPUT(Severity.ERROR),
    MISSING_CUSTOM_PREDICATE(Severity.ERROR),
    ANY_JOIN_REQUIRED_CONTROL_INPUT(Severity.WARNING),

    // --- 作用域 ---
    SCOPE_MISSING_MANDATORY_PORT(Severity.ERROR),
    SCOPE_UNKNOWN(Severity.ERROR),
    SCOPE_INVALID_MEMBERSHIP(Severity.ERROR),
    SCOPE_CONNECTION_OUTSIDE(Severity.ERROR),

    // --- 使用情况 ---
    UNUSED_NODE(Severity.WARNING),
    UNUSED_OUTPUT_PORT(Severity.WARNING),
    UNREACHABLE_EXIT_PORT(Severity.WARNING),
    NO_START_CONNECTIONS(Severity.WARNING),
    NO_EXIT_CONNECTIONS(Severity.WARNING);

    private final Severity severity;

    DiagnosticCode(Severity severity) {
        this.severity = severity;
    }

    public Severity getSeverity() {
        return severity;
    }
}
