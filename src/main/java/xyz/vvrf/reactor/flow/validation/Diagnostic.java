package xyz.vvrf.reactor.flow.validation;

import xyz.vvrf.reactor.flow.model.Connection;

import java.util.Objects;
import java.util.Optional;

/**
 * 一条校验诊断（不可变）。
 *
 * @author ruifeng.wen
 */
public final class Diagnostic {
    private final DiagnosticCode code;
    private final String message;
    private final String instanceId;
    private final Connection connection;

    public Diagnostic(DiagnosticCode code, String message, String instanceId, Connection connection) {
        this.code = Objects.requireNonNull(code, "诊断代码不能为空");
        this.message = Objects.requireNonNull(message, "诊断信息不能为空");
        this.instanceId = instanceId;
        this.connection = connection;
    }

    public static Diagnostic of(DiagnosticCode code, String message) {
        return new Diagnostic(code, message, null, null);
    }

    public static Diagnostic forInstance(DiagnosticCode code, String instanceId, String message) {
        return new Diagnostic(code, message, instanceId, null);
    }

    public static Diagnostic forConnection(DiagnosticCode code, Connection connection, String message) {
        return new Diagnostic(code, message, connection.getTargetInstance(), connection);
    }

    public DiagnosticCode getCode() {
        return code;
    }

    public Severity getSeverity() {
        return code.getSeverity();
    }

    public String getMessage() {
        return message;
    }

    public Optional<String> getInstanceId() {
        return Optional.ofNullable(instanceId);
    }

    public Optional<Connection> getConnection() {
        return Optional.ofNullable(connection);
    }

    public boolean isError() {
        return code.getSeverity() == Severity.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Diagnostic that = (Diagnostic) o;
        return code == that.code &&
                message.equals(that.message) &&
                Objects.equals(instanceId, that.instanceId) &&
                Objects.equals(connection, that.connection);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message, instanceId, connection);
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", getSeverity(), code, message);
    }
}
