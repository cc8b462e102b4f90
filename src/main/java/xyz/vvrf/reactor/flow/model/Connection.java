package xyz.vvrf.reactor.flow.model;

import java.util.Objects;

/**
 * 工作流中的一条连接（不可变数据类）：(源实例, 源端口) -> (目标实例, 目标端口)。
 * Start 与 Exit 作为普通实例参与连接。
 *
 * @author ruifeng.wen
 */
public final class Connection {
    private final PortRef source;
    private final PortRef target;

    public Connection(PortRef source, PortRef target) {
        this.source = Objects.requireNonNull(source, "源端口不能为空");
        this.target = Objects.requireNonNull(target, "目标端口不能为空");
    }

    public static Connection of(String sourceInstance, String sourcePort, String targetInstance, String targetPort) {
        return new Connection(PortRef.of(sourceInstance, sourcePort), PortRef.of(targetInstance, targetPort));
    }

    public PortRef getSource() {
        return source;
    }

    public PortRef getTarget() {
        return target;
    }

    public String getSourceInstance() {
        return source.getInstanceId();
    }

    public String getSourcePort() {
        return source.getPortName();
    }

    public String getTargetInstance() {
        return target.getInstanceId();
    }

    public String getTargetPort() {
        return target.getPortName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Connection that = (Connection) o;
        return source.equals(that.source) && target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target);
    }

    @Override
    public String toString() {
        return String.format("Connection[%s -> %s]", source, target);
    }
}
