package xyz.vvrf.reactor.flow.plan;

import java.util.Objects;

/**
 * 对一个上游 CONTROL 输出信号的引用。
 *
 * @author ruifeng.wen
 */
public final class ControlSignalRef {
    private final String instanceId;
    private final String portName;

    public ControlSignalRef(String instanceId, String portName) {
        this.instanceId = Objects.requireNonNull(instanceId, "实例 ID 不能为空");
        this.portName = Objects.requireNonNull(portName, "端口名称不能为空");
    }

    public String getInstanceId() {
        return instanceId;
    }

    public String getPortName() {
        return portName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ControlSignalRef that = (ControlSignalRef) o;
        return instanceId.equals(that.instanceId) && portName.equals(that.portName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(instanceId, portName);
    }

    @Override
    public String toString() {
        return instanceId + "." + portName;
    }
}
