package xyz.vvrf.reactor.flow.model;

import java.util.Objects;

/**
 * 对某个实例上某个端口的引用（不可变）。
 *
 * @author ruifeng.wen
 */
public final class PortRef {
    private final String instanceId;
    private final String portName;

    public PortRef(String instanceId, String portName) {
        this.instanceId = Objects.requireNonNull(instanceId, "实例 ID 不能为空");
        this.portName = Objects.requireNonNull(portName, "端口名称不能为空");
    }

    public static PortRef of(String instanceId, String portName) {
        return new PortRef(instanceId, portName);
    }

    /**
     * 解析 "instance.port" 形式的引用。以最后一个 '.' 分隔。
     *
     * @throws IllegalArgumentException 如果格式不合法
     */
    public static PortRef parse(String qualified) {
        Objects.requireNonNull(qualified, "端口引用不能为空");
        int dot = qualified.lastIndexOf('.');
        if (dot <= 0 || dot == qualified.length() - 1) {
            throw new IllegalArgumentException("端口引用格式应为 'instance.port': " + qualified);
        }
        return new PortRef(qualified.substring(0, dot), qualified.substring(dot + 1));
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
        PortRef portRef = (PortRef) o;
        return instanceId.equals(portRef.instanceId) && portName.equals(portRef.portName);
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
