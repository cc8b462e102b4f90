package xyz.vvrf.reactor.flow.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 工作流中的一个节点实例（不可变数据类）。
 * 包含实例 ID、节点类型名称，以及为未连接输入提供值的静态配置。
 * 作用域归属记录在 {@link Workflow#getScopes()} 中。
 *
 * @author ruifeng.wen
 */
public final class NodeInstance {
    private final String id;
    private final String nodeTypeName;
    private final Map<String, Object> configuration;

    /**
     * 创建节点实例。
     *
     * @param id            实例 ID (不能为空)
     * @param nodeTypeName  节点类型名称 (不能为空)
     * @param configuration 静态配置 (端口名 -> 值)，可以为 null
     */
    public NodeInstance(String id, String nodeTypeName, Map<String, Object> configuration) {
        this.id = Objects.requireNonNull(id, "实例 ID 不能为空");
        this.nodeTypeName = Objects.requireNonNull(nodeTypeName, "节点类型名称不能为空");
        this.configuration = (configuration == null || configuration.isEmpty())
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(configuration));
    }

    public NodeInstance(String id, String nodeTypeName) {
        this(id, nodeTypeName, null);
    }

    public String getId() {
        return id;
    }

    public String getNodeTypeName() {
        return nodeTypeName;
    }

    /**
     * 获取静态配置 (不可变)。注意配置值本身可以是 null。
     */
    public Map<String, Object> getConfiguration() {
        return configuration;
    }

    public boolean isConfigured(String portName) {
        return configuration.containsKey(portName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeInstance that = (NodeInstance) o;
        return id.equals(that.id) && nodeTypeName.equals(that.nodeTypeName) && configuration.equals(that.configuration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, nodeTypeName, configuration);
    }

    @Override
    public String toString() {
        return String.format("NodeInstance[id=%s, type=%s%s]", id, nodeTypeName,
                configuration.isEmpty() ? "" : ", config=" + configuration.keySet());
    }
}
