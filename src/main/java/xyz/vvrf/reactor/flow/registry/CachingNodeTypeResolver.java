package xyz.vvrf.reactor.flow.registry;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.model.NodeType;
import xyz.vvrf.reactor.flow.model.Workflow;

import java.util.Objects;
import java.util.Optional;

/**
 * 带有容量上限的节点类型解析缓存。
 * <p>
 * 包装一个（通常代价较高的，例如需要解析外部文件的）NodeTypeRegistry，
 * 用 Caffeine 按容量淘汰最近最少使用的条目。由前端显式创建并注入，核心代码不持有全局缓存。
 * 未命中的查找结果（empty）同样被缓存，直到被 {@link #invalidateAll()} 清除。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class CachingNodeTypeResolver implements NodeTypeRegistry {

    private final NodeTypeRegistry delegate;
    private final long capacity;
    private final Cache<String, Optional<NodeType>> nodeTypeCache;
    private final Cache<String, Optional<Workflow>> workflowCache;

    /**
     * @param delegate 实际执行解析的注册表 (不能为空)
     * @param capacity 每类缓存的最大条目数，必须大于 0
     */
    public CachingNodeTypeResolver(NodeTypeRegistry delegate, long capacity) {
        this.delegate = Objects.requireNonNull(delegate, "被包装的 NodeTypeRegistry 不能为空");
        if (capacity <= 0) {
            throw new IllegalArgumentException("缓存容量必须大于 0: " + capacity);
        }
        this.capacity = capacity;
        this.nodeTypeCache = Caffeine.newBuilder().maximumSize(capacity).recordStats().build();
        this.workflowCache = Caffeine.newBuilder().maximumSize(capacity).recordStats().build();
        log.info("CachingNodeTypeResolver 已创建，容量: {}, 委托: {}", capacity, delegate.getClass().getSimpleName());
    }

    @Override
    public Optional<NodeType> findNodeType(String typeName) {
        Objects.requireNonNull(typeName, "节点类型名称不能为空");
        return nodeTypeCache.get(typeName, name -> {
            log.debug("节点类型缓存未命中: '{}'，委托解析", name);
            return delegate.findNodeType(name);
        });
    }

    @Override
    public Optional<Workflow> findWorkflow(String workflowName) {
        Objects.requireNonNull(workflowName, "工作流名称不能为空");
        return workflowCache.get(workflowName, name -> {
            log.debug("工作流缓存未命中: '{}'，委托解析", name);
            return delegate.findWorkflow(name);
        });
    }

    /**
     * 清除所有缓存条目，例如在前端重新加载源文件之后。
     */
    public void invalidateAll() {
        nodeTypeCache.invalidateAll();
        workflowCache.invalidateAll();
        log.info("CachingNodeTypeResolver 缓存已清空");
    }

    public long getCapacity() {
        return capacity;
    }

    public CacheStats getNodeTypeStats() {
        return nodeTypeCache.stats();
    }

    /**
     * 当前缓存的节点类型条目数（估计值）。
     */
    public long estimatedSize() {
        nodeTypeCache.cleanUp();
        return nodeTypeCache.estimatedSize();
    }
}
