package xyz.vvrf.reactor.flow.runtime;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 节点实现注册表：实现 ID（本地节点的 implementationId 或内置节点的 builtinId）-> 实现。
 * 线程安全。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class NodeImplementationRegistry {

    private final Map<String, NodeImplementation> implementations = new ConcurrentHashMap<>();

    /**
     * 注册一个节点实现。
     *
     * @throws IllegalArgumentException 如果该 ID 已被注册
     */
    public NodeImplementationRegistry register(String implementationId, NodeImplementation implementation) {
        Objects.requireNonNull(implementationId, "实现 ID 不能为空");
        Objects.requireNonNull(implementation, "节点实现不能为空");
        if (implementations.putIfAbsent(implementationId, implementation) != null) {
            throw new IllegalArgumentException(String.format("实现 ID '%s' 已在注册表中存在。", implementationId));
        }
        log.info("已注册节点实现 '{}' (类: {})", implementationId, implementation.getClass().getName());
        return this;
    }

    /**
     * 仅当该 ID 尚未注册时注册，用于内置实现（宿主可以预先注册同名实现来覆盖）。
     *
     * @return 如果本次注册生效则为 true
     */
    public boolean registerIfAbsent(String implementationId, NodeImplementation implementation) {
        Objects.requireNonNull(implementationId, "实现 ID 不能为空");
        Objects.requireNonNull(implementation, "节点实现不能为空");
        boolean registered = implementations.putIfAbsent(implementationId, implementation) == null;
        if (registered) {
            log.debug("已注册默认节点实现 '{}'", implementationId);
        }
        return registered;
    }

    public Optional<NodeImplementation> find(String implementationId) {
        return Optional.ofNullable(implementations.get(implementationId));
    }

    public Set<String> getRegisteredIds() {
        return Collections.unmodifiableSet(implementations.keySet());
    }
}
