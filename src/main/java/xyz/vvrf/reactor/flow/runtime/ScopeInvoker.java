package xyz.vvrf.reactor.flow.runtime;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * 调用一个作用域子图。所有者每次逻辑迭代调用一次。
 * 每次调用都在全新的作用域状态中运行，子图中的惰性节点在每次调用内单独记忆。
 *
 * @author ruifeng.wen
 */
@FunctionalInterface
public interface ScopeInvoker {

    /**
     * 调用作用域。
     *
     * @param payload 负载输出的值 (端口名 -> 值)，例如 forEach 的 item 与 index
     * @return 出口信号与结果
     */
    Mono<ScopeResult> invoke(Map<String, Object> payload);
}
