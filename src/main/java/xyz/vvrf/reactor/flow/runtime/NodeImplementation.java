package xyz.vvrf.reactor.flow.runtime;

import reactor.core.publisher.Mono;

/**
 * 宿主提供的节点业务逻辑。
 * <p>
 * 实现可以同步返回 {@code Mono.just(...)}，也可以返回异步的 Mono；
 * 引擎会等待它完成后再执行下一个节点。抛出的异常与错误信号都被记为 FAILURE。
 *
 * @author ruifeng.wen
 */
@FunctionalInterface
public interface NodeImplementation {

    /**
     * 执行节点。
     *
     * @param invocation 本次调用的输入、配置与作用域
     * @return 包含执行结果的 Mono，应当恰好发出一个元素
     */
    Mono<NodeOutcome> execute(NodeInvocation invocation);
}
