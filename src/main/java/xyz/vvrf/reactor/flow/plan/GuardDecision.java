package xyz.vvrf.reactor.flow.plan;

/**
 * 就绪守卫的判定结果。
 */
public enum GuardDecision {
    /** 执行节点 */
    RUN,
    /** 跳过节点，其 CONTROL 输出写为 false */
    SKIP,
    /** 仍有信号未写入，继续等待 */
    WAIT
}
