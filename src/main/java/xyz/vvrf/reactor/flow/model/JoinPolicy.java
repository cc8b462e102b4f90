package xyz.vvrf.reactor.flow.model;

/**
 * 节点的汇合策略：决定节点在收到哪些 CONTROL 信号后可以执行。
 *
 * @author ruifeng.wen
 */
public enum JoinPolicy {
    /**
     * 等待所有入向 CONTROL 输入被写入，且全部为 true 时才执行；
     * 全部写入但不全为 true 时跳过。这是默认策略。
     */
    ALL,

    /**
     * 任意一个入向 CONTROL 输入为 true 即执行，不等待其余输入。
     * 可能永远不会触发的输入应声明为可选。
     */
    ANY,

    /**
     * 由节点类型提供的 {@link CustomReadinessPredicate} 自行判断。
     * 引擎只保证谓词在其引用的所有输入都有机会被写入之后才被调用。
     */
    CUSTOM
}
