package xyz.vvrf.reactor.flow.model;

/**
 * 端口类别：控制信号或数据值。
 *
 * @author ruifeng.wen
 */
public enum PortKind {
    /**
     * 控制端口。携带布尔信号，表示节点是否运行、运行成功还是失败。
     * 一个 CONTROL 输出可以扇出到任意多个 CONTROL 输入。
     */
    CONTROL,
    /**
     * 数据端口。在节点之间传递类型化的值。
     * 拥有多个写入者的 DATA 输入必须声明 {@link MergeStrategy}。
     */
    DATA
}
