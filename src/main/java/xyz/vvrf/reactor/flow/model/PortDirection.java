package xyz.vvrf.reactor.flow.model;

/**
 * 端口方向。
 *
 * @author ruifeng.wen
 */
public enum PortDirection {
    /** 输入端口，由上游连接或静态配置写入 */
    INPUT,
    /** 输出端口，由节点执行后写出 */
    OUTPUT
}
