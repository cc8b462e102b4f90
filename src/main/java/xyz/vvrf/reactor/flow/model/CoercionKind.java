package xyz.vvrf.reactor.flow.model;

/**
 * 合成类型转换节点的目标类型。
 */
public enum CoercionKind {
    STRING,
    NUMBER,
    BOOLEAN,
    /** 序列化为 JSON 字符串 */
    JSON,
    /** 从 JSON 字符串解析为对象 */
    OBJECT
}
