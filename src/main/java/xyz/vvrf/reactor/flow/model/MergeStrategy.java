package xyz.vvrf.reactor.flow.model;

/**
 * 多写入者 DATA 输入的合并策略。
 * 所有策略都按连接的声明顺序处理写入值。
 *
 * @author ruifeng.wen
 */
public enum MergeStrategy {
    /** 按声明顺序收集为列表 */
    COLLECT,
    /** 浅合并多个对象，后写入者覆盖先写入者的同名键 */
    MERGE,
    /** 先 COLLECT，再展开一层 */
    CONCAT,
    /** 第一个已定义（非缺失）的值 */
    FIRST,
    /** 最后一个已定义（非缺失）的值 */
    LAST
}
