package xyz.vvrf.reactor.flow.model;

import java.util.Map;

/**
 * CUSTOM 汇合策略使用的就绪谓词。
 *
 * @author ruifeng.wen
 */
@FunctionalInterface
public interface CustomReadinessPredicate {

    /**
     * 判断节点是否应当执行。
     *
     * @param inputs 节点当前的输入值 (端口名 -> 值)。CONTROL 输入以 Boolean 出现，
     *               未被写入的端口不在 Map 中。
     * @return true 表示执行，false 表示跳过
     */
    boolean test(Map<String, Object> inputs);
}
