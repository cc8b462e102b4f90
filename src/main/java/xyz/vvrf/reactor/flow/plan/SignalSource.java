package xyz.vvrf.reactor.flow.plan;

/**
 * 守卫判定时读取 CONTROL 信号的来源。
 */
@FunctionalInterface
public interface SignalSource {

    /**
     * 读取信号。
     *
     * @return true/false，尚未写入时返回 null
     */
    Boolean readSignal(String instanceId, String portName);
}
