package xyz.vvrf.reactor.flow.plan;

import xyz.vvrf.reactor.flow.model.CustomReadinessPredicate;
import xyz.vvrf.reactor.flow.model.JoinPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 一个节点的就绪守卫（不可变）：汇合策略加上按声明顺序排列的入向 CONTROL 信号。
 *
 * @author ruifeng.wen
 */
public final class ReadinessGuard {
    private final String instanceId;
    private final JoinPolicy policy;
    private final List<ControlSignalRef> signals;
    private final CustomReadinessPredicate predicate;

    public ReadinessGuard(String instanceId, JoinPolicy policy, List<ControlSignalRef> signals,
                          CustomReadinessPredicate predicate) {
        this.instanceId = Objects.requireNonNull(instanceId, "实例 ID 不能为空");
        this.policy = Objects.requireNonNull(policy, "汇合策略不能为空");
        this.signals = Collections.unmodifiableList(new ArrayList<>(signals));
        this.predicate = predicate;
        if (policy == JoinPolicy.CUSTOM && predicate == null) {
            throw new IllegalArgumentException("CUSTOM 汇合策略需要就绪谓词: " + instanceId);
        }
    }

    public String getInstanceId() {
        return instanceId;
    }

    public JoinPolicy getPolicy() {
        return policy;
    }

    public List<ControlSignalRef> getSignals() {
        return signals;
    }

    /**
     * 没有入向 CONTROL 连接的节点总是就绪。
     */
    public boolean isUnconditional() {
        return signals.isEmpty() && policy != JoinPolicy.CUSTOM;
    }

    /**
     * 根据当前信号做出判定。
     *
     * @param source 信号来源
     * @param inputs 节点当前的输入值，仅 CUSTOM 策略使用
     * @return 判定结果
     */
    public GuardDecision decide(SignalSource source, Map<String, Object> inputs) {
        if (policy == JoinPolicy.CUSTOM) {
            return predicate.test(inputs) ? GuardDecision.RUN : GuardDecision.SKIP;
        }
        if (signals.isEmpty()) {
            return GuardDecision.RUN;
        }
        int written = 0;
        int fired = 0;
        for (ControlSignalRef signal : signals) {
            Boolean value = source.readSignal(signal.getInstanceId(), signal.getPortName());
            if (value != null) {
                written++;
                if (value) {
                    fired++;
                }
            }
        }
        boolean allWritten = written == signals.size();
        if (policy == JoinPolicy.ANY) {
            if (fired > 0) {
                return GuardDecision.RUN;
            }
            return allWritten ? GuardDecision.SKIP : GuardDecision.WAIT;
        }
        if (!allWritten) {
            return GuardDecision.WAIT;
        }
        return fired == signals.size() ? GuardDecision.RUN : GuardDecision.SKIP;
    }

    /**
     * 以表达式形式描述守卫，例如 {@code a.onSuccess && b.onSuccess}。
     */
    public String describe() {
        if (policy == JoinPolicy.CUSTOM) {
            return "custom(" + signals.stream().map(ControlSignalRef::toString).collect(Collectors.joining(", ")) + ")";
        }
        if (signals.isEmpty()) {
            return "true";
        }
        String operator = policy == JoinPolicy.ANY ? " || " : " && ";
        return signals.stream().map(ControlSignalRef::toString).collect(Collectors.joining(operator));
    }

    @Override
    public String toString() {
        return String.format("ReadinessGuard[%s: %s]", instanceId, describe());
    }
}
