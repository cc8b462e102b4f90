package xyz.vvrf.reactor.flow.runtime;

import lombok.Getter;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 一次工作流调用的结果（不可变）。
 *
 * @author ruifeng.wen
 */
@Getter
public final class ExecutionResult {
    private final String requestId;
    private final String flowName;
    /** Exit 的 DATA 端口值，缺失的端口不在 Map 中 */
    private final Map<String, Object> outputs;
    /** 根层节点的结果 (实例 ID -> 结果)，按执行顺序 */
    private final Map<String, NodeOutcome> outcomes;
    private final boolean succeeded;
    private final boolean failed;
    private final Duration duration;
    /** 解析 Exit 端口时的错误（例如合并失败），没有时为 null */
    private final Throwable error;

    public ExecutionResult(String requestId, String flowName, Map<String, Object> outputs,
                           Map<String, NodeOutcome> outcomes, boolean succeeded, boolean failed, Duration duration) {
        this(requestId, flowName, outputs, outcomes, succeeded, failed, duration, null);
    }

    public ExecutionResult(String requestId, String flowName, Map<String, Object> outputs,
                           Map<String, NodeOutcome> outcomes, boolean succeeded, boolean failed, Duration duration,
                           Throwable error) {
        this.requestId = Objects.requireNonNull(requestId, "请求 ID 不能为空");
        this.flowName = Objects.requireNonNull(flowName, "工作流名称不能为空");
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        this.succeeded = succeeded;
        this.failed = failed;
        this.duration = duration;
        this.error = error;
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    public Object getOutput(String port) {
        return outputs.get(port);
    }

    public boolean hasOutput(String port) {
        return outputs.containsKey(port);
    }

    public NodeOutcome getOutcome(String instanceId) {
        return outcomes.get(instanceId);
    }

    @Override
    public String toString() {
        return String.format("ExecutionResult[%s/%s, succeeded=%b, failed=%b, outputs=%s, duration=%dms]",
                flowName, requestId, succeeded, failed, outputs.keySet(), duration.toMillis());
    }
}
