package xyz.vvrf.reactor.flow.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.model.NodeType;
import xyz.vvrf.reactor.flow.plan.ExecutionPlan;
import xyz.vvrf.reactor.flow.runtime.NodeOutcome;

import java.time.Duration;
import java.util.Map;

/**
 * 把执行事件写入日志的监听器。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class LoggingFlowMonitorListener implements FlowMonitorListener {

    @Override
    public void onFlowStart(String requestId, String flowName, ExecutionPlan plan, Map<String, Object> inputs) {
        log.info("[MONITOR] 请求:[{}] 工作流:[{}] 开始。 节点数:[{}], 输入:[{}]",
                requestId, flowName, plan.getNodes().size(), inputs.keySet());
    }

    @Override
    public void onFlowComplete(String requestId, String flowName, Duration totalDuration, boolean success,
                               Map<String, NodeOutcome> outcomes) {
        log.info("[MONITOR] 请求:[{}] 工作流:[{}] 结束。 成功:[{}], 耗时:[{}ms], 已处理节点:[{}]",
                requestId, flowName, success, totalDuration.toMillis(), outcomes.size());
    }

    @Override
    public void onNodeStart(String requestId, String flowName, String instanceId, NodeType nodeType) {
        log.info("[MONITOR] 请求:[{}] 工作流:[{}] 节点:[{}] 开始。 类型:[{}/{}]",
                requestId, flowName, instanceId, nodeType.getKindName(), nodeType.getName());
    }

    @Override
    public void onNodeSuccess(String requestId, String flowName, String instanceId, Duration duration, NodeOutcome outcome,
                              NodeType nodeType) {
        log.info("[MONITOR] 请求:[{}] 工作流:[{}] 节点:[{}] 成功。 耗时:[{}ms], 输出:[{}], 类型:[{}]",
                requestId, flowName, instanceId, duration.toMillis(), outcome.getOutputs().keySet(), nodeType.getName());
    }

    @Override
    public void onNodeFailure(String requestId, String flowName, String instanceId, Duration duration, Throwable error, NodeType nodeType) {
        log.error("[MONITOR] 请求:[{}] 工作流:[{}] 节点:[{}] 失败。 耗时:[{}ms], 错误:[{}], 类型:[{}]",
                requestId, flowName, instanceId, duration.toMillis(), error.getMessage(), nodeType.getName(), error);
    }

    @Override
    public void onNodeSkipped(String requestId, String flowName, String instanceId, NodeType nodeType) {
        log.info("[MONITOR] 请求:[{}] 工作流:[{}] 节点:[{}] 跳过。 类型:[{}]",
                requestId, flowName, instanceId, nodeType.getName());
    }

    @Override
    public void onNodeTimeout(String requestId, String flowName, String instanceId, Duration timeout, NodeType nodeType) {
        log.warn("[MONITOR] 请求:[{}] 工作流:[{}] 节点:[{}] 超时。 配置:[{}ms], 类型:[{}]",
                requestId, flowName, instanceId, timeout.toMillis(), nodeType.getName());
    }
}
