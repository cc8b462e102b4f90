package xyz.vvrf.reactor.flow.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.model.NodeType;
import xyz.vvrf.reactor.flow.plan.ExecutionPlan;
import xyz.vvrf.reactor.flow.runtime.NodeOutcome;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 把工作流与节点执行事件记录为 Micrometer 指标。
 * <p>
 * 节点指标按工作流、实例、节点类型及其种类（Local、Workflow、Builtin、Coercion）打标签，
 * 子工作流调用也会作为独立的工作流被计入。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class MicrometerFlowMonitorListener implements FlowMonitorListener {

    // 指标名称
    public static final String METRIC_NODE_EXECUTION_TIME = "flow.node.execution.time";
    public static final String METRIC_NODE_EXECUTION_TOTAL = "flow.node.execution.total";
    public static final String METRIC_NODE_TIMEOUT_TOTAL = "flow.node.timeout.total";
    public static final String METRIC_FLOW_EXECUTION_TIME = "flow.execution.time";
    public static final String METRIC_FLOW_EXECUTION_TOTAL = "flow.execution.total";
    public static final String METRIC_FLOW_ACTIVE = "flow.execution.active";

    // 标签键
    public static final String TAG_FLOW_NAME = "flow.name";
    public static final String TAG_NODE_NAME = "node.name";
    public static final String TAG_NODE_TYPE = "node.type";
    public static final String TAG_NODE_KIND = "node.kind";
    public static final String TAG_STATUS = "status";
    public static final String TAG_ERROR = "error";

    // 状态标签值
    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_FAILURE = "FAILURE";
    public static final String STATUS_SKIPPED = "SKIPPED";
    public static final String STATUS_TIMEOUT = "TIMEOUT";

    private static final String UNKNOWN = "Unknown";

    private final MeterRegistry meterRegistry;
    private final Map<String, AtomicInteger> activeFlows = new ConcurrentHashMap<>();

    public MicrometerFlowMonitorListener(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "MeterRegistry 不能为空");
    }

    @Override
    public void onFlowStart(String requestId, String flowName, ExecutionPlan plan, Map<String, Object> inputs) {
        activeCounter(flowName).incrementAndGet();
    }

    @Override
    public void onFlowComplete(String requestId, String flowName, Duration totalDuration, boolean success,
                               Map<String, NodeOutcome> outcomes) {
        activeCounter(flowName).decrementAndGet();
        Tags tags = Tags.of(
                Tag.of(TAG_FLOW_NAME, flowName),
                Tag.of(TAG_STATUS, success ? STATUS_SUCCESS : STATUS_FAILURE)
        );
        try {
            Timer.builder(METRIC_FLOW_EXECUTION_TIME)
                    .tags(tags)
                    .description("工作流执行时间")
                    .register(meterRegistry)
                    .record(totalDuration.toNanos(), TimeUnit.NANOSECONDS);
            Counter.builder(METRIC_FLOW_EXECUTION_TOTAL)
                    .tags(tags)
                    .description("按结果统计的工作流调用总数")
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            log.error("记录工作流 '{}' 指标失败: {}", flowName, e.getMessage(), e);
        }
    }

    @Override
    public void onNodeStart(String requestId, String flowName, String instanceId, NodeType nodeType) {
        // 计时器与计数器在结束时记录
    }

    @Override
    public void onNodeSuccess(String requestId, String flowName, String instanceId, Duration duration,
                              NodeOutcome outcome, NodeType nodeType) {
        Tags tags = nodeTags(flowName, instanceId, nodeType, STATUS_SUCCESS);
        recordNodeTimer(tags, duration);
        incrementNodeCounter(tags);
    }

    @Override
    public void onNodeFailure(String requestId, String flowName, String instanceId, Duration duration,
                              Throwable error, NodeType nodeType) {
        String status = error instanceof TimeoutException ? STATUS_TIMEOUT : STATUS_FAILURE;
        Tags tags = nodeTags(flowName, instanceId, nodeType, status)
                .and(TAG_ERROR, error != null ? error.getClass().getSimpleName() : UNKNOWN);
        recordNodeTimer(tags, duration);
        incrementNodeCounter(tags);
    }

    @Override
    public void onNodeSkipped(String requestId, String flowName, String instanceId, NodeType nodeType) {
        incrementNodeCounter(nodeTags(flowName, instanceId, nodeType, STATUS_SKIPPED));
    }

    @Override
    public void onNodeTimeout(String requestId, String flowName, String instanceId, Duration timeout, NodeType nodeType) {
        try {
            Counter.builder(METRIC_NODE_TIMEOUT_TOTAL)
                    .tags(nodeTags(flowName, instanceId, nodeType, STATUS_TIMEOUT))
                    .description("超过执行时限的节点次数")
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            log.error("记录节点 '{}' 超时指标失败: {}", instanceId, e.getMessage(), e);
        }
    }

    /**
     * 当前正在执行的调用数，按工作流名称区分。仪表在首次遇到该工作流时注册。
     */
    private AtomicInteger activeCounter(String flowName) {
        return activeFlows.computeIfAbsent(flowName, name -> {
            AtomicInteger active = new AtomicInteger();
            Gauge.builder(METRIC_FLOW_ACTIVE, active, AtomicInteger::get)
                    .tag(TAG_FLOW_NAME, name)
                    .description("正在执行的工作流调用数")
                    .register(meterRegistry);
            return active;
        });
    }

    private Tags nodeTags(String flowName, String instanceId, NodeType nodeType, String status) {
        return Tags.of(
                Tag.of(TAG_FLOW_NAME, flowName),
                Tag.of(TAG_NODE_NAME, instanceId),
                Tag.of(TAG_NODE_TYPE, nodeType != null ? nodeType.getName() : UNKNOWN),
                Tag.of(TAG_NODE_KIND, nodeType != null ? nodeType.getKindName() : UNKNOWN),
                Tag.of(TAG_STATUS, status)
        );
    }

    private void recordNodeTimer(Tags tags, Duration duration) {
        try {
            Timer.builder(METRIC_NODE_EXECUTION_TIME)
                    .tags(tags)
                    .description("工作流节点执行时间")
                    .register(meterRegistry)
                    .record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录节点计时器指标失败: {}", e.getMessage(), e);
        }
    }

    private void incrementNodeCounter(Tags tags) {
        try {
            Counter.builder(METRIC_NODE_EXECUTION_TOTAL)
                    .tags(tags)
                    .description("按状态统计的工作流节点执行总数")
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            log.error("增加节点计数器指标失败: {}", e.getMessage(), e);
        }
    }
}
