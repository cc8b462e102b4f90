package xyz.vvrf.reactor.flow.monitor;

import xyz.vvrf.reactor.flow.model.NodeType;
import xyz.vvrf.reactor.flow.plan.ExecutionPlan;
import xyz.vvrf.reactor.flow.runtime.NodeOutcome;

import java.time.Duration;
import java.util.Map;

/**
 * 用于监控工作流执行事件的监听器接口。
 * 包括工作流级别和节点级别的事件。监听器抛出的异常会被引擎记录并忽略。
 *
 * @author ruifeng.wen
 */
public interface FlowMonitorListener {

    /**
     * 工作流执行开始时调用。
     *
     * @param requestId 请求 ID
     * @param flowName  工作流名称
     * @param plan      执行计划
     * @param inputs    工作流输入 (注意: 实现者应考虑处理其中的敏感信息)
     */
    default void onFlowStart(String requestId, String flowName, ExecutionPlan plan, Map<String, Object> inputs) {
    }

    /**
     * 工作流执行完成时调用 (无论成功或失败)。
     *
     * @param requestId     请求 ID
     * @param flowName      工作流名称
     * @param totalDuration 总执行耗时
     * @param success       工作流是否整体成功
     * @param outcomes      根层节点的结果 (实例 ID -> 结果)
     */
    default void onFlowComplete(String requestId, String flowName, Duration totalDuration, boolean success,
                                Map<String, NodeOutcome> outcomes) {
    }

    /**
     * 节点执行开始时调用。
     *
     * @param requestId  请求 ID
     * @param flowName   工作流名称
     * @param instanceId 节点实例 ID
     * @param nodeType   节点类型
     */
    void onNodeStart(String requestId, String flowName, String instanceId, NodeType nodeType);

    /**
     * 节点成功执行完成时调用。
     *
     * @param duration 节点执行耗时
     * @param outcome  节点结果
     * @param nodeType 节点类型
     */
    void onNodeSuccess(String requestId, String flowName, String instanceId, Duration duration, NodeOutcome outcome,
                       NodeType nodeType);

    /**
     * 节点执行失败时调用 (包括超时)。
     *
     * @param duration 节点执行耗时
     * @param error    导致失败的错误
     */
    void onNodeFailure(String requestId, String flowName, String instanceId, Duration duration, Throwable error, NodeType nodeType);

    /**
     * 节点因守卫未满足被跳过时调用。
     */
    void onNodeSkipped(String requestId, String flowName, String instanceId, NodeType nodeType);

    /**
     * 节点执行超时时调用。
     * 这是 onNodeFailure 的一种特定情况，随后仍会调用 onNodeFailure。
     *
     * @param timeout 配置的超时时长
     */
    void onNodeTimeout(String requestId, String flowName, String instanceId, Duration timeout, NodeType nodeType);
}
