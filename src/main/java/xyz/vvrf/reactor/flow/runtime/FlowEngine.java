package xyz.vvrf.reactor.flow.runtime;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.plan.ExecutionPlan;

import java.util.Map;

/**
 * 执行计划的解释器。
 *
 * @author ruifeng.wen
 */
public interface FlowEngine {

    /**
     * 执行计划。
     *
     * @param plan      已编译的执行计划
     * @param inputs    工作流输入 (Start 端口名 -> 值)
     * @param requestId 请求 ID，为空时自动生成
     * @return 发出执行结果的 Mono。节点失败不会使 Mono 出错。
     */
    Mono<ExecutionResult> execute(ExecutionPlan plan, Map<String, Object> inputs, String requestId);

    default Mono<ExecutionResult> execute(ExecutionPlan plan, Map<String, Object> inputs) {
        return execute(plan, inputs, null);
    }

    /**
     * 按名称执行已注册的工作流，执行计划在首次使用时编译并缓存。
     *
     * @return 发出执行结果的 Mono；工作流不存在或校验失败时 Mono 以错误结束
     */
    Mono<ExecutionResult> execute(String workflowName, Map<String, Object> inputs, String requestId);
}
