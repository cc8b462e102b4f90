package xyz.vvrf.reactor.flow.runtime;

import lombok.Getter;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 单个节点执行完成后的结果（不可变数据类）。
 * 包含执行状态、按端口名组织的数据输出以及可能的错误信息。
 *
 * @author ruifeng.wen
 */
public final class NodeOutcome {

    /**
     * 节点执行状态。
     */
    public enum Status {
        /** 节点成功执行。非失败分支的 CONTROL 输出被触发。*/
        SUCCESS,
        /** 节点执行失败。必须包含错误信息，失败分支的 CONTROL 输出被触发。*/
        FAILURE,
        /** 节点被跳过。所有 CONTROL 输出写为 false。*/
        SKIPPED
    }

    private static final NodeOutcome SKIPPED_OUTCOME = new NodeOutcome(Status.SKIPPED, Collections.<String, Object>emptyMap(), null);

    @Getter private final Status status;
    @Getter private final Map<String, Object> outputs;
    private final Throwable error;

    private NodeOutcome(Status status, Map<String, Object> outputs, Throwable error) {
        this.status = Objects.requireNonNull(status, "节点状态不能为空");
        this.outputs = outputs;
        this.error = error;
        if (status == Status.FAILURE && error == null) {
            throw new IllegalArgumentException("FAILURE 状态的结果必须包含一个非空的错误信息。");
        }
        if (status != Status.FAILURE && error != null) {
            throw new IllegalArgumentException("非 FAILURE 状态的结果不能包含错误信息。");
        }
    }

    // --- 静态工厂方法 ---

    /**
     * 创建成功结果。
     * @param outputs 数据输出 (端口名 -> 值)，值可以为 null；未出现的端口视为缺失
     */
    public static NodeOutcome success(Map<String, Object> outputs) {
        Objects.requireNonNull(outputs, "输出 Map 不能为空");
        return new NodeOutcome(Status.SUCCESS, Collections.unmodifiableMap(new HashMap<>(outputs)), null);
    }

    /**
     * 创建只有一个数据输出的成功结果。
     */
    public static NodeOutcome success(String port, Object value) {
        return new NodeOutcome(Status.SUCCESS, Collections.singletonMap(port, value), null);
    }

    /**
     * 创建没有数据输出的成功结果。
     */
    public static NodeOutcome success() {
        return new NodeOutcome(Status.SUCCESS, Collections.<String, Object>emptyMap(), null);
    }

    /**
     * 创建失败结果。
     * @param error 导致失败的异常 (不能为空)
     */
    public static NodeOutcome failure(Throwable error) {
        Objects.requireNonNull(error, "错误对象不能为空");
        return new NodeOutcome(Status.FAILURE, Collections.<String, Object>emptyMap(), error);
    }

    public static NodeOutcome skipped() {
        return SKIPPED_OUTCOME;
    }

    // --- 实例方法 ---

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    public boolean hasOutput(String port) {
        return outputs.containsKey(port);
    }

    public Object getOutput(String port) {
        return outputs.get(port);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isFailure() {
        return status == Status.FAILURE;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    @Override
    public String toString() {
        return "NodeOutcome{" +
                "status=" + status +
                ", outputs=" + outputs.keySet() +
                (error != null ? ", error=" + error.getClass().getSimpleName() + ": " + error.getMessage() : "") +
                '}';
    }
}
