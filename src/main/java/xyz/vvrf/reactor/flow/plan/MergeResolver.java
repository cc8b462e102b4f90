package xyz.vvrf.reactor.flow.plan;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.model.Connection;
import xyz.vvrf.reactor.flow.model.MergeStrategy;
import xyz.vvrf.reactor.flow.model.PortDefinition;
import xyz.vvrf.reactor.flow.model.PortRef;
import xyz.vvrf.reactor.flow.model.Workflow;
import xyz.vvrf.reactor.flow.model.WorkflowConstants;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 多写入者 DATA 输入的合并。
 * <p>
 * 值 {@code null} 代表缺失（写入者未运行或未产出该值）。
 * 所有策略都按连接的声明顺序处理；策略从不被猜测：没有声明策略的多写入者输入会被拒绝。
 * Exit 端口例外：未声明策略时按 LAST（最后一个已定义的值）处理。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class MergeResolver {

    /**
     * 列出某个实例上所有多写入者 DATA 输入的合并表达式（端口声明顺序）。
     *
     * @throws IllegalStateException 如果某个多写入者输入没有声明合并策略
     */
    public List<MergeExpression> expressionsFor(Workflow workflow, String instanceId) {
        List<PortDefinition> inputs;
        if (WorkflowConstants.isExit(instanceId)) {
            inputs = workflow.getExitPorts();
        } else {
            inputs = workflow.nodeTypeOf(instanceId).map(t -> t.getInputs()).orElse(new ArrayList<>());
        }
        List<MergeExpression> expressions = new ArrayList<>();
        for (PortDefinition port : inputs) {
            expressionFor(workflow, PortRef.of(instanceId, port.getName())).ifPresent(expressions::add);
        }
        return expressions;
    }

    /**
     * 为单个输入端口构建合并表达式。少于两个写入者或端口不是 DATA 时返回 empty。
     *
     * @throws IllegalStateException 如果多写入者输入没有声明合并策略
     */
    public Optional<MergeExpression> expressionFor(Workflow workflow, PortRef target) {
        Optional<PortDefinition> port = workflow.findInputPort(target.getInstanceId(), target.getPortName());
        if (!port.isPresent() || !port.get().isData()) {
            return Optional.empty();
        }
        Set<PortRef> writers = new LinkedHashSet<>();
        for (Connection connection : workflow.incomingTo(target.getInstanceId(), target.getPortName())) {
            writers.add(connection.getSource());
        }
        if (writers.size() < 2) {
            return Optional.empty();
        }
        MergeStrategy strategy = port.get().getMergeStrategy().orElse(null);
        if (strategy == null) {
            if (!WorkflowConstants.isExit(target.getInstanceId())) {
                throw new IllegalStateException(String.format(
                        "Flow '%s': Input %s has %d writers but declares no merge strategy",
                        workflow.getName(), target, writers.size()));
            }
            strategy = MergeStrategy.LAST;
        }
        return Optional.of(new MergeExpression(target, strategy, new ArrayList<>(writers)));
    }

    /**
     * 按策略合并写入值。
     *
     * @param strategy 合并策略，不能为 null
     * @param values   按声明顺序排列的写入值，null 代表缺失
     * @return 合并结果；FIRST/LAST 在全部缺失时返回 null
     * @throws IllegalStateException    如果策略为 null
     * @throws IllegalArgumentException 如果 MERGE 遇到非 Map 的值
     */
    public Object resolve(MergeStrategy strategy, List<?> values) {
        if (strategy == null) {
            throw new IllegalStateException("Merge strategy must be declared for multi-writer inputs");
        }
        switch (strategy) {
            case COLLECT:
                return new ArrayList<Object>(values);
            case MERGE:
                return mergeMaps(values);
            case CONCAT:
                return concat(values);
            case FIRST:
                for (Object value : values) {
                    if (value != null) {
                        return value;
                    }
                }
                return null;
            case LAST:
                for (int i = values.size() - 1; i >= 0; i--) {
                    if (values.get(i) != null) {
                        return values.get(i);
                    }
                }
                return null;
            default:
                throw new IllegalStateException("Unsupported merge strategy: " + strategy);
        }
    }

    private Map<Object, Object> mergeMaps(List<?> values) {
        Map<Object, Object> merged = new LinkedHashMap<>();
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            if (!(value instanceof Map)) {
                throw new IllegalArgumentException("MERGE expects map values but got " + value.getClass().getName());
            }
            merged.putAll((Map<?, ?>) value);
        }
        return merged;
    }

    private List<Object> concat(List<?> values) {
        List<Object> flattened = new ArrayList<>();
        for (Object value : values) {
            if (value instanceof Collection) {
                flattened.addAll((Collection<?>) value);
            } else if (value != null && value.getClass().isArray()) {
                int length = Array.getLength(value);
                for (int i = 0; i < length; i++) {
                    flattened.add(Array.get(value, i));
                }
            } else {
                flattened.add(value);
            }
        }
        return flattened;
    }
}
