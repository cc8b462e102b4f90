package xyz.vvrf.reactor.flow.runtime.builtin;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.builder.BuiltinNodeTypes;
import xyz.vvrf.reactor.flow.runtime.FlowExecutionException;
import xyz.vvrf.reactor.flow.runtime.NodeImplementation;
import xyz.vvrf.reactor.flow.runtime.NodeInvocation;
import xyz.vvrf.reactor.flow.runtime.NodeOutcome;
import xyz.vvrf.reactor.flow.runtime.ScopeInvoker;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 内置 forEach：对 items 中每个元素依次调用一次 iteration 作用域，
 * 并按调用顺序收集各次迭代的 result。任一迭代以 failure 结束或未发出 success 时节点失败。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class ForEachNode implements NodeImplementation {

    @Override
    public Mono<NodeOutcome> execute(NodeInvocation invocation) {
        List<Object> items = toList(invocation.getInput(BuiltinNodeTypes.ITEMS));
        ScopeInvoker iteration = invocation.scope(BuiltinNodeTypes.ITERATION_SCOPE);
        log.debug("[RequestId: {}][Flow: '{}'] forEach '{}' iterating over {} item(s)",
                invocation.getRequestId(), invocation.getFlowName(), invocation.getInstanceId(), items.size());

        return Flux.range(0, items.size())
                .concatMap(index -> {
                    Map<String, Object> payload = new HashMap<>();
                    payload.put(BuiltinNodeTypes.ITEM, items.get(index));
                    payload.put(BuiltinNodeTypes.INDEX, index);
                    return iteration.invoke(payload).flatMap(result -> {
                        if (result.isFailure() || !result.isSuccess()) {
                            return Mono.<List<Object>>error(new FlowExecutionException(String.format(
                                    "Iteration %d of forEach '%s' did not succeed.", index, invocation.getInstanceId())));
                        }
                        // 用 singletonList 包装，result 可以为 null
                        return Mono.just(Collections.<Object>singletonList(result.getResult(BuiltinNodeTypes.RESULT)));
                    });
                })
                .collectList()
                .map(wrapped -> {
                    List<Object> results = new ArrayList<>(wrapped.size());
                    for (List<Object> single : wrapped) {
                        results.add(single.get(0));
                    }
                    return NodeOutcome.success(BuiltinNodeTypes.RESULTS, results);
                });
    }

    private List<Object> toList(Object items) {
        if (items == null) {
            return Collections.emptyList();
        }
        if (items instanceof Collection) {
            return new ArrayList<Object>((Collection<?>) items);
        }
        if (items.getClass().isArray()) {
            int length = Array.getLength(items);
            List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(Array.get(items, i));
            }
            return list;
        }
        throw new IllegalArgumentException("forEach expects a collection or array but got " + items.getClass().getName());
    }
}
