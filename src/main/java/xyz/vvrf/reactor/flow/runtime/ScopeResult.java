package xyz.vvrf.reactor.flow.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次作用域调用的结果：出口的 success/failure 信号以及结果端口的值。
 *
 * @author ruifeng.wen
 */
public final class ScopeResult {
    private final boolean success;
    private final boolean failure;
    private final Map<String, Object> results;

    public ScopeResult(boolean success, boolean failure, Map<String, Object> results) {
        this.success = success;
        this.failure = failure;
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return failure;
    }

    /**
     * 结果端口的值 (端口名 -> 值)。缺失的端口不在 Map 中。
     */
    public Map<String, Object> getResults() {
        return results;
    }

    public Object getResult(String port) {
        return results.get(port);
    }

    @Override
    public String toString() {
        return String.format("ScopeResult[success=%b, failure=%b, results=%s]", success, failure, results.keySet());
    }
}
