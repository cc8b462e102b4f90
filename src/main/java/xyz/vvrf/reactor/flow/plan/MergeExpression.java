package xyz.vvrf.reactor.flow.plan;

import xyz.vvrf.reactor.flow.model.MergeStrategy;
import xyz.vvrf.reactor.flow.model.PortRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 一个多写入者输入的合并表达式（不可变）：目标端口、合并策略以及按声明顺序排列的写入者。
 *
 * @author ruifeng.wen
 */
public final class MergeExpression {
    private final PortRef target;
    private final MergeStrategy strategy;
    private final List<PortRef> sources;

    public MergeExpression(PortRef target, MergeStrategy strategy, List<PortRef> sources) {
        this.target = Objects.requireNonNull(target, "目标端口不能为空");
        this.strategy = Objects.requireNonNull(strategy, "合并策略不能为空");
        this.sources = Collections.unmodifiableList(new ArrayList<>(sources));
    }

    public PortRef getTarget() {
        return target;
    }

    public MergeStrategy getStrategy() {
        return strategy;
    }

    public List<PortRef> getSources() {
        return sources;
    }

    /**
     * 以表达式形式描述，例如 {@code COLLECT(a.out, b.out)}。
     */
    public String describe() {
        return strategy + "(" + sources.stream().map(PortRef::toString).collect(Collectors.joining(", ")) + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MergeExpression that = (MergeExpression) o;
        return target.equals(that.target) && strategy == that.strategy && sources.equals(that.sources);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, strategy, sources);
    }

    @Override
    public String toString() {
        return target + " = " + describe();
    }
}
