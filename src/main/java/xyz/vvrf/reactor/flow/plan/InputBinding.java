package xyz.vvrf.reactor.flow.plan;

import xyz.vvrf.reactor.flow.model.PortDefinition;
import xyz.vvrf.reactor.flow.model.PortRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 一个输入端口在执行计划中的取值方式（不可变）。
 *
 * @author ruifeng.wen
 */
public final class InputBinding {

    /**
     * 取值来源。
     */
    public enum Source {
        /** CONTROL 输入：任一写入者为 true 即为 true */
        SIGNAL,
        /** 单个上游写入者 */
        CONNECTED,
        /** 多个写入者，经合并表达式合并 */
        MERGED,
        /** 实例的静态配置 */
        CONFIGURED,
        /** 端口默认值 */
        DEFAULTED,
        /** 没有任何来源，值缺失 */
        UNBOUND
    }

    private final PortDefinition port;
    private final Source source;
    private final List<PortRef> writers;
    private final MergeExpression mergeExpression;
    private final Object staticValue;

    private InputBinding(PortDefinition port, Source source, List<PortRef> writers,
                         MergeExpression mergeExpression, Object staticValue) {
        this.port = Objects.requireNonNull(port, "端口不能为空");
        this.source = Objects.requireNonNull(source, "来源不能为空");
        this.writers = Collections.unmodifiableList(new ArrayList<>(writers));
        this.mergeExpression = mergeExpression;
        this.staticValue = staticValue;
    }

    public static InputBinding signal(PortDefinition port, List<PortRef> writers) {
        return new InputBinding(port, Source.SIGNAL, writers, null, null);
    }

    public static InputBinding connected(PortDefinition port, PortRef writer) {
        return new InputBinding(port, Source.CONNECTED, Collections.singletonList(writer), null, null);
    }

    public static InputBinding merged(PortDefinition port, MergeExpression expression) {
        return new InputBinding(port, Source.MERGED, expression.getSources(), expression, null);
    }

    public static InputBinding configured(PortDefinition port, Object value) {
        return new InputBinding(port, Source.CONFIGURED, Collections.<PortRef>emptyList(), null, value);
    }

    public static InputBinding defaulted(PortDefinition port) {
        return new InputBinding(port, Source.DEFAULTED, Collections.<PortRef>emptyList(), null, port.getDefaultValue());
    }

    public static InputBinding unbound(PortDefinition port) {
        return new InputBinding(port, Source.UNBOUND, Collections.<PortRef>emptyList(), null, null);
    }

    public PortDefinition getPort() {
        return port;
    }

    public String getPortName() {
        return port.getName();
    }

    public Source getSource() {
        return source;
    }

    /**
     * 获取写入者（声明顺序）。静态来源为空列表。
     */
    public List<PortRef> getWriters() {
        return writers;
    }

    public Optional<MergeExpression> getMergeExpression() {
        return Optional.ofNullable(mergeExpression);
    }

    /**
     * CONFIGURED 或 DEFAULTED 来源的静态值。
     */
    public Object getStaticValue() {
        return staticValue;
    }

    /**
     * 以表达式形式描述取值方式。
     */
    public String describe() {
        switch (source) {
            case SIGNAL:
                return writers.isEmpty() ? "false" : writers.stream().map(PortRef::toString)
                        .reduce((a, b) -> a + " || " + b).orElse("false");
            case CONNECTED:
                return writers.get(0).toString();
            case MERGED:
                return mergeExpression.describe();
            case CONFIGURED:
                return "config(" + staticValue + ")";
            case DEFAULTED:
                return "default(" + staticValue + ")";
            default:
                return "undefined";
        }
    }

    @Override
    public String toString() {
        return port.getName() + " <- " + describe();
    }
}
