package xyz.vvrf.reactor.flow.builder;

import xyz.vvrf.reactor.flow.model.BuiltinNodeType;
import xyz.vvrf.reactor.flow.model.CoercionKind;
import xyz.vvrf.reactor.flow.model.CoercionNodeType;
import xyz.vvrf.reactor.flow.registry.SimpleNodeTypeRegistry;

import java.util.Locale;

/**
 * 引擎内置节点类型的定义。
 *
 * @author ruifeng.wen
 */
public final class BuiltinNodeTypes {

    public static final String FOR_EACH = "forEach";
    public static final String ITERATION_SCOPE = "iteration";

    public static final String ITEMS = "items";
    public static final String ITEM = "item";
    public static final String INDEX = "index";
    public static final String RESULT = "result";
    public static final String RESULTS = "results";
    public static final String VALUE = "value";

    private BuiltinNodeTypes() {}

    /**
     * forEach：对 items 中的每个元素调用一次作用域 "iteration"，按调用顺序收集 result。
     */
    public static BuiltinNodeType forEach() {
        return NodeTypeBuilder.named(FOR_EACH)
                .withStandardControlPorts()
                .dataInput(ITEMS, "any[]")
                .dataOutput(RESULTS, "any[]")
                .scope(ITERATION_SCOPE)
                .scopeOutput(ITERATION_SCOPE, ITEM, "any")
                .scopeOutput(ITERATION_SCOPE, INDEX, "number")
                .scopeInput(ITERATION_SCOPE, RESULT, "any")
                .builtin(FOR_EACH);
    }

    /**
     * 值转换节点，类型名称形如 "coerce:string"。
     */
    public static CoercionNodeType coercion(CoercionKind kind) {
        return NodeTypeBuilder.named(coercionTypeName(kind))
                .withStandardControlPorts()
                .dataInput(VALUE, "any")
                .dataOutput(VALUE, kind.name().toLowerCase(Locale.ROOT))
                .coercion(kind);
    }

    public static String coercionTypeName(CoercionKind kind) {
        return "coerce:" + kind.name().toLowerCase(Locale.ROOT);
    }

    /**
     * 把 forEach 与全部转换节点类型注册到注册表中。
     *
     * @return 传入的注册表
     */
    public static SimpleNodeTypeRegistry registerAll(SimpleNodeTypeRegistry registry) {
        registry.register(forEach());
        for (CoercionKind kind : CoercionKind.values()) {
            registry.register(coercion(kind));
        }
        return registry;
    }
}
