package xyz.vvrf.reactor.flow.runtime.builtin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.builder.BuiltinNodeTypes;
import xyz.vvrf.reactor.flow.model.CoercionKind;
import xyz.vvrf.reactor.flow.model.CoercionNodeType;
import xyz.vvrf.reactor.flow.runtime.NodeImplementation;
import xyz.vvrf.reactor.flow.runtime.NodeInvocation;
import xyz.vvrf.reactor.flow.runtime.NodeOutcome;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

/**
 * 值转换节点：把 value 输入转换为目标类别后写到 value 输出。
 * JSON 与 OBJECT 的转换使用 Jackson。
 *
 * @author ruifeng.wen
 */
public class CoercionNode implements NodeImplementation {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {
    };

    private final ObjectMapper objectMapper;

    public CoercionNode(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper 不能为空");
    }

    @Override
    public Mono<NodeOutcome> execute(NodeInvocation invocation) {
        if (!(invocation.getNodeType() instanceof CoercionNodeType)) {
            return Mono.error(new IllegalArgumentException(
                    "Coercion requested for non-coercion node type: " + invocation.getNodeType().getName()));
        }
        CoercionKind kind = ((CoercionNodeType) invocation.getNodeType()).getTargetKind();
        return Mono.fromCallable(() -> NodeOutcome.success(BuiltinNodeTypes.VALUE,
                coerce(kind, invocation.getInput(BuiltinNodeTypes.VALUE))));
    }

    /**
     * 转换单个值。null 总是转换为 null。
     *
     * @throws IllegalArgumentException 如果值无法转换
     */
    public Object coerce(CoercionKind kind, Object value) throws JsonProcessingException {
        if (value == null) {
            return null;
        }
        switch (kind) {
            case STRING:
                return value instanceof String ? value : String.valueOf(value);
            case NUMBER:
                if (value instanceof Number) {
                    return value;
                }
                if (value instanceof Boolean) {
                    return (Boolean) value ? 1 : 0;
                }
                try {
                    return new BigDecimal(value.toString().trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Cannot coerce '" + value + "' to a number", e);
                }
            case BOOLEAN:
                if (value instanceof Boolean) {
                    return value;
                }
                if (value instanceof Number) {
                    return ((Number) value).doubleValue() != 0;
                }
                String text = value.toString().trim();
                if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                    return Boolean.valueOf(text);
                }
                throw new IllegalArgumentException("Cannot coerce '" + value + "' to a boolean");
            case JSON:
                return objectMapper.writeValueAsString(value);
            case OBJECT:
                if (value instanceof Map) {
                    return value;
                }
                if (value instanceof String) {
                    return objectMapper.readValue((String) value, MAP_TYPE);
                }
                return objectMapper.convertValue(value, MAP_TYPE);
            default:
                throw new IllegalStateException("Unsupported coercion kind: " + kind);
        }
    }
}
