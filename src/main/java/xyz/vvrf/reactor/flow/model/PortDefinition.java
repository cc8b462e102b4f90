package xyz.vvrf.reactor.flow.model;

import java.util.Objects;
import java.util.Optional;

/**
 * 节点类型上的一个端口（不可变数据类）。
 * 端口名称在所属节点类型内唯一（由校验器检查）。
 *
 * @author ruifeng.wen
 */
public final class PortDefinition {
    private final String name;
    private final PortDirection direction;
    private final PortKind kind;
    private final String valueType; // 类型形状字符串，例如 "{ id: string; tags: string[] }"，可为 null
    private final boolean optional;
    private final boolean hasDefault;
    private final Object defaultValue;
    private final MergeStrategy mergeStrategy;
    private final String scope; // 所属作用域名称，null 表示不属于任何作用域
    private final boolean failure; // 仅对 CONTROL 输出有意义：失败分支

    private PortDefinition(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "端口名称不能为空");
        this.direction = Objects.requireNonNull(builder.direction, "端口方向不能为空");
        this.kind = Objects.requireNonNull(builder.kind, "端口类别不能为空");
        this.valueType = builder.valueType;
        this.optional = builder.optional;
        this.hasDefault = builder.hasDefault;
        this.defaultValue = builder.defaultValue;
        this.mergeStrategy = builder.mergeStrategy;
        this.scope = builder.scope;
        this.failure = builder.failure;
    }

    public static Builder builder(String name, PortDirection direction, PortKind kind) {
        return new Builder(name, direction, kind);
    }

    /**
     * 创建一个必需的 DATA 输入端口。
     */
    public static PortDefinition dataInput(String name, String valueType) {
        return builder(name, PortDirection.INPUT, PortKind.DATA).valueType(valueType).build();
    }

    /**
     * 创建一个可选的 DATA 输入端口。
     */
    public static PortDefinition optionalDataInput(String name, String valueType) {
        return builder(name, PortDirection.INPUT, PortKind.DATA).valueType(valueType).optional(true).build();
    }

    public static PortDefinition dataOutput(String name, String valueType) {
        return builder(name, PortDirection.OUTPUT, PortKind.DATA).valueType(valueType).build();
    }

    public static PortDefinition controlInput(String name) {
        return builder(name, PortDirection.INPUT, PortKind.CONTROL).build();
    }

    public static PortDefinition controlOutput(String name) {
        return builder(name, PortDirection.OUTPUT, PortKind.CONTROL).build();
    }

    /**
     * 创建一个失败分支 CONTROL 输出：节点执行失败时触发。
     */
    public static PortDefinition failureOutput(String name) {
        return builder(name, PortDirection.OUTPUT, PortKind.CONTROL).failure(true).build();
    }

    // --- Getters ---

    public String getName() {
        return name;
    }

    public PortDirection getDirection() {
        return direction;
    }

    public PortKind getKind() {
        return kind;
    }

    /**
     * 获取声明的类型形状。
     * @return 类型字符串，未声明时为 null
     */
    public String getValueType() {
        return valueType;
    }

    public boolean isOptional() {
        return optional;
    }

    public boolean hasDefaultValue() {
        return hasDefault;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public Optional<MergeStrategy> getMergeStrategy() {
        return Optional.ofNullable(mergeStrategy);
    }

    public Optional<String> getScope() {
        return Optional.ofNullable(scope);
    }

    public boolean isFailure() {
        return failure;
    }

    public boolean isInput() {
        return direction == PortDirection.INPUT;
    }

    public boolean isOutput() {
        return direction == PortDirection.OUTPUT;
    }

    public boolean isControl() {
        return kind == PortKind.CONTROL;
    }

    public boolean isData() {
        return kind == PortKind.DATA;
    }

    public boolean isScoped() {
        return scope != null;
    }

    public boolean belongsToScope(String scopeName) {
        return scope != null && scope.equals(scopeName);
    }

    // --- equals, hashCode, toString ---

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PortDefinition that = (PortDefinition) o;
        return optional == that.optional &&
                hasDefault == that.hasDefault &&
                failure == that.failure &&
                name.equals(that.name) &&
                direction == that.direction &&
                kind == that.kind &&
                Objects.equals(valueType, that.valueType) &&
                Objects.equals(defaultValue, that.defaultValue) &&
                mergeStrategy == that.mergeStrategy &&
                Objects.equals(scope, that.scope);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, direction, kind, valueType, optional, hasDefault, defaultValue, mergeStrategy, scope, failure);
    }

    @Override
    public String toString() {
        return String.format("Port[%s %s %s%s%s%s]",
                direction, kind, name,
                valueType != null ? ": " + valueType : "",
                scope != null ? ", scope=" + scope : "",
                mergeStrategy != null ? ", merge=" + mergeStrategy : "");
    }

    /**
     * PortDefinition 的构建器。
     */
    public static final class Builder {
        private final String name;
        private final PortDirection direction;
        private final PortKind kind;
        private String valueType;
        private boolean optional;
        private boolean hasDefault;
        private Object defaultValue;
        private MergeStrategy mergeStrategy;
        private String scope;
        private boolean failure;

        private Builder(String name, PortDirection direction, PortKind kind) {
            this.name = name;
            this.direction = direction;
            this.kind = kind;
        }

        public Builder valueType(String valueType) {
            this.valueType = valueType;
            return this;
        }

        public Builder optional(boolean optional) {
            this.optional = optional;
            return this;
        }

        /**
         * 设置默认值。默认值可以是 null，仍视为"已声明默认值"。
         */
        public Builder defaultValue(Object defaultValue) {
            this.hasDefault = true;
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder mergeStrategy(MergeStrategy mergeStrategy) {
            this.mergeStrategy = mergeStrategy;
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder failure(boolean failure) {
            this.failure = failure;
            return this;
        }

        public PortDefinition build() {
            return new PortDefinition(this);
        }
    }
}
