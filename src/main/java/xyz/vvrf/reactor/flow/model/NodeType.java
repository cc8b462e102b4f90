package xyz.vvrf.reactor.flow.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 节点类型（不可变）。一个封闭的变体：只有本包内的四个子类
 * {@link LocalNodeType}、{@link WorkflowNodeType}、{@link CoercionNodeType}、{@link BuiltinNodeType}，
 * 每个子类只持有自己类别需要的字段。使用 {@link #accept(NodeTypeVisitor)} 按类别分派。
 *
 * @author ruifeng.wen
 */
public abstract class NodeType {
    private final String name;
    private final List<PortDefinition> ports;
    private final JoinPolicy joinPolicy;
    private final CustomReadinessPredicate readinessPredicate;
    private final boolean pure;
    private final boolean lazy;
    private final List<ScopeDefinition> scopes;

    // 包级私有：禁止在本包之外扩展新的类别
    NodeType(String name, List<PortDefinition> ports, JoinPolicy joinPolicy,
             CustomReadinessPredicate readinessPredicate, boolean pure, boolean lazy,
             List<String> declaredScopes) {
        this.name = Objects.requireNonNull(name, "节点类型名称不能为空");
        this.ports = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(ports, "端口列表不能为空")));
        this.joinPolicy = joinPolicy != null ? joinPolicy : JoinPolicy.ALL;
        this.readinessPredicate = readinessPredicate;
        this.pure = pure;
        this.lazy = lazy;

        Set<String> scopeNames = new LinkedHashSet<>();
        if (declaredScopes != null) {
            scopeNames.addAll(declaredScopes);
        }
        for (PortDefinition port : this.ports) {
            port.getScope().ifPresent(scopeNames::add);
        }
        List<ScopeDefinition> scopeDefinitions = new ArrayList<>();
        for (String scopeName : scopeNames) {
            scopeDefinitions.add(new ScopeDefinition(scopeName, this.ports));
        }
        this.scopes = Collections.unmodifiableList(scopeDefinitions);
    }

    /**
     * 按类别分派。
     */
    public abstract <R> R accept(NodeTypeVisitor<R> visitor);

    /**
     * 获取类别名称，用于日志与诊断。
     */
    public abstract String getKindName();

    // --- Getters ---

    public String getName() {
        return name;
    }

    /**
     * 获取按声明顺序排列的端口（不可变）。
     */
    public List<PortDefinition> getPorts() {
        return ports;
    }

    public JoinPolicy getJoinPolicy() {
        return joinPolicy;
    }

    public Optional<CustomReadinessPredicate> getReadinessPredicate() {
        return Optional.ofNullable(readinessPredicate);
    }

    public boolean isPure() {
        return pure;
    }

    public boolean isLazy() {
        return lazy;
    }

    public List<ScopeDefinition> getScopes() {
        return scopes;
    }

    // --- 派生视图 ---

    public List<PortDefinition> getInputs() {
        return ports.stream().filter(PortDefinition::isInput).collect(Collectors.toList());
    }

    public List<PortDefinition> getOutputs() {
        return ports.stream().filter(PortDefinition::isOutput).collect(Collectors.toList());
    }

    /**
     * 查找输入端口。若存在同名端口，返回第一个。
     */
    public Optional<PortDefinition> findInput(String portName) {
        return ports.stream().filter(p -> p.isInput() && p.getName().equals(portName)).findFirst();
    }

    public Optional<PortDefinition> findOutput(String portName) {
        return ports.stream().filter(p -> p.isOutput() && p.getName().equals(portName)).findFirst();
    }

    public Optional<ScopeDefinition> findScope(String scopeName) {
        return scopes.stream().filter(s -> s.getName().equals(scopeName)).findFirst();
    }

    /**
     * 是否为分支节点：同时拥有成功与失败两类非作用域 CONTROL 输出。
     */
    public boolean isBranching() {
        boolean hasSuccess = false;
        boolean hasFailure = false;
        for (PortDefinition port : ports) {
            if (port.isOutput() && port.isControl() && !port.isScoped()) {
                if (port.isFailure()) {
                    hasFailure = true;
                } else {
                    hasSuccess = true;
                }
            }
        }
        return hasSuccess && hasFailure;
    }

    @Override
    public String toString() {
        return String.format("%s[name=%s, ports=%d, join=%s%s]",
                getKindName(), name, ports.size(), joinPolicy, lazy ? ", lazy" : "");
    }
}
