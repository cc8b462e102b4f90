package xyz.vvrf.reactor.flow.model;

import java.util.Objects;

/**
 * 对某个所有者实例上某个作用域的引用，限定名为 {@code owner.scope}。
 */
public final class ScopeRef {
    private final String ownerId;
    private final String scopeName;

    public ScopeRef(String ownerId, String scopeName) {
        this.ownerId = Objects.requireNonNull(ownerId, "所有者 ID 不能为空");
        this.scopeName = Objects.requireNonNull(scopeName, "作用域名称不能为空");
    }

    /**
     * 解析限定名 "owner.scope"，以最后一个 '.' 分隔。
     */
    public static ScopeRef parse(String qualifiedName) {
        PortRef ref = PortRef.parse(qualifiedName);
        return new ScopeRef(ref.getInstanceId(), ref.getPortName());
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getScopeName() {
        return scopeName;
    }

    public String getQualifiedName() {
        return ownerId + "." + scopeName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScopeRef scopeRef = (ScopeRef) o;
        return ownerId.equals(scopeRef.ownerId) && scopeName.equals(scopeRef.scopeName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ownerId, scopeName);
    }

    @Override
    public String toString() {
        return getQualifiedName();
    }
}
