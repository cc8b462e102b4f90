package xyz.vvrf.reactor.flow.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 节点类型声明的一个作用域（回调子图）的端口视图。
 * <p>
 * 作用域的入口是所有者的 scoped 输出（必需的 {@code start} 以及负载输出），
 * 出口是所有者的 scoped 输入（必需的 {@code success}/{@code failure} 以及结果输入）。
 *
 * @author ruifeng.wen
 */
public final class ScopeDefinition {
    private final String name;
    private final List<PortDefinition> entryPorts;
    private final List<PortDefinition> exitPorts;

    public ScopeDefinition(String name, List<PortDefinition> ports) {
        this.name = Objects.requireNonNull(name, "作用域名称不能为空");
        Objects.requireNonNull(ports, "端口列表不能为空");
        List<PortDefinition> entries = new ArrayList<>();
        List<PortDefinition> exits = new ArrayList<>();
        for (PortDefinition port : ports) {
            if (!port.belongsToScope(name)) {
                continue;
            }
            if (port.isOutput()) {
                entries.add(port);
            } else {
                exits.add(port);
            }
        }
        this.entryPorts = Collections.unmodifiableList(entries);
        this.exitPorts = Collections.unmodifiableList(exits);
    }

    public String getName() {
        return name;
    }

    /**
     * 所有者侧的 scoped 输出端口（子图的入口）。
     */
    public List<PortDefinition> getEntryPorts() {
        return entryPorts;
    }

    /**
     * 所有者侧的 scoped 输入端口（子图的出口）。
     */
    public List<PortDefinition> getExitPorts() {
        return exitPorts;
    }

    public Optional<PortDefinition> getStartPort() {
        return findEntry(WorkflowConstants.SCOPE_START);
    }

    public Optional<PortDefinition> getSuccessPort() {
        return findExit(WorkflowConstants.SCOPE_SUCCESS);
    }

    public Optional<PortDefinition> getFailurePort() {
        return findExit(WorkflowConstants.SCOPE_FAILURE);
    }

    /**
     * 负载输出：除 start 以外的入口端口。
     */
    public List<PortDefinition> getPayloadPorts() {
        List<PortDefinition> result = new ArrayList<>();
        for (PortDefinition port : entryPorts) {
            if (!WorkflowConstants.SCOPE_START.equals(port.getName())) {
                result.add(port);
            }
        }
        return result;
    }

    /**
     * 结果输入：除 success/failure 以外的出口端口。
     */
    public List<PortDefinition> getResultPorts() {
        List<PortDefinition> result = new ArrayList<>();
        for (PortDefinition port : exitPorts) {
            String portName = port.getName();
            if (!WorkflowConstants.SCOPE_SUCCESS.equals(portName) && !WorkflowConstants.SCOPE_FAILURE.equals(portName)) {
                result.add(port);
            }
        }
        return result;
    }

    /**
     * 列出缺失的必需端口名称（start / success / failure）。
     */
    public List<String> getMissingMandatoryPorts() {
        List<String> missing = new ArrayList<>();
        if (!getStartPort().isPresent()) missing.add(WorkflowConstants.SCOPE_START);
        if (!getSuccessPort().isPresent()) missing.add(WorkflowConstants.SCOPE_SUCCESS);
        if (!getFailurePort().isPresent()) missing.add(WorkflowConstants.SCOPE_FAILURE);
        return missing;
    }

    private Optional<PortDefinition> findEntry(String portName) {
        return entryPorts.stream().filter(p -> p.getName().equals(portName)).findFirst();
    }

    private Optional<PortDefinition> findExit(String portName) {
        return exitPorts.stream().filter(p -> p.getName().equals(portName)).findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScopeDefinition that = (ScopeDefinition) o;
        return name.equals(that.name) && entryPorts.equals(that.entryPorts) && exitPorts.equals(that.exitPorts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, entryPorts, exitPorts);
    }

    @Override
    public String toString() {
        return String.format("Scope[%s, entries=%d, exits=%d]", name, entryPorts.size(), exitPorts.size());
    }
}
