package xyz.vvrf.reactor.flow.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 拓扑排序发现环时抛出，列出所有位于环上的实例。
 *
 * @author ruifeng.wen
 */
public class CycleDetectedException extends WorkflowCompilationException {

    private final String graphName;
    private final List<String> cycleMembers;

    public CycleDetectedException(String graphName, List<String> cycleMembers) {
        super(String.format("Circular dependency detected in '%s'. Nodes in cycle: %s",
                graphName, String.join(", ", cycleMembers)));
        this.graphName = graphName;
        this.cycleMembers = Collections.unmodifiableList(new ArrayList<>(cycleMembers));
    }

    public String getGraphName() {
        return graphName;
    }

    public List<String> getCycleMembers() {
        return cycleMembers;
    }
}
