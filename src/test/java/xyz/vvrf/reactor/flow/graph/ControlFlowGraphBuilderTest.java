package xyz.vvrf.reactor.flow.graph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.flow.builder.BuiltinNodeTypes;
import xyz.vvrf.reactor.flow.builder.WorkflowBuilder;
import xyz.vvrf.reactor.flow.model.ScopeRef;
import xyz.vvrf.reactor.flow.model.Workflow;
import xyz.vvrf.reactor.flow.registry.SimpleNodeTypeRegistry;
import xyz.vvrf.reactor.flow.test.util.TestNodeTypes;

import static org.assertj.core.api.Assertions.assertThat;

class ControlFlowGraphBuilderTest {

    private SimpleNodeTypeRegistry registry;
    private ControlFlowGraphBuilder builder;

    @BeforeEach
    void setUp() {
        registry = BuiltinNodeTypes.registerAll(new SimpleNodeTypeRegistry());
        registry.register(TestNodeTypes.step("step"));
        builder = new ControlFlowGraphBuilder();
    }

    @Test
    void unifiesControlAndDataConnectionsIntoEdges() {
        Workflow workflow = new WorkflowBuilder("wf", registry)
                .addNode("a", "step")
                .addNode("b", "step")
                .addNode("c", "step")
                .connect("Start.execute", "a.execute")
                .connect("a.onSuccess", "b.execute")
                .connect("a.out", "c.in")
                .connect("b.onSuccess", "Exit.onSuccess")
                .build();

        ControlFlowGraph graph = builder.build(workflow);

        assertThat(graph.getName()).isEqualTo("wf");
        assertThat(graph.getNodes()).containsExactly("Start", "a", "b", "c", "Exit");
        assertThat(graph.hasEdge("Start", "a")).isTrue();
        assertThat(graph.hasEdge("a", "b")).isTrue();
        assertThat(graph.hasEdge("a", "c")).isTrue();
        assertThat(graph.hasEdge("b", "Exit")).isTrue();
        // c 没有后继，隐式连向 Exit
        assertThat(graph.hasEdge("c", "Exit")).isTrue();
        assertThat(graph.edgeCount()).isEqualTo(5);
        assertThat(graph.predecessorsOf("c")).containsExactly("a");
    }

    @Test
    void addsStartAsImplicitPredecessorOfUnreachedNodes() {
        Workflow workflow = new WorkflowBuilder("wf", registry)
                .addNode("a", "step")
                .addNode("orphan", "step")
                .connect("Start.execute", "a.execute")
                .connect("a.onSuccess", "Exit.onSuccess")
                .build();

        ControlFlowGraph graph = builder.build(workflow);

        assertThat(graph.hasEdge("Start", "orphan")).isTrue();
        assertThat(graph.hasEdge("orphan", "Exit")).isTrue();
        assertThat(graph.findCycles()).isEmpty();
    }

    @Test
    void mergesDuplicateEdgesBetweenTheSameNodes() {
        Workflow workflow = new WorkflowBuilder("wf", registry)
                .addNode("a", "step")
                .addNode("b", "step")
                .connect("Start.execute", "a.execute")
                .connect("a.onSuccess", "b.execute")
                .connect("a.out", "b.in")
                .build();

        ControlFlowGraph graph = builder.build(workflow);

        assertThat(graph.successorsOf("a")).containsExactly("b");
    }

    @Test
    void buildsSeparateGraphPerScopeLayer() {
        Workflow workflow = new WorkflowBuilder("wf", registry)
                .startPort("list", "any[]")
                .exitPort("out", "any[]")
                .addNode("loop", BuiltinNodeTypes.FOR_EACH)
                .addNode("body", "step")
                .addToScope("loop", BuiltinNodeTypes.ITERATION_SCOPE, "body")
                .connect("Start.execute", "loop.execute")
                .connect("Start.list", "loop.items")
                .connect("loop.start", "body.execute")
                .connect("loop.item", "body.in")
                .connect("body.out", "loop.result")
                .connect("body.onSuccess", "loop.success")
                .connect("loop.results", "Exit.out")
                .build();

        ControlFlowGraph root = builder.build(workflow);
        assertThat(root.getNodes()).containsExactly("Start", "loop", "Exit");
        assertThat(root.contains("body")).isFalse();
        assertThat(root.hasEdge("Start", "loop")).isTrue();
        assertThat(root.hasEdge("loop", "Exit")).isTrue();

        ControlFlowGraph scope = builder.build(workflow, GraphLayer.of(new ScopeRef("loop", BuiltinNodeTypes.ITERATION_SCOPE)));
        assertThat(scope.getName()).isEqualTo("wf/loop.iteration");
        assertThat(scope.getNodes()).containsExactly("Start", "body", "Exit");
        assertThat(scope.hasEdge("Start", "body")).isTrue();
        assertThat(scope.hasEdge("body", "Exit")).isTrue();
        assertThat(scope.edgeCount()).isEqualTo(2);
    }

    @Test
    void findsCyclesOrderedByDeclaration() {
        Workflow workflow = new WorkflowBuilder("wf", registry)
                .addNode("a", "step")
                .addNode("b", "step")
                .addNode("c", "step")
                .connect("c.onSuccess", "a.execute")
                .connect("a.onSuccess", "b.execute")
                .connect("b.onSuccess", "c.execute")
                .build();

        ControlFlowGraph graph = builder.build(workflow);

        assertThat(graph.findCycles()).hasSize(1);
        assertThat(graph.findCycles().get(0)).containsExactly("a", "b", "c");
    }

    @Test
    void rendersDot() {
        Workflow workflow = new WorkflowBuilder("wf", registry)
                .addNode("a", "step")
                .connect("Start.execute", "a.execute")
                .build();

        String dot = builder.build(workflow).toDot();

        assertThat(dot).startsWith("digraph \"wf\" {");
        assertThat(dot).contains("\"Start\" -> \"a\";");
        assertThat(dot).contains("\"a\" [shape=box];");
        assertThat(dot).endsWith("}");
    }
}
