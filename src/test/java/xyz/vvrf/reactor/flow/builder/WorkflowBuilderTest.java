package xyz.vvrf.reactor.flow.builder;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.flow.model.Connection;
import xyz.vvrf.reactor.flow.model.ScopeRef;
import xyz.vvrf.reactor.flow.model.Workflow;
import xyz.vvrf.reactor.flow.registry.SimpleNodeTypeRegistry;
import xyz.vvrf.reactor.flow.test.util.TestNodeTypes;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowBuilderTest {

    private SimpleNodeTypeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = BuiltinNodeTypes.registerAll(new SimpleNodeTypeRegistry());
        registry.register(TestNodeTypes.step("step"));
    }

    @Test
    void buildsImmutableWorkflow() {
        Workflow workflow = new WorkflowBuilder("wf", registry)
                .startPort("input", "string")
                .exitPort("output", "string")
                .addNode("a", "step")
                .withConfiguration("a", "in", "static")
                .connect("Start.execute", "a.execute")
                .connect("a", "out", "Exit", "output")
                .build();

        assertThat(workflow.getName()).isEqualTo("wf");
        assertThat(workflow.getInstances()).hasSize(1);
        assertThat(workflow.findInstance("a").get().getConfiguration()).containsEntry("in", "static");
        assertThat(workflow.getConnections()).containsExactly(
                Connection.of("Start", "execute", "a", "execute"),
                Connection.of("a", "out", "Exit", "output"));
        assertThat(workflow.findOutputPort("Start", "execute")).isPresent();
        assertThat(workflow.findInputPort("Exit", "onSuccess")).isPresent();
        assertThat(workflow.findInputPort("Exit", "onFailure")).isPresent();
        assertThat(workflow.nodeTypeOf("a")).isPresent();
        assertThatThrownBy(() -> workflow.getConnections().add(Connection.of("a", "out", "b", "in")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void recordsScopeMembership() {
        Workflow workflow = new WorkflowBuilder("wf", registry)
                .addNode("loop", BuiltinNodeTypes.FOR_EACH)
                .addNode("body", "step")
                .addToScope("loop", BuiltinNodeTypes.ITERATION_SCOPE, "body")
                .build();

        assertThat(workflow.getScopeOf("body")).contains(new ScopeRef("loop", "iteration"));
        assertThat(workflow.getScopeOf("loop")).isEmpty();
        assertThat(workflow.getScopeMembers(new ScopeRef("loop", "iteration"))).containsExactly("body");
    }

    @Test
    void leavesUnknownTypesForTheValidator() {
        Workflow workflow = new WorkflowBuilder("wf", registry).addNode("x", "missing").build();

        assertThat(workflow.hasInstance("x")).isTrue();
        assertThat(workflow.nodeTypeOf("x")).isEmpty();
    }

    @Test
    void rejectsDuplicateAndReservedInstances() {
        WorkflowBuilder builder = new WorkflowBuilder("wf", registry).addNode("a", "step");

        assertThatThrownBy(() -> builder.addNode("a", "step")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.addNode("Start", "step")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.addNode("Exit", "step")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsDuplicateConnectionsAndMalformedReferences() {
        WorkflowBuilder builder = new WorkflowBuilder("wf", registry)
                .addNode("a", "step")
                .connect("Start.execute", "a.execute");

        assertThatThrownBy(() -> builder.connect("Start.execute", "a.execute"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.connect("Start", "a.execute"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsConfigurationForUnknownInstanceAndRepeatedMembers() {
        WorkflowBuilder builder = new WorkflowBuilder("wf", registry)
                .addNode("loop", BuiltinNodeTypes.FOR_EACH)
                .addNode("body", "step")
                .addToScope("loop", BuiltinNodeTypes.ITERATION_SCOPE, "body");

        assertThatThrownBy(() -> builder.withConfiguration("ghost", "in", 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.addToScope("loop", BuiltinNodeTypes.ITERATION_SCOPE, "body"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
