package xyz.vvrf.reactor.flow.model;

import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.flow.builder.BuiltinNodeTypes;
import xyz.vvrf.reactor.flow.test.util.TestNodeTypes;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowTest {

    @Test
    void addsImplicitControlPortsToStartAndExit() {
        Workflow workflow = new Workflow("empty", Collections.<NodeInstance>emptyList(),
                Collections.<Connection>emptyList(), null, null, null, null);

        assertThat(workflow.getStartPorts()).extracting(PortDefinition::getName).containsExactly("execute");
        assertThat(workflow.getExitPorts()).extracting(PortDefinition::getName).containsExactly("onSuccess", "onFailure");
        assertThat(workflow.findInputPort("Exit", "onFailure").get().isOptional()).isTrue();
        assertThat(workflow.hasInstance("Start")).isTrue();
        assertThat(workflow.hasInstance("Exit")).isTrue();
        assertThat(workflow.declarationIndexOf("ghost")).isEqualTo(-1);
    }

    @Test
    void exposesScopeAndConnectionViews() {
        LocalNodeType step = TestNodeTypes.step("step");
        BuiltinNodeType forEach = BuiltinNodeTypes.forEach();
        Map<String, List<String>> scopes = new LinkedHashMap<>();
        scopes.put("loop.iteration", Collections.singletonList("body"));
        Connection entry = Connection.of("loop", "start", "body", "execute");
        Connection payload = Connection.of("loop", "item", "body", "in");
        Connection result = Connection.of("body", "out", "loop", "result");
        Connection outer = Connection.of("Start", "execute", "loop", "execute");

        Workflow workflow = new Workflow("wf",
                Arrays.asList(new NodeInstance("loop", "forEach"), new NodeInstance("body", "step")),
                Arrays.asList(outer, entry, payload, result),
                null, null, scopes, Arrays.<NodeType>asList(forEach, step));

        ScopeRef iteration = new ScopeRef("loop", "iteration");
        assertThat(workflow.getScopeRefs()).containsExactly(iteration);
        assertThat(workflow.getScopeRefsOwnedBy("loop")).containsExactly(iteration);
        assertThat(workflow.getScopeOf("body")).contains(iteration);
        assertThat(workflow.scopedSourceOf(entry)).contains(iteration);
        assertThat(workflow.scopedTargetOf(result)).contains(iteration);
        assertThat(workflow.isScopedConnection(outer)).isFalse();
        assertThat(workflow.sourceLayerOf(payload)).contains(iteration);
        assertThat(workflow.targetLayerOf(outer)).isEmpty();
        assertThat(workflow.incomingTo("body")).containsExactly(entry, payload);
        assertThat(workflow.outgoingFrom("body")).containsExactly(result);
        assertThat(workflow.declarationIndexOf("body")).isEqualTo(1);
    }

    @Test
    void leavesMalformedScopeKeysOutOfMembership() {
        Map<String, List<String>> scopes = new LinkedHashMap<>();
        scopes.put("noOwner", Collections.singletonList("body"));
        scopes.put("loop.iteration", Collections.singletonList("inner"));

        Workflow workflow = new Workflow("malformed",
                Arrays.asList(new NodeInstance("loop", "forEach"), new NodeInstance("body", "step"),
                        new NodeInstance("inner", "step")),
                Collections.<Connection>emptyList(), null, null, scopes, null);

        assertThat(workflow.getScopes()).containsKeys("noOwner", "loop.iteration");
        assertThat(workflow.getScopeOf("body")).isEmpty();
        assertThat(workflow.getScopeOf("inner")).contains(ScopeRef.parse("loop.iteration"));
    }

    @Test
    void parsesQualifiedReferences() {
        assertThat(PortRef.parse("a.b.out")).isEqualTo(PortRef.of("a.b", "out"));
        assertThat(ScopeRef.parse("loop.iteration").getOwnerId()).isEqualTo("loop");
        assertThatThrownBy(() -> PortRef.parse("noPort")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PortRef.parse("trailing.")).isInstanceOf(IllegalArgumentException.class);
    }
}
