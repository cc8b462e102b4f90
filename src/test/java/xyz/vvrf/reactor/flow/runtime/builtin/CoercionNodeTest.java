package xyz.vvrf.reactor.flow.runtime.builtin;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import xyz.vvrf.reactor.flow.builder.BuiltinNodeTypes;
import xyz.vvrf.reactor.flow.model.CoercionKind;
import xyz.vvrf.reactor.flow.runtime.NodeInvocation;
import xyz.vvrf.reactor.flow.runtime.ScopeInvoker;
import xyz.vvrf.reactor.flow.test.util.TestNodeTypes;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoercionNodeTest {

    private final CoercionNode coercion = new CoercionNode(new ObjectMapper());

    @Test
    void coercesToString() throws Exception {
        assertThat(coercion.coerce(CoercionKind.STRING, 12)).isEqualTo("12");
        assertThat(coercion.coerce(CoercionKind.STRING, "text")).isEqualTo("text");
        assertThat(coercion.coerce(CoercionKind.STRING, null)).isNull();
    }

    @Test
    void coercesToNumber() throws Exception {
        assertThat(coercion.coerce(CoercionKind.NUMBER, 3)).isEqualTo(3);
        assertThat(coercion.coerce(CoercionKind.NUMBER, "2.50")).isEqualTo(new BigDecimal("2.50"));
        assertThat(coercion.coerce(CoercionKind.NUMBER, true)).isEqualTo(1);
        assertThatThrownBy(() -> coercion.coerce(CoercionKind.NUMBER, "abc"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("abc");
    }

    @Test
    void coercesToBoolean() throws Exception {
        assertThat(coercion.coerce(CoercionKind.BOOLEAN, "TRUE")).isEqualTo(true);
        assertThat(coercion.coerce(CoercionKind.BOOLEAN, 0)).isEqualTo(false);
        assertThat(coercion.coerce(CoercionKind.BOOLEAN, 2.5)).isEqualTo(true);
        assertThatThrownBy(() -> coercion.coerce(CoercionKind.BOOLEAN, "yes"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void convertsBetweenJsonAndObjects() throws Exception {
        Map<String, Object> user = new LinkedHashMap<>();
        user.put("id", "u1");
        user.put("age", 30);

        Object json = coercion.coerce(CoercionKind.JSON, user);
        Object parsed = coercion.coerce(CoercionKind.OBJECT, json);

        assertThat(json).isEqualTo("{\"id\":\"u1\",\"age\":30}");
        assertThat(parsed).isEqualTo(user);
        assertThat(coercion.coerce(CoercionKind.OBJECT, user)).isSameAs(user);
    }

    @Test
    void executesAgainstCoercionNodeType() {
        NodeInvocation invocation = new NodeInvocation("req", "wf", "toText",
                BuiltinNodeTypes.coercion(CoercionKind.STRING),
                Collections.<String, Object>singletonMap(BuiltinNodeTypes.VALUE, 7),
                null, Collections.<String, ScopeInvoker>emptyMap(), 0);

        StepVerifier.create(coercion.execute(invocation))
                .assertNext(outcome -> {
                    assertThat(outcome.isSuccess()).isTrue();
                    assertThat(outcome.getOutput(BuiltinNodeTypes.VALUE)).isEqualTo("7");
                })
                .verifyComplete();
    }

    @Test
    void rejectsNonCoercionNodeType() {
        NodeInvocation invocation = new NodeInvocation("req", "wf", "x", TestNodeTypes.step("step"),
                Collections.<String, Object>emptyMap(), null, Collections.<String, ScopeInvoker>emptyMap(), 0);

        StepVerifier.create(coercion.execute(invocation))
                .expectError(IllegalArgumentException.class)
                .verify();
    }
}
