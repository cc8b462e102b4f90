package xyz.vvrf.reactor.flow.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.flow.builder.BuiltinNodeTypes;
import xyz.vvrf.reactor.flow.model.CoercionKind;
import xyz.vvrf.reactor.flow.model.NodeType;
import xyz.vvrf.reactor.flow.runtime.NodeOutcome;
import xyz.vvrf.reactor.flow.test.util.TestNodeTypes;

import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class MicrometerFlowMonitorListenerTest {

    private SimpleMeterRegistry registry;
    private MicrometerFlowMonitorListener listener;
    private final NodeType type = TestNodeTypes.step("step");

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        listener = new MicrometerFlowMonitorListener(registry);
    }

    @Test
    void recordsSuccessfulNodeTimerAndCounter() {
        listener.onNodeSuccess("r1", "orders", "fetch", Duration.ofMillis(20), NodeOutcome.success(), type);
        listener.onNodeSuccess("r2", "orders", "fetch", Duration.ofMillis(40), NodeOutcome.success(), type);

        Timer timer = registry.get(MicrometerFlowMonitorListener.METRIC_NODE_EXECUTION_TIME)
                .tags("flow.name", "orders", "node.name", "fetch", "status", "SUCCESS")
                .timer();
        Counter counter = registry.get(MicrometerFlowMonitorListener.METRIC_NODE_EXECUTION_TOTAL)
                .tags("status", "SUCCESS")
                .counter();

        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(60.0);
        assertThat(counter.count()).isEqualTo(2.0);
    }

    @Test
    void tagsNodeMetersWithTypeAndKind() {
        NodeType coercion = BuiltinNodeTypes.coercion(CoercionKind.NUMBER);
        listener.onNodeSuccess("r", "orders", "fetch", Duration.ofMillis(5), NodeOutcome.success(), type);
        listener.onNodeSuccess("r", "orders", "toNumber", Duration.ofMillis(1), NodeOutcome.success(), coercion);

        assertThat(registry.get(MicrometerFlowMonitorListener.METRIC_NODE_EXECUTION_TOTAL)
                .tags("node.type", "step", "node.kind", "Local").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(MicrometerFlowMonitorListener.METRIC_NODE_EXECUTION_TOTAL)
                .tags("node.name", "toNumber", "node.kind", "Coercion").counter().count()).isEqualTo(1.0);
    }

    @Test
    void tagsFailuresWithErrorAndTimeoutStatus() {
        listener.onNodeFailure("r", "orders", "fetch", Duration.ofMillis(5), new IllegalStateException("x"), type);
        listener.onNodeTimeout("r", "orders", "slow", Duration.ofSeconds(1), type);
        listener.onNodeFailure("r", "orders", "slow", Duration.ofSeconds(1), new TimeoutException(), type);

        assertThat(registry.get(MicrometerFlowMonitorListener.METRIC_NODE_EXECUTION_TOTAL)
                .tags("node.name", "fetch", "status", "FAILURE", "error", "IllegalStateException")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get(MicrometerFlowMonitorListener.METRIC_NODE_EXECUTION_TOTAL)
                .tags("node.name", "slow", "status", "TIMEOUT", "error", "TimeoutException")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get(MicrometerFlowMonitorListener.METRIC_NODE_TIMEOUT_TOTAL)
                .tags("node.name", "slow", "node.kind", "Local")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void countsSkippedNodesWithoutTimer() {
        listener.onNodeSkipped("r", "orders", "optional", type);

        assertThat(registry.get(MicrometerFlowMonitorListener.METRIC_NODE_EXECUTION_TOTAL)
                .tags("status", "SKIPPED").counter().count()).isEqualTo(1.0);
        assertThat(registry.find(MicrometerFlowMonitorListener.METRIC_NODE_EXECUTION_TIME).timer()).isNull();
    }

    @Test
    void recordsFlowDurationAndCountByOutcome() {
        listener.onFlowComplete("r", "orders", Duration.ofMillis(100), true, Collections.<String, NodeOutcome>emptyMap());
        listener.onFlowComplete("r", "orders", Duration.ofMillis(50), false, Collections.<String, NodeOutcome>emptyMap());

        assertThat(registry.get(MicrometerFlowMonitorListener.METRIC_FLOW_EXECUTION_TIME)
                .tags("flow.name", "orders", "status", "SUCCESS").timer().count()).isEqualTo(1);
        assertThat(registry.get(MicrometerFlowMonitorListener.METRIC_FLOW_EXECUTION_TIME)
                .tags("status", "FAILURE").timer().count()).isEqualTo(1);
        assertThat(registry.get(MicrometerFlowMonitorListener.METRIC_FLOW_EXECUTION_TOTAL)
                .tags("flow.name", "orders", "status", "FAILURE").counter().count()).isEqualTo(1.0);
    }

    @Test
    void tracksActiveInvocationsPerFlow() {
        listener.onFlowStart("r1", "orders", null, Collections.<String, Object>emptyMap());
        listener.onFlowStart("r2", "orders", null, Collections.<String, Object>emptyMap());
        listener.onFlowStart("r2", "doubler", null, Collections.<String, Object>emptyMap());

        assertThat(registry.get(MicrometerFlowMonitorListener.METRIC_FLOW_ACTIVE)
                .tags("flow.name", "orders").gauge().value()).isEqualTo(2.0);

        listener.onFlowComplete("r1", "orders", Duration.ofMillis(10), true, Collections.<String, NodeOutcome>emptyMap());

        assertThat(registry.get(MicrometerFlowMonitorListener.METRIC_FLOW_ACTIVE)
                .tags("flow.name", "orders").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get(MicrometerFlowMonitorListener.METRIC_FLOW_ACTIVE)
                .tags("flow.name", "doubler").gauge().value()).isEqualTo(1.0);
    }
}
