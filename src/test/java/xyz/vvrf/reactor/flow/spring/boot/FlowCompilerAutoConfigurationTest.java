package xyz.vvrf.reactor.flow.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import xyz.vvrf.reactor.flow.builder.BuiltinNodeTypes;
import xyz.vvrf.reactor.flow.monitor.FlowMonitorListener;
import xyz.vvrf.reactor.flow.monitor.LoggingFlowMonitorListener;
import xyz.vvrf.reactor.flow.monitor.MicrometerFlowMonitorListener;
import xyz.vvrf.reactor.flow.plan.WorkflowCompiler;
import xyz.vvrf.reactor.flow.registry.CachingNodeTypeResolver;
import xyz.vvrf.reactor.flow.registry.NodeTypeRegistry;
import xyz.vvrf.reactor.flow.registry.SimpleNodeTypeRegistry;
import xyz.vvrf.reactor.flow.runtime.FlowEngine;
import xyz.vvrf.reactor.flow.runtime.NodeImplementationRegistry;
import xyz.vvrf.reactor.flow.validation.WorkflowValidator;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class FlowCompilerAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(FlowCompilerAutoConfiguration.class));

    @Test
    void providesCompilerEngineAndRegistries() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(WorkflowValidator.class);
            assertThat(context).hasSingleBean(WorkflowCompiler.class);
            assertThat(context).hasSingleBean(FlowEngine.class);
            assertThat(context).hasSingleBean(NodeImplementationRegistry.class);
            assertThat(context).hasSingleBean(LoggingFlowMonitorListener.class);
            assertThat(context).doesNotHaveBean(MicrometerFlowMonitorListener.class);

            assertThat(context.getBean(NodeTypeRegistry.class)).isInstanceOf(CachingNodeTypeResolver.class);
            assertThat(context.getBean(SimpleNodeTypeRegistry.class).findNodeType(BuiltinNodeTypes.FOR_EACH)).isPresent();
            assertThat(context.getBean(NodeImplementationRegistry.class).find(BuiltinNodeTypes.FOR_EACH)).isPresent();
        });
    }

    @Test
    void bindsProperties() {
        contextRunner
                .withPropertyValues(
                        "flow.compiler.max-scope-depth=4",
                        "flow.engine.default-node-timeout=250ms",
                        "flow.engine.max-call-depth=6",
                        "flow.cache.node-type-capacity=10",
                        "flow.cache.plan-capacity=3")
                .run(context -> {
                    FlowCompilerProperties properties = context.getBean(FlowCompilerProperties.class);
                    assertThat(properties.getCompiler().getMaxScopeDepth()).isEqualTo(4);
                    assertThat(properties.getEngine().getDefaultNodeTimeout()).isEqualTo(Duration.ofMillis(250));
                    assertThat(properties.getEngine().getMaxCallDepth()).isEqualTo(6);
                    assertThat(properties.getCache().getPlanCapacity()).isEqualTo(3);
                    assertThat(context.getBean(CachingNodeTypeResolver.class).getCapacity()).isEqualTo(10);
                });
    }

    @Test
    void rejectsInvalidProperties() {
        contextRunner
                .withPropertyValues("flow.engine.max-call-depth=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void registersMicrometerListenerWhenMeterRegistryPresent() {
        contextRunner
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(context -> {
                    assertThat(context).hasSingleBean(MicrometerFlowMonitorListener.class);
                    assertThat(context.getBeansOfType(FlowMonitorListener.class)).hasSize(2);
                });
    }

    @Test
    void loggingListenerCanBeDisabled() {
        contextRunner
                .withPropertyValues("flow.monitor.logging-enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(LoggingFlowMonitorListener.class));
    }

    @Test
    void backsOffWhenUserDefinesRegistry() {
        SimpleNodeTypeRegistry custom = new SimpleNodeTypeRegistry();
        contextRunner
                .withBean(SimpleNodeTypeRegistry.class, () -> custom)
                .run(context -> {
                    assertThat(context).hasSingleBean(SimpleNodeTypeRegistry.class);
                    assertThat(context.getBean(SimpleNodeTypeRegistry.class)).isSameAs(custom);
                    assertThat(custom.findNodeType(BuiltinNodeTypes.FOR_EACH)).isEmpty();
                });
    }
}
