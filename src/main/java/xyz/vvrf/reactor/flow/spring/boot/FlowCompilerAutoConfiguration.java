package xyz.vvrf.reactor.flow.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import xyz.vvrf.reactor.flow.builder.BuiltinNodeTypes;
import xyz.vvrf.reactor.flow.graph.BranchExclusivityAnalyzer;
import xyz.vvrf.reactor.flow.graph.ControlFlowGraphBuilder;
import xyz.vvrf.reactor.flow.graph.TopologicalScheduler;
import xyz.vvrf.reactor.flow.monitor.FlowMonitorListener;
import xyz.vvrf.reactor.flow.monitor.LoggingFlowMonitorListener;
import xyz.vvrf.reactor.flow.monitor.MicrometerFlowMonitorListener;
import xyz.vvrf.reactor.flow.plan.MergeResolver;
import xyz.vvrf.reactor.flow.plan.ReadinessEvaluator;
import xyz.vvrf.reactor.flow.plan.ScopeExpander;
import xyz.vvrf.reactor.flow.plan.WorkflowCompiler;
import xyz.vvrf.reactor.flow.registry.CachingNodeTypeResolver;
import xyz.vvrf.reactor.flow.registry.NodeTypeRegistry;
import xyz.vvrf.reactor.flow.registry.SimpleNodeTypeRegistry;
import xyz.vvrf.reactor.flow.runtime.FlowEngine;
import xyz.vvrf.reactor.flow.runtime.NodeImplementationRegistry;
import xyz.vvrf.reactor.flow.runtime.StandardFlowEngine;
import xyz.vvrf.reactor.flow.validation.WorkflowValidator;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 工作流编译器的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link FlowCompilerProperties}。
 * 2. 提供编译流水线的各个组件以及 {@link WorkflowCompiler}。
 * 3. 提供节点类型注册表（内置类型已注册，外层包装解析缓存）与节点实现注册表。
 * 4. 收集所有的 {@link FlowMonitorListener} Bean，并提供 {@link FlowEngine}。
 * <p>
 * 所有 Bean 都可以由用户定义的同类型 Bean 覆盖。
 *
 * @author ruifeng.wen
 */
@Configuration
@EnableConfigurationProperties(FlowCompilerProperties.class)
@Slf4j
public class FlowCompilerAutoConfiguration {

    public FlowCompilerAutoConfiguration() {
        log.info("工作流编译器自动配置 (FlowCompilerAutoConfiguration) 已加载。");
    }

    @Bean
    @ConditionalOnMissingBean
    public ControlFlowGraphBuilder controlFlowGraphBuilder() {
        return new ControlFlowGraphBuilder();
    }

    @Bean
    @ConditionalOnMissingBean
    public TopologicalScheduler topologicalScheduler() {
        return new TopologicalScheduler();
    }

    @Bean
    @ConditionalOnMissingBean
    public BranchExclusivityAnalyzer branchExclusivityAnalyzer() {
        return new BranchExclusivityAnalyzer();
    }

    @Bean
    @ConditionalOnMissingBean
    public ReadinessEvaluator readinessEvaluator() {
        return new ReadinessEvaluator();
    }

    @Bean
    @ConditionalOnMissingBean
    public MergeResolver mergeResolver() {
        return new MergeResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowValidator workflowValidator(ControlFlowGraphBuilder graphBuilder,
                                               BranchExclusivityAnalyzer exclusivityAnalyzer) {
        return new WorkflowValidator(graphBuilder, exclusivityAnalyzer);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScopeExpander scopeExpander(ControlFlowGraphBuilder graphBuilder, TopologicalScheduler scheduler,
                                       ReadinessEvaluator readinessEvaluator, MergeResolver mergeResolver,
                                       FlowCompilerProperties properties) {
        return new ScopeExpander(graphBuilder, scheduler, readinessEvaluator, mergeResolver,
                properties.getCompiler().getMaxScopeDepth());
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowCompiler workflowCompiler(WorkflowValidator validator, ScopeExpander scopeExpander) {
        log.info("正在创建 WorkflowCompiler Bean...");
        return new WorkflowCompiler(validator, scopeExpander);
    }

    /**
     * 默认的节点类型注册表：已注册全部内置类型。
     * 用户通过注入 {@link SimpleNodeTypeRegistry} 注册自己的类型与工作流。
     */
    @Bean
    @ConditionalOnMissingBean
    public SimpleNodeTypeRegistry simpleNodeTypeRegistry() {
        return BuiltinNodeTypes.registerAll(new SimpleNodeTypeRegistry());
    }

    /**
     * 引擎与构建器使用的解析入口，包装默认注册表。
     */
    @Bean
    @Primary
    @ConditionalOnMissingBean
    public CachingNodeTypeResolver cachingNodeTypeResolver(SimpleNodeTypeRegistry registry,
                                                           FlowCompilerProperties properties) {
        return new CachingNodeTypeResolver(registry, properties.getCache().getNodeTypeCapacity());
    }

    @Bean
    @ConditionalOnMissingBean
    public NodeImplementationRegistry nodeImplementationRegistry() {
        return new NodeImplementationRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "flow.monitor", name = "logging-enabled", havingValue = "true", matchIfMissing = true)
    public LoggingFlowMonitorListener loggingFlowMonitorListener() {
        return new LoggingFlowMonitorListener();
    }

    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MicrometerListenerConfiguration {

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnBean(MeterRegistry.class)
        public MicrometerFlowMonitorListener micrometerFlowMonitorListener(MeterRegistry meterRegistry) {
            return new MicrometerFlowMonitorListener(meterRegistry);
        }
    }

    @Bean
    @ConditionalOnMissingBean(FlowEngine.class)
    public StandardFlowEngine flowEngine(WorkflowCompiler compiler,
                                         NodeTypeRegistry nodeTypeRegistry,
                                         NodeImplementationRegistry implementationRegistry,
                                         MergeResolver mergeResolver,
                                         ObjectProvider<ObjectMapper> objectMapperProvider,
                                         ObjectProvider<FlowMonitorListener> listenersProvider,
                                         FlowCompilerProperties properties) {
        log.info("正在创建 FlowEngine Bean，配置: {}", properties);
        List<FlowMonitorListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        if (listeners.isEmpty()) {
            log.info("在 Spring 上下文中未找到 FlowMonitorListener Bean。");
        } else {
            log.info("收集到 {} 个 FlowMonitorListener Bean: {}", listeners.size(),
                    listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ")));
        }
        ObjectMapper objectMapper = objectMapperProvider.getIfAvailable(ObjectMapper::new);
        return new StandardFlowEngine(compiler, nodeTypeRegistry, implementationRegistry, mergeResolver, objectMapper,
                properties.getEngine().getDefaultNodeTimeout(), properties.getEngine().getMaxCallDepth(),
                properties.getCache().getPlanCapacity(), Collections.unmodifiableList(listeners));
    }
}
