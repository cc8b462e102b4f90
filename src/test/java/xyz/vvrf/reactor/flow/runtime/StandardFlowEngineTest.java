package xyz.vvrf.reactor.flow.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import xyz.vvrf.reactor.flow.builder.BuiltinNodeTypes;
import xyz.vvrf.reactor.flow.builder.NodeTypeBuilder;
import xyz.vvrf.reactor.flow.builder.WorkflowBuilder;
import xyz.vvrf.reactor.flow.graph.ControlFlowGraphBuilder;
import xyz.vvrf.reactor.flow.graph.TopologicalScheduler;
import xyz.vvrf.reactor.flow.model.CoercionKind;
import xyz.vvrf.reactor.flow.model.MergeStrategy;
import xyz.vvrf.reactor.flow.model.NodeType;
import xyz.vvrf.reactor.flow.model.Workflow;
import xyz.vvrf.reactor.flow.monitor.FlowMonitorListener;
import xyz.vvrf.reactor.flow.plan.ExecutionPlan;
import xyz.vvrf.reactor.flow.plan.MergeResolver;
import xyz.vvrf.reactor.flow.plan.ReadinessEvaluator;
import xyz.vvrf.reactor.flow.plan.ScopeExpander;
import xyz.vvrf.reactor.flow.plan.WorkflowCompiler;
import xyz.vvrf.reactor.flow.registry.SimpleNodeTypeRegistry;
import xyz.vvrf.reactor.flow.test.util.TestNodeImplementation;
import xyz.vvrf.reactor.flow.test.util.TestNodeTypes;
import xyz.vvrf.reactor.flow.validation.WorkflowValidator;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class StandardFlowEngineTest {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private SimpleNodeTypeRegistry types;
    private NodeImplementationRegistry implementations;
    private MergeResolver mergeResolver;
    private WorkflowCompiler compiler;
    private RecordingListener listener;
    private List<String> executionLog;

    @BeforeEach
    void setUp() {
        types = BuiltinNodeTypes.registerAll(new SimpleNodeTypeRegistry());
        types.register(TestNodeTypes.step("step"));
        implementations = new NodeImplementationRegistry();
        mergeResolver = new MergeResolver();
        compiler = new WorkflowCompiler(new WorkflowValidator(), new ScopeExpander(new ControlFlowGraphBuilder(),
                new TopologicalScheduler(), new ReadinessEvaluator(), mergeResolver, ScopeExpander.DEFAULT_MAX_DEPTH));
        listener = new RecordingListener();
        executionLog = new CopyOnWriteArrayList<>();
    }

    private StandardFlowEngine engine(Duration timeout, int maxCallDepth) {
        return new StandardFlowEngine(compiler, types, implementations, mergeResolver, new ObjectMapper(),
                timeout, maxCallDepth, 16, Collections.<FlowMonitorListener>singletonList(listener));
    }

    private StandardFlowEngine engine() {
        return engine(DEFAULT_TIMEOUT, 8);
    }

    private WorkflowBuilder workflow(String name) {
        return new WorkflowBuilder(name, types);
    }

    /**
     * 注册一个实现 ID 与类型名相同的 step 类型及其实现。
     */
    private TestNodeImplementation stepType(String typeName, TestNodeImplementation.Builder implementation) {
        types.register(TestNodeTypes.step(typeName));
        TestNodeImplementation built = implementation.logTo(executionLog).build();
        implementations.register(typeName, built);
        return built;
    }

    private static int intInput(NodeInvocation invocation) {
        return ((Number) invocation.getInput(TestNodeTypes.IN)).intValue();
    }

    private static NodeOutcome addOne(NodeInvocation invocation) {
        return NodeOutcome.success(TestNodeTypes.OUT, intInput(invocation) + 1);
    }

    private ExecutionPlan compile(Workflow workflow) {
        return compiler.compileOrThrow(workflow);
    }

    @Test
    void executesChainInTopologicalOrder() {
        stepType("produce", TestNodeImplementation.builder("produce").returns(TestNodeTypes.OUT, 1));
        stepType("increment", TestNodeImplementation.builder("increment").computes(StandardFlowEngineTest::addOne));

        Workflow wf = workflow("chain")
                .exitPort("result", "any")
                .addNode("c", "increment")
                .addNode("b", "increment")
                .addNode("a", "produce")
                .connect("Start.execute", "a.execute")
                .connect("a.onSuccess", "b.execute")
                .connect("a.out", "b.in")
                .connect("b.onSuccess", "c.execute")
                .connect("b.out", "c.in")
                .connect("c.out", "Exit.result")
                .connect("c.onSuccess", "Exit.onSuccess")
                .build();

        StepVerifier.create(engine().execute(compile(wf), Collections.<String, Object>emptyMap(), "req-chain"))
                .assertNext(result -> {
                    assertThat(result.getRequestId()).isEqualTo("req-chain");
                    assertThat(result.getFlowName()).isEqualTo("chain");
                    assertThat(result.isSucceeded()).isTrue();
                    assertThat(result.isFailed()).isFalse();
                    assertThat(result.getOutput("result")).isEqualTo(3);
                    assertThat(result.getOutcomes().keySet()).containsExactly("a", "b", "c");
                })
                .verifyComplete();

        assertThat(executionLog).containsExactly("a", "b", "c");
        assertThat(listener.events).containsExactly(
                "flowStart:chain",
                "start:a", "success:a",
                "start:b", "success:b",
                "start:c", "success:c",
                "flowComplete:chain:true");
    }

    @Test
    void seedsStartPortsFromInputsAndGeneratesRequestId() {
        stepType("increment", TestNodeImplementation.builder("increment").computes(StandardFlowEngineTest::addOne));

        Workflow wf = workflow("seeded")
                .startPort("n", "number")
                .exitPort("result", "number")
                .addNode("inc", "increment")
                .connect("Start.execute", "inc.execute")
                .connect("Start.n", "inc.in")
                .connect("inc.out", "Exit.result")
                .build();
        Map<String, Object> inputs = new HashMap<>();
        inputs.put("n", 41);
        inputs.put("undeclared", "ignored");

        StepVerifier.create(engine().execute(compile(wf), inputs))
                .assertNext(result -> {
                    assertThat(result.getRequestId()).startsWith("flow-req-");
                    assertThat(result.getOutputs()).containsOnlyKeys("result");
                    assertThat(result.getOutput("result")).isEqualTo(42);
                })
                .verifyComplete();
    }

    @Test
    void skipsNodesWhoseGuardIsNotSatisfied() {
        stepType("ok", TestNodeImplementation.builder("ok"));
        TestNodeImplementation handler = stepType("handler", TestNodeImplementation.builder("handler"));

        Workflow wf = workflow("skips")
                .addNode("a", "ok")
                .addNode("recover", "handler")
                .addNode("after", "ok")
                .connect("Start.execute", "a.execute")
                .connect("a.onFailure", "recover.execute")
                .connect("recover.onSuccess", "after.execute")
                .build();

        StepVerifier.create(engine().execute(compile(wf), null))
                .assertNext(result -> {
                    assertThat(result.getOutcome("a").isSuccess()).isTrue();
                    assertThat(result.getOutcome("recover").isSkipped()).isTrue();
                    assertThat(result.getOutcome("after").isSkipped()).isTrue();
                    assertThat(result.isSucceeded()).isTrue();
                    assertThat(result.isFailed()).isFalse();
                })
                .verifyComplete();

        assertThat(handler.getInvocationCount()).isZero();
        assertThat(listener.events).contains("skipped:recover", "skipped:after");
    }

    @Test
    void routesFailureThroughFailureBranch() {
        IllegalStateException boom = new IllegalStateException("boom");
        stepType("fragile", TestNodeImplementation.builder("fragile").throwsError(boom));
        stepType("ok", TestNodeImplementation.builder("ok"));

        Workflow wf = workflow("failing")
                .addNode("a", "fragile")
                .addNode("next", "ok")
                .addNode("recover", "ok")
                .connect("Start.execute", "a.execute")
                .connect("a.onSuccess", "next.execute")
                .connect("a.onFailure", "recover.execute")
                .connect("next.onSuccess", "Exit.onSuccess")
                .connect("recover.onSuccess", "Exit.onFailure")
                .build();

        StepVerifier.create(engine().execute(compile(wf), null))
                .assertNext(result -> {
                    NodeOutcome failed = result.getOutcome("a");
                    assertThat(failed.isFailure()).isTrue();
                    assertThat(failed.getError()).containsSame(boom);
                    assertThat(result.getOutcome("next").isSkipped()).isTrue();
                    assertThat(result.getOutcome("recover").isSuccess()).isTrue();
                    assertThat(result.isSucceeded()).isFalse();
                    assertThat(result.isFailed()).isTrue();
                })
                .verifyComplete();

        assertThat(executionLog).containsExactly("a", "recover");
        assertThat(listener.events).contains("failure:a:IllegalStateException");
    }

    @Test
    void failsNodeThatExceedsTimeout() {
        stepType("slow", TestNodeImplementation.builder("slow")
                .returns(TestNodeTypes.OUT, "late")
                .delay(Duration.ofSeconds(5)));

        Workflow wf = workflow("timeouts")
                .addNode("slow", "slow")
                .connect("Start.execute", "slow.execute")
                .build();

        StepVerifier.create(engine(Duration.ofMillis(100), 8).execute(compile(wf), null))
                .assertNext(result -> {
                    NodeOutcome outcome = result.getOutcome("slow");
                    assertThat(outcome.isFailure()).isTrue();
                    assertThat(outcome.getError().get()).isInstanceOf(TimeoutException.class);
                    assertThat(result.isFailed()).isTrue();
                })
                .expectComplete()
                .verify(Duration.ofSeconds(3));

        assertThat(listener.events).containsSubsequence("start:slow", "timeout:slow", "failure:slow:TimeoutException");
    }

    @Test
    void reportsMissingImplementationAsNodeFailure() {
        types.register(TestNodeTypes.step("unbacked"));

        Workflow wf = workflow("missing")
                .addNode("x", "unbacked")
                .connect("Start.execute", "x.execute")
                .build();

        StepVerifier.create(engine().execute(compile(wf), null))
                .assertNext(result -> {
                    Throwable error = result.getOutcome("x").getError().get();
                    assertThat(error).isInstanceOf(FlowExecutionException.class)
                            .hasMessageContaining("No implementation registered under 'unbacked'");
                    assertThat(result.isFailed()).isTrue();
                })
                .verifyComplete();
    }

    @Test
    void runsLazyNodeOnceForAllConsumers() {
        types.register(TestNodeTypes.stepBuilder("lazySource").lazy().local());
        TestNodeImplementation source = TestNodeImplementation.builder("lazySource")
                .returns(TestNodeTypes.OUT, 10)
                .logTo(executionLog)
                .build();
        implementations.register("lazySource", source);
        stepType("increment", TestNodeImplementation.builder("increment").computes(StandardFlowEngineTest::addOne));

        Workflow wf = workflow("lazy")
                .exitPort("first", "any")
                .exitPort("second", "any")
                .addNode("src", "lazySource")
                .addNode("a", "increment")
                .addNode("b", "increment")
                .connect("Start.execute", "src.execute")
                .connect("Start.execute", "a.execute")
                .connect("a.onSuccess", "b.execute")
                .connect("src.out", "a.in")
                .connect("src.out", "b.in")
                .connect("a.out", "Exit.first")
                .connect("b.out", "Exit.second")
                .build();

        StepVerifier.create(engine().execute(compile(wf), null))
                .assertNext(result -> {
                    assertThat(result.getOutput("first")).isEqualTo(11);
                    assertThat(result.getOutput("second")).isEqualTo(11);
                })
                .verifyComplete();

        assertThat(source.getInvocationCount()).isEqualTo(1);
        assertThat(executionLog).containsExactly("src", "a", "b");
    }

    @Test
    void neverRunsLazyNodeWithoutConsumers() {
        types.register(TestNodeTypes.stepBuilder("lazySource").lazy().local());
        TestNodeImplementation source = TestNodeImplementation.builder("lazySource").returns(TestNodeTypes.OUT, 10).build();
        implementations.register("lazySource", source);
        stepType("ok", TestNodeImplementation.builder("ok"));

        Workflow wf = workflow("idleLazy")
                .addNode("src", "lazySource")
                .addNode("a", "ok")
                .connect("Start.execute", "src.execute")
                .connect("Start.execute", "a.execute")
                .build();

        StepVerifier.create(engine().execute(compile(wf), null))
                .assertNext(result -> {
                    assertThat(result.getOutcomes()).containsOnlyKeys("a");
                    assertThat(result.isSucceeded()).isTrue();
                })
                .verifyComplete();

        assertThat(source.getInvocationCount()).isZero();
    }

    @Test
    void iteratesScopeOncePerItemInOrder() {
        types.register(TestNodeTypes.stepBuilder("lazyIncrement").lazy().local());
        TestNodeImplementation lazyIncrement = TestNodeImplementation.builder("lazyIncrement")
                .computes(StandardFlowEngineTest::addOne)
                .build();
        implementations.register("lazyIncrement", lazyIncrement);
        stepType("pass", TestNodeImplementation.builder("pass")
                .computes(inv -> NodeOutcome.success(TestNodeTypes.OUT, inv.getInput(TestNodeTypes.IN))));
        stepType("double", TestNodeImplementation.builder("double")
                .computes(inv -> NodeOutcome.success(TestNodeTypes.OUT, intInput(inv) * 2)));

        Workflow wf = workflow("iterate")
                .startPort("list", "any[]")
                .exitPort("out", "any[]")
                .addNode("loop", BuiltinNodeTypes.FOR_EACH)
                .addNode("plusOne", "lazyIncrement")
                .addNode("body", "pass")
                .addNode("tail", "double")
                .addToScope("loop", BuiltinNodeTypes.ITERATION_SCOPE, "plusOne", "body", "tail")
                .connect("Start.execute", "loop.execute")
                .connect("Start.list", "loop.items")
                .connect("loop.start", "plusOne.execute")
                .connect("loop.item", "plusOne.in")
                .connect("loop.start", "body.execute")
                .connect("plusOne.out", "body.in")
                .connect("body.onSuccess", "tail.execute")
                .connect("plusOne.out", "tail.in")
                .connect("tail.out", "loop.result")
                .connect("tail.onSuccess", "loop.success")
                .connect("loop.results", "Exit.out")
                .connect("loop.onSuccess", "Exit.onSuccess")
                .build();

        Map<String, Object> inputs = Collections.<String, Object>singletonMap("list", Arrays.asList(1, 2, 3));

        StepVerifier.create(engine().execute(compile(wf), inputs))
                .assertNext(result -> {
                    assertThat(result.isSucceeded()).isTrue();
                    assertThat(result.getOutput("out")).asList().containsExactly(4, 6, 8);
                    assertThat(result.getOutcomes()).containsOnlyKeys("loop");
                })
                .verifyComplete();

        assertThat(lazyIncrement.getInvocationCount()).isEqualTo(3);
        assertThat(executionLog).containsExactly("body", "tail", "body", "tail", "body", "tail");
    }

    @Test
    void failsForEachWhenIterationDoesNotSucceed() {
        stepType("fragile", TestNodeImplementation.builder("fragile").failsWith(new IllegalArgumentException("bad item")));

        Workflow wf = workflow("iterateFailing")
                .startPort("list", "any[]")
                .addNode("loop", BuiltinNodeTypes.FOR_EACH)
                .addNode("body", "fragile")
                .addToScope("loop", BuiltinNodeTypes.ITERATION_SCOPE, "body")
                .connect("Start.execute", "loop.execute")
                .connect("Start.list", "loop.items")
                .connect("loop.start", "body.execute")
                .connect("loop.item", "body.in")
                .connect("body.out", "loop.result")
                .connect("body.onSuccess", "loop.success")
                .connect("body.onFailure", "loop.failure")
                .build();

        Map<String, Object> inputs = Collections.<String, Object>singletonMap("list", Arrays.asList("x", "y"));

        StepVerifier.create(engine().execute(compile(wf), inputs))
                .assertNext(result -> {
                    Throwable error = result.getOutcome("loop").getError().get();
                    assertThat(error).hasMessageContaining("Iteration 0 of forEach 'loop' did not succeed");
                    assertThat(result.isFailed()).isTrue();
                })
                .verifyComplete();

        assertThat(executionLog).containsExactly("body");
    }

    @Test
    void invokesRegisteredSubWorkflowByName() {
        stepType("double", TestNodeImplementation.builder("double")
                .computes(inv -> NodeOutcome.success(TestNodeTypes.OUT, intInput(inv) * 2)));
        Workflow child = workflow("doubler")
                .startPort("value", "number")
                .exitPort("result", "number")
                .addNode("d", "double")
                .connect("Start.execute", "d.execute")
                .connect("Start.value", "d.in")
                .connect("d.out", "Exit.result")
                .connect("d.onSuccess", "Exit.onSuccess")
                .build();
        types.registerWorkflow(child);
        types.register(NodeTypeBuilder.named("callDoubler")
                .withStandardControlPorts()
                .dataInput("value", "number")
                .dataOutput("result", "number")
                .workflow("doubler"));

        Workflow parent = workflow("parent")
                .startPort("n", "number")
                .exitPort("out", "number")
                .addNode("call", "callDoubler")
                .connect("Start.execute", "call.execute")
                .connect("Start.n", "call.value")
                .connect("call.result", "Exit.out")
                .connect("call.onSuccess", "Exit.onSuccess")
                .build();
        types.registerWorkflow(parent);
        StandardFlowEngine engine = engine();

        StepVerifier.create(engine.execute("parent", Collections.<String, Object>singletonMap("n", 21), "req-sub"))
                .assertNext(result -> {
                    assertThat(result.isSucceeded()).isTrue();
                    assertThat(result.getOutput("out")).isEqualTo(42);
                    assertThat(result.getOutcome("call").getOutputs()).containsEntry("result", 42);
                })
                .verifyComplete();

        assertThat(listener.events).containsSubsequence("flowStart:parent", "flowStart:doubler",
                "flowComplete:doubler:true", "flowComplete:parent:true");
    }

    @Test
    void boundsRecursiveWorkflowInvocations() {
        TestNodeImplementation tick = stepType("tick", TestNodeImplementation.builder("tick"));
        types.register(NodeTypeBuilder.named("callRecursive")
                .withStandardControlPorts()
                .workflow("recursive"));
        Workflow recursive = workflow("recursive")
                .addNode("tick", "tick")
                .addNode("self", "callRecursive")
                .connect("Start.execute", "tick.execute")
                .connect("tick.onSuccess", "self.execute")
                .connect("self.onSuccess", "Exit.onSuccess")
                .build();
        types.registerWorkflow(recursive);

        StepVerifier.create(engine(DEFAULT_TIMEOUT, 3).execute("recursive", null, null))
                .assertNext(result -> {
                    assertThat(result.isSucceeded()).isFalse();
                    assertThat(result.getOutcome("self").getError().get())
                            .hasMessageContaining("Workflow 'recursive' invoked by node 'self' did not succeed");
                })
                .verifyComplete();

        assertThat(tick.getInvocationCount()).isEqualTo(4);
        assertThat(listener.errors).anySatisfy(error ->
                assertThat(error).hasMessageContaining("Maximum call depth 3 exceeded"));
    }

    @Test
    void rejectsUnregisteredWorkflowName() {
        StepVerifier.create(engine().execute("nowhere", null, null))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(FlowExecutionException.class)
                        .hasMessage("Workflow 'nowhere' is not registered."))
                .verify();
    }

    @Test
    void cachesCompiledPlansPerWorkflowName() {
        TestNodeImplementation ok = stepType("ok", TestNodeImplementation.builder("ok"));
        types.registerWorkflow(workflow("cached")
                .addNode("a", "ok")
                .connect("Start.execute", "a.execute")
                .build());
        StandardFlowEngine engine = engine();

        StepVerifier.create(engine.execute("cached", null, null).then(engine.execute("cached", null, null)))
                .assertNext(result -> assertThat(result.isSucceeded()).isTrue())
                .verifyComplete();

        assertThat(ok.getInvocationCount()).isEqualTo(2);
        assertThat(engine.getCachedPlanCount()).isEqualTo(1);
        engine.invalidatePlans();
        assertThat(engine.getCachedPlanCount()).isZero();
    }

    @Test
    void collectsMergedInputInConnectionOrder() {
        stepType("one", TestNodeImplementation.builder("one").returns(TestNodeTypes.OUT, 1));
        stepType("two", TestNodeImplementation.builder("two").returns(TestNodeTypes.OUT, 2));
        types.register(NodeTypeBuilder.named("gather")
                .withStandardControlPorts()
                .mergedInput("values", "any[]", MergeStrategy.COLLECT)
                .dataOutput(TestNodeTypes.OUT, "any[]")
                .local());
        implementations.register("gather", TestNodeImplementation.builder("gather")
                .computes(inv -> NodeOutcome.success(TestNodeTypes.OUT, inv.getInput("values")))
                .build());

        Workflow wf = workflow("merging")
                .exitPort("all", "any[]")
                .addNode("a", "one")
                .addNode("b", "two")
                .addNode("c", "gather")
                .connect("Start.execute", "a.execute")
                .connect("Start.execute", "b.execute")
                .connect("a.onSuccess", "c.execute")
                .connect("b.onSuccess", "c.execute")
                .connect("b.out", "c.values")
                .connect("a.out", "c.values")
                .connect("c.out", "Exit.all")
                .build();

        StepVerifier.create(engine().execute(compile(wf), null))
                .assertNext(result -> assertThat(result.getOutput("all")).asList().containsExactly(2, 1))
                .verifyComplete();
    }

    @Test
    void reportsExitMergeFailureAsFailedResult() {
        stepType("textA", TestNodeImplementation.builder("textA").returns(TestNodeTypes.OUT, "text"));
        stepType("textB", TestNodeImplementation.builder("textB").returns(TestNodeTypes.OUT, "text"));
        stepType("number", TestNodeImplementation.builder("number").returns(TestNodeTypes.OUT, 7));

        Workflow wf = workflow("badMerge")
                .exitPort("out", "any", MergeStrategy.MERGE)
                .exitPort("count", "any")
                .addNode("a", "textA")
                .addNode("b", "textB")
                .addNode("n", "number")
                .connect("Start.execute", "a.execute")
                .connect("Start.execute", "b.execute")
                .connect("Start.execute", "n.execute")
                .connect("a.out", "Exit.out")
                .connect("b.out", "Exit.out")
                .connect("n.out", "Exit.count")
                .build();

        StepVerifier.create(engine().execute(compile(wf), null))
                .assertNext(result -> {
                    assertThat(result.isSucceeded()).isFalse();
                    assertThat(result.isFailed()).isTrue();
                    assertThat(result.hasOutput("out")).isFalse();
                    assertThat(result.getOutput("count")).isEqualTo(7);
                    assertThat(result.getError()).hasValueSatisfying(error -> assertThat(error)
                            .isInstanceOf(FlowExecutionException.class)
                            .hasMessageContaining("Exit port 'out'")
                            .hasCauseInstanceOf(IllegalArgumentException.class));
                    assertThat(result.getOutcomes().values()).allMatch(NodeOutcome::isSuccess);
                })
                .verifyComplete();

        assertThat(listener.events).contains("flowComplete:badMerge:false");
    }

    @Test
    void coercesValuesWithBuiltinCoercionNodes() {
        Workflow wf = workflow("coercing")
                .startPort("raw", "string")
                .exitPort("number", "number")
                .addNode("toNumber", BuiltinNodeTypes.coercionTypeName(CoercionKind.NUMBER))
                .connect("Start.execute", "toNumber.execute")
                .connect("Start.raw", "toNumber.value")
                .connect("toNumber.value", "Exit.number")
                .build();

        StepVerifier.create(engine().execute(compile(wf), Collections.<String, Object>singletonMap("raw", " 42 ")))
                .assertNext(result -> assertThat(result.getOutput("number")).isEqualTo(new BigDecimal("42")))
                .verifyComplete();
    }

    @Test
    void keepsRunningWhenListenerThrows() {
        stepType("ok", TestNodeImplementation.builder("ok"));
        Workflow wf = workflow("noisy")
                .addNode("a", "ok")
                .connect("Start.execute", "a.execute")
                .build();
        List<FlowMonitorListener> listeners = new ArrayList<>();
        listeners.add(new RecordingListener() {
            @Override
            public void onNodeStart(String requestId, String flowName, String instanceId, NodeType nodeType) {
                throw new IllegalStateException("listener failure");
            }
        });
        listeners.add(listener);
        StandardFlowEngine engine = new StandardFlowEngine(compiler, types, implementations, mergeResolver,
                new ObjectMapper(), DEFAULT_TIMEOUT, 8, 16, listeners);

        StepVerifier.create(engine.execute(compile(wf), null))
                .assertNext(result -> assertThat(result.getOutcome("a").isSuccess()).isTrue())
                .verifyComplete();

        assertThat(listener.events).contains("start:a", "success:a");
    }

    /**
     * 把收到的事件记录为字符串。
     */
    private static class RecordingListener implements FlowMonitorListener {
        final List<String> events = new CopyOnWriteArrayList<>();
        final List<Throwable> errors = new CopyOnWriteArrayList<>();

        @Override
        public void onFlowStart(String requestId, String flowName, ExecutionPlan plan, Map<String, Object> inputs) {
            events.add("flowStart:" + flowName);
        }

        @Override
        public void onFlowComplete(String requestId, String flowName, Duration totalDuration, boolean success,
                                   Map<String, NodeOutcome> outcomes) {
            events.add("flowComplete:" + flowName + ":" + success);
        }

        @Override
        public void onNodeStart(String requestId, String flowName, String instanceId, NodeType nodeType) {
            events.add("start:" + instanceId);
        }

        @Override
        public void onNodeSuccess(String requestId, String flowName, String instanceId, Duration duration,
                                  NodeOutcome outcome, NodeType nodeType) {
            events.add("success:" + instanceId);
        }

        @Override
        public void onNodeFailure(String requestId, String flowName, String instanceId, Duration duration,
                                  Throwable error, NodeType nodeType) {
            events.add("failure:" + instanceId + ":" + error.getClass().getSimpleName());
            errors.add(error);
        }

        @Override
        public void onNodeSkipped(String requestId, String flowName, String instanceId, NodeType nodeType) {
            events.add("skipped:" + instanceId);
        }

        @Override
        public void onNodeTimeout(String requestId, String flowName, String instanceId, Duration timeout, NodeType nodeType) {
            events.add("timeout:" + instanceId);
        }
    }
}
