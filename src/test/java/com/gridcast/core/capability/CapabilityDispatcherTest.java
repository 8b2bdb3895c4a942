package com.gridcast.core.capability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridcast.core.metrics.AgentMetrics;
import com.gridcast.core.model.ErrorKind;
import com.gridcast.core.model.InvocationOutcome;
import com.gridcast.core.model.PlannedInvocation;
import com.gridcast.core.model.ResultEnvelope;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityDispatcherTest {

    private final AtomicInteger executions = new AtomicInteger();
    private final AtomicReference<InvocationContext> lastContext = new AtomicReference<>();
    private final AtomicBoolean sideEffectApplied = new AtomicBoolean();
    private SimpleMeterRegistry meterRegistry;
    private CapabilityDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        var registry = CapabilityRegistry.of(
                new CapabilityDescriptor("get_horizon", "returns a horizon", List.of(), "map", null,
                        (args, ctx) -> {
                            executions.incrementAndGet();
                            return ResultEnvelope.ok(Map.of("horizon", 24, "points", List.of(5, 6)), "horizon");
                        }),
                new CapabilityDescriptor("echo", "echoes its arguments", List.of(
                        ParameterSpec.required("value", ParameterType.INTEGER, "value").range(0, 100)),
                        "map", null,
                        (args, ctx) -> {
                            executions.incrementAndGet();
                            return ResultEnvelope.ok(args.asMap(), "echo");
                        }),
                new CapabilityDescriptor("explode", "always throws", List.of(), "none", null,
                        (args, ctx) -> {
                            throw new IllegalStateException("kaboom");
                        }),
                new CapabilityDescriptor("fail", "returns a failure", List.of(), "none", null,
                        (args, ctx) -> ResultEnvelope.failure(ErrorKind.INSUFFICIENT_DATA, "not enough rows")),
                new CapabilityDescriptor("silent", "returns null", List.of(), "none", null,
                        (args, ctx) -> null),
                new CapabilityDescriptor("slow", "sleeps past its bound", List.of(), "none", Duration.ofMillis(100),
                        (args, ctx) -> {
                            lastContext.set(ctx);
                            Thread.sleep(2_000);
                            if (ctx.tryCommit()) {
                                sideEffectApplied.set(true);
                            }
                            return ResultEnvelope.ok("late", "late");
                        }),
                new CapabilityDescriptor("slow_commit", "commits then runs slightly long", List.of(), "none",
                        Duration.ofMillis(300),
                        (args, ctx) -> {
                            assertTrue(ctx.tryCommit());
                            Thread.sleep(450);
                            return ResultEnvelope.ok("stored", "stored");
                        }));
        meterRegistry = new SimpleMeterRegistry();
        dispatcher = new CapabilityDispatcher(registry, new ArgumentValidator(), new InvocationScheduler(),
                new DispatchProperties(), new AgentMetrics(meterRegistry), new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    @Nested
    @DisplayName("dispatch")
    class SingleDispatch {

        @Test
        @DisplayName("unknown capability is reported without executing anything")
        void unknownCapability() {
            var result = dispatcher.dispatch("S-1", "inv-1", "forecast_anything", Map.of());
            assertFalse(result.succeeded());
            assertEquals(ErrorKind.CAPABILITY_NOT_FOUND, result.result().errorKind());
            assertTrue(result.result().message().startsWith("CapabilityNotFound"));
            assertEquals(0, executions.get());
        }

        @Test
        @DisplayName("invalid arguments are rejected before execution")
        void invalidArguments() {
            var result = dispatcher.dispatch("S-1", "inv-1", "echo", Map.of("value", 500));
            assertEquals(ErrorKind.VALIDATION_FAILED, result.result().errorKind());
            assertEquals(InvocationOutcome.ERROR, result.outcome());
            assertEquals(0, executions.get());
        }

        @Test
        @DisplayName("successful invocation is recorded with duration and metrics")
        void success() {
            var result = dispatcher.dispatch("S-1", "inv-1", "echo", Map.of("value", 7));
            assertTrue(result.succeeded());
            assertEquals(InvocationOutcome.OK, result.outcome());
            assertEquals(Map.of("value", 7), result.result().data());
            assertNotNull(meterRegistry.find("gridcast.capability.duration").tag("capability", "echo").timer());
        }

        @Test
        @DisplayName("exceptions become internal capability errors")
        void exceptionsAreNormalized() {
            var result = dispatcher.dispatch("S-1", "inv-1", "explode", Map.of());
            assertEquals(ErrorKind.INTERNAL_CAPABILITY_ERROR, result.result().errorKind());
            assertTrue(result.result().message().contains("kaboom"));
        }

        @Test
        @DisplayName("a null result becomes an internal capability error")
        void nullResult() {
            var result = dispatcher.dispatch("S-1", "inv-1", "silent", Map.of());
            assertEquals(ErrorKind.INTERNAL_CAPABILITY_ERROR, result.result().errorKind());
        }

        @Test
        @DisplayName("a capability failure keeps its own error kind")
        void capabilityFailure() {
            var result = dispatcher.dispatch("S-1", "inv-1", "fail", Map.of());
            assertEquals(ErrorKind.INSUFFICIENT_DATA, result.result().errorKind());
            assertEquals(InvocationOutcome.ERROR, result.outcome());
        }

        @Test
        @DisplayName("timeout abandons the invocation so no side effect is committed")
        void timeoutAbandons() throws Exception {
            var result = dispatcher.dispatch("S-1", "inv-1", "slow", Map.of());
            assertEquals(ErrorKind.TIMEOUT, result.result().errorKind());
            assertEquals(InvocationOutcome.TIMEOUT, result.outcome());
            assertTrue(result.result().message().startsWith("TimeoutError"));
            assertTrue(lastContext.get().isAbandoned());
            assertFalse(lastContext.get().tryCommit());
            assertFalse(sideEffectApplied.get());
        }

        @Test
        @DisplayName("a committed invocation gets one more bound to report")
        void committedInvocationIsAwaited() {
            var result = dispatcher.dispatch("S-1", "inv-1", "slow_commit", Map.of());
            assertTrue(result.succeeded());
            assertEquals("stored", result.result().data());
        }
    }

    @Nested
    @DisplayName("dispatchAll")
    class PlanDispatch {

        @Test
        @DisplayName("references resolve against earlier results and order follows the plan")
        void resolvesReferences() {
            var plan = List.of(
                    new PlannedInvocation("b", "echo", Map.of("value", "$ref:a.horizon"), List.of()),
                    new PlannedInvocation("a", "get_horizon", Map.of(), List.of()),
                    new PlannedInvocation("c", "echo", Map.of("value", "$ref:a.points.1"), List.of()));

            var results = dispatcher.dispatchAll("S-1", plan);

            assertEquals(List.of("b", "a", "c"), results.stream().map(r -> r.invocationId()).toList());
            assertTrue(results.get(0).succeeded());
            assertEquals(24, results.get(0).arguments().get("value"));
            assertEquals(6, results.get(2).arguments().get("value"));
        }

        @Test
        @DisplayName("all invocations are attempted and a reference to a failure is not executed")
        void referenceToFailure() {
            var plan = List.of(
                    new PlannedInvocation("a", "fail", Map.of(), List.of()),
                    new PlannedInvocation("b", "echo", Map.of("value", "$ref:a.rows"), List.of()),
                    new PlannedInvocation("c", "echo", Map.of("value", 3), List.of()));

            var results = dispatcher.dispatchAll("S-1", plan);

            assertEquals(3, results.size());
            assertEquals(ErrorKind.INSUFFICIENT_DATA, results.get(0).result().errorKind());
            assertEquals(ErrorKind.VALIDATION_FAILED, results.get(1).result().errorKind());
            assertTrue(results.get(2).succeeded());
            assertEquals(1, executions.get());
        }

        @Test
        @DisplayName("an unschedulable plan fails every invocation")
        void cycle() {
            var plan = List.of(
                    new PlannedInvocation("a", "echo", Map.of("value", 1), List.of("b")),
                    new PlannedInvocation("b", "echo", Map.of("value", 2), List.of("a")));

            var results = dispatcher.dispatchAll("S-1", plan);

            assertTrue(results.stream().allMatch(r -> r.result().errorKind() == ErrorKind.VALIDATION_FAILED));
            assertEquals(0, executions.get());
        }
    }
}
