package com.gridcast.core.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridcast.core.logging.MdcContext;
import com.gridcast.core.metrics.AgentMetrics;
import com.gridcast.core.model.CapabilityInvocation;
import com.gridcast.core.model.ErrorKind;
import com.gridcast.core.model.InvocationOutcome;
import com.gridcast.core.model.PlannedInvocation;
import com.gridcast.core.model.ResultEnvelope;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Validates, executes and normalizes capability invocations.
 * <p>
 * Nothing thrown by a capability crosses this boundary: unknown names, invalid arguments,
 * timeouts and unexpected exceptions all come back as a failed {@link ResultEnvelope}
 * inside a {@link CapabilityInvocation}. Invocations that fail validation are never executed.
 */
@Service
public class CapabilityDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CapabilityDispatcher.class);

    private final CapabilityRegistry registry;
    private final ArgumentValidator validator;
    private final InvocationScheduler scheduler;
    private final DispatchProperties properties;
    private final AgentMetrics metrics;
    private final ObjectMapper objectMapper;

    private final ExecutorService capabilityExecutor = Executors.newCachedThreadPool(daemonThreads("gridcast-capability"));
    private final ExecutorService waveExecutor;

    public CapabilityDispatcher(CapabilityRegistry registry,
                                ArgumentValidator validator,
                                InvocationScheduler scheduler,
                                DispatchProperties properties,
                                AgentMetrics metrics,
                                ObjectMapper objectMapper) {
        this.registry = registry;
        this.validator = validator;
        this.scheduler = scheduler;
        this.properties = properties;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.waveExecutor = properties.getMaxParallel() > 1
                ? Executors.newFixedThreadPool(properties.getMaxParallel(), daemonThreads("gridcast-wave"))
                : null;
    }

    /**
     * Dispatches a single invocation with literal arguments.
     */
    public CapabilityInvocation dispatch(String sessionId, String invocationId, String capabilityName,
                                         Map<String, Object> arguments) {
        return execute(sessionId, invocationId, capabilityName, arguments);
    }

    /**
     * Dispatches every invocation of a plan. All invocations are attempted even when some fail;
     * the returned list follows the planned order.
     * <p>
     * Invocations run in dependency waves. Within a wave they run one at a time unless
     * {@code gridcast.dispatch.max-parallel} is above 1. An invocation referencing a failed
     * invocation's result is reported as {@link ErrorKind#VALIDATION_FAILED} without executing.
     */
    public List<CapabilityInvocation> dispatchAll(String sessionId, List<PlannedInvocation> plan) {
        List<List<PlannedInvocation>> waves;
        try {
            waves = scheduler.computeWaves(plan);
        } catch (IllegalArgumentException e) {
            log.warn("Plan for session {} cannot be scheduled: {}", sessionId, e.getMessage());
            return plan.stream()
                    .map(p -> rejected(p.id(), p.capability(), p.arguments(), ErrorKind.VALIDATION_FAILED,
                            "ValidationFailed: " + e.getMessage()))
                    .toList();
        }

        var completed = new ConcurrentHashMap<String, CapabilityInvocation>();
        for (var wave : waves) {
            if (waveExecutor != null && wave.size() > 1) {
                Map<String, String> mdc = MDC.getCopyOfContextMap();
                var futures = wave.stream()
                        .map(p -> CompletableFuture.supplyAsync(() -> {
                            if (mdc != null) {
                                MDC.setContextMap(mdc);
                            }
                            try {
                                return resolveAndExecute(sessionId, p, completed);
                            } finally {
                                MDC.clear();
                            }
                        }, waveExecutor))
                        .toList();
                for (int i = 0; i < wave.size(); i++) {
                    completed.put(wave.get(i).id(), futures.get(i).join());
                }
            } else {
                for (var planned : wave) {
                    completed.put(planned.id(), resolveAndExecute(sessionId, planned, completed));
                }
            }
        }
        return plan.stream().map(p -> completed.get(p.id())).toList();
    }

    @PreDestroy
    public void shutdown() {
        capabilityExecutor.shutdownNow();
        if (waveExecutor != null) {
            waveExecutor.shutdownNow();
        }
    }

    private CapabilityInvocation resolveAndExecute(String sessionId, PlannedInvocation planned,
                                                   Map<String, CapabilityInvocation> completed) {
        Map<String, Object> resolved;
        try {
            resolved = resolveReferences(planned.arguments(), completed);
        } catch (IllegalArgumentException e) {
            log.warn("Invocation {} ({}) not executed: {}", planned.id(), planned.capability(), e.getMessage());
            return rejected(planned.id(), planned.capability(), planned.arguments(), ErrorKind.VALIDATION_FAILED,
                    "ValidationFailed: " + e.getMessage());
        }
        return execute(sessionId, planned.id(), planned.capability(), resolved);
    }

    private CapabilityInvocation execute(String sessionId, String invocationId, String capabilityName,
                                         Map<String, Object> arguments) {
        var descriptor = registry.find(capabilityName);
        if (descriptor.isEmpty()) {
            log.warn("Capability '{}' is not registered", capabilityName);
            return rejected(invocationId, capabilityName, arguments, ErrorKind.CAPABILITY_NOT_FOUND,
                    "CapabilityNotFound: no capability named '" + capabilityName + "'");
        }
        var capability = descriptor.get();

        List<String> errors = validator.validate(capability, arguments, false);
        if (!errors.isEmpty()) {
            log.warn("Invocation {} of {} failed validation: {}", invocationId, capabilityName, errors);
            return rejected(invocationId, capabilityName, arguments, ErrorKind.VALIDATION_FAILED,
                    "ValidationFailed: " + String.join("; ", errors));
        }

        var context = new InvocationContext(sessionId, invocationId, capabilityName);
        Duration timeout = properties.timeoutFor(capability);
        long start = System.nanoTime();
        ResultEnvelope envelope = executeBounded(capability, new CapabilityArguments(arguments), context, timeout);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        InvocationOutcome outcome = outcomeOf(envelope);
        metrics.recordCapabilityExecution(capabilityName, outcome.name().toLowerCase(), elapsed.toMillis());
        if (envelope.success()) {
            log.info("Capability {} ({}) ok in {}ms: {}", capabilityName, invocationId, elapsed.toMillis(),
                    envelope.message());
        } else {
            log.warn("Capability {} ({}) {} in {}ms: {}", capabilityName, invocationId, envelope.errorKind(),
                    elapsed.toMillis(), envelope.message());
        }
        return new CapabilityInvocation(invocationId, capabilityName, arguments, envelope, elapsed, outcome);
    }

    private ResultEnvelope executeBounded(CapabilityDescriptor capability, CapabilityArguments arguments,
                                          InvocationContext context, Duration timeout) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<ResultEnvelope> future = capabilityExecutor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            MdcContext.setCapability(capability.name());
            try {
                return capability.executor().execute(arguments, context);
            } finally {
                MDC.clear();
            }
        });

        try {
            return checked(capability, future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            if (context.abandon()) {
                future.cancel(true);
                return ResultEnvelope.failure(ErrorKind.TIMEOUT,
                        "TimeoutError: " + capability.name() + " did not finish within " + timeout.toSeconds() + "s",
                        Map.of("timeoutSeconds", timeout.toSeconds()));
            }
            // side effects were already committed; give the capability one more bound to report them
            log.warn("{} exceeded {}s after committing side effects, waiting once more",
                    capability.name(), timeout.toSeconds());
            return awaitCommitted(capability, future, timeout);
        } catch (ExecutionException e) {
            context.abandon();
            return internalError(capability, e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.abandon();
            future.cancel(true);
            return ResultEnvelope.failure(ErrorKind.ABORTED,
                    capability.name() + " was interrupted before completing");
        }
    }

    private ResultEnvelope awaitCommitted(CapabilityDescriptor capability, Future<ResultEnvelope> future,
                                          Duration timeout) {
        try {
            return checked(capability, future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            return ResultEnvelope.failure(ErrorKind.TIMEOUT,
                    "TimeoutError: " + capability.name() + " committed its work but did not report a result within "
                            + (2 * timeout.toSeconds()) + "s",
                    Map.of("timeoutSeconds", timeout.toSeconds(), "committed", true));
        } catch (ExecutionException e) {
            return internalError(capability, e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ResultEnvelope.failure(ErrorKind.ABORTED,
                    capability.name() + " was interrupted before completing");
        }
    }

    private ResultEnvelope checked(CapabilityDescriptor capability, ResultEnvelope envelope) {
        if (envelope == null) {
            return ResultEnvelope.failure(ErrorKind.INTERNAL_CAPABILITY_ERROR,
                    "InternalCapabilityError: " + capability.name() + " returned no result");
        }
        return envelope;
    }

    private ResultEnvelope internalError(CapabilityDescriptor capability, Throwable cause) {
        log.error("Capability {} failed unexpectedly", capability.name(), cause);
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return ResultEnvelope.failure(ErrorKind.INTERNAL_CAPABILITY_ERROR,
                "InternalCapabilityError: " + capability.name() + " failed: " + detail,
                Map.of("exception", cause.getClass().getName()));
    }

    private static CapabilityInvocation rejected(String invocationId, String capabilityName,
                                                 Map<String, Object> arguments, ErrorKind kind, String message) {
        var envelope = ResultEnvelope.failure(kind, message);
        return new CapabilityInvocation(invocationId, capabilityName, arguments, envelope, Duration.ZERO,
                InvocationOutcome.ERROR);
    }

    private static InvocationOutcome outcomeOf(ResultEnvelope envelope) {
        if (envelope.success()) {
            return InvocationOutcome.OK;
        }
        return envelope.errorKind() == ErrorKind.TIMEOUT ? InvocationOutcome.TIMEOUT : InvocationOutcome.ERROR;
    }

    // --- $ref resolution ---

    private Map<String, Object> resolveReferences(Map<String, Object> arguments,
                                                  Map<String, CapabilityInvocation> completed) {
        var resolved = new LinkedHashMap<String, Object>();
        for (var entry : arguments.entrySet()) {
            resolved.put(entry.getKey(), resolveValue(entry.getValue(), completed));
        }
        return resolved;
    }

    private Object resolveValue(Object value, Map<String, CapabilityInvocation> completed) {
        if (ArgumentValidator.isReference(value)) {
            return resolveReference((String) value, completed);
        }
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<Object, Object>();
            map.forEach((k, v) -> copy.put(k, resolveValue(v, completed)));
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            var copy = new ArrayList<>();
            collection.forEach(v -> copy.add(resolveValue(v, completed)));
            return copy;
        }
        return value;
    }

    private Object resolveReference(String reference, Map<String, CapabilityInvocation> completed) {
        String id = InvocationScheduler.referencedId(reference);
        var source = completed.get(id);
        if (source == null) {
            throw new IllegalArgumentException("reference " + reference + " points to an invocation that has not run");
        }
        if (!source.succeeded()) {
            throw new IllegalArgumentException("reference " + reference + " points to failed invocation " + id);
        }
        String body = reference.substring(PlannedInvocation.REFERENCE_PREFIX.length());
        int dot = body.indexOf('.');
        JsonNode node = objectMapper.valueToTree(source.result().data());
        if (dot >= 0) {
            for (String segment : body.substring(dot + 1).split("\\.")) {
                node = node.isArray() && segment.chars().allMatch(Character::isDigit)
                        ? node.path(Integer.parseInt(segment))
                        : node.path(segment);
            }
        }
        if (node.isMissingNode() || node.isNull()) {
            throw new IllegalArgumentException("reference " + reference + " resolves to nothing");
        }
        try {
            return objectMapper.treeToValue(node, Object.class);
        } catch (Exception e) {
            throw new IllegalArgumentException("reference " + reference + " cannot be converted: " + e.getMessage());
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
