package com.gridcast.core.engine;

import com.gridcast.core.capability.ArgumentValidator;
import com.gridcast.core.capability.CapabilityDescriptor;
import com.gridcast.core.capability.CapabilityRegistry;
import com.gridcast.core.capability.InvocationScheduler;
import com.gridcast.core.model.PlannedInvocation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Checks an oracle plan against the registry's contracts before anything runs.
 */
@Component
public class PlanValidator {

    private final CapabilityRegistry registry;
    private final ArgumentValidator argumentValidator;
    private final InvocationScheduler scheduler;

    public PlanValidator(CapabilityRegistry registry, ArgumentValidator argumentValidator,
                         InvocationScheduler scheduler) {
        this.registry = registry;
        this.argumentValidator = argumentValidator;
        this.scheduler = scheduler;
    }

    /**
     * Result of validating a plan.
     *
     * @param plan   the plan with ids assigned to every invocation
     * @param errors problems found; empty when the plan may be executed
     */
    public record Validation(List<PlannedInvocation> plan, List<String> errors) {

        public Validation {
            plan = List.copyOf(plan);
            errors = List.copyOf(errors);
        }

        public boolean isValid() {
            return errors.isEmpty();
        }
    }

    public Validation validate(List<PlannedInvocation> proposed) {
        var errors = new ArrayList<String>();
        if (proposed == null || proposed.isEmpty()) {
            errors.add("Plan contains no invocations");
            return new Validation(List.of(), errors);
        }

        var plan = new ArrayList<PlannedInvocation>(proposed.size());
        var ids = new HashSet<String>();
        for (int i = 0; i < proposed.size(); i++) {
            PlannedInvocation invocation = proposed.get(i);
            if (invocation == null) {
                errors.add("Invocation #" + (i + 1) + " is empty");
                continue;
            }
            if (invocation.id() == null || invocation.id().isBlank()) {
                invocation = invocation.withId("inv-" + (i + 1));
            }
            if (!ids.add(invocation.id())) {
                errors.add("Duplicate invocation id '" + invocation.id() + "'");
            }
            plan.add(invocation);
        }

        for (PlannedInvocation invocation : plan) {
            if (invocation.capability() == null || invocation.capability().isBlank()) {
                errors.add(invocation.id() + ": capability name is missing");
                continue;
            }
            Optional<CapabilityDescriptor> descriptor = registry.find(invocation.capability());
            if (descriptor.isEmpty()) {
                errors.add(invocation.id() + ": CapabilityNotFound: '" + invocation.capability()
                        + "' is not a registered capability");
                continue;
            }
            argumentValidator.validate(descriptor.get(), invocation.arguments(), true)
                    .forEach(error -> errors.add(invocation.id() + ": " + error));
        }

        if (errors.isEmpty()) {
            try {
                scheduler.computeWaves(plan);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        return new Validation(plan, errors);
    }
}
