package com.gridcast.core.capability;

import com.gridcast.core.model.PlannedInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orders the invocations of one plan into dependency waves.
 * <p>
 * An invocation depends on every id listed in its {@code dependsOn} and on every
 * invocation its arguments reference with {@code $ref:}. A wave holds invocations whose
 * dependencies all sit in earlier waves; within a wave the planned order is kept.
 */
@Component
public class InvocationScheduler {

    private static final Logger log = LoggerFactory.getLogger(InvocationScheduler.class);

    /**
     * @throws IllegalArgumentException if an invocation depends on an unknown id or the
     *                                  dependencies form a cycle
     */
    public List<List<PlannedInvocation>> computeWaves(List<PlannedInvocation> invocations) {
        var ids = new HashSet<String>();
        for (var invocation : invocations) {
            ids.add(invocation.id());
        }
        for (var invocation : invocations) {
            for (String dep : dependenciesOf(invocation)) {
                if (!ids.contains(dep)) {
                    throw new IllegalArgumentException(
                            "Invocation " + invocation.id() + " depends on unknown invocation '" + dep + "'");
                }
                if (dep.equals(invocation.id())) {
                    throw new IllegalArgumentException("Invocation " + invocation.id() + " depends on itself");
                }
            }
        }

        var waves = new ArrayList<List<PlannedInvocation>>();
        var completed = new HashSet<String>();
        var remaining = new ArrayList<>(invocations);
        while (!remaining.isEmpty()) {
            var wave = new ArrayList<PlannedInvocation>();
            for (var invocation : remaining) {
                if (completed.containsAll(dependenciesOf(invocation))) {
                    wave.add(invocation);
                }
            }
            if (wave.isEmpty()) {
                throw new IllegalArgumentException("Dependency cycle among invocations "
                        + remaining.stream().map(PlannedInvocation::id).toList());
            }
            remaining.removeAll(wave);
            wave.forEach(i -> completed.add(i.id()));
            waves.add(List.copyOf(wave));
        }
        log.debug("Scheduled {} invocations into {} waves", invocations.size(), waves.size());
        return waves;
    }

    public Set<String> dependenciesOf(PlannedInvocation invocation) {
        var deps = new LinkedHashSet<String>(invocation.dependsOn());
        collectReferences(invocation.arguments().values(), deps);
        return deps;
    }

    /**
     * Extracts the invocation id from a {@code $ref:<id>[.<path>]} value.
     */
    public static String referencedId(String reference) {
        String body = reference.substring(PlannedInvocation.REFERENCE_PREFIX.length());
        int dot = body.indexOf('.');
        return dot < 0 ? body : body.substring(0, dot);
    }

    private static void collectReferences(Collection<?> values, Set<String> into) {
        for (Object value : values) {
            if (ArgumentValidator.isReference(value)) {
                into.add(referencedId((String) value));
            } else if (value instanceof Map<?, ?> map) {
                collectReferences(map.values(), into);
            } else if (value instanceof Collection<?> collection) {
                collectReferences(collection, into);
            }
        }
    }
}
