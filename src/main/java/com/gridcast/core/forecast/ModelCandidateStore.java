package com.gridcast.core.forecast;

import com.gridcast.core.model.ModelKind;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Holds trained candidates per target, keeping the most recent {@code retentionPerKind}
 * of each kind, and remembers which candidate was last selected for each target.
 * <p>
 * All methods are synchronized; per-target ordering of train/select/forecast sequences is
 * the responsibility of {@link ForecastModelManager}'s target locks.
 */
@Component
public class ModelCandidateStore {

    private final int retentionPerKind;
    private final Map<String, Map<ModelKind, Deque<ModelCandidate>>> candidates = new HashMap<>();
    private final Map<String, String> selected = new HashMap<>();

    public ModelCandidateStore(ForecastProperties properties) {
        this(properties.getRetentionPerKind());
    }

    public ModelCandidateStore(int retentionPerKind) {
        if (retentionPerKind < 1) {
            throw new IllegalArgumentException("retentionPerKind must be at least 1");
        }
        this.retentionPerKind = retentionPerKind;
    }

    /**
     * Stores a candidate and returns any candidates evicted to honour the retention limit.
     */
    public synchronized List<ModelCandidate> add(ModelCandidate candidate) {
        var byKind = candidates.computeIfAbsent(candidate.target(), t -> new EnumMap<>(ModelKind.class));
        var deque = byKind.computeIfAbsent(candidate.kind(), k -> new ArrayDeque<>());
        deque.addLast(candidate);
        var evicted = new ArrayList<ModelCandidate>();
        while (deque.size() > retentionPerKind) {
            ModelCandidate old = deque.removeFirst();
            evicted.add(old);
            if (old.id().equals(selected.get(old.target()))) {
                selected.remove(old.target());
            }
        }
        return evicted;
    }

    public synchronized boolean contains(ModelCandidate candidate) {
        var byKind = candidates.get(candidate.target());
        if (byKind == null) {
            return false;
        }
        var deque = byKind.get(candidate.kind());
        return deque != null && deque.stream().anyMatch(c -> c.id().equals(candidate.id()));
    }

    public synchronized Optional<ModelCandidate> find(String target, String candidateId) {
        return candidates(target).stream().filter(c -> c.id().equals(candidateId)).findFirst();
    }

    /**
     * Latest candidate of a kind for a target.
     */
    public synchronized Optional<ModelCandidate> latest(String target, ModelKind kind) {
        var byKind = candidates.get(target);
        if (byKind == null || byKind.get(kind) == null || byKind.get(kind).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(byKind.get(kind).peekLast());
    }

    /**
     * Latest candidate of every kind for a target, in {@link ModelKind} order.
     */
    public synchronized List<ModelCandidate> latestPerKind(String target) {
        var result = new ArrayList<ModelCandidate>();
        var byKind = candidates.get(target);
        if (byKind != null) {
            byKind.values().stream()
                    .filter(d -> !d.isEmpty())
                    .map(Deque::peekLast)
                    .forEach(result::add);
        }
        return result;
    }

    /**
     * All retained candidates for a target, oldest first within each kind.
     */
    public synchronized List<ModelCandidate> candidates(String target) {
        var result = new ArrayList<ModelCandidate>();
        var byKind = candidates.get(target);
        if (byKind != null) {
            byKind.values().forEach(result::addAll);
        }
        return result;
    }

    public synchronized void select(ModelCandidate candidate) {
        selected.put(candidate.target(), candidate.id());
    }

    public synchronized Optional<ModelCandidate> selected(String target) {
        String id = selected.get(target);
        return id == null ? Optional.empty() : find(target, id);
    }

    public synchronized Set<String> targets() {
        return new TreeSet<>(candidates.keySet());
    }

    public int retentionPerKind() {
        return retentionPerKind;
    }
}
