package com.herzen.tracing.transfer;

import com.herzen.tracing.domain.DomainModels;
import com.herzen.tracing.mastery.BayesianMasteryUpdater;
import com.herzen.tracing.mastery.KnowledgeStateLocks;
import com.herzen.tracing.mastery.ParameterResolver;
import com.herzen.tracing.store.DependencyFallbackMetrics;
import com.herzen.tracing.store.KnowledgeStateStore;
import com.herzen.tracing.store.StoreCallGuard;
import com.herzen.tracing.store.StoreCallGuard.Guarded;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class TransferLearningService {
    private static final Logger log = LoggerFactory.getLogger(TransferLearningService.class);
    private static final String DEPENDENCY = "knowledge-state-store";

    private final TransferGraph graph;
    private final KnowledgeStateStore stateStore;
    private final KnowledgeStateLocks locks;
    private final StoreCallGuard guard;
    private final ParameterResolver parameters;
    private final BayesianMasteryUpdater updater;
    private final DependencyFallbackMetrics metrics;

    public TransferLearningService(TransferGraph graph, KnowledgeStateStore stateStore, KnowledgeStateLocks locks,
                                   StoreCallGuard guard, ParameterResolver parameters, BayesianMasteryUpdater updater,
                                   DependencyFallbackMetrics metrics) {
        this.graph = graph;
        this.stateStore = stateStore;
        this.locks = locks;
        this.guard = guard;
        this.parameters = parameters;
        this.updater = updater;
        this.metrics = metrics;
    }

    public List<TransferModels.TransferUpdate> propagate(String studentId, String sourceConceptId, double before, double after) {
        double delta = after - before;
        Map<String, Double> neighbours = graph.neighbours(sourceConceptId);
        if (delta == 0.0 || neighbours.isEmpty()) return List.of();

        List<TransferModels.TransferUpdate> updates = new ArrayList<>();
        for (var e : neighbours.entrySet()) {
            String target = e.getKey();
            double weight = e.getValue();
            updates.add(locks.withLock(studentId, target, () -> apply(studentId, target, weight, delta)));
        }
        return updates;
    }

    private TransferModels.TransferUpdate apply(String studentId, String target, double weight, double delta) {
        Guarded<Optional<DomainModels.KnowledgeState>> read = guard.call(DEPENDENCY, () -> stateStore.find(studentId, target), Optional::empty);
        if (read.degraded()) {
            return new TransferModels.TransferUpdate(target, weight, null, null, false);
        }
        DomainModels.KnowledgeState current = read.value().orElseGet(() -> {
            DomainModels.ConceptParameters params = parameters.resolve(target);
            return DomainModels.KnowledgeState.initial(studentId, target, updater.initialPrior(params));
        });
        double previous = current.masteryProbability();
        double next = Math.max(0.0, Math.min(1.0, previous + weight * delta * graph.factor()));
        try {
            stateStore.save(current.withMastery(next));
        } catch (DataAccessException ex) {
            log.warn("Transfer write failed for {}/{}: {}", studentId, target, ex.getMessage());
            metrics.increment(DEPENDENCY, "write-failure");
            return new TransferModels.TransferUpdate(target, weight, previous, previous, false);
        }
        log.debug("transfer {} -> {}/{}: {} -> {}", delta, studentId, target, previous, next);
        return new TransferModels.TransferUpdate(target, weight, previous, next, true);
    }
}
