package com.herzen.tracing.mastery;

import com.herzen.tracing.domain.DomainModels;
import com.herzen.tracing.error.ValidationException;
import com.herzen.tracing.store.DependencyFallbackMetrics;
import com.herzen.tracing.store.KnowledgeStateStore;
import com.herzen.tracing.store.StoreCallGuard;
import com.herzen.tracing.store.StoreCallGuard.Guarded;
import com.herzen.tracing.transfer.TransferLearningService;
import com.herzen.tracing.transfer.TransferModels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class MasteryService {
    private static final Logger log = LoggerFactory.getLogger(MasteryService.class);
    public static final String STATE_DEPENDENCY = "knowledge-state-store";

    private final BayesianMasteryUpdater updater;
    private final ParameterResolver parameters;
    private final KnowledgeStateStore stateStore;
    private final StoreCallGuard guard;
    private final KnowledgeStateLocks locks;
    private final TransferLearningService transfer;
    private final DependencyFallbackMetrics metrics;

    public MasteryService(BayesianMasteryUpdater updater, ParameterResolver parameters, KnowledgeStateStore stateStore,
                          StoreCallGuard guard, KnowledgeStateLocks locks, TransferLearningService transfer,
                          DependencyFallbackMetrics metrics) {
        this.updater = updater;
        this.parameters = parameters;
        this.stateStore = stateStore;
        this.guard = guard;
        this.locks = locks;
        this.transfer = transfer;
        this.metrics = metrics;
    }

    public MasteryModels.MasteryUpdateResult updateMastery(String studentId, String conceptId, boolean correct, MasteryModels.UpdateContext ctx) {
        requireKey("studentId", studentId);
        requireKey("conceptId", conceptId);
        DomainModels.ConceptParameters params = checkParameters(conceptId);

        Step step = locks.withLock(studentId, conceptId, () -> {
            Guarded<DomainModels.KnowledgeState> read = readState(studentId, conceptId, params);
            MasteryModels.UpdateOutcome outcome = updater.update(read.value(), params, correct, ctx);
            boolean persisted = !read.degraded() && save(outcome.state());
            return new Step(read.value().masteryProbability(), outcome, read.degraded(), persisted);
        });

        MasteryModels.UpdateOutcome outcome = step.outcome();
        List<TransferModels.TransferUpdate> transfers = step.degraded()
                ? List.of()
                : transfer.propagate(studentId, conceptId, step.previous(), outcome.state().masteryProbability());
        if (outcome.recovery()) {
            log.info("Recovery mode for {}/{}: mastery {} after {} incorrect", studentId, conceptId,
                    outcome.state().masteryProbability(), outcome.state().incorrectStreak());
        }
        DomainModels.KnowledgeState s = outcome.state();
        return new MasteryModels.MasteryUpdateResult(studentId, conceptId, step.previous(), s.masteryProbability(), s.practiceCount(),
                s.incorrectStreak(), outcome.recovery(), outcome.predictedCorrect(), outcome.effectiveSlip(),
                outcome.effectiveGuess(), outcome.confidence(), step.degraded() || !step.persisted(), transfers);
    }

    public DomainModels.ConceptParameters checkParameters(String conceptId) {
        DomainModels.ConceptParameters params = parameters.resolve(conceptId);
        updater.validateParameters(params);
        return params;
    }

    public MasteryModels.MasteryView currentMastery(String studentId, String conceptId) {
        requireKey("studentId", studentId);
        requireKey("conceptId", conceptId);
        DomainModels.ConceptParameters params = parameters.resolve(conceptId);
        Guarded<Optional<DomainModels.KnowledgeState>> read = guard.call(STATE_DEPENDENCY,
                () -> stateStore.find(studentId, conceptId), Optional::empty);
        return read.value()
                .map(s -> new MasteryModels.MasteryView(studentId, conceptId, s.masteryProbability(), s.practiceCount(),
                        s.incorrectStreak(), s.lastPracticed(), true))
                .orElseGet(() -> new MasteryModels.MasteryView(studentId, conceptId, updater.initialPrior(params), 0, 0, null, false));
    }

    private Guarded<DomainModels.KnowledgeState> readState(String studentId, String conceptId, DomainModels.ConceptParameters params) {
        DomainModels.KnowledgeState fresh = DomainModels.KnowledgeState.initial(studentId, conceptId, updater.initialPrior(params));
        return guard.call(STATE_DEPENDENCY,
                () -> stateStore.find(studentId, conceptId).orElse(fresh),
                () -> fresh);
    }

    private boolean save(DomainModels.KnowledgeState state) {
        try {
            stateStore.save(state);
            return true;
        } catch (DataAccessException ex) {
            log.warn("Knowledge state write failed for {}/{}: {}", state.studentId(), state.conceptId(), ex.getMessage());
            metrics.increment(STATE_DEPENDENCY, "write-failure");
            return false;
        }
    }

    private static void requireKey(String name, String value) {
        if (value == null || value.isBlank()) throw new ValidationException(name + " must not be blank");
    }

    private record Step(double previous, MasteryModels.UpdateOutcome outcome, boolean degraded, boolean persisted) {}
}
