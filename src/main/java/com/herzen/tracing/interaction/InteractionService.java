package com.herzen.tracing.interaction;

import com.herzen.tracing.calibration.CalibrationService;
import com.herzen.tracing.domain.DomainModels;
import com.herzen.tracing.error.ValidationException;
import com.herzen.tracing.exam.ExamCatalog;
import com.herzen.tracing.fairness.FairnessMonitor;
import com.herzen.tracing.load.CognitiveLoadEstimator;
import com.herzen.tracing.load.LoadModels;
import com.herzen.tracing.mastery.MasteryModels;
import com.herzen.tracing.mastery.MasteryService;
import com.herzen.tracing.pacing.PacingModels;
import com.herzen.tracing.pacing.PacingService;
import com.herzen.tracing.pacing.TimeAllocationPolicy;
import com.herzen.tracing.store.InteractionEventSink;
import com.herzen.tracing.store.StoreCallGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;

@Service
public class InteractionService {
    private static final Logger log = LoggerFactory.getLogger(InteractionService.class);
    static final String EVENT_DEPENDENCY = "interaction-event-sink";

    private final CognitiveLoadEstimator loadEstimator;
    private final MasteryService masteryService;
    private final PacingService pacingService;
    private final CalibrationService calibrationService;
    private final FairnessMonitor fairnessMonitor;
    private final ExamCatalog exams;
    private final InteractionEventSink eventSink;
    private final StoreCallGuard guard;

    public InteractionService(CognitiveLoadEstimator loadEstimator, MasteryService masteryService,
                              PacingService pacingService, CalibrationService calibrationService,
                              FairnessMonitor fairnessMonitor, ExamCatalog exams, InteractionEventSink eventSink,
                              StoreCallGuard guard) {
        this.loadEstimator = loadEstimator;
        this.masteryService = masteryService;
        this.pacingService = pacingService;
        this.calibrationService = calibrationService;
        this.fairnessMonitor = fairnessMonitor;
        this.exams = exams;
        this.eventSink = eventSink;
        this.guard = guard;
    }

    public InteractionModels.InteractionOutcome submit(InteractionModels.InteractionRequest request) {
        validate(request);
        List<String> concepts = new ArrayList<>(new LinkedHashSet<>(request.conceptIds()));
        concepts.forEach(masteryService::checkParameters);

        List<Double> masteries = concepts.stream()
                .map(c -> masteryService.currentMastery(request.studentId(), c).masteryProbability())
                .toList();
        LoadModels.LoadAssessment load = loadEstimator.assess(request.signals(), request.device(),
                new LoadModels.ProblemComplexity(request.solutionSteps(), masteries, request.prerequisiteGap()), request.session());

        Instant now = Instant.now();
        MasteryModels.UpdateContext ctx = new MasteryModels.UpdateContext(load.stress(), request.signals().responseTimeMs(), now);
        List<MasteryModels.MasteryUpdateResult> results = concepts.stream()
                .map(c -> masteryService.updateMastery(request.studentId(), c, request.correct(), ctx))
                .toList();
        MasteryModels.MasteryUpdateResult primary = results.get(0);
        boolean degraded = results.stream().anyMatch(MasteryModels.MasteryUpdateResult::degraded);

        double calibrated = calibrationService.apply(request.examCode(), request.subject(), primary.predictedCorrect());

        PacingModels.TimeAllocation next = null;
        if (request.nextQuestion() != null) {
            boolean reduce = load.preferDifficultyReduction() || results.stream().anyMatch(MasteryModels.MasteryUpdateResult::recovery);
            next = pacingService.allocateTime(request.studentId(), request.nextQuestion(), request.examCode(),
                    new PacingModels.PacingContext(load.stress(), load.fatigue(), request.session().sessionElapsedMs(), request.device(), reduce));
        }

        boolean grouped = request.demographicGroup() != null && !request.demographicGroup().isBlank();
        if (grouped && primary.degraded()) {
            log.info("Skipping fairness sample for {}: mastery update of {} is degraded",
                    request.studentId(), primary.conceptId());
        } else if (grouped) {
            fairnessMonitor.record(request.examCode(), request.subject(), request.demographicGroup(), primary.newMastery());
        }

        DomainModels.InteractionEvent event = new DomainModels.InteractionEvent(UUID.randomUUID().toString(), request.studentId(), concepts,
                request.correct(), request.signals().responseTimeMs(), request.examCode(), request.subject(),
                request.device().deviceType(), request.device().networkQuality(), load.stress(), load.intrinsicLoad(),
                load.extraneousLoad(), load.totalLoad(), primary.predictedCorrect(), primary.previousMastery(),
                primary.newMastery(), degraded, request.demographicGroup(), now);
        boolean logged = guard.run(EVENT_DEPENDENCY, () -> eventSink.append(event));
        log.debug("interaction {} for {}: stress={} load={} p'={}", event.eventId(), request.studentId(),
                load.stress(), load.totalLoad(), primary.newMastery());

        return new InteractionModels.InteractionOutcome(event.eventId(), load, results, primary.predictedCorrect(), calibrated, next,
                exams.scoreDelta(request.examCode(), request.correct()), logged);
    }

    private void validate(InteractionModels.InteractionRequest request) {
        if (request == null) throw new ValidationException("request is required");
        if (request.studentId() == null || request.studentId().isBlank()) throw new ValidationException("studentId must not be blank");
        exams.require(request.examCode());
        if (request.subject() == null || request.subject().isBlank()) throw new ValidationException("subject must not be blank");
        if (request.conceptIds() == null || request.conceptIds().isEmpty()) {
            throw new ValidationException("at least one concept id is required");
        }
        if (request.conceptIds().stream().anyMatch(c -> c == null || c.isBlank())) {
            throw new ValidationException("concept ids must not be blank");
        }
        if (request.signals() == null || request.device() == null || request.session() == null) {
            throw new ValidationException("signals, device and session are required");
        }
        if (request.nextQuestion() != null) TimeAllocationPolicy.validateQuestion(request.nextQuestion());
    }
}
