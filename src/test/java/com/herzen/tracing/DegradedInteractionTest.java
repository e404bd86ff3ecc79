package com.herzen.tracing;

import com.herzen.tracing.calibration.CalibrationService;
import com.herzen.tracing.config.EngineProperties;
import com.herzen.tracing.domain.DomainModels;
import com.herzen.tracing.exam.ExamCatalog;
import com.herzen.tracing.fairness.FairnessMonitor;
import com.herzen.tracing.interaction.InteractionModels;
import com.herzen.tracing.interaction.InteractionService;
import com.herzen.tracing.load.CognitiveLoadEstimator;
import com.herzen.tracing.load.LoadModels;
import com.herzen.tracing.mastery.*;
import com.herzen.tracing.pacing.PacingService;
import com.herzen.tracing.pacing.TimeAllocationPolicy;
import com.herzen.tracing.store.DependencyFallbackMetrics;
import com.herzen.tracing.store.InteractionEventSink;
import com.herzen.tracing.store.KnowledgeStateStore;
import com.herzen.tracing.store.ParameterStore;
import com.herzen.tracing.store.StoreCallGuard;
import com.herzen.tracing.transfer.TransferGraph;
import com.herzen.tracing.transfer.TransferLearningService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DegradedInteractionTest {
    @Mock
    private ParameterStore parameterStore;

    @Mock
    private KnowledgeStateStore stateStore;

    @Mock
    private CalibrationService calibrationService;

    @Mock
    private FairnessMonitor fairnessMonitor;

    @Mock
    private InteractionEventSink eventSink;

    private DependencyFallbackMetrics metrics;
    private StoreCallGuard guard;
    private InteractionService service;

    @BeforeEach
    void setUp() {
        EngineProperties properties = TestProperties.defaults();
        metrics = new DependencyFallbackMetrics(new SimpleMeterRegistry());
        guard = new StoreCallGuard(properties, metrics);
        BayesianMasteryUpdater updater = new BayesianMasteryUpdater(properties);
        KnowledgeStateLocks locks = new KnowledgeStateLocks();
        ParameterResolver resolver = new ParameterResolver(parameterStore, guard, properties);
        TransferLearningService transfer = new TransferLearningService(new TransferGraph(properties), stateStore, locks,
                guard, resolver, updater, metrics);
        MasteryService masteryService = new MasteryService(updater, resolver, stateStore, guard, locks, transfer, metrics);
        ExamCatalog exams = new ExamCatalog(properties);
        PacingService pacing = new PacingService(new TimeAllocationPolicy(properties), exams, masteryService, properties);
        service = new InteractionService(new CognitiveLoadEstimator(properties), masteryService, pacing,
                calibrationService, fairnessMonitor, exams, eventSink, guard);

        when(parameterStore.find("algebra")).thenReturn(Optional.empty());
        when(calibrationService.apply(eq("JEE_Mains"), eq("math"), anyDouble())).thenAnswer(inv -> inv.getArgument(2));
    }

    @AfterEach
    void tearDown() {
        guard.shutdown();
    }

    private static InteractionModels.InteractionRequest request(String student) {
        return new InteractionModels.InteractionRequest(student, "JEE_Mains", "math", List.of("algebra"), true,
                new LoadModels.BehavioralSignals(40_000, 45_000, 2500, 0.1), LoadModels.DeviceContext.desktop(),
                new LoadModels.SessionContext(10 * 60_000L, 0, 0.2), 2, 0.0, "urban", null);
    }

    @Test
    void degradedMasteryStaysOutOfFairnessAndIsFlaggedInTheLog() {
        when(stateStore.find("s1", "algebra")).thenAnswer(inv -> {
            Thread.sleep(1500);
            return Optional.empty();
        });

        InteractionModels.InteractionOutcome outcome = service.submit(request("s1"));

        assertTrue(outcome.mastery().get(0).degraded());
        assertTrue(outcome.eventLogged());
        verify(fairnessMonitor, never()).record(anyString(), anyString(), anyString(), anyDouble());
        ArgumentCaptor<DomainModels.InteractionEvent> logged = ArgumentCaptor.forClass(DomainModels.InteractionEvent.class);
        verify(eventSink).append(logged.capture());
        assertTrue(logged.getValue().degraded());
        verify(stateStore, never()).save(any());
    }

    @Test
    void healthyMasteryIsSampledForFairness() {
        when(stateStore.find("s2", "algebra")).thenReturn(Optional.empty());

        InteractionModels.InteractionOutcome outcome = service.submit(request("s2"));

        assertFalse(outcome.mastery().get(0).degraded());
        verify(fairnessMonitor).record(eq("JEE_Mains"), eq("math"), eq("urban"), eq(outcome.mastery().get(0).newMastery()));
        ArgumentCaptor<DomainModels.InteractionEvent> logged = ArgumentCaptor.forClass(DomainModels.InteractionEvent.class);
        verify(eventSink).append(logged.capture());
        assertFalse(logged.getValue().degraded());
    }
}
