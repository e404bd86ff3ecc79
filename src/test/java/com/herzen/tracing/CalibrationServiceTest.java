package com.herzen.tracing;

import com.herzen.tracing.calibration.CalibrationModels;
import com.herzen.tracing.calibration.CalibrationService;
import com.herzen.tracing.domain.DomainModels;
import com.herzen.tracing.error.DegenerateCalibrationException;
import com.herzen.tracing.error.ValidationException;
import com.herzen.tracing.store.InteractionEventSink;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "tracing.store.timeout=2s")
class CalibrationServiceTest {
    @Autowired
    private CalibrationService calibrationService;

    @Autowired
    private InteractionEventSink eventSink;

    private static List<Double> overconfidentLogits() {
        List<Double> logits = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            logits.add(4.0);
            logits.add(-4.0);
        }
        return logits;
    }

    private static List<Double> noisyLabels() {
        List<Double> labels = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            labels.add(i < 7 ? 1.0 : 0.0);
            labels.add(i < 7 ? 0.0 : 1.0);
        }
        return labels;
    }

    @Test
    void applyWithoutStoredTemperatureReturnsInput() {
        assertEquals(0.37, calibrationService.apply("NEET", "botany-unset", 0.37));
        assertEquals(0.0, calibrationService.apply("NEET", "botany-unset", 0.0));
        assertTrue(calibrationService.current("NEET", "botany-unset").isEmpty());
    }

    @Test
    void fitIsStoredUnderItsOwnKeyOnly() {
        CalibrationModels.CalibrationFit fit = calibrationService.fit("JEE_Mains", "physics-fit", overconfidentLogits(), noisyLabels());

        assertTrue(fit.temperature() > 1.0);
        double calibrated = calibrationService.apply("JEE_Mains", "physics-fit", 0.9);
        assertTrue(calibrated < 0.9 && calibrated > 0.5);
        assertEquals(0.9, calibrationService.apply("JEE_Mains", "chemistry-other", 0.9));
        assertEquals(0.9, calibrationService.apply("NEET", "physics-fit", 0.9));
        assertEquals(fit.temperature(), calibrationService.current("JEE_Mains", "physics-fit").orElseThrow().temperature(), 1e-12);
    }

    @Test
    void degenerateLabelsStoreNothing() {
        assertThrows(DegenerateCalibrationException.class,
                () -> calibrationService.fit("NEET", "degenerate", List.of(1.0, 2.0), List.of(0.0, 0.0)));
        assertTrue(calibrationService.current("NEET", "degenerate").isEmpty());
    }

    @Test
    void invalidInputsAreRejected() {
        assertThrows(ValidationException.class, () -> calibrationService.fit("SAT", "math", List.of(1.0, -1.0), List.of(1.0, 0.0)));
        assertThrows(ValidationException.class, () -> calibrationService.fit("NEET", "math", List.of(1.0, -1.0), List.of(1.0)));
        assertThrows(ValidationException.class, () -> calibrationService.apply("NEET", "math", 1.2));
    }

    @Test
    void refitFitsLargeGroupsAndSkipsSmallOnes() {
        for (int i = 0; i < 5; i++) eventSink.append(event("NEET", "refit-small", 0.8, i % 2 == 0));
        for (int i = 0; i < 200; i++) eventSink.append(event("JEE_Advanced", "refit-large", i % 2 == 0 ? 0.9 : 0.1, i % 10 < 7 == (i % 2 == 0)));

        CalibrationModels.RefitSummary summary = calibrationService.refit();

        assertTrue(summary.skipped().contains("NEET/refit-small"));
        assertTrue(summary.fitted().stream().anyMatch(f -> f.subject().equals("refit-large")));
        assertTrue(calibrationService.current("JEE_Advanced", "refit-large").orElseThrow().temperature() > 1.0);
        assertTrue(calibrationService.current("NEET", "refit-small").isEmpty());
    }

    @Test
    void refitLeavesOutDegradedEvents() {
        for (int i = 0; i < 200; i++) {
            eventSink.append(event("NEET", "refit-degraded", i % 2 == 0 ? 0.9 : 0.1, i % 10 < 7 == (i % 2 == 0), true));
        }
        for (int i = 0; i < 10; i++) eventSink.append(event("NEET", "refit-degraded", 0.6, i % 2 == 0));

        CalibrationModels.RefitSummary summary = calibrationService.refit();

        assertTrue(summary.skipped().contains("NEET/refit-degraded"));
        assertTrue(calibrationService.current("NEET", "refit-degraded").isEmpty());
    }

    private static DomainModels.InteractionEvent event(String exam, String subject, double predicted, boolean correct) {
        return event(exam, subject, predicted, correct, false);
    }

    private static DomainModels.InteractionEvent event(String exam, String subject, double predicted, boolean correct, boolean degraded) {
        return new DomainModels.InteractionEvent(UUID.randomUUID().toString(), "cal-student", List.of("c"), correct, 30_000, exam,
                subject, DomainModels.DeviceType.DESKTOP, DomainModels.NetworkQuality.HIGH, 0.1, 0.3, 0.2, 0.3, predicted, 0.5, 0.6, degraded, null,
                Instant.now());
    }
}
