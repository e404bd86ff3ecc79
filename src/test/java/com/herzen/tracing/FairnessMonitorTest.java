package com.herzen.tracing;

import com.herzen.tracing.domain.DomainModels;
import com.herzen.tracing.error.ValidationException;
import com.herzen.tracing.fairness.FairnessModels;
import com.herzen.tracing.fairness.FairnessMonitor;
import com.herzen.tracing.repository.FairnessJdbcRepository;
import com.herzen.tracing.store.InteractionEventSink;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "tracing.store.timeout=2s")
class FairnessMonitorTest {
    @Autowired
    private FairnessMonitor monitor;

    @Autowired
    private FairnessJdbcRepository repository;

    @Autowired
    private InteractionEventSink eventSink;

    private void recordMany(String exam, String subject, String group, double outcome, int times) {
        for (int i = 0; i < times; i++) monitor.record(exam, subject, group, outcome);
    }

    @Test
    void severeDisparityIsFlaggedWithActions() {
        recordMany("NEET", "fair-bio", "urban", 0.9, 30);
        recordMany("NEET", "fair-bio", "rural", 0.6, 30);

        FairnessModels.FairnessReport report = monitor.report("NEET", "fair-bio");

        assertEquals(0.3, report.disparity(), 1e-9);
        assertTrue(report.flagged());
        assertEquals(2, report.recommendations().size());
        assertTrue(monitor.audit().stream().anyMatch(r -> r.subject().equals("fair-bio")));
    }

    @Test
    void keysAreIsolatedAcrossExamAndSubject() {
        recordMany("JEE_Mains", "fair-iso", "a", 1.0, 30);
        recordMany("JEE_Mains", "fair-iso", "b", 0.0, 30);

        assertTrue(monitor.report("JEE_Mains", "fair-iso").flagged());
        FairnessModels.FairnessReport otherExam = monitor.report("NEET", "fair-iso");
        assertTrue(otherExam.groups().isEmpty());
        assertEquals(0.0, otherExam.disparity());
        assertFalse(otherExam.flagged());
        assertTrue(monitor.report("JEE_Mains", "fair-iso-2").groups().isEmpty());
    }

    @Test
    void groupsBelowMinimumSamplesAreExcludedFromDisparity() {
        recordMany("NEET", "fair-min", "large-a", 0.5, 30);
        recordMany("NEET", "fair-min", "large-b", 0.52, 30);
        recordMany("NEET", "fair-min", "tiny", 0.05, 10);

        FairnessModels.FairnessReport report = monitor.report("NEET", "fair-min");

        assertEquals(0.02, report.disparity(), 1e-9);
        assertFalse(report.flagged());
        FairnessModels.GroupStatistic tiny = report.groups().stream().filter(g -> g.demographicGroup().equals("tiny")).findFirst().orElseThrow();
        assertFalse(tiny.included());
        assertEquals(10, tiny.sampleCount());
        assertEquals("Disparity within acceptable range", report.recommendations().get(0));
    }

    @Test
    void singleIncludedGroupHasZeroDisparity() {
        recordMany("NEET", "fair-single", "only", 0.7, 40);
        recordMany("NEET", "fair-single", "few", 0.1, 3);
        assertEquals(0.0, monitor.report("NEET", "fair-single").disparity());
    }

    @Test
    void moderateDisparityAsksForMonitoring() {
        recordMany("JEE_Advanced", "fair-mod", "x", 0.5, 30);
        recordMany("JEE_Advanced", "fair-mod", "y", 0.6, 30);

        FairnessModels.FairnessReport report = monitor.report("JEE_Advanced", "fair-mod");
        assertTrue(report.flagged());
        assertEquals(1, report.recommendations().size());
    }

    @Test
    void runningMeanIsWrittenThrough() {
        monitor.record("NEET", "fair-mean", "g", 0.2);
        monitor.record("NEET", "fair-mean", "g", 0.4);

        FairnessModels.GroupStatistic g = monitor.report("NEET", "fair-mean").groups().get(0);
        assertEquals(0.3, g.averageOutcome(), 1e-12);
        assertEquals(2, g.sampleCount());
        assertTrue(repository.findAll().stream()
                .anyMatch(s -> s.subject().equals("fair-mean") && s.sampleCount() == 2 && Math.abs(s.averageOutcome() - 0.3) < 1e-12));
    }

    @Test
    void calibrationGapPerGroupIsReportedAndFlagged() {
        for (int i = 0; i < 40; i++) eventSink.append(event("fair-calib", "well", 0.7, i < 28, false));
        for (int i = 0; i < 40; i++) eventSink.append(event("fair-calib", "over", 0.9, i < 20, false));
        for (int i = 0; i < 5; i++) eventSink.append(event("fair-calib", "small", 0.9, false, false));
        for (int i = 0; i < 40; i++) eventSink.append(event("fair-calib", "ghost", 0.99, false, true));

        FairnessModels.FairnessReport report = monitor.report("NEET", "fair-calib");

        assertEquals(List.of("over", "small", "well"), report.calibration().stream().map(FairnessModels.GroupCalibration::demographicGroup).toList());
        assertEquals(0.4, gap(report, "over"), 1e-9);
        assertEquals(0.0, gap(report, "well"), 1e-9);
        assertNull(report.calibration().stream().filter(g -> g.demographicGroup().equals("small")).findFirst().orElseThrow().calibrationGap());
        assertEquals(0.4, report.calibrationParity(), 1e-9);
        assertEquals(0.0, report.equalizedOddsGap(), 1e-9);
        assertTrue(report.flagged());
        assertTrue(report.recommendations().contains("Apply group-specific temperature scaling"));
        assertTrue(monitor.audit().stream().anyMatch(r -> r.subject().equals("fair-calib")));
    }

    @Test
    void equalizedOddsComparesErrorRatesAcrossGroups() {
        for (int i = 0; i < 40; i++) eventSink.append(event("fair-odds", "sharp", i < 20 ? 0.8 : 0.2, i < 20, false));
        for (int i = 0; i < 40; i++) eventSink.append(event("fair-odds", "blunt", 0.8, i < 20, false));

        FairnessModels.FairnessReport report = monitor.report("NEET", "fair-odds");

        assertEquals(1.0, report.equalizedOddsGap(), 1e-9);
        assertEquals(0.1, report.calibrationParity(), 1e-9);
        assertTrue(report.flagged());
        assertTrue(report.recommendations().contains("Review ground truth label accuracy across groups"));
        assertFalse(report.recommendations().contains("Apply group-specific temperature scaling"));
    }

    @Test
    void invalidSamplesAreRejected() {
        assertThrows(ValidationException.class, () -> monitor.record("NEET", "fair-bad", "g", 1.2));
        assertThrows(ValidationException.class, () -> monitor.record("NEET", "fair-bad", " ", 0.5));
        assertThrows(ValidationException.class, () -> monitor.record(null, "fair-bad", "g", 0.5));
        assertTrue(monitor.report("NEET", "fair-bad").groups().isEmpty());
    }

    private static double gap(FairnessModels.FairnessReport report, String group) {
        return report.calibration().stream().filter(g -> g.demographicGroup().equals(group)).findFirst().orElseThrow().calibrationGap();
    }

    private static DomainModels.InteractionEvent event(String subject, String group, double predicted, boolean correct,
                                                       boolean degraded) {
        return new DomainModels.InteractionEvent(UUID.randomUUID().toString(), "fair-student", List.of("c"), correct, 30_000,
                "NEET", subject, DomainModels.DeviceType.DESKTOP, DomainModels.NetworkQuality.HIGH, 0.1, 0.3, 0.2, 0.3,
                predicted, 0.5, 0.6, degraded, group, Instant.now());
    }
}
