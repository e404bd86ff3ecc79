package com.herzen.tracing.calibration;

import com.herzen.tracing.config.EngineProperties;
import com.herzen.tracing.domain.DomainModels;
import com.herzen.tracing.error.DegenerateCalibrationException;
import com.herzen.tracing.error.ValidationException;
import com.herzen.tracing.exam.ExamCatalog;
import com.herzen.tracing.repository.CalibrationJdbcRepository;
import com.herzen.tracing.store.InteractionEventSink;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Service
public class CalibrationService {
    private static final Logger log = LoggerFactory.getLogger(CalibrationService.class);

    private final TemperatureScaling scaling;
    private final CalibrationJdbcRepository repository;
    private final InteractionEventSink events;
    private final ExamCatalog exams;
    private final EngineProperties.Calibration props;
    private final Map<Key, DomainModels.CalibrationEntry> entries = new ConcurrentHashMap<>();

    public CalibrationService(TemperatureScaling scaling, CalibrationJdbcRepository repository, InteractionEventSink events,
                              ExamCatalog exams, EngineProperties properties) {
        this.scaling = scaling;
        this.repository = repository;
        this.events = events;
        this.exams = exams;
        this.props = properties.calibration();
    }

    @PostConstruct
    public void restore() {
        try {
            List<DomainModels.CalibrationEntry> stored = repository.findAll();
            stored.forEach(e -> entries.putIfAbsent(new Key(e.examCode(), e.subject()), e));
            log.info("Restored {} calibration entries", stored.size());
        } catch (DataAccessException ex) {
            log.warn("Could not restore calibration entries, serving raw scores: {}", ex.getMessage());
        }
    }

    public CalibrationModels.CalibrationFit fit(String examCode, String subject, List<Double> logits, List<Double> labels) {
        exams.require(examCode);
        requireSubject(subject);
        CalibrationModels.FitResult r = scaling.fit(logits, labels);
        DomainModels.CalibrationEntry entry = new DomainModels.CalibrationEntry(examCode, subject, r.temperature(), r.sampleCount(),
                r.nllBefore(), r.nllAfter(), r.eceBefore(), r.eceAfter(), Instant.now());
        repository.save(entry);
        entries.put(new Key(examCode, subject), entry);
        log.info("Calibrated {}/{}: T={} n={} nll {} -> {} ece {} -> {}", examCode, subject, r.temperature(),
                r.sampleCount(), r.nllBefore(), r.nllAfter(), r.eceBefore(), r.eceAfter());
        return toFit(entry);
    }

    public double apply(String examCode, String subject, double rawScore) {
        if (!(rawScore >= 0.0 && rawScore <= 1.0)) {
            throw new ValidationException("raw score must be a probability in [0,1], got " + rawScore);
        }
        Optional<DomainModels.CalibrationEntry> entry = entry(examCode, subject);
        if (entry.isEmpty() || entry.get().temperature() == 1.0) return rawScore;
        return TemperatureScaling.apply(rawScore, entry.get().temperature());
    }

    public Optional<CalibrationModels.CalibrationFit> current(String examCode, String subject) {
        return entry(examCode, subject).map(CalibrationService::toFit);
    }

    @Scheduled(initialDelayString = "${tracing.calibration.refit-delay-ms:3600000}",
            fixedDelayString = "${tracing.calibration.refit-delay-ms:3600000}")
    public void scheduledRefit() {
        try {
            refit();
        } catch (DataAccessException ex) {
            log.warn("Scheduled calibration refit failed: {}", ex.getMessage());
        }
    }

    public CalibrationModels.RefitSummary refit() {
        Map<Key, List<DomainModels.InteractionEvent>> byKey = events.snapshot().stream()
                .filter(e -> !e.degraded())
                .collect(Collectors.groupingBy(e -> new Key(e.examCode(), e.subject()), TreeMap::new, Collectors.toList()));
        List<CalibrationModels.CalibrationFit> fitted = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        byKey.forEach((key, group) -> {
            if (group.size() < props.minSamples()) {
                log.warn("Skipping refit of {}: {} samples, need {}", key, group.size(), props.minSamples());
                skipped.add(key.toString());
                return;
            }
            List<Double> logits = group.stream().map(e -> TemperatureScaling.logit(e.predictedCorrect())).toList();
            List<Double> labels = group.stream().map(e -> e.correct() ? 1.0 : 0.0).toList();
            try {
                fitted.add(fit(key.examCode(), key.subject(), logits, labels));
            } catch (DegenerateCalibrationException | ValidationException ex) {
                log.warn("Skipping refit of {}: {}", key, ex.getMessage());
                skipped.add(key.toString());
            }
        });
        log.info("Calibration refit done: {} fitted, {} skipped", fitted.size(), skipped.size());
        return new CalibrationModels.RefitSummary(fitted, skipped);
    }

    private Optional<DomainModels.CalibrationEntry> entry(String examCode, String subject) {
        return Optional.ofNullable(entries.get(new Key(examCode, subject)));
    }

    private static void requireSubject(String subject) {
        if (subject == null || subject.isBlank()) throw new ValidationException("subject must not be blank");
    }

    private static CalibrationModels.CalibrationFit toFit(DomainModels.CalibrationEntry e) {
        return new CalibrationModels.CalibrationFit(e.examCode(), e.subject(), e.temperature(), e.sampleCount(), e.nllBefore(),
                e.nllAfter(), e.eceBefore(), e.eceAfter(), e.fittedAt());
    }

    private record Key(String examCode, String subject) implements Comparable<Key> {
        @Override
        public int compareTo(Key o) {
            int c = examCode.compareTo(o.examCode);
            return c != 0 ? c : subject.compareTo(o.subject);
        }

        @Override
        public String toString() {
            return examCode + "/" + subject;
        }
    }
}
