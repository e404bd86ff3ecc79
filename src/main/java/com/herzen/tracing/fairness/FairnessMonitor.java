package com.herzen.tracing.fairness;

import com.herzen.tracing.config.EngineProperties;
import com.herzen.tracing.domain.DomainModels;
import com.herzen.tracing.error.ValidationException;
import com.herzen.tracing.repository.FairnessJdbcRepository;
import com.herzen.tracing.store.InteractionEventSink;
import com.herzen.tracing.store.StoreCallGuard;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

@Service
public class FairnessMonitor {
    private static final Logger log = LoggerFactory.getLogger(FairnessMonitor.class);
    public static final String DEPENDENCY = "fairness-store";

    private final FairnessJdbcRepository repository;
    private final InteractionEventSink events;
    private final StoreCallGuard guard;
    private final EngineProperties.Fairness props;
    private final int eceBins;
    private final ConcurrentMap<Scope, ConcurrentMap<String, Aggregate>> aggregates = new ConcurrentHashMap<>();
    private final Set<GroupKey> pending = ConcurrentHashMap.newKeySet();

    public FairnessMonitor(FairnessJdbcRepository repository, InteractionEventSink events, StoreCallGuard guard,
                           EngineProperties properties) {
        this.repository = repository;
        this.events = events;
        this.guard = guard;
        this.props = properties.fairness();
        this.eceBins = properties.calibration().eceBins();
    }

    @PostConstruct
    public void restore() {
        try {
            List<DomainModels.FairnessSnapshot> snapshots = repository.findAll();
            snapshots.forEach(s -> groups(new Scope(s.examCode(), s.subject()))
                    .put(s.demographicGroup(), new Aggregate(s.averageOutcome(), s.sampleCount())));
            log.info("Restored {} fairness snapshots", snapshots.size());
        } catch (DataAccessException ex) {
            log.warn("Could not restore fairness snapshots, starting empty: {}", ex.getMessage());
        }
    }

    public void record(String examCode, String subject, String group, double outcome) {
        requireKey("examCode", examCode);
        requireKey("subject", subject);
        requireKey("group", group);
        if (!(outcome >= 0.0 && outcome <= 1.0)) {
            throw new ValidationException("outcome must be in [0,1], got " + outcome);
        }
        Scope scope = new Scope(examCode, subject);
        groups(scope).merge(group, new Aggregate(outcome, 1), Aggregate::plus);
        persist(new GroupKey(scope, group));
    }

    public FairnessModels.FairnessReport report(String examCode, String subject) {
        requireKey("examCode", examCode);
        requireKey("subject", subject);
        return report(new Scope(examCode, subject), usableEvents(events.snapshot()));
    }

    @Scheduled(initialDelayString = "${tracing.fairness.audit-delay-ms:900000}",
            fixedDelayString = "${tracing.fairness.audit-delay-ms:900000}")
    public void scheduledAudit() {
        try {
            audit();
        } catch (DataAccessException ex) {
            log.warn("Scheduled fairness audit failed: {}", ex.getMessage());
        }
    }

    public List<FairnessModels.FairnessReport> audit() {
        int retried = flushPending();
        List<DomainModels.InteractionEvent> usable = usableEvents(events.snapshot());
        Set<Scope> scopes = new TreeSet<>(Comparator.comparing(Scope::examCode).thenComparing(Scope::subject));
        scopes.addAll(aggregates.keySet());
        usable.forEach(e -> scopes.add(new Scope(e.examCode(), e.subject())));

        List<FairnessModels.FairnessReport> flagged = scopes.stream()
                .map(s -> report(s, usable))
                .filter(FairnessModels.FairnessReport::flagged)
                .toList();
        flagged.forEach(r -> log.warn(
                "Fairness flagged for {}/{}: disparity {} calibration parity {} equalized odds {}",
                r.examCode(), r.subject(), r.disparity(), r.calibrationParity(), r.equalizedOddsGap()));
        log.info("Fairness audit: {} scopes, {} flagged, {} snapshot writes retried",
                scopes.size(), flagged.size(), retried);
        return flagged;
    }

    private int flushPending() {
        int written = 0;
        for (GroupKey key : new ArrayList<>(pending)) {
            pending.remove(key);
            if (write(key)) written++;
        }
        return written;
    }

    private FairnessModels.FairnessReport report(Scope scope, List<DomainModels.InteractionEvent> usable) {
        Map<String, Aggregate> byGroup = new TreeMap<>(aggregates.getOrDefault(scope, new ConcurrentHashMap<>()));
        List<FairnessModels.GroupStatistic> stats = byGroup.entrySet().stream()
                .map(e -> new FairnessModels.GroupStatistic(e.getKey(), e.getValue().average(), e.getValue().count(),
                        e.getValue().count() >= props.minSamples()))
                .toList();
        DoubleSummaryStatistics included = stats.stream()
                .filter(FairnessModels.GroupStatistic::included)
                .mapToDouble(FairnessModels.GroupStatistic::averageOutcome)
                .summaryStatistics();
        double disparity = included.getCount() < 2 ? 0.0 : included.getMax() - included.getMin();

        Map<String, List<DomainModels.InteractionEvent>> eventsByGroup = usable.stream()
                .filter(e -> e.examCode().equals(scope.examCode()) && e.subject().equals(scope.subject()))
                .collect(Collectors.groupingBy(DomainModels.InteractionEvent::demographicGroup, TreeMap::new, Collectors.toList()));
        List<FairnessModels.GroupCalibration> calibration = eventsByGroup.entrySet().stream()
                .map(e -> GroupCalibrationMetrics.measure(e.getKey(), e.getValue(), props.calibrationMinSamples(), eceBins))
                .toList();
        double calibrationParity = GroupCalibrationMetrics.calibrationParity(calibration);
        double equalizedOdds = GroupCalibrationMetrics.equalizedOddsGap(calibration);

        boolean flagged = disparity > props.disparityThreshold()
                || calibrationParity > props.calibrationParityThreshold()
                || equalizedOdds > props.equalizedOddsThreshold();
        return new FairnessModels.FairnessReport(scope.examCode(), scope.subject(), stats, disparity, calibration,
                calibrationParity, equalizedOdds, flagged, recommendations(disparity, calibrationParity, equalizedOdds));
    }

    private List<String> recommendations(double disparity, double calibrationParity, double equalizedOdds) {
        List<String> out = new ArrayList<>();
        if (disparity > props.severeThreshold()) {
            out.add("Investigate potential bias in question features");
            out.add("Review time allocation across groups");
        } else if (disparity > props.disparityThreshold()) {
            out.add("Monitor disparity trend over the next audit windows");
        }
        if (calibrationParity > props.calibrationParityThreshold()) {
            out.add("Apply group-specific temperature scaling");
        }
        if (equalizedOdds > props.equalizedOddsThreshold()) {
            out.add("Review ground truth label accuracy across groups");
        }
        if (out.isEmpty()) out.add("Disparity within acceptable range");
        return out;
    }

    private static List<DomainModels.InteractionEvent> usableEvents(List<DomainModels.InteractionEvent> snapshot) {
        return snapshot.stream()
                .filter(e -> !e.degraded())
                .filter(e -> e.demographicGroup() != null && !e.demographicGroup().isBlank())
                .toList();
    }

    private void persist(GroupKey key) {
        if (!write(key)) pending.add(key);
    }

    private boolean write(GroupKey key) {
        return guard.run(DEPENDENCY, () -> writeLatest(key));
    }

    private void writeLatest(GroupKey key) {
        ConcurrentMap<String, Aggregate> groups = groups(key.scope());
        // serialized per scope so a stale aggregate never lands after a newer one
        synchronized (groups) {
            Aggregate latest = groups.get(key.group());
            if (latest == null) return;
            repository.save(new DomainModels.FairnessSnapshot(key.scope().examCode(), key.scope().subject(), key.group(),
                    latest.average(), latest.count()));
        }
    }

    private ConcurrentMap<String, Aggregate> groups(Scope scope) {
        return aggregates.computeIfAbsent(scope, k -> new ConcurrentHashMap<>());
    }

    private static void requireKey(String name, String value) {
        if (value == null || value.isBlank()) throw new ValidationException(name + " must not be blank");
    }

    private record Scope(String examCode, String subject) {}

    private record GroupKey(Scope scope, String group) {}

    private record Aggregate(double average, long count) {
        Aggregate plus(Aggregate other) {
            long total = count + other.count;
            return new Aggregate(average + (other.average - average) * other.count / total, total);
        }
    }
}
