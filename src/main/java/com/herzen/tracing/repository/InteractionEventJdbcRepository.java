package com.herzen.tracing.repository;

import com.herzen.tracing.domain.DomainModels;
import com.herzen.tracing.store.InteractionEventSink;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.*;

@Repository
public class InteractionEventJdbcRepository implements InteractionEventSink {
    private final JdbcTemplate jdbcTemplate;

    public InteractionEventJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void append(DomainModels.InteractionEvent e) {
        jdbcTemplate.update(
                "INSERT INTO interaction_events(event_id, student_id, correct, response_time_ms, exam_code, subject, device_type, network_quality, "
                        + "stress, intrinsic_load, extraneous_load, total_load, predicted_correct, mastery_before, mastery_after, degraded, demographic_group, recorded_at) "
                        + "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
                e.eventId(), e.studentId(), e.correct(), e.responseTimeMs(), e.examCode(), e.subject(),
                e.deviceType().name(), e.networkQuality().name(), e.stress(), e.intrinsicLoad(), e.extraneousLoad(), e.totalLoad(),
                e.predictedCorrect(), e.masteryBefore(), e.masteryAfter(), e.degraded(), e.demographicGroup(), Timestamp.from(e.recordedAt()));

        List<String> concepts = e.conceptIds();
        for (int i = 0; i < concepts.size(); i++) {
            jdbcTemplate.update("INSERT INTO interaction_event_concepts(event_id, concept_order, concept_id) VALUES (?,?,?)",
                    e.eventId(), i, concepts.get(i));
        }
    }

    @Override
    public List<DomainModels.InteractionEvent> snapshot() {
        Map<String, List<String>> concepts = new HashMap<>();
        jdbcTemplate.query("SELECT event_id, concept_id FROM interaction_event_concepts ORDER BY event_id, concept_order",
                rs -> {
                    concepts.computeIfAbsent(rs.getString(1), k -> new ArrayList<>()).add(rs.getString(2));
                });

        return jdbcTemplate.query(
                "SELECT event_id, student_id, correct, response_time_ms, exam_code, subject, device_type, network_quality, "
                        + "stress, intrinsic_load, extraneous_load, total_load, predicted_correct, mastery_before, mastery_after, degraded, demographic_group, recorded_at "
                        + "FROM interaction_events ORDER BY recorded_at",
                (rs, rowNum) -> new DomainModels.InteractionEvent(rs.getString(1), rs.getString(2),
                        concepts.getOrDefault(rs.getString(1), List.of()),
                        rs.getBoolean(3), rs.getLong(4), rs.getString(5), rs.getString(6),
                        DomainModels.DeviceType.valueOf(rs.getString(7)), DomainModels.NetworkQuality.valueOf(rs.getString(8)),
                        rs.getDouble(9), rs.getDouble(10), rs.getDouble(11), rs.getDouble(12), rs.getDouble(13),
                        rs.getDouble(14), rs.getDouble(15), rs.getBoolean(16), rs.getString(17), rs.getTimestamp(18).toInstant()));
    }
}
