package com.herzen.tracing.repository;

import com.herzen.tracing.domain.DomainModels;
import com.herzen.tracing.store.KnowledgeStateStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.Optional;

@Repository
public class KnowledgeStateJdbcRepository implements KnowledgeStateStore {
    private final JdbcTemplate jdbcTemplate;

    public KnowledgeStateJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<DomainModels.KnowledgeState> find(String studentId, String conceptId) {
        return jdbcTemplate.query(
                "SELECT student_id, concept_id, mastery_probability, practice_count, incorrect_streak, last_practiced FROM knowledge_states WHERE student_id=? AND concept_id=?",
                (rs, rowNum) -> {
                    Timestamp last = rs.getTimestamp(6);
                    return new DomainModels.KnowledgeState(rs.getString(1), rs.getString(2), rs.getDouble(3), rs.getInt(4), rs.getInt(5),
                            last == null ? null : last.toInstant());
                },
                studentId, conceptId).stream().findFirst();
    }

    @Override
    public void save(DomainModels.KnowledgeState s) {
        jdbcTemplate.update(
                "MERGE INTO knowledge_states(student_id, concept_id, mastery_probability, practice_count, incorrect_streak, last_practiced) KEY(student_id, concept_id) VALUES (?,?,?,?,?,?)",
                s.studentId(), s.conceptId(), s.masteryProbability(), s.practiceCount(), s.incorrectStreak(),
                s.lastPracticed() == null ? null : Timestamp.from(s.lastPracticed()));
    }
}
