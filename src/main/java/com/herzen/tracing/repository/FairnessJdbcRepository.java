package com.herzen.tracing.repository;

import com.herzen.tracing.domain.DomainModels;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class FairnessJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public FairnessJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void save(DomainModels.FairnessSnapshot s) {
        jdbcTemplate.update(
                "MERGE INTO fairness_snapshots(exam_code, subject, demographic_group, average_outcome, sample_count) KEY(exam_code, subject, demographic_group) VALUES (?,?,?,?,?)",
                s.examCode(), s.subject(), s.demographicGroup(), s.averageOutcome(), s.sampleCount());
    }

    public List<DomainModels.FairnessSnapshot> findAll() {
        return jdbcTemplate.query(
                "SELECT exam_code, subject, demographic_group, average_outcome, sample_count FROM fairness_snapshots",
                (rs, rowNum) -> new DomainModels.FairnessSnapshot(rs.getString(1), rs.getString(2), rs.getString(3), rs.getDouble(4), rs.getLong(5)));
    }
}
