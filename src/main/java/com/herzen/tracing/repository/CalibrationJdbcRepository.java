package com.herzen.tracing.repository;

import com.herzen.tracing.domain.DomainModels;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;

@Repository
public class CalibrationJdbcRepository {
    private static final String COLUMNS = "exam_code, subject, temperature, sample_count, nll_before, nll_after, ece_before, ece_after, fitted_at";
    private static final RowMapper<DomainModels.CalibrationEntry> MAPPER = (rs, rowNum) -> new DomainModels.CalibrationEntry(
            rs.getString(1), rs.getString(2), rs.getDouble(3), rs.getInt(4), rs.getDouble(5), rs.getDouble(6),
            rs.getDouble(7), rs.getDouble(8), rs.getTimestamp(9).toInstant());

    private final JdbcTemplate jdbcTemplate;

    public CalibrationJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void save(DomainModels.CalibrationEntry e) {
        jdbcTemplate.update(
                "MERGE INTO calibration_entries(" + COLUMNS + ") KEY(exam_code, subject) VALUES (?,?,?,?,?,?,?,?,?)",
                e.examCode(), e.subject(), e.temperature(), e.sampleCount(), e.nllBefore(), e.nllAfter(),
                e.eceBefore(), e.eceAfter(), Timestamp.from(e.fittedAt()));
    }

    public List<DomainModels.CalibrationEntry> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM calibration_entries", MAPPER);
    }
}
