package com.herzen.tracing.repository;

import com.herzen.tracing.domain.DomainModels;
import com.herzen.tracing.store.ParameterStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class ConceptParameterJdbcRepository implements ParameterStore {
    private final JdbcTemplate jdbcTemplate;

    public ConceptParameterJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<DomainModels.ConceptParameters> find(String conceptId) {
        return jdbcTemplate.query(
                "SELECT concept_id, learn_rate, slip_rate, guess_rate, forgetting_rate, prior FROM concept_parameters WHERE concept_id=?",
                (rs, rowNum) -> new DomainModels.ConceptParameters(rs.getString(1), rs.getDouble(2), rs.getDouble(3), rs.getDouble(4),
                        rs.getDouble(5), rs.getObject(6) == null ? null : rs.getDouble(6)),
                conceptId).stream().findFirst();
    }

    public void save(DomainModels.ConceptParameters p) {
        jdbcTemplate.update(
                "MERGE INTO concept_parameters(concept_id, learn_rate, slip_rate, guess_rate, forgetting_rate, prior) KEY(concept_id) VALUES (?,?,?,?,?,?)",
                p.conceptId(), p.learnRate(), p.slipRate(), p.guessRate(), p.forgettingRate(), p.prior());
    }
}
