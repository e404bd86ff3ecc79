package com.herzen.tracing.store;

import com.herzen.tracing.domain.DomainModels;

import java.util.Optional;

public interface KnowledgeStateStore {
    Optional<DomainModels.KnowledgeState> find(String studentId, String conceptId);

    void save(DomainModels.KnowledgeState state);
}
