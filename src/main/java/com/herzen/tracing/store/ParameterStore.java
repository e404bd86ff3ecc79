package com.herzen.tracing.store;

import com.herzen.tracing.domain.DomainModels;

import java.util.Optional;

public interface ParameterStore {
    Optional<DomainModels.ConceptParameters> find(String conceptId);
}
