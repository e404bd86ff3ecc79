package com.herzen.tracing.mastery;

import com.herzen.tracing.config.EngineProperties;
import com.herzen.tracing.domain.DomainModels;
import com.herzen.tracing.store.ParameterStore;
import com.herzen.tracing.store.StoreCallGuard;
import com.herzen.tracing.store.StoreCallGuard.Guarded;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class ParameterResolver {
    static final String DEPENDENCY = "parameter-store";

    private final ParameterStore store;
    private final StoreCallGuard guard;
    private final EngineProperties.DefaultParameters defaults;
    private final Map<String, DomainModels.ConceptParameters> lastKnown = new ConcurrentHashMap<>();

    public ParameterResolver(ParameterStore store, StoreCallGuard guard, EngineProperties properties) {
        this.store = store;
        this.guard = guard;
        this.defaults = properties.mastery().defaultParameters();
    }

    public DomainModels.ConceptParameters resolve(String conceptId) {
        Guarded<Optional<DomainModels.ConceptParameters>> read = guard.call(DEPENDENCY,
                () -> store.find(conceptId),
                () -> Optional.ofNullable(lastKnown.get(conceptId)));
        Optional<DomainModels.ConceptParameters> found = read.value();
        if (!read.degraded()) found.ifPresent(p -> lastKnown.put(conceptId, p));
        return found.orElseGet(() -> new DomainModels.ConceptParameters(conceptId, defaults.learnRate(), defaults.slipRate(),
                defaults.guessRate(), defaults.forgettingRate(), null));
    }
}
