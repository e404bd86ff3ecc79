package com.herzen.tracing.store;

import com.herzen.tracing.domain.DomainModels;

import java.util.List;

public interface InteractionEventSink {
    void append(DomainModels.InteractionEvent event);

    List<DomainModels.InteractionEvent> snapshot();
}
