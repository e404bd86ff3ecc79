package com.herzen.tracing;

import com.herzen.tracing.domain.DomainModels;
import com.herzen.tracing.store.InteractionEventSink;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "tracing.store.timeout=2s")
class InteractionEventLogTest {
    @Autowired
    private InteractionEventSink eventSink;

    @Test
    void conceptIdsKeepTheirExactValuesAndOrder() {
        String id = UUID.randomUUID().toString();
        eventSink.append(event(id, List.of("vectors,2d", "algebra", "a, b"), true));

        DomainModels.InteractionEvent stored = find(id);

        assertEquals(List.of("vectors,2d", "algebra", "a, b"), stored.conceptIds());
        assertTrue(stored.degraded());
        assertEquals("log-group", stored.demographicGroup());
    }

    @Test
    void singleConceptEventReadsBackAsOneId() {
        String id = UUID.randomUUID().toString();
        eventSink.append(event(id, List.of("thermodynamics"), false));

        DomainModels.InteractionEvent stored = find(id);

        assertEquals(List.of("thermodynamics"), stored.conceptIds());
        assertFalse(stored.degraded());
    }

    private DomainModels.InteractionEvent find(String eventId) {
        return eventSink.snapshot().stream().filter(e -> e.eventId().equals(eventId)).findFirst().orElseThrow();
    }

    private static DomainModels.InteractionEvent event(String id, List<String> concepts, boolean degraded) {
        return new DomainModels.InteractionEvent(id, "log-student", concepts, true, 12_000, "JEE_Mains", "log-physics",
                DomainModels.DeviceType.MOBILE, DomainModels.NetworkQuality.LOW, 0.2, 0.4, 0.3, 0.5, 0.6, 0.3, 0.5,
                degraded, "log-group", Instant.now());
    }
}
