package com.herzen.tracing.transfer;

import com.herzen.tracing.config.EngineProperties;
import com.herzen.tracing.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@Component
public class TransferGraph {
    private static final Logger log = LoggerFactory.getLogger(TransferGraph.class);

    private final double factor;
    private final Map<String, Map<String, Double>> adjacency;

    public TransferGraph(EngineProperties properties) {
        EngineProperties.Transfer transfer = properties.transfer();
        List<TransferModels.GraphEdge> edges = transfer.edges().stream()
                .map(e -> new TransferModels.GraphEdge(e.source(), e.target(), e.weight()))
                .toList();
        List<TransferModels.GraphValidationIssue> issues = validate(transfer.factor(), edges);
        if (!issues.isEmpty()) {
            throw new ConfigurationException("invalid transfer graph: " + issues.stream()
                    .map(i -> i.code() + "(" + i.node() + "): " + i.message())
                    .collect(Collectors.joining("; ")));
        }
        this.factor = transfer.factor();
        Map<String, Map<String, Double>> map = new HashMap<>();
        for (TransferModels.GraphEdge e : edges) {
            map.computeIfAbsent(e.source(), k -> new TreeMap<>()).put(e.target(), e.weight());
        }
        map.replaceAll((k, v) -> Collections.unmodifiableMap(v));
        this.adjacency = Collections.unmodifiableMap(map);
        log.info("Transfer graph loaded: {} edges, factor {}", edges.size(), factor);
    }

    public static List<TransferModels.GraphValidationIssue> validate(double factor, List<TransferModels.GraphEdge> edges) {
        List<TransferModels.GraphValidationIssue> issues = new ArrayList<>();
        if (!(factor >= 0.0 && factor < 1.0)) {
            issues.add(new TransferModels.GraphValidationIssue("FACTOR_OUT_OF_RANGE", "transfer factor must be in [0,1), got " + factor, null));
        }
        Set<String> seen = new HashSet<>();
        for (TransferModels.GraphEdge e : edges) {
            if (e.source() == null || e.source().isBlank() || e.target() == null || e.target().isBlank()) {
                issues.add(new TransferModels.GraphValidationIssue("BLANK_NODE", "edge endpoints must not be blank", e.source() + "->" + e.target()));
                continue;
            }
            if (e.source().equals(e.target())) {
                issues.add(new TransferModels.GraphValidationIssue("SELF_LOOP", "concept cannot transfer to itself", e.source()));
            }
            if (!(e.weight() >= 0.0 && e.weight() <= 1.0)) {
                issues.add(new TransferModels.GraphValidationIssue("WEIGHT_OUT_OF_RANGE", "weight must be in [0,1], got " + e.weight(), e.source() + "->" + e.target()));
            }
            if (!seen.add(e.source() + "->" + e.target())) {
                issues.add(new TransferModels.GraphValidationIssue("DUPLICATE_EDGE", "edge declared more than once", e.source() + "->" + e.target()));
            }
        }
        return issues;
    }

    public Map<String, Double> neighbours(String conceptId) {
        return adjacency.getOrDefault(conceptId, Map.of());
    }

    public double factor() {
        return factor;
    }
}
