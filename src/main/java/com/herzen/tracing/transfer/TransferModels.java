package com.herzen.tracing.transfer;

public class TransferModels {
    public record GraphEdge(String source, String target, double weight) {}

    public record GraphValidationIssue(String code, String message, String node) {}

    public record TransferUpdate(String targetConceptId, double weight, Double previousMastery, Double newMastery,
                                 boolean applied) {}
}
