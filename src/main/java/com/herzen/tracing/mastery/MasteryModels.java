package com.herzen.tracing.mastery;

import com.herzen.tracing.domain.DomainModels;
import com.herzen.tracing.transfer.TransferModels;

import java.time.Instant;
import java.util.List;

public class MasteryModels {
    public record UpdateContext(double stress, long responseTimeMs, Instant now) {
        public static UpdateContext neutral() {
            return new UpdateContext(0.0, 0L, Instant.now());
        }
    }

    public record UpdateOutcome(DomainModels.KnowledgeState state, double priorMastery, double predictedCorrect,
                                double effectiveSlip, double effectiveGuess, boolean recovery, double confidence) {}

    public record MasteryUpdateResult(String studentId, String conceptId, double previousMastery, double newMastery,
                                      int practiceCount, int incorrectStreak, boolean recovery, double predictedCorrect,
                                      double effectiveSlip, double effectiveGuess, double confidence, boolean degraded,
                                      List<TransferModels.TransferUpdate> transfers) {}

    public record MasteryView(String studentId, String conceptId, double masteryProbability, int practiceCount,
                              int incorrectStreak, Instant lastPracticed, boolean stored) {}
}
