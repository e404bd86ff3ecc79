package com.herzen.tracing.domain;

import java.time.Instant;
import java.util.List;

public class DomainModels {
    public record ConceptParameters(String conceptId, double learnRate, double slipRate, double guessRate,
                                    double forgettingRate, Double prior) {}

    public record KnowledgeState(String studentId, String conceptId, double masteryProbability,
                                 int practiceCount, int incorrectStreak, Instant lastPracticed) {
        public static KnowledgeState initial(String studentId, String conceptId, double prior) {
            return new KnowledgeState(studentId, conceptId, prior, 0, 0, null);
        }

        public KnowledgeState withMastery(double mastery) {
            return new KnowledgeState(studentId, conceptId, mastery, practiceCount, incorrectStreak, lastPracticed);
        }
    }

    public record InteractionEvent(String eventId, String studentId, List<String> conceptIds, boolean correct,
                                   long responseTimeMs, String examCode, String subject, DeviceType deviceType,
                                   NetworkQuality networkQuality, double stress, double intrinsicLoad,
                                   double extraneousLoad, double totalLoad, double predictedCorrect,
                                   double masteryBefore, double masteryAfter, boolean degraded,
                                   String demographicGroup, Instant recordedAt) {
        public InteractionEvent {
            conceptIds = List.copyOf(conceptIds);
        }
    }

    public record CalibrationEntry(String examCode, String subject, double temperature, int sampleCount,
                                   double nllBefore, double nllAfter, double eceBefore, double eceAfter,
                                   Instant fittedAt) {}

    public record FairnessSnapshot(String examCode, String subject, String demographicGroup,
                                   double averageOutcome, long sampleCount) {}

    public enum DeviceType {
        DESKTOP, TABLET, MOBILE
    }

    public enum NetworkQuality {
        HIGH, MEDIUM, LOW
    }

    public enum ScreenClass {
        SMALL, MEDIUM, LARGE
    }
}
