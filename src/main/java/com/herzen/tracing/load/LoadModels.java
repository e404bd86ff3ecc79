package com.herzen.tracing.load;

import com.herzen.tracing.domain.DomainModels;

import java.util.List;

public class LoadModels {
    public record BehavioralSignals(long responseTimeMs, long expectedTimeMs, long hesitationMs,
                                    double keystrokeVariance) {}

    public record DeviceContext(DomainModels.DeviceType deviceType, DomainModels.ScreenClass screenClass,
                                DomainModels.NetworkQuality networkQuality, double distractionLevel, double interfaceComplexity, double presentationQuality) {
        public static DeviceContext desktop() {
            return new DeviceContext(DomainModels.DeviceType.DESKTOP, DomainModels.ScreenClass.LARGE,
                    DomainModels.NetworkQuality.HIGH, 0.0, 0.2, 1.0);
        }

        public boolean mobile() {
            return deviceType == DomainModels.DeviceType.MOBILE;
        }
    }

    public record ProblemComplexity(int solutionSteps, List<Double> requiredConceptMasteries, double prerequisiteGap) {
        public ProblemComplexity {
            requiredConceptMasteries = requiredConceptMasteries == null ? List.of() : List.copyOf(requiredConceptMasteries);
        }
    }

    public record SessionContext(long sessionElapsedMs, int recentErrorStreak, double timePressure) {}

    public enum InterventionLevel { NONE, MILD, MODERATE, HIGH }

    public record LoadAssessment(double stress, double fatigue, double intrinsicLoad, double extraneousLoad,
                                 double totalLoad, double workingCapacity, boolean overload,
                                 boolean preferDifficultyReduction, InterventionLevel interventionLevel,
                                 List<String> recommendations) {}
}
