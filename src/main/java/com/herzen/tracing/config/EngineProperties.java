package com.herzen.tracing.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "tracing")
public record EngineProperties(@DefaultValue Mastery mastery,
                               @DefaultValue Transfer transfer,
                               @DefaultValue Load load,
                               @DefaultValue Pacing pacing,
                               @DefaultValue Calibration calibration,
                               @DefaultValue Fairness fairness,
                               @DefaultValue Store store,
                               Map<String, Exam> exams) {

    public EngineProperties {
        exams = exams == null ? Map.of() : Map.copyOf(exams);
    }

    public record Mastery(@DefaultValue("0.25") double defaultPrior,
                          @DefaultValue("1e-6") double epsilon,
                          @DefaultValue("0.3") double recoveryFloor,
                          @DefaultValue("3") int recoveryStreak,
                          @DefaultValue("0.10") double stressSlipBoost,
                          @DefaultValue("0.10") double stressGuessBoost,
                          @DefaultValue("0.05") double rapidGuessBoost,
                          @DefaultValue("1000") long rapidResponseMs,
                          @DefaultValue("0.95") double maxCombinedRate,
                          @DefaultValue DefaultParameters defaultParameters) {}

    public record DefaultParameters(@DefaultValue("0.3") double learnRate,
                                    @DefaultValue("0.1") double slipRate,
                                    @DefaultValue("0.2") double guessRate,
                                    @DefaultValue("0.0") double forgettingRate) {}

    public record Transfer(@DefaultValue("0.5") double factor,
                           List<Edge> edges) {
        public Transfer {
            edges = edges == null ? List.of() : List.copyOf(edges);
        }
    }

    public record Edge(String source, String target, double weight) {}

    public record Load(@DefaultValue("0.7") double overloadThreshold,
                       @DefaultValue("0.05") double mobileBaseFriction) {}

    public record Pacing(@DefaultValue("0.5") double minFactor,
                         @DefaultValue("2.0") double maxFactor,
                         @DefaultValue("1.15") double difficultyReductionFactor) {}

    public record Calibration(@DefaultValue("0.05") double minTemperature,
                              @DefaultValue("100.0") double maxTemperature,
                              @DefaultValue("200") int minSamples,
                              @DefaultValue("10") int eceBins) {}

    public record Fairness(@DefaultValue("0.08") double disparityThreshold,
                           @DefaultValue("0.15") double severeThreshold,
                           @DefaultValue("30") int minSamples,
                           @DefaultValue("20") int calibrationMinSamples,
                           @DefaultValue("0.15") double calibrationParityThreshold,
                           @DefaultValue("0.1") double equalizedOddsThreshold) {}

    public record Store(@DefaultValue("40ms") Duration timeout,
                        @DefaultValue("8") int workerThreads) {}

    public record Exam(long maxQuestionTimeMs,
                       @DefaultValue("1.0") double difficultyFactor,
                       @DefaultValue ScoringScheme scoring,
                       Map<String, Double> subjectWeightings) {
        public Exam {
            subjectWeightings = subjectWeightings == null ? Map.of() : Map.copyOf(subjectWeightings);
        }
    }

    public record ScoringScheme(@DefaultValue("4") double correctScore,
                                @DefaultValue("-1") double incorrectScore) {}
}
