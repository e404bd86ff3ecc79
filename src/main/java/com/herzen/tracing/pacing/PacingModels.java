package com.herzen.tracing.pacing;

import com.herzen.tracing.exam.ExamCatalog.ExamConfig;
import com.herzen.tracing.load.LoadModels;

import java.util.List;

public class PacingModels {
    public record QuestionDescriptor(String questionId, String conceptId, String subject, long baseTimeMs,
                                     double difficulty) {}

    public record PacingContext(double stress, double fatigue, long sessionElapsedMs, LoadModels.DeviceContext device,
                                boolean reduceDifficulty) {}

    public record AllocationInput(long baseTimeMs, double stress, double fatigue, double mastery, double difficulty,
                                  long sessionElapsedMs, ExamConfig exam, LoadModels.DeviceContext device,
                                  boolean reduceDifficulty) {}

    public record Adjustment(String name, double value) {}

    public record TimeAllocation(String questionId, String examCode, long baseTimeMs, double factor, long finalTimeMs,
                                 boolean capped, double mastery, List<Adjustment> breakdown) {}
}
