package com.herzen.tracing.calibration;

import java.time.Instant;
import java.util.List;

public class CalibrationModels {
    public record FitResult(double temperature, int sampleCount, double nllBefore, double nllAfter,
                            double eceBefore, double eceAfter) {}

    public record CalibrationFit(String examCode, String subject, double temperature, int sampleCount,
                                 double nllBefore, double nllAfter, double eceBefore, double eceAfter,
                                 Instant fittedAt) {}

    public record RefitSummary(List<CalibrationFit> fitted, List<String> skipped) {}
}
