package com.herzen.tracing.fairness;

import java.util.List;

public class FairnessModels {
    public record GroupStatistic(String demographicGroup, double averageOutcome, long sampleCount, boolean included) {}

    public record GroupCalibration(String demographicGroup, long sampleCount, Double calibrationGap,
                                   Double truePositiveRate, Double falsePositiveRate) {}

    public record FairnessReport(String examCode, String subject, List<GroupStatistic> groups, double disparity,
                                 List<GroupCalibration> calibration, double calibrationParity, double equalizedOddsGap,
                                 boolean flagged, List<String> recommendations) {}
}
