package com.herzen.tracing.fairness;

import com.herzen.tracing.domain.DomainModels;

import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

final class GroupCalibrationMetrics {
    private static final double DECISION_THRESHOLD = 0.5;

    private GroupCalibrationMetrics() {
    }

    static FairnessModels.GroupCalibration measure(String group, List<DomainModels.InteractionEvent> events,
                                                   int minSamples, int bins) {
        Double gap = events.size() >= minSamples ? calibrationError(events, bins) : null;
        long tp = 0, fn = 0, fp = 0, tn = 0;
        for (DomainModels.InteractionEvent e : events) {
            boolean predicted = e.predictedCorrect() > DECISION_THRESHOLD;
            if (e.correct()) {
                if (predicted) tp++;
                else fn++;
            } else {
                if (predicted) fp++;
                else tn++;
            }
        }
        // rates are only comparable when the group has seen both outcomes
        boolean bothOutcomes = tp + fn > 0 && fp + tn > 0;
        Double tpr = bothOutcomes ? (double) tp / (tp + fn) : null;
        Double fpr = bothOutcomes ? (double) fp / (fp + tn) : null;
        return new FairnessModels.GroupCalibration(group, events.size(), gap, tpr, fpr);
    }

    static double calibrationParity(List<FairnessModels.GroupCalibration> groups) {
        return spread(groups, FairnessModels.GroupCalibration::calibrationGap);
    }

    static double equalizedOddsGap(List<FairnessModels.GroupCalibration> groups) {
        return Math.max(spread(groups, FairnessModels.GroupCalibration::truePositiveRate),
                spread(groups, FairnessModels.GroupCalibration::falsePositiveRate));
    }

    private static double calibrationError(List<DomainModels.InteractionEvent> events, int bins) {
        double[] confidence = new double[bins];
        double[] hits = new double[bins];
        int[] counts = new int[bins];
        for (DomainModels.InteractionEvent e : events) {
            int b = Math.min(bins - 1, (int) (e.predictedCorrect() * bins));
            confidence[b] += e.predictedCorrect();
            hits[b] += e.correct() ? 1.0 : 0.0;
            counts[b]++;
        }
        double error = 0.0;
        for (int b = 0; b < bins; b++) {
            if (counts[b] == 0) continue;
            error += counts[b] * Math.abs(hits[b] / counts[b] - confidence[b] / counts[b]);
        }
        return error / events.size();
    }

    private static double spread(List<FairnessModels.GroupCalibration> groups,
                                 Function<FairnessModels.GroupCalibration, Double> metric) {
        DoubleSummaryStatistics stats = groups.stream()
                .map(metric)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .summaryStatistics();
        return stats.getCount() < 2 ? 0.0 : stats.getMax() - stats.getMin();
    }
}
