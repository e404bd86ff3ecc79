package com.herzen.tracing.calibration;

import com.herzen.tracing.config.EngineProperties;
import com.herzen.tracing.error.DegenerateCalibrationException;
import com.herzen.tracing.error.ValidationException;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class TemperatureScaling {
    private static final int ITERATIONS = 100;
    private static final double PROB_EPS = 1e-12;

    private final EngineProperties.Calibration props;

    public TemperatureScaling(EngineProperties properties) {
        this.props = properties.calibration();
    }

    public CalibrationModels.FitResult fit(List<Double> logits, List<Double> labels) {
        double[] z = toLogits(logits);
        int[] y = toLabels(labels, z.length);

        double lo = 1.0 / props.maxTemperature();
        double hi = 1.0 / props.minTemperature();
        double beta;
        if (gradient(lo, z, y) >= 0) {
            beta = lo;
        } else if (gradient(hi, z, y) <= 0) {
            beta = hi;
        } else {
            double a = lo;
            double b = hi;
            for (int i = 0; i < ITERATIONS; i++) {
                double mid = 0.5 * (a + b);
                if (gradient(mid, z, y) > 0) b = mid;
                else a = mid;
            }
            beta = 0.5 * (a + b);
        }
        double temperature = 1.0 / beta;
        return new CalibrationModels.FitResult(temperature, z.length, nll(1.0, z, y), nll(beta, z, y),
                ece(1.0, z, y, props.eceBins()), ece(beta, z, y, props.eceBins()));
    }

    public static double apply(double probability, double temperature) {
        double p = Math.max(PROB_EPS, Math.min(1.0 - PROB_EPS, probability));
        return sigmoid(logit(p) / temperature);
    }

    public static double logit(double p) {
        double q = Math.max(PROB_EPS, Math.min(1.0 - PROB_EPS, p));
        return Math.log(q / (1.0 - q));
    }

    static double sigmoid(double x) {
        if (x >= 0) return 1.0 / (1.0 + Math.exp(-x));
        double e = Math.exp(x);
        return e / (1.0 + e);
    }

    private static double gradient(double beta, double[] z, int[] y) {
        double g = 0.0;
        for (int i = 0; i < z.length; i++) g += (sigmoid(beta * z[i]) - y[i]) * z[i];
        return g;
    }

    private static double nll(double beta, double[] z, int[] y) {
        double total = 0.0;
        for (int i = 0; i < z.length; i++) {
            double p = Math.max(PROB_EPS, Math.min(1.0 - PROB_EPS, sigmoid(beta * z[i])));
            total -= y[i] == 1 ? Math.log(p) : Math.log(1.0 - p);
        }
        return total / z.length;
    }

    private static double ece(double beta, double[] z, int[] y, int bins) {
        int n = Math.max(1, bins);
        double[] confidence = new double[n];
        double[] accuracy = new double[n];
        int[] count = new int[n];
        for (int i = 0; i < z.length; i++) {
            double p = sigmoid(beta * z[i]);
            int bin = Math.min(n - 1, (int) (p * n));
            confidence[bin] += p;
            accuracy[bin] += y[i];
            count[bin]++;
        }
        double ece = 0.0;
        for (int b = 0; b < n; b++) {
            if (count[b] == 0) continue;
            ece += (double) count[b] / z.length * Math.abs(accuracy[b] / count[b] - confidence[b] / count[b]);
        }
        return ece;
    }

    private static double[] toLogits(List<Double> logits) {
        if (logits == null || logits.isEmpty()) throw new ValidationException("calibration needs at least one logit");
        double[] z = new double[logits.size()];
        for (int i = 0; i < z.length; i++) {
            Double v = logits.get(i);
            if (v == null || !Double.isFinite(v)) throw new ValidationException("logit at index " + i + " is not finite");
            z[i] = v;
        }
        return z;
    }

    private static int[] toLabels(List<Double> labels, int expected) {
        if (labels == null || labels.size() != expected) {
            throw new ValidationException("labels length " + (labels == null ? 0 : labels.size())
                    + " does not match logits length " + expected);
        }
        int[] y = new int[expected];
        int positives = 0;
        for (int i = 0; i < expected; i++) {
            Double v = labels.get(i);
            if (v == null || (v != 0.0 && v != 1.0)) throw new ValidationException("label at index " + i + " must be 0 or 1");
            y[i] = v == 1.0 ? 1 : 0;
            positives += y[i];
        }
        if (positives == 0 || positives == expected) {
            throw new DegenerateCalibrationException("labels contain a single class; temperature is not identifiable");
        }
        return y;
    }
}
