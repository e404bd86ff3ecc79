package com.herzen.tracing.mastery;

import com.herzen.tracing.config.EngineProperties;
import com.herzen.tracing.domain.DomainModels;
import com.herzen.tracing.error.ConfigurationException;
import com.herzen.tracing.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

@Component
public class BayesianMasteryUpdater {
    private static final Logger log = LoggerFactory.getLogger(BayesianMasteryUpdater.class);
    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private final EngineProperties.Mastery props;

    public BayesianMasteryUpdater(EngineProperties properties) {
        this.props = properties.mastery();
    }

    public MasteryModels.UpdateOutcome update(DomainModels.KnowledgeState state, DomainModels.ConceptParameters params,
                                              boolean correct, MasteryModels.UpdateContext ctx) {
        validateParameters(params);
        validateContext(ctx);
        double stored = state.masteryProbability();
        if (!(stored >= 0.0 && stored <= 1.0)) {
            throw new ValidationException("mastery probability must be in [0,1], got " + stored + " for " + state.conceptId());
        }

        double eps = props.epsilon();
        double p = decay(stored, initialPrior(params), params.forgettingRate(), state.lastPracticed(), ctx.now());
        p = clamp(p, eps, 1.0 - eps);

        double s = params.slipRate();
        double g = params.guessRate();
        double slipBoost = props.stressSlipBoost() * ctx.stress();
        double guessBoost = props.stressGuessBoost() * ctx.stress();
        if (ctx.responseTimeMs() > 0 && ctx.responseTimeMs() < props.rapidResponseMs()) {
            guessBoost += props.rapidGuessBoost();
        }
        double ceiling = Math.max(s + g, props.maxCombinedRate());
        double boost = slipBoost + guessBoost;
        if (boost > 0 && s + g + boost > ceiling) {
            double scale = Math.max(0.0, ceiling - s - g) / boost;
            slipBoost *= scale;
            guessBoost *= scale;
        }
        double slip = Math.min(1.0, s + slipBoost);
        double guess = Math.min(1.0, g + guessBoost);

        double predicted = p * (1 - slip) + (1 - p) * guess;
        double numerator = correct ? p * (1 - slip) : p * slip;
        double denominator = correct ? numerator + (1 - p) * guess : numerator + (1 - p) * (1 - guess);
        double observed = numerator / Math.max(denominator, eps);
        double next = clamp(observed + (1 - observed) * params.learnRate(), 0.0, 1.0);

        int count = state.practiceCount() + 1;
        int streak = correct ? 0 : state.incorrectStreak() + 1;
        boolean recovery = next < props.recoveryFloor() && streak >= props.recoveryStreak();
        double confidence = clamp(1.0 - 2.0 * Math.sqrt(next * (1 - next) / count), 0.0, 1.0);

        log.debug("bkt {}/{} correct={} p={} S'={} G'={} p_obs={} p'={}",
                state.studentId(), state.conceptId(), correct, p, slip, guess, observed, next);

        DomainModels.KnowledgeState updated = new DomainModels.KnowledgeState(state.studentId(), state.conceptId(), next, count, streak, ctx.now());
        return new MasteryModels.UpdateOutcome(updated, p, clamp(predicted, 0.0, 1.0), slip, guess, recovery, confidence);
    }

    public void validateParameters(DomainModels.ConceptParameters params) {
        requireRate("learnRate", params.learnRate(), params);
        requireRate("slipRate", params.slipRate(), params);
        requireRate("guessRate", params.guessRate(), params);
        requireRate("forgettingRate", params.forgettingRate(), params);
        if (params.slipRate() + params.guessRate() >= 1.0) {
            throw new ConfigurationException("slip + guess must be < 1 for concept " + params.conceptId()
                    + " (slip=" + params.slipRate() + ", guess=" + params.guessRate() + ")");
        }
        double prior = initialPrior(params);
        if (!(prior >= 0.0 && prior <= 1.0)) {
            throw new ValidationException("prior mastery must be in [0,1] for concept " + params.conceptId() + ", got " + prior);
        }
    }

    public double initialPrior(DomainModels.ConceptParameters params) {
        return params.prior() != null ? params.prior() : props.defaultPrior();
    }

    private double decay(double p, double floor, double forgettingRate, Instant lastPracticed, Instant now) {
        if (forgettingRate <= 0 || lastPracticed == null || now == null) return p;
        double days = Duration.between(lastPracticed, now).toMillis() / MILLIS_PER_DAY;
        if (days <= 1.0) return p;
        double decayed = p * Math.exp(-forgettingRate * days);
        return Math.min(p, Math.max(decayed, floor));
    }

    private void validateContext(MasteryModels.UpdateContext ctx) {
        if (ctx == null) throw new ValidationException("update context is required");
        if (!(ctx.stress() >= 0.0 && ctx.stress() <= 1.0)) {
            throw new ValidationException("stress must be in [0,1], got " + ctx.stress());
        }
        if (ctx.responseTimeMs() < 0) {
            throw new ValidationException("response time must be >= 0, got " + ctx.responseTimeMs());
        }
        if (ctx.now() == null) throw new ValidationException("update time is required");
    }

    private static void requireRate(String name, double value, DomainModels.ConceptParameters params) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new ConfigurationException(name + " must be in [0,1] for concept " + params.conceptId() + ", got " + value);
        }
    }

    static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
