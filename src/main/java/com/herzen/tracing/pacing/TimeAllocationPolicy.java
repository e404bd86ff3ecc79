package com.herzen.tracing.pacing;

import com.herzen.tracing.config.EngineProperties;
import com.herzen.tracing.domain.DomainModels;
import com.herzen.tracing.error.ValidationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class TimeAllocationPolicy {
    private final EngineProperties.Pacing props;

    public TimeAllocationPolicy(EngineProperties properties) {
        this.props = properties.pacing();
    }

    public PacingModels.TimeAllocation allocate(String questionId, PacingModels.AllocationInput in) {
        validate(in);
        List<PacingModels.Adjustment> breakdown = new ArrayList<>();
        breakdown.add(new PacingModels.Adjustment("stress", 1.0 + 0.5 * in.stress()));
        breakdown.add(new PacingModels.Adjustment("fatigue", 1.0 + 0.3 * in.fatigue()));
        breakdown.add(new PacingModels.Adjustment("mastery", 1.0 - 0.3 * in.mastery()));
        breakdown.add(new PacingModels.Adjustment("difficulty", Math.max(0.5, in.difficulty()) * in.exam().difficultyFactor()));
        double hours = in.sessionElapsedMs() / 3_600_000.0;
        breakdown.add(new PacingModels.Adjustment("session", 1.0 + Math.min(0.2, hours * 0.1)));
        if (in.device() != null && in.device().mobile()) {
            if (in.device().screenClass() == DomainModels.ScreenClass.SMALL) breakdown.add(new PacingModels.Adjustment("small_screen", 1.2));
            if (in.device().networkQuality() == DomainModels.NetworkQuality.LOW) breakdown.add(new PacingModels.Adjustment("network", 1.3));
            else if (in.device().networkQuality() == DomainModels.NetworkQuality.MEDIUM) breakdown.add(new PacingModels.Adjustment("network", 1.15));
            breakdown.add(new PacingModels.Adjustment("distraction", 1.0 + 0.2 * in.device().distractionLevel()));
        }
        if (in.reduceDifficulty()) {
            breakdown.add(new PacingModels.Adjustment("recovery", props.difficultyReductionFactor()));
        }

        double product = breakdown.stream().mapToDouble(PacingModels.Adjustment::value).reduce(1.0, (a, b) -> a * b);
        double factor = Math.max(props.minFactor(), Math.min(props.maxFactor(), product));
        if (factor != product) breakdown.add(new PacingModels.Adjustment("clamp", factor / product));

        long scaled = Math.round(in.baseTimeMs() * factor);
        long cap = in.exam().maxQuestionTimeMs();
        boolean capped = scaled > cap;
        long finalTime = Math.min(scaled, cap);
        return new PacingModels.TimeAllocation(questionId, in.exam().code(), in.baseTimeMs(), factor, finalTime, capped,
                in.mastery(), List.copyOf(breakdown));
    }

    public static void validateQuestion(PacingModels.QuestionDescriptor q) {
        if (q == null) throw new ValidationException("question is required");
        if (q.conceptId() == null || q.conceptId().isBlank()) throw new ValidationException("question conceptId must not be blank");
        if (q.baseTimeMs() <= 0) throw new ValidationException("base time must be > 0, got " + q.baseTimeMs());
        requireUnit("difficulty", q.difficulty());
    }

    private static void validate(PacingModels.AllocationInput in) {
        if (in.exam() == null) throw new ValidationException("exam is required");
        if (in.baseTimeMs() <= 0) throw new ValidationException("base time must be > 0, got " + in.baseTimeMs());
        if (in.sessionElapsedMs() < 0) throw new ValidationException("session elapsed time must be >= 0");
        requireUnit("stress", in.stress());
        requireUnit("fatigue", in.fatigue());
        requireUnit("mastery", in.mastery());
        requireUnit("difficulty", in.difficulty());
        if (in.device() != null) requireUnit("distractionLevel", in.device().distractionLevel());
    }

    private static void requireUnit(String name, double v) {
        if (!(v >= 0.0 && v <= 1.0)) throw new ValidationException(name + " must be in [0,1], got " + v);
    }
}
