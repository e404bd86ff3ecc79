package com.herzen.tracing.load;

import com.herzen.tracing.config.EngineProperties;
import com.herzen.tracing.domain.DomainModels;
import com.herzen.tracing.error.ValidationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class CognitiveLoadEstimator {
    private static final double PACE_WEIGHT = 0.35;
    private static final double HESITATION_WEIGHT = 0.20;
    private static final double KEYSTROKE_WEIGHT = 0.15;
    private static final double ERROR_STREAK_WEIGHT = 0.20;
    private static final double FATIGUE_WEIGHT = 0.10;

    private static final double HESITATION_SATURATION_MS = 5000.0;
    private static final double KEYSTROKE_SATURATION = 0.6;
    private static final double ERROR_STREAK_SATURATION = 5.0;
    private static final double FATIGUE_SATURATION_MINUTES = 120.0;

    private static final double MILD_STRESS = 0.2;
    private static final double MODERATE_STRESS = 0.4;
    private static final double HIGH_STRESS = 0.7;

    private final EngineProperties.Load props;

    public CognitiveLoadEstimator(EngineProperties properties) {
        this.props = properties.load();
    }

    public LoadModels.LoadAssessment assess(LoadModels.BehavioralSignals signals, LoadModels.DeviceContext device,
                                            LoadModels.ProblemComplexity problem, LoadModels.SessionContext session) {
        validate(signals, device, problem, session);

        double fatigue = clamp(session.sessionElapsedMs() / 60_000.0 / FATIGUE_SATURATION_MINUTES);
        double pace = clamp(((double) signals.responseTimeMs() / signals.expectedTimeMs() - 1.0) / 2.0);
        double stress = clamp(PACE_WEIGHT * pace
                + HESITATION_WEIGHT * clamp(signals.hesitationMs() / HESITATION_SATURATION_MS)
                + KEYSTROKE_WEIGHT * clamp(signals.keystrokeVariance() / KEYSTROKE_SATURATION)
                + ERROR_STREAK_WEIGHT * clamp(session.recentErrorStreak() / ERROR_STREAK_SATURATION)
                + FATIGUE_WEIGHT * fatigue);

        double novelty = 1.0 - problem.requiredConceptMasteries().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double steps = clamp(Math.log(problem.solutionSteps() + 1.0) / Math.log(2) / 5.0);
        double intrinsic = clamp(0.4 * steps + 0.3 * novelty + 0.3 * problem.prerequisiteGap());

        double extraneous = extraneousLoad(device, session.timePressure(), stress);
        double capacity = Math.max(0.3, 1.0 - 0.4 * stress - 0.3 * fatigue);
        double total = clamp((0.55 * intrinsic + 0.45 * extraneous) / capacity);
        boolean overload = total > props.overloadThreshold();
        LoadModels.InterventionLevel level = interventionLevel(stress);

        return new LoadModels.LoadAssessment(stress, fatigue, intrinsic, extraneous, total, capacity, overload, overload, level,
                recommendations(overload, intrinsic, problem.prerequisiteGap(), device, level, fatigue));
    }

    double extraneousLoad(LoadModels.DeviceContext device, double timePressure, double stress) {
        boolean mobile = device.mobile();
        double raw = 0.30 * timePressure * (mobile ? 1.10 : 1.0)
                + 0.20 * device.interfaceComplexity() * (mobile ? 1.15 : 1.0)
                + 0.20 * device.distractionLevel() * (mobile ? 1.20 : 1.0)
                + 0.10 * (1.0 - device.presentationQuality()) * (mobile ? 1.10 : 1.0)
                + 0.10 * networkPenalty(device.networkQuality())
                + 0.10 * stress;
        if (mobile) raw += props.mobileBaseFriction();
        return 1.0 - Math.exp(-2.0 * raw);
    }

    private static LoadModels.InterventionLevel interventionLevel(double stress) {
        if (stress >= HIGH_STRESS) return LoadModels.InterventionLevel.HIGH;
        if (stress >= MODERATE_STRESS) return LoadModels.InterventionLevel.MODERATE;
        if (stress >= MILD_STRESS) return LoadModels.InterventionLevel.MILD;
        return LoadModels.InterventionLevel.NONE;
    }

    private static List<String> recommendations(boolean overload, double intrinsic, double prerequisiteGap,
                                                LoadModels.DeviceContext device, LoadModels.InterventionLevel level, double fatigue) {
        List<String> out = new ArrayList<>();
        if (overload) out.add("Reduce difficulty for the next question");
        if (level == LoadModels.InterventionLevel.HIGH) out.add("Suggest a short breathing break");
        if (fatigue > 0.75) out.add("Session is long; recommend a 10 minute break");
        if (intrinsic > 0.7) out.add("Split the problem into smaller steps");
        if (prerequisiteGap > 0.5) out.add("Review prerequisite concepts first");
        if (device.mobile() && device.distractionLevel() > 0.5) out.add("Enable focus mode or move to a quieter place");
        if (device.networkQuality() == DomainModels.NetworkQuality.LOW) out.add("Preload content to avoid network delays");
        return out;
    }

    private static double networkPenalty(DomainModels.NetworkQuality quality) {
        return switch (quality) {
            case HIGH -> 0.0;
            case MEDIUM -> 0.5;
            case LOW -> 1.0;
        };
    }

    private static void validate(LoadModels.BehavioralSignals signals, LoadModels.DeviceContext device,
                                 LoadModels.ProblemComplexity problem, LoadModels.SessionContext session) {
        if (signals == null || device == null || problem == null || session == null) {
            throw new ValidationException("signals, device, problem and session are required");
        }
        if (signals.responseTimeMs() < 0 || signals.hesitationMs() < 0) {
            throw new ValidationException("response and hesitation times must be >= 0");
        }
        if (signals.expectedTimeMs() <= 0) throw new ValidationException("expected time must be > 0");
        if (!(signals.keystrokeVariance() >= 0)) throw new ValidationException("keystroke variance must be >= 0");
        if (device.deviceType() == null || device.networkQuality() == null) {
            throw new ValidationException("device type and network quality are required");
        }
        requireUnit("distractionLevel", device.distractionLevel());
        requireUnit("interfaceComplexity", device.interfaceComplexity());
        requireUnit("presentationQuality", device.presentationQuality());
        requireUnit("prerequisiteGap", problem.prerequisiteGap());
        requireUnit("timePressure", session.timePressure());
        if (problem.solutionSteps() < 0) throw new ValidationException("solution steps must be >= 0");
        for (Double m : problem.requiredConceptMasteries()) {
            if (m == null || !(m >= 0.0 && m <= 1.0)) throw new ValidationException("required concept mastery must be in [0,1]");
        }
        if (session.sessionElapsedMs() < 0 || session.recentErrorStreak() < 0) {
            throw new ValidationException("session elapsed time and error streak must be >= 0");
        }
    }

    private static void requireUnit(String name, double v) {
        if (!(v >= 0.0 && v <= 1.0)) throw new ValidationException(name + " must be in [0,1], got " + v);
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
