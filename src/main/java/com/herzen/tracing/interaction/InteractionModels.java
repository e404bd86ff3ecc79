package com.herzen.tracing.interaction;

import com.herzen.tracing.load.LoadModels;
import com.herzen.tracing.mastery.MasteryModels;
import com.herzen.tracing.pacing.PacingModels;

import java.util.List;

public class InteractionModels {
    public record InteractionRequest(String studentId, String examCode, String subject, List<String> conceptIds,
                                     boolean correct, LoadModels.BehavioralSignals signals, LoadModels.DeviceContext device,
                                     LoadModels.SessionContext session, int solutionSteps, double prerequisiteGap,
                                     String demographicGroup, PacingModels.QuestionDescriptor nextQuestion) {}

    public record InteractionOutcome(String eventId, LoadModels.LoadAssessment load, List<MasteryModels.MasteryUpdateResult> mastery,
                                     double predictedCorrect, double calibratedPredictedCorrect,
                                     PacingModels.TimeAllocation nextAllocation, double scoreDelta, boolean eventLogged) {}
}
