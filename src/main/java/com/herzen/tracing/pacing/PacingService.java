package com.herzen.tracing.pacing;

import com.herzen.tracing.config.EngineProperties;
import com.herzen.tracing.error.ValidationException;
import com.herzen.tracing.exam.ExamCatalog;
import com.herzen.tracing.exam.ExamCatalog.ExamConfig;
import com.herzen.tracing.mastery.MasteryModels;
import com.herzen.tracing.mastery.MasteryService;
import org.springframework.stereotype.Service;

@Service
public class PacingService {
    private final TimeAllocationPolicy policy;
    private final ExamCatalog exams;
    private final MasteryService masteryService;
    private final EngineProperties.Mastery masteryProps;

    public PacingService(TimeAllocationPolicy policy, ExamCatalog exams, MasteryService masteryService,
                         EngineProperties properties) {
        this.policy = policy;
        this.exams = exams;
        this.masteryService = masteryService;
        this.masteryProps = properties.mastery();
    }

    public PacingModels.TimeAllocation allocateTime(String studentId, PacingModels.QuestionDescriptor question, String examCode,
                                                    PacingModels.PacingContext ctx) {
        ExamConfig exam = exams.require(examCode);
        TimeAllocationPolicy.validateQuestion(question);
        if (ctx == null) throw new ValidationException("pacing context is required");

        MasteryModels.MasteryView mastery = masteryService.currentMastery(studentId, question.conceptId());
        boolean recovery = mastery.masteryProbability() < masteryProps.recoveryFloor()
                && mastery.incorrectStreak() >= masteryProps.recoveryStreak();
        PacingModels.AllocationInput in = new PacingModels.AllocationInput(question.baseTimeMs(), ctx.stress(), ctx.fatigue(),
                mastery.masteryProbability(), question.difficulty(), ctx.sessionElapsedMs(), exam, ctx.device(),
                ctx.reduceDifficulty() || recovery);
        return policy.allocate(question.questionId(), in);
    }
}
