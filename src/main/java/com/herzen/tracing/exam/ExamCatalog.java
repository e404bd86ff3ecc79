package com.herzen.tracing.exam;

import com.herzen.tracing.config.EngineProperties;
import com.herzen.tracing.error.ConfigurationException;
import com.herzen.tracing.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class ExamCatalog {
    private static final Logger log = LoggerFactory.getLogger(ExamCatalog.class);

    private final Map<String, ExamConfig> exams;

    public ExamCatalog(EngineProperties properties) {
        Map<String, ExamConfig> map = new TreeMap<>();
        properties.exams().forEach((code, e) -> {
            if (e.maxQuestionTimeMs() <= 0) {
                throw new ConfigurationException("exam " + code + " needs a positive max-question-time-ms");
            }
            if (!(e.difficultyFactor() > 0)) {
                throw new ConfigurationException("exam " + code + " needs a positive difficulty-factor");
            }
            double weightSum = e.subjectWeightings().values().stream().mapToDouble(Double::doubleValue).sum();
            if (!e.subjectWeightings().isEmpty() && Math.abs(weightSum - 1.0) > 1e-6) {
                log.warn("Subject weightings for exam {} sum to {}, not 1", code, weightSum);
            }
            map.put(code, new ExamConfig(code, e.maxQuestionTimeMs(), e.difficultyFactor(),
                    e.scoring().correctScore(), e.scoring().incorrectScore(), e.subjectWeightings()));
        });
        this.exams = Collections.unmodifiableMap(map);
    }

    public ExamConfig require(String examCode) {
        if (examCode == null || examCode.isBlank()) throw new ValidationException("exam code must not be blank");
        ExamConfig exam = exams.get(examCode);
        if (exam == null) throw new ValidationException("unknown exam code " + examCode + ", known: " + exams.keySet());
        return exam;
    }

    public double scoreDelta(String examCode, boolean correct) {
        ExamConfig exam = require(examCode);
        return correct ? exam.correctScore() : exam.incorrectScore();
    }

    public Set<String> codes() {
        return exams.keySet();
    }

    public record ExamConfig(String code, long maxQuestionTimeMs, double difficultyFactor, double correctScore,
                             double incorrectScore, Map<String, Double> subjectWeightings) {}
}
