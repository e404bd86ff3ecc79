package com.herzen.tracing.api;

import com.herzen.tracing.calibration.CalibrationModels;
import com.herzen.tracing.calibration.CalibrationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/calibration")
public class CalibrationController {
    private final CalibrationService calibrationService;

    public CalibrationController(CalibrationService calibrationService) {
        this.calibrationService = calibrationService;
    }

    @PostMapping("/fit")
    public ResponseEntity<CalibrationModels.CalibrationFit> fit(@RequestBody FitRequest request) {
        return ResponseEntity.ok(calibrationService.fit(request.examCode(), request.subject(), request.logits(), request.labels()));
    }

    @GetMapping("/apply")
    public ResponseEntity<ApplyResponse> apply(@RequestParam String examCode,
                                               @RequestParam String subject,
                                               @RequestParam double rawScore) {
        return ResponseEntity.ok(new ApplyResponse(rawScore, calibrationService.apply(examCode, subject, rawScore)));
    }

    @GetMapping
    public ResponseEntity<CalibrationModels.CalibrationFit> current(@RequestParam String examCode, @RequestParam String subject) {
        return calibrationService.current(examCode, subject)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/refit")
    public ResponseEntity<CalibrationModels.RefitSummary> refit() {
        return ResponseEntity.ok(calibrationService.refit());
    }

    public record FitRequest(String examCode, String subject, List<Double> logits, List<Double> labels) {}

    public record ApplyResponse(double rawScore, double calibratedScore) {}
}
