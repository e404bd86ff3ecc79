package com.herzen.tracing.api;

import com.herzen.tracing.fairness.FairnessModels;
import com.herzen.tracing.fairness.FairnessMonitor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/fairness")
public class FairnessController {
    private final FairnessMonitor fairnessMonitor;

    public FairnessController(FairnessMonitor fairnessMonitor) {
        this.fairnessMonitor = fairnessMonitor;
    }

    @PostMapping("/record")
    public ResponseEntity<Void> record(@RequestBody RecordRequest request) {
        fairnessMonitor.record(request.examCode(), request.subject(), request.group(), request.outcome());
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/report")
    public ResponseEntity<FairnessModels.FairnessReport> report(@RequestParam String examCode, @RequestParam String subject) {
        return ResponseEntity.ok(fairnessMonitor.report(examCode, subject));
    }

    @PostMapping("/audit")
    public ResponseEntity<List<FairnessModels.FairnessReport>> audit() {
        return ResponseEntity.ok(fairnessMonitor.audit());
    }

    public record RecordRequest(String examCode, String subject, String group, double outcome) {}
}
