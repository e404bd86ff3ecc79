package com.herzen.tracing.api;

import com.herzen.tracing.mastery.MasteryModels;
import com.herzen.tracing.mastery.MasteryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

@RestController
@RequestMapping("/api/mastery")
public class MasteryController {
    private final MasteryService masteryService;

    public MasteryController(MasteryService masteryService) {
        this.masteryService = masteryService;
    }

    @PostMapping("/update")
    public ResponseEntity<MasteryModels.MasteryUpdateResult> update(@RequestBody UpdateRequest request) {
        MasteryModels.UpdateContext ctx = new MasteryModels.UpdateContext(request.stress(), request.responseTimeMs(), Instant.now());
        return ResponseEntity.ok(masteryService.updateMastery(request.studentId(), request.conceptId(), request.correct(), ctx));
    }

    @GetMapping
    public ResponseEntity<MasteryModels.MasteryView> current(@RequestParam String studentId, @RequestParam String conceptId) {
        return ResponseEntity.ok(masteryService.currentMastery(studentId, conceptId));
    }

    public record UpdateRequest(String studentId, String conceptId, boolean correct, double stress, long responseTimeMs) {}
}
