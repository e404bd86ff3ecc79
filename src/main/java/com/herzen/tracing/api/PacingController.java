package com.herzen.tracing.api;

import com.herzen.tracing.pacing.PacingModels;
import com.herzen.tracing.pacing.PacingService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/pacing")
public class PacingController {
    private final PacingService pacingService;

    public PacingController(PacingService pacingService) {
        this.pacingService = pacingService;
    }

    @PostMapping("/allocate")
    public ResponseEntity<PacingModels.TimeAllocation> allocate(@RequestBody AllocateRequest request) {
        return ResponseEntity.ok(pacingService.allocateTime(request.studentId(), request.question(), request.examCode(), request.context()));
    }

    public record AllocateRequest(String studentId,
                                  String examCode,
                                  PacingModels.QuestionDescriptor question,
                                  PacingModels.PacingContext context) {}
}
