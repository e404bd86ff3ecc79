package com.herzen.tracing.api;

import com.herzen.tracing.interaction.InteractionModels;
import com.herzen.tracing.interaction.InteractionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/interactions")
public class InteractionController {
    private final InteractionService interactionService;

    public InteractionController(InteractionService interactionService) {
        this.interactionService = interactionService;
    }

    @PostMapping
    public ResponseEntity<InteractionModels.InteractionOutcome> submit(@RequestBody InteractionModels.InteractionRequest request) {
        return ResponseEntity.ok(interactionService.submit(request));
    }
}
