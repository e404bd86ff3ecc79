package com.herzen.tracing.api;

import com.herzen.tracing.load.CognitiveLoadEstimator;
import com.herzen.tracing.load.LoadModels;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/load")
public class LoadController {
    private final CognitiveLoadEstimator estimator;

    public LoadController(CognitiveLoadEstimator estimator) {
        this.estimator = estimator;
    }

    @PostMapping("/assess")
    public ResponseEntity<LoadModels.LoadAssessment> assess(@RequestBody AssessRequest request) {
        return ResponseEntity.ok(estimator.assess(request.signals(), request.device(), request.problem(), request.session()));
    }

    public record AssessRequest(LoadModels.BehavioralSignals signals,
                                LoadModels.DeviceContext device,
                                LoadModels.ProblemComplexity problem,
                                LoadModels.SessionContext session) {}
}
