package com.changelab.mentor.api;

import com.changelab.mentor.orchestrator.Orchestrator;
import com.changelab.mentor.orchestrator.OrchestratorModels.AiRequest;
import com.changelab.mentor.orchestrator.OrchestratorModels.AiResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/ai")
public class AiController {
    private final Orchestrator orchestrator;

    public AiController(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public ResponseEntity<AiResponse> handle(@RequestBody AiRequest request) {
        return ResponseEntity.ok(orchestrator.handle(request));
    }
}
