package com.changelab.mentor.api;

import com.changelab.mentor.convergence.ConvergenceModels;
import com.changelab.mentor.convergence.ConvergenceService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/projects/{projectId}/convergence")
public class ConvergenceController {
    private final ConvergenceService convergenceService;

    public ConvergenceController(ConvergenceService convergenceService) {
        this.convergenceService = convergenceService;
    }

    @GetMapping
    public ResponseEntity<ConvergenceModels.ConvergenceSession> view(@PathVariable String projectId) {
        return ResponseEntity.ok(convergenceService.view(projectId));
    }

    @PostMapping("/reflect")
    public ResponseEntity<ConvergenceModels.ConvergenceSession> reflect(@PathVariable String projectId) {
        return ResponseEntity.ok(convergenceService.evaluateReflectionTrigger(projectId));
    }

    @PostMapping("/candidates")
    public ResponseEntity<ConvergenceModels.ConvergenceSession> choose(@PathVariable String projectId,
                                                                       @RequestBody ConvergenceModels.ChooseRequest request) {
        return ResponseEntity.ok(convergenceService.chooseCandidates(projectId, request.candidateIds()));
    }

    @PostMapping("/messages")
    public ResponseEntity<ConvergenceModels.ConvergenceSession> message(@PathVariable String projectId,
                                                                        @RequestBody ConvergenceModels.MessageRequest request) {
        return ResponseEntity.ok(convergenceService.sendMessage(projectId, request.text()));
    }

    @PostMapping("/phase/confirm")
    public ResponseEntity<ConvergenceModels.ConvergenceSession> confirmPhase(@PathVariable String projectId) {
        return ResponseEntity.ok(convergenceService.confirmPhase(projectId));
    }

    @PostMapping("/direction/confirm")
    public ResponseEntity<ConvergenceModels.ConvergenceSession> confirmDirection(@PathVariable String projectId) {
        return ResponseEntity.ok(convergenceService.confirmDirection(projectId));
    }

    @PostMapping("/variants")
    public ResponseEntity<ConvergenceModels.ConvergenceSession> variants(@PathVariable String projectId) {
        return ResponseEntity.ok(convergenceService.generateVariants(projectId));
    }

    @PostMapping("/ideas/like")
    public ResponseEntity<ConvergenceModels.ConvergenceSession> like(@PathVariable String projectId,
                                                                     @RequestBody ConvergenceModels.IdeaRequest request) {
        return ResponseEntity.ok(convergenceService.likeVariant(projectId, request.text()));
    }

    @PostMapping("/ideas")
    public ResponseEntity<ConvergenceModels.ConvergenceSession> addIdea(@PathVariable String projectId,
                                                                        @RequestBody ConvergenceModels.IdeaRequest request) {
        return ResponseEntity.ok(convergenceService.addIdea(projectId, request.text()));
    }

    @PostMapping("/ideas/remove")
    public ResponseEntity<ConvergenceModels.ConvergenceSession> removeIdea(@PathVariable String projectId,
                                                                           @RequestBody ConvergenceModels.IdeaRequest request) {
        return ResponseEntity.ok(convergenceService.removeIdea(projectId, request.text()));
    }

    @PostMapping("/selection")
    public ResponseEntity<ConvergenceModels.ConvergenceSession> selection(@PathVariable String projectId) {
        return ResponseEntity.ok(convergenceService.proceedToSelection(projectId));
    }

    @PostMapping("/lock")
    public ResponseEntity<ConvergenceModels.ConvergenceSession> lock(@PathVariable String projectId,
                                                                     @RequestBody ConvergenceModels.IdeaRequest request) {
        return ResponseEntity.ok(convergenceService.lock(projectId, request.text()));
    }

    @PostMapping("/reset")
    public ResponseEntity<ConvergenceModels.ConvergenceSession> reset(@PathVariable String projectId) {
        return ResponseEntity.ok(convergenceService.reset(projectId));
    }
}
