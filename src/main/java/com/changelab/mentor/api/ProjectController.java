package com.changelab.mentor.api;

import com.changelab.mentor.project.DraftAutosaveService;
import com.changelab.mentor.project.JourneyProgressService;
import com.changelab.mentor.project.ProjectEventStream;
import com.changelab.mentor.project.ProjectModels;
import com.changelab.mentor.project.ProjectNotFoundException;
import com.changelab.mentor.project.ProjectStore;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {
    private static final Set<String> PROTECTED_NAMESPACES = Set.of("convergence", "decision");

    private final ProjectStore projectStore;
    private final DraftAutosaveService draftAutosaveService;
    private final JourneyProgressService journeyProgressService;
    private final ProjectEventStream eventStream;

    public ProjectController(ProjectStore projectStore,
                             DraftAutosaveService draftAutosaveService,
                             JourneyProgressService journeyProgressService,
                             ProjectEventStream eventStream) {
        this.projectStore = projectStore;
        this.draftAutosaveService = draftAutosaveService;
        this.journeyProgressService = journeyProgressService;
        this.eventStream = eventStream;
    }

    @PostMapping
    public ResponseEntity<ProjectModels.CreateProjectResponse> create(@RequestBody(required = false) ProjectModels.CreateProjectRequest request) {
        String topic = request == null ? null : request.passionTopic();
        return ResponseEntity.ok(new ProjectModels.CreateProjectResponse(projectStore.create(topic)));
    }

    @GetMapping("/{projectId}")
    public ResponseEntity<ProjectModels.ProjectDocument> get(@PathVariable String projectId) {
        return ResponseEntity.ok(projectStore.get(projectId).orElseThrow(() -> new ProjectNotFoundException(projectId)));
    }

    @PatchMapping("/{projectId}")
    public ResponseEntity<ProjectModels.ProjectDocument> update(@PathVariable String projectId,
                                                                @RequestBody ProjectModels.PartialUpdateRequest request) {
        return ResponseEntity.ok(projectStore.updatePartial(projectId, fields(request)));
    }

    @PutMapping("/{projectId}/drafts")
    public ResponseEntity<Void> draft(@PathVariable String projectId,
                                      @RequestBody ProjectModels.PartialUpdateRequest request) {
        if (projectStore.get(projectId).isEmpty()) {
            throw new ProjectNotFoundException(projectId);
        }
        draftAutosaveService.submit(projectId, fields(request));
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/{projectId}/progress")
    public ResponseEntity<ProjectModels.JourneyProgress> progress(@PathVariable String projectId) {
        return ResponseEntity.ok(journeyProgressService.progress(projectId));
    }

    @GetMapping(path = "/{projectId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable String projectId) {
        return eventStream.open(projectId);
    }

    private static Map<String, Object> fields(ProjectModels.PartialUpdateRequest request) {
        if (request == null || request.fields() == null || request.fields().isEmpty()) {
            throw new IllegalArgumentException("fields must not be empty");
        }
        for (String path : request.fields().keySet()) {
            String root = path == null ? "" : path.split("\\.", 2)[0];
            if (PROTECTED_NAMESPACES.contains(root)) {
                throw new IllegalArgumentException("Field " + path + " is managed by the convergence session");
            }
        }
        return request.fields();
    }
}
