package com.changelab.mentor.project;

import com.changelab.mentor.project.ProjectModels.ProjectDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class ProjectEventStream {
    private static final Logger log = LoggerFactory.getLogger(ProjectEventStream.class);

    private final ProjectStore projectStore;
    private final long timeoutMs;

    public ProjectEventStream(ProjectStore projectStore,
                              @Value("${changelab.events.timeout-ms:0}") long timeoutMs) {
        this.projectStore = projectStore;
        this.timeoutMs = timeoutMs;
    }

    public SseEmitter open(String projectId) {
        return attach(projectId, new SseEmitter(timeoutMs));
    }

    // one sender thread per client; store writes never wait on it
    public SseEmitter attach(String projectId, SseEmitter emitter) {
        ProjectDocument initial = projectStore.get(projectId)
                .orElseThrow(() -> new ProjectNotFoundException(projectId));
        ExecutorService sender = Executors.newSingleThreadExecutor();
        AtomicReference<Runnable> unsubscribe = new AtomicReference<>(() -> {});
        Runnable close = () -> {
            unsubscribe.get().run();
            sender.shutdown();
        };

        sender.execute(() -> send(projectId, emitter, initial, close));
        unsubscribe.set(projectStore.subscribe(projectId, document -> {
            if (!sender.isShutdown()) {
                sender.execute(() -> send(projectId, emitter, document, close));
            }
        }));
        emitter.onCompletion(close);
        emitter.onTimeout(close);
        emitter.onError(e -> close.run());
        return emitter;
    }

    private void send(String projectId, SseEmitter emitter, ProjectDocument document, Runnable close) {
        try {
            emitter.send(SseEmitter.event().name("project").id(Long.toString(document.revision())).data(body(document)));
        } catch (IOException | IllegalStateException e) {
            log.debug("Event client for {} went away", projectId);
            close.run();
            emitter.completeWithError(e);
        }
    }

    private static Map<String, Object> body(ProjectDocument document) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("projectId", document.projectId());
        body.put("revision", document.revision());
        body.put("updatedAt", document.updatedAt().toString());
        body.put("data", document.data());
        return body;
    }
}
