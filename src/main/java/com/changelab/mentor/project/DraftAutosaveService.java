package com.changelab.mentor.project;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

@Service
public class DraftAutosaveService {
    private static final Logger log = LoggerFactory.getLogger(DraftAutosaveService.class);

    private final ProjectStore projectStore;
    private final TaskScheduler taskScheduler;
    private final Duration quietPeriod;

    private final Map<String, PendingDraft> pending = new ConcurrentHashMap<>();

    public DraftAutosaveService(ProjectStore projectStore,
                                TaskScheduler taskScheduler,
                                @Value("${changelab.autosave.quiet-period-ms:800}") long quietPeriodMs) {
        this.projectStore = projectStore;
        this.taskScheduler = taskScheduler;
        this.quietPeriod = Duration.ofMillis(quietPeriodMs);
    }

    public void submit(String projectId, Map<String, ?> fields) {
        if (fields == null || fields.isEmpty()) return;
        pending.compute(projectId, (id, draft) -> {
            PendingDraft next = draft == null ? new PendingDraft() : draft;
            next.fields.putAll(fields);
            if (next.flush != null) {
                next.flush.cancel(false);
            }
            next.flush = taskScheduler.schedule(() -> flush(id), Instant.now().plus(quietPeriod));
            return next;
        });
    }

    public boolean hasPending(String projectId) {
        return pending.containsKey(projectId);
    }

    public void flush(String projectId) {
        PendingDraft draft = pending.remove(projectId);
        if (draft == null) return;
        if (draft.flush != null) {
            draft.flush.cancel(false);
        }
        Map<String, Object> fields = new LinkedHashMap<>(draft.fields);
        try {
            projectStore.updatePartial(projectId, fields);
            log.debug("Flushed {} draft field(s) for project {}", fields.size(), projectId);
        } catch (RuntimeException e) {
            log.warn("Draft flush failed for project {} ({} field(s)); next flush will overwrite",
                    projectId, fields.size(), e);
        }
    }

    @PreDestroy
    public void flushAll() {
        pending.keySet().forEach(this::flush);
    }

    private static final class PendingDraft {
        private final Map<String, Object> fields = new LinkedHashMap<>();
        private ScheduledFuture<?> flush;
    }
}
