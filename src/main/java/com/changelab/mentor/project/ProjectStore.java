package com.changelab.mentor.project;

import com.changelab.mentor.project.ProjectModels.ProjectDocument;
import com.changelab.mentor.project.ProjectModels.ProjectListener;
import com.changelab.mentor.repository.ProjectDocumentJdbcRepository;
import com.changelab.mentor.repository.ProjectDocumentJdbcRepository.DocumentRow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Document store for learner projects.
 * <p>
 * Each project is one JSON document. Writes are path-scoped: a key such as
 * {@code problemExploration.thinkBig.answers} replaces only that leaf and creates missing
 * parents, so sibling fields are never clobbered. A {@code null} value removes the leaf.
 * Every committed write is pushed, as a full document, to the project's subscribers.
 */
@Service
public class ProjectStore {
    private static final Logger log = LoggerFactory.getLogger(ProjectStore.class);
    private static final int LOCK_STRIPES = 64;

    private final ProjectDocumentJdbcRepository repository;
    private final ObjectMapper objectMapper;

    private final Object[] writeLocks = new Object[LOCK_STRIPES];
    private final Map<String, List<ProjectListener>> listeners = new ConcurrentHashMap<>();

    public ProjectStore(ProjectDocumentJdbcRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        Arrays.setAll(writeLocks, i -> new Object());
    }

    public String create(String passionTopic) {
        String projectId = UUID.randomUUID().toString();
        ObjectNode data = objectMapper.createObjectNode();
        if (passionTopic == null || passionTopic.isBlank()) {
            data.putNull("passionTopic");
        } else {
            data.put("passionTopic", passionTopic.trim());
        }
        data.putNull("chosenProblem");
        data.put("currentStepId", "incubator");

        Instant now = Instant.now();
        write(new DocumentRow(projectId, serialize(data), 1, now, now));
        log.info("Created project {}", projectId);
        return projectId;
    }

    public Optional<ProjectDocument> get(String projectId) {
        if (projectId == null || projectId.isBlank()) return Optional.empty();
        return repository.load(projectId).map(this::toDocument);
    }

    public Runnable subscribe(String projectId, ProjectListener listener) {
        List<ProjectListener> forProject = listeners.computeIfAbsent(projectId, id -> new CopyOnWriteArrayList<>());
        forProject.add(listener);
        return () -> {
            forProject.remove(listener);
            listeners.computeIfPresent(projectId, (id, current) -> current.isEmpty() ? null : current);
        };
    }

    public ProjectDocument updatePartial(String projectId, Map<String, ?> pathedFields) {
        if (pathedFields == null || pathedFields.isEmpty()) {
            return get(projectId).orElseThrow(() -> new ProjectNotFoundException(projectId));
        }
        pathedFields.keySet().forEach(ProjectStore::checkPath);

        ProjectDocument committed;
        synchronized (writeLocks[Math.floorMod(projectId.hashCode(), LOCK_STRIPES)]) {
            DocumentRow current = repository.load(projectId)
                    .orElseThrow(() -> new ProjectNotFoundException(projectId));
            ObjectNode data = parse(current.document());
            pathedFields.forEach((path, value) -> applyPath(data, path, value));

            DocumentRow next = new DocumentRow(projectId, serialize(data), current.revision() + 1,
                    current.createdAt(), Instant.now());
            write(next);
            committed = toDocument(next);
        }
        publish(committed);
        return committed;
    }

    private void write(DocumentRow row) {
        try {
            repository.save(row);
        } catch (DataAccessException e) {
            throw new PersistenceWriteException(row.projectId(), e);
        }
    }

    private void publish(ProjectDocument document) {
        List<ProjectListener> forProject = listeners.get(document.projectId());
        if (forProject == null) return;
        for (ProjectListener listener : forProject) {
            try {
                listener.onChange(new ProjectDocument(document.projectId(), document.data().deepCopy(),
                        document.revision(), document.updatedAt()));
            } catch (RuntimeException e) {
                log.warn("Project listener failed for {} at revision {}", document.projectId(), document.revision(), e);
            }
        }
    }

    private void applyPath(ObjectNode root, String path, Object value) {
        String[] segments = path.split("\\.");
        ObjectNode parent = root;
        for (int i = 0; i < segments.length - 1; i++) {
            JsonNode child = parent.get(segments[i]);
            if (child instanceof ObjectNode objectChild) {
                parent = objectChild;
            } else {
                parent = parent.putObject(segments[i]);
            }
        }
        String leaf = segments[segments.length - 1];
        if (value == null) {
            parent.remove(leaf);
        } else {
            parent.set(leaf, objectMapper.valueToTree(value));
        }
    }

    private static void checkPath(String path) {
        if (path == null || path.isBlank() || path.startsWith(".") || path.endsWith(".") || path.contains("..")) {
            throw new IllegalArgumentException("Invalid field path: " + path);
        }
    }

    private ProjectDocument toDocument(DocumentRow row) {
        return new ProjectDocument(row.projectId(), parse(row.document()), row.revision(), row.updatedAt());
    }

    private ObjectNode parse(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            return node instanceof ObjectNode object ? object : objectMapper.createObjectNode();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored project document is not valid JSON", e);
        }
    }

    private String serialize(ObjectNode data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Project document cannot be serialized", e);
        }
    }
}
