package com.changelab.mentor.convergence;

import com.changelab.mentor.context.FocusAction;
import com.changelab.mentor.convergence.ConvergenceModels.CoDesignPhase;
import com.changelab.mentor.convergence.ConvergenceModels.ConversationEntry;
import com.changelab.mentor.convergence.ConvergenceModels.ConvergenceSession;
import com.changelab.mentor.convergence.ConvergenceModels.Role;
import com.changelab.mentor.convergence.ConvergenceModels.Stage;
import com.changelab.mentor.interpreter.InterpreterModels.InterpretedResponse;
import com.changelab.mentor.orchestrator.Orchestrator;
import com.changelab.mentor.project.ProjectModels.ProjectDocument;
import com.changelab.mentor.project.ProjectNotFoundException;
import com.changelab.mentor.project.ProjectStore;
import com.changelab.mentor.strategy.FocusPayloads.ConvergencePayload;
import com.changelab.mentor.strategy.FocusPayloads.HistoryLine;
import com.changelab.mentor.strategy.SolutionStrategies;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Convergence session state machine: Reflect, Choose, CoDesign, Variants, Selection, Locked.
 * <p>
 * The session lives in the project document under {@code convergence}. Learner-driven transitions
 * are read-modify-write under a per-project lock. Reasoning-backed transitions check their
 * precondition, call out without holding the lock, and apply the result only if the session is
 * still where it was; a failed call leaves the session untouched. At most one reasoning-backed
 * transition runs per project.
 */
@Service
public class ConvergenceService {
    private static final Logger log = LoggerFactory.getLogger(ConvergenceService.class);

    static final String REFLECTION_GUARD = "reflection";
    static final int MAX_CANDIDATES = 3;
    private static final int LOCK_STRIPES = 64;

    private final ProjectStore projectStore;
    private final Orchestrator orchestrator;
    private final IdeaNormalizer normalizer;
    private final ObjectMapper objectMapper;
    private final int variantCount;

    private final Object[] locks = new Object[LOCK_STRIPES];
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public ConvergenceService(ProjectStore projectStore,
                              Orchestrator orchestrator,
                              IdeaNormalizer normalizer,
                              ObjectMapper objectMapper,
                              @Value("${changelab.convergence.variant-count:3}") int variantCount) {
        this.projectStore = projectStore;
        this.orchestrator = orchestrator;
        this.normalizer = normalizer;
        this.objectMapper = objectMapper;
        this.variantCount = variantCount;
        Arrays.setAll(locks, i -> new Object());
    }

    public ConvergenceSession view(String projectId) {
        return session(load(projectId));
    }

    public ConvergenceSession evaluateReflectionTrigger(String projectId) {
        ProjectDocument document = load(projectId);
        ConvergenceSession session = session(document);
        if (session.stage() != Stage.REFLECT || session.hasFired(REFLECTION_GUARD)) {
            return session;
        }
        Map<String, String> ideas = stationIdeas(document);
        if (ideas.size() < SolutionStrategies.STATION_NAMES.size()) {
            log.debug("Reflection for {} waits for a complete solution wheel ({} of {})",
                    projectId, ideas.size(), SolutionStrategies.STATION_NAMES.size());
            return session;
        }
        if (!inFlight.add(projectId)) {
            return session;
        }
        try {
            InterpretedResponse reflection = orchestrator.run("convergence:reflect", projectId, FocusAction.GENERATE,
                    payload(ideas, session, null));
            return apply(projectId, current -> current.stage() == Stage.REFLECT && !current.hasFired(REFLECTION_GUARD),
                    current -> current.append(collaborator(reflection, Stage.REFLECT))
                            .withStage(Stage.CHOOSE, null)
                            .fired(REFLECTION_GUARD));
        } finally {
            inFlight.remove(projectId);
        }
    }

    public ConvergenceSession chooseCandidates(String projectId, List<String> candidateIds) {
        List<String> selected = candidateIds == null ? List.of() : candidateIds.stream().distinct().toList();
        if (selected.isEmpty() || selected.size() > MAX_CANDIDATES) {
            throw new IllegalArgumentException("Choose between 1 and " + MAX_CANDIDATES + " distinct candidates");
        }
        for (String id : selected) {
            if (!SolutionStrategies.STATION_NAMES.containsKey(id)) {
                throw new IllegalArgumentException("Unknown candidate: " + id);
            }
        }
        return transition(projectId, "chooseCandidates", EnumSet.of(Stage.CHOOSE),
                session -> session.withSelectedCandidates(selected).withStage(Stage.CO_DESIGN, CoDesignPhase.RANK));
    }

    public ConvergenceSession sendMessage(String projectId, String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("message text is required");
        }
        ProjectDocument document = load(projectId);
        ConvergenceSession session = session(document);
        Set<Stage> allowed = EnumSet.of(Stage.CHOOSE, Stage.CO_DESIGN, Stage.VARIANTS, Stage.SELECTION);
        requireStage("sendMessage", session, allowed);

        return withReasoningSlot(projectId, "sendMessage", session, () -> {
            InterpretedResponse reply = orchestrator.run("convergence:co-design", projectId, FocusAction.SUGGEST,
                    payload(stationIdeas(document), session, text.trim()));
            Stage stage = session.stage();
            return apply(projectId, current -> current.stage() == stage,
                    current -> current.append(
                            new ConversationEntry(Role.LEARNER, text.trim(), Instant.now(), stage),
                            collaborator(reply, stage)));
        });
    }

    public ConvergenceSession confirmPhase(String projectId) {
        return transition(projectId, "confirmPhase", EnumSet.of(Stage.CO_DESIGN), session -> {
            CoDesignPhase current = session.subPhase() == null ? CoDesignPhase.RANK : session.subPhase();
            CoDesignPhase next = current.next();
            return next == null
                    ? session.withStage(Stage.VARIANTS, null)
                    : session.withStage(Stage.CO_DESIGN, next);
        });
    }

    public ConvergenceSession confirmDirection(String projectId) {
        return transition(projectId, "confirmDirection", EnumSet.of(Stage.CO_DESIGN),
                session -> session.withStage(Stage.VARIANTS, null));
    }

    public ConvergenceSession generateVariants(String projectId) {
        ProjectDocument document = load(projectId);
        ConvergenceSession session = session(document);
        requireStage("generateVariants", session, EnumSet.of(Stage.VARIANTS));

        return withReasoningSlot(projectId, "generateVariants", session, () -> {
            InterpretedResponse variants = orchestrator.run("convergence:variants", projectId, FocusAction.GENERATE,
                    payload(stationIdeas(document), session, null));
            List<String> items = variants.items() == null ? List.of() : variants.items();
            if (items.isEmpty()) {
                log.info("No variants came back for {}; keeping the current options", projectId);
                return view(projectId);
            }
            List<String> options = items.subList(0, Math.min(variantCount, items.size()));
            return apply(projectId, current -> current.stage() == Stage.VARIANTS,
                    current -> current.withVariantOptions(options));
        });
    }

    public ConvergenceSession likeVariant(String projectId, String text) {
        return addIdea(projectId, text, "likeVariant");
    }

    public ConvergenceSession addIdea(String projectId, String text) {
        return addIdea(projectId, text, "addIdea");
    }

    private ConvergenceSession addIdea(String projectId, String text, String operation) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("idea text is required");
        }
        return transition(projectId, operation, EnumSet.of(Stage.VARIANTS), session -> {
            IdeaBank bank = IdeaBank.of(session.ideaBank(), normalizer);
            return bank.add(text) ? session.withIdeaBank(bank.entries()) : session;
        });
    }

    public ConvergenceSession removeIdea(String projectId, String text) {
        return transition(projectId, "removeIdea", EnumSet.of(Stage.VARIANTS), session -> {
            IdeaBank bank = IdeaBank.of(session.ideaBank(), normalizer);
            return bank.remove(text) ? session.withIdeaBank(bank.entries()) : session;
        });
    }

    public ConvergenceSession proceedToSelection(String projectId) {
        ProjectDocument document = load(projectId);
        ConvergenceSession session = session(document);
        requireStage("proceedToSelection", session, EnumSet.of(Stage.VARIANTS));
        if (session.ideaBank().size() != IdeaBank.BOUND) {
            throw new IllegalTransitionException("proceedToSelection", session.stage(),
                    "the idea bank holds " + session.ideaBank().size() + " of " + IdeaBank.BOUND + " ideas");
        }

        return withReasoningSlot(projectId, "proceedToSelection", session, () -> {
            InterpretedResponse comparison = orchestrator.run("convergence:selection", projectId, FocusAction.REVIEW,
                    payload(stationIdeas(document), session, null));
            return apply(projectId,
                    current -> current.stage() == Stage.VARIANTS && current.ideaBank().size() == IdeaBank.BOUND,
                    current -> current.append(collaborator(comparison, Stage.SELECTION))
                            .withStage(Stage.SELECTION, null));
        });
    }

    public ConvergenceSession lock(String projectId, String idea) {
        synchronized (lockFor(projectId)) {
            ConvergenceSession session = session(load(projectId));
            requireStage("lock", session, EnumSet.of(Stage.SELECTION));
            if (session.lockedArtifact() != null) {
                throw new IllegalTransitionException("lock", session.stage(), "an idea is already locked");
            }
            String artifact = IdeaBank.of(session.ideaBank(), normalizer).find(idea)
                    .orElseThrow(() -> new IllegalTransitionException("lock", session.stage(),
                            "the idea is not in the idea bank"));

            ConvergenceSession locked = session.locked(artifact);
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("convergence", locked);
            fields.put("decision", decisionSeed());
            fields.put("currentStepId", "decision-tree");
            projectStore.updatePartial(projectId, fields);
            log.info("Project {} locked its idea", projectId);
            return locked;
        }
    }

    public ConvergenceSession reset(String projectId) {
        synchronized (lockFor(projectId)) {
            load(projectId);
            ConvergenceSession fresh = ConvergenceSession.fresh();
            projectStore.updatePartial(projectId, Map.of("convergence", fresh));
            log.info("Convergence session reset for project {}", projectId);
            return fresh;
        }
    }

    private ConvergenceSession transition(String projectId, String operation, Set<Stage> allowed,
                                          Function<ConvergenceSession, ConvergenceSession> change) {
        synchronized (lockFor(projectId)) {
            ConvergenceSession session = session(load(projectId));
            requireStage(operation, session, allowed);
            ConvergenceSession next = change.apply(session);
            if (next.equals(session)) {
                return session;
            }
            projectStore.updatePartial(projectId, Map.of("convergence", next));
            return next;
        }
    }

    private ConvergenceSession apply(String projectId, Predicate<ConvergenceSession> stillValid,
                                     Function<ConvergenceSession, ConvergenceSession> change) {
        synchronized (lockFor(projectId)) {
            ConvergenceSession current = session(load(projectId));
            if (!stillValid.test(current)) {
                log.info("Convergence session of {} moved on during a reasoning call; result dropped", projectId);
                return current;
            }
            ConvergenceSession next = change.apply(current);
            projectStore.updatePartial(projectId, Map.of("convergence", next));
            return next;
        }
    }

    private ConvergenceSession withReasoningSlot(String projectId, String operation, ConvergenceSession session,
                                                 Supplier<ConvergenceSession> call) {
        if (!inFlight.add(projectId)) {
            throw new IllegalTransitionException(operation, session.stage(), "another reasoning request is in progress");
        }
        try {
            return call.get();
        } finally {
            inFlight.remove(projectId);
        }
    }

    private static void requireStage(String operation, ConvergenceSession session, Set<Stage> allowed) {
        if (!allowed.contains(session.stage())) {
            throw new IllegalTransitionException(operation, session.stage(), "expected one of " + allowed);
        }
    }

    private ConvergencePayload payload(Map<String, String> stationIdeas, ConvergenceSession session, String message) {
        List<HistoryLine> history = session.history().stream()
                .map(entry -> new HistoryLine(entry.role() == Role.COLLABORATOR ? "collaborator" : "learner", entry.content()))
                .toList();
        return new ConvergencePayload(stationIdeas, session.selectedCandidates(),
                session.subPhase() == null ? null : session.subPhase().name(),
                history, message, session.ideaBank(), variantCount);
    }

    private static ConversationEntry collaborator(InterpretedResponse response, Stage stage) {
        StringBuilder content = new StringBuilder(String.join("\n\n", response.feedback()));
        if (response.followUpQuestion() != null) {
            if (content.length() > 0) content.append("\n\n");
            content.append(response.followUpQuestion());
        }
        return new ConversationEntry(Role.COLLABORATOR, content.toString(), Instant.now(), stage);
    }

    private Map<String, String> stationIdeas(ProjectDocument document) {
        Map<String, String> ideas = new LinkedHashMap<>();
        JsonNode wheel = document.data().path("solutionWheel");
        for (String station : SolutionStrategies.STATION_NAMES.keySet()) {
            String idea = wheel.path(station).path("idea").asText("");
            if (!idea.isBlank()) {
                ideas.put(station, idea.trim());
            }
        }
        return ideas;
    }

    private ObjectNode decisionSeed() {
        ObjectNode seed = objectMapper.createObjectNode();
        seed.putObject("possible");
        seed.putObject("planetImpact");
        seed.putObject("impact");
        seed.putObject("originality");
        return seed;
    }

    private ProjectDocument load(String projectId) {
        return projectStore.get(projectId).orElseThrow(() -> new ProjectNotFoundException(projectId));
    }

    private ConvergenceSession session(ProjectDocument document) {
        JsonNode node = document.data().get("convergence");
        if (node == null || node.isNull()) {
            return ConvergenceSession.fresh();
        }
        try {
            return objectMapper.treeToValue(node, ConvergenceSession.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored convergence session of " + document.projectId() + " is unreadable", e);
        }
    }

    private Object lockFor(String projectId) {
        return locks[Math.floorMod(projectId.hashCode(), LOCK_STRIPES)];
    }
}
