package com.changelab.mentor.convergence;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class ConvergenceModels {
    public enum Stage { REFLECT, CHOOSE, CO_DESIGN, VARIANTS, SELECTION, LOCKED }

    public enum CoDesignPhase {
        RANK, VARY, CONSOLIDATE, DETAIL, REMIX, COMMIT;

        public CoDesignPhase next() {
            int i = ordinal() + 1;
            return i < values().length ? values()[i] : null;
        }
    }

    public enum Role { COLLABORATOR, LEARNER }

    public record ConversationEntry(Role role, String content, Instant timestamp, Stage stageTag) {}

    public record ConvergenceSession(Stage stage,
                                     CoDesignPhase subPhase,
                                     List<String> selectedCandidates,
                                     List<String> ideaBank,
                                     String lockedArtifact,
                                     Set<String> oneShotGuards,
                                     List<ConversationEntry> history,
                                     List<String> variantOptions) {

        public ConvergenceSession {
            selectedCandidates = selectedCandidates == null ? List.of() : List.copyOf(selectedCandidates);
            ideaBank = ideaBank == null ? List.of() : List.copyOf(ideaBank);
            oneShotGuards = oneShotGuards == null ? Set.of() : Set.copyOf(oneShotGuards);
            history = history == null ? List.of() : List.copyOf(history);
            variantOptions = variantOptions == null ? List.of() : List.copyOf(variantOptions);
        }

        public static ConvergenceSession fresh() {
            return new ConvergenceSession(Stage.REFLECT, null, List.of(), List.of(), null, Set.of(), List.of(), List.of());
        }

        public boolean hasFired(String guard) {
            return oneShotGuards.contains(guard);
        }

        public ConvergenceSession withStage(Stage stage, CoDesignPhase subPhase) {
            return new ConvergenceSession(stage, subPhase, selectedCandidates, ideaBank, lockedArtifact,
                    oneShotGuards, history, variantOptions);
        }

        public ConvergenceSession withSelectedCandidates(List<String> selected) {
            return new ConvergenceSession(stage, subPhase, selected, ideaBank, lockedArtifact,
                    oneShotGuards, history, variantOptions);
        }

        public ConvergenceSession withIdeaBank(List<String> bank) {
            return new ConvergenceSession(stage, subPhase, selectedCandidates, bank, lockedArtifact,
                    oneShotGuards, history, variantOptions);
        }

        public ConvergenceSession withVariantOptions(List<String> options) {
            return new ConvergenceSession(stage, subPhase, selectedCandidates, ideaBank, lockedArtifact,
                    oneShotGuards, history, options);
        }

        public ConvergenceSession locked(String artifact) {
            return new ConvergenceSession(Stage.LOCKED, null, selectedCandidates, ideaBank, artifact,
                    oneShotGuards, history, variantOptions);
        }

        public ConvergenceSession fired(String guard) {
            Set<String> guards = new LinkedHashSet<>(oneShotGuards);
            guards.add(guard);
            return new ConvergenceSession(stage, subPhase, selectedCandidates, ideaBank, lockedArtifact,
                    guards, history, variantOptions);
        }

        public ConvergenceSession append(ConversationEntry... entries) {
            List<ConversationEntry> next = new ArrayList<>(history);
            next.addAll(List.of(entries));
            return new ConvergenceSession(stage, subPhase, selectedCandidates, ideaBank, lockedArtifact,
                    oneShotGuards, next, variantOptions);
        }
    }

    public record ChooseRequest(List<String> candidateIds) {}

    public record MessageRequest(String text) {}

    public record IdeaRequest(String text) {}
}
