package com.changelab.mentor.convergence;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class IdeaBank {
    public static final int BOUND = 3;

    private final List<String> entries;
    private final IdeaNormalizer normalizer;

    private IdeaBank(List<String> entries, IdeaNormalizer normalizer) {
        this.entries = new ArrayList<>(entries);
        this.normalizer = normalizer;
    }

    public static IdeaBank of(List<String> entries, IdeaNormalizer normalizer) {
        IdeaBank bank = new IdeaBank(List.of(), normalizer);
        // stored lists are trusted only as far as the invariants hold
        entries.forEach(bank::add);
        return bank;
    }

    public boolean add(String idea) {
        if (idea == null || idea.isBlank()) return false;
        if (isFull() || find(idea).isPresent()) return false;
        entries.add(idea.trim());
        return true;
    }

    public boolean remove(String idea) {
        return find(idea).map(entry -> entries.remove(entry)).orElse(false);
    }

    public Optional<String> find(String idea) {
        String key = normalizer.normalize(idea);
        return entries.stream().filter(entry -> normalizer.normalize(entry).equals(key)).findFirst();
    }

    public boolean isFull() {
        return entries.size() >= BOUND;
    }

    public List<String> entries() {
        return List.copyOf(entries);
    }
}
