package com.changelab.mentor.validation;

import com.changelab.mentor.validation.ValidationModels.CompletionCheck;
import com.changelab.mentor.validation.ValidationModels.ValidationVerdict;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

@Component
public class ResponseValidator {
    public static final int DEFAULT_MIN_LENGTH = 10;

    private static final Set<String> FILLER_PHRASES = Set.of(
            "idk", "idc", "i don't know", "i dont know", "i don't care", "i dont care",
            "yes", "no", "n/a", "na", "none", "ok", "okay", "whatever", "nothing",
            "same", "yeah", "yea", "sure", "maybe", "stuff", "things"
    );

    // no letter or digit at all: "....", "---", "?!?"
    private static final Pattern PUNCTUATION_ONLY = Pattern.compile("^[^\\p{L}\\p{N}]+$");

    public boolean isValid(String text) {
        return isValid(text, DEFAULT_MIN_LENGTH);
    }

    public boolean isValid(String text, int minLength) {
        if (text == null) return false;
        String trimmed = text.trim();
        if (trimmed.isEmpty() || trimmed.length() < minLength) return false;
        if (FILLER_PHRASES.contains(trimmed.toLowerCase(Locale.ROOT))) return false;
        return !PUNCTUATION_ONLY.matcher(trimmed).matches();
    }

    public boolean isUnique(String text, Collection<String> corpus) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) return true;
        if (corpus == null) return true;
        long occurrences = corpus.stream()
                .map(this::normalize)
                .filter(normalized::equals)
                .count();
        return occurrences <= 1;
    }

    public ValidationVerdict verdict(String text, Collection<String> corpus, int minLength) {
        return new ValidationVerdict(isValid(text, minLength), isUnique(text, corpus));
    }

    public int countAccepted(List<String> entries, int minLength) {
        if (entries == null) return 0;
        return (int) entries.stream()
                .filter(e -> isValid(e, minLength) && isUnique(e, entries))
                .count();
    }

    public CompletionCheck completion(List<String> entries, int requiredCount, int minLength) {
        int accepted = countAccepted(entries, minLength);
        return new CompletionCheck(accepted, requiredCount, accepted >= requiredCount);
    }

    public boolean isComplete(List<String> entries, int requiredCount) {
        return completion(entries, requiredCount, DEFAULT_MIN_LENGTH).complete();
    }

    private String normalize(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }
}
