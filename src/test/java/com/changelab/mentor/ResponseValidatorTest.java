package com.changelab.mentor;

import com.changelab.mentor.validation.ResponseValidator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResponseValidatorTest {
    private final ResponseValidator validator = new ResponseValidator();

    @Test
    void shortTextIsNeverValid() {
        assertFalse(validator.isValid("   too short  "));
        assertFalse(validator.isValid("abcdefghi"));
        assertTrue(validator.isValid("abcdefghij"));
        assertFalse(validator.isValid("plenty of characters here", 30));
        assertFalse(validator.isValid(null));
    }

    @Test
    void rejectsFillerAndPunctuationOnly() {
        assertFalse(validator.isValid("I don't know", 3));
        assertFalse(validator.isValid("  WHATEVER ", 3));
        assertFalse(validator.isValid("n/a", 1));
        assertFalse(validator.isValid("..........."));
        assertFalse(validator.isValid("?!?!?!?!?!?!"));
        assertTrue(validator.isValid("Buses skip our stop twice a week"));
    }

    @Test
    void uniquenessUsesNormalizedOccurrences() {
        List<String> corpus = List.of("Litter in the park", "  litter IN the park ", "Noisy traffic at night");
        assertFalse(validator.isUnique("Litter in the park", corpus));
        assertTrue(validator.isUnique("Noisy traffic at night", corpus));
        assertTrue(validator.isUnique("", corpus));
    }

    @Test
    void completionCountsEntriesThatAreValidAndUnique() {
        List<String> answers = List.of(
                "Plastic bottles pile up by the river",
                "plastic bottles pile up by the river",
                "idk",
                "Bins are emptied only once a month");
        var check = validator.completion(answers, 2, ResponseValidator.DEFAULT_MIN_LENGTH);
        assertEquals(1, check.validCount());
        assertFalse(check.complete());

        assertTrue(validator.isComplete(List.of(
                "Plastic bottles pile up by the river",
                "Bins are emptied only once a month"), 2));
    }
}
