package com.changelab.mentor;

import com.changelab.mentor.project.ProjectModels.ProjectDocument;
import com.changelab.mentor.project.ProjectNotFoundException;
import com.changelab.mentor.project.ProjectStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ProjectStoreTest {
    @Autowired
    private ProjectStore store;

    @Test
    void createsDocumentWithJourneyDefaults() {
        String id = store.create("  ocean plastic  ");
        ProjectDocument document = store.get(id).orElseThrow();
        assertEquals("ocean plastic", document.text("passionTopic"));
        assertNull(document.text("chosenProblem"));
        assertEquals("incubator", document.text("currentStepId"));
        assertEquals(1, document.revision());
        assertTrue(store.get("missing-project").isEmpty());
    }

    @Test
    void dottedPathUpdatesLeaveSiblingsAlone() {
        String id = store.create("ocean plastic");
        store.updatePartial(id, Map.of(
                "problemExploration.thinkBig.answers", List.of("Fishing nets", "Shipping routes", "Beach tourism"),
                "problemExploration.causes.answers", List.of("Cheap packaging")));
        store.updatePartial(id, Map.of("problemExploration.thinkBig.hasCheckedFeedback", true));

        ProjectDocument document = store.get(id).orElseThrow();
        var exploration = document.data().path("problemExploration");
        assertEquals(3, exploration.path("thinkBig").path("answers").size());
        assertTrue(exploration.path("thinkBig").path("hasCheckedFeedback").asBoolean());
        assertEquals("Cheap packaging", exploration.path("causes").path("answers").get(0).asText());
        assertEquals("ocean plastic", document.text("passionTopic"));
        assertEquals(3, document.revision());
    }

    @Test
    void nullValueRemovesOnlyTheLeaf() {
        String id = store.create("music");
        store.updatePartial(id, Map.of("solutionWheel.hiTech.idea", "A shared instrument library app",
                "solutionWheel.hiTech.hasCheckedFeedback", true));
        Map<String, Object> removal = new HashMap<>();
        removal.put("solutionWheel.hiTech.idea", null);
        store.updatePartial(id, removal);

        var hiTech = store.get(id).orElseThrow().data().path("solutionWheel").path("hiTech");
        assertTrue(hiTech.path("idea").isMissingNode());
        assertTrue(hiTech.path("hasCheckedFeedback").asBoolean());
    }

    @Test
    void subscribersReceiveEveryCommittedDocumentAndFailuresStayIsolated() {
        String id = store.create("bikes");
        List<Long> seen = new ArrayList<>();
        Runnable failing = store.subscribe(id, document -> {
            throw new IllegalStateException("listener bug");
        });
        Runnable recording = store.subscribe(id, document -> seen.add(document.revision()));

        store.updatePartial(id, Map.of("chosenProblem", "Unsafe junctions near school"));
        store.updatePartial(id, Map.of("currentStepId", "explore"));
        recording.run();
        failing.run();
        store.updatePartial(id, Map.of("currentStepId", "four-ws"));

        assertEquals(List.of(2L, 3L), seen);
        assertEquals("four-ws", store.get(id).orElseThrow().text("currentStepId"));
    }

    @Test
    void rejectsUnknownProjectsAndMalformedPaths() {
        assertThrows(ProjectNotFoundException.class, () -> store.updatePartial("nope", Map.of("a", 1)));
        String id = store.create(null);
        assertThrows(IllegalArgumentException.class, () -> store.updatePartial(id, Map.of("a..b", 1)));
        assertThrows(IllegalArgumentException.class, () -> store.updatePartial(id, Map.of(".a", 1)));
    }
}
