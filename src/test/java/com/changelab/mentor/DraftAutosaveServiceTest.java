package com.changelab.mentor;

import com.changelab.mentor.project.DraftAutosaveService;
import com.changelab.mentor.project.ProjectStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class DraftAutosaveServiceTest {
    @Autowired
    private DraftAutosaveService autosave;

    @Autowired
    private ProjectStore store;

    @Test
    void editsInsideTheQuietPeriodCoalesceIntoOneWrite() throws InterruptedException {
        String id = store.create("water");
        autosave.submit(id, Map.of("problemStatement.what.answer", "Tap water"));
        autosave.submit(id, Map.of("problemStatement.what.answer", "Tap water tastes"));
        autosave.submit(id, Map.of("problemStatement.what.answer", "Tap water tastes of metal",
                "problemStatement.who.answer", "Families on our estate"));
        assertTrue(autosave.hasPending(id));

        long deadline = System.currentTimeMillis() + 5_000;
        while (store.get(id).orElseThrow().revision() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        // longer than the quiet period: a second flush would have landed by now
        Thread.sleep(400);

        var document = store.get(id).orElseThrow();
        assertFalse(autosave.hasPending(id));
        assertEquals(2, document.revision());
        assertEquals("Tap water tastes of metal",
                document.data().path("problemStatement").path("what").path("answer").asText());
        assertEquals("Families on our estate",
                document.data().path("problemStatement").path("who").path("answer").asText());
    }

    @Test
    void failedFlushIsDroppedAndLaterFlushesStillWrite() {
        autosave.submit("no-such-project", Map.of("currentStepId", "explore"));
        assertDoesNotThrow(() -> autosave.flush("no-such-project"));
        assertFalse(autosave.hasPending("no-such-project"));

        String id = store.create("trees");
        autosave.submit(id, Map.of("chosenProblem", "Street trees are dying"));
        autosave.flush(id);
        assertEquals("Street trees are dying", store.get(id).orElseThrow().text("chosenProblem"));
    }
}
