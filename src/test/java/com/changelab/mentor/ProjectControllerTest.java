package com.changelab.mentor;

import com.changelab.mentor.project.DraftAutosaveService;
import com.changelab.mentor.project.ProjectStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ProjectControllerTest {
    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ProjectStore store;

    @Autowired
    private DraftAutosaveService autosave;

    @Autowired
    private ScriptedReasoningClient client;

    @BeforeEach
    void resetClient() {
        client.reset();
    }

    @Test
    void createsPatchesAndReadsProjects() throws Exception {
        String body = mockMvc.perform(post("/api/projects").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"passionTopic\": \"gaming\"}"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        String id = objectMapper.readTree(body).path("projectId").asText();

        mockMvc.perform(patch("/api/projects/" + id).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fields\": {\"chosenProblem\": \"Online games push costly loot boxes on kids\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.revision").value(2));

        mockMvc.perform(get("/api/projects/" + id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.passionTopic").value("gaming"))
                .andExpect(jsonPath("$.data.chosenProblem").value("Online games push costly loot boxes on kids"));

        mockMvc.perform(get("/api/projects/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
        mockMvc.perform(patch("/api/projects/missing").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fields\": {\"chosenProblem\": \"x\"}}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void convergenceAndDecisionFieldsCannotBeWrittenDirectly() throws Exception {
        String id = store.create("gaming");
        String forged = "{\"fields\": {\"convergence.stage\": \"LOCKED\", "
                + "\"convergence.lockedArtifact\": \"skipped everything\", "
                + "\"convergence.ideaBank\": [\"a\", \"b\", \"c\", \"d\", \"A\"]}}";

        mockMvc.perform(patch("/api/projects/" + id).contentType(MediaType.APPLICATION_JSON).content(forged))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
        mockMvc.perform(patch("/api/projects/" + id).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fields\": {\"convergence\": {\"stage\": \"LOCKED\"}}}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(put("/api/projects/" + id + "/drafts").contentType(MediaType.APPLICATION_JSON).content(forged))
                .andExpect(status().isBadRequest());
        mockMvc.perform(put("/api/projects/" + id + "/drafts").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fields\": {\"decision.impact.score\": 5}}"))
                .andExpect(status().isBadRequest());

        assertFalse(autosave.hasPending(id));
        JsonNode data = store.get(id).orElseThrow().data();
        assertTrue(data.path("convergence").isMissingNode());
        assertTrue(data.path("decision").isMissingNode());
        assertEquals(1, store.get(id).orElseThrow().revision());

        mockMvc.perform(get("/api/projects/" + id + "/convergence"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stage").value("REFLECT"));
    }

    @Test
    void draftsAreAcceptedAndFlushedLater() throws Exception {
        String id = store.create("gaming");
        mockMvc.perform(put("/api/projects/" + id + "/drafts").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fields\": {\"problemStatement.what.answer\": \"Loot boxes\"}}"))
                .andExpect(status().isAccepted());
        assertTrue(autosave.hasPending(id));
        autosave.flush(id);
        assertEquals("Loot boxes",
                store.get(id).orElseThrow().data().path("problemStatement").path("what").path("answer").asText());

        mockMvc.perform(put("/api/projects/missing/drafts").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fields\": {\"a\": 1}}"))
                .andExpect(status().isNotFound());
        mockMvc.perform(put("/api/projects/" + id + "/drafts").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fields\": {}}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void reportsJourneyProgress() throws Exception {
        String id = store.create("gaming");
        mockMvc.perform(get("/api/projects/" + id + "/progress"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.frontierStepId").value("explore"))
                .andExpect(jsonPath("$.steps.length()").value(5))
                .andExpect(jsonPath("$.steps[4].stepId").value("decision-tree"));
    }

    @Test
    void validatorIsExposedToPresentationCode() throws Exception {
        mockMvc.perform(post("/api/validation/check").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"idk\", \"corpus\": [\"idk\", \"idk\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isValid").value(false))
                .andExpect(jsonPath("$.isUnique").value(false));

        mockMvc.perform(post("/api/validation/complete").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entries\": [\"Kids overspend on skins\", \"Parents cannot see purchases\"], \"requiredCount\": 2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.validCount").value(2))
                .andExpect(jsonPath("$.complete").value(true));
    }

    @Test
    void convergenceEndpointsDriveTheSessionAndRejectIllegalTransitions() throws Exception {
        String id = store.create("gaming");
        Map<String, Object> fields = new HashMap<>();
        for (String station : List.of("hiTech", "lowTech", "perspectives", "superpowers",
                "bottomlessDollar", "leader", "friends", "tinySeeds")) {
            fields.put("solutionWheel." + station + ".idea", "Idea for the " + station + " station");
        }
        store.updatePartial(id, fields);
        String base = "/api/projects/" + id + "/convergence";

        mockMvc.perform(post(base + "/direction/confirm"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false));

        client.reply("Lots of energy in these ideas.");
        mockMvc.perform(post(base + "/reflect"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stage").value("CHOOSE"));

        mockMvc.perform(post(base + "/candidates").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"candidateIds\": [\"hiTech\", \"friends\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stage").value("CO_DESIGN"))
                .andExpect(jsonPath("$.subPhase").value("RANK"));

        mockMvc.perform(post(base + "/direction/confirm"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stage").value("VARIANTS"));

        String session = mockMvc.perform(post(base + "/ideas").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"Spending limit dashboard for families\"}"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        JsonNode bank = objectMapper.readTree(session).path("ideaBank");
        assertEquals(1, bank.size());

        mockMvc.perform(post(base + "/selection")).andExpect(status().isConflict());
        mockMvc.perform(post("/api/projects/missing/convergence/reset")).andExpect(status().isNotFound());
    }
}
