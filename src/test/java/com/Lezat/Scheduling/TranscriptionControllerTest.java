package com.Lezat.Scheduling;

import com.Lezat.Scheduling.model.User;
import com.Lezat.Scheduling.model.UserIntegrationSettings;
import com.Lezat.Scheduling.repository.*;
import com.Lezat.Scheduling.service.dispatch.DestinationResolver;
import com.Lezat.Scheduling.service.dispatch.ResolvedDestinations;
import com.Lezat.Scheduling.service.extraction.TaskExtractor;
import com.Lezat.Scheduling.service.fireflies.FirefliesClient;
import com.Lezat.Scheduling.service.readai.ReadAiClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class TranscriptionControllerTest {

    static final String COMPLETED = "{\"meetingId\":\"m1\",\"eventType\":\"Transcription completed\"}";

    @Autowired
    MockMvc mockMvc;
    @Autowired
    TranscriptionRecordRepository recordRepository;
    @Autowired
    ActionItemCreationRepository creationRepository;
    @Autowired
    DispatchAttemptRepository attemptRepository;
    @Autowired
    UserRepository userRepository;
    @Autowired
    UserIntegrationSettingsRepository settingsRepository;

    @MockBean
    FirefliesClient firefliesClient;
    @MockBean
    ReadAiClient readAiClient;
    @MockBean
    TaskExtractor taskExtractor;
    @MockBean
    DestinationResolver destinationResolver;

    @BeforeEach
    void setUp() {
        attemptRepository.deleteAll();
        creationRepository.deleteAll();
        recordRepository.deleteAll();
        settingsRepository.deleteAll();
        userRepository.deleteAll();

        User u = new User();
        u.setClientReferenceId("u1");
        u.setEmail("u1@example.com");
        u.setFullName("User One");
        userRepository.save(u);

        when(destinationResolver.resolve(any())).thenReturn(ResolvedDestinations.none());
    }

    @Test
    void webhookWithoutUserIsRejected() throws Exception {
        mockMvc.perform(post("/api/transcriptions/webhooks/fireflies")
                        .contentType(MediaType.APPLICATION_JSON).content(COMPLETED))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error", containsString("user_id")));
        assertEquals(0, recordRepository.count());
    }

    @Test
    void webhookForUnknownUserIsNotFound() throws Exception {
        mockMvc.perform(post("/api/transcriptions/webhooks/fireflies/ghost")
                        .contentType(MediaType.APPLICATION_JSON).content(COMPLETED))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("User not found for webhook URL."));
        assertEquals(0, recordRepository.count());
    }

    @Test
    void unknownProviderIsRejected() throws Exception {
        mockMvc.perform(post("/api/transcriptions/webhooks/zoom/u1")
                        .contentType(MediaType.APPLICATION_JSON).content(COMPLETED))
                .andExpect(status().isUnprocessableEntity());
        assertEquals(0, recordRepository.count());
    }

    @Test
    void malformedPayloadsAreRejectedWithoutPersisting() throws Exception {
        mockMvc.perform(post("/api/transcriptions/webhooks/fireflies/u1")
                        .contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(post("/api/transcriptions/webhooks/fireflies/u1")
                        .contentType(MediaType.APPLICATION_JSON).content("[1,2]"))
                .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(post("/api/transcriptions/webhooks/fireflies/u1")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"eventType\":\"Transcription completed\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error", containsString("meeting id")));
        mockMvc.perform(post("/api/transcriptions/webhooks/fireflies/u1")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"meetingId\":\"" + "9".repeat(300) + "\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error", containsString("longer than 255")));
        assertEquals(0, recordRepository.count());
    }

    @Test
    void acceptedWebhookReturns202() throws Exception {
        mockMvc.perform(post("/api/transcriptions/webhooks/read-ai/u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"event_type\":\"meeting_start\",\"meeting\":{\"id\":\"r1\",\"platform\":\"zoom\"}}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.recordId", notNullValue()))
                .andExpect(jsonPath("$.provider").value("read_ai"))
                .andExpect(jsonPath("$.meetingId").value("r1"))
                .andExpect(jsonPath("$.meetingPlatform").value("OTHER"))
                .andExpect(jsonPath("$.enrichmentStatus").value("RECEIVED"));
        assertEquals(1, recordRepository.count());
    }

    @Test
    void enrichmentFailureStillReturns202() throws Exception {
        when(firefliesClient.isConfigured(any())).thenReturn(true);
        when(firefliesClient.fetchTranscript(eq("m1"), any()))
                .thenThrow(new com.Lezat.Scheduling.exception.ProviderFetchException("timed out"));

        mockMvc.perform(post("/api/transcriptions/webhooks/fireflies/u1")
                        .contentType(MediaType.APPLICATION_JSON).content(COMPLETED))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.enrichmentStatus").value("FAILED"))
                .andExpect(jsonPath("$.enrichmentError").value("timed out"));
    }

    @Test
    void recordDetailExposesTranscriptAndRawPayload() throws Exception {
        when(firefliesClient.isConfigured(any())).thenReturn(true);
        when(firefliesClient.fetchTranscript(eq("m1"), any())).thenReturn(EnrichmentPipelineTest.helloWorld());
        mockMvc.perform(post("/api/transcriptions/webhooks/fireflies/u1")
                .contentType(MediaType.APPLICATION_JSON).content(COMPLETED));
        String id = recordRepository.findAll().get(0).getId();

        mockMvc.perform(get("/api/transcriptions/received/" + id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enrichmentStatus").value("TRANSCRIPT_READY"))
                .andExpect(jsonPath("$.transcriptText").value("Hello world"))
                .andExpect(jsonPath("$.transcriptSentences[0].speaker").value("Ana"))
                .andExpect(jsonPath("$.participantEmails[0]").value("ana@example.com"))
                .andExpect(jsonPath("$.rawPayload.meetingId").value("m1"));

        mockMvc.perform(get("/api/transcriptions/received/by-meeting/m1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(id));
    }

    @Test
    void listIsNewestFirstAndLimitIsClamped() throws Exception {
        mockMvc.perform(post("/api/transcriptions/webhooks/fireflies/u1")
                .contentType(MediaType.APPLICATION_JSON).content("{\"meetingId\":\"a\",\"eventType\":\"other\"}"));
        Thread.sleep(5);
        mockMvc.perform(post("/api/transcriptions/webhooks/fireflies/u1")
                .contentType(MediaType.APPLICATION_JSON).content("{\"meetingId\":\"b\",\"eventType\":\"other\"}"));

        mockMvc.perform(get("/api/transcriptions/received").param("limit", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].meetingId").value("b"));
        mockMvc.perform(get("/api/transcriptions/received").param("limit", "500"))
                .andExpect(jsonPath("$", hasSize(2)));
    }

    @Test
    void missingRecordsAreNotFound() throws Exception {
        mockMvc.perform(get("/api/transcriptions/received/does-not-exist"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/transcriptions/received/by-meeting/nope"))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/transcriptions/backfill/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    void settingsNeverEchoSecrets() throws Exception {
        UserIntegrationSettings s = new UserIntegrationSettings();
        s.setClientReferenceId("u1");
        s.setTimezone("America/Bogota");
        s.setNotionToken("secret_notion_token");
        s.setNotionDatabaseId("db-1");
        s.setGoogleRefreshToken("secret_refresh_token");
        s.setOutlookAccessToken("secret_outlook_token");
        settingsRepository.save(s);

        mockMvc.perform(get("/api/integrations/u1/settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.autosyncEnabled").value(true))
                .andExpect(jsonPath("$.timezone").value("America/Bogota"))
                .andExpect(jsonPath("$.notionConfigured").value(true))
                .andExpect(jsonPath("$.notionDatabaseId").value("db-1"))
                .andExpect(jsonPath("$.notionToken").value(nullValue()))
                .andExpect(jsonPath("$.mondayConfigured").value(false))
                .andExpect(jsonPath("$.googleCalendarConfigured").value(true))
                .andExpect(jsonPath("$.googleRefreshToken").value(nullValue()))
                .andExpect(jsonPath("$.outlookCalendarConfigured").value(true))
                .andExpect(jsonPath("$.outlookAccessToken").value(nullValue()))
                .andExpect(content().string(not(containsString("secret_"))));

        mockMvc.perform(get("/api/integrations/ghost/settings"))
                .andExpect(status().isNotFound());
    }
}
