package com.Lezat.Scheduling.service.fireflies;

import com.Lezat.Scheduling.exception.ProviderFetchException;
import com.Lezat.Scheduling.service.settings.IntegrationSettings;
import com.Lezat.Scheduling.service.transcript.FetchedTranscript;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FirefliesClientTest {

    private final FirefliesClient client = new FirefliesClient();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void graphqlErrorsAreMarkedForFallback() {
        ProviderFetchException ex = assertThrows(ProviderFetchException.class,
                () -> client.parseTranscriptNode("{\"errors\":[{\"message\":\"Cannot query field host_email\"}]}"));
        assertTrue(ex.getMessage().contains("GraphQL error"));
    }

    @Test
    void missingTranscriptIsAnError() {
        ProviderFetchException ex = assertThrows(ProviderFetchException.class,
                () -> client.parseTranscriptNode("{\"data\":{\"transcript\":null}}"));
        assertTrue(ex.getMessage().contains("not found"));
        assertThrows(ProviderFetchException.class, () -> client.parseTranscriptNode("{}"));
        assertThrows(ProviderFetchException.class, () -> client.parseTranscriptNode("<html>"));
    }

    @Test
    void mapsSentencesAndCollectsParticipants() throws Exception {
        String json = "{\"id\":\"t-1\",\"meeting_link\":\"https://meet.google.com/a\",\"organizer_email\":\"Host@X.com\","
                + "\"participants\":[\"b@x.com, c@x.com\",\"host@x.com\"],\"fireflies_users\":[\"d@x.com\"],"
                + "\"user\":{\"email\":\"e@x.com\"},\"meeting_attendees\":[{\"email\":\"a@x.com\",\"name\":\"A\"},{\"name\":\"nobody\"}],"
                + "\"sentences\":[{\"speaker_name\":\"Ana\",\"text\":\"Hello\",\"start_time\":0.5,\"end_time\":1.2},"
                + "{\"speaker_name\":null,\"text\":\"world\"},{\"text\":\"  \"}]}";

        FetchedTranscript t = client.toTranscript(mapper.readTree(json));

        assertEquals("t-1", t.transcriptId());
        assertEquals("Ana: Hello\nworld", t.text());
        assertEquals(2, t.sentences().size());
        assertEquals(0.5, t.sentences().get(0).getStartTime());
        assertNull(t.sentences().get(1).getSpeaker());
        assertEquals(List.of("a@x.com", "b@x.com", "c@x.com", "d@x.com", "e@x.com", "host@x.com"),
                List.copyOf(new java.util.TreeSet<>(t.participantEmails())));
    }

    @Test
    void queriesNarrowProgressively() {
        assertEquals(3, FirefliesClient.TRANSCRIPT_QUERIES.size());
        assertTrue(FirefliesClient.TRANSCRIPT_QUERIES.get(0).contains("host_email"));
        assertFalse(FirefliesClient.TRANSCRIPT_QUERIES.get(2).contains("participants"));
    }

    @Test
    void userKeyEnablesFetching() {
        IntegrationSettings none = IntegrationSettings.defaults("u1", ZoneId.of("UTC"));
        IntegrationSettings own = new IntegrationSettings("u1", true, ZoneId.of("UTC"), "ff-key", null, null, null, null, null);

        assertFalse(client.isConfigured(none));
        assertTrue(client.isConfigured(own));
        assertThrows(ProviderFetchException.class, () -> client.fetchTranscript("m1", none));
    }
}
