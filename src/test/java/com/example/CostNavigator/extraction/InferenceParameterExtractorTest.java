package com.example.CostNavigator.extraction;

import com.example.CostNavigator.exception.CollaboratorUnavailableException;
import com.example.CostNavigator.model.RankingIntent;
import com.example.CostNavigator.util.RequestBudget;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.ai.chat.client.ChatClient;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class InferenceParameterExtractorTest {

    private final ChatClient chatClient = mock(ChatClient.class, Mockito.RETURNS_DEEP_STUBS);

    private InferenceParameterExtractor extractor(Duration timeout) {
        return new InferenceParameterExtractor(chatClient, new DraftValidator(), timeout);
    }

    @Test
    void replyIsMappedAndRevalidated() {
        InferenceDraft reply = new InferenceDraft("best-rated", "470", null, "10001-2345", 25.0, "miles", 5);
        when(chatClient.prompt().system(anyString()).user(anyString()).call().entity(InferenceDraft.class))
                .thenReturn(reply);

        ExtractionResult result = extractor(Duration.ofSeconds(2))
                .extract("best rated drg 470 near 10001", RequestBudget.start(Duration.ofSeconds(10)));

        assertEquals(ExtractionOrigin.INFERENCE, result.origin());
        assertEquals("470", result.draft().procedureCode());
        assertEquals("10001", result.draft().postalCode());
        assertEquals(40.2336, result.draft().radiusKm(), 1e-9);
        assertEquals(RankingIntent.BEST_RATED, result.draft().rankingIntent());
        assertEquals(5, result.draft().limit());
    }

    @Test
    void inventedValuesAreDropped() {
        InferenceDraft reply = new InferenceDraft("cheapest", "4700", null, "ABCDE", null, null, null);
        when(chatClient.prompt().system(anyString()).user(anyString()).call().entity(InferenceDraft.class))
                .thenReturn(reply);

        ExtractionResult result = extractor(Duration.ofSeconds(2))
                .extract("cheapest option", RequestBudget.start(Duration.ofSeconds(10)));

        assertNull(result.draft().procedureCode());
        assertNull(result.draft().postalCode());
        assertEquals(RankingIntent.CHEAPEST, result.draft().rankingIntent());
    }

    @Test
    void transportErrorBecomesCollaboratorUnavailable() {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().entity(InferenceDraft.class))
                .thenThrow(new IllegalStateException("connection refused"));

        assertThrows(CollaboratorUnavailableException.class, () -> extractor(Duration.ofSeconds(2))
                .extract("cheapest drg 470 near 10001", RequestBudget.start(Duration.ofSeconds(10))));
    }

    @Test
    void slowReplyTimesOut() {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().entity(InferenceDraft.class))
                .thenAnswer(invocation -> {
                    Thread.sleep(2_000);
                    return new InferenceDraft(null, "470", null, "10001", null, null, null);
                });

        assertThrows(CollaboratorUnavailableException.class, () -> extractor(Duration.ofMillis(100))
                .extract("cheapest drg 470 near 10001", RequestBudget.start(Duration.ofSeconds(10))));
    }

    @Test
    void exhaustedBudgetSkipsTheCall() {
        assertThrows(CollaboratorUnavailableException.class, () -> extractor(Duration.ofSeconds(2))
                .extract("cheapest drg 470 near 10001", RequestBudget.start(Duration.ZERO)));
    }

    @Test
    void unknownUnitDropsRadius() {
        QuerySpecDraft draft = InferenceParameterExtractor.toDraft(
                new InferenceDraft("nonsense", " ", "knee replacement", "10001", 10.0, "leagues", null));

        assertNull(draft.radiusKm());
        assertNull(draft.rankingIntent());
        assertNull(draft.procedureCode());
        assertEquals("knee replacement", draft.procedureText());
    }

    @Test
    void radiusWithoutUnitIsKilometers() {
        QuerySpecDraft draft = InferenceParameterExtractor.toDraft(
                new InferenceDraft("top_n", null, null, null, 12.5, null, 3));

        assertEquals(12.5, draft.radiusKm());
        assertEquals(RankingIntent.TOP_N, draft.rankingIntent());
    }
}
