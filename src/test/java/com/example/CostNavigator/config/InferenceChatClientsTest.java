package com.example.CostNavigator.config;

import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class InferenceChatClientsTest {

    private final ChatClient deepSeek = mock(ChatClient.class);
    private final ChatClient openAi = mock(ChatClient.class);

    @Test
    void requestedModelWins() {
        InferenceChatClients clients = new InferenceChatClients(ordered(deepSeek, openAi));

        assertSame(openAi, clients.resolve("OpenAI").orElseThrow());
        assertSame(deepSeek, clients.resolve(null).orElseThrow());
    }

    @Test
    void unknownModelFallsBackToDefaultThenAnyClient() {
        assertSame(deepSeek, new InferenceChatClients(ordered(deepSeek, openAi)).resolve("claude").orElseThrow());
        assertSame(openAi, new InferenceChatClients(Map.of("openai", openAi)).resolve("deepseek").orElseThrow());
    }

    @Test
    void noClientsResolvesEmpty() {
        InferenceChatClients clients = new InferenceChatClients(Map.of());

        assertTrue(clients.isEmpty());
        assertTrue(clients.resolve("deepseek").isEmpty());
    }

    private static Map<String, ChatClient> ordered(ChatClient deepSeek, ChatClient openAi) {
        Map<String, ChatClient> clients = new LinkedHashMap<>();
        clients.put("deepseek", deepSeek);
        clients.put("openai", openAi);
        return clients;
    }
}
