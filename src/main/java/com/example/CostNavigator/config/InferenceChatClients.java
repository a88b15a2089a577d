package com.example.CostNavigator.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.springframework.ai.chat.client.ChatClient;

/**
 * Chat clients that could be built from the chat models present at startup,
 * keyed by short model name ("deepseek", "openai").
 */
public record InferenceChatClients(Map<String, ChatClient> clients) {

    public static final String DEFAULT_MODEL = "deepseek";

    public InferenceChatClients {
        clients = Collections.unmodifiableMap(new LinkedHashMap<>(clients));
    }

    /**
     * Requested model first, then the default model, then whatever is available.
     */
    public Optional<ChatClient> resolve(String model) {
        String key = Optional.ofNullable(model)
                .map(m -> m.trim().toLowerCase(Locale.ROOT))
                .orElse(DEFAULT_MODEL);
        if (clients.containsKey(key)) {
            return Optional.of(clients.get(key));
        }
        if (clients.containsKey(DEFAULT_MODEL)) {
            return Optional.of(clients.get(DEFAULT_MODEL));
        }
        return clients.values().stream().findFirst();
    }

    public boolean isEmpty() {
        return clients.isEmpty();
    }
}
