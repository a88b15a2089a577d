package com.example.CostNavigator.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
public class AiConfig {

    private static final String DEFAULT_SYSTEM =
            "You are the Cost Navigator query reader. You answer only with the requested JSON.";

    /**
     * Build a ChatClient for every chat model that actually got configured.
     * Models are resolved lazily so a missing API key only means "no inference",
     * never a failed startup. DeepSeek is registered first and is the default.
     */
    @Bean
    public InferenceChatClients inferenceChatClients(
            ObjectProvider<DeepSeekChatModel> deepSeekProvider,
            ObjectProvider<OpenAiChatModel> openAiProvider
    ) {
        Map<String, ChatClient> clients = new LinkedHashMap<>();
        deepSeekProvider.ifAvailable(model -> clients.put("deepseek", build(model)));
        openAiProvider.ifAvailable(model -> clients.put("openai", build(model)));
        return new InferenceChatClients(clients);
    }

    private static ChatClient build(ChatModel model) {
        return ChatClient.builder(model)
                .defaultSystem(DEFAULT_SYSTEM)
                .build();
    }
}
