package com.example.CostNavigator.config;

import com.example.CostNavigator.extraction.DraftValidator;
import com.example.CostNavigator.extraction.FallbackParameterExtractor;
import com.example.CostNavigator.extraction.InferenceParameterExtractor;
import com.example.CostNavigator.extraction.ParameterExtractor;
import com.example.CostNavigator.extraction.PatternParameterExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.Optional;

/**
 * Picks the extraction strategy once, at startup. Request handling only ever sees
 * the {@link ParameterExtractor} interface.
 */
@Configuration
public class ExtractionConfig {

    private static final Logger log = LoggerFactory.getLogger(ExtractionConfig.class);

    @Bean
    @Primary
    public ParameterExtractor parameterExtractor(
            NavigatorProperties properties,
            PatternParameterExtractor patternExtractor,
            DraftValidator validator,
            InferenceChatClients chatClients
    ) {
        NavigatorProperties.Inference inference = properties.getInference();
        if (!inference.isEnabled()) {
            log.info("Inference extraction disabled; using pattern grammar only");
            return patternExtractor;
        }
        Optional<ChatClient> client = chatClients.resolve(inference.getModel());
        if (client.isEmpty()) {
            log.info("No chat model configured; using pattern grammar only");
            return patternExtractor;
        }
        log.info("Inference extraction enabled (model preference '{}', timeout {})",
                inference.getModel(), inference.getTimeout());
        return new FallbackParameterExtractor(
                new InferenceParameterExtractor(client.get(), validator, inference.getTimeout()),
                patternExtractor
        );
    }
}
