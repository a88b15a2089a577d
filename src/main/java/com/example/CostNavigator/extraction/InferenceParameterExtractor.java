package com.example.CostNavigator.extraction;

import com.example.CostNavigator.exception.CollaboratorUnavailableException;
import com.example.CostNavigator.geo.GeoMath;
import com.example.CostNavigator.model.RankingIntent;
import com.example.CostNavigator.util.RequestBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Asks the chat model to read the question into an {@link InferenceDraft}.
 * The call runs on the bounded-elastic scheduler under a timeout capped by the
 * request budget. Any failure surfaces as {@link CollaboratorUnavailableException}.
 */
public class InferenceParameterExtractor implements ParameterExtractor {

    private static final Logger log = LoggerFactory.getLogger(InferenceParameterExtractor.class);

    static final String SYSTEM_PROMPT = """
            You extract structured parameters for hospital pricing and quality questions.
            Only report values the question actually states. Use null for anything missing.
            Never invent a ZIP code or a DRG code.
            """;

    private static final Set<String> KM_UNITS = Set.of("km", "kms", "kilometer", "kilometers", "kilometre", "kilometres");
    private static final Set<String> MILE_UNITS = Set.of("mi", "mile", "miles");

    private final ChatClient chatClient;
    private final DraftValidator validator;
    private final Duration timeout;

    public InferenceParameterExtractor(ChatClient chatClient, DraftValidator validator, Duration timeout) {
        this.chatClient = chatClient;
        this.validator = validator;
        this.timeout = timeout;
    }

    @Override
    public ExtractionResult extract(String question, RequestBudget budget) {
        if (budget.exhausted()) {
            throw new CollaboratorUnavailableException("Request budget exhausted before inference");
        }
        Duration callTimeout = budget.cap(timeout);

        InferenceDraft reply;
        try {
            reply = Mono.fromCallable(() -> ask(question))
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(callTimeout)
                    .block();
        } catch (RuntimeException ex) {
            Throwable cause = Exceptions.unwrap(ex);
            throw new CollaboratorUnavailableException(
                    "Inference call failed: " + cause.getClass().getSimpleName(), cause);
        }
        if (reply == null) {
            throw new CollaboratorUnavailableException("Inference returned no content");
        }

        var validation = validator.validate(toDraft(reply));
        if (!validation.valid()) {
            log.debug("Inference draft fields dropped: {}", validation.violations());
        }
        return new ExtractionResult(validation.draft(), ExtractionOrigin.INFERENCE);
    }

    private InferenceDraft ask(String question) {
        return chatClient.prompt()
                .system(SYSTEM_PROMPT)
                .user(question)
                .call()
                .entity(InferenceDraft.class);
    }

    /**
     * Map onto draft fields. Vocabulary fields (intent, unit) that fall outside the
     * vocabulary are dropped here; the rest are checked by the validator.
     */
    static QuerySpecDraft toDraft(InferenceDraft reply) {
        RankingIntent intent = RankingIntent.fromLabel(reply.intent()).orElse(null);
        return new QuerySpecDraft(
                blankToNull(reply.drgCode()),
                blankToNull(reply.procedureText()),
                blankToNull(reply.zipCode()),
                toKilometers(reply.radius(), reply.unit()),
                intent,
                reply.topK()
        );
    }

    private static Double toKilometers(Double radius, String unit) {
        if (radius == null) {
            return null;
        }
        String u = unit == null ? "km" : unit.trim().toLowerCase(Locale.ROOT);
        if (KM_UNITS.contains(u)) {
            return radius;
        }
        if (MILE_UNITS.contains(u)) {
            return GeoMath.milesToKm(radius);
        }
        return null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
