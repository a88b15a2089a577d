package com.example.CostNavigator.service;

import com.example.CostNavigator.config.NavigatorProperties;
import com.example.CostNavigator.exception.InvalidInputException;
import com.example.CostNavigator.extraction.ExtractionResult;
import com.example.CostNavigator.extraction.ParameterExtractor;
import com.example.CostNavigator.extraction.QuerySpecDraft;
import com.example.CostNavigator.extraction.StructuredDraftMapper;
import com.example.CostNavigator.geo.GeoMath;
import com.example.CostNavigator.guard.GuardDecision;
import com.example.CostNavigator.guard.IntentGuard;
import com.example.CostNavigator.model.AskRequest;
import com.example.CostNavigator.model.AskResponse;
import com.example.CostNavigator.model.CostSummary;
import com.example.CostNavigator.model.ProviderResult;
import com.example.CostNavigator.model.ProviderSearchRequest;
import com.example.CostNavigator.model.QuerySpec;
import com.example.CostNavigator.model.RankingIntent;
import com.example.CostNavigator.ranking.ResultRanker;
import com.example.CostNavigator.search.Candidate;
import com.example.CostNavigator.search.CandidateSet;
import com.example.CostNavigator.search.OfferingRow;
import com.example.CostNavigator.search.SearchPlanner;
import com.example.CostNavigator.util.RequestBudget;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Request pipeline: extract, guard, plan, rank.
 *
 * Structured searches and natural-language questions share everything after
 * extraction, including validation and scope checks.
 */
@Service
@RequiredArgsConstructor
public class NavigatorService {

    private static final Logger log = LoggerFactory.getLogger(NavigatorService.class);

    private final NavigatorProperties properties;
    private final StructuredDraftMapper structuredDraftMapper;
    private final ParameterExtractor parameterExtractor;
    private final IntentGuard intentGuard;
    private final SearchPlanner searchPlanner;
    private final ResultRanker resultRanker;
    private final AnswerFormatter answerFormatter;

    /**
     * Query-string search. Invalid parameters are rejected, never trimmed.
     */
    public List<ProviderResult> search(ProviderSearchRequest request) {
        RequestBudget budget = RequestBudget.start(properties.getRequest().getDeadline());
        QuerySpecDraft draft = structuredDraftMapper.toDraft(request);

        GuardDecision decision = intentGuard.classify(draft);
        if (!(decision instanceof GuardDecision.InScope inScope)) {
            throw new InvalidInputException("drg", "drg and zip are required");
        }
        QuerySpec spec = inScope.spec();

        CandidateSet candidates = searchPlanner.plan(spec, budget);
        return resultRanker.rank(candidates.candidates(), spec.rankingIntent(), spec.limit()).stream()
                .map(NavigatorService::toResult)
                .toList();
    }

    /**
     * Natural-language question. Out-of-scope questions get a typed refusal rather
     * than an empty result list.
     */
    public AskResponse ask(AskRequest request) {
        String question = request.resolveQuestion();
        if (question.isEmpty()) {
            throw new InvalidInputException("question", "question is required");
        }
        RequestBudget budget = RequestBudget.start(properties.getRequest().getDeadline());

        ExtractionResult extraction = parameterExtractor.extract(question, budget);
        log.debug("Extracted {} via {} from question='{}'", extraction.draft(), extraction.origin(), question);

        GuardDecision decision = intentGuard.classify(question, extraction.draft());
        if (decision instanceof GuardDecision.OutOfScope outOfScope) {
            return AskResponse.outOfScope(outOfScope.message());
        }
        QuerySpec spec = ((GuardDecision.InScope) decision).spec();

        CandidateSet candidates = searchPlanner.plan(spec, budget);
        List<Candidate> ranked = resultRanker.rank(candidates.candidates(), spec.rankingIntent(), spec.limit());
        CostSummary summary = spec.rankingIntent() == RankingIntent.AVERAGE_COST
                ? resultRanker.summarize(candidates.candidates()).orElse(null)
                : null;

        return new AskResponse(
                true,
                answerFormatter.format(spec.rankingIntent(), ranked, summary),
                spec.rankingIntent(),
                extraction.origin().name(),
                ranked.stream().map(NavigatorService::toResult).toList(),
                summary
        );
    }

    private static ProviderResult toResult(Candidate candidate) {
        OfferingRow row = candidate.offering();
        return new ProviderResult(
                row.providerId(),
                row.name(),
                row.city(),
                row.state(),
                row.zipCode(),
                row.msDrgDefinition(),
                row.averageCoveredCharges(),
                row.averageTotalPayments(),
                row.averageMedicarePayments(),
                row.rating(),
                GeoMath.roundForDisplay(candidate.distanceKm())
        );
    }
}
