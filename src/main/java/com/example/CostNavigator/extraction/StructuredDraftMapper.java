package com.example.CostNavigator.extraction;

import com.example.CostNavigator.exception.InvalidInputException;
import com.example.CostNavigator.model.ProviderSearchRequest;
import com.example.CostNavigator.model.RankingIntent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Maps query-string parameters onto a draft. Unlike free text, a structured
 * request that fails validation is rejected instead of silently trimmed.
 */
@Component
@RequiredArgsConstructor
public class StructuredDraftMapper {

    private static final Pattern DRG_CODE = Pattern.compile("\\d{3}");

    private final DraftValidator validator;

    public QuerySpecDraft toDraft(ProviderSearchRequest request) {
        String drg = request.drg() == null ? "" : request.drg().trim();
        if (drg.isEmpty()) {
            throw new InvalidInputException("drg", "drg is required (DRG code or procedure text)");
        }
        if (request.zip() == null || request.zip().isBlank()) {
            throw new InvalidInputException("zip", "zip is required");
        }

        RankingIntent intent = null;
        if (request.sort() != null && !request.sort().isBlank()) {
            intent = RankingIntent.fromLabel(request.sort())
                    .orElseThrow(() -> new InvalidInputException("sort", "Unknown sort: " + request.sort()));
        }

        boolean isCode = DRG_CODE.matcher(drg).matches();
        QuerySpecDraft raw = new QuerySpecDraft(
                isCode ? drg : null,
                isCode ? null : drg,
                request.zip(),
                request.radiusKm(),
                intent,
                request.limit()
        );

        var validation = validator.validate(raw);
        if (!validation.valid()) {
            DraftValidator.Violation first = validation.violations().get(0);
            throw new InvalidInputException(first.field(), first.reason());
        }
        return validation.draft();
    }
}
