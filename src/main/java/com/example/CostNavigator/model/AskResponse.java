package com.example.CostNavigator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AskResponse(
        boolean inScope,
        String answer,
        RankingIntent intent,
        String origin,
        List<ProviderResult> results,
        CostSummary summary
) {
    public static AskResponse outOfScope(String answer) {
        return new AskResponse(false, answer, null, null, null, null);
    }
}
