package com.example.CostNavigator.extraction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Shape the chat model is asked to fill. Nothing here is trusted: every value is
 * mapped onto a {@link QuerySpecDraft} and revalidated.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InferenceDraft(
        @JsonProperty("intent")
        @JsonPropertyDescription("one of cheapest, best_rated, top_n, average_cost, or null")
        String intent,

        @JsonProperty("drg_code")
        @JsonPropertyDescription("3-digit MS-DRG code if the question names one, else null")
        String drgCode,

        @JsonProperty("procedure_text")
        @JsonPropertyDescription("short procedure or condition description when no DRG code is given, else null")
        String procedureText,

        @JsonProperty("zip_code")
        @JsonPropertyDescription("5-digit US ZIP code, else null")
        String zipCode,

        @JsonProperty("radius")
        @JsonPropertyDescription("search radius as a number, else null")
        Double radius,

        @JsonProperty("unit")
        @JsonPropertyDescription("unit of radius: km or miles")
        String unit,

        @JsonProperty("top_k")
        @JsonPropertyDescription("number of hospitals requested, else null")
        Integer topK
) {
}
