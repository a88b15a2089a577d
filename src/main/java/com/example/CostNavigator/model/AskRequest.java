package com.example.CostNavigator.model;

/**
 * Free-text question, e.g. "Who is cheapest for DRG 470 within 25 miles of 10001?"
 *
 * @param question natural-language question
 */
public record AskRequest(String question) {

    public String resolveQuestion() {
        return question == null ? "" : question.strip();
    }
}
