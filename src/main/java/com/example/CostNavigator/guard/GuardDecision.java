package com.example.CostNavigator.guard;

import com.example.CostNavigator.model.QuerySpec;

/**
 * Result of scope classification: either a runnable {@link QuerySpec} or a refusal.
 */
public sealed interface GuardDecision permits GuardDecision.InScope, GuardDecision.OutOfScope {

    record InScope(QuerySpec spec) implements GuardDecision {
    }

    record OutOfScope(String message) implements GuardDecision {
    }
}
