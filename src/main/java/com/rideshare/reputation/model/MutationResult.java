package com.rideshare.reputation.model;

import java.util.List;

/**
 * A committed mutation together with the outcomes of its side effects.
 * A failed side effect never turns into an error for the caller.
 */
public record MutationResult<T>(T result, List<SideEffectOutcome> sideEffects) {

    public MutationResult {
        sideEffects = List.copyOf(sideEffects);
    }

    public static <T> MutationResult<T> of(T result, SideEffectOutcome... sideEffects) {
        return new MutationResult<>(result, List.of(sideEffects));
    }

    public boolean hasFailedSideEffects() {
        return sideEffects.stream().anyMatch(SideEffectOutcome::isFailed);
    }

    public SideEffectOutcome sideEffect(String name) {
        return sideEffects.stream()
                .filter(outcome -> outcome.name().equals(name))
                .findFirst()
                .orElse(null);
    }
}
