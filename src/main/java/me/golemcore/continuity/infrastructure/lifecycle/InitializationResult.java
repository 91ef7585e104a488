package me.golemcore.continuity.infrastructure.lifecycle;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one {@link InitializationGuard#ensureInitialized} call.
 */
@Value
@Builder
public class InitializationResult {

    boolean success;
    boolean alreadyInitialized;
    String error;
    boolean retryable;
    int attempt;

    public static InitializationResult succeeded(int attempt) {
        return InitializationResult.builder().success(true).attempt(attempt).build();
    }

    public static InitializationResult alreadyInitialized(int attempt) {
        return InitializationResult.builder().success(true).alreadyInitialized(true).attempt(attempt).build();
    }

    public static InitializationResult failed(String error, boolean retryable, int attempt) {
        return InitializationResult.builder()
                .success(false)
                .error(error)
                .retryable(retryable)
                .attempt(attempt)
                .build();
    }
}
