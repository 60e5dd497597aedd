package com.example.legalrag.util;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Runs ordered strategies until one yields an accepted value.
 * <p>
 * The result is the first success that passes {@code accept}. Failing that, the last success that
 * did not pass (for instance an empty result set); failing that, the last failure.
 */
@Slf4j
public final class FallbackChain {

    private FallbackChain() {}

    public record Strategy<T>(String name, Supplier<T> action) {}

    public static <T> Strategy<T> strategy(String name, Supplier<T> action) {
        return new Strategy<>(name, action);
    }

    public static <T> Attempt<T> firstSuccess(List<Strategy<T>> strategies, Predicate<T> accept) {
        Attempt<T> rejected = null;
        Attempt<T> failed = Attempt.failure("none", new IllegalStateException("No strategy configured"));
        for (Strategy<T> strategy : strategies) {
            Attempt<T> attempt = run(strategy);
            if (attempt instanceof Attempt.Success<T> success) {
                if (accept.test(success.value())) return success;
                log.debug("Strategy {} returned a rejected result, trying next", strategy.name());
                rejected = success;
            } else {
                failed = attempt;
            }
        }
        return rejected != null ? rejected : failed;
    }

    public static <T> Attempt<T> firstSuccess(List<Strategy<T>> strategies) {
        return firstSuccess(strategies, value -> true);
    }

    private static <T> Attempt<T> run(Strategy<T> strategy) {
        try {
            return Attempt.success(strategy.name(), strategy.action().get());
        } catch (RuntimeException e) {
            log.warn("Strategy {} failed: {}", strategy.name(), e.getMessage());
            return Attempt.failure(strategy.name(), e);
        }
    }
}
