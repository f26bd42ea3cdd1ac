package org.nowstart.perpbot.service;

import java.time.Duration;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Fixed-delay retry for fallible collaborator calls. The last failure is rethrown once attempts run out.
 */
@Slf4j
@Getter
public class RetryExecutor {

    private final int retries;
    private final Duration delay;

    public RetryExecutor(int retries, Duration delay) {
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0");
        }
        this.retries = retries;
        this.delay = delay;
    }

    public <T> T call(String operation, Supplier<T> action) {
        RuntimeException lastFailure = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                lastFailure = e;
                if (attempt < retries) {
                    log.warn(
                            "event=retry operation={} attempt={} max_attempts={} reason={}",
                            operation,
                            attempt + 1,
                            retries + 1,
                            e.getMessage()
                    );
                    pause(operation);
                }
            }
        }
        throw lastFailure;
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    private void pause(String operation) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while retrying " + operation, e);
        }
    }
}
