package saig.email.app.service;

import saig.email.app.config.EngineProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Exponential retry delay for failing sync ticks: base doubled per consecutive failure, capped.
 */
@Component
public class BackoffPolicy {
    private final Duration base;
    private final Duration cap;

    public BackoffPolicy(EngineProperties properties) {
        this.base = properties.getSync().getBackoffBase();
        this.cap = properties.getSync().getBackoffCap();
    }

    public Duration delayAfter(int consecutiveFailures) {
        if (consecutiveFailures <= 0) {
            return Duration.ZERO;
        }
        int shift = Math.min(consecutiveFailures - 1, 30);
        long millis = base.toMillis() << shift;
        if (millis <= 0 || millis > cap.toMillis()) {
            return cap;
        }
        return Duration.ofMillis(millis);
    }
}
