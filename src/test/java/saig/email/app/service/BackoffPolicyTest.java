package saig.email.app.service;

import saig.email.app.config.EngineProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {
    private final BackoffPolicy backoffPolicy = new BackoffPolicy(new EngineProperties());

    @Test
    void delayAfter_NoFailures_ShouldBeZero() {
        assertEquals(Duration.ZERO, backoffPolicy.delayAfter(0));
    }

    @Test
    void delayAfter_ShouldDoublePerFailure() {
        assertEquals(Duration.ofSeconds(30), backoffPolicy.delayAfter(1));
        assertEquals(Duration.ofSeconds(60), backoffPolicy.delayAfter(2));
        assertEquals(Duration.ofSeconds(240), backoffPolicy.delayAfter(4));
    }

    @Test
    void delayAfter_ManyFailures_ShouldStayAtCap() {
        assertEquals(Duration.ofMinutes(10), backoffPolicy.delayAfter(6));
        assertEquals(Duration.ofMinutes(10), backoffPolicy.delayAfter(500));
    }

    @Test
    void delayAfter_ShouldFollowConfiguredBaseAndCap() {
        // Given
        EngineProperties properties = new EngineProperties();
        properties.getSync().setBackoffBase(Duration.ofSeconds(5));
        properties.getSync().setBackoffCap(Duration.ofSeconds(12));
        BackoffPolicy policy = new BackoffPolicy(properties);

        // Then
        assertEquals(Duration.ofSeconds(10), policy.delayAfter(2));
        assertEquals(Duration.ofSeconds(12), policy.delayAfter(3));
    }
}
