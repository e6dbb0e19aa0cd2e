package saig.email.app.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Engine tuning, bound from {@code saig.*} properties.
 */
@Data
@Component
@ConfigurationProperties(prefix = "saig")
public class EngineProperties {

    private Sync sync = new Sync();
    private Trash trash = new Trash();
    private Extraction extraction = new Extraction();
    private Locks locks = new Locks();
    private Urgency urgency = new Urgency();

    @Data
    public static class Sync {
        private long tickIntervalMs = 30000L;
        private int pageSize = 50;
        private int maxPagesPerTick = 10; // bounds one tick's work
        private Duration backoffBase = Duration.ofSeconds(30);
        private Duration backoffCap = Duration.ofMinutes(10);
    }

    @Data
    public static class Trash {
        private int retentionDays = 30;
        private long sweepIntervalMs = 3600000L;
        private long remoteRetryIntervalMs = 120000L;
    }

    @Data
    public static class Extraction {
        private String zone = "UTC";
        private int maxItemsPerEmail = 5;
    }

    @Data
    public static class Urgency {
        private int threshold = 40;
        /** Address fragments whose mail always scores as important. */
        private List<String> vipSenders = new ArrayList<>();
        /** Address fragments whose mail is never marked urgent. */
        private List<String> ignoredSenders = new ArrayList<>();
    }

    @Data
    public static class Locks {
        private Duration entityLockTimeout = Duration.ofSeconds(30);
        private Duration accountLockTimeout = Duration.ofMinutes(10);
    }
}
