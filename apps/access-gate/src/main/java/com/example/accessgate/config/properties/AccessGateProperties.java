package com.example.accessgate.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.UUID;

@Data
@Validated
@ConfigurationProperties(prefix = "access-gate")
public class AccessGateProperties {

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Store store = new Store();

    @Valid
    private Approval approval = new Approval();

    @Valid
    private Audit audit = new Audit();

    @Valid
    private Notification notification = new Notification();

    /**
     * Identifies this instance on the invalidation channel. Random when unset.
     */
    private String instanceId = UUID.randomUUID().toString();

    @Data
    public static class Cache {
        /**
         * {@code in-memory} or {@code redis}.
         */
        @NotBlank
        private String store = "in-memory";

        @NotNull
        private Duration ttl = Duration.ofSeconds(300);

        /**
         * TTL applied to denied decisions.
         */
        @NotNull
        private Duration negativeTtl = Duration.ofSeconds(30);

        @Min(1)
        private long maxEntries = 50_000;

        @NotBlank
        private String keyPrefix = "access-gate:decision:";

        /**
         * Broadcast invalidations to other instances over Redis pub/sub.
         */
        private boolean broadcast = false;
    }

    @Data
    public static class Store {
        /**
         * {@code memory} or {@code mongo}.
         */
        @NotBlank
        private String type = "memory";

        /**
         * Upper bound on index creation at startup when {@code type} is {@code mongo}.
         */
        @NotNull
        private Duration indexInitTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Approval {
        @Valid
        private Escalation escalation = new Escalation();

        @Data
        public static class Escalation {
            private boolean enabled = false;

            @NotNull
            private Duration interval = Duration.ofMinutes(5);
        }
    }

    @Data
    public static class Audit {
        private boolean enabled = true;
    }

    @Data
    public static class Notification {
        /**
         * Approver notification channel. Only {@code log} ships with the engine.
         */
        @NotBlank
        private String type = "log";
    }
}
