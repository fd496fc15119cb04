package com.company.radar.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

/**
 * Binds the radar.* section of application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "radar")
public class RadarProperties {

    @Valid
    private Pipeline pipeline = new Pipeline();

    @Valid
    private Ingestion ingestion = new Ingestion();

    @Valid
    private Detection detection = new Detection();

    @Valid
    private Dispatch dispatch = new Dispatch();

    @Valid
    private Email email = new Email();

    @Valid
    private Upstream upstream = new Upstream();

    @Valid
    private Retention retention = new Retention();

    @Data
    public static class Pipeline {
        /** Concurrent account pipelines. */
        @Min(1)
        private int workerPoolSize = 4;
        /** Runs waiting for a worker before submissions are rejected. */
        @Min(0)
        private int queueCapacity = 100;
        /** Parallel analyzers inside one run. */
        @Min(1)
        private int analysisParallelism = 2;
        /** A running run with no heartbeat for this long is reaped. */
        @NotNull
        private Duration heartbeatTimeout = Duration.ofMinutes(20);
        /** A running run older than this is reaped regardless of heartbeat. */
        @NotNull
        private Duration hardTimeout = Duration.ofHours(2);
    }

    @Data
    public static class Ingestion {
        /** Total analysis window, split in two halves for comparison. */
        @Min(2)
        private int analysisWindowDays = 14;
        /** Days the upstream needs before a day's numbers are complete. */
        @Min(0)
        private int lagDays = 2;
        @Min(0)
        private int safetyBufferDays = 7;
        /** Rows requested per upstream page. */
        @Min(1)
        private int pageSize = 25000;
        /** Rows per upsert batch. */
        @Min(1)
        private int persistBatchSize = 1000;

        public int getHalfWindowDays() {
            return analysisWindowDays / 2;
        }

        public int getBackfillDays() {
            return analysisWindowDays + lagDays + safetyBufferDays;
        }
    }

    @Data
    public static class Detection {
        /** Previous-window impressions below this never trigger. */
        @Min(0)
        private long noiseFloor = 100;
        /** Trigger when the delta is at or below this percentage. */
        private double dropThresholdPct = -10.0;
        @NotNull
        private Duration dedupWindow = Duration.ofHours(24);
        /** Continuing keys are classified as gain/drop at or beyond this absolute change. */
        private double significantChangePct = 40.0;
    }

    @Data
    public static class Dispatch {
        @NotNull
        private Duration cooldown = Duration.ofDays(3);
        @NotNull
        private Duration pacingDelay = Duration.ofMillis(500);
        /** How long a claimed delivery stays invisible to other dispatchers. */
        @NotNull
        private Duration claimLease = Duration.ofMinutes(10);
        @Min(1)
        private int batchSize = 100;
    }

    @Data
    public static class Email {
        /** sendgrid or smtp. */
        @NotBlank
        private String provider = "sendgrid";
        @NotBlank
        private String fromAddress = "alerts@searchradar.local";
        private String sendgridApiKey;
        @NotBlank
        private String sendgridBaseUrl = "https://api.sendgrid.com";
    }

    @Data
    public static class Upstream {
        @NotBlank
        private String baseUrl = "https://searchconsole.googleapis.com";
        @NotBlank
        private String tokenUri = "https://oauth2.googleapis.com/token";
        private String clientId;
        private String clientSecret;
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Retention {
        /** Finished runs and closed alerts older than this are deleted. */
        @Min(1)
        private int days = 180;
    }
}
