package com.screening.config;

import com.screening.engine.ListSource;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Bound to the "screening" block of application.yml.
 *
 * Example:
 *
 * screening:
 *   hard-block-sources: DOMESTIC_BLOCKED
 *   snapshot:
 *     directory: /var/lib/screening/watchlists
 *     fallback-enabled: true
 *   rescreen:
 *     cron: "0 0 2 * * *"
 *     parallelism: 4
 *     deadline: 30m
 *   internal:
 *     shared-secret: ${SCREENING_INTERNAL_SECRET:}
 */
@ConfigurationProperties(prefix = "screening")
@Validated
@Data
public class ScreeningProperties {

    /** Sources whose hit forces rejection regardless of score. */
    @NotNull
    private Set<ListSource> hardBlockSources = EnumSet.of(ListSource.DOMESTIC_BLOCKED);

    /** Cap on entries returned per source; the total is always reported in full. */
    @Min(1)
    @Max(100)
    private int maxEntriesPerSource = 10;

    @Valid
    private Snapshot snapshot = new Snapshot();

    @Valid
    private Rescreen rescreen = new Rescreen();

    @Valid
    private Internal internal = new Internal();

    @Data
    public static class Snapshot {

        /** Directory holding one JSON file per source, refreshed by an upstream job. */
        @NotBlank
        private String directory = "data/watchlists";

        /** Use the built-in reference lists when a snapshot cannot be loaded. */
        private boolean fallbackEnabled = true;
    }

    @Data
    public static class Rescreen {

        private boolean enabled = true;

        @NotBlank
        private String cron = "0 0 2 * * *";

        @Min(1)
        @Max(64)
        private int parallelism = 4;

        @NotNull
        private Duration deadline = Duration.ofMinutes(30);
    }

    @Data
    public static class Internal {

        /** Shared secret of the internal batch trigger. Empty disables the trigger. */
        private String sharedSecret = "";
    }
}
