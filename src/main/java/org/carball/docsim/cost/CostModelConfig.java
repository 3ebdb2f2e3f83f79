package org.carball.docsim.cost;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Every rate and constant the cost model and simulator use. Built once per run
 * and passed explicitly; nothing reads these values from globals.
 */
@Value
@Builder(toBuilder = true)
@Slf4j
public class CostModelConfig {

    public static final long BYTES_PER_GB = 1024L * 1024L * 1024L;

    // Cost units per GB scanned
    @Builder.Default
    double timeUnit = 1.0;

    @Builder.Default
    double carbonUnit = 0.5;

    @Builder.Default
    double priceUnit = 0.1;

    // Applied to shuffles and other remote transfers
    @Builder.Default
    double networkMultiplier = 5.0;

    // Per-field overhead in output documents
    @Builder.Default
    int keyOverheadBytes = 12;

    @Builder.Default
    int unknownFieldSizeBytes = 8;

    @Builder.Default
    long bytesPerGb = BYTES_PER_GB;

    // Leaderboard weights
    @Builder.Default
    double timeWeight = 1.0;

    @Builder.Default
    double carbonWeight = 1.0;

    @Builder.Default
    double priceWeight = 1.0;

    public static CostModelConfig defaults() {
        return CostModelConfig.builder().build();
    }

    public double toGb(long bytes) {
        return (double) bytes / bytesPerGb;
    }

    /**
     * Logs a warning for every value that would make cost comparisons meaningless.
     */
    public void validate() {
        if (timeUnit <= 0) {
            log.warn("Time unit ({}) should be positive", timeUnit);
        }
        if (carbonUnit <= 0) {
            log.warn("Carbon unit ({}) should be positive", carbonUnit);
        }
        if (priceUnit <= 0) {
            log.warn("Price unit ({}) should be positive", priceUnit);
        }
        if (networkMultiplier < 1.0) {
            log.warn("Network multiplier ({}) should be at least 1.0", networkMultiplier);
        }
        if (bytesPerGb <= 0) {
            log.warn("Bytes per GB ({}) should be positive", bytesPerGb);
        }

        log.debug("Using cost units - time: {}, carbon: {}, price: {}, network x{}",
                timeUnit, carbonUnit, priceUnit, networkMultiplier);
    }

    public String getConfigurationSummary() {
        return String.format(Locale.ROOT, "Time/GB: %.3f | Carbon/GB: %.3f | Price/GB: %.3f | Network: x%.1f",
                timeUnit, carbonUnit, priceUnit, networkMultiplier);
    }
}
