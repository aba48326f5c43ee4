package org.carball.askdb.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.ZoneId;

@Data
@Builder(toBuilder = true)
@Slf4j
public class TranslationSettings {

    // Business days start at local midnight in this zone
    @Builder.Default
    private ZoneId timeZone = ZoneId.of("Europe/London");

    @Builder.Default
    private int maxOffsetDays = 365;

    // Store access
    @Builder.Default
    private Duration requestTimeout = Duration.ofSeconds(10);

    @Builder.Default
    private int rowLimit = 10_000;

    private String storeUrl;

    private String storeApiKey;

    private String openAiApiKey;

    public static TranslationSettings defaults() {
        return TranslationSettings.builder().build();
    }

    /**
     * Rejects values the engine cannot work with and logs warnings for merely questionable ones.
     */
    public void validate() {
        if (timeZone == null) {
            throw new IllegalArgumentException("Time zone must be set");
        }
        if (maxOffsetDays < 0) {
            throw new IllegalArgumentException("Max offset days (" + maxOffsetDays + ") must not be negative");
        }
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("Request timeout (" + requestTimeout + ") must be positive");
        }
        if (rowLimit <= 0) {
            throw new IllegalArgumentException("Row limit (" + rowLimit + ") must be positive");
        }

        if (maxOffsetDays > 3650) {
            log.warn("Max offset days ({}) allows date windows more than ten years back", maxOffsetDays);
        }
        if (requestTimeout.compareTo(Duration.ofSeconds(10)) > 0) {
            log.warn("Request timeout ({} ms) is above the 10 s an interactive question should wait",
                    requestTimeout.toMillis());
        }
        if (rowLimit > 100_000) {
            log.warn("Row limit ({}) may pull very large result sets into memory", rowLimit);
        }
        if (storeUrl != null && storeApiKey == null) {
            log.warn("Store URL is set but no API key, requests will be anonymous");
        }

        log.debug("Using settings - Zone: {}, Max offset: {}, Timeout: {} ms, Row limit: {}",
                timeZone, maxOffsetDays, requestTimeout.toMillis(), rowLimit);
    }

    public String getConfigurationSummary() {
        return String.format("Zone: %s | Max offset: %d days | Timeout: %d ms | Row limit: %d | Store: %s",
                timeZone, maxOffsetDays, requestTimeout.toMillis(), rowLimit,
                storeUrl == null ? "none" : storeUrl);
    }
}
