package dev.aparikh.hybridsearch.fusion;

import dev.aparikh.hybridsearch.ConfigurationException;

import java.util.Locale;

/**
 * The interchangeable fusion strategies.
 */
public enum FusionMethod {
    WEIGHTED_SUM,
    RRF;

    /**
     * Parses a strategy name. Accepts {@code weighted}, {@code weighted_sum}, {@code weighted-sum}
     * and {@code rrf}, case-insensitively.
     *
     * @throws ConfigurationException if the name is blank or unknown
     */
    public static FusionMethod fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Fusion strategy must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "weighted", "weighted_sum" -> WEIGHTED_SUM;
            case "rrf" -> RRF;
            default -> throw new ConfigurationException(
                    "Unknown fusion strategy '" + value + "', expected one of: weighted, rrf");
        };
    }
}
