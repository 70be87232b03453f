package dev.aparikh.hybridsearch.web;

import org.jspecify.annotations.Nullable;

/**
 * JSON error body.
 *
 * @param code    machine-readable error category
 * @param message human-readable detail
 */
public record ErrorResponse(String code, @Nullable String message) {
}
