package dev.aparikh.hybridsearch.search.model;

import org.jspecify.annotations.Nullable;

/**
 * What happened to one retrieval source during a search.
 *
 * @param source  the source name
 * @param state   outcome of the call
 * @param hits    number of results used for fusion (0 unless {@link State#OK})
 * @param tookMs  wall time until the result was available or given up on
 * @param message failure detail, {@code null} when OK
 */
public record SourceStatus(String source, State state, int hits, long tookMs, @Nullable String message) {

    public enum State {
        OK,
        FAILED,
        TIMED_OUT
    }

    public static SourceStatus ok(String source, int hits, long tookMs) {
        return new SourceStatus(source, State.OK, hits, tookMs, null);
    }

    public boolean degraded() {
        return state != State.OK;
    }
}
