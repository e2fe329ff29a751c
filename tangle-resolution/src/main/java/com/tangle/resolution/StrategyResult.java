package com.tangle.resolution;

import com.tangle.marking.Markings;

import java.util.Objects;

/**
 * Answer of one strategy (possibly partial), or a cancellation that aborts the whole resolution.
 */
public final class StrategyResult {

    private final Markings markings;
    private final String cancelReason;

    private StrategyResult(Markings markings, String cancelReason) {
        this.markings = markings;
        this.cancelReason = cancelReason;
    }

    public static StrategyResult answered(Markings markings) {
        return new StrategyResult(Objects.requireNonNull(markings, "markings"), null);
    }

    public static StrategyResult nothing() {
        return new StrategyResult(new Markings(), null);
    }

    public static StrategyResult cancelled(String reason) {
        return new StrategyResult(null, reason != null ? reason : "cancelled");
    }

    public boolean isCancelled() {
        return cancelReason != null;
    }

    /** Answered markings; empty for a cancellation. */
    public Markings getMarkings() {
        return markings != null ? markings : new Markings();
    }

    public String getCancelReason() {
        return cancelReason;
    }

    @Override
    public String toString() {
        return isCancelled() ? "cancelled(" + cancelReason + ")" : "answered(" + markings + ")";
    }
}
