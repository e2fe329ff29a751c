package com.tangle.resolution;

import com.tangle.marking.Markings;

import java.util.Objects;

/**
 * Result of a top-level resolution: committed with the resolved markings, or aborted with
 * nothing written.
 */
public final class ResolutionOutcome {

    private final Markings markings;
    private final String abortReason;

    private ResolutionOutcome(Markings markings, String abortReason) {
        this.markings = markings;
        this.abortReason = abortReason;
    }

    public static ResolutionOutcome committed(Markings markings) {
        return new ResolutionOutcome(Objects.requireNonNull(markings, "markings"), null);
    }

    public static ResolutionOutcome aborted(String reason) {
        return new ResolutionOutcome(null, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isCommitted() {
        return abortReason == null;
    }

    public boolean isAborted() {
        return abortReason != null;
    }

    /**
     * Resolved markings.
     *
     * @throws IllegalStateException if the resolution was aborted
     */
    public Markings getMarkings() {
        if (isAborted()) throw new IllegalStateException("Resolution aborted: " + abortReason);
        return markings;
    }

    public String getAbortReason() {
        return abortReason;
    }

    @Override
    public String toString() {
        return isCommitted() ? "committed(" + markings + ")" : "aborted(" + abortReason + ")";
    }
}
