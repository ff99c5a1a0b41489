package com.largomodo.demstitch.core.domain;

/**
 * Outcome of a hole-filling run.
 *
 * @param missingBefore Missing pixels when the run started
 * @param filled        Pixels filled across all passes
 * @param passes        Passes actually executed
 * @param skipped       True when the missing count exceeded the cap and nothing was touched
 */
public record InterpolationResult(int missingBefore, int filled, int passes, boolean skipped) {

    public int remaining() {
        return missingBefore - filled;
    }

    public static InterpolationResult skipped(int missingBefore) {
        return new InterpolationResult(missingBefore, 0, 0, true);
    }
}
