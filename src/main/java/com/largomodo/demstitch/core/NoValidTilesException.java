package com.largomodo.demstitch.core;

/**
 * Fatal run-level failure: nothing usable survived a pipeline stage.
 * <p>
 * RuntimeException so the stages can abort without declaring it; the CLI maps it to its own
 * exit code. Distinct from per-tile failures, which are only counted and logged.
 */
public class NoValidTilesException extends RuntimeException {

    /**
     * Stage at which the tile set became empty.
     */
    public enum Reason {
        NO_TILES_FOUND("No tiles found"),
        NO_TILES_DECODED("No tiles decoded"),
        NO_TILES_PLACED("No tiles placed");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    private final Reason reason;

    public NoValidTilesException(Reason reason, String detail) {
        super(reason.description() + ": " + detail);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
