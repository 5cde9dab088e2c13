package com.eainde.bidding.workflow;

/**
 * Lifecycle of one pipeline run.
 *
 * <pre>
 * INIT → INDEXED → EXTRACTING → AGGREGATED → DONE
 *   └───────┴──────────┴────────────┴──────→ FAILED
 * </pre>
 */
public enum PipelineState {
    INIT,
    INDEXED,
    EXTRACTING,
    AGGREGATED,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
