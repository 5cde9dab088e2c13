package com.eainde.bidding.workflow;

import com.eainde.bidding.model.AggregatedReport;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one run. A completed run carries a report (possibly with unavailable fields);
 * a failed run carries a failure and no report.
 */
public record PipelineResult(String runId, PipelineState state, AggregatedReport report, PipelineFailure failure,
                             List<StateTransition> history, Duration elapsed) {

    public PipelineResult {
        history = List.copyOf(history);
    }

    static PipelineResult completed(String runId, PipelineStateMachine fsm, AggregatedReport report, Duration elapsed) {
        return new PipelineResult(runId, fsm.current(), report, null, fsm.history(), elapsed);
    }

    static PipelineResult failed(String runId, PipelineStateMachine fsm, PipelineFailure failure, Duration elapsed) {
        return new PipelineResult(runId, fsm.current(), null, failure, fsm.history(), elapsed);
    }

    public boolean isDone() {
        return state == PipelineState.DONE;
    }
}
