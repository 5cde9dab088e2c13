package com.eainde.bidding.workflow;

import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Explicit transition table for {@link PipelineState}. Every transition is recorded; an
 * illegal one throws {@link IllegalStateException} and leaves the state unchanged.
 */
@Log4j2
public class PipelineStateMachine {

    private static final Map<PipelineState, Set<PipelineState>> TRANSITIONS = new EnumMap<>(PipelineState.class);

    static {
        TRANSITIONS.put(PipelineState.INIT, EnumSet.of(PipelineState.INDEXED, PipelineState.FAILED));
        TRANSITIONS.put(PipelineState.INDEXED, EnumSet.of(PipelineState.EXTRACTING, PipelineState.FAILED));
        TRANSITIONS.put(PipelineState.EXTRACTING, EnumSet.of(PipelineState.AGGREGATED, PipelineState.FAILED));
        TRANSITIONS.put(PipelineState.AGGREGATED, EnumSet.of(PipelineState.DONE, PipelineState.FAILED));
        TRANSITIONS.put(PipelineState.DONE, EnumSet.noneOf(PipelineState.class));
        TRANSITIONS.put(PipelineState.FAILED, EnumSet.noneOf(PipelineState.class));
    }

    private PipelineState current = PipelineState.INIT;
    private final List<StateTransition> history = new ArrayList<>();

    public static boolean isAllowed(PipelineState from, PipelineState to) {
        return TRANSITIONS.get(from).contains(to);
    }

    public synchronized PipelineState current() {
        return current;
    }

    public synchronized void transitionTo(PipelineState next, String reason) {
        if (!isAllowed(current, next)) {
            throw new IllegalStateException("Illegal pipeline transition " + current + " -> " + next);
        }
        history.add(new StateTransition(current, next, reason));
        log.info("Pipeline {} -> {}{}", current, next, reason == null ? "" : " (" + reason + ")");
        current = next;
    }

    public void transitionTo(PipelineState next) {
        transitionTo(next, null);
    }

    public void fail(String reason) {
        transitionTo(PipelineState.FAILED, reason);
    }

    public synchronized List<StateTransition> history() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }
}
