package com.eainde.bidding.thread;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Carries the submitting thread's MDC (run id, session id, agent) into pooled worker threads,
 * and clears it again when the task ends so pooled threads never leak context between runs.
 */
public final class MdcTaskDecorator {

    private MdcTaskDecorator() {
    }

    public static <T> Callable<T> decorate(Callable<T> task) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            } else {
                MDC.clear();
            }
            try {
                return task.call();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }
}
