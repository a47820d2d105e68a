package com.screening.concurrent;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Carries the caller's MDC into tasks run on pool threads.
 */
public final class MdcContext {

    private MdcContext() {
    }

    public static <T> Callable<T> wrap(Callable<T> task) {
        // Capture on the submitting thread
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
