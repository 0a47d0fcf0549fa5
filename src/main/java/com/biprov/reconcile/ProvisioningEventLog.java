package com.biprov.reconcile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Structured provisioning events.
 *
 * Each event is one log record whose MDC carries {@code event}, {@code projectId},
 * {@code correlationId} and, inside a stage, {@code stage}. With structured console logging
 * enabled these become top-level JSON fields of the record.
 *
 * Usage:
 * <pre>
 * try (ProvisioningEventLog.Scope scope = eventLog.open(projectId, correlationId)) {
 *     eventLog.event("provision.start", "templates={}", ids);
 * }
 * </pre>
 */
@Component
public class ProvisioningEventLog {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningEventLog.class);

    public static final String MDC_EVENT = "event";
    public static final String MDC_PROJECT_ID = "projectId";
    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_STAGE = "stage";

    /**
     * Binds the invocation's identifiers to the current thread until closed.
     */
    public Scope open(String projectId, String correlationId) {
        if (projectId != null) {
            MDC.put(MDC_PROJECT_ID, projectId);
        }
        MDC.put(MDC_CORRELATION_ID, correlationId);
        return new Scope();
    }

    /**
     * Adds the project id once it is known, for scopes opened before the payload was parsed.
     */
    public void project(String projectId) {
        MDC.put(MDC_PROJECT_ID, projectId);
    }

    public void stage(ReconcileStage stage) {
        MDC.put(MDC_STAGE, stage.getValue());
    }

    public void event(String event, String format, Object... args) {
        MDC.put(MDC_EVENT, event);
        try {
            log.info(event + " " + format, args);
        } finally {
            MDC.remove(MDC_EVENT);
        }
    }

    public void warn(String event, String format, Object... args) {
        MDC.put(MDC_EVENT, event);
        try {
            log.warn(event + " " + format, args);
        } finally {
            MDC.remove(MDC_EVENT);
        }
    }

    /**
     * Logs a failure event. A trailing {@link Throwable} argument is logged with its stack trace.
     */
    public void error(String event, String format, Object... args) {
        MDC.put(MDC_EVENT, event);
        try {
            log.error(event + " " + format, args);
        } finally {
            MDC.remove(MDC_EVENT);
        }
    }

    /**
     * Clears the invocation's MDC keys on close.
     */
    public static final class Scope implements AutoCloseable {

        private Scope() {
        }

        @Override
        public void close() {
            MDC.remove(MDC_PROJECT_ID);
            MDC.remove(MDC_CORRELATION_ID);
            MDC.remove(MDC_STAGE);
            MDC.remove(MDC_EVENT);
        }
    }
}
