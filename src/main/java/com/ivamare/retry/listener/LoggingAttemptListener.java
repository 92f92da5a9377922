package com.ivamare.retry.listener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one WARN line per failed attempt, with the error's stack trace and causes.
 */
public class LoggingAttemptListener implements AttemptListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingAttemptListener.class);

    private final Logger logger;

    public LoggingAttemptListener() {
        this(log);
    }

    /**
     * Creates a listener writing to the given logger.
     *
     * @param logger Logger to write to
     */
    public LoggingAttemptListener(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void onAttemptFailed(String stepName, int attempt, Throwable error) {
        logger.warn("Step {} attempt {} failed: {}", stepName, attempt, error.toString(), error);
    }
}
