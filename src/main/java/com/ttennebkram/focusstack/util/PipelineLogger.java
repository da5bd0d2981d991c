package com.ttennebkram.focusstack.util;

/**
 * Sink for formatted diagnostic messages.
 * Tasks receive a logger from the Worker right before they run.
 * All methods take a {@link String#format(String, Object...)} pattern.
 */
public interface PipelineLogger {

    /**
     * Detailed progress information, normally hidden.
     */
    void verbose(String format, Object... args);

    /**
     * Regular progress information.
     */
    void info(String format, Object... args);

    /**
     * Failures and other problems that the user should see.
     */
    void error(String format, Object... args);

    /**
     * Logger that discards everything. Used when a task is run without a Worker.
     */
    PipelineLogger NONE = new PipelineLogger() {
        @Override
        public void verbose(String format, Object... args) {
        }

        @Override
        public void info(String format, Object... args) {
        }

        @Override
        public void error(String format, Object... args) {
        }
    };
}
