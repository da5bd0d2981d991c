package com.ttennebkram.focusstack.model;

/**
 * Outcome of running a stack job.
 */
public enum RunResult {
    SUCCESS(0),
    FAILED(1),
    TIMED_OUT(2);

    private final int exitCode;

    RunResult(int exitCode) {
        this.exitCode = exitCode;
    }

    /**
     * Process exit code the launcher uses for this outcome.
     */
    public int getExitCode() {
        return exitCode;
    }
}
