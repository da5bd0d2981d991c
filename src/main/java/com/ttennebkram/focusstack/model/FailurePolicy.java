package com.ttennebkram.focusstack.model;

/**
 * What the Worker does with queued tasks once some task has failed.
 * The first failure message is recorded under every policy.
 */
public enum FailurePolicy {

    /** Failed tasks count as completed and their dependents run normally. */
    RUN_DEPENDENTS,

    /**
     * Tasks depending directly or transitively on a failed task are marked failed
     * without running. Independent branches keep going so partial output is still produced.
     */
    SKIP_DEPENDENTS,

    /** After the first failure, no further task is started; everything still queued is skipped. */
    STOP_ALL;

    /**
     * Parse a policy name, ignoring case and accepting '-' for '_'.
     */
    public static FailurePolicy fromName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Failure policy name is empty");
        }
        String normalized = name.trim().toUpperCase().replace('-', '_');
        for (FailurePolicy policy : values()) {
            if (policy.name().equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown failure policy: " + name);
    }
}
