package com.ttennebkram.focusstack.model;

/**
 * Progress snapshot of a Worker. Values are read under the Worker lock
 * but may be stale by the time they are displayed.
 */
public class WorkerStatus {
    private final int totalTasks;
    private final int completedTasks;
    private final String runningTaskName;

    public WorkerStatus(int totalTasks, int completedTasks, String runningTaskName) {
        this.totalTasks = totalTasks;
        this.completedTasks = completedTasks;
        this.runningTaskName = runningTaskName;
    }

    public int getTotalTasks() {
        return totalTasks;
    }

    public int getCompletedTasks() {
        return completedTasks;
    }

    /**
     * Name of the running task that is furthest along in the pipeline, or an empty string.
     */
    public String getRunningTaskName() {
        return runningTaskName;
    }

    @Override
    public String toString() {
        return String.format("%d/%d %s", completedTasks, totalTasks, runningTaskName);
    }
}
