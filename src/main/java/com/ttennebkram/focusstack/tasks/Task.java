package com.ttennebkram.focusstack.tasks;

import com.ttennebkram.focusstack.model.TaskState;
import com.ttennebkram.focusstack.util.PipelineLogger;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Generic runnable task with optional dependencies on other tasks.
 *
 * Subclasses implement {@link #task()}. The Worker calls {@link #run(PipelineLogger)}
 * once {@link #readyToRun()} holds; any exception thrown by task() is caught there,
 * stored as the error message, and the task still ends up completed so that
 * nothing waiting on it hangs.
 *
 * Lifecycle fields are guarded by a per-task lock, which also serves {@link #await()}.
 */
public abstract class Task {

    // Lock object for lifecycle state
    private final Object stateLock = new Object();

    private TaskState state = TaskState.PENDING;
    private String error;

    protected volatile PipelineLogger logger = PipelineLogger.NONE;
    protected String filename = "";
    protected String name = "";
    private volatile int index;

    // Tasks whose results this task consumes
    private final List<Task> dependsOn = new ArrayList<>();

    protected Task() {
    }

    /**
     * Register a dependency. Only called from subclass constructors;
     * the dependency list is fixed once the task has been submitted.
     */
    protected void addDependency(Task task) {
        if (task == null) {
            throw new IllegalArgumentException("Dependency of " + name + " is null");
        }
        dependsOn.add(task);
    }

    /**
     * True when every dependency has completed, successfully or not.
     * Overrides may add conditions but must call this first.
     */
    public boolean readyToRun() {
        for (Task dependency : dependsOn) {
            if (!dependency.isCompleted()) {
                return false;
            }
        }
        return true;
    }

    /**
     * True while readiness may change without any other task completing,
     * e.g. while waiting for a file to appear. The Worker polls such tasks.
     */
    public boolean awaitsExternalEvent() {
        return false;
    }

    /**
     * Whether this task needs the shared OpenCL device. The Worker limits how many of these run at once.
     */
    public boolean usesOpenCl() {
        return false;
    }

    /**
     * Execute the task in the calling thread.
     *
     * @param logger logger for diagnostics, null for none
     * @throws IllegalStateException if the task has already been started or skipped
     * @throws Error rethrown from task() after the task has been marked failed
     */
    public void run(PipelineLogger logger) {
        synchronized (stateLock) {
            if (state != TaskState.PENDING) {
                throw new IllegalStateException("Task " + name + " already " + state);
            }
            state = TaskState.RUNNING;
        }

        this.logger = logger != null ? logger : PipelineLogger.NONE;

        String failure = null;
        try {
            task();
        } catch (Exception e) {
            failure = describe(e);
            this.logger.error("%s failed: %s", name, failure);
        } catch (Error e) {
            failure = describe(e);
            this.logger.error("%s aborted: %s", name, e);
            throw e;
        } finally {
            // Always reach a terminal state so nothing waiting on this task hangs
            finish(failure == null ? TaskState.SUCCEEDED : TaskState.FAILED, failure);
        }
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    /**
     * Mark a pending task as failed without running it.
     *
     * @return true if the task was pending and is now failed
     */
    public boolean skip(String reason) {
        synchronized (stateLock) {
            if (state != TaskState.PENDING) {
                return false;
            }
            state = TaskState.FAILED;
            error = reason;
            stateLock.notifyAll();
        }
        return true;
    }

    private void finish(TaskState terminal, String failure) {
        synchronized (stateLock) {
            state = terminal;
            error = failure;
            stateLock.notifyAll();
        }
    }

    /**
     * Block until the task has completed.
     */
    public void await() throws InterruptedException {
        synchronized (stateLock) {
            while (!state.isTerminal()) {
                stateLock.wait();
            }
        }
    }

    /**
     * Block until the task has completed or the timeout elapses.
     *
     * @return true if the task completed
     */
    public boolean await(long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        synchronized (stateLock) {
            while (!state.isTerminal()) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    return false;
                }
                stateLock.wait(remaining);
            }
            return true;
        }
    }

    /**
     * The work itself. Exceptions are reported through {@link #getError()}.
     */
    protected abstract void task() throws Exception;

    public TaskState getState() {
        synchronized (stateLock) {
            return state;
        }
    }

    public boolean isRunning() {
        return getState() == TaskState.RUNNING;
    }

    public boolean isCompleted() {
        return getState().isTerminal();
    }

    public boolean isFailed() {
        return getState() == TaskState.FAILED;
    }

    /**
     * Failure message, or null if the task has not failed.
     */
    public String getError() {
        synchronized (stateLock) {
            return error;
        }
    }

    public String getFilename() {
        return filename;
    }

    public String getName() {
        return name;
    }

    /**
     * File name without directories, for log messages.
     */
    public String basename() {
        if (filename == null || filename.isEmpty()) {
            return name;
        }
        return new File(filename).getName();
    }

    public int getIndex() {
        return index;
    }

    public void setIndex(int index) {
        this.index = index;
    }

    public List<Task> getDepends() {
        return Collections.unmodifiableList(dependsOn);
    }

    @Override
    public String toString() {
        return name;
    }
}
