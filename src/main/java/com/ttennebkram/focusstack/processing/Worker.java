package com.ttennebkram.focusstack.processing;

import com.ttennebkram.focusstack.model.FailurePolicy;
import com.ttennebkram.focusstack.model.WorkerStatus;
import com.ttennebkram.focusstack.tasks.Task;
import com.ttennebkram.focusstack.util.PipelineLogger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Work queue that distributes tasks to a fixed pool of threads.
 *
 * Architecture:
 * - Tasks wait in a deque until {@link Task#readyToRun()} holds
 * - Each thread picks the first ready task in queue order and runs it outside the lock
 * - At most {@code openClLimit} tasks that use OpenCL run at the same time
 * - One shared monitor; every enqueue and completion wakes all waiting threads
 * - The first failure message is kept, later ones are only logged
 */
public class Worker implements AutoCloseable {

    public static final int DEFAULT_OPENCL_LIMIT = 1;

    /** Poll interval while some queued task waits for something outside the pipeline (a file). */
    static final long EXTERNAL_POLL_MS = 100;

    private final PipelineLogger logger;
    private final int openClLimit;
    private final FailurePolicy failurePolicy;
    private final List<Thread> threads = new ArrayList<>();

    // Everything below is guarded by lock
    private final Object lock = new Object();
    private final Deque<Task> tasks = new ArrayDeque<>();
    private final Set<Task> running = new HashSet<>();
    private boolean closed = false;
    private int totalTasks = 0;
    private int completedTasks = 0;
    private int openClUsers = 0;
    private boolean failed = false;
    private String error = null;

    private final long startTime = System.nanoTime();

    public Worker(int maxThreads, PipelineLogger logger) {
        this(maxThreads, logger, DEFAULT_OPENCL_LIMIT, FailurePolicy.SKIP_DEPENDENTS);
    }

    public Worker(int maxThreads, PipelineLogger logger, int openClLimit, FailurePolicy failurePolicy) {
        if (maxThreads < 1) {
            throw new IllegalArgumentException("Worker needs at least one thread, got " + maxThreads);
        }
        if (openClLimit < 1) {
            throw new IllegalArgumentException("OpenCL limit must be at least 1, got " + openClLimit);
        }
        this.logger = logger != null ? logger : PipelineLogger.NONE;
        this.openClLimit = openClLimit;
        this.failurePolicy = failurePolicy != null ? failurePolicy : FailurePolicy.SKIP_DEPENDENTS;

        for (int i = 0; i < maxThreads; i++) {
            final int threadIdx = i;
            Thread thread = new Thread(() -> workerLoop(threadIdx), "Worker-" + i);
            threads.add(thread);
        }
        for (Thread thread : threads) {
            thread.start();
        }
    }

    /**
     * Add task to the end of the queue.
     */
    public void add(Task task) {
        synchronized (lock) {
            checkOpen();
            tasks.addLast(task);
            totalTasks++;
            lock.notifyAll();
        }
    }

    /**
     * Add task to the front of the queue, so that it runs as soon as it is ready.
     */
    public void prepend(Task task) {
        synchronized (lock) {
            checkOpen();
            tasks.addFirst(task);
            totalTasks++;
            lock.notifyAll();
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Worker is closed");
        }
    }

    /**
     * Wait until the queue is empty and no task is running.
     *
     * @param timeoutMs maximum time to wait, negative to wait forever
     * @return true if all tasks finished, false on timeout or interrupt
     */
    public boolean waitAll(long timeoutMs) {
        long deadline = System.currentTimeMillis() + timeoutMs;
        synchronized (lock) {
            while (!tasks.isEmpty() || !running.isEmpty()) {
                try {
                    if (timeoutMs < 0) {
                        lock.wait();
                    } else {
                        long remaining = deadline - System.currentTimeMillis();
                        if (remaining <= 0) {
                            return false;
                        }
                        lock.wait(remaining);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return true;
        }
    }

    public boolean failed() {
        synchronized (lock) {
            return failed;
        }
    }

    /**
     * Message of the first failure, or null.
     */
    public String error() {
        synchronized (lock) {
            return error;
        }
    }

    /**
     * Snapshot of progress. The reported task name is the running task with the highest index.
     */
    public WorkerStatus getStatus() {
        synchronized (lock) {
            Task furthest = null;
            for (Task task : running) {
                if (furthest == null || task.getIndex() > furthest.getIndex()) {
                    furthest = task;
                }
            }
            return new WorkerStatus(totalTasks, completedTasks, furthest != null ? furthest.getName() : "");
        }
    }

    public int getOpenClLimit() {
        return openClLimit;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    /**
     * Skip every task that has not started yet. Running tasks are not interrupted.
     *
     * @return number of tasks skipped
     */
    public int discardPending(String reason) {
        synchronized (lock) {
            int count = 0;
            for (Task task : tasks) {
                if (task.skip(reason + ": " + task.getName())) {
                    count++;
                }
                completedTasks++;
            }
            tasks.clear();
            lock.notifyAll();
            return count;
        }
    }

    /**
     * Close the queue and join the threads. Queued tasks still run; tasks that can
     * never become ready are skipped, which wakes anything blocked in {@link Task#await()}.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            lock.notifyAll();
        }

        for (Thread thread : threads) {
            try {
                thread.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        discardPending("Worker closed before task ran");
    }

    private float secondsPassed() {
        return (System.nanoTime() - startTime) / 1e9f;
    }

    /**
     * Main loop of each pool thread.
     */
    private void workerLoop(int threadIdx) {
        while (true) {
            Task task;
            synchronized (lock) {
                while (true) {
                    skipAfterFailures();
                    task = takeRunnable();
                    if (task != null) {
                        break;
                    }

                    boolean polling = anyAwaitsExternalEvent();
                    // Closed: exit once the queue is drained, or when nothing left in it can ever become ready
                    if (closed && (tasks.isEmpty() || (running.isEmpty() && !polling))) {
                        return;
                    }

                    try {
                        if (polling) {
                            lock.wait(EXTERNAL_POLL_MS);
                        } else {
                            lock.wait();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                }

                running.add(task);
                if (task.usesOpenCl()) {
                    openClUsers++;
                }
            }

            logger.verbose("[%6.3f] Thread %d starting %s", secondsPassed(), threadIdx, task.getName());

            String precondition = null;
            try {
                task.run(logger);
            } catch (IllegalStateException e) {
                // Task was already started elsewhere
                precondition = e.getMessage();
                logger.error("%s", precondition);
            } catch (Error e) {
                // The task is already marked failed; keep this thread serving the queue
                logger.error("Thread %d: %s aborted with %s", threadIdx, task.getName(), e);
            } finally {
                logger.verbose("[%6.3f] Thread %d finished %s", secondsPassed(), threadIdx, task.getName());

                synchronized (lock) {
                    running.remove(task);
                    if (task.usesOpenCl()) {
                        openClUsers--;
                    }
                    completedTasks++;

                    if (precondition != null) {
                        recordFailure(precondition);
                    } else if (task.isFailed()) {
                        recordFailure(task.getError());
                    }

                    // Completion may have made dependents ready or freed an OpenCL slot
                    lock.notifyAll();
                }
            }
        }
    }

    /**
     * Find and dequeue the first task that can run now. Must hold lock.
     */
    private Task takeRunnable() {
        // A task can fail before its thread gets back to the lock to record it
        if (failurePolicy == FailurePolicy.STOP_ALL && (failed || anyRunningFailed())) {
            return null;
        }

        Iterator<Task> it = tasks.iterator();
        while (it.hasNext()) {
            Task task = it.next();
            if (task.usesOpenCl() && openClUsers >= openClLimit) {
                continue;
            }
            if (failurePolicy == FailurePolicy.SKIP_DEPENDENTS && hasFailedDependency(task)) {
                // Left for skipAfterFailures once the failure is recorded
                continue;
            }
            if (task.readyToRun()) {
                it.remove();
                return task;
            }
        }
        return null;
    }

    /**
     * Apply the failure policy to queued tasks. Must hold lock.
     */
    private void skipAfterFailures() {
        if (failurePolicy == FailurePolicy.RUN_DEPENDENTS) {
            return;
        }

        boolean skippedAny = false;
        // Repeat until stable: a skipped task may be the dependency of a task earlier in the queue
        while (skipPass()) {
            skippedAny = true;
        }

        if (skippedAny) {
            lock.notifyAll();
        }
    }

    private boolean skipPass() {
        boolean skippedAny = false;
        Iterator<Task> it = tasks.iterator();
        while (it.hasNext()) {
            Task task = it.next();
            String reason = null;

            if (failurePolicy == FailurePolicy.STOP_ALL && failed) {
                reason = "Skipped " + task.getName() + " after earlier failure";
            } else {
                for (Task dependency : task.getDepends()) {
                    // A failed dependency still in running has not had its own error recorded yet
                    if (dependency.isFailed() && !running.contains(dependency)) {
                        reason = "Skipped " + task.getName() + ": dependency " + dependency.getName() + " failed";
                        break;
                    }
                }
            }

            if (reason != null) {
                it.remove();
                if (task.skip(reason)) {
                    logger.verbose("%s", reason);
                    recordFailure(reason);
                }
                completedTasks++;
                skippedAny = true;
            }
        }
        return skippedAny;
    }

    private boolean anyRunningFailed() {
        for (Task task : running) {
            if (task.isFailed()) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasFailedDependency(Task task) {
        for (Task dependency : task.getDepends()) {
            if (dependency.isFailed()) {
                return true;
            }
        }
        return false;
    }

    private boolean anyAwaitsExternalEvent() {
        for (Task task : tasks) {
            if (task.awaitsExternalEvent()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Keep the first error only. Must hold lock.
     */
    private void recordFailure(String message) {
        if (!failed) {
            failed = true;
            error = message;
        }
    }
}
