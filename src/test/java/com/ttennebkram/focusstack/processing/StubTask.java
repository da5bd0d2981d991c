package com.ttennebkram.focusstack.processing;

import com.ttennebkram.focusstack.tasks.Task;

import java.util.List;

/**
 * Task with a pluggable body for scheduler tests.
 */
class StubTask extends Task {

    interface Body {
        void run() throws Exception;
    }

    private final Body body;
    private final boolean openCl;
    private volatile boolean executed = false;

    StubTask(String name, Body body, Task... depends) {
        this(name, false, body, depends);
    }

    StubTask(String name, boolean openCl, Body body, Task... depends) {
        this.name = name;
        this.openCl = openCl;
        this.body = body;
        for (Task dependency : depends) {
            addDependency(dependency);
        }
    }

    static StubTask recording(String name, List<String> order, Task... depends) {
        return new StubTask(name, () -> {
            synchronized (order) {
                order.add(name);
            }
        }, depends);
    }

    static StubTask failing(String name, String message, Task... depends) {
        return new StubTask(name, () -> {
            throw new IllegalStateException(message);
        }, depends);
    }

    @Override
    public boolean usesOpenCl() {
        return openCl;
    }

    @Override
    protected void task() throws Exception {
        executed = true;
        body.run();
    }

    boolean wasExecuted() {
        return executed;
    }
}
