package com.iimsoft.gantt.domain;

import java.util.Objects;

/**
 * Precedence relation of a task on a target task.
 * <p>
 * The dependent task may start {@code lag} time units after the target ends. A negative lag is a lead time:
 * the dependent task may start up to {@code |lag|} units before the target ends.
 */
public class Dependency {

    private final String taskId;
    private final String targetId;
    private final int lag;

    public Dependency(String taskId, String targetId, int lag) {
        this.taskId = Objects.requireNonNull(taskId, "taskId");
        this.targetId = Objects.requireNonNull(targetId, "targetId");
        this.lag = lag;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getTargetId() {
        return targetId;
    }

    public int getLag() {
        return lag;
    }

    @Override
    public String toString() {
        return taskId + " -> " + targetId + " (lag " + lag + ")";
    }

}
