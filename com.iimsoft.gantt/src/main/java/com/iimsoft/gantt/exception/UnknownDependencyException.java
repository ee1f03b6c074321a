package com.iimsoft.gantt.exception;

public class UnknownDependencyException extends GanttSolverException {

    private final String taskId;
    private final String targetId;

    public UnknownDependencyException(String taskId, String targetId) {
        super("Task (" + taskId + ") depends on unknown task (" + targetId + ").");
        this.taskId = taskId;
        this.targetId = targetId;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getTargetId() {
        return targetId;
    }

}
