package com.iimsoft.gantt.exception;

public class CycleDetectedException extends GanttSolverException {

    private final String taskId;
    private final String targetId;

    public CycleDetectedException(String taskId, String targetId, Throwable cause) {
        super("The dependency of task (" + taskId + ") on task (" + targetId + ") closes a cycle.", cause);
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
