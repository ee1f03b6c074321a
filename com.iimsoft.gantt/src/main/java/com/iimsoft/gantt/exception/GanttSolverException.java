package com.iimsoft.gantt.exception;

public class GanttSolverException extends RuntimeException {

    public GanttSolverException(String message) {
        super(message);
    }

    public GanttSolverException(String message, Throwable cause) {
        super(message, cause);
    }

}
