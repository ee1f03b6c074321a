package com.iimsoft.gantt.exception;

/**
 * The raw input does not have the required shape.
 */
public class SchemaInvalidException extends GanttSolverException {

    public SchemaInvalidException(String message) {
        super(message);
    }

    public SchemaInvalidException(String message, Throwable cause) {
        super(message, cause);
    }

}
