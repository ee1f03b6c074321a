package com.iimsoft.gantt.exception;

import com.iimsoft.gantt.service.TerminalStatus;

/**
 * Solving ended without any feasible schedule, either proven ({@link TerminalStatus#INFEASIBLE})
 * or because the time limit ran out first ({@link TerminalStatus#UNKNOWN}).
 */
public class NoFeasibleSolutionException extends GanttSolverException {

    private final TerminalStatus status;

    public NoFeasibleSolutionException(TerminalStatus status) {
        super(status == TerminalStatus.INFEASIBLE
                ? "No feasible solution exists."
                : "No feasible solution found within the time limit.");
        this.status = status;
    }

    public TerminalStatus getStatus() {
        return status;
    }

}
