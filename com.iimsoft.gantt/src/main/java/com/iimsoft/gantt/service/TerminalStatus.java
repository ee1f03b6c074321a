package com.iimsoft.gantt.service;

public enum TerminalStatus {
    /** A feasible schedule reached the makespan lower bound. */
    OPTIMAL,
    /** The time limit was hit with at least one feasible schedule found. */
    FEASIBLE,
    /** No feasible schedule exists. */
    INFEASIBLE,
    /** The time limit was hit before any feasible schedule was found. */
    UNKNOWN;

    public boolean hasSolution() {
        return this == OPTIMAL || this == FEASIBLE;
    }
}
