package com.iimsoft.gantt.service;

import com.iimsoft.gantt.domain.Schedule;

/**
 * Receives every feasible assignment as soon as the search finds it, on the solving thread.
 */
@FunctionalInterface
public interface SolutionCallback {

    void onSolution(Schedule assignment);

}
