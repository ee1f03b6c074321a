package com.iimsoft.gantt.service;

import java.util.Optional;

import com.iimsoft.gantt.domain.Schedule;

/**
 * Solver-ready planning problem plus the bounds derived while building it.
 */
public final class ScheduleModel {

    private final Schedule schedule;
    private final int makespanLowerBound;
    private final String infeasibilityReason;

    ScheduleModel(Schedule schedule, int makespanLowerBound, String infeasibilityReason) {
        this.schedule = schedule;
        this.makespanLowerBound = makespanLowerBound;
        this.infeasibilityReason = infeasibilityReason;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public int getHorizon() {
        return schedule.getHorizon().getHorizon();
    }

    public int getMaxDuration() {
        return schedule.getHorizon().getMaxDuration();
    }

    public int getCapacity() {
        return schedule.getResource().getCapacity();
    }

    /**
     * No schedule can be shorter than this, so a feasible schedule of exactly this length is optimal.
     */
    public int getMakespanLowerBound() {
        return makespanLowerBound;
    }

    /**
     * Present when the model can be shown to have no feasible schedule without searching.
     */
    public Optional<String> getInfeasibilityReason() {
        return Optional.ofNullable(infeasibilityReason);
    }

    public int getTaskCount() {
        return schedule.getAllocationList().size();
    }

}
