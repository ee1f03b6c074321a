package com.iimsoft.gantt.domain;

import java.util.List;

import org.optaplanner.core.api.domain.solution.PlanningEntityCollectionProperty;
import org.optaplanner.core.api.domain.solution.PlanningScore;
import org.optaplanner.core.api.domain.solution.PlanningSolution;
import org.optaplanner.core.api.domain.solution.ProblemFactCollectionProperty;
import org.optaplanner.core.api.domain.solution.ProblemFactProperty;
import org.optaplanner.core.api.domain.valuerange.CountableValueRange;
import org.optaplanner.core.api.domain.valuerange.ValueRangeFactory;
import org.optaplanner.core.api.domain.valuerange.ValueRangeProvider;
import org.optaplanner.core.api.score.buildin.hardsoftlong.HardSoftLongScore;

/**
 * Planning problem and, once solved, one assignment of start times to every task.
 */
@PlanningSolution
public class Schedule extends AbstractPersistable {

    private List<Task> taskList;
    private List<Dependency> dependencyList;
    private GlobalResource resource;
    private ScheduleHorizon horizon;

    private List<Allocation> allocationList;

    private HardSoftLongScore score;

    public Schedule() {
    }

    public Schedule(long id) {
        super(id);
    }

    @ProblemFactCollectionProperty
    public List<Task> getTaskList() {
        return taskList;
    }

    public void setTaskList(List<Task> taskList) {
        this.taskList = taskList;
    }

    @ProblemFactCollectionProperty
    public List<Dependency> getDependencyList() {
        return dependencyList;
    }

    public void setDependencyList(List<Dependency> dependencyList) {
        this.dependencyList = dependencyList;
    }

    @ProblemFactProperty
    public GlobalResource getResource() {
        return resource;
    }

    public void setResource(GlobalResource resource) {
        this.resource = resource;
    }

    @ProblemFactProperty
    public ScheduleHorizon getHorizon() {
        return horizon;
    }

    public void setHorizon(ScheduleHorizon horizon) {
        this.horizon = horizon;
    }

    @PlanningEntityCollectionProperty
    public List<Allocation> getAllocationList() {
        return allocationList;
    }

    public void setAllocationList(List<Allocation> allocationList) {
        this.allocationList = allocationList;
    }

    @PlanningScore
    public HardSoftLongScore getScore() {
        return score;
    }

    public void setScore(HardSoftLongScore score) {
        this.score = score;
    }

    // ************************************************************************
    // Ranges
    // ************************************************************************

    @ValueRangeProvider(id = "delayRange")
    public CountableValueRange<Integer> getDelayRange() {
        // Upper bound is exclusive
        return ValueRangeFactory.createIntValueRange(0, horizon.getHorizon() + 1);
    }

}
