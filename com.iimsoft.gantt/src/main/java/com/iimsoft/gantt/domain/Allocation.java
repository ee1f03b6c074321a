package com.iimsoft.gantt.domain;

import java.util.List;

import org.optaplanner.core.api.domain.entity.PlanningEntity;
import org.optaplanner.core.api.domain.variable.PlanningVariable;
import org.optaplanner.core.api.domain.variable.ShadowVariable;

import com.iimsoft.gantt.domain.solver.EarliestStartUpdatingVariableListener;

@PlanningEntity
public class Allocation extends AbstractPersistable {

    private Task task;

    // Aligned with task.getDependencyList(): element i is the allocation of dependency i's target.
    private List<Allocation> predecessorAllocationList;
    private List<Allocation> successorAllocationList;

    // Planning variables: changes during planning, between score calculations.
    private Integer delay;

    // Shadow variables
    private Integer earliestStart;

    public Allocation() {
    }

    public Allocation(long id, Task task) {
        super(id);
        this.task = task;
    }

    public Task getTask() {
        return task;
    }

    public void setTask(Task task) {
        this.task = task;
    }

    public List<Allocation> getPredecessorAllocationList() {
        return predecessorAllocationList;
    }

    public void setPredecessorAllocationList(List<Allocation> predecessorAllocationList) {
        this.predecessorAllocationList = predecessorAllocationList;
    }

    public List<Allocation> getSuccessorAllocationList() {
        return successorAllocationList;
    }

    public void setSuccessorAllocationList(List<Allocation> successorAllocationList) {
        this.successorAllocationList = successorAllocationList;
    }

    @PlanningVariable(valueRangeProviderRefs = "delayRange")
    public Integer getDelay() {
        return delay;
    }

    public void setDelay(Integer delay) {
        this.delay = delay;
    }

    @ShadowVariable(variableListenerClass = EarliestStartUpdatingVariableListener.class, sourceVariableName = "delay")
    public Integer getEarliestStart() {
        return earliestStart;
    }

    public void setEarliestStart(Integer earliestStart) {
        this.earliestStart = earliestStart;
    }

    // ************************************************************************
    // Complex methods
    // ************************************************************************

    public String getTaskId() {
        return task.getId();
    }

    public int getResourceDemand() {
        return task.getResourceDemand();
    }

    public Integer getStartDate() {
        if (earliestStart == null) {
            return null;
        }
        return earliestStart + (delay == null ? 0 : delay);
    }

    public Integer getEndDate() {
        Integer startDate = getStartDate();
        if (startDate == null) {
            return null;
        }
        return startDate + task.getDuration();
    }

    /**
     * Earliest start allowed by the predecessors' current end dates, never below {@code 0}.
     * Capped at {@link ScheduleHorizon#MAX_HORIZON}: a start that late already breaks the horizon.
     */
    public int computeEarliestStart() {
        long earliest = 0L;
        List<Dependency> dependencyList = task.getDependencyList();
        for (int i = 0; i < dependencyList.size(); i++) {
            Integer predecessorEnd = predecessorAllocationList.get(i).getEndDate();
            if (predecessorEnd != null) {
                earliest = Math.max(earliest, (long) predecessorEnd + dependencyList.get(i).getLag());
            }
        }
        return (int) Math.min(earliest, ScheduleHorizon.MAX_HORIZON);
    }

}
