package com.iimsoft.gantt.domain.solver;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Queue;

import org.optaplanner.core.api.domain.variable.VariableListener;
import org.optaplanner.core.api.score.director.ScoreDirector;

import com.iimsoft.gantt.domain.Allocation;
import com.iimsoft.gantt.domain.Schedule;

/**
 * Moving an allocation shifts the earliest start of its successors, which shifts their successors in turn.
 * The propagation stops at successors whose earliest start did not change.
 */
public class EarliestStartUpdatingVariableListener implements VariableListener<Schedule, Allocation> {

    @Override
    public void beforeEntityAdded(ScoreDirector<Schedule> scoreDirector, Allocation allocation) {
        // Do nothing
    }

    @Override
    public void afterEntityAdded(ScoreDirector<Schedule> scoreDirector, Allocation allocation) {
        updateAllocation(scoreDirector, allocation);
    }

    @Override
    public void beforeVariableChanged(ScoreDirector<Schedule> scoreDirector, Allocation allocation) {
        // Do nothing
    }

    @Override
    public void afterVariableChanged(ScoreDirector<Schedule> scoreDirector, Allocation allocation) {
        updateAllocation(scoreDirector, allocation);
    }

    @Override
    public void beforeEntityRemoved(ScoreDirector<Schedule> scoreDirector, Allocation allocation) {
        // Do nothing
    }

    @Override
    public void afterEntityRemoved(ScoreDirector<Schedule> scoreDirector, Allocation allocation) {
        // Do nothing
    }

    protected void updateAllocation(ScoreDirector<Schedule> scoreDirector, Allocation originalAllocation) {
        Queue<Allocation> uncheckedSuccessorQueue = new ArrayDeque<>(originalAllocation.getSuccessorAllocationList());
        while (!uncheckedSuccessorQueue.isEmpty()) {
            Allocation allocation = uncheckedSuccessorQueue.remove();
            if (updateEarliestStart(scoreDirector, allocation)) {
                uncheckedSuccessorQueue.addAll(allocation.getSuccessorAllocationList());
            }
        }
    }

    /**
     * @return true if the earliest start changed
     */
    protected boolean updateEarliestStart(ScoreDirector<Schedule> scoreDirector, Allocation allocation) {
        int earliestStart = allocation.computeEarliestStart();
        if (Objects.equals(earliestStart, allocation.getEarliestStart())) {
            return false;
        }
        scoreDirector.beforeVariableChanged(allocation, "earliestStart");
        allocation.setEarliestStart(earliestStart);
        scoreDirector.afterVariableChanged(allocation, "earliestStart");
        return true;
    }

}
