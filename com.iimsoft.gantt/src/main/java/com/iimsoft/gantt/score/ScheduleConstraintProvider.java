package com.iimsoft.gantt.score;

import org.optaplanner.core.api.score.buildin.hardsoftlong.HardSoftLongScore;
import org.optaplanner.core.api.score.stream.Constraint;
import org.optaplanner.core.api.score.stream.ConstraintCollectors;
import org.optaplanner.core.api.score.stream.ConstraintFactory;
import org.optaplanner.core.api.score.stream.ConstraintProvider;
import org.optaplanner.core.api.score.stream.Joiners;

import com.iimsoft.gantt.domain.Allocation;
import com.iimsoft.gantt.domain.Dependency;
import com.iimsoft.gantt.domain.GlobalResource;
import com.iimsoft.gantt.domain.ScheduleHorizon;

/**
 * Constraint streams of the resource-constrained project scheduling model.
 * <p>
 * Hard:
 * <ul>
 * <li>precedence: {@code start(task) >= end(target) + lag} for every dependency,</li>
 * <li>resource capacity: the summed demand of the tasks active at any point in time stays within the pool,</li>
 * <li>horizon: no task ends after the horizon,</li>
 * <li>maximum duration: the makespan stays within the configured cap, if any.</li>
 * </ul>
 * Soft: the makespan, the latest end over all tasks.
 */
public class ScheduleConstraintProvider implements ConstraintProvider {

    @Override
    public Constraint[] defineConstraints(ConstraintFactory constraintFactory) {
        return new Constraint[] {
                precedence(constraintFactory),
                resourceCapacity(constraintFactory),
                horizon(constraintFactory),
                maximumDuration(constraintFactory),
                makespan(constraintFactory)
        };
    }

    // ************************************************************************
    // Hard constraints
    // ************************************************************************

    protected Constraint precedence(ConstraintFactory constraintFactory) {
        return constraintFactory.forEach(Dependency.class)
                .join(Allocation.class,
                        Joiners.equal(Dependency::getTaskId, Allocation::getTaskId))
                .join(Allocation.class,
                        Joiners.equal((dependency, allocation) -> dependency.getTargetId(), Allocation::getTaskId))
                .filter((dependency, allocation, target) ->
                        allocation.getStartDate() < (long) target.getEndDate() + dependency.getLag())
                .penalizeLong(HardSoftLongScore.ONE_HARD,
                        (dependency, allocation, target) ->
                                (long) target.getEndDate() + dependency.getLag() - allocation.getStartDate())
                .asConstraint("Precedence");
    }

    /**
     * Usage only rises when a task starts, so checking every distinct start date covers every point in time.
     */
    protected Constraint resourceCapacity(ConstraintFactory constraintFactory) {
        return constraintFactory.forEach(Allocation.class)
                .groupBy(Allocation::getStartDate)
                .join(Allocation.class,
                        Joiners.greaterThanOrEqual((Integer time) -> time, Allocation::getStartDate),
                        Joiners.lessThan((Integer time) -> time, Allocation::getEndDate))
                .groupBy((time, allocation) -> time,
                        ConstraintCollectors.sumLong((time, allocation) -> (long) allocation.getResourceDemand()))
                .join(GlobalResource.class)
                .filter((time, used, resource) -> used > resource.getCapacity())
                .penalizeLong(HardSoftLongScore.ONE_HARD,
                        (time, used, resource) -> used - resource.getCapacity())
                .asConstraint("Resource capacity");
    }

    protected Constraint horizon(ConstraintFactory constraintFactory) {
        return constraintFactory.forEach(Allocation.class)
                .join(ScheduleHorizon.class)
                .filter((allocation, horizon) -> allocation.getEndDate() > horizon.getHorizon())
                .penalizeLong(HardSoftLongScore.ONE_HARD,
                        (allocation, horizon) -> (long) allocation.getEndDate() - horizon.getHorizon())
                .asConstraint("Horizon");
    }

    protected Constraint maximumDuration(ConstraintFactory constraintFactory) {
        return constraintFactory.forEach(Allocation.class)
                .groupBy(ConstraintCollectors.max(Allocation::getEndDate))
                .join(ScheduleHorizon.class)
                .filter((makespan, horizon) -> horizon.hasMaxDuration() && makespan > horizon.getMaxDuration())
                .penalizeLong(HardSoftLongScore.ONE_HARD,
                        (makespan, horizon) -> (long) makespan - horizon.getMaxDuration())
                .asConstraint("Maximum duration");
    }

    // ************************************************************************
    // Soft constraints
    // ************************************************************************

    protected Constraint makespan(ConstraintFactory constraintFactory) {
        return constraintFactory.forEach(Allocation.class)
                .groupBy(ConstraintCollectors.max(Allocation::getEndDate))
                .penalizeLong(HardSoftLongScore.ONE_SOFT, makespan -> (long) makespan)
                .asConstraint("Makespan");
    }

}
