package com.iimsoft.gantt.service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.iimsoft.gantt.domain.Allocation;
import com.iimsoft.gantt.domain.Dependency;
import com.iimsoft.gantt.domain.GlobalResource;
import com.iimsoft.gantt.domain.Schedule;
import com.iimsoft.gantt.domain.ScheduleHorizon;
import com.iimsoft.gantt.domain.Task;
import com.iimsoft.gantt.exception.SchemaInvalidException;
import com.iimsoft.gantt.graph.TaskGraph;

/**
 * Turns a validated task graph into the planning problem handed to the solver.
 * <p>
 * Each task gets an {@link Allocation} whose start is its earliest start plus a planning delay. A forward pass
 * with every delay at zero yields the lag-aware critical path used as a makespan lower bound. A second, serial
 * pass then assigns every delay so that the solver starts from a complete schedule that respects precedence
 * and capacity, and skips construction.
 */
public class ScheduleModelBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScheduleModelBuilder.class);

    public ScheduleModel build(TaskGraph taskGraph, int maxResourcesInParallel, int maxDuration) {
        if (maxResourcesInParallel <= 0) {
            throw new IllegalArgumentException("The maxResourcesInParallel (" + maxResourcesInParallel
                    + ") must be positive.");
        }
        List<Task> taskList = taskGraph.getOrderedTaskList();
        long longHorizon = computeHorizon(taskList);
        if (longHorizon > ScheduleHorizon.MAX_HORIZON) {
            throw new SchemaInvalidException("The durations and lags add up to a horizon (" + longHorizon
                    + ") above the supported maximum (" + ScheduleHorizon.MAX_HORIZON + ").");
        }
        int horizon = (int) longHorizon;

        Schedule schedule = new Schedule(0L);
        List<Dependency> dependencyList = new ArrayList<>();
        List<Allocation> allocationList = new ArrayList<>(taskList.size());
        schedule.setTaskList(taskList);
        schedule.setDependencyList(dependencyList);
        schedule.setResource(new GlobalResource(0L, maxResourcesInParallel));
        schedule.setHorizon(new ScheduleHorizon(horizon, Math.max(maxDuration, 0)));
        schedule.setAllocationList(allocationList);

        Map<String, Allocation> allocationByTaskId = new HashMap<>(taskList.size());
        long allocationId = 0L;
        for (Task task : taskList) {
            Allocation allocation = new Allocation(allocationId++, task);
            allocation.setPredecessorAllocationList(new ArrayList<>(task.getDependencyList().size()));
            allocation.setSuccessorAllocationList(new ArrayList<>());
            allocationList.add(allocation);
            allocationByTaskId.put(task.getId(), allocation);
        }

        // link allocation graph
        for (Allocation allocation : allocationList) {
            for (Dependency dependency : allocation.getTask().getDependencyList()) {
                Allocation target = allocationByTaskId.get(dependency.getTargetId());
                allocation.getPredecessorAllocationList().add(target);
                target.getSuccessorAllocationList().add(allocation);
                dependencyList.add(dependency);
            }
        }

        // Topological order guarantees the predecessors' earliest starts are already set
        int criticalPathEnd = 0;
        for (Allocation allocation : allocationList) {
            allocation.setEarliestStart(allocation.computeEarliestStart());
            criticalPathEnd = Math.max(criticalPathEnd, allocation.getEndDate());
        }
        // Never above the horizon unless some demand exceeds the capacity, which is infeasible anyway
        int makespanLowerBound = (int) Math.min(
                Math.max(criticalPathEnd, computeEnergyBound(taskList, maxResourcesInParallel)), Integer.MAX_VALUE);

        String infeasibilityReason = findInfeasibilityReason(taskList, maxResourcesInParallel, maxDuration,
                makespanLowerBound);
        if (infeasibilityReason == null) {
            seedSerialSchedule(allocationList, maxResourcesInParallel);
        }
        ScheduleModel model = new ScheduleModel(schedule, makespanLowerBound, infeasibilityReason);
        LOGGER.info("Built schedule model: {} tasks, {} dependencies, capacity ({}), horizon ({}),"
                        + " makespan lower bound ({}), maximum duration ({}).",
                allocationList.size(), dependencyList.size(), maxResourcesInParallel, horizon,
                makespanLowerBound, maxDuration > 0 ? maxDuration : "none");
        return model;
    }

    /**
     * Length of the fully serial schedule in which every task also waits out each positive lag.
     */
    static long computeHorizon(List<Task> taskList) {
        long horizon = 0L;
        for (Task task : taskList) {
            horizon = Math.addExact(horizon, task.getDuration());
            for (Dependency dependency : task.getDependencyList()) {
                horizon = Math.addExact(horizon, Math.max(0, dependency.getLag()));
            }
        }
        return horizon;
    }

    /**
     * No schedule finishes before the total work fits through the pool.
     */
    static long computeEnergyBound(List<Task> taskList, int capacity) {
        long energy = 0L;
        for (Task task : taskList) {
            energy = Math.addExact(energy, Math.multiplyExact((long) task.getDuration(), task.getResourceDemand()));
        }
        return (energy + capacity - 1) / capacity;
    }

    /**
     * Serial schedule generation: in topological order, every task starts at the first time from its earliest
     * start on at which its demand fits next to the tasks already placed. Each task starts no later than the
     * end of everything placed before it plus its largest positive lag, so every end stays within the horizon.
     */
    static void seedSerialSchedule(List<Allocation> allocationList, int capacity) {
        List<Allocation> placedList = new ArrayList<>(allocationList.size());
        for (Allocation allocation : allocationList) {
            int earliestStart = allocation.computeEarliestStart();
            allocation.setEarliestStart(earliestStart);
            int start = findFirstFit(placedList, earliestStart, allocation.getTask().getDuration(),
                    allocation.getResourceDemand(), capacity);
            allocation.setDelay(start - earliestStart);
            placedList.add(allocation);
        }
        LOGGER.debug("Seeded a serial schedule for {} tasks.", allocationList.size());
    }

    private static int findFirstFit(List<Allocation> placedList, int earliestStart, int duration, int demand,
            int capacity) {
        // The usage only drops at an end, so the first fit is the earliest start or some later end
        List<Integer> candidateList = new ArrayList<>();
        candidateList.add(earliestStart);
        for (Allocation placed : placedList) {
            if (placed.getEndDate() > earliestStart) {
                candidateList.add(placed.getEndDate());
            }
        }
        candidateList.sort(null);
        for (int candidate : candidateList) {
            if (fits(placedList, candidate, candidate + duration, demand, capacity)) {
                return candidate;
            }
        }
        throw new IllegalStateException("No start from (" + earliestStart + ") fits the demand (" + demand
                + ") within the capacity (" + capacity + ").");
    }

    /**
     * The usage inside {@code [start, end)} only rises at a start, so checking {@code start} and every placed
     * start inside the window covers the whole window.
     */
    private static boolean fits(List<Allocation> placedList, int start, int end, int demand, int capacity) {
        List<Integer> checkTimeList = new ArrayList<>();
        checkTimeList.add(start);
        for (Allocation placed : placedList) {
            if (placed.getStartDate() > start && placed.getStartDate() < end) {
                checkTimeList.add(placed.getStartDate());
            }
        }
        for (int time : checkTimeList) {
            long used = demand;
            for (Allocation placed : placedList) {
                if (placed.getStartDate() <= time && time < placed.getEndDate()) {
                    used += placed.getResourceDemand();
                }
            }
            if (used > capacity) {
                return false;
            }
        }
        return true;
    }

    private static String findInfeasibilityReason(List<Task> taskList, int capacity, int maxDuration,
            int makespanLowerBound) {
        for (Task task : taskList) {
            if (task.getResourceDemand() > capacity) {
                return "Task (" + task.getId() + ") needs " + task.getResourceDemand()
                        + " resources but only " + capacity + " are available in parallel.";
            }
        }
        if (maxDuration > 0 && makespanLowerBound > maxDuration) {
            return "No schedule can be shorter than " + makespanLowerBound
                    + ", which exceeds the maximum duration (" + maxDuration + ").";
        }
        return null;
    }

}
