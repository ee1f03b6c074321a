package com.iimsoft.gantt.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.iimsoft.gantt.domain.Allocation;
import com.iimsoft.gantt.domain.ProjectSchedule;
import com.iimsoft.gantt.domain.Schedule;
import com.iimsoft.gantt.domain.ScheduleSolution;

/**
 * Keeps the best reported solutions, shortest total duration first.
 * <p>
 * Only the best {@code maxSolutions} are retained: whenever the store grows beyond that, the worst entry is
 * evicted. Among equal total durations the earlier reported solution ranks first. Solutions with equal
 * durations, even identical ones, are all kept.
 * <p>
 * Thread-safe: the solver may report solutions from any thread.
 */
public class SolutionCollector implements SolutionCallback {

    private static final Logger LOGGER = LoggerFactory.getLogger(SolutionCollector.class);

    private static final Comparator<RankedSolution> BEST_FIRST = Comparator
            .comparingInt((RankedSolution ranked) -> ranked.solution.getTotalDuration())
            .thenComparingLong(ranked -> ranked.sequence);

    private final int maxSolutions;
    // Worst on top, so eviction is a poll
    private final PriorityQueue<RankedSolution> retained;
    private long reportedCount = 0L;

    public SolutionCollector(int maxSolutions) {
        if (maxSolutions <= 0) {
            throw new IllegalArgumentException("The maxSolutions (" + maxSolutions + ") must be positive.");
        }
        this.maxSolutions = maxSolutions;
        this.retained = new PriorityQueue<>(maxSolutions + 1, BEST_FIRST.reversed());
    }

    @Override
    public void onSolution(Schedule assignment) {
        add(toScheduleSolution(assignment));
    }

    public synchronized void add(ScheduleSolution solution) {
        retained.add(new RankedSolution(solution, reportedCount++));
        if (retained.size() > maxSolutions) {
            retained.poll();
        }
        LOGGER.debug("Collected solution #{} with total duration ({}).", reportedCount, solution.getTotalDuration());
    }

    /**
     * @return at most {@code maxSolutions} solutions, sorted by ascending total duration
     */
    public synchronized List<ScheduleSolution> topSolutions() {
        List<RankedSolution> rankedList = new ArrayList<>(retained);
        rankedList.sort(BEST_FIRST);
        List<ScheduleSolution> solutionList = new ArrayList<>(rankedList.size());
        for (RankedSolution ranked : rankedList) {
            solutionList.add(ranked.solution);
        }
        return solutionList;
    }

    /**
     * Number of solutions reported so far, including evicted ones.
     */
    public synchronized long getReportedCount() {
        return reportedCount;
    }

    static ScheduleSolution toScheduleSolution(Schedule assignment) {
        List<ProjectSchedule> projectScheduleList = new ArrayList<>(assignment.getAllocationList().size());
        int totalDuration = 0;
        for (Allocation allocation : assignment.getAllocationList()) {
            int start = allocation.getStartDate();
            int end = allocation.getEndDate();
            projectScheduleList.add(new ProjectSchedule(allocation.getTaskId(), allocation.getTask().getName(),
                    allocation.getResourceDemand(), start, end));
            totalDuration = Math.max(totalDuration, end);
        }
        return new ScheduleSolution(totalDuration, projectScheduleList);
    }

    private static final class RankedSolution {

        private final ScheduleSolution solution;
        private final long sequence;

        private RankedSolution(ScheduleSolution solution, long sequence) {
            this.solution = solution;
            this.sequence = sequence;
        }

    }

}
