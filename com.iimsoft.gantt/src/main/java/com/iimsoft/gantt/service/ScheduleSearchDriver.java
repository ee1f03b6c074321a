package com.iimsoft.gantt.service;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.optaplanner.core.api.score.buildin.hardsoftlong.HardSoftLongScore;
import org.optaplanner.core.api.solver.Solver;
import org.optaplanner.core.api.solver.SolverFactory;
import org.optaplanner.core.config.solver.SolverConfig;
import org.optaplanner.core.config.solver.termination.TerminationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.iimsoft.gantt.domain.Allocation;
import com.iimsoft.gantt.domain.Schedule;
import com.iimsoft.gantt.score.ScheduleConstraintProvider;

/**
 * Runs the solver on a {@link ScheduleModel} within a wall-clock budget.
 * <p>
 * Every new best solution the solver reports is forwarded to the callback once it is fully initialised and
 * feasible, and so is a feasible starting schedule the search never improved on. The callback may therefore be
 * called any number of times, including zero.
 */
public class ScheduleSearchDriver {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScheduleSearchDriver.class);

    public TerminalStatus solve(ScheduleModel model, long timeLimitSeconds, SolutionCallback onSolution) {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(onSolution, "onSolution");
        if (timeLimitSeconds <= 0L) {
            throw new IllegalArgumentException("The timeLimitSeconds (" + timeLimitSeconds + ") must be positive.");
        }
        if (model.getInfeasibilityReason().isPresent()) {
            LOGGER.info("Skipping search, the model is infeasible: {}", model.getInfeasibilityReason().get());
            return TerminalStatus.INFEASIBLE;
        }

        HardSoftLongScore lowerBoundScore = HardSoftLongScore.of(0L, -model.getMakespanLowerBound());
        SolverFactory<Schedule> solverFactory = SolverFactory.create(new SolverConfig()
                .withSolutionClass(Schedule.class)
                .withEntityClasses(Allocation.class)
                .withConstraintProviderClass(ScheduleConstraintProvider.class)
                .withTerminationConfig(new TerminationConfig()
                        .withSpentLimit(Duration.ofSeconds(timeLimitSeconds))
                        .withBestScoreLimit(lowerBoundScore.toString())));
        Solver<Schedule> solver = solverFactory.buildSolver();
        AtomicBoolean reported = new AtomicBoolean(false);
        solver.addEventListener(event -> {
            Schedule newBestSolution = event.getNewBestSolution();
            if (isFeasible(newBestSolution.getScore())) {
                LOGGER.debug("New feasible solution ({}).", newBestSolution.getScore());
                reported.set(true);
                onSolution.onSolution(newBestSolution);
            }
        });

        LOGGER.info("Solving {} tasks for at most {} seconds.", model.getTaskCount(), timeLimitSeconds);
        long startNanos = System.nanoTime();
        Schedule bestSolution = solver.solve(model.getSchedule());
        long spentMillis = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();

        // No event fires when the seeded starting schedule is never improved on
        if (!reported.get() && isFeasible(bestSolution.getScore())) {
            LOGGER.debug("Starting solution kept ({}).", bestSolution.getScore());
            onSolution.onSolution(bestSolution);
        }
        TerminalStatus status = toTerminalStatus(bestSolution.getScore(), lowerBoundScore);
        LOGGER.info("Solving ended: status ({}), best score ({}), time spent ({} ms).",
                status, bestSolution.getScore(), spentMillis);
        return status;
    }

    static TerminalStatus toTerminalStatus(HardSoftLongScore bestScore, HardSoftLongScore lowerBoundScore) {
        if (!isFeasible(bestScore)) {
            return TerminalStatus.UNKNOWN;
        }
        return bestScore.compareTo(lowerBoundScore) >= 0 ? TerminalStatus.OPTIMAL : TerminalStatus.FEASIBLE;
    }

    private static boolean isFeasible(HardSoftLongScore score) {
        return score != null && score.isSolutionInitialized() && score.isFeasible();
    }

}
