package com.iimsoft.gantt.app;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.iimsoft.gantt.api.dto.ProjectRequest;
import com.iimsoft.gantt.chart.GanttChartRenderer;
import com.iimsoft.gantt.exception.CycleDetectedException;
import com.iimsoft.gantt.exception.NoFeasibleSolutionException;
import com.iimsoft.gantt.exception.SchemaInvalidException;
import com.iimsoft.gantt.exception.UnknownDependencyException;
import com.iimsoft.gantt.persistence.ProjectRequestFileIO;
import com.iimsoft.gantt.persistence.ScheduleSolutionFileIO;
import com.iimsoft.gantt.service.GanttSolveService;
import com.iimsoft.gantt.service.SolveOptions;
import com.iimsoft.gantt.service.SolveReport;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: gantt-solver -i projects.json
 * <p>
 * Writes {@code <prefix>-<index>.json} and {@code <prefix>-<index>.png} for every retained solution,
 * best first.
 */
@Command(name = "gantt-solver", mixinStandardHelpOptions = true, version = "gantt-solver 1.0.0",
        description = "Schedules projects under precedence and shared resource constraints, minimizing total duration.")
public class GanttSolverCommand implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_NO_FEASIBLE_SOLUTION = 1;
    public static final int EXIT_INVALID_INPUT = 2;
    public static final int EXIT_IO_FAILURE = 3;

    private static final Logger LOGGER = LoggerFactory.getLogger(GanttSolverCommand.class);

    @Option(names = {"-i", "--input"}, required = true, description = "Project input JSON file")
    Path inputFile;

    @Option(names = {"-o", "--output-prefix"}, defaultValue = SolveOptions.DEFAULT_OUTPUT_PREFIX,
            description = "Prefix of the written schedule and chart files (default: ${DEFAULT-VALUE})")
    Path outputPrefix;

    @Option(names = {"-t", "--time-limit"}, defaultValue = "" + SolveOptions.DEFAULT_TIME_LIMIT_SECONDS,
            description = "Solver time limit in seconds (default: ${DEFAULT-VALUE})")
    long timeLimitSeconds;

    @Option(names = {"-n", "--max-solutions"}, defaultValue = "" + SolveOptions.DEFAULT_MAX_SOLUTIONS,
            description = "Maximum number of solutions to write (default: ${DEFAULT-VALUE})")
    int maxSolutions;

    @Option(names = {"-d", "--max-duration"}, defaultValue = "0",
            description = "Maximum total duration, 0 for no cap (default: ${DEFAULT-VALUE})")
    int maxDuration;

    @Option(names = "--time-unit", defaultValue = "Weeks",
            description = "Time unit shown on the chart axis (default: ${DEFAULT-VALUE})")
    String timeUnit;

    private final Function<String, GanttSolveService> serviceFactory;

    public GanttSolverCommand() {
        this(timeUnit -> new GanttSolveService(new ScheduleSolutionFileIO(), new GanttChartRenderer(timeUnit)));
    }

    GanttSolverCommand(Function<String, GanttSolveService> serviceFactory) {
        this.serviceFactory = serviceFactory;
    }

    @Override
    public Integer call() {
        SolveOptions options;
        try {
            options = new SolveOptions(outputPrefix, timeLimitSeconds, maxSolutions, maxDuration);
        } catch (IllegalArgumentException e) {
            LOGGER.error("Invalid option: {}", e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        try {
            ProjectRequest request = new ProjectRequestFileIO().read(inputFile);
            SolveReport report = serviceFactory.apply(timeUnit).solve(request, options);
            LOGGER.info("Done: {} with {} solutions written.", report.getStatus(), report.getSolutionList().size());
            return EXIT_OK;
        } catch (SchemaInvalidException | UnknownDependencyException | CycleDetectedException e) {
            LOGGER.error("Invalid input ({}): {}", inputFile, e.getMessage());
            return EXIT_INVALID_INPUT;
        } catch (NoFeasibleSolutionException e) {
            LOGGER.error("No feasible solution ({}): {}", e.getStatus(), e.getMessage());
            return EXIT_NO_FEASIBLE_SOLUTION;
        } catch (UncheckedIOException e) {
            LOGGER.error("I/O failure: {}", e.getMessage(), e);
            return EXIT_IO_FAILURE;
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GanttSolverCommand()).execute(args);
        System.exit(exitCode);
    }

}
