package com.iimsoft.gantt.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.iimsoft.gantt.api.dto.ProjectRequest;
import com.iimsoft.gantt.chart.ChartRenderer;
import com.iimsoft.gantt.domain.Dependency;
import com.iimsoft.gantt.domain.ProjectSchedule;
import com.iimsoft.gantt.domain.ScheduleSolution;
import com.iimsoft.gantt.domain.Task;
import com.iimsoft.gantt.exception.NoFeasibleSolutionException;
import com.iimsoft.gantt.graph.DependencyGraphBuilder;
import com.iimsoft.gantt.graph.TaskGraph;
import com.iimsoft.gantt.persistence.ProjectRequestValidator;
import com.iimsoft.gantt.persistence.ScheduleSolutionFileIO;

/**
 * Runs the whole pipeline: validate, build the dependency graph, build the model, search, rank,
 * and write one schedule file and one chart per retained solution.
 * <p>
 * Input and graph errors abort before the solver is started. Ending the search without a feasible solution
 * raises {@link NoFeasibleSolutionException}.
 */
public class GanttSolveService {

    private static final Logger LOGGER = LoggerFactory.getLogger(GanttSolveService.class);

    private final DependencyGraphBuilder dependencyGraphBuilder;
    private final ScheduleModelBuilder scheduleModelBuilder;
    private final ScheduleSearchDriver scheduleSearchDriver;
    private final ScheduleSolutionFileIO scheduleSolutionFileIO;
    private final ChartRenderer chartRenderer;

    public GanttSolveService(ScheduleSolutionFileIO scheduleSolutionFileIO, ChartRenderer chartRenderer) {
        this(new DependencyGraphBuilder(), new ScheduleModelBuilder(), new ScheduleSearchDriver(),
                scheduleSolutionFileIO, chartRenderer);
    }

    public GanttSolveService(DependencyGraphBuilder dependencyGraphBuilder, ScheduleModelBuilder scheduleModelBuilder,
            ScheduleSearchDriver scheduleSearchDriver, ScheduleSolutionFileIO scheduleSolutionFileIO,
            ChartRenderer chartRenderer) {
        this.dependencyGraphBuilder = dependencyGraphBuilder;
        this.scheduleModelBuilder = scheduleModelBuilder;
        this.scheduleSearchDriver = scheduleSearchDriver;
        this.scheduleSolutionFileIO = scheduleSolutionFileIO;
        this.chartRenderer = chartRenderer;
    }

    public SolveReport solve(ProjectRequest request, SolveOptions options) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(options, "options");
        ProjectRequestValidator.validate(request);

        TaskGraph taskGraph = dependencyGraphBuilder.build(toTaskList(request));
        LOGGER.info("Dependency graph is acyclic: {} tasks.", taskGraph.size());
        ScheduleModel model = scheduleModelBuilder.build(taskGraph, request.maxResourcesInParallel,
                options.getMaxDuration());

        SolutionCollector collector = new SolutionCollector(options.getMaxSolutions());
        TerminalStatus status = scheduleSearchDriver.solve(model, options.getTimeLimitSeconds(), collector);
        List<ScheduleSolution> solutionList = collector.topSolutions();
        if (!status.hasSolution() || solutionList.isEmpty()) {
            throw new NoFeasibleSolutionException(status.hasSolution() ? TerminalStatus.UNKNOWN : status);
        }
        LOGGER.info("Collected {} solutions, keeping the best {}.", collector.getReportedCount(), solutionList.size());
        logSchedule(status, solutionList.get(0));

        List<Path> writtenFileList = writeSolutions(solutionList, new ScheduleOutputBuilder(model.getCapacity()),
                options);
        return new SolveReport(status, solutionList, writtenFileList);
    }

    static List<Task> toTaskList(ProjectRequest request) {
        List<Task> taskList = new ArrayList<>(request.projects.size());
        for (Map.Entry<String, ProjectRequest.ProjectDto> entry : request.projects.entrySet()) {
            String taskId = entry.getKey();
            ProjectRequest.ProjectDto project = entry.getValue();
            List<Dependency> dependencyList = new ArrayList<>(project.dependencies.size());
            for (ProjectRequest.DependencyDto dependency : project.dependencies) {
                dependencyList.add(new Dependency(taskId, dependency.projectId, dependency.lagTime));
            }
            taskList.add(new Task(taskId, project.name, project.duration, project.numResources, dependencyList));
        }
        return taskList;
    }

    private List<Path> writeSolutions(List<ScheduleSolution> solutionList, ScheduleOutputBuilder outputBuilder,
            SolveOptions options) {
        createParentDirectories(options.getOutputPrefix());
        List<Path> writtenFileList = new ArrayList<>(solutionList.size() * 2);
        for (int i = 0; i < solutionList.size(); i++) {
            RenderedSchedule rendered = outputBuilder.render(solutionList.get(i));
            Path scheduleFile = options.resolveScheduleFile(i);
            scheduleSolutionFileIO.write(rendered.getResponse(), scheduleFile);
            Path chartFile = options.resolveChartFile(i);
            chartRenderer.render(rendered.getChartBarList(), chartFile);
            writtenFileList.add(scheduleFile);
            writtenFileList.add(chartFile);
            LOGGER.info("Wrote solution #{} (total duration {}) to {} and {}.",
                    i, solutionList.get(i).getTotalDuration(), scheduleFile, chartFile);
        }
        return writtenFileList;
    }

    private static void createParentDirectories(Path outputPrefix) {
        Path parent = outputPrefix.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create output directory (" + parent + ").", e);
        }
    }

    private static void logSchedule(TerminalStatus status, ScheduleSolution best) {
        LOGGER.info("--- Final solution ({}) ---", status);
        LOGGER.info("{} Schedule Length: {}", status == TerminalStatus.OPTIMAL ? "Optimal" : "Best",
                best.getTotalDuration());
        for (ProjectSchedule projectSchedule : best.getProjectScheduleList()) {
            LOGGER.info("  {}: {} -> {}", projectSchedule.getName(), projectSchedule.getStart(),
                    projectSchedule.getEnd());
        }
    }

}
