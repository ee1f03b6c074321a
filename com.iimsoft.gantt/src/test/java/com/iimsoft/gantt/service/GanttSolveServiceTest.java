package com.iimsoft.gantt.service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.iimsoft.gantt.api.dto.ProjectRequest;
import com.iimsoft.gantt.api.dto.ScheduleSolutionResponse;
import com.iimsoft.gantt.chart.ChartRenderer;
import com.iimsoft.gantt.domain.ProjectSchedule;
import com.iimsoft.gantt.domain.ScheduleSolution;
import com.iimsoft.gantt.domain.Task;
import com.iimsoft.gantt.exception.CycleDetectedException;
import com.iimsoft.gantt.exception.NoFeasibleSolutionException;
import com.iimsoft.gantt.exception.SchemaInvalidException;
import com.iimsoft.gantt.exception.UnknownDependencyException;
import com.iimsoft.gantt.graph.DependencyGraphBuilder;
import com.iimsoft.gantt.persistence.ScheduleSolutionFileIO;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class GanttSolveServiceTest {

    @TempDir
    Path tempDir;

    private ScheduleSolutionFileIO scheduleSolutionFileIO;
    private ChartRenderer chartRenderer;
    private ScheduleSearchDriver scheduleSearchDriver;

    @BeforeEach
    void setUp() {
        scheduleSolutionFileIO = mock(ScheduleSolutionFileIO.class);
        chartRenderer = mock(ChartRenderer.class);
        scheduleSearchDriver = mock(ScheduleSearchDriver.class);
    }

    private GanttSolveService serviceWithMockedDriver() {
        return new GanttSolveService(new DependencyGraphBuilder(), new ScheduleModelBuilder(), scheduleSearchDriver,
                scheduleSolutionFileIO, chartRenderer);
    }

    private static ProjectRequest.ProjectDto project(String name, int numResources, int duration,
            String... dependsOn) {
        ProjectRequest.ProjectDto project = new ProjectRequest.ProjectDto();
        project.name = name;
        project.numResources = numResources;
        project.duration = duration;
        project.dependencies = new ArrayList<>();
        for (String targetId : dependsOn) {
            ProjectRequest.DependencyDto dependency = new ProjectRequest.DependencyDto();
            dependency.projectId = targetId;
            dependency.lagTime = 0;
            project.dependencies.add(dependency);
        }
        return project;
    }

    private static ProjectRequest request(int capacity) {
        ProjectRequest request = new ProjectRequest();
        request.maxResourcesInParallel = capacity;
        request.projects = new LinkedHashMap<>();
        return request;
    }

    @Test
    @DisplayName("Scenario D: a two-task cycle is rejected before any search")
    void cycleIsRejectedBeforeSearch() {
        ProjectRequest request = request(1);
        request.projects.put("X", project("X", 1, 1, "Y"));
        request.projects.put("Y", project("Y", 1, 1, "X"));

        ScheduleModelBuilder scheduleModelBuilder = mock(ScheduleModelBuilder.class);
        GanttSolveService service = new GanttSolveService(new DependencyGraphBuilder(), scheduleModelBuilder,
                scheduleSearchDriver, scheduleSolutionFileIO, chartRenderer);

        assertThrows(CycleDetectedException.class,
                () -> service.solve(request, new SolveOptions(tempDir.resolve("plan"), 5L, 1, 0)));
        verifyNoInteractions(scheduleModelBuilder, scheduleSearchDriver, scheduleSolutionFileIO, chartRenderer);
    }

    @Test
    @DisplayName("An unknown dependency is rejected before any search")
    void unknownDependencyIsRejected() {
        ProjectRequest request = request(1);
        request.projects.put("A", project("A", 1, 1, "missing"));

        assertThrows(UnknownDependencyException.class,
                () -> serviceWithMockedDriver().solve(request, new SolveOptions(tempDir.resolve("plan"), 5L, 1, 0)));
        verifyNoInteractions(scheduleSearchDriver);
    }

    @Test
    @DisplayName("Durations beyond the supported horizon are rejected before any search")
    void oversizedHorizonIsRejected() {
        ProjectRequest request = request(2);
        request.projects.put("A", project("A", 1, 1_500_000_000));
        request.projects.put("B", project("B", 1, 1_500_000_000));

        assertThrows(SchemaInvalidException.class,
                () -> serviceWithMockedDriver().solve(request, new SolveOptions(tempDir.resolve("plan"), 5L, 1, 0)));
        verifyNoInteractions(scheduleSearchDriver, scheduleSolutionFileIO, chartRenderer);
    }

    @Test
    @DisplayName("An invalid request is rejected before any search")
    void invalidRequestIsRejected() {
        ProjectRequest request = request(1);

        assertThrows(SchemaInvalidException.class,
                () -> serviceWithMockedDriver().solve(request, new SolveOptions(tempDir.resolve("plan"), 5L, 1, 0)));
        verifyNoInteractions(scheduleSearchDriver);
    }

    @Test
    @DisplayName("Ending the search without a solution writes nothing")
    void noFeasibleSolution() {
        ProjectRequest request = request(1);
        request.projects.put("A", project("A", 1, 1));
        when(scheduleSearchDriver.solve(any(), anyLong(), any())).thenReturn(TerminalStatus.UNKNOWN);

        NoFeasibleSolutionException e = assertThrows(NoFeasibleSolutionException.class,
                () -> serviceWithMockedDriver().solve(request, new SolveOptions(tempDir.resolve("plan"), 5L, 1, 0)));
        assertEquals(TerminalStatus.UNKNOWN, e.getStatus());
        verifyNoInteractions(scheduleSolutionFileIO, chartRenderer);
    }

    @Test
    @DisplayName("Demand above capacity ends as infeasible")
    void infeasible() {
        ProjectRequest request = request(1);
        request.projects.put("A", project("A", 2, 1));

        NoFeasibleSolutionException e = assertThrows(NoFeasibleSolutionException.class,
                () -> new GanttSolveService(scheduleSolutionFileIO, chartRenderer)
                        .solve(request, new SolveOptions(tempDir.resolve("plan"), 5L, 1, 0)));
        assertEquals(TerminalStatus.INFEASIBLE, e.getStatus());
        verifyNoInteractions(scheduleSolutionFileIO, chartRenderer);
    }

    @Test
    @DisplayName("Writes one schedule and one chart per retained solution, best first")
    void writesSolutions() {
        ProjectRequest request = request(1);
        request.projects.put("A", project("Alpha", 1, 3));
        request.projects.put("B", project("Beta", 1, 2, "A"));
        when(scheduleSearchDriver.solve(any(), anyLong(), any())).thenAnswer(invocation -> {
            SolutionCollector collector = invocation.getArgument(2);
            collector.add(new ScheduleSolution(6, List.of(
                    new ProjectSchedule("A", "Alpha", 1, 0, 3),
                    new ProjectSchedule("B", "Beta", 1, 4, 6))));
            collector.add(new ScheduleSolution(5, List.of(
                    new ProjectSchedule("A", "Alpha", 1, 0, 3),
                    new ProjectSchedule("B", "Beta", 1, 3, 5))));
            return TerminalStatus.OPTIMAL;
        });
        Path prefix = tempDir.resolve("nested").resolve("plan");

        SolveReport report = serviceWithMockedDriver().solve(request, new SolveOptions(prefix, 5L, 2, 0));

        assertEquals(TerminalStatus.OPTIMAL, report.getStatus());
        assertEquals(List.of(5, 6), report.getSolutionList().stream()
                .map(ScheduleSolution::getTotalDuration).toList());
        assertEquals(List.of(prefix.resolveSibling("plan-0.json"), prefix.resolveSibling("plan-0.png"),
                prefix.resolveSibling("plan-1.json"), prefix.resolveSibling("plan-1.png")),
                report.getWrittenFileList());
        verify(scheduleSolutionFileIO).write(any(ScheduleSolutionResponse.class),
                eq(prefix.resolveSibling("plan-0.json")));
        verify(scheduleSolutionFileIO).write(any(ScheduleSolutionResponse.class),
                eq(prefix.resolveSibling("plan-1.json")));
        verify(chartRenderer, times(2)).render(anyList(), any(Path.class));
        assertTrue(prefix.getParent().toFile().isDirectory());
    }

    @Test
    @DisplayName("End to end: the real search serializes two tasks on one resource")
    void endToEnd() {
        ProjectRequest request = request(1);
        request.projects.put("A", project("Alpha", 1, 3));
        request.projects.put("B", project("Beta", 1, 2));

        SolveReport report = new GanttSolveService(scheduleSolutionFileIO, chartRenderer)
                .solve(request, new SolveOptions(tempDir.resolve("plan"), 10L, 1, 0));

        assertEquals(TerminalStatus.OPTIMAL, report.getStatus());
        assertEquals(5, report.getSolutionList().get(0).getTotalDuration());
        verify(scheduleSolutionFileIO).write(any(ScheduleSolutionResponse.class), eq(tempDir.resolve("plan-0.json")));
        verify(chartRenderer).render(anyList(), eq(tempDir.resolve("plan-0.png")));
    }

    @Test
    @DisplayName("Maps the request to tasks in file order")
    void toTaskList() {
        ProjectRequest request = request(2);
        request.projects.put("B", project("Beta", 2, 4, "A"));
        request.projects.put("A", project("Alpha", 1, 3));

        List<Task> taskList = GanttSolveService.toTaskList(request);

        assertEquals(List.of("B", "A"), taskList.stream().map(Task::getId).toList());
        Task beta = taskList.get(0);
        assertEquals("Beta", beta.getName());
        assertEquals(4, beta.getDuration());
        assertEquals(2, beta.getResourceDemand());
        assertEquals("B", beta.getDependencyList().get(0).getTaskId());
        assertEquals("A", beta.getDependencyList().get(0).getTargetId());
        assertEquals(0, beta.getDependencyList().get(0).getLag());
    }

}
