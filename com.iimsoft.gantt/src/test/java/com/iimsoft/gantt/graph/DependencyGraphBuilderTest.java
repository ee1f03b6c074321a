package com.iimsoft.gantt.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.iimsoft.gantt.domain.Dependency;
import com.iimsoft.gantt.domain.Task;
import com.iimsoft.gantt.exception.CycleDetectedException;
import com.iimsoft.gantt.exception.UnknownDependencyException;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphBuilderTest {

    private DependencyGraphBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new DependencyGraphBuilder();
    }

    private Task task(String id, String... dependencyTargetIds) {
        List<Dependency> dependencyList = new ArrayList<>();
        for (String targetId : dependencyTargetIds) {
            dependencyList.add(new Dependency(id, targetId, 0));
        }
        return new Task(id, "Task " + id, 1, 1, dependencyList);
    }

    private static void assertAfterAllTargets(TaskGraph graph) {
        List<Task> ordered = graph.getOrderedTaskList();
        for (int i = 0; i < ordered.size(); i++) {
            for (Dependency dependency : ordered.get(i).getDependencyList()) {
                int targetIndex = ordered.indexOf(graph.getTask(dependency.getTargetId()));
                assertTrue(targetIndex < i, ordered.get(i).getId() + " must follow " + dependency.getTargetId());
            }
        }
    }

    @Test
    @DisplayName("Independent tasks are all kept")
    void independentTasks() {
        TaskGraph graph = builder.build(List.of(task("A"), task("B"), task("C")));
        assertEquals(3, graph.size());
        assertEquals(3, graph.getOrderedTaskList().size());
    }

    @Test
    @DisplayName("Chain listed backwards is ordered targets first")
    void chainListedBackwards() {
        TaskGraph graph = builder.build(List.of(task("C", "B"), task("B", "A"), task("A")));
        assertEquals(List.of("A", "B", "C"),
                graph.getOrderedTaskList().stream().map(Task::getId).toList());
    }

    @Test
    @DisplayName("Diamond D->{B,C}->A: every task follows all its targets")
    void diamond() {
        TaskGraph graph = builder.build(List.of(task("D", "B", "C"), task("B", "A"), task("C", "A"), task("A")));
        assertAfterAllTargets(graph);
        assertEquals("A", graph.getOrderedTaskList().get(0).getId());
        assertEquals("D", graph.getOrderedTaskList().get(3).getId());
        assertEquals(Set.of("B", "C"), graph.getDependencyTargetIds("D"));
    }

    @Test
    @DisplayName("Dependency on a missing task fails with UnknownDependency")
    void unknownDependency() {
        UnknownDependencyException e = assertThrows(UnknownDependencyException.class,
                () -> builder.build(List.of(task("A", "ghost"))));
        assertEquals("A", e.getTaskId());
        assertEquals("ghost", e.getTargetId());
    }

    @Test
    @DisplayName("Two-cycle X<->Y fails with CycleDetected")
    void twoCycle() {
        CycleDetectedException e = assertThrows(CycleDetectedException.class,
                () -> builder.build(List.of(task("X", "Y"), task("Y", "X"))));
        assertEquals("Y", e.getTaskId());
        assertEquals("X", e.getTargetId());
    }

    @Test
    @DisplayName("Self dependency fails with CycleDetected")
    void selfLoop() {
        assertThrows(CycleDetectedException.class, () -> builder.build(List.of(task("A", "A"))));
    }

    @Test
    @DisplayName("Longer cycle behind an acyclic prefix is detected on the same edge every time")
    void longerCycleIsDeterministic() {
        List<Task> tasks = List.of(task("S"), task("A", "S", "C"), task("B", "A"), task("C", "B"));
        CycleDetectedException first = assertThrows(CycleDetectedException.class, () -> builder.build(tasks));
        CycleDetectedException second = assertThrows(CycleDetectedException.class, () -> builder.build(tasks));
        assertEquals(first.getMessage(), second.getMessage());
    }

    @Test
    @DisplayName("Duplicate dependency on the same target is accepted")
    void duplicateDependency() {
        TaskGraph graph = builder.build(List.of(task("A"), task("B", "A", "A")));
        assertAfterAllTargets(graph);
    }

    @Test
    @DisplayName("Duplicate task ids are rejected")
    void duplicateTaskId() {
        assertThrows(IllegalArgumentException.class, () -> builder.build(List.of(task("A"), task("A"))));
    }
}
