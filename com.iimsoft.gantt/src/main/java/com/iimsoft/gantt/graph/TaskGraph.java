package com.iimsoft.gantt.graph;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;

import com.iimsoft.gantt.domain.Task;

/**
 * Validated, acyclic set of tasks. Edges run from a dependency target to the task depending on it.
 */
public final class TaskGraph {

    private final Map<String, Task> taskById;
    private final DirectedAcyclicGraph<String, DefaultEdge> dag;
    private final List<Task> orderedTaskList;

    TaskGraph(Map<String, Task> taskById, DirectedAcyclicGraph<String, DefaultEdge> dag, List<Task> orderedTaskList) {
        this.taskById = Collections.unmodifiableMap(taskById);
        this.dag = dag;
        this.orderedTaskList = List.copyOf(orderedTaskList);
    }

    public Task getTask(String taskId) {
        Task task = taskById.get(taskId);
        if (task == null) {
            throw new IllegalArgumentException("Unknown task (" + taskId + ").");
        }
        return task;
    }

    /**
     * Every task comes after all of its dependency targets.
     */
    public List<Task> getOrderedTaskList() {
        return orderedTaskList;
    }

    public Set<String> getDependencyTargetIds(String taskId) {
        return dag.incomingEdgesOf(taskId).stream()
                .map(dag::getEdgeSource)
                .collect(Collectors.toUnmodifiableSet());
    }

    public int size() {
        return taskById.size();
    }

    @Override
    public String toString() {
        return "TaskGraph[vertices=" + dag.vertexSet().size() +
                ", edges=" + dag.edgeSet().size() + "]";
    }

}
