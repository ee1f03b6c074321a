package com.iimsoft.gantt.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.iimsoft.gantt.domain.Dependency;
import com.iimsoft.gantt.domain.Task;
import com.iimsoft.gantt.exception.CycleDetectedException;
import com.iimsoft.gantt.exception.UnknownDependencyException;

/**
 * Checks that every dependency points to a known task and that the dependencies form no cycle,
 * then orders the tasks so that each one follows all of its dependency targets.
 * <p>
 * Tasks and dependencies are visited in input order, so the same input always fails on the same edge.
 */
public class DependencyGraphBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    public TaskGraph build(List<Task> taskList) {
        Map<String, Task> taskById = new LinkedHashMap<>();
        for (Task task : taskList) {
            if (taskById.putIfAbsent(task.getId(), task) != null) {
                throw new IllegalArgumentException("Duplicate task id (" + task.getId() + ").");
            }
        }
        for (Task task : taskList) {
            for (Dependency dependency : task.getDependencyList()) {
                if (!taskById.containsKey(dependency.getTargetId())) {
                    throw new UnknownDependencyException(task.getId(), dependency.getTargetId());
                }
            }
        }

        DirectedAcyclicGraph<String, DefaultEdge> dag = new DirectedAcyclicGraph<>(DefaultEdge.class);
        taskById.keySet().forEach(dag::addVertex);
        for (Task task : taskList) {
            for (Dependency dependency : task.getDependencyList()) {
                try {
                    dag.addEdge(dependency.getTargetId(), task.getId());
                } catch (IllegalArgumentException e) {
                    // Thrown for a self-loop as well as for an edge that closes a longer cycle
                    throw new CycleDetectedException(task.getId(), dependency.getTargetId(), e);
                }
            }
        }

        List<Task> orderedTaskList = new ArrayList<>(taskById.size());
        for (String taskId : dag) {
            orderedTaskList.add(taskById.get(taskId));
        }
        LOGGER.debug("Built dependency graph with {} tasks and {} edges.", dag.vertexSet().size(), dag.edgeSet().size());
        return new TaskGraph(taskById, dag, orderedTaskList);
    }

}
