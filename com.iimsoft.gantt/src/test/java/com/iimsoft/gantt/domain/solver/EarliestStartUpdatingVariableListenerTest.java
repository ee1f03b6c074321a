package com.iimsoft.gantt.domain.solver;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.optaplanner.core.api.score.director.ScoreDirector;

import com.iimsoft.gantt.domain.Allocation;
import com.iimsoft.gantt.domain.Dependency;
import com.iimsoft.gantt.domain.Schedule;
import com.iimsoft.gantt.domain.Task;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class EarliestStartUpdatingVariableListenerTest {

    private ScoreDirector<Schedule> scoreDirector;
    private EarliestStartUpdatingVariableListener listener;

    private Allocation a;
    private Allocation b;
    private Allocation c;
    private Allocation d;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        scoreDirector = mock(ScoreDirector.class);
        listener = new EarliestStartUpdatingVariableListener();

        // A -> B (lag 1) -> C, and D independent
        a = allocation(0L, new Task("A", "A", 3, 1, List.of()));
        b = allocation(1L, new Task("B", "B", 2, 1, List.of(new Dependency("B", "A", 1))));
        c = allocation(2L, new Task("C", "C", 1, 1, List.of(new Dependency("C", "B", 0))));
        d = allocation(3L, new Task("D", "D", 4, 1, List.of()));
        link(b, a);
        link(c, b);
        for (Allocation allocation : List.of(a, b, c, d)) {
            allocation.setEarliestStart(allocation.computeEarliestStart());
        }
    }

    private static Allocation allocation(long id, Task task) {
        Allocation allocation = new Allocation(id, task);
        allocation.setPredecessorAllocationList(new ArrayList<>());
        allocation.setSuccessorAllocationList(new ArrayList<>());
        allocation.setDelay(0);
        return allocation;
    }

    private static void link(Allocation allocation, Allocation target) {
        allocation.getPredecessorAllocationList().add(target);
        target.getSuccessorAllocationList().add(allocation);
    }

    @Test
    @DisplayName("Delaying a task pushes every transitive successor")
    void propagatesThroughChain() {
        assertEquals(4, b.getEarliestStart());
        assertEquals(6, c.getEarliestStart());

        a.setDelay(2);
        listener.afterVariableChanged(scoreDirector, a);

        assertEquals(6, b.getEarliestStart());
        assertEquals(8, c.getEarliestStart());
        assertEquals(0, d.getEarliestStart());
        verify(scoreDirector).beforeVariableChanged(b, "earliestStart");
        verify(scoreDirector).afterVariableChanged(b, "earliestStart");
        verify(scoreDirector).beforeVariableChanged(c, "earliestStart");
        verify(scoreDirector).afterVariableChanged(c, "earliestStart");
        verifyNoMoreInteractions(scoreDirector);
    }

    @Test
    @DisplayName("Propagation stops where the earliest start is unchanged")
    void stopsWhenUnchanged() {
        listener.afterVariableChanged(scoreDirector, a);
        verifyNoInteractions(scoreDirector);
    }

    @Test
    @DisplayName("Delaying a middle task moves only what follows it")
    void successorDelayPropagates() {
        b.setDelay(3);
        listener.afterVariableChanged(scoreDirector, b);

        assertEquals(4, b.getEarliestStart());
        assertEquals(9, c.getEarliestStart());
        assertEquals(0, a.getEarliestStart());
    }

}
