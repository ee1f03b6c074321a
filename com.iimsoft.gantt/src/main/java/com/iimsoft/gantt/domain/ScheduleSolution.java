package com.iimsoft.gantt.domain;

import java.util.List;
import java.util.Optional;

public final class ScheduleSolution {

    private final int totalDuration;
    private final List<ProjectSchedule> projectScheduleList;

    public ScheduleSolution(int totalDuration, List<ProjectSchedule> projectScheduleList) {
        this.totalDuration = totalDuration;
        this.projectScheduleList = List.copyOf(projectScheduleList);
    }

    /**
     * Makespan: the latest end over all tasks.
     */
    public int getTotalDuration() {
        return totalDuration;
    }

    public List<ProjectSchedule> getProjectScheduleList() {
        return projectScheduleList;
    }

    public Optional<ProjectSchedule> findProjectSchedule(String taskId) {
        return projectScheduleList.stream()
                .filter(projectSchedule -> projectSchedule.getId().equals(taskId))
                .findFirst();
    }

    @Override
    public String toString() {
        return "ScheduleSolution[totalDuration=" + totalDuration + ", tasks=" + projectScheduleList.size() + "]";
    }

}
