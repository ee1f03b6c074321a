package com.iimsoft.gantt.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.iimsoft.gantt.api.dto.ScheduleSolutionResponse;
import com.iimsoft.gantt.chart.ChartBar;
import com.iimsoft.gantt.domain.ProjectSchedule;
import com.iimsoft.gantt.domain.ScheduleSolution;

/**
 * Converts a solution into its serializable record and the bars of its Gantt chart.
 */
public class ScheduleOutputBuilder {

    private static final Comparator<ChartBar> LATEST_START_FIRST = Comparator
            .comparingInt(ChartBar::getStart).reversed()
            .thenComparing(ChartBar::getLabel);

    private final int capacity;

    public ScheduleOutputBuilder(int capacity) {
        this.capacity = capacity;
    }

    public RenderedSchedule render(ScheduleSolution solution) {
        return new RenderedSchedule(buildResponse(solution), buildChartBars(solution));
    }

    ScheduleSolutionResponse buildResponse(ScheduleSolution solution) {
        ScheduleSolutionResponse response = new ScheduleSolutionResponse();
        response.totalDuration = solution.getTotalDuration();

        List<ScheduleSolutionResponse.ProjectScheduleResult> schedules = new ArrayList<>();
        for (ProjectSchedule projectSchedule : solution.getProjectScheduleList()) {
            ScheduleSolutionResponse.ProjectScheduleResult r = new ScheduleSolutionResponse.ProjectScheduleResult();
            r.id = projectSchedule.getId();
            r.name = projectSchedule.getName();
            r.numResources = projectSchedule.getResourceDemand();
            r.start = projectSchedule.getStart();
            r.end = projectSchedule.getEnd();
            schedules.add(r);
        }
        response.schedules = schedules;
        response.resourceUsages = buildResourceUsages(solution);
        return response;
    }

    /**
     * Step profile of the pool: one entry per distinct start or end, holding the usage from that time until the
     * next entry. The last entry is the total duration, where the usage drops to zero.
     */
    private List<ScheduleSolutionResponse.ResourceUsage> buildResourceUsages(ScheduleSolution solution) {
        TreeMap<Integer, Long> deltaByTime = new TreeMap<>();
        for (ProjectSchedule projectSchedule : solution.getProjectScheduleList()) {
            deltaByTime.merge(projectSchedule.getStart(), (long) projectSchedule.getResourceDemand(), Long::sum);
            deltaByTime.merge(projectSchedule.getEnd(), (long) -projectSchedule.getResourceDemand(), Long::sum);
        }
        List<ScheduleSolutionResponse.ResourceUsage> out = new ArrayList<>(deltaByTime.size());
        long used = 0L;
        for (Map.Entry<Integer, Long> entry : deltaByTime.entrySet()) {
            used += entry.getValue();
            ScheduleSolutionResponse.ResourceUsage ru = new ScheduleSolutionResponse.ResourceUsage();
            ru.time = entry.getKey();
            ru.used = used;
            ru.capacity = capacity;
            out.add(ru);
        }
        return out;
    }

    List<ChartBar> buildChartBars(ScheduleSolution solution) {
        List<ChartBar> barList = new ArrayList<>();
        for (ProjectSchedule projectSchedule : solution.getProjectScheduleList()) {
            barList.add(new ChartBar(projectSchedule.getName(), projectSchedule.getResourceDemand(),
                    projectSchedule.getStart(), projectSchedule.getDuration()));
        }
        barList.sort(LATEST_START_FIRST);
        return barList;
    }

}
