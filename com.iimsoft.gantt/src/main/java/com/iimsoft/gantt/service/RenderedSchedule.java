package com.iimsoft.gantt.service;

import java.util.List;

import com.iimsoft.gantt.api.dto.ScheduleSolutionResponse;
import com.iimsoft.gantt.chart.ChartBar;

public final class RenderedSchedule {

    private final ScheduleSolutionResponse response;
    private final List<ChartBar> chartBarList;

    public RenderedSchedule(ScheduleSolutionResponse response, List<ChartBar> chartBarList) {
        this.response = response;
        this.chartBarList = List.copyOf(chartBarList);
    }

    public ScheduleSolutionResponse getResponse() {
        return response;
    }

    /**
     * Sorted by descending start.
     */
    public List<ChartBar> getChartBarList() {
        return chartBarList;
    }

}
