package com.iimsoft.gantt.api.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ScheduleSolutionResponse {

    @JsonProperty("total_duration")
    public int totalDuration;

    @JsonProperty("schedules")
    public List<ProjectScheduleResult> schedules;

    /** Resource load as a step profile: each entry holds from its time until the next entry's time */
    @JsonProperty("resource_usages")
    public List<ResourceUsage> resourceUsages;

    public static class ProjectScheduleResult {
        @JsonProperty("id")
        public String id;

        @JsonProperty("name")
        public String name;

        @JsonProperty("num_resources")
        public int numResources;

        @JsonProperty("start")
        public int start;

        @JsonProperty("end")
        public int end;
    }

    public static class ResourceUsage {
        @JsonProperty("time")
        public int time;

        @JsonProperty("used")
        public long used;

        @JsonProperty("capacity")
        public int capacity;
    }

}
