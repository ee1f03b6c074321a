package com.iimsoft.gantt.api.dto;

import java.util.LinkedHashMap;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Input file shape. Field names follow the snake_case of the file.
 */
public class ProjectRequest {

    @JsonProperty("max_resources_in_parallel")
    public Integer maxResourcesInParallel;

    /** Task id to task definition, in file order */
    @JsonProperty("projects")
    public LinkedHashMap<String, ProjectDto> projects;

    public static class ProjectDto {
        @JsonProperty("name")
        public String name;

        @JsonProperty("num_resources")
        public Integer numResources;

        @JsonProperty("duration")
        @JsonAlias("time_in_weeks")
        public Integer duration;

        @JsonProperty("dependencies")
        public List<DependencyDto> dependencies;
    }

    public static class DependencyDto {
        @JsonProperty("project_id")
        public String projectId;

        /** Negative for a lead time */
        @JsonProperty("lag_time")
        public Integer lagTime;
    }

}
