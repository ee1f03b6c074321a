package com.iimsoft.gantt.persistence;

import java.util.Map;

import com.iimsoft.gantt.api.dto.ProjectRequest;
import com.iimsoft.gantt.exception.SchemaInvalidException;

public final class ProjectRequestValidator {

    private ProjectRequestValidator() {
    }

    public static void validate(ProjectRequest request) {
        if (request.maxResourcesInParallel == null) {
            throw new SchemaInvalidException("max_resources_in_parallel is required.");
        }
        if (request.maxResourcesInParallel <= 0) {
            throw new SchemaInvalidException("max_resources_in_parallel (" + request.maxResourcesInParallel
                    + ") must be positive.");
        }
        if (request.projects == null || request.projects.isEmpty()) {
            throw new SchemaInvalidException("projects must contain at least one project.");
        }
        for (Map.Entry<String, ProjectRequest.ProjectDto> entry : request.projects.entrySet()) {
            validateProject(entry.getKey(), entry.getValue());
        }
    }

    private static void validateProject(String projectId, ProjectRequest.ProjectDto project) {
        String path = "projects." + projectId;
        if (project == null) {
            throw new SchemaInvalidException(path + " must be an object.");
        }
        if (project.name == null) {
            throw new SchemaInvalidException(path + ".name is required.");
        }
        if (project.numResources == null) {
            throw new SchemaInvalidException(path + ".num_resources is required.");
        }
        if (project.numResources < 0) {
            throw new SchemaInvalidException(path + ".num_resources (" + project.numResources
                    + ") must not be negative.");
        }
        if (project.duration == null) {
            throw new SchemaInvalidException(path + ".duration is required.");
        }
        if (project.duration <= 0) {
            throw new SchemaInvalidException(path + ".duration (" + project.duration + ") must be positive.");
        }
        if (project.dependencies == null) {
            throw new SchemaInvalidException(path + ".dependencies is required.");
        }
        for (int i = 0; i < project.dependencies.size(); i++) {
            ProjectRequest.DependencyDto dependency = project.dependencies.get(i);
            String dependencyPath = path + ".dependencies[" + i + "]";
            if (dependency == null) {
                throw new SchemaInvalidException(dependencyPath + " must be an object.");
            }
            if (dependency.projectId == null) {
                throw new SchemaInvalidException(dependencyPath + ".project_id is required.");
            }
            if (dependency.lagTime == null) {
                throw new SchemaInvalidException(dependencyPath + ".lag_time is required.");
            }
        }
    }

}
