package com.iimsoft.gantt.domain;

import java.util.List;
import java.util.Objects;

public class Task {

    private final String id;
    private final String name;
    private final int duration;
    private final int resourceDemand;
    private final List<Dependency> dependencyList;

    public Task(String id, String name, int duration, int resourceDemand, List<Dependency> dependencyList) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.duration = duration;
        this.resourceDemand = resourceDemand;
        this.dependencyList = List.copyOf(dependencyList);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getDuration() {
        return duration;
    }

    public int getResourceDemand() {
        return resourceDemand;
    }

    public List<Dependency> getDependencyList() {
        return dependencyList;
    }

    @Override
    public String toString() {
        return id;
    }

}
