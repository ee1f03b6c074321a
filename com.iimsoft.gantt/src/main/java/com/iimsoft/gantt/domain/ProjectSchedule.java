package com.iimsoft.gantt.domain;

/**
 * Concrete placement of one task in one reported solution.
 */
public final class ProjectSchedule {

    private final String id;
    private final String name;
    private final int resourceDemand;
    private final int start;
    private final int end;

    public ProjectSchedule(String id, String name, int resourceDemand, int start, int end) {
        this.id = id;
        this.name = name;
        this.resourceDemand = resourceDemand;
        this.start = start;
        this.end = end;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getResourceDemand() {
        return resourceDemand;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int getDuration() {
        return end - start;
    }

    @Override
    public String toString() {
        return name + ": " + start + " -> " + end;
    }

}
