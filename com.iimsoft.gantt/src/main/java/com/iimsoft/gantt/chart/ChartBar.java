package com.iimsoft.gantt.chart;

/**
 * One horizontal bar of a timeline: a label, the magnitude printed inside the bar, and its extent.
 */
public final class ChartBar {

    private final String label;
    private final int magnitude;
    private final int start;
    private final int duration;

    public ChartBar(String label, int magnitude, int start, int duration) {
        this.label = label;
        this.magnitude = magnitude;
        this.start = start;
        this.duration = duration;
    }

    public String getLabel() {
        return label;
    }

    public int getMagnitude() {
        return magnitude;
    }

    public int getStart() {
        return start;
    }

    public int getDuration() {
        return duration;
    }

    public int getEnd() {
        return start + duration;
    }

    @Override
    public String toString() {
        return "bar = (" + label + ", " + magnitude + ", (" + start + ", " + duration + "))";
    }

}
