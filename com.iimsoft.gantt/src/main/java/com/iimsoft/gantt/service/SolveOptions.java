package com.iimsoft.gantt.service;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings of one solve run.
 */
public final class SolveOptions {

    public static final long DEFAULT_TIME_LIMIT_SECONDS = 30L;
    public static final int DEFAULT_MAX_SOLUTIONS = 1;
    public static final String DEFAULT_OUTPUT_PREFIX = "schedule-gantt-projects";

    private final Path outputPrefix;
    private final long timeLimitSeconds;
    private final int maxSolutions;
    private final int maxDuration;

    /**
     * @param timeLimitSeconds falls back to {@link #DEFAULT_TIME_LIMIT_SECONDS} when not positive
     * @param maxDuration makespan cap, {@code 0} for none
     */
    public SolveOptions(Path outputPrefix, long timeLimitSeconds, int maxSolutions, int maxDuration) {
        this.outputPrefix = Objects.requireNonNull(outputPrefix, "outputPrefix");
        if (maxSolutions <= 0) {
            throw new IllegalArgumentException("The maxSolutions (" + maxSolutions + ") must be positive.");
        }
        if (maxDuration < 0) {
            throw new IllegalArgumentException("The maxDuration (" + maxDuration + ") must not be negative.");
        }
        this.timeLimitSeconds = timeLimitSeconds > 0L ? timeLimitSeconds : DEFAULT_TIME_LIMIT_SECONDS;
        this.maxSolutions = maxSolutions;
        this.maxDuration = maxDuration;
    }

    public Path getOutputPrefix() {
        return outputPrefix;
    }

    public long getTimeLimitSeconds() {
        return timeLimitSeconds;
    }

    public int getMaxSolutions() {
        return maxSolutions;
    }

    public int getMaxDuration() {
        return maxDuration;
    }

    public Path resolveScheduleFile(int solutionIndex) {
        return resolve(solutionIndex, ".json");
    }

    public Path resolveChartFile(int solutionIndex) {
        return resolve(solutionIndex, ".png");
    }

    private Path resolve(int solutionIndex, String extension) {
        String fileName = outputPrefix.getFileName() + "-" + solutionIndex + extension;
        return outputPrefix.resolveSibling(fileName);
    }

}
