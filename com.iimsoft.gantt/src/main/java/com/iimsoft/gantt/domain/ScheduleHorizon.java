package com.iimsoft.gantt.domain;

public class ScheduleHorizon {

    /**
     * Largest supported horizon. Start and end dates of any move stay below {@code 3 * MAX_HORIZON},
     * which keeps all date arithmetic within {@code int}.
     */
    public static final int MAX_HORIZON = Integer.MAX_VALUE / 4;

    private final int horizon;
    private final int maxDuration;

    /**
     * @param horizon upper bound of every start and end
     * @param maxDuration makespan cap, {@code 0} for none
     */
    public ScheduleHorizon(int horizon, int maxDuration) {
        this.horizon = horizon;
        this.maxDuration = maxDuration;
    }

    public int getHorizon() {
        return horizon;
    }

    public int getMaxDuration() {
        return maxDuration;
    }

    public boolean hasMaxDuration() {
        return maxDuration > 0;
    }

}
