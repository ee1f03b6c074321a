package com.iimsoft.gantt.chart;

import java.util.List;

/**
 * Maps chart time units and bar rows to pixel coordinates of the plot area.
 */
final class ChartScale {

    private static final int[] TICK_STEPS = {1, 2, 5, 10, 20, 50, 100, 200, 500, 1000};
    private static final int MAX_TICKS = 20;

    private final int left;
    private final int right;
    private final int top;
    private final int bottom;
    private final int maxTime;
    private final int rowCount;

    ChartScale(List<ChartBar> barList, int left, int right, int top, int bottom) {
        this.left = left;
        this.right = right;
        this.top = top;
        this.bottom = bottom;
        this.maxTime = Math.max(1, barList.stream().mapToInt(ChartBar::getEnd).max().orElse(1));
        this.rowCount = Math.max(1, barList.size());
    }

    int getMaxTime() {
        return maxTime;
    }

    int toX(int time) {
        return left + (int) Math.round((double) time * (right - left) / maxTime);
    }

    int getRowHeight() {
        return (bottom - top) / rowCount;
    }

    int toRowCenterY(int row) {
        return top + row * getRowHeight() + getRowHeight() / 2;
    }

    int getBarHeight() {
        return Math.max(2, getRowHeight() * 2 / 5);
    }

    int getTickStep() {
        for (int step : TICK_STEPS) {
            if (maxTime / step <= MAX_TICKS) {
                return step;
            }
        }
        return (maxTime / MAX_TICKS) + 1;
    }

}
