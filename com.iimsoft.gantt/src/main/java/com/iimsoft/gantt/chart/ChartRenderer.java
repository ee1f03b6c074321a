package com.iimsoft.gantt.chart;

import java.nio.file.Path;
import java.util.List;

public interface ChartRenderer {

    /**
     * Draws the bars top to bottom in list order and writes the image to {@code outputFile}.
     */
    void render(List<ChartBar> barList, Path outputFile);

}
