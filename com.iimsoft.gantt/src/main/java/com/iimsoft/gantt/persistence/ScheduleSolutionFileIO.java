package com.iimsoft.gantt.persistence;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.iimsoft.gantt.api.dto.ScheduleSolutionResponse;

/**
 * Write-only JSON serialization of a solved schedule.
 */
public class ScheduleSolutionFileIO {

    private final ObjectWriter writer = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public void write(ScheduleSolutionResponse response, Path outputFile) {
        try {
            writer.writeValue(outputFile.toFile(), response);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write schedule (" + outputFile + ").", e);
        }
    }

}
