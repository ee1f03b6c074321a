package com.iimsoft.gantt.persistence;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.gantt.api.dto.ScheduleSolutionResponse;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleSolutionFileIOTest {

    private static ScheduleSolutionResponse response() {
        ScheduleSolutionResponse.ProjectScheduleResult result = new ScheduleSolutionResponse.ProjectScheduleResult();
        result.id = "a";
        result.name = "Alpha";
        result.numResources = 2;
        result.start = 1;
        result.end = 4;
        ScheduleSolutionResponse.ResourceUsage usage = new ScheduleSolutionResponse.ResourceUsage();
        usage.time = 1;
        usage.used = 2;
        usage.capacity = 3;
        ScheduleSolutionResponse response = new ScheduleSolutionResponse();
        response.totalDuration = 4;
        response.schedules = List.of(result);
        response.resourceUsages = List.of(usage);
        return response;
    }

    @Test
    @DisplayName("Writes snake_case fields")
    void write(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("plan-0.json");
        new ScheduleSolutionFileIO().write(response(), file);

        JsonNode root = new ObjectMapper().readTree(Files.readString(file));
        assertEquals(4, root.get("total_duration").asInt());
        JsonNode schedule = root.get("schedules").get(0);
        assertEquals("a", schedule.get("id").asText());
        assertEquals("Alpha", schedule.get("name").asText());
        assertEquals(2, schedule.get("num_resources").asInt());
        assertEquals(1, schedule.get("start").asInt());
        assertEquals(4, schedule.get("end").asInt());
        assertEquals(3, root.get("resource_usages").get(0).get("capacity").asInt());
    }

    @Test
    @DisplayName("Writing into a missing directory fails")
    void writeFailure(@TempDir Path tempDir) {
        assertThrows(UncheckedIOException.class,
                () -> new ScheduleSolutionFileIO().write(response(), tempDir.resolve("absent").resolve("plan.json")));
    }

}
