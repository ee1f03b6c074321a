package com.iimsoft.gantt.persistence;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.gantt.api.dto.ProjectRequest;
import com.iimsoft.gantt.exception.SchemaInvalidException;

/**
 * Reads the project input file. Unknown fields, duplicate keys and fractional numbers are rejected here;
 * required fields and value ranges are checked by {@link ProjectRequestValidator}.
 */
public class ProjectRequestFileIO {

    private final ObjectMapper objectMapper;

    public ProjectRequestFileIO() {
        objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    }

    public ProjectRequest read(Path inputFile) {
        if (!Files.isRegularFile(inputFile)) {
            throw new SchemaInvalidException("The input file (" + inputFile.toAbsolutePath() + ") does not exist.");
        }
        try (InputStream in = Files.newInputStream(inputFile)) {
            return read(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read input file (" + inputFile + ").", e);
        }
    }

    public ProjectRequest read(InputStream in) throws IOException {
        ProjectRequest request;
        try {
            request = objectMapper.readValue(in, ProjectRequest.class);
        } catch (JsonProcessingException e) {
            throw new SchemaInvalidException("The input is not a valid project file: " + e.getOriginalMessage(), e);
        }
        if (request == null) {
            throw new SchemaInvalidException("The input is empty.");
        }
        ProjectRequestValidator.validate(request);
        return request;
    }

}
