package com.testament.core.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.testament.core.model.TestSuiteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serialises a sealed suite result to {@code results.json}.
 */
@Component
public class ResultReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ResultReportWriter.class);

    public static final String FILE_NAME = "results.json";

    private final ObjectMapper objectMapper;

    public ResultReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param folder run folder the report goes into
     * @return the written file
     */
    public Path write(TestSuiteResult result, Path folder) throws IOException {
        Files.createDirectories(folder);
        Path target = folder.resolve(FILE_NAME);
        objectMapper.writeValue(target.toFile(), result);
        log.debug("Wrote result summary to {}", target);
        return target;
    }
}
