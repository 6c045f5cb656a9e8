package com.qmb.dispatch.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qmb.core.model.SampledStats;
import com.qmb.core.model.SourceSpec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the JSON input files given on the command line.
 */
final class InputFiles {

    private InputFiles() {}

    static SourceSpec readSpec(ObjectMapper objectMapper, Path path) throws IOException {
        return objectMapper.readValue(Files.readString(path), SourceSpec.class);
    }

    static List<SampledStats> readSamples(ObjectMapper objectMapper, Path path) throws IOException {
        return objectMapper.readValue(Files.readString(path), new TypeReference<List<SampledStats>>() {});
    }
}
