package com.qmb.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.qmb.core.analysis.InputAnalyzer;
import com.qmb.core.error.ModelBuilderException;
import com.qmb.core.model.AnalysisResult;
import com.qmb.core.model.AnalysisWarning;
import com.qmb.core.model.RelationshipEdge;
import com.qmb.core.model.TableAnalysis;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: qmb analyze --spec &lt;file&gt; --samples &lt;file&gt;
 * <p>
 * Analyses the input without starting a session and prints classifications,
 * relationships, warnings and the recommended model type.
 */
@Command(name = "analyze", mixinStandardHelpOptions = true, description = "Classify tables and recommend a model type")
@Component
public class AnalyzeCommand implements Callable<Integer> {

    @Option(names = {"--spec", "-s"}, required = true, description = "JSON file with table declarations")
    private Path specFile;

    @Option(names = {"--samples"}, required = true, description = "JSON file with sampled statistics")
    private Path samplesFile;

    private final InputAnalyzer inputAnalyzer;
    private final ObjectMapper objectMapper;

    public AnalyzeCommand(InputAnalyzer inputAnalyzer, ObjectMapper objectMapper) {
        this.inputAnalyzer = inputAnalyzer;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        AnalysisResult result;
        try {
            result = inputAnalyzer.analyze(InputFiles.readSpec(objectMapper, specFile),
                    InputFiles.readSamples(objectMapper, samplesFile));
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read input: " + e.getMessage());
            return 1;
        } catch (ModelBuilderException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        System.out.println();
        System.out.println("TABLES");
        for (TableAnalysis table : result.tables()) {
            System.out.printf("  %-24s %-10s %3d%%  %s%n", table.name(), table.classification().wireName(),
                    Math.round(table.confidence() * 100), String.join("; ", table.reasoning()));
        }
        System.out.println();
        System.out.println("RELATIONSHIPS");
        if (result.relationships().isEmpty()) {
            System.out.println("  (none)");
        }
        for (RelationshipEdge edge : result.relationships()) {
            System.out.println("  " + edge.describe());
        }
        if (!result.warnings().isEmpty()) {
            System.out.println();
            System.out.println("WARNINGS");
            for (AnalysisWarning warning : result.warnings()) {
                ConsoleOutput.warning(warning);
            }
        }
        System.out.println();
        ConsoleOutput.success("Recommended model type: " + result.recommendation().modelType().wireName()
                + " (" + Math.round(result.recommendation().confidence() * 100) + "%)");
        ConsoleOutput.info(result.recommendation().rationale());
        return 0;
    }
}
