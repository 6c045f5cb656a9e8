package com.qmb.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.qmb.core.analysis.InputAnalyzer;
import com.qmb.core.error.ModelBuilderException;
import com.qmb.core.model.AnalysisResult;
import com.qmb.core.model.StageId;
import com.qmb.core.pipeline.ModelTypeSelector;
import com.qmb.core.pipeline.StagePipeline;
import com.qmb.core.session.SessionStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: qmb build --spec &lt;file&gt; --samples &lt;file&gt;
 * <p>
 * Runs a whole session without review: processes the input, selects the recommended (or
 * given) model type, builds and approves stages A to F, then writes the assembled script.
 */
@Command(name = "build", mixinStandardHelpOptions = true, description = "Build the complete load script headlessly")
@Component
public class BuildCommand implements Callable<Integer> {

    @Option(names = {"--spec", "-s"}, required = true, description = "JSON file with table declarations")
    private Path specFile;

    @Option(names = {"--samples"}, required = true, description = "JSON file with sampled statistics")
    private Path samplesFile;

    @Option(names = {"--project", "-p"}, description = "Project name (default: ${DEFAULT-VALUE})",
            defaultValue = "qlik-model")
    private String project;

    @Option(names = {"--model-type", "-m"}, description = "star_schema, snowflake, link_table or normalized; defaults to the recommendation")
    private String modelType;

    @Option(names = {"--qvd-path"}, description = "Source QVD folder")
    private String qvdPath;

    @Option(names = {"--calendar-language"}, description = "EN or HE")
    private String calendarLanguage;

    @Option(names = {"--out", "-o"}, description = "Write the script to this file instead of stdout")
    private Path out;

    private final SessionStore sessionStore;
    private final InputAnalyzer inputAnalyzer;
    private final ModelTypeSelector modelTypeSelector;
    private final StagePipeline stagePipeline;
    private final ObjectMapper objectMapper;

    public BuildCommand(SessionStore sessionStore, InputAnalyzer inputAnalyzer, ModelTypeSelector modelTypeSelector,
                        StagePipeline stagePipeline, ObjectMapper objectMapper) {
        this.sessionStore = sessionStore;
        this.inputAnalyzer = inputAnalyzer;
        this.modelTypeSelector = modelTypeSelector;
        this.stagePipeline = stagePipeline;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            sessionStore.start(project);
            AnalysisResult analysis = inputAnalyzer.processInput(InputFiles.readSpec(objectMapper, specFile),
                    InputFiles.readSamples(objectMapper, samplesFile));
            ConsoleOutput.info("Analysed " + analysis.tables().size() + " table(s), "
                    + analysis.relationships().size() + " relationship(s)");

            String type = modelType != null ? modelType : analysis.recommendation().modelType().wireName();
            modelTypeSelector.selectModelType(type);
            ConsoleOutput.info("Model type: " + type);

            Map<String, Object> options = new LinkedHashMap<>();
            if (qvdPath != null) {
                options.put("qvd_path", qvdPath);
            }
            if (calendarLanguage != null) {
                options.put("calendar_language", calendarLanguage);
            }
            if (!options.isEmpty()) {
                modelTypeSelector.updateConfig(options);
            }

            for (StageId stage : StageId.values()) {
                var built = stagePipeline.build(null);
                stagePipeline.approve();
                ConsoleOutput.stage(stage.name(), stage.title() + " approved ("
                        + built.artifact().tables().size() + " table(s))");
            }

            String script = stagePipeline.getScript();
            if (out != null) {
                Files.writeString(out, script);
                ConsoleOutput.success("Script written to " + out);
            } else {
                System.out.println();
                System.out.println(script);
            }
            return 0;
        } catch (IOException e) {
            ConsoleOutput.error("I/O failure: " + e.getMessage());
            return 1;
        } catch (ModelBuilderException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
