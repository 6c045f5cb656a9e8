package com.qmb.core.metrics;

import com.qmb.core.error.ErrorKind;
import com.qmb.core.model.StageId;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for model builder sessions.
 */
@Service
public class ModelBuilderMetrics {

    private final MeterRegistry registry;

    public ModelBuilderMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementSessionsStarted() {
        Counter.builder("qmb.sessions.started")
                .register(registry)
                .increment();
    }

    public void recordAnalysisDuration(long ms) {
        Timer.builder("qmb.analysis.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStageBuild(StageId stage) {
        stageCounter("qmb.stage.builds", stage);
    }

    public void recordStageApproval(StageId stage) {
        stageCounter("qmb.stage.approvals", stage);
    }

    public void recordStageRevert(StageId stage) {
        stageCounter("qmb.stage.reverts", stage);
    }

    public void incrementExports() {
        Counter.builder("qmb.exports.total")
                .register(registry)
                .increment();
    }

    public void recordScopeDecision(boolean allowed) {
        Counter.builder("qmb.scope.decisions")
                .tag("result", allowed ? "allowed" : "blocked")
                .register(registry)
                .increment();
    }

    public void recordToolError(ErrorKind kind) {
        Counter.builder("qmb.tool.errors")
                .tag("kind", kind.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    private void stageCounter(String name, StageId stage) {
        Counter.builder(name)
                .tag("stage", stage.name())
                .register(registry)
                .increment();
    }
}
